/*
 * Copyright © 2025 CorvusPrint
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.corvusprint.slicer.events;

import static java.util.Objects.requireNonNull;

/**
 * Export phase notification.
 *
 * @param phase the export phase
 * @param path  location of the exported file; {@code null} while the export has only begun
 */
public record ExportInfo(Phase phase, String path) {

  public enum Phase {
    BEGAN,
    FINISHED
  }

  public ExportInfo {
    requireNonNull(phase, "phase must not be null");
    if (phase == Phase.BEGAN && path != null) {
      throw new IllegalArgumentException("path must be undefined when the export has only begun");
    }
    if (phase == Phase.FINISHED) {
      requireNonNull(path, "path must not be null when the export is finished");
    }
  }

  public static ExportInfo began() {
    return new ExportInfo(Phase.BEGAN, null);
  }

  public static ExportInfo finished(String path) {
    return new ExportInfo(Phase.FINISHED, path);
  }
}
