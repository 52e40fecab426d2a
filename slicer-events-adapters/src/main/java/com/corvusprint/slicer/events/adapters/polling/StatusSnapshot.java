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
package com.corvusprint.slicer.events.adapters.polling;

import com.corvusprint.slicer.events.CompletionInfo;
import com.corvusprint.slicer.events.SlicingStatus;

import static java.util.Objects.requireNonNull;

/**
 * Consistent view of the state cached by a {@link PollingEventSink}.
 *
 * @param status       the latest status received
 * @param hasCompleted whether the current run has completed
 * @param completion   the completion of the run, {@code null} unless {@code hasCompleted}
 */
public record StatusSnapshot(SlicingStatus status, boolean hasCompleted, CompletionInfo completion) {

  public StatusSnapshot {
    requireNonNull(status, "status must not be null");
    if (hasCompleted != (completion != null)) {
      throw new IllegalArgumentException("completion must be present exactly when the run has completed");
    }
  }
}
