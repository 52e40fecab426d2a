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

/**
 * Progress report emitted repeatedly by the slicing process.
 * <p>
 * There is no ordering key beyond arrival order: consumers treat the latest status they received as
 * authoritative. The producer is single-threaded with respect to itself, so arrival order is
 * emission order for any one dispatcher.
 *
 * @param percent     completion percentage, between 0 and 100 inclusive
 * @param message     human readable description of the current step; never {@code null}
 * @param flags       bitset of the {@code RELOAD_*} / {@code UPDATE_*} constants below
 * @param warningStep index of the step whose warnings changed, meaningful with the warning flags only
 * @param extra       producer-specific marker forwarded untouched to consumers
 */
public record SlicingStatus(int percent, String message, int flags, int warningStep, boolean extra) {

  public static final int DEFAULT = 0;
  public static final int RELOAD_SCENE = 1 << 1;
  public static final int RELOAD_SLA_SUPPORT_POINTS = 1 << 2;
  public static final int RELOAD_SLA_PREVIEW = 1 << 3;
  public static final int UPDATE_PRINT_STEP_WARNINGS = 1 << 4;
  public static final int UPDATE_PRINT_OBJECT_STEP_WARNINGS = 1 << 5;

  public SlicingStatus {
    if (percent < 0 || percent > 100) {
      throw new IllegalArgumentException("percent must be between 0 and 100, got: " + percent);
    }
    message = message == null ? "" : message;
  }

  /**
   * Creates a plain progress status with no flags.
   *
   * @param percent completion percentage, between 0 and 100 inclusive
   * @param message description of the current step
   * @return the status
   * @throws IllegalArgumentException if {@code percent} is out of range
   */
  public static SlicingStatus of(int percent, String message) {
    return new SlicingStatus(percent, message, DEFAULT, 0, false);
  }

  /**
   * Tells whether every bit of {@code flag} is set on this status.
   *
   * @param flag one of the flag constants, or a combination of them
   * @return {@code true} if all bits are set
   */
  public boolean hasFlag(int flag) {
    return (flags & flag) == flag;
  }
}
