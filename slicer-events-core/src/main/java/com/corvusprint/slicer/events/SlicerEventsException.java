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
 * Base exception for slicer events operations.
 * <p>
 * This unchecked exception reports failures of the components built around the dispatchers:
 * loading a static resource, invalid configuration, or a transport that cannot be set up.
 * Dispatchers themselves never wrap the exceptions thrown by sinks or listeners.
 */
public class SlicerEventsException extends RuntimeException {

  /**
   * Creates a new exception with the specified error message.
   *
   * @param message the detail message explaining the error
   */
  public SlicerEventsException(String message) {
    super(message);
  }

  /**
   * Creates a new exception with the specified error message and cause.
   *
   * @param message the detail message explaining the error
   * @param cause   the underlying cause
   */
  public SlicerEventsException(String message, Throwable cause) {
    super(message, cause);
  }
}
