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
package com.corvusprint.slicer.events.internal;

import java.util.function.Consumer;

/**
 * Ordered store of registered consumers, the registration side of a dispatcher.
 * <p>
 * Two strategies exist because the ownership contracts differ: {@link StrongRegistry} keeps its
 * entries alive until they are explicitly removed, {@link WeakRegistry} never extends the lifetime of
 * its targets and forgets the ones that have been collected.
 * <p>
 * Implementations are not thread-safe. The owning dispatcher guards every call with its own lock.
 *
 * @param <T> type of the registered consumers
 */
public interface Registry<T> {

  /**
   * Appends a target. No uniqueness check is performed: a target added twice is visited twice.
   *
   * @param target the target to register; must not be {@code null}
   * @throws NullPointerException if {@code target} is {@code null}
   */
  void add(T target);

  /**
   * Removes every entry referring to {@code target}, compared by reference.
   *
   * @param target the target to unregister
   * @return the number of entries removed
   */
  int removeAll(T target);

  /**
   * Removes every entry. Calling it on an empty registry has no effect.
   */
  void clear();

  /**
   * Returns the number of entries currently stored, including entries whose target may no longer be
   * reachable but has not been observed as such yet.
   *
   * @return the entry count
   */
  int size();

  default boolean isEmpty() {
    return size() == 0;
  }

  /**
   * Visits every live target in registration order.
   * <p>
   * An exception thrown by {@code action} stops the visit and propagates to the caller.
   *
   * @param action the visitor
   */
  void forEach(Consumer<? super T> action);
}
