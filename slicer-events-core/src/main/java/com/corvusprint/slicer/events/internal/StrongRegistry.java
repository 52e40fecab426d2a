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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * {@link Registry} holding strong references. Entries leave only through {@link #removeAll(Object)}
 * or {@link #clear()}; there is no liveness check.
 *
 * @param <T> type of the registered consumers
 */
public final class StrongRegistry<T> implements Registry<T> {

  private final List<T> entries = new ArrayList<>();

  @Override
  public void add(T target) {
    entries.add(requireNonNull(target, "target must not be null"));
  }

  @Override
  public int removeAll(T target) {
    int before = entries.size();
    entries.removeIf(entry -> entry == target);
    return before - entries.size();
  }

  @Override
  public void clear() {
    entries.clear();
  }

  @Override
  public int size() {
    return entries.size();
  }

  @Override
  public void forEach(Consumer<? super T> action) {
    requireNonNull(action, "action must not be null");
    for (T entry : entries) {
      action.accept(entry);
    }
  }
}
