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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Reference;
import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * {@link Registry} holding non-owning references.
 * <p>
 * The registry never keeps a target alive. Once the last strong reference held elsewhere is released
 * and the reference is cleared, the entry is stale; it is removed the first time
 * {@link #forEach(Consumer)} reaches it. There is no background sweep, so {@link #size()} keeps
 * counting a stale entry until the next visit.
 * <p>
 * Each entry is resolved exactly once per visit: the resolved target is the one delivered to, so a
 * reference cleared concurrently cannot be observed live and stale within the same visit.
 *
 * @param <T> type of the registered consumers
 */
public final class WeakRegistry<T> implements Registry<T> {

  private static final Logger logger = LoggerFactory.getLogger(WeakRegistry.class);

  private final List<Reference<? extends T>> entries = new ArrayList<>();

  /**
   * Registers {@code target} through a {@link WeakReference}.
   *
   * @param target the target to register; must not be {@code null}
   * @throws NullPointerException if {@code target} is {@code null}
   */
  @Override
  public void add(T target) {
    requireNonNull(target, "target must not be null");
    entries.add(new WeakReference<>(target));
  }

  /**
   * Registers a caller-supplied reference. Soft or weak references and their subclasses are accepted
   * alike; the registry only relies on {@link Reference#get()} returning {@code null} once the target
   * is gone.
   *
   * @param reference the reference to register; must not be {@code null}
   * @throws NullPointerException if {@code reference} is {@code null}
   */
  public void add(Reference<? extends T> reference) {
    entries.add(requireNonNull(reference, "reference must not be null"));
  }

  @Override
  public int removeAll(T target) {
    int before = entries.size();
    entries.removeIf(entry -> entry.get() == target);
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
    Iterator<Reference<? extends T>> iterator = entries.iterator();
    while (iterator.hasNext()) {
      T target = iterator.next().get();
      if (target == null) {
        iterator.remove();
        logger.debug("Pruned stale registration, {} remaining", entries.size());
      } else {
        action.accept(target);
      }
    }
  }
}
