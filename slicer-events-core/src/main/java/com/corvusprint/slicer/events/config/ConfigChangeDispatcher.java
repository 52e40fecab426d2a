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
package com.corvusprint.slicer.events.config;

import com.corvusprint.slicer.events.FaultPolicy;
import com.corvusprint.slicer.events.NotificationContext;
import com.corvusprint.slicer.events.internal.StrongRegistry;
import com.corvusprint.slicer.events.internal.WeakRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Reference;
import java.lang.ref.WeakReference;
import java.util.function.BiConsumer;

import static java.util.Objects.requireNonNull;

/**
 * Fans out configuration option changes to weakly-held listeners and to owned callbacks.
 * <p>
 * Two kinds of registration are kept apart:
 * <ul>
 *   <li><strong>Listeners</strong> ({@link #addListener(ConfigChangeListener)}) are held through
 *       non-owning references. The dispatcher never extends their lifetime; a listener whose owner
 *       released it is removed the first time {@link #notifyChange(String, ConfigValue)} observes it.</li>
 *   <li><strong>Callbacks</strong> ({@link #addCallback(BiConsumer)}) are owned by the dispatcher and
 *       always live. They are never pruned automatically; only {@link #clear()} removes them.</li>
 * </ul>
 * Neither kind is checked for uniqueness: registering the same target twice yields two deliveries per
 * change. Callers are expected to register once.
 * <p>
 * {@link #setEnabled(boolean)} is a gate over delivery: while disabled, notifications are dropped
 * without touching the registrations, and re-enabling resumes delivery to whatever is still live.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Every operation can be called from any thread. A single lock guards registration and fan-out for
 * their whole duration, so a change is delivered to a consistent set of registrations and deliveries
 * are totally ordered. Delivery is synchronous on the notifying thread. A listener must not register
 * or unregister anything on this dispatcher from within its callback.
 * <p>
 * Instances are built explicitly and shared through {@link NotificationContext}; there is no global
 * instance.
 *
 * @see ConfigChangeListener
 * @see FaultPolicy
 */
public final class ConfigChangeDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(ConfigChangeDispatcher.class);

  private final Object lock = new Object();
  private final WeakRegistry<ConfigChangeListener> listeners = new WeakRegistry<>();
  private final StrongRegistry<BiConsumer<String, ConfigValue>> callbacks = new StrongRegistry<>();
  private final FaultPolicy faultPolicy;
  private volatile boolean enabled = true;

  /**
   * Creates an enabled dispatcher that lets listener exceptions propagate to the notifier.
   */
  public ConfigChangeDispatcher() {
    this(FaultPolicy.PROPAGATE);
  }

  /**
   * Creates an enabled dispatcher with the given fault policy.
   *
   * @param faultPolicy what to do when a listener or callback throws
   * @throws NullPointerException if {@code faultPolicy} is {@code null}
   */
  public ConfigChangeDispatcher(FaultPolicy faultPolicy) {
    this.faultPolicy = requireNonNull(faultPolicy, "faultPolicy must not be null");
  }

  /**
   * Registers a listener through a weak reference. A {@code null} listener is ignored.
   * <p>
   * The caller keeps ownership: once nothing else references the listener, it stops receiving
   * changes. Do not pass a lambda created on the spot, nothing would keep it reachable; use
   * {@link #addCallback(BiConsumer)} for that.
   *
   * @param listener the listener to register
   */
  public void addListener(ConfigChangeListener listener) {
    if (listener == null) {
      logger.debug("Ignoring registration of a null config change listener");
      return;
    }
    addListener(new WeakReference<>(listener));
  }

  /**
   * Registers a listener through a caller-supplied non-owning reference. A {@code null} reference is
   * ignored.
   *
   * @param reference reference to the listener
   */
  public void addListener(Reference<? extends ConfigChangeListener> reference) {
    if (reference == null) {
      logger.debug("Ignoring registration of a null config change listener reference");
      return;
    }
    synchronized (lock) {
      listeners.add(reference);
      logger.debug("Config change listener registered, {} listener(s)", listeners.size());
    }
  }

  /**
   * Unregisters every registration of {@code listener}.
   *
   * @param listener the listener to unregister
   * @return {@code true} if at least one registration was removed
   */
  public boolean removeListener(ConfigChangeListener listener) {
    if (listener == null) {
      return false;
    }
    synchronized (lock) {
      return listeners.removeAll(listener) > 0;
    }
  }

  /**
   * Registers a callback owned by this dispatcher. A {@code null} callback is ignored.
   *
   * @param callback receives the option key and its new value
   */
  public void addCallback(BiConsumer<String, ConfigValue> callback) {
    if (callback == null) {
      logger.debug("Ignoring registration of a null config change callback");
      return;
    }
    synchronized (lock) {
      callbacks.add(callback);
    }
  }

  /**
   * Delivers a change to every live listener, in registration order, then to every callback, in
   * registration order.
   * <p>
   * Does nothing, not even pruning, while the dispatcher is disabled. Listeners found stale during
   * the walk are removed. Blocks until every invocation returns.
   *
   * @param key   the option key
   * @param value the new value
   * @throws NullPointerException if {@code key} or {@code value} is {@code null}
   * @throws RuntimeException     whatever a listener or callback throws, under {@link FaultPolicy#PROPAGATE}
   */
  public void notifyChange(String key, ConfigValue value) {
    requireNonNull(key, "key must not be null");
    requireNonNull(value, "value must not be null");
    if (!enabled) {
      return;
    }

    synchronized (lock) {
      listeners.forEach(listener -> faultPolicy.deliver(listener, key, l -> l.onConfigChange(key, value)));
      callbacks.forEach(callback -> faultPolicy.deliver(callback, key, c -> c.accept(key, value)));
    }
  }

  /**
   * Removes every listener and every callback. Idempotent.
   */
  public void clear() {
    synchronized (lock) {
      listeners.clear();
      callbacks.clear();
    }
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Returns the number of listener registrations, counting stale ones that have not been pruned by a
   * notification yet.
   *
   * @return the listener registration count
   */
  public int listenerCount() {
    synchronized (lock) {
      return listeners.size();
    }
  }

  public int callbackCount() {
    synchronized (lock) {
      return callbacks.size();
    }
  }

  public FaultPolicy faultPolicy() {
    return faultPolicy;
  }
}
