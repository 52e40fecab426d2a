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

/**
 * Receiver of configuration option changes.
 * <p>
 * Listeners are held weakly by {@link ConfigChangeDispatcher}: registering one does not keep it
 * alive, and the dispatcher forgets it once it has been collected. Whoever registers a listener owns
 * it and must keep it reachable for as long as it should receive changes. Closures with no owner of
 * their own are registered as callbacks instead, see
 * {@link ConfigChangeDispatcher#addCallback(java.util.function.BiConsumer)}.
 */
@FunctionalInterface
public interface ConfigChangeListener {

  /**
   * Called when an option value changes.
   *
   * @param key   the option key, e.g. {@code "layer_height"}
   * @param value the new value
   */
  void onConfigChange(String key, ConfigValue value);
}
