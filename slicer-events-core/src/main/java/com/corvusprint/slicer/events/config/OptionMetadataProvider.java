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

import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Looks up the {@link OptionMetadata} of a configuration option by key.
 */
@FunctionalInterface
public interface OptionMetadataProvider {

  /**
   * @param key the option key
   * @return the metadata of the option, or empty when the option is not described
   */
  Optional<OptionMetadata> lookup(String key);

  /**
   * Returns a provider that describes no option.
   *
   * @return the empty provider
   */
  static OptionMetadataProvider none() {
    return key -> Optional.empty();
  }

  /**
   * Returns a provider backed by a fixed table. The table is copied.
   *
   * @param table option key to metadata
   * @return the provider
   */
  static OptionMetadataProvider of(Map<String, OptionMetadata> table) {
    var copy = Map.copyOf(requireNonNull(table, "table must not be null"));
    return key -> Optional.ofNullable(copy.get(key));
  }
}
