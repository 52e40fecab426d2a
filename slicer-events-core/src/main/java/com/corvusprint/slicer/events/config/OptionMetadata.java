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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Descriptive metadata of a configuration option, as shown next to the option in an editor.
 *
 * @param label       short display name
 * @param category    category the option belongs to
 * @param tooltip     long description
 * @param unit        unit suffix (e.g. {@code mm}), empty when the option has none
 * @param min         lower bound, {@code null} when unbounded
 * @param max         upper bound, {@code null} when unbounded
 * @param options     enumeration keys mapped to their numeric value, in declaration order
 * @param enumValues  serialized values accepted by an enumerated option
 * @param enumLabels  display labels matching {@code enumValues}
 */
public record OptionMetadata(String label,
                             String category,
                             String tooltip,
                             String unit,
                             Double min,
                             Double max,
                             Map<String, Integer> options,
                             List<String> enumValues,
                             List<String> enumLabels) {

  public OptionMetadata {
    label = label == null ? "" : label;
    category = category == null ? "" : category;
    tooltip = tooltip == null ? "" : tooltip;
    unit = unit == null ? "" : unit;
    options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
    enumLabels = enumLabels == null ? List.of() : List.copyOf(enumLabels);
  }

  /**
   * Creates metadata carrying only the descriptive texts.
   *
   * @param label    short display name
   * @param category category the option belongs to
   * @param tooltip  long description
   * @return the metadata
   */
  public static OptionMetadata of(String label, String category, String tooltip) {
    return new OptionMetadata(label, category, tooltip, "", null, null, null, null, null);
  }

  public OptionMetadata withUnit(String unit) {
    return new OptionMetadata(label, category, tooltip, unit, min, max, options, enumValues, enumLabels);
  }

  public OptionMetadata withRange(Double min, Double max) {
    return new OptionMetadata(label, category, tooltip, unit, min, max, options, enumValues, enumLabels);
  }

  public OptionMetadata withEnum(Map<String, Integer> options, List<String> enumValues, List<String> enumLabels) {
    return new OptionMetadata(label, category, tooltip, unit, min, max, options, enumValues, enumLabels);
  }
}
