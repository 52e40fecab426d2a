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

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * New value of a configuration option.
 * <p>
 * The set of kinds is closed: boolean, integer, floating point, string, and lists of strings,
 * integers or floating point numbers. Values carry no identity and are never stored by the
 * dispatcher. List kinds hold immutable copies.
 */
public sealed interface ConfigValue
  permits ConfigValue.BoolValue, ConfigValue.IntValue, ConfigValue.FloatValue, ConfigValue.StringValue,
  ConfigValue.StringsValue, ConfigValue.IntsValue, ConfigValue.FloatsValue {

  /**
   * Returns the stable name of this kind, as used in serialized documents.
   *
   * @return one of {@code bool}, {@code int}, {@code float}, {@code string}, {@code strings},
   * {@code ints}, {@code floats}
   */
  String typeName();

  static ConfigValue of(boolean value) {
    return new BoolValue(value);
  }

  static ConfigValue of(int value) {
    return new IntValue(value);
  }

  static ConfigValue of(double value) {
    return new FloatValue(value);
  }

  static ConfigValue of(String value) {
    return new StringValue(value);
  }

  static ConfigValue ofStrings(List<String> values) {
    return new StringsValue(values);
  }

  static ConfigValue ofInts(List<Integer> values) {
    return new IntsValue(values);
  }

  static ConfigValue ofFloats(List<Double> values) {
    return new FloatsValue(values);
  }

  record BoolValue(boolean value) implements ConfigValue {
    @Override
    public String typeName() {
      return "bool";
    }
  }

  record IntValue(int value) implements ConfigValue {
    @Override
    public String typeName() {
      return "int";
    }
  }

  record FloatValue(double value) implements ConfigValue {
    @Override
    public String typeName() {
      return "float";
    }
  }

  record StringValue(String value) implements ConfigValue {
    public StringValue {
      requireNonNull(value, "value must not be null");
    }

    @Override
    public String typeName() {
      return "string";
    }
  }

  record StringsValue(List<String> values) implements ConfigValue {
    public StringsValue {
      values = List.copyOf(requireNonNull(values, "values must not be null"));
    }

    @Override
    public String typeName() {
      return "strings";
    }
  }

  record IntsValue(List<Integer> values) implements ConfigValue {
    public IntsValue {
      values = List.copyOf(requireNonNull(values, "values must not be null"));
    }

    @Override
    public String typeName() {
      return "ints";
    }
  }

  record FloatsValue(List<Double> values) implements ConfigValue {
    public FloatsValue {
      values = List.copyOf(requireNonNull(values, "values must not be null"));
    }

    @Override
    public String typeName() {
      return "floats";
    }
  }
}
