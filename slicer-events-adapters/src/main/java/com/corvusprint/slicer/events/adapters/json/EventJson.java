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
package com.corvusprint.slicer.events.adapters.json;

import com.corvusprint.slicer.events.CompletionInfo;
import com.corvusprint.slicer.events.ExportInfo;
import com.corvusprint.slicer.events.SlicingStatus;
import com.corvusprint.slicer.events.config.ConfigValue;
import com.corvusprint.slicer.events.config.OptionMetadata;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.List;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Renders slicing events and configuration changes as flat JSON documents.
 * <p>
 * Documents produced:
 * </p>
 * <pre>{@code
 * status:            {"percent":42,"message":"slicing layer 10","flags":0,"warning_step":0,"extra":false}
 * slicing completed: {"timestamp":1712}
 * completion:        {"status":"error","error_message":"mesh not manifold","critical_error":false,
 *                     "invalidate_downstream":false,"error_object_ids":[3]}
 * export:            {"phase":"began"} / {"phase":"finished","path":"/tmp/out.gcode"}
 * config value:      {"key":"layer_height","value":0.2,"type":"float","meta":{...}}
 * preset name:       {"key":"preset_name","value":"Generic PLA","type":"string","extruder":0}
 * polling status:    {"percent":100,"message":"","flags":0,"warning_step":0,
 *                     "completed":{"status":"finished"}}
 * }</pre>
 *
 * <h2>Serialization Details</h2>
 * <ul>
 *   <li>Numbers are written as JSON numbers and booleans as {@code true}/{@code false}; NaN and
 *       infinities are written as {@code null}</li>
 *   <li>Strings are escaped for quotes, backslashes and control characters only; HTML characters
 *       are written as is</li>
 *   <li>Enumerated values are written lowercase</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is stateless apart from an immutable {@link Gson} instance and can be used from any
 * thread.
 * </p>
 */
public final class EventJson {

  private static final Gson gson = new GsonBuilder()
    .disableHtmlEscaping()
    .create();

  private EventJson() {
  }

  public static String status(SlicingStatus status) {
    return gson.toJson(statusObject(status, true));
  }

  public static String slicingCompleted(int timestamp) {
    var json = new JsonObject();
    json.addProperty("timestamp", timestamp);
    return gson.toJson(json);
  }

  public static String completion(CompletionInfo info) {
    requireNonNull(info, "info must not be null");
    var json = new JsonObject();
    json.addProperty("status", lowercase(info.status()));
    json.addProperty("error_message", info.errorMessage());
    json.addProperty("critical_error", info.criticalError());
    json.addProperty("invalidate_downstream", info.invalidateDownstream());
    var ids = new JsonArray();
    info.errorObjectIds().forEach(ids::add);
    json.add("error_object_ids", ids);
    return gson.toJson(json);
  }

  public static String export(ExportInfo info) {
    requireNonNull(info, "info must not be null");
    if (info.phase() == ExportInfo.Phase.FINISHED) {
      return exportFinished(info.path());
    }
    var json = new JsonObject();
    json.addProperty("phase", lowercase(info.phase()));
    return gson.toJson(json);
  }

  /**
   * Renders the end of an export.
   *
   * @param path location of the exported file, or {@code null} to leave out the {@code path} member
   * @return the document
   */
  public static String exportFinished(String path) {
    var json = new JsonObject();
    json.addProperty("phase", lowercase(ExportInfo.Phase.FINISHED));
    if (path != null) {
      json.addProperty("path", path);
    }
    return gson.toJson(json);
  }

  /**
   * Renders a configuration change.
   *
   * @param key      the option key
   * @param value    the new value
   * @param metadata description of the option, or {@code null} to leave out the {@code meta} object
   * @return the document
   */
  public static String configValue(String key, ConfigValue value, OptionMetadata metadata) {
    requireNonNull(key, "key must not be null");
    requireNonNull(value, "value must not be null");
    var json = new JsonObject();
    json.addProperty("key", key);
    json.add("value", valueElement(value));
    json.addProperty("type", value.typeName());
    if (metadata != null) {
      json.add("meta", metadataObject(metadata));
    }
    return gson.toJson(json);
  }

  /**
   * Renders the name of a printer or filament preset.
   *
   * @param presetName the preset name
   * @param extruder   index of the extruder the filament is loaded in, or {@code null} for a printer
   *                   preset
   * @return {@code {"key":"preset_name","value":...,"type":"string"}}, with an {@code extruder}
   * member for a filament preset
   */
  public static String presetName(String presetName, Integer extruder) {
    requireNonNull(presetName, "presetName must not be null");
    var json = new JsonObject();
    json.addProperty("key", "preset_name");
    json.addProperty("value", presetName);
    json.addProperty("type", "string");
    if (extruder != null) {
      json.addProperty("extruder", extruder);
    }
    return gson.toJson(json);
  }

  /**
   * Renders the state cached by a polling consumer.
   * <p>
   * The {@code completed} object is present only once the run has completed; its
   * {@code error_message} only when non-empty.
   *
   * @param status     the latest status
   * @param completion the completion of the run, or {@code null} while it is in progress
   * @return the document
   */
  public static String pollingStatus(SlicingStatus status, CompletionInfo completion) {
    var json = statusObject(status, false);
    if (completion != null) {
      var completed = new JsonObject();
      completed.addProperty("status", lowercase(completion.status()));
      if (!completion.errorMessage().isEmpty()) {
        completed.addProperty("error_message", completion.errorMessage());
      }
      json.add("completed", completed);
    }
    return gson.toJson(json);
  }

  private static JsonObject statusObject(SlicingStatus status, boolean withExtra) {
    requireNonNull(status, "status must not be null");
    var json = new JsonObject();
    json.addProperty("percent", status.percent());
    json.addProperty("message", status.message());
    json.addProperty("flags", status.flags());
    json.addProperty("warning_step", status.warningStep());
    if (withExtra) {
      json.addProperty("extra", status.extra());
    }
    return json;
  }

  private static JsonElement valueElement(ConfigValue value) {
    if (value instanceof ConfigValue.BoolValue v) return new JsonPrimitive(v.value());
    if (value instanceof ConfigValue.IntValue v) return new JsonPrimitive(v.value());
    if (value instanceof ConfigValue.FloatValue v) return number(v.value());
    if (value instanceof ConfigValue.StringValue v) return new JsonPrimitive(v.value());
    if (value instanceof ConfigValue.StringsValue v) return stringArray(v.values());
    if (value instanceof ConfigValue.IntsValue v) {
      var array = new JsonArray();
      v.values().forEach(array::add);
      return array;
    }
    var array = new JsonArray();
    ((ConfigValue.FloatsValue) value).values().forEach(v -> array.add(number(v)));
    return array;
  }

  private static JsonElement number(Double value) {
    if (value == null || value.isNaN() || value.isInfinite()) {
      return JsonNull.INSTANCE;
    }
    return new JsonPrimitive(value);
  }

  private static JsonObject metadataObject(OptionMetadata metadata) {
    var meta = new JsonObject();
    meta.addProperty("label", metadata.label());
    meta.addProperty("category", metadata.category());
    meta.addProperty("tooltip", metadata.tooltip());
    if (!metadata.unit().isEmpty()) {
      meta.addProperty("unit", metadata.unit());
    }
    if (metadata.min() != null) {
      meta.add("min", number(metadata.min()));
    }
    if (metadata.max() != null) {
      meta.add("max", number(metadata.max()));
    }
    if (!metadata.options().isEmpty()) {
      var options = new JsonArray();
      metadata.options().forEach((optionKey, optionValue) -> {
        var option = new JsonObject();
        option.addProperty("key", optionKey);
        option.addProperty("value", optionValue);
        options.add(option);
      });
      meta.add("options", options);
    }
    if (!metadata.enumValues().isEmpty()) {
      meta.add("enum_values", stringArray(metadata.enumValues()));
    }
    if (!metadata.enumLabels().isEmpty()) {
      meta.add("enum_labels", stringArray(metadata.enumLabels()));
    }
    return meta;
  }

  private static JsonArray stringArray(List<String> values) {
    var array = new JsonArray();
    values.forEach(array::add);
    return array;
  }

  private static String lowercase(Enum<?> value) {
    return value.name().toLowerCase(Locale.ROOT);
  }
}
