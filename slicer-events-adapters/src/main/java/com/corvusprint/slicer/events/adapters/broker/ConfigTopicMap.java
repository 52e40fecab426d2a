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
package com.corvusprint.slicer.events.adapters.broker;

import com.corvusprint.slicer.events.SlicerEventsException;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Maps configuration option keys to the broker topic they are published on.
 * <p>
 * Options are arranged the way the settings editor shows them, in pages holding groups:
 * {@code config/{page}/{group}/{key}}, e.g. {@code config/quality/layer_height/layer_height}. Keys
 * absent from the table go to {@code config/unknown/{key}}.
 * <p>
 * The table is read from a classpath JSON resource of the form:
 * <pre>{@code
 * {"pages": [
 *   {"page": "quality", "groups": [
 *     {"group": "layer_height", "keys": ["layer_height", "initial_layer_print_height"]}
 *   ]}
 * ]}
 * }</pre>
 * A key listed twice keeps its first mapping. Iteration follows the order of the resource.
 * <p>
 * An optional {@code printer} section arranges printer options the same way. Its {@code groups}
 * give {@code config/printer/{group}/{key}}, unlisted printer options going to
 * {@code config/printer/misc/{key}}. Its {@code extruder_groups} list the options holding one
 * value per extruder, published as {@code config/printer/extruder/{index}/{group}/{key}}:
 * <pre>{@code
 * "printer": {
 *   "groups": [{"group": "motion_ability/speed", "keys": ["machine_max_speed_x"]}],
 *   "extruder_groups": [{"group": "retraction", "keys": ["retraction_length"]}]
 * }
 * }</pre>
 * Filament options are not mapped: they go to {@code config/filament/{index}/{key}}.
 * <p>
 * Instances are immutable.
 */
public final class ConfigTopicMap {

  private static final Logger logger = LoggerFactory.getLogger(ConfigTopicMap.class);

  public static final String DEFAULT_RESOURCE = "config-topics.json";
  static final String UNKNOWN_PAGE = "unknown";
  static final String PRINTER_MISC_GROUP = "misc";

  private final Map<String, Location> locations;
  private final Map<String, String> printerGroups;
  private final Map<String, String> extruderGroups;

  private ConfigTopicMap(Map<String, Location> locations, Map<String, String> printerGroups, Map<String, String> extruderGroups) {
    this.locations = Collections.unmodifiableMap(locations);
    this.printerGroups = Collections.unmodifiableMap(printerGroups);
    this.extruderGroups = Collections.unmodifiableMap(extruderGroups);
  }

  /**
   * Page and group an option belongs to.
   *
   * @param page  settings page, e.g. {@code quality}
   * @param group group within the page, e.g. {@code seam}
   */
  public record Location(String page, String group) {
    public Location {
      requireNonNull(page, "page must not be null");
      requireNonNull(group, "group must not be null");
    }
  }

  /**
   * Loads the table shipped with this library.
   *
   * @return the table
   * @throws SlicerEventsException if the resource is missing or malformed
   */
  public static ConfigTopicMap load() {
    return load(DEFAULT_RESOURCE);
  }

  /**
   * Loads a table from a classpath resource.
   *
   * @param resourceName name of the resource, relative to the classpath root
   * @return the table
   * @throws SlicerEventsException if the resource is missing or malformed
   */
  public static ConfigTopicMap load(String resourceName) {
    requireNonNull(resourceName, "resourceName must not be null");
    var stream = ConfigTopicMap.class.getClassLoader().getResourceAsStream(resourceName);
    if (stream == null) {
      throw new SlicerEventsException("Config topic table not found on classpath: " + resourceName);
    }

    try (var reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      var table = parse(JsonParser.parseReader(reader));
      logger.debug("Loaded {} config topic mappings from {}", table.size(), resourceName);
      return table;
    } catch (IOException | JsonParseException | IllegalStateException | UnsupportedOperationException e) {
      throw new SlicerEventsException("Malformed config topic table: " + resourceName, e);
    }
  }

  private static ConfigTopicMap parse(JsonElement root) {
    var table = root.getAsJsonObject();
    var pages = requireArray(table, "pages");
    var locations = new LinkedHashMap<String, Location>();
    for (var pageElement : pages) {
      var page = pageElement.getAsJsonObject();
      var pageName = requireString(page, "page");
      for (var groupElement : requireArray(page, "groups")) {
        var group = groupElement.getAsJsonObject();
        var location = new Location(pageName, requireString(group, "group"));
        for (var key : requireArray(group, "keys")) {
          var previous = locations.putIfAbsent(key.getAsString(), location);
          if (previous != null) {
            logger.debug("Ignoring duplicate mapping of {} to {}, already mapped to {}", key.getAsString(), location, previous);
          }
        }
      }
    }

    var printerGroups = new LinkedHashMap<String, String>();
    var extruderGroups = new LinkedHashMap<String, String>();
    var printer = table.get("printer");
    if (printer != null) {
      var section = printer.getAsJsonObject();
      parseGroups(section, "groups", printerGroups);
      parseGroups(section, "extruder_groups", extruderGroups);
    }
    return new ConfigTopicMap(locations, printerGroups, extruderGroups);
  }

  private static void parseGroups(JsonObject section, String member, Map<String, String> groups) {
    if (section.get(member) == null) {
      return;
    }
    for (var groupElement : requireArray(section, member)) {
      var group = groupElement.getAsJsonObject();
      var groupName = requireString(group, "group");
      for (var key : requireArray(group, "keys")) {
        var previous = groups.putIfAbsent(key.getAsString(), groupName);
        if (previous != null) {
          logger.debug("Ignoring duplicate printer mapping of {} to {}, already mapped to {}", key.getAsString(), groupName, previous);
        }
      }
    }
  }

  private static Iterable<JsonElement> requireArray(JsonObject object, String member) {
    var element = object.get(member);
    if (element == null || !element.isJsonArray()) {
      throw new IllegalStateException("'" + member + "' must be an array");
    }
    return element.getAsJsonArray();
  }

  private static String requireString(JsonObject object, String member) {
    var element = object.get(member);
    if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
      throw new IllegalStateException("'" + member + "' must be a string");
    }
    return element.getAsString();
  }

  /**
   * Returns the topic of an option, relative to the broker topic prefix.
   *
   * @param key the option key
   * @return {@code config/{page}/{group}/{key}}, or {@code config/unknown/{key}} for an unmapped key
   */
  public String topicFor(String key) {
    requireNonNull(key, "key must not be null");
    var location = locations.get(key);
    if (location == null) {
      return "config/" + UNKNOWN_PAGE + "/" + key;
    }
    return "config/" + location.page() + "/" + location.group() + "/" + key;
  }

  /**
   * Returns the topic of a printer option holding a single value.
   *
   * @param key the option key
   * @return {@code config/printer/{group}/{key}}, or {@code config/printer/misc/{key}} for an
   * unmapped key
   */
  public String printerTopicFor(String key) {
    requireNonNull(key, "key must not be null");
    return "config/printer/" + printerGroups.getOrDefault(key, PRINTER_MISC_GROUP) + "/" + key;
  }

  /**
   * Returns the group of a printer option holding one value per extruder.
   *
   * @param key the option key
   * @return the group, or empty if the option is not split per extruder
   */
  public Optional<String> extruderGroupOf(String key) {
    return Optional.ofNullable(extruderGroups.get(key));
  }

  public String extruderTopicFor(String key, int extruder) {
    requireNonNull(key, "key must not be null");
    var group = extruderGroupOf(key)
      .orElseThrow(() -> new IllegalArgumentException(key + " is not an extruder option"));
    return "config/printer/extruder/" + extruder + "/" + group + "/" + key;
  }

  public String filamentTopicFor(String key, int extruder) {
    requireNonNull(key, "key must not be null");
    return "config/filament/" + extruder + "/" + key;
  }

  public Optional<Location> locationOf(String key) {
    return Optional.ofNullable(locations.get(key));
  }

  public boolean contains(String key) {
    return locations.containsKey(key);
  }

  /**
   * @return the mapped keys, in table order
   */
  public Set<String> keys() {
    return locations.keySet();
  }

  public int size() {
    return locations.size();
  }
}
