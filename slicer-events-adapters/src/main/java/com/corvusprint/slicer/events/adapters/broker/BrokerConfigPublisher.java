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

import com.corvusprint.slicer.events.config.ConfigChangeDispatcher;
import com.corvusprint.slicer.events.config.ConfigChangeListener;
import com.corvusprint.slicer.events.config.ConfigValue;
import com.corvusprint.slicer.events.config.OptionMetadataProvider;
import com.corvusprint.slicer.events.adapters.json.EventJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Publishes configuration option values to a message broker, one retained document per option.
 * <p>
 * Each option goes to the topic given by {@link ConfigTopicMap#topicFor(String)} under the broker
 * topic prefix, for instance {@code slicer/config/quality/layer_height/layer_height}:
 * <pre>{@code
 * {"key":"layer_height","value":0.2,"type":"float",
 *  "meta":{"label":"Layer height","category":"Quality","tooltip":"...","unit":"mm","min":0.0}}
 * }</pre>
 * The {@code meta} object is present when the {@link OptionMetadataProvider} describes the option.
 * Retained documents let a subscriber joining late read the current value of every option.
 * <p>
 * As a {@link ConfigChangeListener} the publisher mirrors every change notified on a
 * {@link ConfigChangeDispatcher}. The dispatcher holds it weakly: whoever calls
 * {@link #registerWith(ConfigChangeDispatcher)} must keep a reference to the publisher for as long
 * as changes should be published.
 * <p>
 * Printer and filament presets are published the same way, after a {@code preset_name} document:
 * printer options under {@code config/printer/}, with options listed as extruder options split into
 * one document per extruder, and filament options under {@code config/filament/{index}/}. See
 * {@link ConfigTopicMap} for the exact topics.
 * <p>
 * Nothing is published while the client is disconnected, and transport faults are logged, never
 * thrown.
 */
public final class BrokerConfigPublisher implements ConfigChangeListener {

  private static final Logger logger = LoggerFactory.getLogger(BrokerConfigPublisher.class);

  static final String PRESET_NAME_KEY = "preset_name";
  static final String PRINTER_PRESET_TOPIC = "config/printer/" + PRESET_NAME_KEY;
  private static final String NOZZLE_DIAMETER_KEY = "nozzle_diameter";

  private final BrokerClient client;
  private final BrokerConfig config;
  private final ConfigTopicMap topics;
  private final OptionMetadataProvider metadata;

  public BrokerConfigPublisher(BrokerClient client, BrokerConfig config, ConfigTopicMap topics, OptionMetadataProvider metadata) {
    this.client = requireNonNull(client, "client must not be null");
    this.config = requireNonNull(config, "config must not be null");
    this.topics = requireNonNull(topics, "topics must not be null");
    this.metadata = requireNonNull(metadata, "metadata must not be null");
  }

  /**
   * Registers this publisher as a weakly-held listener of {@code dispatcher}.
   *
   * @param dispatcher the dispatcher to mirror
   */
  public void registerWith(ConfigChangeDispatcher dispatcher) {
    requireNonNull(dispatcher, "dispatcher must not be null");
    dispatcher.addListener(this);
  }

  public boolean unregisterFrom(ConfigChangeDispatcher dispatcher) {
    requireNonNull(dispatcher, "dispatcher must not be null");
    return dispatcher.removeListener(this);
  }

  @Override
  public void onConfigChange(String key, ConfigValue value) {
    publishChange(key, value);
  }

  /**
   * Publishes the value of one option.
   *
   * @param key   the option key
   * @param value the option value
   * @return {@code true} if the document was handed to the broker client
   */
  public boolean publishChange(String key, ConfigValue value) {
    var payload = EventJson.configValue(key, value, metadata.lookup(key).orElse(null));
    return BrokerPublishing.publish(client, config, topics.topicFor(key), payload, true);
  }

  /**
   * Publishes the whole configuration: every option of the topic table that {@code options}
   * holds, in table order. Options unknown to the table are not published.
   *
   * @param options the current value of every option
   * @return the number of documents handed to the broker client
   */
  public int publishAll(Map<String, ConfigValue> options) {
    requireNonNull(options, "options must not be null");
    if (!client.isConnected()) {
      logger.warn("Cannot publish full config: not connected");
      return 0;
    }

    int published = 0;
    for (var key : topics.keys()) {
      var value = options.get(key);
      if (value != null && publishChange(key, value)) {
        published++;
      }
    }
    logger.info("Published full config ({} of {} options)", published, options.size());
    return published;
  }

  /**
   * Publishes a printer preset: its name, then every option in {@code options} order.
   * <p>
   * An extruder option holding a list is split into one document per extruder, the number of
   * extruders being the number of {@code nozzle_diameter} values. Missing entries are skipped and
   * entries beyond the last extruder are ignored.
   *
   * @param options    the options of the preset
   * @param presetName the preset name
   * @return the number of documents handed to the broker client
   */
  public int publishPrinterConfig(Map<String, ConfigValue> options, String presetName) {
    requireNonNull(options, "options must not be null");
    requireNonNull(presetName, "presetName must not be null");
    if (!client.isConnected()) {
      logger.warn("Cannot publish printer config {}: not connected", presetName);
      return 0;
    }

    int published = 0;
    if (publish(PRINTER_PRESET_TOPIC, EventJson.presetName(presetName, null))) {
      published++;
    }
    int extruders = extruderCount(options);
    for (var option : options.entrySet()) {
      var key = option.getKey();
      var value = option.getValue();
      var elements = listElements(value);
      if (topics.extruderGroupOf(key).isPresent() && elements != null) {
        for (int extruder = 0; extruder < Math.min(extruders, elements.size()); extruder++) {
          if (publishOption(topics.extruderTopicFor(key, extruder), key, elements.get(extruder))) {
            published++;
          }
        }
      } else if (publishOption(topics.printerTopicFor(key), key, value)) {
        published++;
      }
    }
    logger.info("Published printer config {} ({} documents, {} extruders)", presetName, published, extruders);
    return published;
  }

  /**
   * Publishes the filament preset loaded in one extruder: its name, then every option in
   * {@code options} order.
   *
   * @param options    the options of the preset
   * @param presetName the preset name
   * @param extruder   index of the extruder, from {@code 0}
   * @return the number of documents handed to the broker client
   * @throws IllegalArgumentException if {@code extruder} is negative
   */
  public int publishFilamentConfig(Map<String, ConfigValue> options, String presetName, int extruder) {
    requireNonNull(options, "options must not be null");
    requireNonNull(presetName, "presetName must not be null");
    if (extruder < 0) {
      throw new IllegalArgumentException("extruder must be positive or zero, got " + extruder);
    }
    if (!client.isConnected()) {
      logger.warn("Cannot publish filament config {}: not connected", presetName);
      return 0;
    }

    int published = 0;
    if (publish(topics.filamentTopicFor(PRESET_NAME_KEY, extruder), EventJson.presetName(presetName, extruder))) {
      published++;
    }
    for (var option : options.entrySet()) {
      if (publishOption(topics.filamentTopicFor(option.getKey(), extruder), option.getKey(), option.getValue())) {
        published++;
      }
    }
    logger.info("Published filament config {} for extruder {} ({} documents)", presetName, extruder, published);
    return published;
  }

  private boolean publishOption(String topic, String key, ConfigValue value) {
    return publish(topic, EventJson.configValue(key, value, metadata.lookup(key).orElse(null)));
  }

  private boolean publish(String topic, String payload) {
    return BrokerPublishing.publish(client, config, topic, payload, true);
  }

  private static int extruderCount(Map<String, ConfigValue> options) {
    var elements = listElements(options.get(NOZZLE_DIAMETER_KEY));
    return elements == null ? 1 : elements.size();
  }

  // One scalar per list entry, or null when the value is not a list.
  private static List<ConfigValue> listElements(ConfigValue value) {
    if (value instanceof ConfigValue.StringsValue v) {
      return v.values().stream().map(ConfigValue::of).collect(Collectors.toList());
    }
    if (value instanceof ConfigValue.IntsValue v) {
      return v.values().stream().map(i -> ConfigValue.of(i.intValue())).collect(Collectors.toList());
    }
    if (value instanceof ConfigValue.FloatsValue v) {
      return v.values().stream().map(d -> ConfigValue.of(d.doubleValue())).collect(Collectors.toList());
    }
    return null;
  }

  public boolean isConnected() {
    return client.isConnected();
  }
}
