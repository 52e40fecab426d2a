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

import com.corvusprint.slicer.events.NotificationContext;
import com.corvusprint.slicer.events.config.ConfigValue;
import com.corvusprint.slicer.events.config.OptionMetadataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Connects the notification channels of a slicer process to a message broker.
 * <p>
 * Owns a {@link BrokerEventSink} and a {@link BrokerConfigPublisher} sharing one
 * {@link BrokerClient}. {@link #start()} connects the client and registers both with the
 * {@link NotificationContext}: the sink on the slicing event dispatcher, the publisher (weakly,
 * kept alive by this bridge) on the configuration change dispatcher. {@link #stop()} undoes it.
 *
 * <pre>{@code
 * var context = NotificationContext.create();
 * var bridge = new BrokerBridge(context, BrokerConfig.fromEnvironment(System.getenv()), client);
 * if (bridge.start()) {
 *   bridge.publishFullConfig(currentOptions);
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * {@code start} and {@code stop} are serialized on an internal lock.
 */
public final class BrokerBridge {

  private static final Logger logger = LoggerFactory.getLogger(BrokerBridge.class);

  private final Object lock = new Object();
  private final NotificationContext context;
  private final BrokerConfig config;
  private final BrokerEventSink eventSink;
  private final BrokerConfigPublisher configPublisher;
  private boolean started;

  public BrokerBridge(NotificationContext context, BrokerConfig config, BrokerClient client) {
    this(context, config, client, ConfigTopicMap.load(), OptionMetadataProvider.none());
  }

  public BrokerBridge(NotificationContext context,
                      BrokerConfig config,
                      BrokerClient client,
                      ConfigTopicMap topics,
                      OptionMetadataProvider metadata) {
    this.context = requireNonNull(context, "context must not be null");
    this.config = requireNonNull(config, "config must not be null");
    this.eventSink = new BrokerEventSink(client, config);
    this.configPublisher = new BrokerConfigPublisher(client, config, topics, metadata);
  }

  /**
   * Connects to the broker and starts mirroring both channels. Calling it again once started does
   * nothing.
   *
   * @return {@code true} if the bridge is started, {@code false} if the connection failed
   */
  public boolean start() {
    synchronized (lock) {
      if (started) {
        return true;
      }
      if (!eventSink.connect()) {
        logger.warn("Broker bridge not started: cannot connect to {}:{}", config.host(), config.port());
        return false;
      }
      context.slicingEvents().addSink(eventSink);
      configPublisher.registerWith(context.configChanges());
      started = true;
      logger.info("Broker bridge started on {}:{} with topic prefix '{}'", config.host(), config.port(), config.topicPrefix());
      return true;
    }
  }

  /**
   * Unregisters from both channels and disconnects. Does nothing when not started.
   */
  public void stop() {
    synchronized (lock) {
      if (!started) {
        return;
      }
      context.slicingEvents().removeSink(eventSink);
      configPublisher.unregisterFrom(context.configChanges());
      eventSink.disconnect();
      started = false;
      logger.info("Broker bridge stopped");
    }
  }

  public boolean isStarted() {
    synchronized (lock) {
      return started;
    }
  }

  /**
   * Publishes the current value of every option. Skipped, with a warning, when the bridge is not
   * started or the connection was lost.
   *
   * @param options the current value of every option
   * @return the number of documents published
   */
  public int publishFullConfig(Map<String, ConfigValue> options) {
    if (!isStarted()) {
      logger.warn("Cannot publish full config: broker bridge not started");
      return 0;
    }
    return configPublisher.publishAll(options);
  }

  BrokerEventSink eventSink() {
    return eventSink;
  }

  BrokerConfigPublisher configPublisher() {
    return configPublisher;
  }
}
