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

import com.corvusprint.slicer.events.CompletionInfo;
import com.corvusprint.slicer.events.ExportInfo;
import com.corvusprint.slicer.events.SlicingEventSink;
import com.corvusprint.slicer.events.SlicingStatus;
import com.corvusprint.slicer.events.adapters.json.EventJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * {@link SlicingEventSink} publishing every event as a JSON document to a message broker.
 * <p>
 * Topics, relative to {@link BrokerConfig#topicPrefix()}:
 * <table>
 *   <caption>Published topics</caption>
 *   <tr><th>Topic</th><th>Event</th><th>Retained</th></tr>
 *   <tr><td>{@value #STATUS_TOPIC}</td><td>{@link #onSlicingUpdate(SlicingStatus)}</td><td>no</td></tr>
 *   <tr><td>{@value #SLICING_COMPLETED_TOPIC}</td><td>{@link #onSlicingCompleted(int)}</td><td>no</td></tr>
 *   <tr><td>{@value #FINISHED_TOPIC}</td><td>{@link #onProcessFinished(CompletionInfo)}</td><td>yes</td></tr>
 *   <tr><td>{@value #EXPORT_BEGAN_TOPIC}</td><td>{@link #onExportBegan()}</td><td>no</td></tr>
 *   <tr><td>{@value #EXPORT_FINISHED_TOPIC}</td><td>{@link #onExportFinished(String)}</td><td>no</td></tr>
 * </table>
 * The completion is retained so that a subscriber joining after the run still learns its outcome.
 * An export finished without a path is published as {@code {"phase":"finished"}}.
 *
 * <h2>Failure Handling</h2>
 * <p>
 * Publishing is best effort. An event arriving while the client is disconnected is dropped, and a
 * rejected or failing publish is logged; the producer never sees a transport fault.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Stateless apart from the client; thread safety is the client's.
 */
public final class BrokerEventSink implements SlicingEventSink {

  private static final Logger logger = LoggerFactory.getLogger(BrokerEventSink.class);

  public static final String STATUS_TOPIC = "status";
  public static final String SLICING_COMPLETED_TOPIC = "slicing_completed";
  public static final String FINISHED_TOPIC = "finished";
  public static final String EXPORT_BEGAN_TOPIC = "export/began";
  public static final String EXPORT_FINISHED_TOPIC = "export/finished";

  private final BrokerClient client;
  private final BrokerConfig config;

  public BrokerEventSink(BrokerClient client, BrokerConfig config) {
    this.client = requireNonNull(client, "client must not be null");
    this.config = requireNonNull(config, "config must not be null");
  }

  /**
   * Connects the underlying client.
   *
   * @return {@code true} if the connection is established
   */
  public boolean connect() {
    try {
      boolean connected = client.connect(config);
      if (connected) {
        logger.info("Connected to broker {}:{} as {}", config.host(), config.port(), config.clientId());
      } else {
        logger.warn("Failed to connect to broker {}:{}", config.host(), config.port());
      }
      return connected;
    } catch (RuntimeException e) {
      logger.warn("Failed to connect to broker {}:{}", config.host(), config.port(), e);
      return false;
    }
  }

  public void disconnect() {
    try {
      client.disconnect();
      logger.info("Disconnected from broker {}:{}", config.host(), config.port());
    } catch (RuntimeException e) {
      logger.warn("Error while disconnecting from broker {}:{}", config.host(), config.port(), e);
    }
  }

  public boolean isConnected() {
    return client.isConnected();
  }

  @Override
  public void onSlicingUpdate(SlicingStatus status) {
    publish(STATUS_TOPIC, EventJson.status(status), false);
  }

  @Override
  public void onSlicingCompleted(int timestamp) {
    publish(SLICING_COMPLETED_TOPIC, EventJson.slicingCompleted(timestamp), false);
  }

  @Override
  public void onProcessFinished(CompletionInfo info) {
    publish(FINISHED_TOPIC, EventJson.completion(info), true);
  }

  @Override
  public void onExportBegan() {
    publish(EXPORT_BEGAN_TOPIC, EventJson.export(ExportInfo.began()), false);
  }

  @Override
  public void onExportFinished(String path) {
    if (path == null) {
      logger.warn("Export finished without a path, publishing it without one");
    }
    publish(EXPORT_FINISHED_TOPIC, EventJson.exportFinished(path), false);
  }

  boolean publish(String relativeTopic, String payload, boolean retained) {
    return BrokerPublishing.publish(client, config, relativeTopic, payload, retained);
  }

  @Override
  public String toString() {
    return "BrokerEventSink{" +
      "broker=" + config.host() + ':' + config.port() +
      ", topicPrefix='" + config.topicPrefix() + '\'' +
      '}';
  }
}
