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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort publish shared by the broker adapters: drops the document when disconnected, never
 * throws.
 */
final class BrokerPublishing {

  private static final Logger logger = LoggerFactory.getLogger(BrokerPublishing.class);

  private BrokerPublishing() {
  }

  static boolean publish(BrokerClient client, BrokerConfig config, String relativeTopic, String payload, boolean retained) {
    var topic = config.topic(relativeTopic);
    try {
      if (!client.isConnected()) {
        logger.debug("Not connected, dropping message for {}", topic);
        return false;
      }
      boolean accepted = client.publish(topic, payload, config.qos(), retained);
      if (!accepted) {
        logger.warn("Broker client rejected message for {}", topic);
      }
      return accepted;
    } catch (RuntimeException e) {
      logger.warn("Failed to publish message for {}", topic, e);
      return false;
    }
  }
}
