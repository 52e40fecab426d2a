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

/**
 * Transport used to publish documents to a publish/subscribe message broker.
 * <p>
 * Implementations wrap a concrete client library (MQTT or any broker with topics, quality of service
 * and retained messages). Adapters of this package hold one client and never assume more than this
 * contract:
 * <ul>
 *   <li>{@link #publish(String, String, int, boolean)} reports failures through its return value and
 *       is only attempted while {@link #isConnected()} is {@code true};</li>
 *   <li>every method may be called from any thread.</li>
 * </ul>
 * Implementations may still throw unchecked exceptions; adapters log and swallow them.
 */
public interface BrokerClient {

  /**
   * Opens the connection described by {@code config}.
   *
   * @param config host, port, credentials, TLS and keep-alive to use
   * @return {@code true} if the connection is established
   */
  boolean connect(BrokerConfig config);

  /**
   * Closes the connection. Does nothing when not connected.
   */
  void disconnect();

  boolean isConnected();

  /**
   * Publishes one document.
   *
   * @param topic    the full topic, prefix included
   * @param payload  the UTF-8 text payload
   * @param qos      quality of service, 0 to 2
   * @param retained whether the broker keeps the document for late subscribers
   * @return {@code true} if the client accepted the document
   */
  boolean publish(String topic, String payload, int qos, boolean retained);
}
