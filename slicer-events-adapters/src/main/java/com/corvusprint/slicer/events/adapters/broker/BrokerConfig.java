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
import com.corvusprint.slicer.events.adapters.internal.AddressResolver;
import com.google.common.net.HostAndPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Immutable configuration for connecting to a message broker and naming the published topics.
 * <p>
 * Create instances using the builder pattern, or from environment variables with
 * {@link #fromEnvironment(Map)}.
 *
 * <h2>Environment Variables</h2>
 * <table>
 *   <caption>Variables read by {@link #fromEnvironment(Map)}</caption>
 *   <tr><th>Variable</th><th>Meaning</th><th>Default</th></tr>
 *   <tr><td>{@value #ENV_ADDRESS}</td><td>{@code host[:port]}, optional scheme {@code mqtt://},
 *       {@code tcp://}, {@code mqtts://} or {@code ssl://}; without a port, 1883, or 8883 for a TLS scheme</td><td>{@code localhost:1883}</td></tr>
 *   <tr><td>{@value #ENV_CLIENT_ID}</td><td>client identifier</td><td>{@code corvusprint-slicer}</td></tr>
 *   <tr><td>{@value #ENV_TOPIC_PREFIX}</td><td>prefix of every topic</td><td>{@code slicer/}</td></tr>
 *   <tr><td>{@value #ENV_USERNAME}</td><td>user name</td><td>none</td></tr>
 *   <tr><td>{@value #ENV_PASSWORD}</td><td>password, requires a user name</td><td>none</td></tr>
 *   <tr><td>{@value #ENV_QOS}</td><td>quality of service, 0 to 2</td><td>{@code 1}</td></tr>
 *   <tr><td>{@value #ENV_USE_TLS}</td><td>{@code true} to connect over TLS</td><td>{@code false}</td></tr>
 *   <tr><td>{@value #ENV_KEEP_ALIVE_SECONDS}</td><td>keep-alive interval in seconds</td><td>{@code 60}</td></tr>
 * </table>
 *
 * @see BrokerClient
 */
public final class BrokerConfig {

  private static final Logger logger = LoggerFactory.getLogger(BrokerConfig.class);

  public static final String ENV_ADDRESS = "Slicer__Broker__Address";
  public static final String ENV_CLIENT_ID = "Slicer__Broker__ClientId";
  public static final String ENV_TOPIC_PREFIX = "Slicer__Broker__TopicPrefix";
  public static final String ENV_USERNAME = "Slicer__Broker__Username";
  public static final String ENV_PASSWORD = "Slicer__Broker__Password";
  public static final String ENV_QOS = "Slicer__Broker__Qos";
  public static final String ENV_USE_TLS = "Slicer__Broker__UseTls";
  public static final String ENV_KEEP_ALIVE_SECONDS = "Slicer__Broker__KeepAliveSeconds";

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 1883;
  public static final int DEFAULT_TLS_PORT = 8883;
  public static final String DEFAULT_CLIENT_ID = "corvusprint-slicer";
  public static final String DEFAULT_TOPIC_PREFIX = "slicer/";
  public static final int DEFAULT_QOS = 1;
  public static final Duration DEFAULT_KEEP_ALIVE = Duration.ofSeconds(60);

  private final String host;
  private final int port;
  private final String clientId;
  private final String topicPrefix;
  private final String username;
  private final String password;
  private final int qos;
  private final boolean useTls;
  private final Duration keepAlive;

  private BrokerConfig(Builder builder) {
    this.host = builder.host;
    this.port = builder.port;
    this.clientId = builder.clientId;
    this.topicPrefix = builder.topicPrefix;
    this.username = builder.username;
    this.password = builder.password;
    this.qos = builder.qos;
    this.useTls = builder.useTls;
    this.keepAlive = builder.keepAlive;
  }

  /**
   * Returns a configuration with every default applied.
   *
   * @return the default configuration
   */
  public static BrokerConfig defaults() {
    return builder().build();
  }

  /**
   * Creates a new builder for constructing a {@link BrokerConfig}.
   *
   * @return a new builder instance
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads the configuration from environment variables.
   * <p>
   * Pass {@code System.getenv()} in production; tests pass their own map. Variables that are absent
   * or blank keep their default. When no address is configured, the default address is used and a
   * warning is logged.
   *
   * @param environment the environment variables
   * @return the configuration
   * @throws SlicerEventsException if a variable holds an invalid value
   */
  public static BrokerConfig fromEnvironment(Map<String, String> environment) {
    requireNonNull(environment, "environment must not be null");
    var builder = builder();

    var rawAddress = environment.get(ENV_ADDRESS);
    try {
      boolean tls = AddressResolver.isTlsScheme(rawAddress);
      var address = AddressResolver.resolve(rawAddress, tls ? DEFAULT_TLS_PORT : DEFAULT_PORT);
      if (address.isPresent()) {
        builder.address(address.get());
        builder.useTls(tls);
      } else {
        logger.warn("{} is not set, falling back to {}:{}", ENV_ADDRESS, DEFAULT_HOST, DEFAULT_PORT);
      }

      valueOf(environment, ENV_CLIENT_ID).ifPresent(builder::clientId);
      valueOf(environment, ENV_TOPIC_PREFIX).ifPresent(builder::topicPrefix);
      valueOf(environment, ENV_USERNAME).ifPresent(builder::username);
      valueOf(environment, ENV_PASSWORD).ifPresent(builder::password);
      valueOf(environment, ENV_QOS).map(v -> parseInt(ENV_QOS, v)).ifPresent(builder::qos);
      valueOf(environment, ENV_USE_TLS).map(v -> parseBoolean(ENV_USE_TLS, v)).ifPresent(builder::useTls);
      valueOf(environment, ENV_KEEP_ALIVE_SECONDS)
        .map(v -> Duration.ofSeconds(parseInt(ENV_KEEP_ALIVE_SECONDS, v)))
        .ifPresent(builder::keepAlive);

      return builder.build();
    } catch (IllegalArgumentException e) {
      throw new SlicerEventsException("Invalid broker configuration in environment: " + e.getMessage(), e);
    }
  }

  private static Optional<String> valueOf(Map<String, String> environment, String name) {
    var value = environment.get(name);
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
  }

  private static int parseInt(String name, String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be an integer, got: " + value, e);
    }
  }

  private static boolean parseBoolean(String name, String value) {
    switch (value.toLowerCase(Locale.ROOT)) {
      case "true":
      case "1":
      case "yes":
        return true;
      case "false":
      case "0":
      case "no":
        return false;
      default:
        throw new IllegalArgumentException(name + " must be a boolean, got: " + value);
    }
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  public String clientId() {
    return clientId;
  }

  /**
   * Returns the prefix prepended to every published topic, trailing separator included.
   *
   * @return the topic prefix (e.g. {@code "slicer/"})
   */
  public String topicPrefix() {
    return topicPrefix;
  }

  /**
   * @return the user name, or {@code null} for anonymous connections
   */
  public String username() {
    return username;
  }

  /**
   * @return the password, or {@code null} if none
   */
  public String password() {
    return password;
  }

  public int qos() {
    return qos;
  }

  public boolean useTls() {
    return useTls;
  }

  public Duration keepAlive() {
    return keepAlive;
  }

  /**
   * Prepends the topic prefix to a relative topic.
   *
   * @param relativeTopic topic relative to the prefix (e.g. {@code "status"})
   * @return the full topic
   */
  public String topic(String relativeTopic) {
    return topicPrefix + relativeTopic;
  }

  @Override
  public String toString() {
    return "BrokerConfig{" +
      "host='" + host + '\'' +
      ", port=" + port +
      ", clientId='" + clientId + '\'' +
      ", topicPrefix='" + topicPrefix + '\'' +
      ", username='" + username + '\'' +
      ", password='" + (password != null ? "***" : null) + '\'' +
      ", qos=" + qos +
      ", useTls=" + useTls +
      ", keepAlive=" + keepAlive +
      '}';
  }

  /**
   * Builder for {@link BrokerConfig}.
   * <p>
   * Use fluent methods to configure the connection parameters, then call {@link #build()}
   * to create an immutable configuration instance.
   */
  public static final class Builder {
    private String host = DEFAULT_HOST;
    private int port = DEFAULT_PORT;
    private String clientId = DEFAULT_CLIENT_ID;
    private String topicPrefix = DEFAULT_TOPIC_PREFIX;
    private String username;
    private String password;
    private int qos = DEFAULT_QOS;
    private boolean useTls;
    private Duration keepAlive = DEFAULT_KEEP_ALIVE;

    private Builder() {
    }

    public Builder host(String host) {
      this.host = host;
      return this;
    }

    public Builder port(int port) {
      this.port = port;
      return this;
    }

    /**
     * Sets host and port from a parsed address.
     *
     * @param address the broker address; must carry a port
     * @return this builder
     */
    public Builder address(HostAndPort address) {
      requireNonNull(address, "address must not be null");
      this.host = address.getHost();
      this.port = address.getPort();
      return this;
    }

    public Builder clientId(String clientId) {
      this.clientId = clientId;
      return this;
    }

    /**
     * Sets the prefix prepended to every topic. An empty prefix publishes at the root.
     *
     * @param topicPrefix the prefix, usually ending with {@code /}
     * @return this builder
     */
    public Builder topicPrefix(String topicPrefix) {
      this.topicPrefix = topicPrefix;
      return this;
    }

    public Builder username(String username) {
      this.username = username;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    /**
     * Sets the quality of service used for every publish.
     *
     * @param qos 0 (at most once), 1 (at least once) or 2 (exactly once)
     * @return this builder
     */
    public Builder qos(int qos) {
      this.qos = qos;
      return this;
    }

    public Builder useTls(boolean useTls) {
      this.useTls = useTls;
      return this;
    }

    public Builder keepAlive(Duration keepAlive) {
      this.keepAlive = keepAlive;
      return this;
    }

    /**
     * Builds the immutable {@link BrokerConfig} instance.
     * <p>
     * Validates that the configuration is consistent and all required fields are set.
     *
     * @return a new {@link BrokerConfig} instance
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public BrokerConfig build() {
      validate();
      return new BrokerConfig(this);
    }

    private void validate() {
      if (host == null || host.isBlank())
        throw new IllegalArgumentException("host is required");

      if (port < 0 || port > 65535)
        throw new IllegalArgumentException("port must be between 0 and 65535, got: " + port);

      if (clientId == null || clientId.isBlank())
        throw new IllegalArgumentException("clientId is required");

      if (topicPrefix == null)
        throw new IllegalArgumentException("topicPrefix must not be null");

      if (qos < 0 || qos > 2)
        throw new IllegalArgumentException("qos must be 0, 1 or 2, got: " + qos);

      if (keepAlive == null || keepAlive.isZero() || keepAlive.isNegative())
        throw new IllegalArgumentException("keepAlive must be positive");

      if (password != null && username == null)
        throw new IllegalArgumentException("username is required when password is specified");
    }
  }
}
