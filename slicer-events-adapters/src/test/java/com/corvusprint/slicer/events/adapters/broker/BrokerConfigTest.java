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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static com.corvusprint.slicer.events.adapters.broker.BrokerConfig.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BrokerConfigTest {

  @Test
  @DisplayName("should apply defaults")
  void should_apply_defaults() {
    // When
    var config = BrokerConfig.defaults();

    // Then
    assertThat(config.host()).isEqualTo("localhost");
    assertThat(config.port()).isEqualTo(1883);
    assertThat(config.clientId()).isEqualTo("corvusprint-slicer");
    assertThat(config.topicPrefix()).isEqualTo("slicer/");
    assertThat(config.qos()).isEqualTo(1);
    assertThat(config.keepAlive()).isEqualTo(Duration.ofSeconds(60));
    assertThat(config.useTls()).isFalse();
    assertThat(config.username()).isNull();
    assertThat(config.topic("status")).isEqualTo("slicer/status");
  }

  @Test
  @DisplayName("should reject invalid settings on build")
  void should_reject_invalid_settings() {
    // When - Then
    assertThatThrownBy(() -> BrokerConfig.builder().host(" ").build())
      .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("host");
    assertThatThrownBy(() -> BrokerConfig.builder().port(65536).build())
      .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("port");
    assertThatThrownBy(() -> BrokerConfig.builder().qos(3).build())
      .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("qos");
    assertThatThrownBy(() -> BrokerConfig.builder().keepAlive(Duration.ZERO).build())
      .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("keepAlive");
    assertThatThrownBy(() -> BrokerConfig.builder().password("secret").build())
      .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("username");
  }

  @Test
  @DisplayName("should read every setting from the environment")
  void should_read_settings_from_environment() {
    // Given
    var environment = Map.of(
      ENV_ADDRESS, "mqtt://192.168.1.100:1884",
      ENV_CLIENT_ID, "farm-node-3",
      ENV_TOPIC_PREFIX, "farm/node3/",
      ENV_USERNAME, "slicer",
      ENV_PASSWORD, "secret",
      ENV_QOS, "2",
      ENV_KEEP_ALIVE_SECONDS, "30");

    // When
    var config = BrokerConfig.fromEnvironment(environment);

    // Then
    assertThat(config.host()).isEqualTo("192.168.1.100");
    assertThat(config.port()).isEqualTo(1884);
    assertThat(config.clientId()).isEqualTo("farm-node-3");
    assertThat(config.topicPrefix()).isEqualTo("farm/node3/");
    assertThat(config.username()).isEqualTo("slicer");
    assertThat(config.password()).isEqualTo("secret");
    assertThat(config.qos()).isEqualTo(2);
    assertThat(config.keepAlive()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.useTls()).isFalse();
    assertThat(config.toString()).doesNotContain("secret");
  }

  @Test
  @DisplayName("should fall back to the default address when none is configured")
  void should_fall_back_to_default_address() {
    // When
    var config = BrokerConfig.fromEnvironment(Map.of(ENV_CLIENT_ID, "standalone"));

    // Then
    assertThat(config.host()).isEqualTo(DEFAULT_HOST);
    assertThat(config.port()).isEqualTo(DEFAULT_PORT);
    assertThat(config.clientId()).isEqualTo("standalone");
  }

  @Test
  @DisplayName("should enable tls from the scheme, unless explicitly disabled")
  void should_enable_tls_from_scheme() {
    // When
    var fromScheme = BrokerConfig.fromEnvironment(Map.of(ENV_ADDRESS, "mqtts://broker:8883"));
    var overridden = BrokerConfig.fromEnvironment(Map.of(ENV_ADDRESS, "mqtts://broker:8883", ENV_USE_TLS, "false"));

    // Then
    assertThat(fromScheme.useTls()).isTrue();
    assertThat(overridden.useTls()).isFalse();
  }

  @Test
  @DisplayName("should default to the tls port when a tls address has no port")
  void should_default_to_tls_port_when_tls_address_has_no_port() {
    // When
    var mqtts = BrokerConfig.fromEnvironment(Map.of(ENV_ADDRESS, "mqtts://broker"));
    var ssl = BrokerConfig.fromEnvironment(Map.of(ENV_ADDRESS, "ssl://broker"));
    var plain = BrokerConfig.fromEnvironment(Map.of(ENV_ADDRESS, "mqtt://broker"));

    // Then
    assertThat(mqtts.port()).isEqualTo(DEFAULT_TLS_PORT);
    assertThat(mqtts.useTls()).isTrue();
    assertThat(ssl.port()).isEqualTo(8883);
    assertThat(plain.port()).isEqualTo(DEFAULT_PORT);
    assertThat(plain.useTls()).isFalse();
  }

  @Test
  @DisplayName("should report invalid environment values")
  void should_report_invalid_environment_values() {
    // When - Then
    assertThatThrownBy(() -> BrokerConfig.fromEnvironment(Map.of(ENV_QOS, "high")))
      .isInstanceOf(SlicerEventsException.class)
      .hasMessageContaining(ENV_QOS);
    assertThatThrownBy(() -> BrokerConfig.fromEnvironment(Map.of(ENV_USE_TLS, "maybe")))
      .isInstanceOf(SlicerEventsException.class)
      .hasMessageContaining(ENV_USE_TLS);
    assertThatThrownBy(() -> BrokerConfig.fromEnvironment(Map.of(ENV_ADDRESS, "http://broker:1883")))
      .isInstanceOf(SlicerEventsException.class);
    assertThatThrownBy(() -> BrokerConfig.fromEnvironment(Map.of(ENV_PASSWORD, "secret")))
      .isInstanceOf(SlicerEventsException.class)
      .hasMessageContaining("username");
  }
}
