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

import com.corvusprint.slicer.events.FaultPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.ref.Reference;
import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class ConfigChangeDispatcherTest {

  private ConfigChangeDispatcher dispatcher;
  private List<String> deliveries;

  @BeforeEach
  void setUp() {
    dispatcher = new ConfigChangeDispatcher();
    deliveries = new ArrayList<>();
  }

  @Test
  @DisplayName("should deliver to listeners first, then to callbacks, each in registration order")
  void should_deliver_listeners_then_callbacks() {
    // Given
    ConfigChangeListener first = (key, value) -> deliveries.add("listener-1:" + key);
    ConfigChangeListener second = (key, value) -> deliveries.add("listener-2:" + key);
    dispatcher.addCallback((key, value) -> deliveries.add("callback-1:" + key));
    dispatcher.addListener(first);
    dispatcher.addCallback((key, value) -> deliveries.add("callback-2:" + key));
    dispatcher.addListener(second);

    // When
    dispatcher.notifyChange("fill_density", ConfigValue.of("15%"));

    // Then
    assertThat(deliveries).containsExactly("listener-1:fill_density",
                                           "listener-2:fill_density",
                                           "callback-1:fill_density",
                                           "callback-2:fill_density");
    Reference.reachabilityFence(first);
    Reference.reachabilityFence(second);
  }

  @Test
  @DisplayName("should deliver only to the callback and prune the listener once its owner released it")
  void should_prune_released_listener() {
    // Given
    ConfigChangeListener listener = (key, value) -> deliveries.add("listener");
    var reference = new WeakReference<>(listener);
    dispatcher.addListener(reference);
    BiConsumer<String, ConfigValue> callback = mock(BiConsumer.class);
    dispatcher.addCallback(callback);
    reference.clear();

    // When
    dispatcher.notifyChange("layer_height", ConfigValue.of(0.2));

    // Then
    assertThat(deliveries).isEmpty();
    verify(callback).accept("layer_height", ConfigValue.of(0.2));
    assertThat(dispatcher.listenerCount()).isZero();
    assertThat(dispatcher.callbackCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("should resolve a stale listener only once across notifications")
  void should_not_resolve_pruned_listener_again() {
    // Given
    var reference = new CountingReference(mock(ConfigChangeListener.class));
    dispatcher.addListener(reference);
    reference.clear();

    // When
    dispatcher.notifyChange("perimeters", ConfigValue.of(3));
    dispatcher.notifyChange("perimeters", ConfigValue.of(4));

    // Then
    assertThat(reference.resolutions).isEqualTo(1);
    assertThat(dispatcher.listenerCount()).isZero();
  }

  @Test
  @DisplayName("should keep a listener alive only as long as its owner does")
  void should_forget_listener_when_owner_drops_it() throws InterruptedException {
    // Given
    var received = new ArrayList<String>();
    var reference = registerListenerWithoutOwner(received);

    // When
    for (int attempt = 0; attempt < 50 && reference.get() != null; attempt++) {
      System.gc();
      Thread.sleep(20);
    }
    dispatcher.notifyChange("infill_speed", ConfigValue.of(90.0));

    // Then
    assertThat(reference.get()).isNull();
    assertThat(received).containsExactly("infill_speed");
    assertThat(dispatcher.listenerCount()).isZero();
  }

  @Test
  @DisplayName("should drop notifications while disabled and resume once enabled again")
  void should_gate_delivery_on_enabled_flag() {
    // Given
    var listener = mock(ConfigChangeListener.class);
    BiConsumer<String, ConfigValue> callback = mock(BiConsumer.class);
    var stale = new CountingReference(mock(ConfigChangeListener.class));
    dispatcher.addListener(listener);
    dispatcher.addListener(stale);
    dispatcher.addCallback(callback);
    stale.clear();

    // When
    dispatcher.setEnabled(false);
    dispatcher.notifyChange("support_material", ConfigValue.of(true));

    // Then
    assertThat(dispatcher.isEnabled()).isFalse();
    verifyNoInteractions(listener, callback);
    assertThat(stale.resolutions).isZero();
    assertThat(dispatcher.listenerCount()).isEqualTo(2);

    // When
    dispatcher.setEnabled(true);
    dispatcher.notifyChange("support_material", ConfigValue.of(false));

    // Then
    verify(listener).onConfigChange("support_material", ConfigValue.of(false));
    verify(callback).accept("support_material", ConfigValue.of(false));
    assertThat(dispatcher.listenerCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("should deliver twice to a listener registered twice")
  void should_deliver_twice_to_duplicate_listener() {
    // Given
    var listener = mock(ConfigChangeListener.class);
    dispatcher.addListener(listener);
    dispatcher.addListener(listener);

    // When
    dispatcher.notifyChange("wall_loops", ConfigValue.of(2));

    // Then
    verify(listener, times(2)).onConfigChange("wall_loops", ConfigValue.of(2));
  }

  @Test
  @DisplayName("should stop delivering to a removed listener and accept it again afterwards")
  void should_remove_and_register_listener_again() {
    // Given
    var listener = mock(ConfigChangeListener.class);
    dispatcher.addListener(listener);
    dispatcher.addListener(listener);

    // When
    boolean removed = dispatcher.removeListener(listener);
    dispatcher.notifyChange("seam_position", ConfigValue.of("aligned"));

    // Then
    assertThat(removed).isTrue();
    assertThat(dispatcher.removeListener(listener)).isFalse();
    verifyNoInteractions(listener);

    // When
    dispatcher.addListener(listener);
    dispatcher.notifyChange("seam_position", ConfigValue.of("rear"));

    // Then
    verify(listener).onConfigChange("seam_position", ConfigValue.of("rear"));
  }

  @Test
  @DisplayName("should remove listeners and callbacks on clear, idempotently")
  void should_clear_everything() {
    // Given
    var listener = mock(ConfigChangeListener.class);
    BiConsumer<String, ConfigValue> callback = mock(BiConsumer.class);
    dispatcher.addListener(listener);
    dispatcher.addCallback(callback);

    // When
    dispatcher.clear();
    dispatcher.clear();
    dispatcher.notifyChange("bed_temperature", ConfigValue.of(60));

    // Then
    assertThat(dispatcher.listenerCount()).isZero();
    assertThat(dispatcher.callbackCount()).isZero();
    verifyNoInteractions(listener, callback);
  }

  @Test
  @DisplayName("should ignore null registrations")
  void should_ignore_null_registrations() {
    // When
    dispatcher.addListener((ConfigChangeListener) null);
    dispatcher.addListener((WeakReference<ConfigChangeListener>) null);
    dispatcher.addCallback(null);

    // Then
    assertThat(dispatcher.listenerCount()).isZero();
    assertThat(dispatcher.callbackCount()).isZero();
    assertThat(dispatcher.removeListener(null)).isFalse();
  }

  @Test
  @DisplayName("should reject a null key or value")
  void should_reject_null_key_or_value() {
    // When - Then
    assertThatThrownBy(() -> dispatcher.notifyChange(null, ConfigValue.of(1)))
      .isInstanceOf(NullPointerException.class)
      .hasMessageContaining("key");
    assertThatThrownBy(() -> dispatcher.notifyChange("layer_height", null))
      .isInstanceOf(NullPointerException.class)
      .hasMessageContaining("value");
  }

  @Test
  @DisplayName("should propagate a listener failure and skip the remaining targets by default")
  void should_propagate_listener_failure_by_default() {
    // Given
    ConfigChangeListener faulty = (key, value) -> {
      throw new IllegalStateException("listener failure");
    };
    BiConsumer<String, ConfigValue> callback = mock(BiConsumer.class);
    dispatcher.addListener(faulty);
    dispatcher.addCallback(callback);

    // When - Then
    assertThatThrownBy(() -> dispatcher.notifyChange("brim_width", ConfigValue.of(5.0)))
      .isInstanceOf(IllegalStateException.class)
      .hasMessage("listener failure");
    verifyNoInteractions(callback);
    Reference.reachabilityFence(faulty);
  }

  @Test
  @DisplayName("should keep delivering after a listener failure under the isolate policy")
  void should_isolate_listener_failure() {
    // Given
    var isolating = new ConfigChangeDispatcher(FaultPolicy.ISOLATE);
    ConfigChangeListener faulty = (key, value) -> {
      throw new IllegalStateException("listener failure");
    };
    BiConsumer<String, ConfigValue> callback = mock(BiConsumer.class);
    isolating.addListener(faulty);
    isolating.addCallback(callback);

    // When
    isolating.notifyChange("brim_width", ConfigValue.of(5.0));

    // Then
    verify(callback).accept("brim_width", ConfigValue.of(5.0));
    assertThat(isolating.faultPolicy()).isEqualTo(FaultPolicy.ISOLATE);
  }

  private WeakReference<ConfigChangeListener> registerListenerWithoutOwner(List<String> received) {
    ConfigChangeListener listener = (key, value) -> received.add(key);
    dispatcher.addListener(listener);
    dispatcher.notifyChange("infill_speed", ConfigValue.of(80.0));
    return new WeakReference<>(listener);
  }

  private static final class CountingReference extends WeakReference<ConfigChangeListener> {
    private int resolutions;

    private CountingReference(ConfigChangeListener referent) {
      super(referent);
    }

    @Override
    public ConfigChangeListener get() {
      resolutions++;
      return super.get();
    }
  }
}
