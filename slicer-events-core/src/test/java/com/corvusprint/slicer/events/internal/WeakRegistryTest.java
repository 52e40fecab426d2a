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
package com.corvusprint.slicer.events.internal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.ref.WeakReference;
import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class WeakRegistryTest {

  private WeakRegistry<Object> registry;

  @BeforeEach
  void setUp() {
    registry = new WeakRegistry<>();
  }

  @Test
  @DisplayName("should visit live targets in registration order")
  void should_visit_live_targets_in_order() {
    // Given
    var first = new Object();
    var second = new Object();
    registry.add(first);
    registry.add(second);

    // When
    var visited = new ArrayList<>();
    registry.forEach(visited::add);

    // Then
    assertThat(visited).containsExactly(first, second);
  }

  @Test
  @DisplayName("should prune a cleared reference on the first visit only")
  void should_prune_cleared_reference_on_first_visit() {
    // Given
    var kept = new Object();
    var released = new Object();
    var releasedRef = new WeakReference<>(released);
    registry.add(kept);
    registry.add(releasedRef);
    registry.add(new WeakReference<>(kept));
    releasedRef.clear();

    // When
    var visited = new ArrayList<>();
    registry.forEach(visited::add);

    // Then
    assertThat(visited).containsExactly(kept, kept);
    assertThat(registry.size()).isEqualTo(2);
  }

  @Test
  @DisplayName("should keep counting a stale entry until a visit observes it")
  void should_count_stale_entry_until_visited() {
    // Given
    var ref = new WeakReference<Object>(new Object());
    registry.add(ref);
    ref.clear();

    // Then
    assertThat(registry.size()).isEqualTo(1);

    // When
    registry.forEach(target -> {});

    // Then
    assertThat(registry.size()).isZero();
  }

  @Test
  @DisplayName("should remove every registration of a target")
  void should_remove_every_registration_of_target() {
    // Given
    var target = new Object();
    var other = new Object();
    registry.add(target);
    registry.add(other);
    registry.add(target);

    // When
    int removed = registry.removeAll(target);

    // Then
    assertThat(removed).isEqualTo(2);
    var visited = new ArrayList<>();
    registry.forEach(visited::add);
    assertThat(visited).containsExactly(other);
  }
}
