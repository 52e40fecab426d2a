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
package com.corvusprint.slicer.events.adapters.polling;

import com.corvusprint.slicer.events.CompletionInfo;
import com.corvusprint.slicer.events.SlicingEventDispatcher;
import com.corvusprint.slicer.events.SlicingStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PollingEventSinkTest {

  private PollingEventSink sink;

  @BeforeEach
  void setUp() {
    sink = new PollingEventSink();
  }

  @Test
  @DisplayName("should report an empty status before any event")
  void should_report_initial_status() {
    // When
    var snapshot = sink.snapshot();

    // Then
    assertThat(snapshot.status()).isEqualTo(SlicingStatus.of(0, ""));
    assertThat(snapshot.hasCompleted()).isFalse();
    assertThat(snapshot.completion()).isNull();
    assertThat(sink.statusJson()).isEqualTo("{\"percent\":0,\"message\":\"\",\"flags\":0,\"warning_step\":0}");
  }

  @Test
  @DisplayName("should reflect the latest status and the failed completion received through a dispatcher")
  void should_reflect_latest_status_and_completion() {
    // Given
    var dispatcher = new SlicingEventDispatcher();
    dispatcher.addSink(sink);

    // When
    dispatcher.onSlicingUpdate(SlicingStatus.of(42, "slicing layer 10"));

    // Then
    assertThat(sink.snapshot().status()).isEqualTo(SlicingStatus.of(42, "slicing layer 10"));
    assertThat(sink.snapshot().hasCompleted()).isFalse();

    // When
    dispatcher.onProcessFinished(CompletionInfo.error("mesh not manifold"));

    // Then
    var snapshot = sink.snapshot();
    assertThat(snapshot.hasCompleted()).isTrue();
    assertThat(snapshot.completion().status()).isEqualTo(CompletionInfo.Status.ERROR);
    assertThat(snapshot.status().percent()).isEqualTo(42);
    assertThat(sink.statusJson())
      .isEqualTo("{\"percent\":42,\"message\":\"slicing layer 10\",\"flags\":0,\"warning_step\":0," +
                 "\"completed\":{\"status\":\"error\",\"error_message\":\"mesh not manifold\"}}");
  }

  @Test
  @DisplayName("should keep the completion across status updates until reset")
  void should_keep_completion_until_reset() {
    // Given
    sink.onProcessFinished(CompletionInfo.finished());

    // When
    sink.onSlicingUpdate(SlicingStatus.of(5, "new run"));

    // Then
    assertThat(sink.snapshot().hasCompleted()).isTrue();

    // When
    sink.resetCompletion();

    // Then
    assertThat(sink.snapshot().hasCompleted()).isFalse();
    assertThat(sink.snapshot().status().percent()).isEqualTo(5);
  }

  @Test
  @DisplayName("should return to the initial state on reset")
  void should_return_to_initial_state_on_reset() {
    // Given
    sink.onSlicingUpdate(SlicingStatus.of(80, "generating g-code"));
    sink.onProcessFinished(CompletionInfo.cancelled());

    // When
    sink.reset();

    // Then
    assertThat(sink.snapshot()).isEqualTo(new StatusSnapshot(SlicingStatus.of(0, ""), false, null));
  }

  @Test
  @DisplayName("should ignore export events")
  void should_ignore_export_events() {
    // When
    sink.onExportBegan();
    sink.onExportFinished("/tmp/benchy.gcode");
    sink.onSlicingCompleted(1712);

    // Then
    assertThat(sink.snapshot()).isEqualTo(new StatusSnapshot(SlicingStatus.of(0, ""), false, null));
  }

  @Test
  @DisplayName("should reject an inconsistent snapshot")
  void should_reject_inconsistent_snapshot() {
    // When - Then
    assertThatThrownBy(() -> new StatusSnapshot(SlicingStatus.of(0, ""), true, null))
      .isInstanceOf(IllegalArgumentException.class);
  }
}
