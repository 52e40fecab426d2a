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
package com.corvusprint.slicer.events;

import com.corvusprint.slicer.events.CompletionInfo.Status;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompletionInfoTest {

  @Test
  @DisplayName("should describe a successful run")
  void should_describe_successful_run() {
    // When
    var info = CompletionInfo.finished();

    // Then
    assertThat(info.status()).isEqualTo(Status.FINISHED);
    assertThat(info.isFinished()).isTrue();
    assertThat(info.isSuccess()).isTrue();
    assertThat(info.isTerminalFailure()).isFalse();
    assertThat(info.errorMessage()).isEmpty();
    assertThat(info.errorObjectIds()).isEmpty();
  }

  @Test
  @DisplayName("should treat cancellation and error as terminal failures")
  void should_treat_cancel_and_error_as_terminal_failures() {
    // When
    var cancelled = CompletionInfo.cancelled();
    var error = CompletionInfo.error("mesh not manifold");

    // Then
    assertThat(cancelled.isCancelled()).isTrue();
    assertThat(cancelled.isTerminalFailure()).isTrue();
    assertThat(error.isError()).isTrue();
    assertThat(error.isTerminalFailure()).isTrue();
    assertThat(error.errorMessage()).isEqualTo("mesh not manifold");
  }

  @Test
  @DisplayName("should build the full form with faulty object identifiers")
  void should_build_full_form() {
    // When
    var info = CompletionInfo.builder(Status.ERROR)
                             .errorMessage("empty layer")
                             .errorObjectId(7L)
                             .errorObjectIds(List.of(11L, 13L))
                             .criticalError(true)
                             .invalidateDownstream(true)
                             .build();

    // Then
    assertThat(info.errorObjectIds()).containsExactly(7L, 11L, 13L);
    assertThat(info.criticalError()).isTrue();
    assertThat(info.invalidateDownstream()).isTrue();
  }

  @Test
  @DisplayName("should copy the identifier list and normalize nulls")
  void should_copy_identifiers_and_normalize_nulls() {
    // Given
    var ids = new ArrayList<>(List.of(1L));

    // When
    var info = new CompletionInfo(Status.ERROR, null, ids, false, false);
    ids.add(2L);
    var empty = new CompletionInfo(Status.CANCELLED, "", null, false, false);

    // Then
    assertThat(info.errorObjectIds()).containsExactly(1L);
    assertThat(info.errorMessage()).isEmpty();
    assertThat(empty.errorObjectIds()).isEmpty();
    assertThatThrownBy(() -> info.errorObjectIds().add(3L)).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  @DisplayName("should require a status")
  void should_require_status() {
    // When - Then
    assertThatThrownBy(() -> CompletionInfo.builder(null)).isInstanceOf(NullPointerException.class);
  }
}
