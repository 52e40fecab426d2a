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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExportInfoTest {

  @Test
  @DisplayName("should carry no path while the export has only begun")
  void should_have_no_path_when_began() {
    // When
    var info = ExportInfo.began();

    // Then
    assertThat(info.phase()).isEqualTo(ExportInfo.Phase.BEGAN);
    assertThat(info.path()).isNull();
  }

  @Test
  @DisplayName("should carry the path once the export is finished")
  void should_carry_path_when_finished() {
    // When
    var info = ExportInfo.finished("/home/user/benchy.gcode");

    // Then
    assertThat(info.phase()).isEqualTo(ExportInfo.Phase.FINISHED);
    assertThat(info.path()).isEqualTo("/home/user/benchy.gcode");
  }

  @Test
  @DisplayName("should reject inconsistent phase and path")
  void should_reject_inconsistent_phase_and_path() {
    // When - Then
    assertThatThrownBy(() -> new ExportInfo(ExportInfo.Phase.BEGAN, "out.gcode"))
      .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ExportInfo.finished(null))
      .isInstanceOf(NullPointerException.class);
  }
}
