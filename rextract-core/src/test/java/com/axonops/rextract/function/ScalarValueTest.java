/*
 * Copyright 2025 AxonOps
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
package com.axonops.rextract.function;

import static org.assertj.core.api.Assertions.*;

import org.apache.arrow.vector.types.pojo.ArrowType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ScalarValue")
class ScalarValueTest {

  @Test
  @DisplayName("uint32 should accept the full unsigned range")
  void uint32_fullRange() {
    assertThat(ScalarValue.uint32(0).asLong()).isZero();
    assertThat(ScalarValue.uint32(Integer.MAX_VALUE).asLong()).isEqualTo(Integer.MAX_VALUE);
    assertThat(ScalarValue.uint32(ScalarValue.UINT32_MAX).asLong()).isEqualTo(4_294_967_295L);
    assertThat(ScalarValue.uint32(ScalarValue.UINT32_MAX).bits()).isEqualTo(-1);
  }

  @Test
  @DisplayName("uint32 should reject values outside the unsigned range")
  void uint32_outOfRange() {
    assertThatIllegalArgumentException().isThrownBy(() -> ScalarValue.uint32(-1));
    assertThatIllegalArgumentException()
        .isThrownBy(() -> ScalarValue.uint32(ScalarValue.UINT32_MAX + 1));
  }

  @Test
  @DisplayName("null payloads should be typed SQL NULLs")
  void nullPayloads() {
    assertThat(ScalarValue.utf8(null).isNull()).isTrue();
    assertThat(new ScalarValue.UInt32(null).isNull()).isTrue();
    assertThat(new ScalarValue.Int64(null).isNull()).isTrue();
    assertThat(ScalarValue.utf8("").isNull()).isFalse();

    assertThatIllegalStateException().isThrownBy(() -> new ScalarValue.UInt32(null).asLong());
  }

  @Test
  @DisplayName("types should match the Arrow types they stand for")
  void types() {
    assertThat(ScalarValue.utf8("x").type()).isEqualTo(ArrowType.Utf8.INSTANCE);
    assertThat(ScalarValue.uint32(1).type()).isEqualTo(new ArrowType.Int(32, false));
    assertThat(ScalarValue.int64(1).type()).isEqualTo(new ArrowType.Int(64, true));
  }
}
