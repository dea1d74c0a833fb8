/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.eval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import org.fusionsql.data.type.DataType;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.exception.CastException;
import org.fusionsql.exception.ErrorKind;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class CastKernelsTest {

  @Test
  void should_saturate_narrowing_integer_cast() {
    // Given
    ColumnVector input = ColumnVector.of(DataType.INT64, List.of(300L, -300L, 42L));

    // When
    ColumnVector result = CastKernels.cast(input, DataType.INT8);

    // Then
    assertEquals(DataType.INT8, result.getType());
    assertEquals(List.of(127L, -128L, 42L), result.toList());
  }

  @Test
  void should_truncate_float_toward_zero() {
    ColumnVector input = ColumnVector.of(DataType.FLOAT64, List.of(-3.9d, 3.9d, -0.5d));

    ColumnVector result = CastKernels.cast(input, DataType.INT32);

    assertEquals(List.of(-3L, 3L, 0L), result.toList());
  }

  @Test
  void should_cast_nan_to_zero() {
    ColumnVector input = ColumnVector.of(DataType.FLOAT64, List.of(Double.NaN));

    assertEquals(List.of(0L), CastKernels.cast(input, DataType.INT64).toList());
  }

  @Test
  void should_clamp_negative_values_cast_to_unsigned_types() {
    ColumnVector input = ColumnVector.of(DataType.INT64, List.of(-1L, 256L));

    assertEquals(List.of(0L, 255L), CastKernels.cast(input, DataType.UINT8).toList());
    assertEquals(List.of(0L, 256L), CastKernels.cast(input, DataType.UINT64).toList());
  }

  @Test
  void should_keep_nulls_through_cast() {
    ColumnVector input = ColumnVector.of(DataType.UTF8, Arrays.asList("7", null));

    assertEquals(Arrays.asList(7L, null), CastKernels.cast(input, DataType.INT64).toList());
  }

  @Test
  void should_fail_on_unparseable_string() {
    // Given
    ColumnVector input = ColumnVector.of(DataType.UTF8, List.of("12", "twelve"));

    // When
    CastException error =
        assertThrows(CastException.class, () -> CastKernels.cast(input, DataType.INT64));

    // Then
    assertEquals(ErrorKind.CAST, error.getKind());
  }

  @Test
  void should_fail_on_timestamp_outside_the_microsecond_range() {
    ColumnVector input = ColumnVector.of(DataType.UTF8, List.of("+300000-01-01T00:00:00Z"));

    assertThrows(CastException.class, () -> CastKernels.cast(input, DataType.TIMESTAMP));
  }

  @Test
  void should_parse_date_as_midnight_timestamp() {
    ColumnVector input = ColumnVector.of(DataType.UTF8, List.of("1970-01-02"));

    assertEquals(
        List.of(86_400_000_000L), CastKernels.cast(input, DataType.TIMESTAMP).toList());
  }
}
