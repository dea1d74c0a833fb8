/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.fusionsql.data.type.DataType;
import org.fusionsql.data.vector.ColumnVector;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class HashKeysTest {

  @Test
  void should_send_equal_keys_of_different_widths_to_the_same_partition() {
    // Given
    ColumnVector narrow = ColumnVector.of(DataType.INT32, Arrays.asList(7L, -3L, 1_000_000L));
    ColumnVector wide = ColumnVector.of(DataType.INT64, Arrays.asList(7L, -3L, 1_000_000L));

    // Then
    for (int partitions = 1; partitions <= 8; partitions++) {
      for (int row = 0; row < 3; row++) {
        assertEquals(
            HashKeys.partitionOf(List.of(narrow), row, partitions),
            HashKeys.partitionOf(List.of(wide), row, partitions));
      }
    }
  }

  @Test
  void should_treat_negative_zero_as_zero() {
    ColumnVector values = ColumnVector.of(DataType.FLOAT64, Arrays.asList(0.0d, -0.0d));

    assertEquals(HashKeys.normalize(values, 0), HashKeys.normalize(values, 1));
    assertEquals(
        HashKeys.partitionOf(List.of(values), 0, 16), HashKeys.partitionOf(List.of(values), 1, 16));
  }

  @Test
  void should_assign_partitions_in_range() {
    ColumnVector values = ColumnVector.of(DataType.INT64, Arrays.asList(-5L, 0L, 99L, null));

    for (int row = 0; row < values.size(); row++) {
      int partition = HashKeys.partitionOf(List.of(values), row, 3);
      assertTrue(partition >= 0 && partition < 3);
    }
  }

  @Test
  void should_return_no_join_key_when_any_column_is_null() {
    ColumnVector first = ColumnVector.of(DataType.INT64, Arrays.asList(1L, 2L));
    ColumnVector second = ColumnVector.of(DataType.UTF8, Arrays.asList("x", null));

    assertEquals(Arrays.asList(1L, "x"), HashKeys.joinKey(List.of(first, second), 0));
    assertNull(HashKeys.joinKey(List.of(first, second), 1));
    assertEquals(Arrays.asList(2L, null), HashKeys.rowKey(List.of(first, second), 1));
  }
}
