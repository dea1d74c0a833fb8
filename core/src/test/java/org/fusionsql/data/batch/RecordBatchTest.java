/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.data.batch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.type.DataType;
import org.fusionsql.data.vector.BooleanVector;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.exception.SchemaException;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class RecordBatchTest {

  private static final Schema SCHEMA =
      Schema.of(new Field("id", DataType.INT64, false), new Field("name", DataType.UTF8, true));

  private RecordBatch batch() {
    return new RecordBatchBuilder(SCHEMA)
        .addRow(1L, "a")
        .addRow(2L, null)
        .addRow(3L, "c")
        .build();
  }

  @Test
  void should_reject_columns_of_different_length() {
    // Given
    List<ColumnVector> columns =
        List.of(
            ColumnVector.of(DataType.INT64, List.of(1L, 2L)),
            ColumnVector.of(DataType.UTF8, List.of("a")));

    // When / Then
    assertThrows(IllegalArgumentException.class, () -> new RecordBatch(SCHEMA, columns, 2));
  }

  @Test
  void should_reject_column_type_that_differs_from_schema() {
    List<ColumnVector> columns =
        List.of(
            ColumnVector.of(DataType.INT32, List.of(1)),
            ColumnVector.of(DataType.UTF8, List.of("a")));

    assertThrows(IllegalArgumentException.class, () -> new RecordBatch(SCHEMA, columns, 1));
  }

  @Test
  void should_filter_rows_and_drop_null_mask_entries() {
    // Given
    BooleanVector mask =
        (BooleanVector) ColumnVector.of(DataType.BOOLEAN, Arrays.asList(true, null, true));

    // When
    RecordBatch filtered = batch().filter(mask);

    // Then
    assertEquals(List.of(List.of(1L, "a"), List.of(3L, "c")), filtered.toRows());
  }

  @Test
  void should_return_same_batch_when_mask_keeps_every_row() {
    RecordBatch batch = batch();
    BooleanVector mask =
        (BooleanVector) ColumnVector.of(DataType.BOOLEAN, List.of(true, true, true));

    assertSame(batch, batch.filter(mask));
  }

  @Test
  void should_pad_negative_take_positions_with_nulls() {
    RecordBatch taken = batch().take(new int[] {2, -1});

    assertEquals(List.of(List.of(3L, "c"), Arrays.asList(null, null)), taken.toRows());
  }

  @Test
  void should_slice_and_project_by_name() {
    // When
    RecordBatch sliced = batch().slice(1, 2).project(List.of("name"));

    // Then
    assertEquals(1, sliced.getColumnCount());
    assertEquals(Arrays.asList(Arrays.asList((Object) null), List.of("c")), sliced.toRows());
  }

  @Test
  void should_concatenate_batches_in_order() {
    RecordBatch first = batch().slice(0, 1);
    RecordBatch second = batch().slice(2, 1);

    RecordBatch merged =
        RecordBatch.concat(SCHEMA, List.of(first, second, RecordBatch.empty(SCHEMA)));

    assertEquals(List.of(List.of(1L, "a"), List.of(3L, "c")), merged.toRows());
  }

  @Test
  void should_refuse_to_concatenate_batches_of_another_schema() {
    Schema other = Schema.of(new Field("id", DataType.INT64, false));
    RecordBatch foreign = new RecordBatchBuilder(other).addRow(1L).build();

    assertThrows(SchemaException.class, () -> RecordBatch.concat(SCHEMA, List.of(foreign)));
  }

  @Test
  void should_build_empty_batch_with_schema_columns() {
    RecordBatch empty = RecordBatch.empty(SCHEMA);

    assertTrue(empty.isEmpty());
    assertEquals(2, empty.getColumnCount());
  }
}
