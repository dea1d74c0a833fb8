/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.batch.RecordBatchBuilder;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.type.DataType;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class RecordBatchCodecTest {

  private final RecordBatchCodec codec = new RecordBatchCodec();

  private final Schema schema =
      Schema.of(
          new Field("id", DataType.INT64),
          new Field("score", DataType.FLOAT64),
          new Field("ok", DataType.BOOLEAN),
          new Field("name", DataType.UTF8),
          new Field("at", DataType.TIMESTAMP));

  @Test
  void should_preserve_nulls_and_special_floating_values() {
    // Given
    RecordBatch batch =
        new RecordBatchBuilder(schema)
            .addRow(Long.MIN_VALUE, Double.NaN, true, "züri \"quoted\"", 0L)
            .addRow(null, -0.0, null, null, 1_700_000_000_000_000L)
            .addRow(7L, Double.NEGATIVE_INFINITY, false, "", null)
            .build();

    // When
    RecordBatch decoded = codec.decode(codec.encode(batch));

    // Then
    assertEquals(schema, decoded.getSchema());
    assertEquals(3, decoded.getRowCount());
    assertEquals(
        Arrays.asList(Long.MIN_VALUE, Double.NaN, true, "züri \"quoted\"", 0L),
        decoded.toRows().get(0));
    assertEquals(
        Double.doubleToRawLongBits(-0.0),
        Double.doubleToRawLongBits((Double) decoded.getValue(1, 1)));
    assertTrue(decoded.getColumn(0).isNull(1));
    assertTrue(decoded.getColumn(2).isNull(1));
    assertTrue(decoded.getColumn(3).isNull(1));
    assertTrue(decoded.getColumn(4).isNull(2));
    assertEquals("", decoded.getValue(2, 3));
  }

  @Test
  void should_encode_an_empty_batch() {
    RecordBatch decoded = codec.decode(codec.encode(RecordBatch.empty(schema)));

    assertEquals(0, decoded.getRowCount());
    assertEquals(schema, decoded.getSchema());
    assertEquals(List.of(), decoded.toRows());
  }

  @Test
  void should_reject_bytes_that_are_not_a_batch() {
    assertThrows(
        IllegalArgumentException.class,
        () -> codec.decode("{oops".getBytes(StandardCharsets.UTF_8)));
  }
}
