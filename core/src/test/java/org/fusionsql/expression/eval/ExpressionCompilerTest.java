/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.eval;

import static org.fusionsql.expression.DSL.add;
import static org.fusionsql.expression.DSL.and;
import static org.fusionsql.expression.DSL.cast;
import static org.fusionsql.expression.DSL.col;
import static org.fusionsql.expression.DSL.divide;
import static org.fusionsql.expression.DSL.equal;
import static org.fusionsql.expression.DSL.greater;
import static org.fusionsql.expression.DSL.isNull;
import static org.fusionsql.expression.DSL.lit;
import static org.fusionsql.expression.DSL.multiply;
import static org.fusionsql.expression.DSL.or;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.batch.RecordBatchBuilder;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.type.DataType;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.exception.EvaluationException;
import org.fusionsql.exception.SchemaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExpressionCompilerTest {

  private final Schema schema =
      Schema.of(
          new Field("a", DataType.INT64),
          new Field("b", DataType.INT64),
          new Field("x", DataType.FLOAT64));

  private RecordBatch batch;

  @BeforeEach
  void setUp() {
    batch =
        new RecordBatchBuilder(schema)
            .addRow(1L, 10L, 1.5d)
            .addRow(2L, null, 2.5d)
            .addRow(null, 30L, null)
            .build();
  }

  @Test
  void should_propagate_null_through_arithmetic() {
    ColumnVector result = evaluate(add(col("a"), col("b")));

    assertEquals(Arrays.asList(11L, null, null), result.toList());
  }

  @Test
  void should_propagate_null_through_comparison() {
    ColumnVector result = evaluate(greater(col("b"), lit(5L)));

    assertEquals(Arrays.asList(true, null, true), result.toList());
  }

  @Test
  void should_combine_null_comparisons_with_three_valued_logic() {
    // Given
    // b > 5 is (true, null, true); a = 1 is (true, false, null)
    ColumnVector conjunction = evaluate(and(greater(col("b"), lit(5L)), equal(col("a"), lit(1L))));
    ColumnVector disjunction = evaluate(or(greater(col("b"), lit(5L)), equal(col("a"), lit(1L))));

    // Then
    assertEquals(Arrays.asList(true, false, null), conjunction.toList());
    assertEquals(Arrays.asList(true, null, true), disjunction.toList());
  }

  @Test
  void should_never_return_null_from_is_null() {
    ColumnVector result = evaluate(isNull(col("b")));

    assertEquals(Arrays.asList(false, true, false), result.toList());
  }

  @Test
  void should_widen_integer_to_float_in_mixed_arithmetic() {
    ColumnVector result = evaluate(multiply(col("a"), col("x")));

    assertEquals(DataType.FLOAT64, result.getType());
    assertEquals(Arrays.asList(1.5d, 5.0d, null), result.toList());
  }

  @Test
  void should_saturate_integer_overflow() {
    ColumnVector result = evaluate(add(col("a"), lit(Long.MAX_VALUE)));

    assertEquals(Long.MAX_VALUE, result.getObject(0));
  }

  @Test
  void should_fail_integer_division_by_zero() {
    assertThrows(EvaluationException.class, () -> evaluate(divide(col("a"), lit(0L))));
  }

  @Test
  void should_cast_integer_to_string() {
    ColumnVector result = evaluate(cast(col("a"), DataType.UTF8));

    assertEquals(Arrays.asList("1", "2", null), result.toList());
  }

  @Test
  void should_reject_unknown_column() {
    assertThrows(SchemaException.class, () -> ExpressionCompiler.compile(col("missing"), schema));
  }

  private ColumnVector evaluate(org.fusionsql.expression.Expression expression) {
    return ExpressionCompiler.compile(expression, schema).evaluate(batch);
  }
}
