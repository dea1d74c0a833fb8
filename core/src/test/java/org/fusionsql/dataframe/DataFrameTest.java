/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.dataframe;

import static org.fusionsql.expression.DSL.add;
import static org.fusionsql.expression.DSL.alias;
import static org.fusionsql.expression.DSL.col;
import static org.fusionsql.expression.DSL.greater;
import static org.fusionsql.expression.DSL.lit;
import static org.fusionsql.expression.DSL.sum;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.type.DataType;
import org.fusionsql.exception.SchemaException;
import org.fusionsql.exception.TypeCheckException;
import org.fusionsql.planner.logical.JoinType;
import org.fusionsql.planner.logical.LogicalFilter;
import org.fusionsql.planner.logical.LogicalScan;
import org.fusionsql.storage.MemoryTable;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class DataFrameTest {

  private static final MemoryTable ORDERS =
      MemoryTable.fromRows(
          Schema.of(
              new Field("customer_id", DataType.INT64, false),
              new Field("amount", DataType.FLOAT64, true)),
          List.of(List.of(1L, 10.0), List.of(2L, 5.5)));

  private static final MemoryTable CUSTOMERS =
      MemoryTable.fromRows(
          Schema.of(
              new Field("id", DataType.INT64, false), new Field("name", DataType.UTF8, false)),
          List.of(List.of(1L, "ann"), List.of(2L, "bob")));

  @Test
  void should_leave_receiver_unchanged_when_extended() {
    // Given
    DataFrame orders = DataFrame.scan("orders", ORDERS);

    // When
    DataFrame filtered = orders.filter(greater(col("amount"), lit(6.0)));

    // Then
    assertInstanceOf(LogicalScan.class, orders.logicalPlan());
    assertInstanceOf(LogicalFilter.class, filtered.logicalPlan());
    assertNotEquals(orders, filtered);
  }

  @Test
  void should_derive_schema_of_projection_and_aggregate() {
    DataFrame orders = DataFrame.scan("orders", ORDERS);

    DataFrame projected =
        orders.select(col("customer_id"), alias(add(col("amount"), lit(1.0)), "bumped"));
    DataFrame totals =
        orders.aggregate(List.of(col("customer_id")), List.of(alias(sum(col("amount")), "total")));

    assertEquals(List.of("customer_id", "bumped"), projected.schema().getFieldNames());
    assertEquals(DataType.FLOAT64, projected.schema().getField("bumped").getType());
    assertEquals(List.of("customer_id", "total"), totals.schema().getFieldNames());
  }

  @Test
  void should_mark_right_side_nullable_in_left_join() {
    // When
    DataFrame joined =
        DataFrame.scan("orders", ORDERS)
            .join(DataFrame.scan("customers", CUSTOMERS), "customer_id", "id", JoinType.LEFT);

    // Then
    assertEquals(4, joined.schema().size());
    assertTrue(joined.schema().getField("name").isNullable());
  }

  @Test
  void should_reject_unknown_column_when_building() {
    DataFrame orders = DataFrame.scan("orders", ORDERS);

    assertThrows(SchemaException.class, () -> orders.select(col("missing")));
    assertThrows(SchemaException.class, () -> orders.col("missing"));
  }

  @Test
  void should_reject_non_boolean_filter() {
    DataFrame orders = DataFrame.scan("orders", ORDERS);

    assertThrows(TypeCheckException.class, () -> orders.filter(col("amount")));
  }

  @Test
  void should_reject_union_of_incompatible_frames() {
    DataFrame orders = DataFrame.scan("orders", ORDERS);
    DataFrame customers = DataFrame.scan("customers", CUSTOMERS);

    assertThrows(SchemaException.class, () -> orders.union(customers));
  }

  @Test
  void should_only_alias_a_scan() {
    DataFrame limited = DataFrame.scan("orders", ORDERS).limit(1);

    assertThrows(IllegalStateException.class, () -> limited.alias("o"));
  }

  @Test
  void should_explain_logical_plan() {
    String explain = DataFrame.scan("orders", ORDERS).limit(1, 1).explain();

    assertTrue(explain.contains("Limit: limit=1 offset=1"), explain);
  }
}
