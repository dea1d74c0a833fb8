/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.optimizer;

import static org.fusionsql.expression.DSL.add;
import static org.fusionsql.expression.DSL.alias;
import static org.fusionsql.expression.DSL.and;
import static org.fusionsql.expression.DSL.col;
import static org.fusionsql.expression.DSL.countStar;
import static org.fusionsql.expression.DSL.equal;
import static org.fusionsql.expression.DSL.greater;
import static org.fusionsql.expression.DSL.less;
import static org.fusionsql.expression.DSL.lit;
import static org.fusionsql.expression.DSL.multiply;
import static org.fusionsql.expression.DSL.sum;
import static org.fusionsql.planner.logical.LogicalPlanDSL.aggregate;
import static org.fusionsql.planner.logical.LogicalPlanDSL.filter;
import static org.fusionsql.planner.logical.LogicalPlanDSL.join;
import static org.fusionsql.planner.logical.LogicalPlanDSL.limit;
import static org.fusionsql.planner.logical.LogicalPlanDSL.on;
import static org.fusionsql.planner.logical.LogicalPlanDSL.project;
import static org.fusionsql.planner.logical.LogicalPlanDSL.scan;
import static org.fusionsql.planner.logical.LogicalPlanDSL.sort;
import static org.fusionsql.planner.logical.LogicalPlanDSL.union;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.HashMultiset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.type.DataType;
import org.fusionsql.planner.distributed.LocalStageExecutor;
import org.fusionsql.planner.logical.JoinType;
import org.fusionsql.planner.logical.LogicalFilter;
import org.fusionsql.planner.logical.LogicalJoin;
import org.fusionsql.planner.logical.LogicalPlan;
import org.fusionsql.planner.logical.LogicalPlanPrinter;
import org.fusionsql.planner.logical.LogicalScan;
import org.fusionsql.planner.logical.LogicalUnion;
import org.fusionsql.planner.logical.SortItem;
import org.fusionsql.storage.MemoryTable;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LogicalPlanOptimizerTest {

  private static final MemoryTable ORDERS =
      MemoryTable.fromRows(
          Schema.of(
              new Field("id", DataType.INT64),
              new Field("customer", DataType.INT64),
              new Field("amount", DataType.INT64),
              new Field("note", DataType.UTF8)),
          rows(
              row(1L, 10L, 100L, "x"),
              row(2L, 10L, 250L, "y"),
              row(3L, 20L, 75L, null),
              row(4L, 30L, null, "z"),
              row(5L, null, 60L, "w"),
              row(6L, 20L, 500L, "v")),
          2);

  private static final MemoryTable CUSTOMERS =
      MemoryTable.fromRows(
          Schema.of(new Field("cid", DataType.INT64), new Field("name", DataType.UTF8)),
          rows(row(10L, "ann"), row(20L, "bob"), row(40L, "cyd")),
          2);

  private final LogicalPlanOptimizer optimizer = LogicalPlanOptimizerFactory.create();

  static Stream<LogicalPlan> plans() {
    LogicalPlan orders = scan("orders", ORDERS);
    LogicalPlan customers = scan("customers", CUSTOMERS);
    return Stream.of(
        filter(orders, greater(col("amount"), add(lit(50L), lit(50L)))),
        project(
            filter(orders, and(greater(col("amount"), lit(70L)), lit(true))),
            col("id"),
            alias(multiply(col("amount"), lit(2L)), "doubled")),
        filter(
            join(orders, customers, JoinType.INNER, on(col("customer"), col("cid"))),
            and(greater(col("amount"), lit(80L)), equal(col("name"), lit("bob")))),
        filter(
            join(orders, customers, JoinType.LEFT, on(col("customer"), col("cid"))),
            and(less(col("id"), lit(5L)), equal(col("name"), lit("ann")))),
        filter(
            join(orders, customers, JoinType.FULL, on(col("customer"), col("cid"))),
            greater(col("id"), lit(1L))),
        filter(
            aggregate(
                orders,
                List.of(col("customer")),
                List.of(alias(sum(col("amount")), "total"), alias(countStar(), "n"))),
            greater(col("customer"), lit(15L))),
        project(
            sort(filter(orders, greater(col("id"), lit(2L))), SortItem.desc(col("amount"))),
            col("note")),
        limit(filter(orders, greater(col("amount"), lit(0L))), 2),
        filter(
            union(project(orders, col("id")), project(customers, col("cid"))),
            greater(col("id"), lit(4L))));
  }

  @ParameterizedTest
  @MethodSource("plans")
  void should_be_idempotent(LogicalPlan plan) {
    // When
    LogicalPlan once = optimizer.optimize(plan);
    LogicalPlan twice = optimizer.optimize(once);

    // Then
    assertEquals(once, twice);
    assertEquals(LogicalPlanPrinter.print(once), LogicalPlanPrinter.print(twice));
  }

  @ParameterizedTest
  @MethodSource("plans")
  void should_preserve_result_rows(LogicalPlan plan) {
    // Given
    LogicalPlan optimized = optimizer.optimize(plan);

    // Then
    for (int partitions : new int[] {1, 3}) {
      assertEquals(
          HashMultiset.create(LocalStageExecutor.execute(plan, partitions)),
          HashMultiset.create(LocalStageExecutor.execute(optimized, partitions)),
          "partitions=" + partitions + "\n" + LogicalPlanPrinter.print(optimized));
    }
  }

  @Test
  void should_preserve_output_schema() {
    plans()
        .forEach(
            plan ->
                assertEquals(
                    plan.getSchema().getFieldNames(),
                    optimizer.optimize(plan).getSchema().getFieldNames()));
  }

  @Test
  void should_fold_constant_arithmetic() {
    LogicalPlan plan =
        filter(scan("orders", ORDERS), greater(col("amount"), add(lit(50L), lit(50L))));

    String printed = LogicalPlanPrinter.print(optimizer.optimize(plan));

    assertTrue(printed.contains("(amount > 100)"), printed);
  }

  @Test
  void should_drop_filter_that_is_always_true() {
    LogicalPlan plan = filter(scan("orders", ORDERS), equal(lit(1L), lit(1L)));

    LogicalPlan optimized = optimizer.optimize(plan);

    assertInstanceOf(LogicalScan.class, optimized);
  }

  @Test
  void should_rename_columns_by_position_when_pushing_filter_into_union_inputs() {
    // Given
    LogicalPlan plan =
        filter(
            union(
                project(scan("orders", ORDERS), col("id")),
                project(scan("customers", CUSTOMERS), col("cid"))),
            greater(col("id"), lit(4L)));

    // When
    LogicalPlan optimized = optimizer.optimize(plan);

    // Then
    LogicalUnion union = assertInstanceOf(LogicalUnion.class, optimized);
    String printed = LogicalPlanPrinter.print(union.getChild().get(1));
    assertTrue(printed.contains("(cid > 4)"), printed);
    assertEquals(
        HashMultiset.create(rows(row(5L), row(6L), row(10L), row(20L), row(40L))),
        HashMultiset.create(LocalStageExecutor.execute(optimized, 2)));
  }

  @Test
  void should_push_single_side_conjuncts_below_inner_join() {
    // Given
    LogicalPlan plan =
        filter(
            join(
                scan("orders", ORDERS),
                scan("customers", CUSTOMERS),
                JoinType.INNER,
                on(col("customer"), col("cid"))),
            and(greater(col("amount"), lit(80L)), equal(col("name"), lit("bob"))));

    // When
    LogicalPlan optimized = optimizer.optimize(plan);

    // Then
    LogicalJoin join = assertInstanceOf(LogicalJoin.class, optimized);
    assertInstanceOf(LogicalFilter.class, join.getLeft());
    assertInstanceOf(LogicalFilter.class, join.getRight());
  }

  @Test
  void should_not_push_into_null_padded_side_of_outer_join() {
    // Given
    LogicalPlan plan =
        filter(
            join(
                scan("orders", ORDERS),
                scan("customers", CUSTOMERS),
                JoinType.LEFT,
                on(col("customer"), col("cid"))),
            equal(col("name"), lit("ann")));

    // When
    LogicalPlan optimized = optimizer.optimize(plan);

    // Then
    LogicalFilter filter = assertInstanceOf(LogicalFilter.class, optimized);
    LogicalJoin join = assertInstanceOf(LogicalJoin.class, filter.getInput());
    assertFalse(join.getRight() instanceof LogicalFilter);
  }

  @Test
  void should_narrow_scan_to_referenced_columns() {
    LogicalPlan plan =
        project(filter(scan("orders", ORDERS), greater(col("amount"), lit(1L))), col("id"));

    LogicalPlan optimized = optimizer.optimize(plan);

    List<LogicalScan> scans = new ArrayList<>();
    collectScans(optimized, scans);
    assertEquals(List.of("id", "amount"), scans.get(0).getProjection());
  }

  @Test
  void should_keep_one_column_for_count_star() {
    LogicalPlan plan = aggregate(scan("orders", ORDERS), List.of(), List.of(countStar()));

    LogicalPlan optimized = optimizer.optimize(plan);

    List<LogicalScan> scans = new ArrayList<>();
    collectScans(optimized, scans);
    assertEquals(1, scans.get(0).getProjection().size());
    assertEquals(List.of(List.of(6L)), LocalStageExecutor.execute(optimized, 2));
  }

  private static void collectScans(LogicalPlan plan, List<LogicalScan> scans) {
    if (plan instanceof LogicalScan) {
      scans.add((LogicalScan) plan);
    }
    plan.getChild().forEach(child -> collectScans(child, scans));
  }

  @SafeVarargs
  private static List<List<Object>> rows(List<Object>... rows) {
    return Arrays.asList(rows);
  }

  private static List<Object> row(Object... values) {
    return Arrays.asList(values);
  }
}
