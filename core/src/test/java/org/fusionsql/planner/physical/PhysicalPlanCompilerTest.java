/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.physical;

import static org.fusionsql.expression.DSL.col;
import static org.fusionsql.expression.DSL.sum;
import static org.fusionsql.planner.logical.LogicalPlanDSL.aggregate;
import static org.fusionsql.planner.logical.LogicalPlanDSL.join;
import static org.fusionsql.planner.logical.LogicalPlanDSL.on;
import static org.fusionsql.planner.logical.LogicalPlanDSL.repartition;
import static org.fusionsql.planner.logical.LogicalPlanDSL.scan;
import static org.fusionsql.planner.logical.LogicalPlanDSL.sort;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.type.DataType;
import org.fusionsql.planner.logical.JoinType;
import org.fusionsql.planner.logical.LogicalPlan;
import org.fusionsql.planner.logical.SortItem;
import org.fusionsql.storage.MemoryTable;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PhysicalPlanCompilerTest {

  private final MemoryTable left =
      MemoryTable.fromRows(
          Schema.of(new Field("a", DataType.INT64), new Field("b", DataType.INT64)), List.of());

  private final MemoryTable right =
      MemoryTable.fromRows(
          Schema.of(new Field("c", DataType.INT64), new Field("d", DataType.UTF8)), List.of());

  @Test
  void should_bound_partition_count_by_worker_pool() {
    PhysicalPlanCompiler compiler = new PhysicalPlanCompiler(16, 3);

    PhysicalPlan plan = compiler.compile(scan("t", left));

    assertEquals(3, plan.getPartitioning().getPartitionCount());
    assertEquals(3, compiler.getPartitionCount());
  }

  @Test
  void should_hash_repartition_both_join_inputs_on_their_keys() {
    // Given
    LogicalPlan logical =
        join(scan("l", left), scan("r", right), JoinType.INNER, on(col("a"), col("c")));

    // When
    PhysicalPlan plan = new PhysicalPlanCompiler(4, 4).compile(logical);

    // Then
    HashJoinExec joinExec = assertInstanceOf(HashJoinExec.class, plan);
    RepartitionExec leftExchange = assertInstanceOf(RepartitionExec.class, joinExec.getLeft());
    RepartitionExec rightExchange = assertInstanceOf(RepartitionExec.class, joinExec.getRight());
    assertEquals(PartitioningScheme.Kind.HASH, leftExchange.getTarget().getKind());
    assertEquals(4, leftExchange.getTarget().getPartitionCount());
    assertEquals(4, rightExchange.getTarget().getPartitionCount());
    assertEquals(4, plan.getPartitioning().getPartitionCount());
  }

  @Test
  void should_join_without_exchange_on_a_single_partition() {
    LogicalPlan logical =
        join(scan("l", left), scan("r", right), JoinType.INNER, on(col("a"), col("c")));

    PhysicalPlan plan = new PhysicalPlanCompiler(4, 1).compile(logical);

    HashJoinExec joinExec = assertInstanceOf(HashJoinExec.class, plan);
    assertInstanceOf(ScanExec.class, joinExec.getLeft());
  }

  @Test
  void should_split_aggregate_around_a_hash_exchange_on_group_keys() {
    // Given
    LogicalPlan logical = aggregate(scan("t", left), List.of(col("a")), List.of(sum(col("b"))));

    // When
    PhysicalPlan plan = new PhysicalPlanCompiler(2, 4).compile(logical);

    // Then
    HashAggregateExec finalAgg = assertInstanceOf(HashAggregateExec.class, plan);
    assertEquals(AggregationMode.FINAL, finalAgg.getMode());
    RepartitionExec exchange = assertInstanceOf(RepartitionExec.class, finalAgg.getInput());
    assertEquals(PartitioningScheme.Kind.HASH, exchange.getTarget().getKind());
    assertEquals(2, exchange.getTarget().getPartitionCount());
    HashAggregateExec partial = assertInstanceOf(HashAggregateExec.class, exchange.getInput());
    assertEquals(AggregationMode.PARTIAL, partial.getMode());
  }

  @Test
  void should_gather_global_aggregate_to_one_partition() {
    LogicalPlan logical = aggregate(scan("t", left), List.of(), List.of(sum(col("b"))));

    PhysicalPlan plan = new PhysicalPlanCompiler(4, 4).compile(logical);

    assertTrue(plan.getPartitioning().isSingle());
    RepartitionExec exchange =
        assertInstanceOf(RepartitionExec.class, ((HashAggregateExec) plan).getInput());
    assertTrue(exchange.getTarget().isSingle());
  }

  @Test
  void should_aggregate_in_one_step_on_a_single_partition() {
    LogicalPlan logical = aggregate(scan("t", left), List.of(col("a")), List.of(sum(col("b"))));

    PhysicalPlan plan = new PhysicalPlanCompiler(4, 1).compile(logical);

    assertEquals(AggregationMode.SINGLE, ((HashAggregateExec) plan).getMode());
  }

  @Test
  void should_gather_before_sort() {
    PhysicalPlan plan =
        new PhysicalPlanCompiler(4, 4).compile(sort(scan("t", left), SortItem.asc(col("a"))));

    SortExec sortExec = assertInstanceOf(SortExec.class, plan);
    assertInstanceOf(RepartitionExec.class, sortExec.getInput());
    assertTrue(plan.getPartitioning().isSingle());
  }

  @Test
  void should_cap_explicit_repartition_by_worker_pool() {
    PhysicalPlan plan =
        new PhysicalPlanCompiler(2, 3).compile(repartition(scan("t", left), 10, col("a")));

    assertEquals(3, plan.getPartitioning().getPartitionCount());
  }
}
