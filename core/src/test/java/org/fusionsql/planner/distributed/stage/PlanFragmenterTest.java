/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.stage;

import static org.fusionsql.expression.DSL.col;
import static org.fusionsql.expression.DSL.sum;
import static org.fusionsql.planner.logical.LogicalPlanDSL.aggregate;
import static org.fusionsql.planner.logical.LogicalPlanDSL.join;
import static org.fusionsql.planner.logical.LogicalPlanDSL.on;
import static org.fusionsql.planner.logical.LogicalPlanDSL.scan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.type.DataType;
import org.fusionsql.planner.logical.JoinType;
import org.fusionsql.planner.physical.ExchangeSourceExec;
import org.fusionsql.planner.physical.HashAggregateExec;
import org.fusionsql.planner.physical.PartitioningScheme;
import org.fusionsql.planner.physical.PhysicalPlan;
import org.fusionsql.planner.physical.PhysicalPlanCompiler;
import org.fusionsql.storage.MemoryTable;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PlanFragmenterTest {

  private final MemoryTable table =
      MemoryTable.fromRows(
          Schema.of(new Field("a", DataType.INT64), new Field("b", DataType.INT64)), List.of());

  private final MemoryTable other =
      MemoryTable.fromRows(Schema.of(new Field("c", DataType.INT64)), List.of());

  @Test
  void should_produce_one_stage_without_exchanges() {
    PhysicalPlan plan = new PhysicalPlanCompiler(2, 2).compile(scan("t", table));

    StagedPlan staged = PlanFragmenter.fragment("q1", plan);

    assertEquals(1, staged.getStageCount());
    ComputeStage root = staged.getRootStage();
    assertTrue(root.isLeaf());
    assertEquals(2, root.getTaskCount());
    assertTrue(root.getOutputPartitioning().isSingle());
  }

  @Test
  void should_cut_aggregate_at_its_exchange() {
    // Given
    PhysicalPlan plan =
        new PhysicalPlanCompiler(2, 2)
            .compile(aggregate(scan("t", table), List.of(col("a")), List.of(sum(col("b")))));

    // When
    StagedPlan staged = PlanFragmenter.fragment("q1", plan);

    // Then
    assertEquals(2, staged.getStageCount());
    ComputeStage partial = staged.getStage("stage-1");
    ComputeStage root = staged.getRootStage();
    assertEquals("stage-2", root.getStageId());
    assertEquals(List.of("stage-1"), root.getSourceStageIds());
    assertEquals(PartitioningScheme.Kind.HASH, partial.getOutputPartitioning().getKind());
    HashAggregateExec finalAgg = assertInstanceOf(HashAggregateExec.class, root.getFragment());
    ExchangeSourceExec source = assertInstanceOf(ExchangeSourceExec.class, finalAgg.getInput());
    assertEquals("stage-1", source.getSourceStageId());
    assertEquals(2, root.getTaskCount());
    assertEquals(List.of(root), staged.getConsumers("stage-1"));
    assertTrue(staged.validate().isEmpty());
  }

  @Test
  void should_order_join_input_stages_before_the_join() {
    PhysicalPlan plan =
        new PhysicalPlanCompiler(3, 3)
            .compile(
                join(scan("t", table), scan("o", other), JoinType.INNER, on(col("a"), col("c"))));

    StagedPlan staged = PlanFragmenter.fragment("q1", plan);

    assertEquals(3, staged.getStageCount());
    assertEquals(List.of("stage-1", "stage-2"), staged.getRootStage().getSourceStageIds());
    assertEquals(2, staged.getLeafStages().size());
    assertTrue(staged.explain().contains("stage-3"));
  }

  @Test
  void should_report_unknown_and_forward_dependencies() {
    // Given
    PhysicalPlan fragment = new PhysicalPlanCompiler(1, 1).compile(scan("t", table));
    StagedPlan staged =
        new StagedPlan(
            "q1",
            List.of(
                new ComputeStage("s1", fragment, PartitioningScheme.single(), List.of("s2")),
                new ComputeStage("s2", fragment, PartitioningScheme.single(), List.of("s1")),
                new ComputeStage("s3", fragment, PartitioningScheme.single(), List.of("x"))));

    // When
    List<String> errors = staged.validate();

    // Then
    assertFalse(errors.isEmpty());
    assertTrue(errors.stream().anyMatch(e -> e.contains("later or cyclic")));
    assertTrue(errors.stream().anyMatch(e -> e.contains("unknown stage: x")));
  }
}
