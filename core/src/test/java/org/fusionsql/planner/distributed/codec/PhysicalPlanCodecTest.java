/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.codec;

import static org.fusionsql.expression.DSL.add;
import static org.fusionsql.expression.DSL.col;
import static org.fusionsql.expression.DSL.greater;
import static org.fusionsql.expression.DSL.lit;
import static org.fusionsql.expression.DSL.sum;
import static org.fusionsql.planner.logical.LogicalPlanDSL.aggregate;
import static org.fusionsql.planner.logical.LogicalPlanDSL.filter;
import static org.fusionsql.planner.logical.LogicalPlanDSL.join;
import static org.fusionsql.planner.logical.LogicalPlanDSL.limit;
import static org.fusionsql.planner.logical.LogicalPlanDSL.on;
import static org.fusionsql.planner.logical.LogicalPlanDSL.project;
import static org.fusionsql.planner.logical.LogicalPlanDSL.scan;
import static org.fusionsql.planner.logical.LogicalPlanDSL.sort;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;
import org.fusionsql.catalog.DefaultCatalogService;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.type.DataType;
import org.fusionsql.exception.SchemaException;
import org.fusionsql.expression.function.FunctionRegistry;
import org.fusionsql.planner.distributed.LocalStageExecutor;
import org.fusionsql.planner.distributed.stage.ComputeStage;
import org.fusionsql.planner.distributed.stage.PlanFragmenter;
import org.fusionsql.planner.distributed.stage.StagedPlan;
import org.fusionsql.planner.logical.JoinType;
import org.fusionsql.planner.logical.LogicalPlan;
import org.fusionsql.planner.logical.SortItem;
import org.fusionsql.planner.physical.PartitioningScheme;
import org.fusionsql.planner.physical.PhysicalPlan;
import org.fusionsql.planner.physical.PhysicalPlanCompiler;
import org.fusionsql.storage.MemoryTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PhysicalPlanCodecTest {

  private final DefaultCatalogService catalog = new DefaultCatalogService();
  private final PhysicalPlanCodec codec =
      new PhysicalPlanCodec(catalog, FunctionRegistry.createDefault());

  private MemoryTable orders;
  private MemoryTable customers;

  @BeforeEach
  void setUp() {
    orders =
        MemoryTable.fromRows(
            Schema.of(new Field("cust", DataType.INT64), new Field("amount", DataType.FLOAT64)),
            List.of(
                List.of(1L, 10.5),
                List.of(2L, 20.0),
                List.of(1L, 4.5),
                List.of(3L, 7.25),
                List.of(2L, 1.0)));
    customers =
        MemoryTable.fromRows(
            Schema.of(new Field("id", DataType.INT64), new Field("name", DataType.UTF8)),
            List.of(List.of(1L, "ann"), List.of(2L, "bob"), List.of(3L, "cy")));
    catalog.registerTable("orders", orders);
    catalog.registerTable("customers", customers);
  }

  @Test
  void should_reencode_a_decoded_fragment_to_the_same_text() {
    // Given
    PhysicalPlan plan = new PhysicalPlanCompiler(3, 3).compile(query());

    // When
    StagedPlan staged = PlanFragmenter.fragment("q", plan);

    // Then
    for (ComputeStage stage : staged.getStages()) {
      String encoded = codec.encode(stage.getFragment());
      assertEquals(encoded, codec.encode(codec.decode(encoded)), stage.getStageId());
    }
  }

  @Test
  void should_compute_the_same_rows_from_decoded_fragments() {
    // Given
    StagedPlan staged =
        PlanFragmenter.fragment("q", new PhysicalPlanCompiler(3, 3).compile(query()));

    // When
    StagedPlan decoded =
        new StagedPlan(
            "q",
            staged.getStages().stream()
                .map(
                    s ->
                        new ComputeStage(
                            s.getStageId(),
                            codec.decode(codec.encode(s.getFragment())),
                            codec.decodePartitioning(
                                codec.encodePartitioningToString(s.getOutputPartitioning())),
                            s.getSourceStageIds()))
                .collect(Collectors.toList()));

    // Then
    assertEquals(LocalStageExecutor.execute(staged), LocalStageExecutor.execute(decoded));
    assertEquals(
        List.of(List.of(2L, 21.0), List.of(1L, 15.0), List.of(3L, 7.25)),
        LocalStageExecutor.execute(decoded));
  }

  @Test
  void should_round_trip_partitioning_schemes() {
    PartitioningScheme hash = PartitioningScheme.hash(List.of(col("cust")), 4);

    PartitioningScheme decoded = codec.decodePartitioning(codec.encodePartitioningToString(hash));

    assertEquals(PartitioningScheme.Kind.HASH, decoded.getKind());
    assertEquals(4, decoded.getPartitionCount());
    assertEquals(hash.getHashKeys(), decoded.getHashKeys());
    assertEquals(
        PartitioningScheme.single(),
        codec.decodePartitioning(codec.encodePartitioningToString(PartitioningScheme.single())));
  }

  @Test
  void should_fail_to_decode_a_scan_of_an_unregistered_table() {
    String encoded = codec.encode(new PhysicalPlanCompiler(1, 1).compile(scan("orders", orders)));
    catalog.dropTable("orders");

    assertThrows(SchemaException.class, () -> codec.decode(encoded));
  }

  @Test
  void should_reject_malformed_text() {
    assertThrows(IllegalArgumentException.class, () -> codec.decode("{not json"));
    assertThrows(IllegalArgumentException.class, () -> codec.decodePartitioning("]"));
  }

  private LogicalPlan query() {
    LogicalPlan joined =
        join(
            filter(scan("orders", orders), greater(col("amount"), lit(0.5))),
            scan("customers", customers),
            JoinType.INNER,
            on(col("cust"), col("id")));
    LogicalPlan summed =
        aggregate(joined, List.of(col("cust")), List.of(sum(col("amount"))));
    LogicalPlan projected =
        project(summed, col("cust"), col("SUM(amount)"));
    return limit(sort(projected, SortItem.desc(col("SUM(amount)"))), 10);
  }
}
