/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.sql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.fusionsql.catalog.DefaultCatalogService;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.type.DataType;
import org.fusionsql.dataframe.DataFrame;
import org.fusionsql.exception.ErrorKind;
import org.fusionsql.exception.QueryEngineException;
import org.fusionsql.exception.SchemaException;
import org.fusionsql.exception.TypeCheckException;
import org.fusionsql.expression.function.FunctionRegistry;
import org.fusionsql.planner.distributed.exchange.OutputBuffer;
import org.fusionsql.planner.distributed.operator.OperatorContext;
import org.fusionsql.planner.distributed.pipeline.StageTaskRunner;
import org.fusionsql.planner.distributed.stage.ComputeStage;
import org.fusionsql.planner.distributed.stage.PlanFragmenter;
import org.fusionsql.planner.distributed.stage.StagedPlan;
import org.fusionsql.planner.logical.LogicalAggregate;
import org.fusionsql.planner.logical.LogicalFilter;
import org.fusionsql.planner.logical.LogicalJoin;
import org.fusionsql.planner.logical.LogicalPlan;
import org.fusionsql.planner.logical.LogicalProject;
import org.fusionsql.planner.physical.PhysicalPlanCompiler;
import org.fusionsql.storage.MemoryTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SqlQueryPlannerTest {

  private final DefaultCatalogService catalog = new DefaultCatalogService();
  private SqlQueryPlanner planner;

  @BeforeEach
  void setUp() {
    catalog.registerTable(
        "T",
        MemoryTable.fromRows(
            Schema.of(new Field("a", DataType.INT64), new Field("b", DataType.INT64)),
            List.of(List.of(1L, 3L), List.of(2L, 20L), List.of(1L, 7L), List.of(2L, 30L))));
    catalog.registerTable(
        "names",
        MemoryTable.fromRows(
            Schema.of(new Field("id", DataType.INT64), new Field("label", DataType.UTF8)),
            List.of(List.of(1L, "one"), List.of(3L, "three"))));
    planner = new SqlQueryPlanner(catalog, FunctionRegistry.createDefault());
  }

  @Test
  void should_plan_group_by_with_sum() {
    // Given
    DataFrame frame = planner.plan("SELECT a, SUM(b) FROM T GROUP BY a ORDER BY a");

    // When
    List<List<Object>> rows = run(frame);

    // Then
    assertEquals(List.of("a", "SUM(b)"), frame.schema().getFieldNames());
    assertEquals(List.of(List.of(1L, 10L), List.of(2L, 50L)), rows);
  }

  @Test
  void should_plan_global_aggregates_without_group_by() {
    DataFrame frame = planner.plan("SELECT count(*), max(b), Avg(b) FROM T WHERE a > 1");

    assertInstanceOf(LogicalAggregate.class, frame.logicalPlan().getChild().get(0));
    assertEquals(List.of(List.of(2L, 30L, 25.0d)), run(frame));
  }

  @Test
  void should_filter_aggregates_with_having_and_order_by_alias() {
    DataFrame frame =
        planner.plan(
            "SELECT a, COUNT(*) AS n, SUM(b) AS total FROM T WHERE b > 3"
                + " GROUP BY a HAVING SUM(b) > 5 ORDER BY total DESC");

    assertEquals(List.of(List.of(2L, 2L, 50L), List.of(1L, 1L, 7L)), run(frame));
  }

  @Test
  void should_plan_where_projection_and_limit() {
    DataFrame frame = planner.plan("SELECT b * 2 AS twice FROM T WHERE a = 2 ORDER BY b LIMIT 1");

    assertInstanceOf(LogicalProject.class, frame.logicalPlan().getChild().get(0));
    assertEquals(List.of(List.of(40L)), run(frame));
  }

  @Test
  void should_order_by_a_column_that_is_not_selected() {
    DataFrame frame = planner.plan("SELECT a FROM T ORDER BY b DESC LIMIT 2 OFFSET 1");

    assertEquals(List.of(List.of(2L), List.of(1L)), run(frame));
  }

  @Test
  void should_plan_left_join_with_qualified_columns() {
    // Given
    DataFrame frame =
        planner.plan(
            "SELECT t.a, n.label FROM T AS t LEFT JOIN names AS n ON t.a = n.id"
                + " WHERE t.b < 10 ORDER BY t.b");

    // When
    LogicalPlan plan = frame.logicalPlan();

    // Then
    assertEquals(
        List.of(Arrays.asList(1L, "one"), Arrays.asList(1L, "one")), run(frame));
    assertInstanceOf(LogicalJoin.class, firstJoin(plan));
  }

  @Test
  void should_keep_non_equality_join_conditions_as_a_filter() {
    DataFrame frame =
        planner.plan("SELECT * FROM T JOIN names ON T.a = names.id AND T.b > 4");

    assertInstanceOf(LogicalFilter.class, frame.logicalPlan());
    assertEquals(List.of(Arrays.asList(1L, 7L, 1L, "one")), run(frame));
  }

  @Test
  void should_concatenate_union_all_inputs() {
    DataFrame frame =
        planner.plan("SELECT a FROM T WHERE b = 3 UNION ALL SELECT id FROM names ORDER BY 1");

    assertEquals(List.of("a"), frame.schema().getFieldNames());
    assertEquals(List.of(List.of(1L), List.of(1L), List.of(3L)), run(frame));
  }

  @Test
  void should_reject_union_all_of_different_column_types() {
    assertThrows(
        SchemaException.class,
        () -> planner.plan("SELECT a FROM T UNION ALL SELECT label FROM names"));
  }

  @Test
  void should_plan_distinct_as_a_grouping() {
    DataFrame frame = planner.plan("SELECT DISTINCT a FROM T ORDER BY a");

    LogicalPlan sort = frame.logicalPlan().getChild().get(0);
    assertInstanceOf(LogicalAggregate.class, sort.getChild().get(0));
    assertEquals(List.of(List.of(1L), List.of(2L)), run(frame));
  }

  @Test
  void should_report_syntax_errors_as_parse_errors() {
    SqlParseException error =
        assertThrows(SqlParseException.class, () -> planner.plan("SELEC a FROM T"));

    assertEquals(ErrorKind.PARSE, error.getKind());
  }

  @Test
  void should_reject_unsupported_syntax() {
    assertThrows(
        SqlParseException.class, () -> planner.plan("SELECT a FROM T UNION SELECT a FROM T"));
    assertThrows(SqlParseException.class, () -> planner.plan("SELECT 1"));
    assertThrows(
        SqlParseException.class,
        () -> planner.plan("SELECT * FROM T LEFT JOIN names ON T.a = names.id AND T.b > 1"));
    assertThrows(SqlParseException.class, () -> planner.plan("SELECT COUNT(DISTINCT a) FROM T"));
  }

  @Test
  void should_report_unknown_tables_and_columns_as_schema_errors() {
    QueryEngineException table =
        assertThrows(SchemaException.class, () -> planner.plan("SELECT a FROM missing"));
    assertEquals(ErrorKind.SCHEMA, table.getKind());
    assertThrows(SchemaException.class, () -> planner.plan("SELECT c FROM T"));
  }

  @Test
  void should_treat_identifiers_as_case_sensitive() {
    assertThrows(SchemaException.class, () -> planner.plan("SELECT A FROM T"));
  }

  @Test
  void should_report_ill_typed_expressions() {
    assertThrows(
        TypeCheckException.class, () -> planner.plan("SELECT a FROM T WHERE a + 'x' > 1"));
  }

  private static LogicalPlan firstJoin(LogicalPlan plan) {
    LogicalPlan current = plan;
    while (!(current instanceof LogicalJoin) && !current.getChild().isEmpty()) {
      current = current.getChild().get(0);
    }
    return current;
  }

  /** Runs every stage of the plan in order on the calling thread. */
  private static List<List<Object>> run(DataFrame frame) {
    StagedPlan staged =
        PlanFragmenter.fragment("sql", new PhysicalPlanCompiler(1, 1).compile(frame.logicalPlan()));
    Map<String, List<List<RecordBatch>>> outputs = new HashMap<>();
    for (ComputeStage stage : staged.getStages()) {
      List<List<RecordBatch>> output = new ArrayList<>();
      for (int i = 0; i < stage.getOutputPartitioning().getPartitionCount(); i++) {
        output.add(new ArrayList<>());
      }
      for (int task = 0; task < stage.getTaskCount(); task++) {
        new StageTaskRunner(
                stage.getFragment(),
                task,
                stage.getOutputPartitioning(),
                OperatorContext.createDefault("sql/" + task),
                (stageId, partition) -> outputs.get(stageId).get(partition).iterator())
            .run(
                new OutputBuffer() {
                  @Override
                  public void enqueue(int partition, RecordBatch batch) {
                    output.get(partition).add(batch);
                  }

                  @Override
                  public void setNoMoreBatches() {}

                  @Override
                  public void abort() {}
                });
      }
      outputs.put(stage.getStageId(), output);
    }
    List<List<Object>> rows = new ArrayList<>();
    outputs.get(staged.getRootStage().getStageId()).get(0).forEach(b -> rows.addAll(b.toRows()));
    return rows;
  }
}
