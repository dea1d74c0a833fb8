/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.dataframe;

import java.util.Arrays;
import java.util.List;
import lombok.EqualsAndHashCode;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.expression.ColumnRef;
import org.fusionsql.expression.Expression;
import org.fusionsql.planner.logical.JoinKey;
import org.fusionsql.planner.logical.JoinType;
import org.fusionsql.planner.logical.LogicalAggregate;
import org.fusionsql.planner.logical.LogicalFilter;
import org.fusionsql.planner.logical.LogicalJoin;
import org.fusionsql.planner.logical.LogicalLimit;
import org.fusionsql.planner.logical.LogicalPlan;
import org.fusionsql.planner.logical.LogicalPlanPrinter;
import org.fusionsql.planner.logical.LogicalProject;
import org.fusionsql.planner.logical.LogicalRepartition;
import org.fusionsql.planner.logical.LogicalScan;
import org.fusionsql.planner.logical.LogicalSort;
import org.fusionsql.planner.logical.LogicalUnion;
import org.fusionsql.planner.logical.SortItem;
import org.fusionsql.storage.DataSource;

/**
 * Immutable query builder. Every operation validates its arguments against the current schema and
 * returns a new frame; the receiver is never modified, so a frame can be shared and extended in
 * several directions.
 */
@EqualsAndHashCode
public final class DataFrame {

  private final LogicalPlan plan;

  private DataFrame(LogicalPlan plan) {
    this.plan = plan;
  }

  public static DataFrame of(LogicalPlan plan) {
    return new DataFrame(plan);
  }

  public static DataFrame scan(String tableName, DataSource source) {
    return new DataFrame(new LogicalScan(tableName, source));
  }

  public DataFrame alias(String alias) {
    if (!(plan instanceof LogicalScan)) {
      throw new IllegalStateException("Only a table scan can be aliased");
    }
    LogicalScan scan = (LogicalScan) plan;
    return new DataFrame(
        new LogicalScan(scan.getTableName(), scan.getSource(), scan.getProjection(), alias));
  }

  public DataFrame select(Expression... expressions) {
    return select(Arrays.asList(expressions));
  }

  public DataFrame select(List<Expression> expressions) {
    return new DataFrame(new LogicalProject(plan, expressions));
  }

  public DataFrame filter(Expression condition) {
    return new DataFrame(new LogicalFilter(plan, condition));
  }

  public DataFrame aggregate(List<Expression> groupBy, List<Expression> aggregates) {
    return new DataFrame(new LogicalAggregate(plan, groupBy, aggregates));
  }

  public DataFrame join(DataFrame right, List<JoinKey> keys, JoinType joinType) {
    return new DataFrame(new LogicalJoin(plan, right.plan, keys, joinType));
  }

  /** Equi-join on one pair of columns. */
  public DataFrame join(DataFrame right, String leftColumn, String rightColumn, JoinType type) {
    return join(
        right, List.of(new JoinKey(new ColumnRef(leftColumn), new ColumnRef(rightColumn))), type);
  }

  public DataFrame sort(SortItem... sortItems) {
    return new DataFrame(new LogicalSort(plan, Arrays.asList(sortItems)));
  }

  public DataFrame limit(long limit) {
    return new DataFrame(new LogicalLimit(plan, limit, 0));
  }

  public DataFrame limit(long limit, long offset) {
    return new DataFrame(new LogicalLimit(plan, limit, offset));
  }

  public DataFrame union(DataFrame other) {
    return new DataFrame(new LogicalUnion(List.of(plan, other.plan)));
  }

  public DataFrame repartition(int partitionCount) {
    return new DataFrame(new LogicalRepartition(plan, partitionCount, List.of()));
  }

  public DataFrame repartitionByHash(int partitionCount, Expression... keys) {
    return new DataFrame(new LogicalRepartition(plan, partitionCount, Arrays.asList(keys)));
  }

  /**
   * Returns a reference to an output column, bound to its field.
   *
   * @throws org.fusionsql.exception.SchemaException if the column is absent or ambiguous
   */
  public ColumnRef col(String name) {
    Field field = plan.getSchema().getField(name);
    return new ColumnRef(name).bind(field);
  }

  public Schema schema() {
    return plan.getSchema();
  }

  public LogicalPlan logicalPlan() {
    return plan;
  }

  public String explain() {
    return LogicalPlanPrinter.print(plan);
  }

  @Override
  public String toString() {
    return "DataFrame" + plan.getSchema();
  }
}
