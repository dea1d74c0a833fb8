/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.logical;

import java.util.Arrays;
import java.util.List;
import lombok.experimental.UtilityClass;
import org.fusionsql.expression.Expression;
import org.fusionsql.storage.DataSource;

/** Static builders of logical plan nodes. */
@UtilityClass
public class LogicalPlanDSL {

  public static LogicalPlan scan(String tableName, DataSource source) {
    return new LogicalScan(tableName, source);
  }

  public static LogicalPlan scan(String tableName, DataSource source, String alias) {
    return new LogicalScan(tableName, source, null, alias);
  }

  public static LogicalPlan scan(String tableName, DataSource source, List<String> projection) {
    return new LogicalScan(tableName, source, projection, null);
  }

  public static LogicalPlan filter(LogicalPlan input, Expression condition) {
    return new LogicalFilter(input, condition);
  }

  public static LogicalPlan project(LogicalPlan input, Expression... projectList) {
    return new LogicalProject(input, Arrays.asList(projectList));
  }

  public static LogicalPlan aggregate(
      LogicalPlan input, List<Expression> groupByList, List<Expression> aggregatorList) {
    return new LogicalAggregate(input, groupByList, aggregatorList);
  }

  public static LogicalPlan join(
      LogicalPlan left, LogicalPlan right, JoinType joinType, JoinKey... keys) {
    return new LogicalJoin(left, right, Arrays.asList(keys), joinType);
  }

  public static JoinKey on(Expression left, Expression right) {
    return new JoinKey(left, right);
  }

  public static LogicalPlan sort(LogicalPlan input, SortItem... sortItems) {
    return new LogicalSort(input, Arrays.asList(sortItems));
  }

  public static LogicalPlan limit(LogicalPlan input, long limit) {
    return new LogicalLimit(input, limit, 0);
  }

  public static LogicalPlan limit(LogicalPlan input, long limit, long offset) {
    return new LogicalLimit(input, limit, offset);
  }

  public static LogicalPlan union(LogicalPlan... inputs) {
    return new LogicalUnion(Arrays.asList(inputs));
  }

  public static LogicalPlan repartition(LogicalPlan input, int partitionCount) {
    return new LogicalRepartition(input, partitionCount, List.of());
  }

  public static LogicalPlan repartition(
      LogicalPlan input, int partitionCount, Expression... hashExpressions) {
    return new LogicalRepartition(input, partitionCount, Arrays.asList(hashExpressions));
  }
}
