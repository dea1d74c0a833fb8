/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.logical;

import java.util.List;
import java.util.stream.Collectors;
import org.fusionsql.expression.Expression;

/** Renders a logical plan as an indented tree, one node per line. */
public class LogicalPlanPrinter implements LogicalPlanNodeVisitor<String, Void> {

  private static final LogicalPlanPrinter INSTANCE = new LogicalPlanPrinter();

  public static String print(LogicalPlan plan) {
    StringBuilder out = new StringBuilder();
    print(plan, 0, out);
    return out.toString();
  }

  private static void print(LogicalPlan plan, int depth, StringBuilder out) {
    out.append("  ".repeat(depth)).append(plan.accept(INSTANCE, null)).append('\n');
    for (LogicalPlan child : plan.getChild()) {
      print(child, depth + 1, out);
    }
  }

  private static String list(List<?> items) {
    return items.stream().map(Object::toString).collect(Collectors.joining(", "));
  }

  @Override
  public String visitScan(LogicalScan plan, Void context) {
    return String.format(
        "Scan: %s%s projection=[%s]",
        plan.getTableName(),
        plan.getAlias() == null ? "" : " AS " + plan.getAlias(),
        list(plan.getProjection()));
  }

  @Override
  public String visitFilter(LogicalFilter plan, Void context) {
    return "Filter: " + plan.getCondition();
  }

  @Override
  public String visitProject(LogicalProject plan, Void context) {
    return "Project: " + list(plan.getProjectList());
  }

  @Override
  public String visitAggregate(LogicalAggregate plan, Void context) {
    return String.format(
        "Aggregate: groupBy=[%s] aggregates=[%s]",
        list(plan.getGroupByList()), list(plan.getAggregatorList()));
  }

  @Override
  public String visitJoin(LogicalJoin plan, Void context) {
    return String.format("Join: %s on=[%s]", plan.getJoinType(), list(plan.getJoinKeys()));
  }

  @Override
  public String visitSort(LogicalSort plan, Void context) {
    return "Sort: " + list(plan.getSortList());
  }

  @Override
  public String visitLimit(LogicalLimit plan, Void context) {
    return String.format("Limit: limit=%d offset=%d", plan.getLimit(), plan.getOffset());
  }

  @Override
  public String visitUnion(LogicalUnion plan, Void context) {
    return "Union: inputs=" + plan.getChild().size();
  }

  @Override
  public String visitRepartition(LogicalRepartition plan, Void context) {
    List<Expression> keys = plan.getHashExpressions();
    return keys.isEmpty()
        ? "Repartition: round_robin(" + plan.getPartitionCount() + ")"
        : String.format("Repartition: hash([%s], %d)", list(keys), plan.getPartitionCount());
  }
}
