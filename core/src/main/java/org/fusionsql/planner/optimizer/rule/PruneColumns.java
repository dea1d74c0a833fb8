/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.optimizer.rule;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.expression.AggregateExpr;
import org.fusionsql.expression.ColumnRef;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionUtils;
import org.fusionsql.planner.logical.LogicalAggregate;
import org.fusionsql.planner.logical.LogicalFilter;
import org.fusionsql.planner.logical.LogicalJoin;
import org.fusionsql.planner.logical.LogicalLimit;
import org.fusionsql.planner.logical.LogicalPlan;
import org.fusionsql.planner.logical.LogicalPlanNodeVisitor;
import org.fusionsql.planner.logical.LogicalProject;
import org.fusionsql.planner.logical.LogicalRepartition;
import org.fusionsql.planner.logical.LogicalScan;
import org.fusionsql.planner.logical.LogicalSort;
import org.fusionsql.planner.logical.LogicalUnion;
import org.fusionsql.planner.logical.SortItem;
import org.fusionsql.planner.optimizer.OptimizerPass;

/**
 * Removes columns no ancestor reads. The pass walks the plan top-down with the set of output
 * positions the parent needs: scans narrow their projection and projections drop unread
 * expressions. The root keeps its whole output. Union inputs keep their whole output since every
 * input has to keep the same columns.
 */
public class PruneColumns
    implements OptimizerPass, LogicalPlanNodeVisitor<LogicalPlan, SortedSet<Integer>> {

  @Override
  public String getName() {
    return "projection_pruning";
  }

  @Override
  public LogicalPlan apply(LogicalPlan plan) {
    return plan.accept(this, allColumns(plan.getSchema()));
  }

  @Override
  public LogicalPlan visitScan(LogicalScan plan, SortedSet<Integer> required) {
    List<String> projection = plan.getProjection();
    List<String> kept =
        required.stream().map(projection::get).collect(Collectors.toList());
    if (kept.isEmpty()) {
      kept = List.of(projection.get(0));
    }
    return kept.equals(projection) ? plan : plan.withProjection(kept);
  }

  @Override
  public LogicalPlan visitFilter(LogicalFilter plan, SortedSet<Integer> required) {
    SortedSet<Integer> childRequired = new TreeSet<>(required);
    addReferences(plan.getCondition(), plan.getInput().getSchema(), childRequired);
    return withChildren(plan, prune(plan.getInput(), childRequired));
  }

  @Override
  public LogicalPlan visitProject(LogicalProject plan, SortedSet<Integer> required) {
    List<Expression> projectList = plan.getProjectList();
    List<Expression> kept =
        required.stream().map(projectList::get).collect(Collectors.toList());
    if (kept.isEmpty()) {
      kept = List.of(projectList.get(0));
    }
    SortedSet<Integer> childRequired = new TreeSet<>();
    Schema input = plan.getInput().getSchema();
    kept.forEach(expression -> addReferences(expression, input, childRequired));
    LogicalPlan child = prune(plan.getInput(), childRequired);
    if (kept.size() == projectList.size() && child == plan.getInput()) {
      return plan;
    }
    return new LogicalProject(child, kept);
  }

  @Override
  public LogicalPlan visitAggregate(LogicalAggregate plan, SortedSet<Integer> required) {
    SortedSet<Integer> childRequired = new TreeSet<>();
    Schema input = plan.getInput().getSchema();
    plan.getGroupByList().forEach(e -> addReferences(e, input, childRequired));
    for (Expression aggregator : plan.getAggregatorList()) {
      AggregateExpr aggregate = (AggregateExpr) ExpressionUtils.stripAlias(aggregator);
      if (!aggregate.isCountStar()) {
        addReferences(aggregate.getArgument(), input, childRequired);
      }
    }
    return withChildren(plan, prune(plan.getInput(), childRequired));
  }

  @Override
  public LogicalPlan visitJoin(LogicalJoin plan, SortedSet<Integer> required) {
    Schema leftSchema = plan.getLeft().getSchema();
    Schema rightSchema = plan.getRight().getSchema();
    int leftSize = leftSchema.size();
    SortedSet<Integer> leftRequired = new TreeSet<>(required.headSet(leftSize));
    SortedSet<Integer> rightRequired = new TreeSet<>();
    if (plan.getJoinType().outputsRight()) {
      required.tailSet(leftSize).forEach(i -> rightRequired.add(i - leftSize));
    }
    plan.getLeftKeys().forEach(e -> addReferences(e, leftSchema, leftRequired));
    plan.getRightKeys().forEach(e -> addReferences(e, rightSchema, rightRequired));
    LogicalPlan left = prune(plan.getLeft(), leftRequired);
    LogicalPlan right = prune(plan.getRight(), rightRequired);
    if (left == plan.getLeft() && right == plan.getRight()) {
      return plan;
    }
    return plan.replaceChildPlans(List.of(left, right));
  }

  @Override
  public LogicalPlan visitSort(LogicalSort plan, SortedSet<Integer> required) {
    SortedSet<Integer> childRequired = new TreeSet<>(required);
    Schema input = plan.getInput().getSchema();
    for (SortItem item : plan.getSortList()) {
      addReferences(item.getExpression(), input, childRequired);
    }
    return withChildren(plan, prune(plan.getInput(), childRequired));
  }

  @Override
  public LogicalPlan visitLimit(LogicalLimit plan, SortedSet<Integer> required) {
    return withChildren(plan, prune(plan.getInput(), required));
  }

  @Override
  public LogicalPlan visitUnion(LogicalUnion plan, SortedSet<Integer> required) {
    List<LogicalPlan> inputs = new ArrayList<>();
    boolean changed = false;
    for (LogicalPlan input : plan.getChild()) {
      LogicalPlan pruned = prune(input, allColumns(input.getSchema()));
      changed |= pruned != input;
      inputs.add(pruned);
    }
    return changed ? plan.replaceChildPlans(inputs) : plan;
  }

  @Override
  public LogicalPlan visitRepartition(LogicalRepartition plan, SortedSet<Integer> required) {
    SortedSet<Integer> childRequired = new TreeSet<>(required);
    Schema input = plan.getInput().getSchema();
    plan.getHashExpressions().forEach(e -> addReferences(e, input, childRequired));
    return withChildren(plan, prune(plan.getInput(), childRequired));
  }

  private LogicalPlan prune(LogicalPlan plan, SortedSet<Integer> required) {
    return plan.accept(this, required);
  }

  private static LogicalPlan withChildren(LogicalPlan plan, LogicalPlan child) {
    return child == plan.getChild().get(0) ? plan : plan.replaceChildPlans(List.of(child));
  }

  private static void addReferences(
      Expression expression, Schema input, SortedSet<Integer> required) {
    for (ColumnRef ref : ExpressionUtils.columnRefs(expression)) {
      required.add(input.indexOf(ref.getReference()));
    }
  }

  private static SortedSet<Integer> allColumns(Schema schema) {
    return IntStream.range(0, schema.size())
        .boxed()
        .collect(Collectors.toCollection(TreeSet::new));
  }
}
