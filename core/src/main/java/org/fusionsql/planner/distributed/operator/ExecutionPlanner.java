/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import java.util.ArrayList;
import java.util.List;
import org.fusionsql.expression.AggregateExpr;
import org.fusionsql.expression.eval.CompiledExpression;
import org.fusionsql.expression.eval.ExpressionCompiler;
import org.fusionsql.planner.distributed.exchange.ExchangeManager;
import org.fusionsql.planner.logical.SortItem;
import org.fusionsql.planner.physical.AggregationMode;
import org.fusionsql.planner.physical.ExchangeSourceExec;
import org.fusionsql.planner.physical.FilterExec;
import org.fusionsql.planner.physical.HashAggregateExec;
import org.fusionsql.planner.physical.HashJoinExec;
import org.fusionsql.planner.physical.LimitExec;
import org.fusionsql.planner.physical.PhysicalPlan;
import org.fusionsql.planner.physical.PhysicalPlanNodeVisitor;
import org.fusionsql.planner.physical.ProjectExec;
import org.fusionsql.planner.physical.RepartitionExec;
import org.fusionsql.planner.physical.ScanExec;
import org.fusionsql.planner.physical.SortExec;
import org.fusionsql.planner.physical.UnionExec;

/**
 * Turns a stage fragment into the operator tree of one task. The visitor context is the partition
 * the task computes. Fragments must not contain {@link RepartitionExec}: those are stage
 * boundaries and are replaced by {@link ExchangeSourceExec} when the plan is fragmented.
 */
public class ExecutionPlanner implements PhysicalPlanNodeVisitor<PhysicalOperator, Integer> {

  private final OperatorContext context;
  private final ExchangeManager exchangeManager;

  public ExecutionPlanner(OperatorContext context, ExchangeManager exchangeManager) {
    this.context = context;
    this.exchangeManager = exchangeManager;
  }

  /** Builds the operator tree computing {@code partition} of the fragment. */
  public PhysicalOperator plan(PhysicalPlan fragment, int partition) {
    int count = fragment.getPartitioning().getPartitionCount();
    if (partition < 0 || partition >= count) {
      throw new IllegalArgumentException(
          String.format("Partition %d out of range, fragment has %d partitions", partition, count));
    }
    return fragment.accept(this, partition);
  }

  @Override
  public PhysicalOperator visitScan(ScanExec node, Integer partition) {
    return new ScanOperator(
        context,
        node.getSchema(),
        node.getSource(),
        node.getProjection(),
        partition,
        node.getPartitionCount());
  }

  @Override
  public PhysicalOperator visitFilter(FilterExec node, Integer partition) {
    PhysicalOperator input = node.getInput().accept(this, partition);
    return new FilterOperator(
        context, input, ExpressionCompiler.compile(node.getCondition(), input.getSchema()));
  }

  @Override
  public PhysicalOperator visitProject(ProjectExec node, Integer partition) {
    PhysicalOperator input = node.getInput().accept(this, partition);
    return new ProjectionOperator(
        context,
        node.getSchema(),
        input,
        ExpressionCompiler.compileAll(node.getProjectList(), input.getSchema()));
  }

  @Override
  public PhysicalOperator visitHashAggregate(HashAggregateExec node, Integer partition) {
    PhysicalOperator input = node.getInput().accept(this, partition);
    List<AggregateExpr> aggregates = node.getAggregates();
    List<CompiledExpression> groupKeys;
    List<CompiledExpression> arguments = new ArrayList<>(aggregates.size());
    if (node.getMode() == AggregationMode.FINAL) {
      // Group values are the leading columns of the partial states.
      groupKeys = new ArrayList<>(node.getGroupByList().size());
      for (int i = 0; i < node.getGroupByList().size(); i++) {
        int column = i;
        groupKeys.add(batch -> batch.getColumn(column));
      }
    } else {
      groupKeys = ExpressionCompiler.compileAll(node.getGroupByList(), input.getSchema());
      for (AggregateExpr aggregate : aggregates) {
        arguments.add(
            aggregate.isCountStar()
                ? null
                : ExpressionCompiler.compile(aggregate.getArgument(), input.getSchema()));
      }
    }
    return new HashAggregateOperator(
        context, node.getSchema(), input, node.getMode(), groupKeys, aggregates, arguments);
  }

  @Override
  public PhysicalOperator visitHashJoin(HashJoinExec node, Integer partition) {
    PhysicalOperator left = node.getLeft().accept(this, partition);
    PhysicalOperator right = node.getRight().accept(this, partition);
    return new HashJoinOperator(
        context,
        node.getSchema(),
        left,
        right,
        node.getJoinType(),
        ExpressionCompiler.compileAll(node.getLeftKeys(), left.getSchema()),
        ExpressionCompiler.compileAll(node.getRightKeys(), right.getSchema()));
  }

  @Override
  public PhysicalOperator visitSort(SortExec node, Integer partition) {
    PhysicalOperator input = node.getInput().accept(this, partition);
    List<SortOperator.SortKey> keys = new ArrayList<>(node.getSortList().size());
    for (SortItem item : node.getSortList()) {
      keys.add(
          new SortOperator.SortKey(
              ExpressionCompiler.compile(item.getExpression(), input.getSchema()),
              item.isAscending(),
              item.isNullsFirst()));
    }
    return new SortOperator(context, input, keys);
  }

  @Override
  public PhysicalOperator visitLimit(LimitExec node, Integer partition) {
    return new LimitOperator(
        context, node.getInput().accept(this, partition), node.getLimit(), node.getOffset());
  }

  /** Partition {@code p} of a union is one partition of one input, inputs taken in order. */
  @Override
  public PhysicalOperator visitUnion(UnionExec node, Integer partition) {
    int remaining = partition;
    for (PhysicalPlan input : node.getChildren()) {
      int count = input.getPartitioning().getPartitionCount();
      if (remaining < count) {
        return new UnionOperator(
            context, node.getSchema(), List.of(input.accept(this, remaining)));
      }
      remaining -= count;
    }
    throw new IllegalArgumentException("Union has no partition " + partition);
  }

  @Override
  public PhysicalOperator visitRepartition(RepartitionExec node, Integer partition) {
    throw new IllegalStateException(
        "Repartition must be replaced by an exchange before execution: " + node.describe());
  }

  @Override
  public PhysicalOperator visitExchangeSource(ExchangeSourceExec node, Integer partition) {
    return new ExchangeSourceOperator(
        context, node.getSchema(), exchangeManager, node.getSourceStageId(), partition);
  }
}
