/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.physical;

import com.google.common.math.LongMath;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.fusionsql.common.setting.EngineSettings;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.expression.ColumnRef;
import org.fusionsql.expression.Expression;
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

/**
 * Maps every logical node to a physical node and inserts the repartitions the chosen algorithms
 * need.
 *
 * <ul>
 *   <li>Scans are split into {@code min(target partitions, worker pool size)} partitions.
 *   <li>A join hash-repartitions both inputs by their keys unless they are co-partitioned already.
 *   <li>An aggregation runs partially per partition, hash-repartitions the partial states by the
 *       group keys and merges them. A global aggregation merges in a single partition.
 *   <li>A sort gathers its input into a single partition.
 *   <li>A limit truncates each partition, gathers, then applies offset and limit once.
 * </ul>
 */
@Log4j2
public class PhysicalPlanCompiler implements LogicalPlanNodeVisitor<PhysicalPlan, Void> {

  @Getter private final int partitionCount;
  private final int workerPoolSize;

  public PhysicalPlanCompiler(int targetPartitions, int workerPoolSize) {
    this.workerPoolSize = Math.max(1, workerPoolSize);
    this.partitionCount = Math.max(1, Math.min(targetPartitions, this.workerPoolSize));
  }

  public PhysicalPlanCompiler(EngineSettings settings) {
    this(settings.getTargetPartitions(), settings.getWorkerPoolSize());
  }

  public PhysicalPlan compile(LogicalPlan plan) {
    PhysicalPlan physical = plan.accept(this, null);
    log.debug("Physical plan:\n{}", physical);
    return physical;
  }

  private PhysicalPlan toPhysical(LogicalPlan plan) {
    return plan.accept(this, null);
  }

  @Override
  public PhysicalPlan visitScan(LogicalScan plan, Void context) {
    return new ScanExec(
        plan.getTableName(),
        plan.getSource(),
        plan.getProjection(),
        plan.getQualifier(),
        partitionCount);
  }

  @Override
  public PhysicalPlan visitFilter(LogicalFilter plan, Void context) {
    return new FilterExec(toPhysical(plan.getInput()), plan.getCondition());
  }

  @Override
  public PhysicalPlan visitProject(LogicalProject plan, Void context) {
    return new ProjectExec(toPhysical(plan.getInput()), plan.getProjectList());
  }

  @Override
  public PhysicalPlan visitAggregate(LogicalAggregate plan, Void context) {
    PhysicalPlan input = toPhysical(plan.getInput());
    List<Expression> groups = plan.getGroupByList();
    List<Expression> aggregates = plan.getAggregatorList();
    PartitioningScheme inputPartitioning = input.getPartitioning();
    if (inputPartitioning.getPartitionCount() == 1
        || (!groups.isEmpty()
            && inputPartitioning.isHashPartitionedWithin(groups, input.getSchema()))) {
      return new HashAggregateExec(input, AggregationMode.SINGLE, groups, aggregates);
    }
    HashAggregateExec partial =
        new HashAggregateExec(input, AggregationMode.PARTIAL, groups, aggregates);
    PartitioningScheme exchange = groups.isEmpty()
        ? PartitioningScheme.single()
        : PartitioningScheme.hash(groupColumns(partial.getSchema(), groups.size()), partitionCount);
    return new HashAggregateExec(
        new RepartitionExec(partial, exchange),
        AggregationMode.FINAL,
        groups,
        aggregates,
        input.getSchema());
  }

  private static List<Expression> groupColumns(Schema partialSchema, int groupCount) {
    List<Expression> keys = new ArrayList<>(groupCount);
    for (int i = 0; i < groupCount; i++) {
      Field field = partialSchema.getField(i);
      keys.add(new ColumnRef(field.getQualifiedName()));
    }
    return keys;
  }

  @Override
  public PhysicalPlan visitJoin(LogicalJoin plan, Void context) {
    PhysicalPlan left = toPhysical(plan.getLeft());
    PhysicalPlan right = toPhysical(plan.getRight());
    List<Expression> leftKeys = plan.getLeftKeys();
    List<Expression> rightKeys = plan.getRightKeys();
    if (!left.getPartitioning().isSingle() || !right.getPartitioning().isSingle()) {
      left = ensureHashPartitioned(left, leftKeys);
      right = ensureHashPartitioned(right, rightKeys);
    }
    return new HashJoinExec(left, right, leftKeys, rightKeys, plan.getJoinType());
  }

  private PhysicalPlan ensureHashPartitioned(PhysicalPlan plan, List<Expression> keys) {
    if (plan.getPartitioning().isHashPartitionedOn(keys, plan.getSchema(), partitionCount)) {
      return plan;
    }
    return new RepartitionExec(plan, PartitioningScheme.hash(keys, partitionCount));
  }

  @Override
  public PhysicalPlan visitSort(LogicalSort plan, Void context) {
    return new SortExec(gather(toPhysical(plan.getInput())), plan.getSortList());
  }

  @Override
  public PhysicalPlan visitLimit(LogicalLimit plan, Void context) {
    PhysicalPlan input = toPhysical(plan.getInput());
    if (!input.getPartitioning().isSingle()) {
      long localLimit = LongMath.saturatedAdd(plan.getLimit(), plan.getOffset());
      input = gather(new LimitExec(input, localLimit, 0));
    }
    return new LimitExec(input, plan.getLimit(), plan.getOffset());
  }

  @Override
  public PhysicalPlan visitUnion(LogicalUnion plan, Void context) {
    return new UnionExec(
        plan.getChild().stream().map(this::toPhysical).collect(Collectors.toList()));
  }

  @Override
  public PhysicalPlan visitRepartition(LogicalRepartition plan, Void context) {
    int count = Math.max(1, Math.min(plan.getPartitionCount(), workerPoolSize));
    PartitioningScheme target = plan.isRoundRobin() || count == 1
        ? PartitioningScheme.roundRobin(count)
        : PartitioningScheme.hash(plan.getHashExpressions(), count);
    return new RepartitionExec(toPhysical(plan.getInput()), target);
  }

  private static PhysicalPlan gather(PhysicalPlan plan) {
    return plan.getPartitioning().isSingle()
        ? plan
        : new RepartitionExec(plan, PartitioningScheme.single());
  }
}
