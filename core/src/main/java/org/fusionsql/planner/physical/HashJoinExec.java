/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.physical;

import com.google.common.base.Preconditions;
import java.util.List;
import lombok.Getter;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionBinder;
import org.fusionsql.planner.logical.JoinType;
import org.fusionsql.planner.logical.LogicalJoin;

/**
 * Hash equi-join. Both inputs have the same number of partitions and partition {@code i} of the
 * left input only meets partition {@code i} of the right input, so matching rows have to be
 * co-partitioned by the keys.
 */
@Getter
public class HashJoinExec extends PhysicalPlan {

  private final PhysicalPlan left;
  private final PhysicalPlan right;
  private final List<Expression> leftKeys;
  private final List<Expression> rightKeys;
  private final JoinType joinType;
  private final Schema schema;

  public HashJoinExec(
      PhysicalPlan left,
      PhysicalPlan right,
      List<Expression> leftKeys,
      List<Expression> rightKeys,
      JoinType joinType) {
    super(List.of(left, right));
    Preconditions.checkArgument(
        leftKeys.size() == rightKeys.size() && !leftKeys.isEmpty(), "Unbalanced join keys");
    Preconditions.checkArgument(
        left.getPartitioning().getPartitionCount() == right.getPartitioning().getPartitionCount(),
        "Join inputs must have the same partition count");
    this.left = left;
    this.right = right;
    this.leftKeys = List.copyOf(ExpressionBinder.bindAll(leftKeys, left.getSchema()));
    this.rightKeys = List.copyOf(ExpressionBinder.bindAll(rightKeys, right.getSchema()));
    this.joinType = joinType;
    this.schema = LogicalJoin.outputSchema(left.getSchema(), right.getSchema(), joinType);
  }

  @Override
  public PartitioningScheme getPartitioning() {
    int count = left.getPartitioning().getPartitionCount();
    if (count == 1) {
      return PartitioningScheme.single();
    }
    List<Expression> keys;
    if (joinType == JoinType.FULL) {
      return PartitioningScheme.roundRobin(count);
    } else if (joinType == JoinType.RIGHT) {
      keys = rightKeys;
    } else {
      keys = leftKeys;
    }
    return PartitioningScheme.columnKeys(keys, schema)
        .map(k -> PartitioningScheme.hash(k, count))
        .orElse(PartitioningScheme.roundRobin(count));
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.HASH_JOIN;
  }

  @Override
  public String describe() {
    return String.format(
        "HashJoinExec[%s, left=%s, right=%s]", joinType, leftKeys, rightKeys);
  }

  @Override
  public <R, C> R accept(PhysicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitHashJoin(this, context);
  }
}
