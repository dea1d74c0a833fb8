/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.logical;

import com.google.common.base.Preconditions;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.exception.TypeCheckException;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionBinder;
import org.fusionsql.expression.ExpressionUtils;

/**
 * Redistributes rows over {@code partitionCount} partitions, by hash of the hash expressions or
 * round robin when there are none.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class LogicalRepartition extends LogicalPlan {

  private final int partitionCount;
  private final List<Expression> hashExpressions;

  public LogicalRepartition(
      LogicalPlan child, int partitionCount, List<Expression> hashExpressions) {
    super(List.of(child));
    Preconditions.checkArgument(partitionCount > 0, "Partition count must be positive");
    this.partitionCount = partitionCount;
    this.hashExpressions =
        List.copyOf(ExpressionBinder.bindAll(hashExpressions, child.getSchema()));
    for (Expression expression : this.hashExpressions) {
      if (ExpressionUtils.containsAggregate(expression)) {
        throw new TypeCheckException("Aggregate functions are not allowed in a partition key");
      }
    }
  }

  public boolean isRoundRobin() {
    return hashExpressions.isEmpty();
  }

  public LogicalPlan getInput() {
    return getChild().get(0);
  }

  @Override
  public Schema getSchema() {
    return getInput().getSchema();
  }

  @Override
  public LogicalPlan replaceChildPlans(List<LogicalPlan> children) {
    Preconditions.checkArgument(children.size() == 1);
    return new LogicalRepartition(children.get(0), partitionCount, hashExpressions);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitRepartition(this, context);
  }
}
