/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.logical;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.exception.TypeCheckException;
import org.fusionsql.expression.AggregateExpr;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionBinder;
import org.fusionsql.expression.ExpressionUtils;

/**
 * Groups rows by the group expressions and computes the aggregates per group. The output has the
 * group columns first, then one column per aggregate. Without group expressions the node yields
 * exactly one row.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class LogicalAggregate extends LogicalPlan {

  private final List<Expression> groupByList;
  private final List<Expression> aggregatorList;
  @EqualsAndHashCode.Exclude private final Schema schema;

  public LogicalAggregate(
      LogicalPlan child, List<Expression> groupByList, List<Expression> aggregatorList) {
    super(List.of(child));
    Schema input = child.getSchema();
    this.groupByList = List.copyOf(ExpressionBinder.bindAll(groupByList, input));
    for (Expression group : this.groupByList) {
      if (ExpressionUtils.containsAggregate(group)) {
        throw new TypeCheckException("Aggregate functions are not allowed in GROUP BY: " + group);
      }
    }
    this.aggregatorList = List.copyOf(ExpressionBinder.bindAll(aggregatorList, input));
    for (Expression aggregator : this.aggregatorList) {
      if (!(ExpressionUtils.stripAlias(aggregator) instanceof AggregateExpr)) {
        throw new TypeCheckException("Expected an aggregate function but got " + aggregator);
      }
    }
    this.schema =
        LogicalProject.outputSchema(
            ImmutableList.<Expression>builder()
                .addAll(this.groupByList)
                .addAll(this.aggregatorList)
                .build());
  }

  public LogicalPlan getInput() {
    return getChild().get(0);
  }

  @Override
  public LogicalPlan replaceChildPlans(List<LogicalPlan> children) {
    Preconditions.checkArgument(children.size() == 1);
    return new LogicalAggregate(children.get(0), groupByList, aggregatorList);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitAggregate(this, context);
  }
}
