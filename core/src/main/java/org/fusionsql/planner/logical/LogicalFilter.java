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
import org.fusionsql.data.type.DataType;
import org.fusionsql.exception.TypeCheckException;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionBinder;
import org.fusionsql.expression.ExpressionUtils;

/** Keeps the rows for which the predicate is true. Null counts as false. */
@Getter
@EqualsAndHashCode(callSuper = true)
public class LogicalFilter extends LogicalPlan {

  private final Expression condition;

  public LogicalFilter(LogicalPlan child, Expression condition) {
    super(List.of(child));
    Expression bound = ExpressionBinder.bind(condition, child.getSchema());
    if (ExpressionUtils.containsAggregate(bound)) {
      throw new TypeCheckException("Aggregate functions are not allowed in a filter: " + bound);
    }
    if (bound.getType() != DataType.BOOLEAN) {
      throw new TypeCheckException(
          String.format("Filter condition must be BOOLEAN but %s is %s", bound, bound.getType()));
    }
    this.condition = bound;
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
    return new LogicalFilter(children.get(0), condition);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitFilter(this, context);
  }
}
