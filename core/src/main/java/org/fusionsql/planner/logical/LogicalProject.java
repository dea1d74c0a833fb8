/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.logical;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.exception.TypeCheckException;
import org.fusionsql.expression.ColumnRef;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionBinder;
import org.fusionsql.expression.ExpressionUtils;

/**
 * Computes one output column per expression. A bare column reference passes its input field
 * through, qualifier included; any other expression produces an unqualified field named after it.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class LogicalProject extends LogicalPlan {

  private final List<Expression> projectList;
  @EqualsAndHashCode.Exclude private final Schema schema;

  public LogicalProject(LogicalPlan child, List<Expression> projectList) {
    super(List.of(child));
    Preconditions.checkArgument(!projectList.isEmpty(), "Projection list must not be empty");
    List<Expression> bound = ExpressionBinder.bindAll(projectList, child.getSchema());
    for (Expression expression : bound) {
      if (ExpressionUtils.containsAggregate(expression)) {
        throw new TypeCheckException(
            "Aggregate functions are only allowed in an aggregation: " + expression);
      }
    }
    this.projectList = List.copyOf(bound);
    this.schema = outputSchema(this.projectList);
  }

  /** Output schema of a list of projected expressions. */
  public static Schema outputSchema(List<Expression> expressions) {
    List<Field> fields = new ArrayList<>(expressions.size());
    for (Expression expression : expressions) {
      fields.add(outputField(expression));
    }
    return new Schema(fields);
  }

  public static Field outputField(Expression expression) {
    if (expression instanceof ColumnRef) {
      return ((ColumnRef) expression).getField();
    }
    return new Field(expression.getName(), expression.getType(), expression.isNullable());
  }

  public LogicalPlan getInput() {
    return getChild().get(0);
  }

  @Override
  public LogicalPlan replaceChildPlans(List<LogicalPlan> children) {
    Preconditions.checkArgument(children.size() == 1);
    return new LogicalProject(children.get(0), projectList);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitProject(this, context);
  }
}
