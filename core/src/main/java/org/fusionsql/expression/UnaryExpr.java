/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.fusionsql.data.type.DataType;
import org.fusionsql.exception.TypeCheckException;

@Getter
@EqualsAndHashCode(callSuper = false)
public class UnaryExpr extends Expression {

  private final UnaryOperator operator;
  private final Expression operand;

  @EqualsAndHashCode.Exclude private final DataType type;

  public UnaryExpr(UnaryOperator operator, Expression operand) {
    this.operator = operator;
    this.operand = operand;
    this.type = operand.isResolved() ? inferType() : null;
  }

  private DataType inferType() {
    DataType input = operand.getType();
    switch (operator) {
      case NOT:
        if (input != DataType.BOOLEAN) {
          throw new TypeCheckException("NOT expects a boolean operand but got " + input);
        }
        return DataType.BOOLEAN;
      case NEGATE:
        if (!input.isNumeric()) {
          throw new TypeCheckException("Negation expects a numeric operand but got " + input);
        }
        return input.getCategory() == DataType.Category.UNSIGNED_INTEGER ? DataType.INT64 : input;
      default:
        return DataType.BOOLEAN;
    }
  }

  @Override
  public DataType getType() {
    if (type == null) {
      throw unresolved();
    }
    return type;
  }

  @Override
  public boolean isNullable() {
    return (operator == UnaryOperator.NOT || operator == UnaryOperator.NEGATE)
        && operand.isNullable();
  }

  @Override
  public boolean isResolved() {
    return type != null;
  }

  @Override
  public String getName() {
    switch (operator) {
      case NOT:
        return "NOT " + operand.getName();
      case NEGATE:
        return "-" + operand.getName();
      case IS_NULL:
        return operand.getName() + " IS NULL";
      default:
        return operand.getName() + " IS NOT NULL";
    }
  }

  @Override
  public List<Expression> getChildren() {
    return ImmutableList.of(operand);
  }

  @Override
  public Expression withChildren(List<Expression> children) {
    Preconditions.checkArgument(children.size() == 1);
    return new UnaryExpr(operator, children.get(0));
  }

  @Override
  public <R, C> R accept(ExpressionNodeVisitor<R, C> visitor, C context) {
    return visitor.visitUnary(this, context);
  }
}
