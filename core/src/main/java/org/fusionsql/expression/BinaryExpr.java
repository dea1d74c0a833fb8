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

/** Arithmetic, comparison or logical operator over two operands. */
@Getter
@EqualsAndHashCode(callSuper = false)
public class BinaryExpr extends Expression {

  private final BinaryOperator operator;
  private final Expression left;
  private final Expression right;

  @EqualsAndHashCode.Exclude private final DataType type;

  public BinaryExpr(BinaryOperator operator, Expression left, Expression right) {
    this.operator = operator;
    this.left = left;
    this.right = right;
    this.type = left.isResolved() && right.isResolved() ? inferType() : null;
  }

  private DataType inferType() {
    DataType l = left.getType();
    DataType r = right.getType();
    switch (operator.getKind()) {
      case ARITHMETIC:
        return DataType.commonNumericType(l, r)
            .orElseThrow(() -> mismatch("numeric operands", l, r));
      case COMPARISON:
        if (!DataType.isComparable(l, r)) {
          throw mismatch("comparable operands", l, r);
        }
        return DataType.BOOLEAN;
      default:
        if (l != DataType.BOOLEAN || r != DataType.BOOLEAN) {
          throw mismatch("boolean operands", l, r);
        }
        return DataType.BOOLEAN;
    }
  }

  private TypeCheckException mismatch(String expected, DataType l, DataType r) {
    return new TypeCheckException(
        String.format(
            "Operator %s expects %s but got %s and %s in [%s]",
            operator.getSymbol(), expected, l, r, getName()));
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
    return left.isNullable() || right.isNullable();
  }

  @Override
  public boolean isResolved() {
    return type != null;
  }

  @Override
  public String getName() {
    return left.getName() + " " + operator.getSymbol() + " " + right.getName();
  }

  @Override
  public List<Expression> getChildren() {
    return ImmutableList.of(left, right);
  }

  @Override
  public Expression withChildren(List<Expression> children) {
    Preconditions.checkArgument(children.size() == 2);
    return new BinaryExpr(operator, children.get(0), children.get(1));
  }

  @Override
  public <R, C> R accept(ExpressionNodeVisitor<R, C> visitor, C context) {
    return visitor.visitBinary(this, context);
  }

  @Override
  public String toString() {
    return "(" + left + " " + operator.getSymbol() + " " + right + ")";
  }
}
