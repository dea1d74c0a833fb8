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
public class CastExpr extends Expression {

  private final Expression child;
  private final DataType targetType;

  public CastExpr(Expression child, DataType targetType) {
    this.child = child;
    this.targetType = targetType;
    if (child.isResolved() && !canCast(child.getType(), targetType)) {
      throw new TypeCheckException(
          String.format("Cannot cast %s to %s", child.getType(), targetType));
    }
  }

  /**
   * Supported conversions: anything to and from UTF8, between numeric types, between booleans and
   * numbers, and between timestamps and integers.
   */
  public static boolean canCast(DataType from, DataType to) {
    if (from == to || from == DataType.UTF8 || to == DataType.UTF8) {
      return true;
    }
    if (from.isNumeric() && to.isNumeric()) {
      return true;
    }
    if (from == DataType.BOOLEAN) {
      return to.isNumeric();
    }
    if (to == DataType.BOOLEAN) {
      return from.isNumeric();
    }
    if (from == DataType.TIMESTAMP) {
      return to.isInteger();
    }
    return to == DataType.TIMESTAMP && from.isInteger();
  }

  @Override
  public DataType getType() {
    if (!child.isResolved()) {
      throw unresolved();
    }
    return targetType;
  }

  @Override
  public boolean isNullable() {
    return child.isNullable();
  }

  @Override
  public boolean isResolved() {
    return child.isResolved();
  }

  @Override
  public String getName() {
    return "CAST(" + child.getName() + " AS " + targetType.getSqlName() + ")";
  }

  @Override
  public List<Expression> getChildren() {
    return ImmutableList.of(child);
  }

  @Override
  public Expression withChildren(List<Expression> children) {
    Preconditions.checkArgument(children.size() == 1);
    return new CastExpr(children.get(0), targetType);
  }

  @Override
  public <R, C> R accept(ExpressionNodeVisitor<R, C> visitor, C context) {
    return visitor.visitCast(this, context);
  }
}
