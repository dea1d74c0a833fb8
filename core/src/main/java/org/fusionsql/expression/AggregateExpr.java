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

/**
 * Aggregate function call. A null argument stands for {@code COUNT(*)}. Aggregates are only
 * legal as top-level aggregate expressions of an aggregate plan node, possibly under an alias.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class AggregateExpr extends Expression {

  private final AggregateFunction function;
  private final Expression argument;

  @EqualsAndHashCode.Exclude private final DataType type;

  public AggregateExpr(AggregateFunction function, Expression argument) {
    Preconditions.checkArgument(
        argument != null || function == AggregateFunction.COUNT, "Only COUNT accepts '*'");
    this.function = function;
    this.argument = argument;
    this.type = argument == null || argument.isResolved() ? inferType() : null;
  }

  public static AggregateExpr countStar() {
    return new AggregateExpr(AggregateFunction.COUNT, null);
  }

  public boolean isCountStar() {
    return argument == null;
  }

  private DataType inferType() {
    if (argument != null && ExpressionUtils.containsAggregate(argument)) {
      throw new TypeCheckException("Aggregate calls cannot be nested: " + getName());
    }
    switch (function) {
      case COUNT:
        return DataType.INT64;
      case SUM:
        requireNumeric();
        return argument.getType().isFloating() ? DataType.FLOAT64 : DataType.INT64;
      case AVG:
        requireNumeric();
        return DataType.FLOAT64;
      default:
        if (argument.getType() == DataType.BOOLEAN) {
          throw new TypeCheckException(function + " is not defined for BOOLEAN");
        }
        return argument.getType();
    }
  }

  private void requireNumeric() {
    if (!argument.getType().isNumeric()) {
      throw new TypeCheckException(
          String.format("%s expects a numeric argument but got %s", function, argument.getType()));
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
    return function != AggregateFunction.COUNT;
  }

  @Override
  public boolean isResolved() {
    return type != null;
  }

  @Override
  public String getName() {
    return function + "(" + (argument == null ? "*" : argument.getName()) + ")";
  }

  @Override
  public List<Expression> getChildren() {
    return argument == null ? ImmutableList.of() : ImmutableList.of(argument);
  }

  @Override
  public Expression withChildren(List<Expression> children) {
    return children.isEmpty() ? this : new AggregateExpr(function, children.get(0));
  }

  @Override
  public <R, C> R accept(ExpressionNodeVisitor<R, C> visitor, C context) {
    return visitor.visitAggregate(this, context);
  }
}
