/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.fusionsql.data.type.DataType;
import org.fusionsql.expression.function.ScalarFunction;

/** Call of a registered scalar function. */
@Getter
@EqualsAndHashCode(callSuper = false)
public class ScalarFunctionExpr extends Expression {

  @EqualsAndHashCode.Exclude private final ScalarFunction function;
  private final String functionName;
  private final List<Expression> arguments;

  @EqualsAndHashCode.Exclude private final DataType type;

  public ScalarFunctionExpr(ScalarFunction function, List<Expression> arguments) {
    this.function = function;
    this.functionName = function.getName();
    this.arguments = ImmutableList.copyOf(arguments);
    this.type =
        this.arguments.stream().allMatch(Expression::isResolved)
            ? function.getReturnType(
                this.arguments.stream().map(Expression::getType).collect(Collectors.toList()))
            : null;
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
    if (function.isNullPropagating()) {
      return arguments.stream().anyMatch(Expression::isNullable);
    }
    return arguments.stream().allMatch(Expression::isNullable);
  }

  @Override
  public boolean isResolved() {
    return type != null;
  }

  @Override
  public String getName() {
    return functionName
        + arguments.stream().map(Expression::getName).collect(Collectors.joining(", ", "(", ")"));
  }

  @Override
  public List<Expression> getChildren() {
    return arguments;
  }

  @Override
  public Expression withChildren(List<Expression> children) {
    return new ScalarFunctionExpr(function, children);
  }

  @Override
  public <R, C> R accept(ExpressionNodeVisitor<R, C> visitor, C context) {
    return visitor.visitFunction(this, context);
  }
}
