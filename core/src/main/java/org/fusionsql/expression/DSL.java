/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression;

import org.fusionsql.data.type.DataType;
import org.fusionsql.expression.function.FunctionRegistry;

/** Static factories for building expression trees. */
public class DSL {

  private DSL() {}

  public static ColumnRef col(String name) {
    return new ColumnRef(name);
  }

  public static Literal lit(Object value) {
    return Literal.of(value);
  }

  public static Literal lit(Object value, DataType type) {
    return new Literal(value, type);
  }

  public static Literal nullLiteral(DataType type) {
    return Literal.nullOf(type);
  }

  public static BinaryExpr add(Expression left, Expression right) {
    return new BinaryExpr(BinaryOperator.PLUS, left, right);
  }

  public static BinaryExpr subtract(Expression left, Expression right) {
    return new BinaryExpr(BinaryOperator.MINUS, left, right);
  }

  public static BinaryExpr multiply(Expression left, Expression right) {
    return new BinaryExpr(BinaryOperator.MULTIPLY, left, right);
  }

  public static BinaryExpr divide(Expression left, Expression right) {
    return new BinaryExpr(BinaryOperator.DIVIDE, left, right);
  }

  public static BinaryExpr modulo(Expression left, Expression right) {
    return new BinaryExpr(BinaryOperator.MODULO, left, right);
  }

  public static BinaryExpr equal(Expression left, Expression right) {
    return new BinaryExpr(BinaryOperator.EQ, left, right);
  }

  public static BinaryExpr notEqual(Expression left, Expression right) {
    return new BinaryExpr(BinaryOperator.NOT_EQ, left, right);
  }

  public static BinaryExpr less(Expression left, Expression right) {
    return new BinaryExpr(BinaryOperator.LT, left, right);
  }

  public static BinaryExpr lessOrEqual(Expression left, Expression right) {
    return new BinaryExpr(BinaryOperator.LTE, left, right);
  }

  public static BinaryExpr greater(Expression left, Expression right) {
    return new BinaryExpr(BinaryOperator.GT, left, right);
  }

  public static BinaryExpr greaterOrEqual(Expression left, Expression right) {
    return new BinaryExpr(BinaryOperator.GTE, left, right);
  }

  public static BinaryExpr and(Expression left, Expression right) {
    return new BinaryExpr(BinaryOperator.AND, left, right);
  }

  public static BinaryExpr or(Expression left, Expression right) {
    return new BinaryExpr(BinaryOperator.OR, left, right);
  }

  public static UnaryExpr not(Expression operand) {
    return new UnaryExpr(UnaryOperator.NOT, operand);
  }

  public static UnaryExpr negate(Expression operand) {
    return new UnaryExpr(UnaryOperator.NEGATE, operand);
  }

  public static UnaryExpr isNull(Expression operand) {
    return new UnaryExpr(UnaryOperator.IS_NULL, operand);
  }

  public static UnaryExpr isNotNull(Expression operand) {
    return new UnaryExpr(UnaryOperator.IS_NOT_NULL, operand);
  }

  public static AggregateExpr count(Expression argument) {
    return new AggregateExpr(AggregateFunction.COUNT, argument);
  }

  public static AggregateExpr countStar() {
    return AggregateExpr.countStar();
  }

  public static AggregateExpr sum(Expression argument) {
    return new AggregateExpr(AggregateFunction.SUM, argument);
  }

  public static AggregateExpr min(Expression argument) {
    return new AggregateExpr(AggregateFunction.MIN, argument);
  }

  public static AggregateExpr max(Expression argument) {
    return new AggregateExpr(AggregateFunction.MAX, argument);
  }

  public static AggregateExpr avg(Expression argument) {
    return new AggregateExpr(AggregateFunction.AVG, argument);
  }

  public static CastExpr cast(Expression child, DataType type) {
    return new CastExpr(child, type);
  }

  public static AliasExpr alias(Expression child, String name) {
    return new AliasExpr(child, name);
  }

  /** Calls a built-in scalar function by name. */
  public static ScalarFunctionExpr call(String function, Expression... arguments) {
    return FunctionRegistry.builtins().call(function, arguments);
  }

  public static ScalarFunctionExpr sqrt(Expression argument) {
    return call("sqrt", argument);
  }

  public static ScalarFunctionExpr abs(Expression argument) {
    return call("abs", argument);
  }

  public static ScalarFunctionExpr upper(Expression argument) {
    return call("upper", argument);
  }

  public static ScalarFunctionExpr lower(Expression argument) {
    return call("lower", argument);
  }
}
