/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.sql;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.calcite.sql.SqlBasicCall;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlCharStringLiteral;
import org.apache.calcite.sql.SqlDataTypeSpec;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlLiteral;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNumericLiteral;
import org.apache.calcite.sql.SqlTimestampLiteral;
import org.apache.calcite.sql.SqlUtil;
import org.apache.calcite.sql.type.SqlTypeName;
import org.apache.calcite.util.TimestampString;
import org.fusionsql.data.type.DataType;
import org.fusionsql.expression.AggregateExpr;
import org.fusionsql.expression.AggregateFunction;
import org.fusionsql.expression.AliasExpr;
import org.fusionsql.expression.BinaryExpr;
import org.fusionsql.expression.BinaryOperator;
import org.fusionsql.expression.CastExpr;
import org.fusionsql.expression.ColumnRef;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.Literal;
import org.fusionsql.expression.ScalarFunctionExpr;
import org.fusionsql.expression.UnaryExpr;
import org.fusionsql.expression.UnaryOperator;
import org.fusionsql.expression.function.FunctionRegistry;

/** Translates Calcite expression trees into engine expressions. Column references stay unbound. */
class SqlExpressionTranslator {

  private final FunctionRegistry functions;

  SqlExpressionTranslator(FunctionRegistry functions) {
    this.functions = functions;
  }

  Expression translate(SqlNode node) {
    if (node instanceof SqlIdentifier) {
      SqlIdentifier identifier = (SqlIdentifier) node;
      if (identifier.isStar()) {
        throw new SqlParseException("'*' is only allowed in the select list and in COUNT(*)");
      }
      return new ColumnRef(String.join(".", identifier.names));
    }
    if (node instanceof SqlLiteral) {
      return literal((SqlLiteral) node);
    }
    if (node instanceof SqlCall) {
      return call((SqlCall) node);
    }
    throw new SqlParseException("Unsupported expression: " + node);
  }

  private Expression literal(SqlLiteral literal) {
    if (SqlUtil.isNullLiteral(literal, false)) {
      return Literal.nullOf(DataType.INT64);
    }
    if (literal instanceof SqlNumericLiteral) {
      BigDecimal value = literal.bigDecimalValue();
      if (((SqlNumericLiteral) literal).isExact() && value.scale() <= 0) {
        try {
          return Literal.of(value.longValueExact());
        } catch (ArithmeticException e) {
          throw new SqlParseException("Integer literal out of range: " + value, e);
        }
      }
      return Literal.of(value.doubleValue());
    }
    if (literal instanceof SqlCharStringLiteral) {
      return Literal.of(literal.getValueAs(String.class));
    }
    if (literal instanceof SqlTimestampLiteral) {
      long millis = literal.getValueAs(TimestampString.class).getMillisSinceEpoch();
      return new Literal(millis * 1000L, DataType.TIMESTAMP);
    }
    if (literal.getTypeName() == SqlTypeName.BOOLEAN) {
      return Literal.of(literal.booleanValue());
    }
    throw new SqlParseException("Unsupported literal: " + literal);
  }

  private Expression call(SqlCall call) {
    SqlKind kind = call.getKind();
    switch (kind) {
      case AS:
        return new AliasExpr(translate(call.operand(0)), alias(call.operand(1)));
      case AND:
      case OR:
        return logical(kind == SqlKind.AND ? BinaryOperator.AND : BinaryOperator.OR, call);
      case EQUALS:
        return binary(BinaryOperator.EQ, call);
      case NOT_EQUALS:
        return binary(BinaryOperator.NOT_EQ, call);
      case LESS_THAN:
        return binary(BinaryOperator.LT, call);
      case LESS_THAN_OR_EQUAL:
        return binary(BinaryOperator.LTE, call);
      case GREATER_THAN:
        return binary(BinaryOperator.GT, call);
      case GREATER_THAN_OR_EQUAL:
        return binary(BinaryOperator.GTE, call);
      case PLUS:
        return binary(BinaryOperator.PLUS, call);
      case MINUS:
        return binary(BinaryOperator.MINUS, call);
      case TIMES:
        return binary(BinaryOperator.MULTIPLY, call);
      case DIVIDE:
        return binary(BinaryOperator.DIVIDE, call);
      case MOD:
        return binary(BinaryOperator.MODULO, call);
      case NOT:
        return new UnaryExpr(UnaryOperator.NOT, translate(call.operand(0)));
      case MINUS_PREFIX:
        return new UnaryExpr(UnaryOperator.NEGATE, translate(call.operand(0)));
      case PLUS_PREFIX:
        return translate(call.operand(0));
      case IS_NULL:
        return new UnaryExpr(UnaryOperator.IS_NULL, translate(call.operand(0)));
      case IS_NOT_NULL:
        return new UnaryExpr(UnaryOperator.IS_NOT_NULL, translate(call.operand(0)));
      case CAST:
        return cast(call);
      default:
        AggregateFunction named = aggregateFunction(call);
        return named != null ? aggregate(named, call) : function(call);
    }
  }

  /**
   * The parser leaves function calls unresolved, so aggregates are recognized by name rather than
   * by {@link SqlKind}.
   */
  private static AggregateFunction aggregateFunction(SqlCall call) {
    switch (call.getOperator().getName().toUpperCase(Locale.ROOT)) {
      case "COUNT":
        return AggregateFunction.COUNT;
      case "SUM":
        return AggregateFunction.SUM;
      case "MIN":
        return AggregateFunction.MIN;
      case "MAX":
        return AggregateFunction.MAX;
      case "AVG":
        return AggregateFunction.AVG;
      default:
        return null;
    }
  }

  private Expression binary(BinaryOperator operator, SqlCall call) {
    if (call.operandCount() != 2) {
      throw new SqlParseException("Operator " + operator + " expects two operands: " + call);
    }
    return new BinaryExpr(operator, translate(call.operand(0)), translate(call.operand(1)));
  }

  private Expression logical(BinaryOperator operator, SqlCall call) {
    Expression result = translate(call.operand(0));
    for (int i = 1; i < call.operandCount(); i++) {
      result = new BinaryExpr(operator, result, translate(call.operand(i)));
    }
    return result;
  }

  private Expression cast(SqlCall call) {
    SqlDataTypeSpec spec = (SqlDataTypeSpec) call.operand(1);
    String typeName = spec.getTypeName().getSimple();
    DataType target =
        DataType.fromName(typeName)
            .orElseThrow(() -> new SqlParseException("Unknown type in CAST: " + typeName));
    SqlNode operand = call.operand(0);
    if (SqlUtil.isNullLiteral(operand, false)) {
      return Literal.nullOf(target);
    }
    return new CastExpr(translate(operand), target);
  }

  private Expression aggregate(AggregateFunction function, SqlCall call) {
    if (call.getFunctionQuantifier() != null) {
      throw new SqlParseException("DISTINCT aggregates are not supported: " + call);
    }
    if (call.operandCount() != 1) {
      throw new SqlParseException(function + " expects one argument: " + call);
    }
    SqlNode argument = call.operand(0);
    if (argument instanceof SqlIdentifier && ((SqlIdentifier) argument).isStar()) {
      if (function != AggregateFunction.COUNT) {
        throw new SqlParseException("Only COUNT accepts '*'");
      }
      return AggregateExpr.countStar();
    }
    return new AggregateExpr(function, translate(argument));
  }

  private Expression function(SqlCall call) {
    if (!(call instanceof SqlBasicCall)) {
      throw new SqlParseException("Unsupported expression: " + call);
    }
    List<Expression> arguments = new ArrayList<>(call.operandCount());
    for (SqlNode operand : call.getOperandList()) {
      arguments.add(translate(operand));
    }
    return new ScalarFunctionExpr(functions.resolve(call.getOperator().getName()), arguments);
  }

  static String alias(SqlNode node) {
    if (node instanceof SqlIdentifier && ((SqlIdentifier) node).isSimple()) {
      return ((SqlIdentifier) node).getSimple();
    }
    throw new SqlParseException("Invalid alias: " + node);
  }
}
