/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.type.DataType;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.data.vector.ColumnVectorBuilder;
import org.fusionsql.expression.AggregateExpr;
import org.fusionsql.expression.AliasExpr;
import org.fusionsql.expression.BinaryExpr;
import org.fusionsql.expression.CastExpr;
import org.fusionsql.expression.ColumnRef;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionBinder;
import org.fusionsql.expression.ExpressionNodeVisitor;
import org.fusionsql.expression.Literal;
import org.fusionsql.expression.ScalarFunctionExpr;
import org.fusionsql.expression.UnaryExpr;
import org.fusionsql.expression.function.ScalarFunction;

/**
 * Compiles an expression tree against an input schema into a {@link CompiledExpression}. Column
 * positions are resolved once here; evaluation then works column-at-a-time on whole vectors.
 */
public class ExpressionCompiler implements ExpressionNodeVisitor<CompiledExpression, Schema> {

  private static final ExpressionCompiler INSTANCE = new ExpressionCompiler();

  public static CompiledExpression compile(Expression expression, Schema inputSchema) {
    Expression bound = ExpressionBinder.bind(expression, inputSchema);
    return bound.accept(INSTANCE, inputSchema);
  }

  public static List<CompiledExpression> compileAll(
      List<Expression> expressions, Schema inputSchema) {
    return expressions.stream().map(e -> compile(e, inputSchema)).collect(Collectors.toList());
  }

  @Override
  public CompiledExpression visitColumnRef(ColumnRef node, Schema schema) {
    int index = schema.indexOf(node.getReference());
    return batch -> batch.getColumn(index);
  }

  @Override
  public CompiledExpression visitLiteral(Literal node, Schema schema) {
    DataType type = node.getType();
    Object value = node.getValue();
    return batch -> ColumnVector.constant(type, value, batch.getRowCount());
  }

  @Override
  public CompiledExpression visitBinary(BinaryExpr node, Schema schema) {
    CompiledExpression left = node.getLeft().accept(this, schema);
    CompiledExpression right = node.getRight().accept(this, schema);
    switch (node.getOperator().getKind()) {
      case ARITHMETIC:
        DataType resultType = node.getType();
        return batch ->
            ArithmeticKernels.evaluate(
                node.getOperator(), left.evaluate(batch), right.evaluate(batch), resultType);
      case COMPARISON:
        return batch ->
            ComparisonKernels.evaluate(
                node.getOperator(), left.evaluate(batch), right.evaluate(batch));
      default:
        switch (node.getOperator()) {
          case AND:
            return batch -> LogicalKernels.and(left.evaluate(batch), right.evaluate(batch));
          default:
            return batch -> LogicalKernels.or(left.evaluate(batch), right.evaluate(batch));
        }
    }
  }

  @Override
  public CompiledExpression visitUnary(UnaryExpr node, Schema schema) {
    CompiledExpression operand = node.getOperand().accept(this, schema);
    switch (node.getOperator()) {
      case NOT:
        return batch -> LogicalKernels.not(operand.evaluate(batch));
      case NEGATE:
        DataType type = node.getType();
        return batch -> negate(operand.evaluate(batch), type);
      case IS_NULL:
        return batch -> nullTest(operand.evaluate(batch), true);
      default:
        return batch -> nullTest(operand.evaluate(batch), false);
    }
  }

  @Override
  public CompiledExpression visitAggregate(AggregateExpr node, Schema schema) {
    throw new IllegalStateException(
        "Aggregate " + node.getName() + " can only be evaluated by an aggregate operator");
  }

  @Override
  public CompiledExpression visitFunction(ScalarFunctionExpr node, Schema schema) {
    List<CompiledExpression> arguments = new ArrayList<>();
    node.getArguments().forEach(arg -> arguments.add(arg.accept(this, schema)));
    ScalarFunction function = node.getFunction();
    DataType returnType = node.getType();
    return batch -> {
      List<ColumnVector> values = new ArrayList<>(arguments.size());
      for (CompiledExpression argument : arguments) {
        values.add(argument.evaluate(batch));
      }
      return function.evaluate(values, returnType, batch.getRowCount());
    };
  }

  @Override
  public CompiledExpression visitCast(CastExpr node, Schema schema) {
    CompiledExpression child = node.getChild().accept(this, schema);
    DataType target = node.getTargetType();
    return batch -> CastKernels.cast(child.evaluate(batch), target);
  }

  @Override
  public CompiledExpression visitAlias(AliasExpr node, Schema schema) {
    return node.getChild().accept(this, schema);
  }

  private static ColumnVector negate(ColumnVector input, DataType type) {
    int rows = input.size();
    ColumnVectorBuilder out = ColumnVectorBuilder.create(type, rows);
    for (int i = 0; i < rows; i++) {
      if (input.isNull(i)) {
        out.appendNull();
      } else if (type.isFloating()) {
        out.appendDouble(-input.getAsDouble(i));
      } else {
        long value = input.getAsLong(i);
        out.appendLong(value == Long.MIN_VALUE ? Long.MAX_VALUE : -value);
      }
    }
    return out.build();
  }

  private static ColumnVector nullTest(ColumnVector input, boolean expectNull) {
    int rows = input.size();
    ColumnVectorBuilder out = ColumnVectorBuilder.create(DataType.BOOLEAN, rows);
    for (int i = 0; i < rows; i++) {
      out.appendBoolean(input.isNull(i) == expectNull);
    }
    return out.build();
  }
}
