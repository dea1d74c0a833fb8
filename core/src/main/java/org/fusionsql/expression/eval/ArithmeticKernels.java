/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.eval;

import lombok.experimental.UtilityClass;
import org.fusionsql.data.type.DataType;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.data.vector.ColumnVectorBuilder;
import org.fusionsql.exception.EvaluationException;
import org.fusionsql.expression.BinaryOperator;

/**
 * Element-wise arithmetic. Any null operand yields null. Integer results saturate at the bounds of
 * the result type; integer division or modulo by zero fails the batch.
 */
@UtilityClass
public class ArithmeticKernels {

  public static ColumnVector evaluate(
      BinaryOperator operator, ColumnVector left, ColumnVector right, DataType resultType) {
    int rows = left.size();
    ColumnVectorBuilder out = ColumnVectorBuilder.create(resultType, rows);
    boolean floating = resultType.isFloating();
    for (int i = 0; i < rows; i++) {
      if (left.isNull(i) || right.isNull(i)) {
        out.appendNull();
      } else if (floating) {
        out.appendDouble(applyDouble(operator, left.getAsDouble(i), right.getAsDouble(i)));
      } else {
        out.appendLong(applyLong(operator, left.getAsLong(i), right.getAsLong(i)));
      }
    }
    return out.build();
  }

  static double applyDouble(BinaryOperator operator, double l, double r) {
    switch (operator) {
      case PLUS:
        return l + r;
      case MINUS:
        return l - r;
      case MULTIPLY:
        return l * r;
      case DIVIDE:
        return l / r;
      case MODULO:
        return l % r;
      default:
        throw new IllegalArgumentException("Not an arithmetic operator: " + operator);
    }
  }

  static long applyLong(BinaryOperator operator, long l, long r) {
    try {
      switch (operator) {
        case PLUS:
          return Math.addExact(l, r);
        case MINUS:
          return Math.subtractExact(l, r);
        case MULTIPLY:
          return Math.multiplyExact(l, r);
        case DIVIDE:
          checkDivisor(r);
          return l == Long.MIN_VALUE && r == -1 ? Long.MAX_VALUE : l / r;
        case MODULO:
          checkDivisor(r);
          return r == -1 ? 0 : l % r;
        default:
          throw new IllegalArgumentException("Not an arithmetic operator: " + operator);
      }
    } catch (ArithmeticException overflow) {
      return saturatedResult(operator, l, r);
    }
  }

  private static void checkDivisor(long divisor) {
    if (divisor == 0) {
      throw new EvaluationException("Division by zero");
    }
  }

  /** Sign of the exact result decides which bound an overflowing operation saturates to. */
  private static long saturatedResult(BinaryOperator operator, long l, long r) {
    boolean negative;
    switch (operator) {
      case PLUS:
        negative = l < 0;
        break;
      case MINUS:
        negative = l < r;
        break;
      default:
        negative = (l < 0) != (r < 0);
        break;
    }
    return negative ? Long.MIN_VALUE : Long.MAX_VALUE;
  }
}
