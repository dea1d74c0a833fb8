/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.eval;

import lombok.experimental.UtilityClass;
import org.fusionsql.data.type.DataType;
import org.fusionsql.data.vector.BooleanVector;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.data.vector.ColumnVectorBuilder;
import org.fusionsql.data.vector.StringVector;
import org.fusionsql.expression.BinaryOperator;

/** Element-wise comparisons producing a boolean vector; null operands yield null. */
@UtilityClass
public class ComparisonKernels {

  public static ColumnVector evaluate(
      BinaryOperator operator, ColumnVector left, ColumnVector right) {
    int rows = left.size();
    ColumnVectorBuilder out = ColumnVectorBuilder.create(DataType.BOOLEAN, rows);
    for (int i = 0; i < rows; i++) {
      if (left.isNull(i) || right.isNull(i)) {
        out.appendNull();
      } else {
        out.appendBoolean(test(operator, compare(left, right, i)));
      }
    }
    return out.build();
  }

  /** Compares row {@code i} of two vectors of comparable types. */
  public static int compare(ColumnVector left, ColumnVector right, int i) {
    return compare(left, i, right, i);
  }

  public static int compare(ColumnVector left, int leftRow, ColumnVector right, int rightRow) {
    DataType l = left.getType();
    DataType r = right.getType();
    if (l.isFloating() || r.isFloating()) {
      return Double.compare(left.getAsDouble(leftRow), right.getAsDouble(rightRow));
    }
    if (l.isLongBacked()) {
      return Long.compare(left.getAsLong(leftRow), right.getAsLong(rightRow));
    }
    if (l == DataType.BOOLEAN) {
      return Boolean.compare(
          ((BooleanVector) left).getBoolean(leftRow), ((BooleanVector) right).getBoolean(rightRow));
    }
    return ((StringVector) left)
        .getString(leftRow)
        .compareTo(((StringVector) right).getString(rightRow));
  }

  private static boolean test(BinaryOperator operator, int comparison) {
    switch (operator) {
      case EQ:
        return comparison == 0;
      case NOT_EQ:
        return comparison != 0;
      case LT:
        return comparison < 0;
      case LTE:
        return comparison <= 0;
      case GT:
        return comparison > 0;
      case GTE:
        return comparison >= 0;
      default:
        throw new IllegalArgumentException("Not a comparison operator: " + operator);
    }
  }
}
