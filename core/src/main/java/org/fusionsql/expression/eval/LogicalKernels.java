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

/**
 * Three-valued AND / OR. {@code false AND null} is false and {@code true OR null} is true; every
 * other combination involving null is null.
 */
@UtilityClass
public class LogicalKernels {

  public static ColumnVector and(ColumnVector left, ColumnVector right) {
    BooleanVector l = (BooleanVector) left;
    BooleanVector r = (BooleanVector) right;
    int rows = l.size();
    ColumnVectorBuilder out = ColumnVectorBuilder.create(DataType.BOOLEAN, rows);
    for (int i = 0; i < rows; i++) {
      boolean leftFalse = !l.isNull(i) && !l.getBoolean(i);
      boolean rightFalse = !r.isNull(i) && !r.getBoolean(i);
      if (leftFalse || rightFalse) {
        out.appendBoolean(false);
      } else if (l.isNull(i) || r.isNull(i)) {
        out.appendNull();
      } else {
        out.appendBoolean(true);
      }
    }
    return out.build();
  }

  public static ColumnVector or(ColumnVector left, ColumnVector right) {
    BooleanVector l = (BooleanVector) left;
    BooleanVector r = (BooleanVector) right;
    int rows = l.size();
    ColumnVectorBuilder out = ColumnVectorBuilder.create(DataType.BOOLEAN, rows);
    for (int i = 0; i < rows; i++) {
      if (l.isTrue(i) || r.isTrue(i)) {
        out.appendBoolean(true);
      } else if (l.isNull(i) || r.isNull(i)) {
        out.appendNull();
      } else {
        out.appendBoolean(false);
      }
    }
    return out.build();
  }

  public static ColumnVector not(ColumnVector input) {
    BooleanVector in = (BooleanVector) input;
    int rows = in.size();
    ColumnVectorBuilder out = ColumnVectorBuilder.create(DataType.BOOLEAN, rows);
    for (int i = 0; i < rows; i++) {
      if (in.isNull(i)) {
        out.appendNull();
      } else {
        out.appendBoolean(!in.getBoolean(i));
      }
    }
    return out.build();
  }
}
