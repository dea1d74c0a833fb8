/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.data.vector;

import org.fusionsql.data.type.DataType;

/** Vector for FLOAT32 and FLOAT64 values. */
public class DoubleVector extends ColumnVector {

  private final double[] values;

  public DoubleVector(DataType type, double[] values, boolean[] nulls) {
    this(type, values, nulls, 0, values.length);
  }

  DoubleVector(DataType type, double[] values, boolean[] nulls, int offset, int length) {
    super(type, nulls, offset, length);
    this.values = values;
  }

  /** Raw value at the row; meaningless when {@link #isNull(int)} is true. */
  public double getDouble(int row) {
    return values[offset + row];
  }

  @Override
  public long getAsLong(int row) {
    return (long) values[offset + row];
  }

  @Override
  public double getAsDouble(int row) {
    return values[offset + row];
  }

  @Override
  public Object getObject(int row) {
    return isNull(row) ? null : Double.valueOf(values[offset + row]);
  }

  @Override
  public DoubleVector slice(int sliceOffset, int sliceLength) {
    checkSlice(sliceOffset, sliceLength);
    return new DoubleVector(type, values, nulls, offset + sliceOffset, sliceLength);
  }
}
