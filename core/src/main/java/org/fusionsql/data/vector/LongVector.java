/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.data.vector;

import org.fusionsql.data.type.DataType;

/** Vector for every integer width and for timestamps (microseconds since the epoch). */
public class LongVector extends ColumnVector {

  private final long[] values;

  public LongVector(DataType type, long[] values, boolean[] nulls) {
    this(type, values, nulls, 0, values.length);
  }

  LongVector(DataType type, long[] values, boolean[] nulls, int offset, int length) {
    super(type, nulls, offset, length);
    this.values = values;
  }

  /** Raw value at the row; meaningless when {@link #isNull(int)} is true. */
  public long getLong(int row) {
    return values[offset + row];
  }

  @Override
  public long getAsLong(int row) {
    return values[offset + row];
  }

  @Override
  public double getAsDouble(int row) {
    return values[offset + row];
  }

  @Override
  public Object getObject(int row) {
    return isNull(row) ? null : Long.valueOf(values[offset + row]);
  }

  @Override
  public LongVector slice(int sliceOffset, int sliceLength) {
    checkSlice(sliceOffset, sliceLength);
    return new LongVector(type, values, nulls, offset + sliceOffset, sliceLength);
  }
}
