/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.data.vector;

import org.fusionsql.data.type.DataType;

/** Vector of UTF-8 strings. */
public class StringVector extends ColumnVector {

  private final String[] values;

  public StringVector(DataType type, String[] values, boolean[] nulls) {
    this(type, values, nulls, 0, values.length);
  }

  StringVector(DataType type, String[] values, boolean[] nulls, int offset, int length) {
    super(type, nulls, offset, length);
    this.values = values;
  }

  /** Raw value at the row; meaningless when {@link #isNull(int)} is true. */
  public String getString(int row) {
    return values[offset + row];
  }

  @Override
  public Object getObject(int row) {
    return isNull(row) ? null : values[offset + row];
  }

  @Override
  public StringVector slice(int sliceOffset, int sliceLength) {
    checkSlice(sliceOffset, sliceLength);
    return new StringVector(type, values, nulls, offset + sliceOffset, sliceLength);
  }
}
