/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.data.vector;

import org.fusionsql.data.type.DataType;

/** Vector of booleans. Also used as selection mask by filters. */
public class BooleanVector extends ColumnVector {

  private final boolean[] values;

  public BooleanVector(DataType type, boolean[] values, boolean[] nulls) {
    this(type, values, nulls, 0, values.length);
  }

  BooleanVector(DataType type, boolean[] values, boolean[] nulls, int offset, int length) {
    super(type, nulls, offset, length);
    this.values = values;
  }

  /** Raw value at the row; meaningless when {@link #isNull(int)} is true. */
  public boolean getBoolean(int row) {
    return values[offset + row];
  }

  /** True only for non-null true rows, the row selection semantics of a predicate. */
  public boolean isTrue(int row) {
    return !isNull(row) && values[offset + row];
  }

  @Override
  public Object getObject(int row) {
    return isNull(row) ? null : Boolean.valueOf(values[offset + row]);
  }

  @Override
  public BooleanVector slice(int sliceOffset, int sliceLength) {
    checkSlice(sliceOffset, sliceLength);
    return new BooleanVector(type, values, nulls, offset + sliceOffset, sliceLength);
  }
}
