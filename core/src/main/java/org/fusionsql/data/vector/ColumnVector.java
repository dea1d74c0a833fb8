/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.data.vector;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import org.fusionsql.data.type.DataType;

/**
 * Immutable column of values of one {@link DataType} with a parallel null indicator. A vector is
 * a window ({@code offset}, {@code length}) over backing arrays, so {@link #slice(int, int)} never
 * copies. Backing arrays are never written after construction.
 */
public abstract class ColumnVector {

  @Getter protected final DataType type;
  /** True marks a null row. A null array means the vector has no nulls. */
  protected final boolean[] nulls;

  protected final int offset;
  protected final int length;

  protected ColumnVector(DataType type, boolean[] nulls, int offset, int length) {
    this.type = type;
    this.nulls = nulls;
    this.offset = offset;
    this.length = length;
  }

  public int size() {
    return length;
  }

  public boolean isNull(int row) {
    return nulls != null && nulls[offset + row];
  }

  public boolean hasNulls() {
    if (nulls == null) {
      return false;
    }
    for (int i = 0; i < length; i++) {
      if (nulls[offset + i]) {
        return true;
      }
    }
    return false;
  }

  /** Returns the boxed value at the row, or null. */
  public abstract Object getObject(int row);

  /** Numeric value of the row as a long; floating values truncate toward zero. */
  public long getAsLong(int row) {
    throw new UnsupportedOperationException(type + " vector has no numeric value");
  }

  /** Numeric value of the row as a double. */
  public double getAsDouble(int row) {
    throw new UnsupportedOperationException(type + " vector has no numeric value");
  }

  /** Zero-copy view of {@code length} rows starting at {@code offset}. */
  public abstract ColumnVector slice(int offset, int length);

  /**
   * Gathers the given rows into a new vector. A negative position produces a null row, which
   * outer joins use for the non-matching side.
   */
  public ColumnVector take(int[] positions) {
    ColumnVectorBuilder builder = ColumnVectorBuilder.create(type, positions.length);
    for (int position : positions) {
      if (position < 0) {
        builder.appendNull();
      } else {
        builder.appendFrom(this, position);
      }
    }
    return builder.build();
  }

  public List<Object> toList() {
    List<Object> values = new ArrayList<>(length);
    for (int i = 0; i < length; i++) {
      values.add(getObject(i));
    }
    return values;
  }

  protected void checkSlice(int sliceOffset, int sliceLength) {
    if (sliceOffset < 0 || sliceLength < 0 || sliceOffset + sliceLength > length) {
      throw new IndexOutOfBoundsException(
          String.format(
              "Slice [%d, %d) out of range for vector of size %d",
              sliceOffset, sliceOffset + sliceLength, length));
    }
  }

  /** A vector of {@code length} nulls. */
  public static ColumnVector nulls(DataType type, int length) {
    ColumnVectorBuilder builder = ColumnVectorBuilder.create(type, length);
    for (int i = 0; i < length; i++) {
      builder.appendNull();
    }
    return builder.build();
  }

  /** A vector repeating one value. */
  public static ColumnVector constant(DataType type, Object value, int length) {
    ColumnVectorBuilder builder = ColumnVectorBuilder.create(type, length);
    for (int i = 0; i < length; i++) {
      builder.append(value);
    }
    return builder.build();
  }

  /** Builds a vector from boxed values. */
  public static ColumnVector of(DataType type, List<?> values) {
    ColumnVectorBuilder builder = ColumnVectorBuilder.create(type, values.size());
    values.forEach(builder::append);
    return builder.build();
  }

  @Override
  public String toString() {
    return type + toList().toString();
  }
}
