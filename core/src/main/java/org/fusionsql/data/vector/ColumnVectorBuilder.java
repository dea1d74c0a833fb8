/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.data.vector;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import org.fusionsql.data.type.DataType;

/**
 * Appends values one at a time and produces a {@link ColumnVector}. Boxed values are normalized
 * to the storage of the target type: integers saturate to the type range, FLOAT32 values are
 * rounded to float precision and timestamps accept {@link Instant} or epoch microseconds.
 */
public class ColumnVectorBuilder {

  private final DataType type;
  private long[] longs;
  private double[] doubles;
  private boolean[] booleans;
  private String[] strings;
  private boolean[] nulls;
  private boolean anyNull;
  private int size;

  private ColumnVectorBuilder(DataType type, int capacity) {
    this.type = type;
    int initial = Math.max(capacity, 8);
    if (type.isLongBacked()) {
      longs = new long[initial];
    } else if (type.isFloating()) {
      doubles = new double[initial];
    } else if (type == DataType.BOOLEAN) {
      booleans = new boolean[initial];
    } else {
      strings = new String[initial];
    }
    nulls = new boolean[initial];
  }

  public static ColumnVectorBuilder create(DataType type, int capacity) {
    return new ColumnVectorBuilder(type, capacity);
  }

  public int size() {
    return size;
  }

  public ColumnVectorBuilder appendNull() {
    ensureCapacity();
    nulls[size++] = true;
    anyNull = true;
    return this;
  }

  public ColumnVectorBuilder appendLong(long value) {
    ensureCapacity();
    longs[size++] = type.isInteger() ? type.saturate(value) : value;
    return this;
  }

  public ColumnVectorBuilder appendDouble(double value) {
    ensureCapacity();
    doubles[size++] = type == DataType.FLOAT32 ? (float) value : value;
    return this;
  }

  public ColumnVectorBuilder appendBoolean(boolean value) {
    ensureCapacity();
    booleans[size++] = value;
    return this;
  }

  public ColumnVectorBuilder appendString(String value) {
    ensureCapacity();
    strings[size++] = value;
    return this;
  }

  /** Appends a boxed value, or a null row for {@code null}. */
  public ColumnVectorBuilder append(Object value) {
    if (value == null) {
      return appendNull();
    }
    if (type.isLongBacked()) {
      if (value instanceof Instant) {
        return appendLong(ChronoUnit.MICROS.between(Instant.EPOCH, (Instant) value));
      }
      return appendLong(requireNumber(value).longValue());
    }
    if (type.isFloating()) {
      return appendDouble(requireNumber(value).doubleValue());
    }
    if (type == DataType.BOOLEAN) {
      if (!(value instanceof Boolean)) {
        throw new IllegalArgumentException(
            String.format("Expected boolean for %s but got %s", type, value.getClass()));
      }
      return appendBoolean((Boolean) value);
    }
    return appendString(value.toString());
  }

  /** Copies one row of a vector of the same storage kind. */
  public ColumnVectorBuilder appendFrom(ColumnVector vector, int row) {
    if (vector.isNull(row)) {
      return appendNull();
    }
    if (vector instanceof LongVector) {
      return appendLong(((LongVector) vector).getLong(row));
    }
    if (vector instanceof DoubleVector) {
      return appendDouble(((DoubleVector) vector).getDouble(row));
    }
    if (vector instanceof BooleanVector) {
      return appendBoolean(((BooleanVector) vector).getBoolean(row));
    }
    return appendString(((StringVector) vector).getString(row));
  }

  public ColumnVector build() {
    boolean[] validity = anyNull ? Arrays.copyOf(nulls, size) : null;
    if (longs != null) {
      return new LongVector(type, Arrays.copyOf(longs, size), validity);
    }
    if (doubles != null) {
      return new DoubleVector(type, Arrays.copyOf(doubles, size), validity);
    }
    if (booleans != null) {
      return new BooleanVector(type, Arrays.copyOf(booleans, size), validity);
    }
    return new StringVector(type, Arrays.copyOf(strings, size), validity);
  }

  private Number requireNumber(Object value) {
    if (value instanceof Number) {
      return (Number) value;
    }
    throw new IllegalArgumentException(
        String.format("Expected number for %s but got %s", type, value.getClass()));
  }

  private void ensureCapacity() {
    if (size < nulls.length) {
      return;
    }
    int grown = nulls.length * 2;
    nulls = Arrays.copyOf(nulls, grown);
    if (longs != null) {
      longs = Arrays.copyOf(longs, grown);
    } else if (doubles != null) {
      doubles = Arrays.copyOf(doubles, grown);
    } else if (booleans != null) {
      booleans = Arrays.copyOf(booleans, grown);
    } else {
      strings = Arrays.copyOf(strings, grown);
    }
  }
}
