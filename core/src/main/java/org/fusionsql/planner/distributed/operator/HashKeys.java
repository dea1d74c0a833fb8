/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lombok.experimental.UtilityClass;
import org.fusionsql.data.type.DataType;
import org.fusionsql.data.vector.BooleanVector;
import org.fusionsql.data.vector.ColumnVector;

/**
 * Normalized key values for grouping, joining and hash partitioning. Integer and timestamp values
 * become {@link Long}, floating values {@link Double}, so that equal keys are equal objects
 * whatever the column width.
 */
@UtilityClass
public class HashKeys {

  private static final HashFunction HASH = Hashing.murmur3_32_fixed();

  /** Normalized value at {@code row}, or null. */
  public static Object normalize(ColumnVector column, int row) {
    if (column.isNull(row)) {
      return null;
    }
    DataType type = column.getType();
    if (type.isLongBacked()) {
      return column.getAsLong(row);
    }
    if (type.isFloating()) {
      double value = column.getAsDouble(row);
      return value == 0.0d ? 0.0d : value;
    }
    if (type == DataType.BOOLEAN) {
      return ((BooleanVector) column).getBoolean(row);
    }
    return column.getObject(row).toString();
  }

  /** Key of one row. Null values are kept, which is what grouping needs. */
  public static List<Object> rowKey(List<ColumnVector> columns, int row) {
    List<Object> key = new ArrayList<>(columns.size());
    for (ColumnVector column : columns) {
      key.add(normalize(column, row));
    }
    return key;
  }

  /** Join key of one row, or null if any key column is null. NULL never matches. */
  public static List<Object> joinKey(List<ColumnVector> columns, int row) {
    List<Object> key = new ArrayList<>(columns.size());
    for (ColumnVector column : columns) {
      Object value = normalize(column, row);
      if (value == null) {
        return null;
      }
      key.add(value);
    }
    return key;
  }

  /**
   * Target partition of one row under hash partitioning. Stable across processes, so producers
   * running anywhere agree on where a key lands.
   */
  public static int partitionOf(List<ColumnVector> keyColumns, int row, int partitionCount) {
    Hasher hasher = HASH.newHasher();
    for (ColumnVector column : keyColumns) {
      Object value = normalize(column, row);
      if (value == null) {
        hasher.putByte((byte) 0);
      } else if (value instanceof Long) {
        hasher.putByte((byte) 1).putLong((Long) value);
      } else if (value instanceof Double) {
        hasher.putByte((byte) 2).putDouble((Double) value);
      } else if (value instanceof Boolean) {
        hasher.putByte((byte) 3).putBoolean((Boolean) value);
      } else {
        hasher.putByte((byte) 4).putString((String) value, StandardCharsets.UTF_8);
      }
    }
    return Math.floorMod(hasher.hash().asInt(), partitionCount);
  }
}
