/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.data.type;

import java.util.Locale;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of primitive value types. Integer types of every width are held as {@code long}
 * values, floating point types as {@code double} and timestamps as microseconds since the epoch.
 * Unsigned 64 bit values are limited to the non-negative {@code long} range.
 */
@RequiredArgsConstructor
public enum DataType {
  BOOLEAN(Category.BOOLEAN, 0, 1, "BOOLEAN"),
  INT8(Category.SIGNED_INTEGER, Byte.MIN_VALUE, Byte.MAX_VALUE, "TINYINT"),
  INT16(Category.SIGNED_INTEGER, Short.MIN_VALUE, Short.MAX_VALUE, "SMALLINT"),
  INT32(Category.SIGNED_INTEGER, Integer.MIN_VALUE, Integer.MAX_VALUE, "INTEGER"),
  INT64(Category.SIGNED_INTEGER, Long.MIN_VALUE, Long.MAX_VALUE, "BIGINT"),
  UINT8(Category.UNSIGNED_INTEGER, 0, 0xFFL, "UTINYINT"),
  UINT16(Category.UNSIGNED_INTEGER, 0, 0xFFFFL, "USMALLINT"),
  UINT32(Category.UNSIGNED_INTEGER, 0, 0xFFFF_FFFFL, "UINTEGER"),
  UINT64(Category.UNSIGNED_INTEGER, 0, Long.MAX_VALUE, "UBIGINT"),
  FLOAT32(Category.FLOATING, 0, 0, "REAL"),
  FLOAT64(Category.FLOATING, 0, 0, "DOUBLE"),
  UTF8(Category.STRING, 0, 0, "VARCHAR"),
  TIMESTAMP(Category.TEMPORAL, Long.MIN_VALUE, Long.MAX_VALUE, "TIMESTAMP");

  /** Value family of a type. Operators are type checked per family. */
  public enum Category {
    BOOLEAN,
    SIGNED_INTEGER,
    UNSIGNED_INTEGER,
    FLOATING,
    STRING,
    TEMPORAL
  }

  @Getter private final Category category;
  @Getter private final long minValue;
  @Getter private final long maxValue;
  @Getter private final String sqlName;

  public boolean isInteger() {
    return category == Category.SIGNED_INTEGER || category == Category.UNSIGNED_INTEGER;
  }

  public boolean isFloating() {
    return category == Category.FLOATING;
  }

  public boolean isNumeric() {
    return isInteger() || isFloating();
  }

  /** Types whose values are stored in a long vector. */
  public boolean isLongBacked() {
    return isInteger() || this == TIMESTAMP;
  }

  /** Clamps an integer value into the range of this integer type. */
  public long saturate(long value) {
    if (value < minValue) {
      return minValue;
    }
    return Math.min(value, maxValue);
  }

  /**
   * Result type of an arithmetic operation. Identical types keep their type; mixed integer types
   * widen to INT64; anything involving a float widens to FLOAT64 unless both sides are FLOAT32.
   */
  public static Optional<DataType> commonNumericType(DataType left, DataType right) {
    if (!left.isNumeric() || !right.isNumeric()) {
      return Optional.empty();
    }
    if (left == right) {
      return Optional.of(left);
    }
    if (left.isFloating() || right.isFloating()) {
      return Optional.of(FLOAT64);
    }
    return Optional.of(INT64);
  }

  /** Whether values of the two types can be compared with each other. */
  public static boolean isComparable(DataType left, DataType right) {
    if (left.isNumeric() && right.isNumeric()) {
      return true;
    }
    return left.category == right.category;
  }

  /** Resolves a type from its enum name or its SQL name, ignoring case. */
  public static Optional<DataType> fromName(String name) {
    String upper = name.toUpperCase(Locale.ROOT);
    for (DataType type : values()) {
      if (type.name().equals(upper) || type.sqlName.equals(upper)) {
        return Optional.of(type);
      }
    }
    switch (upper) {
      case "INT":
        return Optional.of(INT32);
      case "FLOAT":
        return Optional.of(FLOAT32);
      case "STRING":
      case "CHAR":
      case "TEXT":
        return Optional.of(UTF8);
      default:
        return Optional.empty();
    }
  }
}
