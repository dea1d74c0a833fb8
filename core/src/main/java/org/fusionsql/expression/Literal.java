/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.fusionsql.data.type.DataType;

/**
 * Constant value. Values use the same boxed representation as column vectors: {@link Long} for
 * integer and timestamp types, {@link Double} for floating types, {@link Boolean} and {@link
 * String}.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class Literal extends Expression {

  private final Object value;
  private final DataType type;

  public Literal(Object value, DataType type) {
    this.type = Objects.requireNonNull(type, "type");
    this.value = normalize(value, type);
  }

  public static Literal of(Object value) {
    if (value instanceof Long || value instanceof Integer || value instanceof Short
        || value instanceof Byte) {
      return new Literal(value, DataType.INT64);
    }
    if (value instanceof Double || value instanceof Float) {
      return new Literal(value, DataType.FLOAT64);
    }
    if (value instanceof Boolean) {
      return new Literal(value, DataType.BOOLEAN);
    }
    if (value instanceof String) {
      return new Literal(value, DataType.UTF8);
    }
    throw new IllegalArgumentException("Unsupported literal value: " + value);
  }

  public static Literal nullOf(DataType type) {
    return new Literal(null, type);
  }

  public boolean isNull() {
    return value == null;
  }

  @Override
  public boolean isNullable() {
    return value == null;
  }

  @Override
  public boolean isResolved() {
    return true;
  }

  @Override
  public String getName() {
    if (value == null) {
      return "NULL";
    }
    return type == DataType.UTF8 ? "'" + value + "'" : value.toString();
  }

  @Override
  public List<Expression> getChildren() {
    return ImmutableList.of();
  }

  @Override
  public Expression withChildren(List<Expression> children) {
    return this;
  }

  @Override
  public <R, C> R accept(ExpressionNodeVisitor<R, C> visitor, C context) {
    return visitor.visitLiteral(this, context);
  }

  private static Object normalize(Object value, DataType type) {
    if (value == null) {
      return null;
    }
    if (type.isLongBacked()) {
      long raw = ((Number) value).longValue();
      return type.isInteger() ? type.saturate(raw) : raw;
    }
    if (type.isFloating()) {
      double raw = ((Number) value).doubleValue();
      return type == DataType.FLOAT32 ? (double) (float) raw : raw;
    }
    if (type == DataType.BOOLEAN) {
      return (Boolean) value;
    }
    return value.toString();
  }
}
