/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.type.DataType;

/**
 * Reference to an input column by name. The name may be qualified ({@code t.a}). Binding to a
 * schema records the resolved field; the position is looked up again at compile time so a
 * reference stays valid when the plan beneath it is rewritten.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class ColumnRef extends Expression {

  private final String reference;
  private final Field field;

  public ColumnRef(String reference) {
    this(reference, null);
  }

  ColumnRef(String reference, Field field) {
    this.reference = reference;
    this.field = field;
  }

  /** Returns a reference bound to the resolved field. */
  public ColumnRef bind(Field resolved) {
    return new ColumnRef(reference, resolved);
  }

  @Override
  public DataType getType() {
    if (field == null) {
      throw unresolved();
    }
    return field.getType();
  }

  @Override
  public boolean isNullable() {
    return field == null || field.isNullable();
  }

  @Override
  public boolean isResolved() {
    return field != null;
  }

  @Override
  public String getName() {
    if (field != null) {
      return field.getName();
    }
    int dot = reference.indexOf('.');
    return dot > 0 ? reference.substring(dot + 1) : reference;
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
    return visitor.visitColumnRef(this, context);
  }

  @Override
  public String toString() {
    return reference;
  }
}
