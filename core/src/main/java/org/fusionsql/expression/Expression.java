/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression;

import java.util.List;
import org.fusionsql.data.type.DataType;

/**
 * Node of an expression tree. An expression is resolved once every column reference in it has
 * been bound to a schema; only then {@link #getType()} is available. Resolved nodes type check
 * their children on construction and fail with a {@code TypeCheckException}.
 */
public abstract class Expression {

  /** Output type. Only valid on resolved expressions. */
  public abstract DataType getType();

  public abstract boolean isNullable();

  public abstract boolean isResolved();

  /** Name of the column this expression produces when projected. */
  public abstract String getName();

  public abstract List<Expression> getChildren();

  /** Rebuilds this node over new children, re-running type inference. */
  public abstract Expression withChildren(List<Expression> children);

  public abstract <R, C> R accept(ExpressionNodeVisitor<R, C> visitor, C context);

  protected IllegalStateException unresolved() {
    return new IllegalStateException("Expression is not resolved: " + this);
  }

  @Override
  public String toString() {
    return getName();
  }
}
