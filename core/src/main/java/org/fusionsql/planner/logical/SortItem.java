/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.logical;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.fusionsql.expression.Expression;

/** Sort key with direction and null placement. */
@Getter
@EqualsAndHashCode
public class SortItem {
  private final Expression expression;
  private final boolean ascending;
  private final boolean nullsFirst;

  public SortItem(Expression expression, boolean ascending, boolean nullsFirst) {
    this.expression = expression;
    this.ascending = ascending;
    this.nullsFirst = nullsFirst;
  }

  /** Nulls sort last in ascending order and first in descending order. */
  public SortItem(Expression expression, boolean ascending) {
    this(expression, ascending, !ascending);
  }

  public static SortItem asc(Expression expression) {
    return new SortItem(expression, true);
  }

  public static SortItem desc(Expression expression) {
    return new SortItem(expression, false);
  }

  public SortItem withExpression(Expression newExpression) {
    return new SortItem(newExpression, ascending, nullsFirst);
  }

  @Override
  public String toString() {
    return expression
        + (ascending ? " ASC" : " DESC")
        + (nullsFirst ? " NULLS FIRST" : " NULLS LAST");
  }
}
