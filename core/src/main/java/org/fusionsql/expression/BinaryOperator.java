/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public enum BinaryOperator {
  PLUS("+", Kind.ARITHMETIC),
  MINUS("-", Kind.ARITHMETIC),
  MULTIPLY("*", Kind.ARITHMETIC),
  DIVIDE("/", Kind.ARITHMETIC),
  MODULO("%", Kind.ARITHMETIC),
  EQ("=", Kind.COMPARISON),
  NOT_EQ("<>", Kind.COMPARISON),
  LT("<", Kind.COMPARISON),
  LTE("<=", Kind.COMPARISON),
  GT(">", Kind.COMPARISON),
  GTE(">=", Kind.COMPARISON),
  AND("AND", Kind.LOGICAL),
  OR("OR", Kind.LOGICAL);

  public enum Kind {
    ARITHMETIC,
    COMPARISON,
    LOGICAL
  }

  @Getter private final String symbol;
  @Getter private final Kind kind;

  /** Operator with swapped operands, e.g. {@code a < b} is {@code b > a}. */
  public BinaryOperator flip() {
    switch (this) {
      case LT:
        return GT;
      case LTE:
        return GTE;
      case GT:
        return LT;
      case GTE:
        return LTE;
      default:
        return this;
    }
  }
}
