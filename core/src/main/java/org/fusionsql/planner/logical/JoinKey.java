/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.logical;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.fusionsql.expression.Expression;

/** Equality condition between an expression over the left input and one over the right input. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class JoinKey {
  private final Expression left;
  private final Expression right;

  @Override
  public String toString() {
    return left + " = " + right;
  }
}
