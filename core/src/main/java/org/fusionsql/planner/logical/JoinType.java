/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.logical;

/** Join semantics. SEMI and ANTI output the left columns only. */
public enum JoinType {
  INNER,
  LEFT,
  RIGHT,
  FULL,
  SEMI,
  ANTI;

  /** Whether unmatched left rows are kept with nulls on the right. */
  public boolean preservesLeft() {
    return this == LEFT || this == FULL;
  }

  /** Whether unmatched right rows are kept with nulls on the left. */
  public boolean preservesRight() {
    return this == RIGHT || this == FULL;
  }

  public boolean outputsRight() {
    return this != SEMI && this != ANTI;
  }
}
