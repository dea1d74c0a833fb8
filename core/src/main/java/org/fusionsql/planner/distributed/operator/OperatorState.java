/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

/** Lifecycle of a {@link PhysicalOperator}. States only move forward. */
public enum OperatorState {
  CREATED,
  OPEN,
  RUNNING,
  EXHAUSTED,
  CLOSED
}
