/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.physical;

/** Phase of a two-phase aggregation. */
public enum AggregationMode {
  /** Aggregates one partition into partial states. */
  PARTIAL,
  /** Merges the partial states of all partitions of a group. */
  FINAL,
  /** Aggregates complete groups in one step. */
  SINGLE
}
