/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.physical;

/** Execution strategy of a physical plan node. */
public enum PhysicalOperatorType {

  /** Reads one partition of a table. */
  SCAN,

  /** Applies a predicate to every batch. */
  FILTER,

  /** Computes output columns batch by batch. */
  PROJECTION,

  /** Groups rows in a hash table. Buffers its whole input. */
  HASH_AGGREGATE,

  /** Builds a hash table over the right input and probes it with the left input. */
  HASH_JOIN,

  /** Sorts its whole input in memory. */
  SORT,

  /** Skips and truncates rows. */
  LIMIT,

  /** Concatenates the partitions of its inputs. */
  UNION,

  /** Redistributes rows between partitions. Marks a stage boundary. */
  REPARTITION,

  /** Reads one partition of the output of an upstream stage. */
  EXCHANGE_SOURCE
}
