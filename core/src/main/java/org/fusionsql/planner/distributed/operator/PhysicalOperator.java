/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import java.util.Optional;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.schema.Schema;

/**
 * Pull based operator. Operators form a tree where each parent pulls batches from its children.
 *
 * <p>Lifecycle:
 *
 * <ol>
 *   <li>{@link #open()} prepares the operator and its children, once
 *   <li>{@link #nextBatch()} is called until it returns empty
 *   <li>{@link #close()} releases resources; it may be called in any state and more than once
 * </ol>
 */
public interface PhysicalOperator extends AutoCloseable {

  /** Returns the schema of every batch this operator produces. */
  Schema getSchema();

  /**
   * Opens the operator and its children.
   *
   * @throws IllegalStateException if the operator is not in state {@link OperatorState#CREATED}
   */
  void open();

  /**
   * Returns the next non-empty batch, or empty once the operator is exhausted.
   *
   * @throws IllegalStateException if the operator was never opened or is already closed
   * @throws org.fusionsql.exception.QueryCancelledException if the task was cancelled
   */
  Optional<RecordBatch> nextBatch();

  @Override
  void close();

  OperatorState getState();
}
