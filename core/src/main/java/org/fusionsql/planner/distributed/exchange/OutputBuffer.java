/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.exchange;

import org.fusionsql.data.batch.RecordBatch;

/**
 * Receives the output of one task, already split into the partitions of the downstream
 * consumer. Serialization format is an implementation detail of the executor.
 */
public interface OutputBuffer {

  /**
   * Enqueues a batch for the given output partition.
   *
   * @param partition the consumer partition
   * @param batch non-empty batch
   */
  void enqueue(int partition, RecordBatch batch);

  /** Signals that no more batches will be enqueued. */
  void setNoMoreBatches();

  /** Aborts the buffer, discarding any buffered batches. */
  void abort();
}
