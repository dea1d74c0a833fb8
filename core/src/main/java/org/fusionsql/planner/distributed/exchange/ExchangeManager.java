/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.exchange;

import java.util.Iterator;
import org.fusionsql.data.batch.RecordBatch;

/**
 * Gives a task access to the output of the stages it depends on. The executor decides where that
 * output lives: in memory, in a shuffle store, or on a remote worker.
 */
public interface ExchangeManager {

  /**
   * Reads one output partition of an upstream stage, concatenated over all tasks of that stage.
   *
   * @param sourceStageId the upstream stage
   * @param partition the output partition consumed by the calling task
   * @throws org.fusionsql.exception.StageExecutionException if the partition is not available
   */
  Iterator<RecordBatch> read(String sourceStageId, int partition);
}
