/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import java.util.concurrent.atomic.AtomicBoolean;
import org.fusionsql.exception.QueryCancelledException;

/**
 * Runtime context shared by every operator of one task. Provides the batch size and the
 * cancellation flag checked on each pull.
 */
public class OperatorContext {

  public static final int DEFAULT_BATCH_SIZE = 1024;

  private final String taskId;
  private final int batchSize;
  private final AtomicBoolean cancelled;

  public OperatorContext(String taskId, int batchSize) {
    this(taskId, batchSize, new AtomicBoolean(false));
  }

  public OperatorContext(String taskId, int batchSize, AtomicBoolean cancelled) {
    this.taskId = taskId;
    this.batchSize = batchSize;
    this.cancelled = cancelled;
  }

  /** Returns the identifier of the task the operators run in. */
  public String getTaskId() {
    return taskId;
  }

  /** Returns the maximum number of rows an operator emits per batch when it builds batches. */
  public int getBatchSize() {
    return batchSize;
  }

  /** Returns true if the task has been cancelled. */
  public boolean isCancelled() {
    return cancelled.get();
  }

  /** Requests cancellation of the task. */
  public void cancel() {
    cancelled.set(true);
  }

  /**
   * Fails fast once the task is cancelled.
   *
   * @throws QueryCancelledException if {@link #cancel()} was called
   */
  public void checkCancelled() {
    if (cancelled.get()) {
      throw new QueryCancelledException("Task " + taskId + " was cancelled");
    }
  }

  /** Creates a default context for testing. */
  public static OperatorContext createDefault(String taskId) {
    return new OperatorContext(taskId, DEFAULT_BATCH_SIZE);
  }
}
