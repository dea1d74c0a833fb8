/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.executor.worker;

/** Executes stage tasks on behalf of the coordinator. */
public interface Worker {

  String getWorkerId();

  /** Number of tasks this worker runs concurrently. */
  int getSlots();

  /**
   * Starts one task attempt asynchronously. Progress is reported through the listener.
   *
   * @throws org.fusionsql.exception.WorkerUnavailableException if the worker cannot accept tasks
   */
  void execute(StageDescriptor descriptor, StageResultListener listener);

  /** Best effort cancellation of a running attempt. Unknown task ids are ignored. */
  void cancel(String taskId, int attempt);

  void shutdown();
}
