/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.executor.coordinator;

import java.util.HashSet;
import java.util.Set;
import lombok.Getter;
import org.fusionsql.executor.worker.Worker;

/** Coordinator-side bookkeeping for one partition of a stage across its attempts. */
@Getter
public class TaskExecution {

  /** Task execution states. */
  public enum State {
    PENDING,
    DISPATCHED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED
  }

  private final String taskId;
  private final String stageId;
  private final int partition;
  private State state = State.PENDING;
  /** Current attempt number, starting at 1 once dispatched. */
  private int attempt;
  private Worker worker;
  private boolean streamedResults;
  private long outputRows;
  private final Set<String> failedWorkers = new HashSet<>();

  public TaskExecution(String queryId, String stageId, int partition) {
    this.taskId = queryId + "/" + stageId + "/" + partition;
    this.stageId = stageId;
    this.partition = partition;
  }

  void dispatched(Worker target) {
    attempt++;
    worker = target;
    state = State.DISPATCHED;
  }

  void running() {
    state = State.RUNNING;
  }

  void streamed() {
    streamedResults = true;
  }

  void completed(long rows) {
    outputRows = rows;
    state = State.COMPLETED;
  }

  /** Puts the task back in the queue, away from the worker that failed it. */
  void retry() {
    if (worker != null) {
      failedWorkers.add(worker.getWorkerId());
    }
    worker = null;
    state = State.PENDING;
  }

  void failed() {
    state = State.FAILED;
  }

  void cancelled() {
    state = State.CANCELLED;
  }

  boolean isActive() {
    return state == State.DISPATCHED || state == State.RUNNING;
  }
}
