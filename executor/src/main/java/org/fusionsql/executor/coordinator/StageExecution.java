/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.executor.coordinator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.fusionsql.planner.distributed.stage.ComputeStage;

/**
 * Execution state of one stage. A stage is dispatched only after every stage it reads from has
 * completed, and completes once all of its tasks have.
 */
@Log4j2
public class StageExecution {

  /** Stage execution states. */
  public enum State {
    PENDING,
    DISPATCHED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isDone() {
      return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
  }

  @Getter private final ComputeStage stage;
  @Getter private final String encodedFragment;
  @Getter private final String encodedOutputPartitioning;
  @Getter private final boolean root;
  @Getter private State state = State.PENDING;
  private final List<TaskExecution> tasks;

  public StageExecution(
      String queryId,
      ComputeStage stage,
      String encodedFragment,
      String encodedOutputPartitioning,
      boolean root) {
    this.stage = stage;
    this.encodedFragment = encodedFragment;
    this.encodedOutputPartitioning = encodedOutputPartitioning;
    this.root = root;
    List<TaskExecution> list = new ArrayList<>(stage.getTaskCount());
    for (int partition = 0; partition < stage.getTaskCount(); partition++) {
      list.add(new TaskExecution(queryId, stage.getStageId(), partition));
    }
    this.tasks = Collections.unmodifiableList(list);
  }

  public String getStageId() {
    return stage.getStageId();
  }

  public List<TaskExecution> getTasks() {
    return tasks;
  }

  public TaskExecution getTask(int partition) {
    return tasks.get(partition);
  }

  public int getCompletedTasks() {
    return (int) tasks.stream().filter(t -> t.getState() == TaskExecution.State.COMPLETED).count();
  }

  public long getTotalRows() {
    return tasks.stream().mapToLong(TaskExecution::getOutputRows).sum();
  }

  public boolean allTasksCompleted() {
    return getCompletedTasks() == tasks.size();
  }

  void transitionTo(State newState) {
    if (state == newState || state.isDone()) {
      return;
    }
    log.debug("Stage {} {} -> {}", stage.getStageId(), state, newState);
    state = newState;
  }
}
