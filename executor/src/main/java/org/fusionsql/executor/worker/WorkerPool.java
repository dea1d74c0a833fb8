/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.executor.worker;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks free task slots per worker. Not thread safe; owned by the coordinator event loop.
 */
public class WorkerPool {

  private final List<Worker> workers;
  private final Map<String, Integer> busySlots = new HashMap<>();

  public WorkerPool(List<Worker> workers) {
    Preconditions.checkArgument(!workers.isEmpty(), "Worker pool must not be empty");
    this.workers = ImmutableList.copyOf(workers);
    workers.forEach(worker -> busySlots.put(worker.getWorkerId(), 0));
  }

  public List<Worker> getWorkers() {
    return workers;
  }

  public int size() {
    return workers.size();
  }

  /**
   * Reserves a slot on the least loaded worker not in {@code excluded}. Falls back to an excluded
   * worker only when every worker of the pool is excluded.
   */
  public Optional<Worker> acquire(Set<String> excluded) {
    Worker best = pick(excluded);
    if (best == null && excluded.size() >= workers.size()) {
      best = pick(Set.of());
    }
    if (best != null) {
      busySlots.merge(best.getWorkerId(), 1, Integer::sum);
    }
    return Optional.ofNullable(best);
  }

  public void release(Worker worker) {
    busySlots.computeIfPresent(worker.getWorkerId(), (id, busy) -> Math.max(0, busy - 1));
  }

  public int freeSlots() {
    int free = 0;
    for (Worker worker : workers) {
      free += worker.getSlots() - busySlots.get(worker.getWorkerId());
    }
    return free;
  }

  public void shutdown() {
    workers.forEach(Worker::shutdown);
  }

  private Worker pick(Set<String> excluded) {
    Worker best = null;
    int bestFree = 0;
    for (Worker worker : workers) {
      if (excluded.contains(worker.getWorkerId())) {
        continue;
      }
      int free = worker.getSlots() - busySlots.get(worker.getWorkerId());
      if (free > bestFree) {
        best = worker;
        bestFree = free;
      }
    }
    return best;
  }
}
