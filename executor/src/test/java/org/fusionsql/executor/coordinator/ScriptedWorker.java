/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.executor.coordinator;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.Value;
import org.fusionsql.catalog.CatalogService;
import org.fusionsql.exception.ErrorKind;
import org.fusionsql.exception.WorkerUnavailableException;
import org.fusionsql.executor.shuffle.ShuffleService;
import org.fusionsql.executor.worker.LocalWorker;
import org.fusionsql.executor.worker.StageDescriptor;
import org.fusionsql.executor.worker.StageError;
import org.fusionsql.executor.worker.StageResultListener;
import org.fusionsql.executor.worker.Worker;
import org.fusionsql.executor.worker.WorkerFactory;
import org.fusionsql.expression.function.FunctionRegistry;

/**
 * Worker whose behavior per task attempt is decided by a {@link Script}. Attempts that are allowed
 * to run are executed by a {@link LocalWorker}.
 */
class ScriptedWorker implements Worker {

  /** What a worker does with one dispatched attempt. */
  enum Outcome {
    RUN,
    /** Throws WorkerUnavailableException from execute. */
    REFUSE,
    /** Reports a WORKER_UNAVAILABLE failure without running. */
    FAIL_UNAVAILABLE,
    /** Reports an EVALUATION failure without running. */
    FAIL_EVALUATION,
    /** Accepts the attempt and never reports back. */
    HANG,
    /** Runs and reports the completion twice. */
    COMPLETE_TWICE,
    /** Runs, streams its batches, then reports WORKER_UNAVAILABLE instead of completing. */
    FAIL_AFTER_STREAMING,
    /** Reports WORKER_UNAVAILABLE, then runs the attempt anyway shortly after. */
    RUN_AFTER_FAILING
  }

  @FunctionalInterface
  interface Script {
    Outcome decide(StageDescriptor descriptor, String workerId);
  }

  @Value
  static class Dispatch {
    String workerId;
    StageDescriptor descriptor;
  }

  private final LocalWorker delegate;
  private final Script script;
  private final Queue<Dispatch> dispatches;
  private final Queue<String> cancellations;
  @Getter private final String workerId;
  @Getter private final int slots;

  ScriptedWorker(
      LocalWorker delegate,
      Script script,
      Queue<Dispatch> dispatches,
      Queue<String> cancellations) {
    this.delegate = delegate;
    this.script = script;
    this.dispatches = dispatches;
    this.cancellations = cancellations;
    this.workerId = delegate.getWorkerId();
    this.slots = delegate.getSlots();
  }

  static WorkerFactory factory(
      Script script, Queue<Dispatch> dispatches, Queue<String> cancellations) {
    return (String id,
        int slots,
        CatalogService catalog,
        FunctionRegistry functions,
        ShuffleService shuffle) ->
        new ScriptedWorker(
            new LocalWorker(id, slots, catalog, functions, shuffle),
            script,
            dispatches,
            cancellations);
  }

  static List<Dispatch> ofStage(Queue<Dispatch> dispatches, String stageId) {
    return dispatches.stream()
        .filter(d -> d.getDescriptor().getStageId().equals(stageId))
        .collect(Collectors.toList());
  }

  @Override
  public void execute(StageDescriptor descriptor, StageResultListener listener) {
    dispatches.add(new Dispatch(workerId, descriptor));
    switch (script.decide(descriptor, workerId)) {
      case REFUSE:
        throw new WorkerUnavailableException("Worker " + workerId + " refused the task");
      case FAIL_UNAVAILABLE:
        listener.onFailed(
            descriptor,
            new StageError(descriptor.getStageId(), ErrorKind.WORKER_UNAVAILABLE, "worker lost"));
        return;
      case FAIL_EVALUATION:
        listener.onFailed(
            descriptor,
            new StageError(descriptor.getStageId(), ErrorKind.EVALUATION, "bad value"));
        return;
      case HANG:
        return;
      case COMPLETE_TWICE:
        delegate.execute(descriptor, new ForwardingListener(listener) {
          @Override
          public void onCompleted(StageDescriptor d, long rowCount) {
            listener.onCompleted(d, rowCount);
            listener.onCompleted(d, rowCount);
          }
        });
        return;
      case FAIL_AFTER_STREAMING:
        delegate.execute(descriptor, new ForwardingListener(listener) {
          @Override
          public void onCompleted(StageDescriptor d, long rowCount) {
            listener.onFailed(
                d, new StageError(d.getStageId(), ErrorKind.WORKER_UNAVAILABLE, "worker lost"));
          }
        });
        return;
      case RUN_AFTER_FAILING:
        listener.onFailed(
            descriptor,
            new StageError(descriptor.getStageId(), ErrorKind.WORKER_UNAVAILABLE, "worker lost"));
        CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS)
            .execute(() -> delegate.execute(descriptor, listener));
        return;
      default:
        delegate.execute(descriptor, listener);
    }
  }

  @Override
  public void cancel(String taskId, int attempt) {
    cancellations.add(taskId + "#" + attempt);
    delegate.cancel(taskId, attempt);
  }

  @Override
  public void shutdown() {
    delegate.shutdown();
  }

  private static class ForwardingListener implements StageResultListener {
    private final StageResultListener target;

    ForwardingListener(StageResultListener target) {
      this.target = target;
    }

    @Override
    public void onStarted(StageDescriptor descriptor) {
      target.onStarted(descriptor);
    }

    @Override
    public void onBatch(StageDescriptor descriptor, byte[] batch) {
      target.onBatch(descriptor, batch);
    }

    @Override
    public void onCompleted(StageDescriptor descriptor, long rowCount) {
      target.onCompleted(descriptor, rowCount);
    }

    @Override
    public void onFailed(StageDescriptor descriptor, StageError error) {
      target.onFailed(descriptor, error);
    }

    @Override
    public void onCancelled(StageDescriptor descriptor) {
      target.onCancelled(descriptor);
    }
  }
}
