/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.executor.worker;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.fusionsql.catalog.CatalogService;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.exception.QueryCancelledException;
import org.fusionsql.exception.WorkerUnavailableException;
import org.fusionsql.executor.shuffle.ShuffleService;
import org.fusionsql.expression.function.FunctionRegistry;
import org.fusionsql.planner.distributed.codec.PhysicalPlanCodec;
import org.fusionsql.planner.distributed.codec.RecordBatchCodec;
import org.fusionsql.planner.distributed.exchange.OutputBuffer;
import org.fusionsql.planner.distributed.operator.OperatorContext;
import org.fusionsql.planner.distributed.pipeline.StageTaskRunner;
import org.fusionsql.planner.physical.PartitioningScheme;
import org.fusionsql.planner.physical.PhysicalPlan;

/**
 * In-process worker. Runs tasks on its own fixed thread pool, one thread per slot. Non-root output
 * is committed to the {@link ShuffleService}; root output is streamed to the listener batch by
 * batch.
 */
@Log4j2
public class LocalWorker implements Worker {

  @Getter private final String workerId;
  @Getter private final int slots;
  private final PhysicalPlanCodec planCodec;
  private final RecordBatchCodec batchCodec = new RecordBatchCodec();
  private final ShuffleService shuffle;
  private final ExecutorService executor;
  private final Map<String, OperatorContext> running = new ConcurrentHashMap<>();
  private final AtomicBoolean available = new AtomicBoolean(true);

  public LocalWorker(
      String workerId,
      int slots,
      CatalogService catalog,
      FunctionRegistry functions,
      ShuffleService shuffle) {
    this.workerId = workerId;
    this.slots = slots;
    this.planCodec = new PhysicalPlanCodec(catalog, functions);
    this.shuffle = shuffle;
    this.executor =
        Executors.newFixedThreadPool(
            slots,
            new ThreadFactoryBuilder()
                .setNameFormat(workerId + "-task-%d")
                .setDaemon(true)
                .build());
  }

  /** Marks the worker as down. New tasks are refused with {@link WorkerUnavailableException}. */
  public void setAvailable(boolean isAvailable) {
    available.set(isAvailable);
  }

  @Override
  public void execute(StageDescriptor descriptor, StageResultListener listener) {
    if (!available.get()) {
      throw new WorkerUnavailableException("Worker " + workerId + " is not available");
    }
    OperatorContext context =
        new OperatorContext(
            attemptKey(descriptor.taskId(), descriptor.getAttempt()), batchSize(descriptor));
    running.put(attemptKey(descriptor.taskId(), descriptor.getAttempt()), context);
    try {
      executor.execute(() -> runTask(descriptor, context, listener));
    } catch (RejectedExecutionException e) {
      running.remove(attemptKey(descriptor.taskId(), descriptor.getAttempt()));
      throw new WorkerUnavailableException("Worker " + workerId + " rejected the task", e);
    }
  }

  @Override
  public void cancel(String taskId, int attempt) {
    OperatorContext context = running.get(attemptKey(taskId, attempt));
    if (context != null) {
      log.debug("Cancelling task {} attempt {} on {}", taskId, attempt, workerId);
      context.cancel();
    }
  }

  @Override
  public void shutdown() {
    running.values().forEach(OperatorContext::cancel);
    executor.shutdown();
    try {
      if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private void runTask(
      StageDescriptor descriptor, OperatorContext context, StageResultListener listener) {
    try {
      listener.onStarted(descriptor);
      PhysicalPlan fragment = planCodec.decode(descriptor.getFragment());
      PartitioningScheme outputPartitioning =
          planCodec.decodePartitioning(descriptor.getOutputPartitioning());
      StageTaskRunner runner =
          new StageTaskRunner(
              fragment,
              descriptor.getPartition(),
              outputPartitioning,
              context,
              shuffle.exchangeFor(descriptor.getQueryId()));
      OutputBuffer output =
          descriptor.isRoot()
              ? new StreamingOutputBuffer(descriptor, listener)
              : new ShuffleOutputBuffer(descriptor, outputPartitioning.getPartitionCount());
      runner.run(output);
      listener.onCompleted(descriptor, runner.getRowCount());
    } catch (QueryCancelledException e) {
      listener.onCancelled(descriptor);
    } catch (RuntimeException e) {
      log.error("Task {} failed on {}", descriptor.taskId(), workerId, e);
      listener.onFailed(descriptor, StageError.from(descriptor.getStageId(), e));
    } finally {
      running.remove(attemptKey(descriptor.taskId(), descriptor.getAttempt()));
    }
  }

  private static int batchSize(StageDescriptor descriptor) {
    return descriptor.getBatchSize() > 0
        ? descriptor.getBatchSize()
        : OperatorContext.DEFAULT_BATCH_SIZE;
  }

  private static String attemptKey(String taskId, int attempt) {
    return taskId + "#" + attempt;
  }

  /** Sends each root batch to the coordinator as soon as it is produced. */
  private class StreamingOutputBuffer implements OutputBuffer {
    private final StageDescriptor descriptor;
    private final StageResultListener listener;

    StreamingOutputBuffer(StageDescriptor descriptor, StageResultListener listener) {
      this.descriptor = descriptor;
      this.listener = listener;
    }

    @Override
    public void enqueue(int partition, RecordBatch batch) {
      listener.onBatch(descriptor, batchCodec.encode(batch));
    }

    @Override
    public void setNoMoreBatches() {}

    @Override
    public void abort() {}
  }

  /** Buffers encoded output per consumer partition and commits it when the task finishes. */
  private class ShuffleOutputBuffer implements OutputBuffer {
    private final StageDescriptor descriptor;
    private final List<List<byte[]>> partitions;

    ShuffleOutputBuffer(StageDescriptor descriptor, int partitionCount) {
      this.descriptor = descriptor;
      this.partitions = new ArrayList<>(partitionCount);
      for (int i = 0; i < partitionCount; i++) {
        partitions.add(new ArrayList<>());
      }
    }

    @Override
    public void enqueue(int partition, RecordBatch batch) {
      partitions.get(partition).add(batchCodec.encode(batch));
    }

    @Override
    public void setNoMoreBatches() {
      shuffle.commit(
          descriptor.getQueryId(),
          descriptor.getStageId(),
          descriptor.getPartition(),
          descriptor.getAttempt(),
          partitions);
    }

    @Override
    public void abort() {
      partitions.forEach(List::clear);
    }
  }
}
