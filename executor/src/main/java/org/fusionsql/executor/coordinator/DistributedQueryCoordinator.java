/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.executor.coordinator;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import lombok.extern.log4j.Log4j2;
import org.fusionsql.common.setting.EngineSettings;
import org.fusionsql.exception.ErrorKind;
import org.fusionsql.exception.QueryEngineException;
import org.fusionsql.exception.QueryFailedException;
import org.fusionsql.exception.RetriesExhaustedException;
import org.fusionsql.exception.StageExecutionException;
import org.fusionsql.exception.WorkerUnavailableException;
import org.fusionsql.executor.shuffle.ShuffleService;
import org.fusionsql.executor.worker.StageDescriptor;
import org.fusionsql.executor.worker.StageError;
import org.fusionsql.executor.worker.StageResultListener;
import org.fusionsql.executor.worker.Worker;
import org.fusionsql.executor.worker.WorkerPool;
import org.fusionsql.planner.distributed.codec.PhysicalPlanCodec;
import org.fusionsql.planner.distributed.codec.RecordBatchCodec;
import org.fusionsql.planner.distributed.stage.ComputeStage;
import org.fusionsql.planner.distributed.stage.StagedPlan;

/**
 * Drives staged plans across the worker pool.
 *
 * <p>All scheduling state is owned by a single event loop thread; worker callbacks, timeouts and
 * cancellation requests are posted to it as events. Stages are dispatched in dependency order.
 * A task attempt failing with {@link ErrorKind#WORKER_UNAVAILABLE} is retried on a different
 * worker up to {@code maxStageRetries} times; any other failure fails the query. Root tasks that
 * already streamed batches to the client are never retried.
 */
@Log4j2
public class DistributedQueryCoordinator implements AutoCloseable {

  private static final int MAX_FINISHED_QUERIES = 64;

  private final WorkerPool workerPool;
  private final ShuffleService shuffle;
  private final PhysicalPlanCodec planCodec;
  private final RecordBatchCodec batchCodec = new RecordBatchCodec();
  private final int maxStageRetries;
  private final long taskTimeoutMillis;
  private final int batchSize;
  private final ScheduledThreadPoolExecutor loop;

  /** Active queries in submission order. Loop thread only. */
  private final Map<String, QueryExecution> queries = new LinkedHashMap<>();

  /** Recently finished queries, kept for state inspection. Loop thread only. */
  private final Map<String, QueryExecution> finished =
      new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, QueryExecution> eldest) {
          return size() > MAX_FINISHED_QUERIES;
        }
      };

  /** Worker slot held by each outstanding attempt, keyed by task id and attempt. Loop only. */
  private final Map<String, Worker> slots = new HashMap<>();

  private final Map<String, ScheduledFuture<?>> timeouts = new HashMap<>();

  public DistributedQueryCoordinator(
      WorkerPool workerPool,
      ShuffleService shuffle,
      PhysicalPlanCodec planCodec,
      EngineSettings settings) {
    this.workerPool = workerPool;
    this.shuffle = shuffle;
    this.planCodec = planCodec;
    this.maxStageRetries = settings.getMaxStageRetries();
    this.taskTimeoutMillis = settings.getTaskTimeoutMillis();
    this.batchSize = settings.getBatchSize();
    this.loop =
        new ScheduledThreadPoolExecutor(
            1,
            new ThreadFactoryBuilder()
                .setNameFormat("query-coordinator-%d")
                .setDaemon(true)
                .build());
    this.loop.setRemoveOnCancelPolicy(true);
    this.loop.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
  }

  /**
   * Starts executing a staged plan.
   *
   * @return stream of the root stage's output
   * @throws QueryEngineException of kind STAGE if the stage graph is invalid
   */
  public ResultStream execute(String queryId, StagedPlan plan) {
    List<String> errors = plan.validate();
    if (!errors.isEmpty()) {
      throw new QueryEngineException(
          ErrorKind.STAGE, "Invalid stage graph for query " + queryId + ": " + errors);
    }
    ComputeStage rootStage = plan.getRootStage();
    List<StageExecution> stages = new ArrayList<>();
    for (ComputeStage stage : plan.getStages()) {
      stages.add(
          new StageExecution(
              queryId,
              stage,
              planCodec.encode(stage.getFragment()),
              planCodec.encodePartitioningToString(stage.getOutputPartitioning()),
              stage == rootStage));
    }
    ResultStream stream =
        new ResultStream(queryId, rootStage.getFragment().getSchema(), () -> cancel(queryId));
    QueryExecution query = new QueryExecution(queryId, stages, stream);
    log.info(
        "Executing query {} with {} stages across {} workers",
        queryId,
        stages.size(),
        workerPool.size());
    post(
        () -> {
          queries.put(queryId, query);
          dispatchReadyTasks();
        });
    return stream;
  }

  /** Cancels a query. Nothing is dispatched for it afterwards. Unknown ids are ignored. */
  public void cancel(String queryId) {
    post(() -> handleCancel(queryId));
  }

  /** Snapshot of stage states, taken on the event loop. */
  public Map<String, StageExecution.State> getStageStates(String queryId) {
    try {
      return loop.submit(
              () -> {
                Map<String, StageExecution.State> states = new LinkedHashMap<>();
                QueryExecution query = queries.getOrDefault(queryId, finished.get(queryId));
                if (query != null) {
                  query.stages.values().forEach(s -> states.put(s.getStageId(), s.getState()));
                }
                return states;
              })
          .get(10, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while reading stage states", e);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to read stage states of " + queryId, e);
    }
  }

  @Override
  public void close() {
    loop.shutdown();
    try {
      if (!loop.awaitTermination(10, TimeUnit.SECONDS)) {
        loop.shutdownNow();
      }
    } catch (InterruptedException e) {
      loop.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private void post(Runnable event) {
    try {
      loop.execute(
          () -> {
            try {
              event.run();
            } catch (RuntimeException e) {
              log.error("Coordinator event failed", e);
            }
          });
    } catch (RejectedExecutionException e) {
      log.warn("Coordinator is shut down, dropping event");
    }
  }

  /** Dispatches every pending task whose stage inputs are complete, while slots remain. */
  private void dispatchReadyTasks() {
    for (QueryExecution query : new ArrayList<>(queries.values())) {
      for (StageExecution stage : query.stages.values()) {
        if (stage.getState().isDone() || !query.inputsCompleted(stage)) {
          continue;
        }
        for (TaskExecution task : stage.getTasks()) {
          if (task.getState() != TaskExecution.State.PENDING) {
            continue;
          }
          Optional<Worker> worker = workerPool.acquire(task.getFailedWorkers());
          if (worker.isEmpty()) {
            if (workerPool.freeSlots() == 0) {
              return;
            }
            continue;
          }
          dispatch(query, stage, task, worker.get());
          if (query.finished) {
            break;
          }
        }
        if (query.finished) {
          break;
        }
      }
    }
  }

  private void dispatch(
      QueryExecution query, StageExecution stage, TaskExecution task, Worker worker) {
    task.dispatched(worker);
    if (stage.getState() == StageExecution.State.PENDING) {
      stage.transitionTo(StageExecution.State.DISPATCHED);
    }
    StageDescriptor descriptor =
        StageDescriptor.builder()
            .queryId(query.queryId)
            .stageId(stage.getStageId())
            .partition(task.getPartition())
            .attempt(task.getAttempt())
            .fragment(stage.getEncodedFragment())
            .outputPartitioning(stage.getEncodedOutputPartitioning())
            .sourceStageIds(stage.getStage().getSourceStageIds())
            .root(stage.isRoot())
            .batchSize(batchSize)
            .build();
    slots.put(attemptKey(task.getTaskId(), task.getAttempt()), worker);
    log.debug(
        "Dispatching {} attempt {} to {}",
        task.getTaskId(),
        task.getAttempt(),
        worker.getWorkerId());
    try {
      worker.execute(descriptor, new CoordinatorListener());
    } catch (WorkerUnavailableException e) {
      log.warn("Worker {} refused {}: {}", worker.getWorkerId(), task.getTaskId(), e.getMessage());
      releaseSlot(task.getTaskId(), task.getAttempt());
      handleFailure(
          query, stage, task, task.getAttempt(), StageError.from(stage.getStageId(), e));
      post(this::dispatchReadyTasks);
      return;
    }
    String stageId = stage.getStageId();
    int partition = task.getPartition();
    int attempt = task.getAttempt();
    timeouts.put(
        attemptKey(task.getTaskId(), attempt),
        loop.schedule(
            () -> post(() -> handleTimeout(query.queryId, stageId, partition, attempt)),
            taskTimeoutMillis,
            TimeUnit.MILLISECONDS));
  }

  private void handleStarted(StageDescriptor descriptor) {
    TaskExecution task = currentAttempt(descriptor);
    if (task == null || task.getState() != TaskExecution.State.DISPATCHED) {
      return;
    }
    task.running();
    StageExecution stage = queries.get(descriptor.getQueryId()).stages.get(descriptor.getStageId());
    if (stage.getState() == StageExecution.State.DISPATCHED) {
      stage.transitionTo(StageExecution.State.RUNNING);
    }
  }

  private void handleBatch(StageDescriptor descriptor, byte[] encoded) {
    TaskExecution task = currentAttempt(descriptor);
    if (task == null || !task.isActive()) {
      log.debug(
          "Dropping batch from stale attempt {} of {}",
          descriptor.getAttempt(),
          descriptor.taskId());
      return;
    }
    QueryExecution query = queries.get(descriptor.getQueryId());
    task.streamed();
    query.resultsDelivered = true;
    query.stream.offer(batchCodec.decode(encoded));
  }

  private void handleCompleted(StageDescriptor descriptor, long rowCount) {
    releaseSlot(descriptor.taskId(), descriptor.getAttempt());
    QueryExecution query = queries.get(descriptor.getQueryId());
    if (query == null) {
      dispatchReadyTasks();
      return;
    }
    StageExecution stage = query.stages.get(descriptor.getStageId());
    TaskExecution task = stage.getTask(descriptor.getPartition());
    if (task.getState() == TaskExecution.State.COMPLETED) {
      log.debug("Ignoring duplicate completion of {}", task.getTaskId());
    } else if (stage.isRoot()
        && (descriptor.getAttempt() != task.getAttempt() || !task.isActive())) {
      log.debug("Ignoring completion of stale root attempt {}", descriptor.taskId());
    } else {
      if (descriptor.getAttempt() != task.getAttempt() && task.isActive()) {
        // an earlier attempt won; stop the one still running
        task.getWorker().cancel(task.getTaskId(), task.getAttempt());
        releaseSlot(task.getTaskId(), task.getAttempt());
      }
      task.completed(rowCount);
      if (stage.allTasksCompleted()) {
        stage.transitionTo(StageExecution.State.COMPLETED);
        log.info(
            "Stage {} of query {} completed, {} rows",
            stage.getStageId(),
            query.queryId,
            stage.getTotalRows());
        if (stage.isRoot()) {
          finish(query);
          query.stream.complete();
        }
      }
    }
    dispatchReadyTasks();
  }

  private void handleFailed(StageDescriptor descriptor, StageError error) {
    releaseSlot(descriptor.taskId(), descriptor.getAttempt());
    TaskExecution task = currentAttempt(descriptor);
    if (task != null && task.isActive()) {
      QueryExecution query = queries.get(descriptor.getQueryId());
      handleFailure(
          query, query.stages.get(descriptor.getStageId()), task, descriptor.getAttempt(), error);
    }
    dispatchReadyTasks();
  }

  private void handleWorkerCancelled(StageDescriptor descriptor) {
    releaseSlot(descriptor.taskId(), descriptor.getAttempt());
    TaskExecution task = currentAttempt(descriptor);
    if (task != null && task.isActive()) {
      // cancelled without a request from this coordinator
      QueryExecution query = queries.get(descriptor.getQueryId());
      handleFailure(
          query,
          query.stages.get(descriptor.getStageId()),
          task,
          descriptor.getAttempt(),
          new StageError(
              descriptor.getStageId(),
              ErrorKind.WORKER_UNAVAILABLE,
              "Task " + descriptor.taskId() + " was aborted by its worker"));
    }
    dispatchReadyTasks();
  }

  private void handleTimeout(String queryId, String stageId, int partition, int attempt) {
    QueryExecution query = queries.get(queryId);
    if (query == null) {
      return;
    }
    StageExecution stage = query.stages.get(stageId);
    TaskExecution task = stage.getTask(partition);
    if (task.getAttempt() != attempt || !task.isActive()) {
      return;
    }
    log.warn(
        "Task {} attempt {} timed out after {} ms", task.getTaskId(), attempt, taskTimeoutMillis);
    task.getWorker().cancel(task.getTaskId(), attempt);
    releaseSlot(task.getTaskId(), attempt);
    handleFailure(
        query,
        stage,
        task,
        attempt,
        new StageError(
            stageId,
            ErrorKind.WORKER_UNAVAILABLE,
            "Task " + task.getTaskId() + " timed out after " + taskTimeoutMillis + " ms"));
    dispatchReadyTasks();
  }

  private void handleFailure(
      QueryExecution query,
      StageExecution stage,
      TaskExecution task,
      int attempt,
      StageError error) {
    boolean canRetry = error.isRetryable() && !(stage.isRoot() && task.isStreamedResults());
    if (canRetry && attempt <= maxStageRetries) {
      log.warn(
          "Task {} attempt {} failed on {}, retrying: {}",
          task.getTaskId(),
          attempt,
          task.getWorker() == null ? "unknown" : task.getWorker().getWorkerId(),
          error.getMessage());
      task.retry();
      return;
    }
    QueryEngineException cause =
        canRetry
            ? new RetriesExhaustedException(stage.getStageId(), attempt, error.toException())
            : error.toException();
    task.failed();
    fail(query, stage, cause);
  }

  private void fail(QueryExecution query, StageExecution origin, QueryEngineException cause) {
    log.error("Query {} failed in stage {}", query.queryId, origin.getStageId(), cause);
    origin.transitionTo(StageExecution.State.FAILED);
    stopTasks(query);
    finish(query);
    ErrorKind kind =
        cause instanceof StageExecutionException
            ? ((StageExecutionException) cause).getOriginKind()
            : cause.getKind();
    query.stream.fail(
        new QueryFailedException(
            query.queryId, origin.getStageId(), kind, query.resultsDelivered, cause));
  }

  private void handleCancel(String queryId) {
    QueryExecution query = queries.get(queryId);
    if (query == null) {
      return;
    }
    log.info("Cancelling query {}", queryId);
    stopTasks(query);
    finish(query);
    query.stream.cancelled();
  }

  /** Cancels active tasks and marks every unfinished stage CANCELLED. */
  private void stopTasks(QueryExecution query) {
    for (StageExecution stage : query.stages.values()) {
      for (TaskExecution task : stage.getTasks()) {
        if (task.isActive()) {
          task.getWorker().cancel(task.getTaskId(), task.getAttempt());
          releaseSlot(task.getTaskId(), task.getAttempt());
          task.cancelled();
        } else if (task.getState() == TaskExecution.State.PENDING) {
          task.cancelled();
        }
      }
      stage.transitionTo(StageExecution.State.CANCELLED);
    }
  }

  private void finish(QueryExecution query) {
    query.finished = true;
    queries.remove(query.queryId);
    finished.put(query.queryId, query);
    shuffle.release(query.queryId);
  }

  /** The task of an active query if the descriptor is its current attempt. */
  private TaskExecution currentAttempt(StageDescriptor descriptor) {
    QueryExecution query = queries.get(descriptor.getQueryId());
    if (query == null) {
      return null;
    }
    TaskExecution task =
        query.stages.get(descriptor.getStageId()).getTask(descriptor.getPartition());
    return task.getAttempt() == descriptor.getAttempt() ? task : null;
  }

  private void releaseSlot(String taskId, int attempt) {
    ScheduledFuture<?> timeout = timeouts.remove(attemptKey(taskId, attempt));
    if (timeout != null) {
      timeout.cancel(false);
    }
    Worker worker = slots.remove(attemptKey(taskId, attempt));
    if (worker != null) {
      workerPool.release(worker);
    }
  }

  private static String attemptKey(String taskId, int attempt) {
    return taskId + "#" + attempt;
  }

  /** Posts worker callbacks onto the event loop. */
  private class CoordinatorListener implements StageResultListener {

    @Override
    public void onStarted(StageDescriptor descriptor) {
      post(() -> handleStarted(descriptor));
    }

    @Override
    public void onBatch(StageDescriptor descriptor, byte[] batch) {
      post(() -> handleBatch(descriptor, batch));
    }

    @Override
    public void onCompleted(StageDescriptor descriptor, long rowCount) {
      post(() -> handleCompleted(descriptor, rowCount));
    }

    @Override
    public void onFailed(StageDescriptor descriptor, StageError error) {
      post(() -> handleFailed(descriptor, error));
    }

    @Override
    public void onCancelled(StageDescriptor descriptor) {
      post(() -> handleWorkerCancelled(descriptor));
    }
  }

  private static class QueryExecution {
    private final String queryId;
    private final Map<String, StageExecution> stages = new LinkedHashMap<>();
    private final ResultStream stream;
    private boolean finished;
    private boolean resultsDelivered;

    QueryExecution(String queryId, List<StageExecution> stageList, ResultStream stream) {
      this.queryId = queryId;
      this.stream = stream;
      stageList.forEach(stage -> stages.put(stage.getStageId(), stage));
    }

    boolean inputsCompleted(StageExecution stage) {
      for (String source : stage.getStage().getSourceStageIds()) {
        if (stages.get(source).getState() != StageExecution.State.COMPLETED) {
          return false;
        }
      }
      return true;
    }
  }
}
