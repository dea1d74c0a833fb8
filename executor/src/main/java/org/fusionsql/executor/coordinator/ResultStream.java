/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.executor.coordinator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.exception.QueryCancelledException;
import org.fusionsql.exception.QueryFailedException;

/**
 * Blocking iterator over the result batches of one query. Batches arrive in no particular order
 * across root tasks. Iteration ends normally on completion and on cancellation, and throws the
 * {@link QueryFailedException} when the query fails.
 */
public class ResultStream implements Iterator<RecordBatch>, AutoCloseable {

  /** Query status as seen by the client. */
  public enum Status {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED
  }

  private static final Object END = new Object();

  @Getter private final String queryId;
  @Getter private final Schema schema;
  private final Runnable canceller;
  private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
  private final CountDownLatch terminated = new CountDownLatch(1);
  @Getter private volatile Status status = Status.RUNNING;
  private volatile QueryFailedException failure;
  private RecordBatch nextBatch;
  private boolean ended;

  ResultStream(String queryId, Schema schema, Runnable canceller) {
    this.queryId = queryId;
    this.schema = schema;
    this.canceller = canceller;
  }

  @Override
  public boolean hasNext() {
    if (nextBatch != null) {
      return true;
    }
    if (!ended) {
      Object event = take();
      if (event instanceof RecordBatch) {
        nextBatch = (RecordBatch) event;
        return true;
      }
      ended = true;
    }
    if (status == Status.FAILED) {
      throw failure;
    }
    return false;
  }

  @Override
  public RecordBatch next() {
    if (!hasNext()) {
      throw new NoSuchElementException("Query " + queryId + " has no more results");
    }
    RecordBatch batch = nextBatch;
    nextBatch = null;
    return batch;
  }

  /**
   * Drains the stream into rows.
   *
   * @throws QueryFailedException if the query fails
   */
  public List<List<Object>> collectRows() {
    List<List<Object>> rows = new ArrayList<>();
    while (hasNext()) {
      rows.addAll(next().toRows());
    }
    return rows;
  }

  /** Requests cancellation. Running tasks are stopped and the status becomes CANCELLED. */
  public void cancel() {
    if (status == Status.RUNNING) {
      canceller.run();
    }
  }

  /** True when the batches delivered are not the full result. */
  public boolean isIncomplete() {
    return status == Status.FAILED || status == Status.CANCELLED;
  }

  public Optional<QueryFailedException> getFailure() {
    return Optional.ofNullable(failure);
  }

  /** Waits until the query reaches a terminal status. */
  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    return terminated.await(timeout, unit);
  }

  @Override
  public void close() {
    cancel();
  }

  void offer(RecordBatch batch) {
    if (status == Status.RUNNING) {
      queue.add(batch);
    }
  }

  void complete() {
    terminate(Status.COMPLETED);
  }

  void fail(QueryFailedException cause) {
    if (status == Status.RUNNING) {
      failure = cause;
    }
    terminate(Status.FAILED);
  }

  void cancelled() {
    terminate(Status.CANCELLED);
  }

  private void terminate(Status terminal) {
    if (status != Status.RUNNING) {
      return;
    }
    status = terminal;
    queue.add(END);
    terminated.countDown();
  }

  private Object take() {
    try {
      return queue.take();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueryCancelledException("Interrupted while waiting for results of " + queryId, e);
    }
  }
}
