/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import java.util.List;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.schema.Schema;

/**
 * Base operator enforcing the lifecycle {@code CREATED -> OPEN -> RUNNING -> EXHAUSTED -> CLOSED}.
 * Subclasses implement {@link #produceNext()}; empty batches they return are skipped.
 */
@Log4j2
public abstract class AbstractPhysicalOperator implements PhysicalOperator {

  protected final OperatorContext context;
  private final List<PhysicalOperator> children;
  private final Schema schema;
  private OperatorState state = OperatorState.CREATED;

  protected AbstractPhysicalOperator(
      OperatorContext context, Schema schema, List<PhysicalOperator> children) {
    this.context = context;
    this.schema = schema;
    this.children = List.copyOf(children);
  }

  @Override
  public Schema getSchema() {
    return schema;
  }

  @Override
  public OperatorState getState() {
    return state;
  }

  protected List<PhysicalOperator> getChildren() {
    return children;
  }

  @Override
  public final void open() {
    if (state != OperatorState.CREATED) {
      throw new IllegalStateException(
          getClass().getSimpleName() + " cannot be opened in state " + state);
    }
    for (PhysicalOperator child : children) {
      child.open();
    }
    doOpen();
    state = OperatorState.OPEN;
  }

  @Override
  public final Optional<RecordBatch> nextBatch() {
    switch (state) {
      case CREATED:
        throw new IllegalStateException(getClass().getSimpleName() + " was not opened");
      case CLOSED:
        throw new IllegalStateException(getClass().getSimpleName() + " is closed");
      case EXHAUSTED:
        return Optional.empty();
      default:
        break;
    }
    context.checkCancelled();
    Optional<RecordBatch> batch = produceNext();
    while (batch.isPresent() && batch.get().isEmpty()) {
      context.checkCancelled();
      batch = produceNext();
    }
    state = batch.isPresent() ? OperatorState.RUNNING : OperatorState.EXHAUSTED;
    return batch;
  }

  @Override
  public final void close() {
    if (state == OperatorState.CLOSED) {
      return;
    }
    state = OperatorState.CLOSED;
    try {
      doClose();
    } catch (RuntimeException e) {
      log.warn("Error closing operator {}", getClass().getSimpleName(), e);
    }
    for (PhysicalOperator child : children) {
      try {
        child.close();
      } catch (RuntimeException e) {
        log.warn("Error closing child operator", e);
      }
    }
  }

  /** Produces the next batch, or empty when there is no more output. */
  protected abstract Optional<RecordBatch> produceNext();

  protected void doOpen() {}

  protected void doClose() {}

  /** Pulls the next batch of the only child. */
  protected Optional<RecordBatch> pullInput() {
    return children.get(0).nextBatch();
  }
}
