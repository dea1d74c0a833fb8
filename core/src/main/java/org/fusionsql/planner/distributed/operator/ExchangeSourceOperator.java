/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.planner.distributed.exchange.ExchangeManager;

/** Reads one partition of an upstream stage's output through the {@link ExchangeManager}. */
public class ExchangeSourceOperator extends AbstractPhysicalOperator {

  private final ExchangeManager exchangeManager;
  private final String sourceStageId;
  private final int partition;
  private Iterator<RecordBatch> batches;

  public ExchangeSourceOperator(
      OperatorContext context,
      Schema schema,
      ExchangeManager exchangeManager,
      String sourceStageId,
      int partition) {
    super(context, schema, List.of());
    this.exchangeManager = exchangeManager;
    this.sourceStageId = sourceStageId;
    this.partition = partition;
  }

  @Override
  protected void doOpen() {
    batches = exchangeManager.read(sourceStageId, partition);
  }

  @Override
  protected Optional<RecordBatch> produceNext() {
    return batches.hasNext()
        ? Optional.of(batches.next().withSchema(getSchema()))
        : Optional.empty();
  }

  @Override
  protected void doClose() {
    batches = null;
  }
}
