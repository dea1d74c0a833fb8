/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.pipeline;

import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.exception.QueryCancelledException;
import org.fusionsql.planner.distributed.exchange.ExchangeManager;
import org.fusionsql.planner.distributed.exchange.OutputBuffer;
import org.fusionsql.planner.distributed.exchange.OutputPartitioner;
import org.fusionsql.planner.distributed.operator.ExecutionPlanner;
import org.fusionsql.planner.distributed.operator.OperatorContext;
import org.fusionsql.planner.distributed.operator.PhysicalOperator;
import org.fusionsql.planner.physical.PartitioningScheme;
import org.fusionsql.planner.physical.PhysicalPlan;

/**
 * Executes one task: one partition of one stage fragment. Pulls every batch out of the root
 * operator, splits it by the output partitioning and hands it to the {@link OutputBuffer}.
 *
 * <p>Execution model:
 *
 * <ol>
 *   <li>The fragment is turned into an operator tree for the task's partition
 *   <li>The root operator is opened and drained
 *   <li>Each batch is split into the partitions of the consuming stage
 *   <li>The operator tree is closed whatever the outcome
 * </ol>
 */
@Log4j2
public class StageTaskRunner {

  private final PhysicalPlan fragment;
  private final int partition;
  private final PartitioningScheme outputPartitioning;
  private final OperatorContext context;
  private final ExchangeManager exchangeManager;

  @Getter private volatile TaskRunStatus status = TaskRunStatus.CREATED;
  @Getter private long rowCount;

  /**
   * @param outputPartitioning how the consuming stage partitions this stage's output;
   *     single partition for the root stage
   */
  public StageTaskRunner(
      PhysicalPlan fragment,
      int partition,
      PartitioningScheme outputPartitioning,
      OperatorContext context,
      ExchangeManager exchangeManager) {
    this.fragment = fragment;
    this.partition = partition;
    this.outputPartitioning = outputPartitioning;
    this.context = context;
    this.exchangeManager = exchangeManager;
  }

  /**
   * Runs the task to completion.
   *
   * @throws QueryCancelledException if the task was cancelled while running
   * @throws org.fusionsql.exception.QueryEngineException on evaluation or exchange failures
   */
  public void run(OutputBuffer output) {
    status = TaskRunStatus.RUNNING;
    PhysicalOperator root =
        new ExecutionPlanner(context, exchangeManager).plan(fragment, partition);
    OutputPartitioner partitioner = new OutputPartitioner(outputPartitioning, root.getSchema());
    try {
      root.open();
      Optional<RecordBatch> next = root.nextBatch();
      while (next.isPresent()) {
        List<RecordBatch> parts = partitioner.split(next.get());
        for (int target = 0; target < parts.size(); target++) {
          if (parts.get(target) != null) {
            output.enqueue(target, parts.get(target));
          }
        }
        rowCount += next.get().getRowCount();
        next = root.nextBatch();
      }
      output.setNoMoreBatches();
      status = TaskRunStatus.FINISHED;
      log.debug("Task {} produced {} rows", context.getTaskId(), rowCount);
    } catch (QueryCancelledException e) {
      status = TaskRunStatus.CANCELLED;
      output.abort();
      throw e;
    } catch (RuntimeException e) {
      status = TaskRunStatus.FAILED;
      output.abort();
      throw e;
    } finally {
      root.close();
    }
  }
}
