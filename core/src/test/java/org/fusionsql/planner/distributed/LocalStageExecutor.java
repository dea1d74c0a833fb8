/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.planner.distributed.exchange.ExchangeManager;
import org.fusionsql.planner.distributed.exchange.OutputBuffer;
import org.fusionsql.planner.distributed.operator.OperatorContext;
import org.fusionsql.planner.distributed.pipeline.StageTaskRunner;
import org.fusionsql.planner.distributed.stage.ComputeStage;
import org.fusionsql.planner.distributed.stage.PlanFragmenter;
import org.fusionsql.planner.distributed.stage.StagedPlan;
import org.fusionsql.planner.logical.LogicalPlan;
import org.fusionsql.planner.physical.PhysicalPlan;
import org.fusionsql.planner.physical.PhysicalPlanCompiler;

/** Runs every task of a staged plan sequentially on the calling thread. */
public final class LocalStageExecutor {

  private LocalStageExecutor() {}

  public static List<List<Object>> execute(LogicalPlan plan, int partitions) {
    PhysicalPlan physical = new PhysicalPlanCompiler(partitions, partitions).compile(plan);
    return execute(PlanFragmenter.fragment("local", physical));
  }

  public static List<List<Object>> execute(StagedPlan plan) {
    Map<String, List<List<RecordBatch>>> outputs = new HashMap<>();
    ExchangeManager exchange =
        (stageId, partition) -> outputs.get(stageId).get(partition).iterator();
    for (ComputeStage stage : plan.getStages()) {
      List<List<RecordBatch>> output = new ArrayList<>();
      for (int i = 0; i < stage.getOutputPartitioning().getPartitionCount(); i++) {
        output.add(new ArrayList<>());
      }
      for (int task = 0; task < stage.getTaskCount(); task++) {
        new StageTaskRunner(
                stage.getFragment(),
                task,
                stage.getOutputPartitioning(),
                OperatorContext.createDefault(stage.getStageId() + "/" + task),
                exchange)
            .run(
                new OutputBuffer() {
                  @Override
                  public void enqueue(int partition, RecordBatch batch) {
                    output.get(partition).add(batch);
                  }

                  @Override
                  public void setNoMoreBatches() {}

                  @Override
                  public void abort() {}
                });
      }
      outputs.put(stage.getStageId(), output);
    }
    List<List<Object>> rows = new ArrayList<>();
    outputs.get(plan.getRootStage().getStageId()).get(0).forEach(b -> rows.addAll(b.toRows()));
    return rows;
  }
}
