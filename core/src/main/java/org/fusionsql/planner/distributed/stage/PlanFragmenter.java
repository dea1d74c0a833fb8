/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.stage;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.fusionsql.planner.physical.ExchangeSourceExec;
import org.fusionsql.planner.physical.FilterExec;
import org.fusionsql.planner.physical.HashAggregateExec;
import org.fusionsql.planner.physical.HashJoinExec;
import org.fusionsql.planner.physical.LimitExec;
import org.fusionsql.planner.physical.PartitioningScheme;
import org.fusionsql.planner.physical.PhysicalPlan;
import org.fusionsql.planner.physical.PhysicalPlanNodeVisitor;
import org.fusionsql.planner.physical.ProjectExec;
import org.fusionsql.planner.physical.RepartitionExec;
import org.fusionsql.planner.physical.ScanExec;
import org.fusionsql.planner.physical.SortExec;
import org.fusionsql.planner.physical.UnionExec;

/**
 * Cuts a physical plan into {@link ComputeStage}s at every {@link RepartitionExec}. The subtree
 * below a repartition becomes an upstream stage whose output is split by the repartition target;
 * the repartition itself is replaced by an {@link ExchangeSourceExec} reading that stage.
 *
 * <p>Stage IDs are assigned in dependency order, so upstream stages always come first.
 */
@Log4j2
public class PlanFragmenter implements PhysicalPlanNodeVisitor<PhysicalPlan, List<String>> {

  private final List<ComputeStage> stages = new ArrayList<>();

  private PlanFragmenter() {}

  /** Fragments a physical plan. The root stage emits a single stream to the caller. */
  public static StagedPlan fragment(String planId, PhysicalPlan plan) {
    PlanFragmenter fragmenter = new PlanFragmenter();
    List<String> rootSources = new ArrayList<>();
    PhysicalPlan rootFragment = plan.accept(fragmenter, rootSources);
    fragmenter.addStage(rootFragment, PartitioningScheme.single(), rootSources);
    StagedPlan staged = new StagedPlan(planId, fragmenter.stages);
    log.debug("Fragmented plan {} into {} stages", planId, staged.getStageCount());
    return staged;
  }

  private String addStage(
      PhysicalPlan fragment, PartitioningScheme outputPartitioning, List<String> sources) {
    String stageId = "stage-" + (stages.size() + 1);
    stages.add(new ComputeStage(stageId, fragment, outputPartitioning, sources));
    return stageId;
  }

  @Override
  public PhysicalPlan visitRepartition(RepartitionExec node, List<String> sources) {
    List<String> upstreamSources = new ArrayList<>();
    PhysicalPlan upstream = node.getInput().accept(this, upstreamSources);
    String stageId = addStage(upstream, node.getTarget(), upstreamSources);
    sources.add(stageId);
    return new ExchangeSourceExec(stageId, node.getSchema(), node.getTarget());
  }

  @Override
  public PhysicalPlan visitScan(ScanExec node, List<String> sources) {
    return node;
  }

  @Override
  public PhysicalPlan visitExchangeSource(ExchangeSourceExec node, List<String> sources) {
    return node;
  }

  @Override
  public PhysicalPlan visitFilter(FilterExec node, List<String> sources) {
    return new FilterExec(node.getInput().accept(this, sources), node.getCondition());
  }

  @Override
  public PhysicalPlan visitProject(ProjectExec node, List<String> sources) {
    return new ProjectExec(node.getInput().accept(this, sources), node.getProjectList());
  }

  @Override
  public PhysicalPlan visitHashAggregate(HashAggregateExec node, List<String> sources) {
    return new HashAggregateExec(
        node.getInput().accept(this, sources),
        node.getMode(),
        node.getGroupByList(),
        node.getAggregatorList(),
        node.getAggregationInput());
  }

  @Override
  public PhysicalPlan visitHashJoin(HashJoinExec node, List<String> sources) {
    return new HashJoinExec(
        node.getLeft().accept(this, sources),
        node.getRight().accept(this, sources),
        node.getLeftKeys(),
        node.getRightKeys(),
        node.getJoinType());
  }

  @Override
  public PhysicalPlan visitSort(SortExec node, List<String> sources) {
    return new SortExec(node.getInput().accept(this, sources), node.getSortList());
  }

  @Override
  public PhysicalPlan visitLimit(LimitExec node, List<String> sources) {
    return new LimitExec(node.getInput().accept(this, sources), node.getLimit(), node.getOffset());
  }

  @Override
  public PhysicalPlan visitUnion(UnionExec node, List<String> sources) {
    List<PhysicalPlan> inputs = new ArrayList<>(node.getChildren().size());
    for (PhysicalPlan input : node.getChildren()) {
      inputs.add(input.accept(this, sources));
    }
    return new UnionExec(inputs);
  }
}
