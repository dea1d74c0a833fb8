/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.stage;

import java.util.Collections;
import java.util.List;
import org.fusionsql.planner.physical.PartitioningScheme;
import org.fusionsql.planner.physical.PhysicalPlan;

/**
 * A portion of the distributed plan that runs as one task per partition of its fragment. Its
 * output is split by {@code outputPartitioning} for the consuming stage. Inputs from other stages
 * appear in the fragment as exchange sources.
 */
public class ComputeStage {

  private final String stageId;
  private final PhysicalPlan fragment;
  private final PartitioningScheme outputPartitioning;
  private final List<String> sourceStageIds;

  public ComputeStage(
      String stageId,
      PhysicalPlan fragment,
      PartitioningScheme outputPartitioning,
      List<String> sourceStageIds) {
    this.stageId = stageId;
    this.fragment = fragment;
    this.outputPartitioning = outputPartitioning;
    this.sourceStageIds = Collections.unmodifiableList(sourceStageIds);
  }

  public String getStageId() {
    return stageId;
  }

  /** Returns the physical plan fragment each task of this stage executes. */
  public PhysicalPlan getFragment() {
    return fragment;
  }

  /** Returns how this stage's output is partitioned for the downstream stage. */
  public PartitioningScheme getOutputPartitioning() {
    return outputPartitioning;
  }

  /** Returns the IDs of upstream stages that feed data into this stage. */
  public List<String> getSourceStageIds() {
    return sourceStageIds;
  }

  /** Returns the number of tasks, one per partition of the fragment. */
  public int getTaskCount() {
    return fragment.getPartitioning().getPartitionCount();
  }

  /** Returns true if this is a leaf stage (no upstream dependencies). */
  public boolean isLeaf() {
    return sourceStageIds.isEmpty();
  }

  @Override
  public String toString() {
    return "ComputeStage{"
        + "id='"
        + stageId
        + "', tasks="
        + getTaskCount()
        + ", output="
        + outputPartitioning
        + ", deps="
        + sourceStageIds
        + '}';
  }
}
