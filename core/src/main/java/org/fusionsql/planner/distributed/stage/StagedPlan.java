/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.stage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The complete distributed execution plan as a list of {@link ComputeStage}s ordered by
 * dependency: leaf stages first, root stage last. The root stage streams its output to the
 * caller.
 */
public class StagedPlan {

  private final String planId;
  private final List<ComputeStage> stages;

  public StagedPlan(String planId, List<ComputeStage> stages) {
    this.planId = planId;
    this.stages = Collections.unmodifiableList(stages);
  }

  public String getPlanId() {
    return planId;
  }

  /** Returns all stages in dependency order (leaves first, root last). */
  public List<ComputeStage> getStages() {
    return stages;
  }

  /** Returns the root stage (last in the list). */
  public ComputeStage getRootStage() {
    if (stages.isEmpty()) {
      throw new IllegalStateException("StagedPlan has no stages");
    }
    return stages.get(stages.size() - 1);
  }

  /** Returns leaf stages (stages with no upstream dependencies). */
  public List<ComputeStage> getLeafStages() {
    return stages.stream().filter(ComputeStage::isLeaf).collect(Collectors.toList());
  }

  /** Returns a stage by its ID. */
  public ComputeStage getStage(String stageId) {
    return stages.stream()
        .filter(s -> s.getStageId().equals(stageId))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Stage not found: " + stageId));
  }

  /** Returns the stages that read the output of {@code stageId}. */
  public List<ComputeStage> getConsumers(String stageId) {
    return stages.stream()
        .filter(s -> s.getSourceStageIds().contains(stageId))
        .collect(Collectors.toList());
  }

  public int getStageCount() {
    return stages.size();
  }

  /**
   * Validates the plan. Every referenced stage must exist and appear before the stage that reads
   * it, which also rules out cycles.
   *
   * @return list of error messages, empty if valid
   */
  public List<String> validate() {
    List<String> errors = new ArrayList<>();
    if (planId == null || planId.isEmpty()) {
      errors.add("Plan ID is required");
    }
    if (stages.isEmpty()) {
      errors.add("Plan must have at least one stage");
    }
    Set<String> allIds = stages.stream().map(ComputeStage::getStageId).collect(Collectors.toSet());
    if (allIds.size() != stages.size()) {
      errors.add("Stage IDs must be unique");
    }
    Set<String> seen = new HashSet<>();
    for (ComputeStage stage : stages) {
      for (String depId : stage.getSourceStageIds()) {
        if (!allIds.contains(depId)) {
          errors.add("Stage '" + stage.getStageId() + "' references unknown stage: " + depId);
        } else if (!seen.contains(depId)) {
          errors.add(
              "Stage '" + stage.getStageId() + "' depends on later or cyclic stage: " + depId);
        }
      }
      seen.add(stage.getStageId());
    }
    return errors;
  }

  /** Renders every stage with its fragment, root last. */
  public String explain() {
    StringBuilder sb = new StringBuilder();
    for (ComputeStage stage : stages) {
      sb.append(stage).append('\n');
      for (String line : stage.getFragment().explain().split("\n")) {
        sb.append("  ").append(line).append('\n');
      }
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return "StagedPlan{id='" + planId + "', stages=" + stages.size() + '}';
  }
}
