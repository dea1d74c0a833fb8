/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.optimizer;

import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.fusionsql.planner.logical.LogicalPlan;

/** Runs a fixed, ordered list of passes over a logical plan. */
@Log4j2
public class LogicalPlanOptimizer {

  private final List<OptimizerPass> passes;

  public LogicalPlanOptimizer(List<OptimizerPass> passes) {
    this.passes = List.copyOf(passes);
  }

  /** Optimize {@link LogicalPlan}. */
  public LogicalPlan optimize(LogicalPlan plan) {
    LogicalPlan optimized = plan;
    for (OptimizerPass pass : passes) {
      optimized = pass.apply(optimized);
      if (log.isDebugEnabled()) {
        log.debug("Plan after {}:\n{}", pass.getName(), optimized);
      }
    }
    return optimized;
  }
}
