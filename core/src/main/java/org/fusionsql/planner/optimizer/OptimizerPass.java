/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.optimizer;

import org.fusionsql.planner.logical.LogicalPlan;

/** One step of the optimizer pipeline. A pass never changes the result of the plan. */
public interface OptimizerPass {

  String getName();

  LogicalPlan apply(LogicalPlan plan);
}
