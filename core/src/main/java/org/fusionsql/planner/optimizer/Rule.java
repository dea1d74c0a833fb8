/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.optimizer;

import com.facebook.presto.matching.Captures;
import com.facebook.presto.matching.Pattern;
import org.fusionsql.planner.logical.LogicalPlan;

/**
 * Optimization rule applied to the plan nodes matching its pattern. A rule that finds nothing to
 * rewrite returns the matched node itself.
 */
public interface Rule<T> {

  /** Get the {@link Pattern}. */
  Pattern<T> pattern();

  /** Apply the Rule to the LogicalPlan. */
  LogicalPlan apply(T plan, Captures captures);
}
