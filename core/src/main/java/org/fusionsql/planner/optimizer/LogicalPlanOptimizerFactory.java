/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.optimizer;

import java.util.List;
import lombok.experimental.UtilityClass;
import org.fusionsql.planner.optimizer.rule.FoldConstants;
import org.fusionsql.planner.optimizer.rule.MergeFilters;
import org.fusionsql.planner.optimizer.rule.PruneColumns;
import org.fusionsql.planner.optimizer.rule.PushFilterThroughAggregate;
import org.fusionsql.planner.optimizer.rule.PushFilterThroughJoin;
import org.fusionsql.planner.optimizer.rule.PushFilterThroughProject;
import org.fusionsql.planner.optimizer.rule.PushFilterThroughRepartition;
import org.fusionsql.planner.optimizer.rule.PushFilterThroughSort;
import org.fusionsql.planner.optimizer.rule.PushFilterThroughUnion;
import org.fusionsql.planner.optimizer.rule.RemoveTrueFilter;

/** Creates the default optimizer pipeline. */
@UtilityClass
public class LogicalPlanOptimizerFactory {

  /** Constant folding, then predicate pushdown, then projection pruning. */
  public static LogicalPlanOptimizer create() {
    return new LogicalPlanOptimizer(
        List.of(
            new RuleBasedPass(
                "constant_folding", List.of(new FoldConstants(), new RemoveTrueFilter())),
            new RuleBasedPass(
                "predicate_pushdown",
                List.of(
                    new MergeFilters(),
                    new PushFilterThroughProject(),
                    new PushFilterThroughJoin(),
                    new PushFilterThroughAggregate(),
                    new PushFilterThroughSort(),
                    new PushFilterThroughRepartition(),
                    new PushFilterThroughUnion())),
            new PruneColumns()));
  }
}
