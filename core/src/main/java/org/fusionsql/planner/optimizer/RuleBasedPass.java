/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.optimizer;

import static com.facebook.presto.matching.DefaultMatcher.DEFAULT_MATCHER;

import com.facebook.presto.matching.Match;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import org.fusionsql.planner.logical.LogicalPlan;

/**
 * Applies a set of rules bottom-up until none of them changes the plan. After a rewrite the new
 * subtree is optimized again, so a filter pushed below a node keeps moving down.
 */
public class RuleBasedPass implements OptimizerPass {

  @Getter private final String name;
  private final List<Rule<?>> rules;

  public RuleBasedPass(String name, List<Rule<?>> rules) {
    this.name = name;
    this.rules = List.copyOf(rules);
  }

  @Override
  public LogicalPlan apply(LogicalPlan plan) {
    LogicalPlan node = optimizeChildren(plan);
    for (Rule<?> rule : rules) {
      LogicalPlan rewritten = applyRule(rule, node);
      if (rewritten != node && !rewritten.equals(node)) {
        return apply(rewritten);
      }
    }
    return node;
  }

  private LogicalPlan optimizeChildren(LogicalPlan plan) {
    List<LogicalPlan> children = plan.getChild();
    if (children.isEmpty()) {
      return plan;
    }
    List<LogicalPlan> optimized = new ArrayList<>(children.size());
    boolean changed = false;
    for (LogicalPlan child : children) {
      LogicalPlan result = apply(child);
      changed |= result != child;
      optimized.add(result);
    }
    return changed ? plan.replaceChildPlans(optimized) : plan;
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private LogicalPlan applyRule(Rule rule, LogicalPlan node) {
    Match match = DEFAULT_MATCHER.match(rule.pattern(), node);
    if (match.isPresent()) {
      return rule.apply(match.value(), match.captures());
    }
    return node;
  }
}
