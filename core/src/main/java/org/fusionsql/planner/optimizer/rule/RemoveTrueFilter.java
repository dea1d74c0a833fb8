/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.optimizer.rule;

import static com.facebook.presto.matching.Pattern.typeOf;

import com.facebook.presto.matching.Captures;
import com.facebook.presto.matching.Pattern;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.fusionsql.expression.Literal;
import org.fusionsql.planner.logical.LogicalFilter;
import org.fusionsql.planner.logical.LogicalPlan;
import org.fusionsql.planner.optimizer.Rule;

/** Drops a filter whose condition is the literal TRUE. */
public class RemoveTrueFilter implements Rule<LogicalFilter> {

  @Getter
  @Accessors(fluent = true)
  private final Pattern<LogicalFilter> pattern = typeOf(LogicalFilter.class);

  @Override
  public LogicalPlan apply(LogicalFilter filter, Captures captures) {
    if (filter.getCondition() instanceof Literal
        && Boolean.TRUE.equals(((Literal) filter.getCondition()).getValue())) {
      return filter.getInput();
    }
    return filter;
  }
}
