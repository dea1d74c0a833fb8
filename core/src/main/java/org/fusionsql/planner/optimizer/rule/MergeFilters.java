/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.optimizer.rule;

import static com.facebook.presto.matching.Pattern.typeOf;
import static org.fusionsql.planner.optimizer.pattern.Patterns.source;

import com.facebook.presto.matching.Capture;
import com.facebook.presto.matching.Captures;
import com.facebook.presto.matching.Pattern;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.fusionsql.expression.BinaryExpr;
import org.fusionsql.expression.BinaryOperator;
import org.fusionsql.planner.logical.LogicalFilter;
import org.fusionsql.planner.logical.LogicalPlan;
import org.fusionsql.planner.optimizer.Rule;

/** Combines two stacked filters into one conjunction, lower condition first. */
public class MergeFilters implements Rule<LogicalFilter> {

  private final Capture<LogicalFilter> childCapture;

  @Getter
  @Accessors(fluent = true)
  private final Pattern<LogicalFilter> pattern;

  /** Constructor of MergeFilters. */
  public MergeFilters() {
    this.childCapture = Capture.newCapture();
    this.pattern = typeOf(LogicalFilter.class)
        .with(source().matching(typeOf(LogicalFilter.class).capturedAs(childCapture)));
  }

  @Override
  public LogicalPlan apply(LogicalFilter filter, Captures captures) {
    LogicalFilter child = captures.get(childCapture);
    return new LogicalFilter(
        child.getInput(),
        new BinaryExpr(BinaryOperator.AND, child.getCondition(), filter.getCondition()));
  }
}
