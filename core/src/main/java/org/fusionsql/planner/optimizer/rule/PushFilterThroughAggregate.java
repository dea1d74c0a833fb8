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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionUtils;
import org.fusionsql.planner.logical.LogicalAggregate;
import org.fusionsql.planner.logical.LogicalFilter;
import org.fusionsql.planner.logical.LogicalPlan;
import org.fusionsql.planner.optimizer.Rule;

/**
 * Moves the conjuncts that only read group columns below the aggregation. Rows of a group share
 * the group values, so filtering before grouping drops exactly the groups the filter would drop.
 */
public class PushFilterThroughAggregate implements Rule<LogicalFilter> {

  private final Capture<LogicalAggregate> aggregateCapture;

  @Getter
  @Accessors(fluent = true)
  private final Pattern<LogicalFilter> pattern;

  /** Constructor of PushFilterThroughAggregate. */
  public PushFilterThroughAggregate() {
    this.aggregateCapture = Capture.newCapture();
    this.pattern = typeOf(LogicalFilter.class)
        .with(source().matching(typeOf(LogicalAggregate.class).capturedAs(aggregateCapture)));
  }

  @Override
  public LogicalPlan apply(LogicalFilter filter, Captures captures) {
    LogicalAggregate aggregate = captures.get(aggregateCapture);
    if (aggregate.getGroupByList().isEmpty()) {
      return filter;
    }
    List<Expression> pushed = new ArrayList<>();
    List<Expression> kept = new ArrayList<>();
    for (Expression conjunct : ExpressionUtils.splitConjuncts(filter.getCondition())) {
      Optional<Expression> rewritten = ColumnSubstitution.rewrite(
          conjunct, aggregate.getSchema(), aggregate.getGroupByList());
      if (rewritten.isPresent()) {
        pushed.add(rewritten.get());
      } else {
        kept.add(conjunct);
      }
    }
    if (pushed.isEmpty()) {
      return filter;
    }
    LogicalPlan result = new LogicalAggregate(
        new LogicalFilter(aggregate.getInput(), ExpressionUtils.conjunction(pushed)),
        aggregate.getGroupByList(),
        aggregate.getAggregatorList());
    return kept.isEmpty() ? result : new LogicalFilter(result, ExpressionUtils.conjunction(kept));
  }
}
