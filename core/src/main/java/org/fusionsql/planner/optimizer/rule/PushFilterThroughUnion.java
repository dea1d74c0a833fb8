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
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.fusionsql.expression.ColumnRef;
import org.fusionsql.expression.Expression;
import org.fusionsql.planner.logical.LogicalFilter;
import org.fusionsql.planner.logical.LogicalPlan;
import org.fusionsql.planner.logical.LogicalUnion;
import org.fusionsql.planner.optimizer.Rule;

/** Copies a filter over a union into every union input, renaming columns by position. */
public class PushFilterThroughUnion implements Rule<LogicalFilter> {

  private final Capture<LogicalUnion> unionCapture;

  @Getter
  @Accessors(fluent = true)
  private final Pattern<LogicalFilter> pattern;

  /** Constructor of PushFilterThroughUnion. */
  public PushFilterThroughUnion() {
    this.unionCapture = Capture.newCapture();
    this.pattern = typeOf(LogicalFilter.class)
        .with(source().matching(typeOf(LogicalUnion.class).capturedAs(unionCapture)));
  }

  @Override
  public LogicalPlan apply(LogicalFilter filter, Captures captures) {
    LogicalUnion union = captures.get(unionCapture);
    Expression condition = filter.getCondition();
    List<LogicalPlan> inputs = union.getChild().stream()
        .map(input -> (LogicalPlan) new LogicalFilter(input, forInput(condition, union, input)))
        .collect(Collectors.toList());
    return new LogicalUnion(inputs);
  }

  /** Union columns match by position, so each input sees the condition over its own names. */
  private static Expression forInput(Expression condition, LogicalUnion union, LogicalPlan input) {
    List<Expression> sources = input.getSchema().getFields().stream()
        .map(field -> (Expression) new ColumnRef(field.getQualifiedName()))
        .collect(Collectors.toList());
    return ColumnSubstitution.rewrite(condition, union.getSchema(), sources).orElse(condition);
  }
}
