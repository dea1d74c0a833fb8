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
import lombok.Getter;
import lombok.experimental.Accessors;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionBinder;
import org.fusionsql.expression.ExpressionUtils;
import org.fusionsql.planner.logical.JoinType;
import org.fusionsql.planner.logical.LogicalFilter;
import org.fusionsql.planner.logical.LogicalJoin;
import org.fusionsql.planner.logical.LogicalPlan;
import org.fusionsql.planner.optimizer.Rule;

/**
 * Moves each conjunct that reads columns of one join input only into that input. A conjunct is
 * never pushed into a side whose unmatched rows are padded with nulls.
 */
public class PushFilterThroughJoin implements Rule<LogicalFilter> {

  private final Capture<LogicalJoin> joinCapture;

  @Getter
  @Accessors(fluent = true)
  private final Pattern<LogicalFilter> pattern;

  /** Constructor of PushFilterThroughJoin. */
  public PushFilterThroughJoin() {
    this.joinCapture = Capture.newCapture();
    this.pattern = typeOf(LogicalFilter.class)
        .with(source().matching(typeOf(LogicalJoin.class).capturedAs(joinCapture)));
  }

  @Override
  public LogicalPlan apply(LogicalFilter filter, Captures captures) {
    LogicalJoin join = captures.get(joinCapture);
    JoinType type = join.getJoinType();
    boolean intoLeft = !type.preservesRight();
    boolean intoRight = type == JoinType.INNER || type == JoinType.RIGHT;

    List<Expression> left = new ArrayList<>();
    List<Expression> right = new ArrayList<>();
    List<Expression> kept = new ArrayList<>();
    for (Expression conjunct : ExpressionUtils.splitConjuncts(filter.getCondition())) {
      if (ExpressionUtils.columnRefs(conjunct).isEmpty()) {
        kept.add(conjunct);
      } else if (intoLeft && ExpressionBinder.canBind(conjunct, join.getLeft().getSchema())) {
        left.add(conjunct);
      } else if (intoRight && ExpressionBinder.canBind(conjunct, join.getRight().getSchema())) {
        right.add(conjunct);
      } else {
        kept.add(conjunct);
      }
    }
    if (left.isEmpty() && right.isEmpty()) {
      return filter;
    }
    LogicalPlan newLeft = left.isEmpty()
        ? join.getLeft()
        : new LogicalFilter(join.getLeft(), ExpressionUtils.conjunction(left));
    LogicalPlan newRight = right.isEmpty()
        ? join.getRight()
        : new LogicalFilter(join.getRight(), ExpressionUtils.conjunction(right));
    LogicalPlan result = join.replaceChildPlans(List.of(newLeft, newRight));
    return kept.isEmpty() ? result : new LogicalFilter(result, ExpressionUtils.conjunction(kept));
  }
}
