/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.optimizer.rule;

import static com.facebook.presto.matching.Pattern.typeOf;

import com.facebook.presto.matching.Captures;
import com.facebook.presto.matching.Pattern;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.fusionsql.expression.Expression;
import org.fusionsql.planner.logical.LogicalAggregate;
import org.fusionsql.planner.logical.LogicalFilter;
import org.fusionsql.planner.logical.LogicalPlan;
import org.fusionsql.planner.logical.LogicalProject;
import org.fusionsql.planner.logical.LogicalSort;
import org.fusionsql.planner.logical.SortItem;
import org.fusionsql.planner.optimizer.Rule;

/**
 * Evaluates constant subexpressions of filters, projections, aggregations and sorts at plan time.
 * Output expressions keep their column names.
 */
public class FoldConstants implements Rule<LogicalPlan> {

  @Getter
  @Accessors(fluent = true)
  private final Pattern<LogicalPlan> pattern = typeOf(LogicalPlan.class);

  @Override
  public LogicalPlan apply(LogicalPlan plan, Captures captures) {
    if (plan instanceof LogicalFilter) {
      LogicalFilter filter = (LogicalFilter) plan;
      Expression folded = ConstantFolder.fold(filter.getCondition());
      return folded == filter.getCondition()
          ? plan
          : new LogicalFilter(filter.getInput(), folded);
    }
    if (plan instanceof LogicalProject) {
      LogicalProject project = (LogicalProject) plan;
      List<Expression> folded = foldAll(project.getProjectList(), ConstantFolder::foldNamed);
      return folded == null ? plan : new LogicalProject(project.getInput(), folded);
    }
    if (plan instanceof LogicalAggregate) {
      LogicalAggregate aggregate = (LogicalAggregate) plan;
      List<Expression> groups = foldAll(aggregate.getGroupByList(), ConstantFolder::foldNamed);
      List<Expression> aggs = foldAll(aggregate.getAggregatorList(), ConstantFolder::foldNamed);
      if (groups == null && aggs == null) {
        return plan;
      }
      return new LogicalAggregate(
          aggregate.getInput(),
          groups == null ? aggregate.getGroupByList() : groups,
          aggs == null ? aggregate.getAggregatorList() : aggs);
    }
    if (plan instanceof LogicalSort) {
      LogicalSort sort = (LogicalSort) plan;
      List<SortItem> items = new ArrayList<>();
      boolean changed = false;
      for (SortItem item : sort.getSortList()) {
        Expression folded = ConstantFolder.fold(item.getExpression());
        changed |= folded != item.getExpression();
        items.add(item.withExpression(folded));
      }
      return changed ? new LogicalSort(sort.getInput(), items) : plan;
    }
    return plan;
  }

  /** Returns the folded list, or null when no expression changed. */
  private static List<Expression> foldAll(
      List<Expression> expressions, UnaryOperator<Expression> folder) {
    List<Expression> result = new ArrayList<>(expressions.size());
    boolean changed = false;
    for (Expression expression : expressions) {
      Expression folded = folder.apply(expression);
      changed |= folded != expression;
      result.add(folded);
    }
    return changed ? result : null;
  }
}
