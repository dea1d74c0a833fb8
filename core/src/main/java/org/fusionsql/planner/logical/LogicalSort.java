/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.logical;

import com.google.common.base.Preconditions;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.exception.TypeCheckException;
import org.fusionsql.expression.ExpressionBinder;
import org.fusionsql.expression.ExpressionUtils;

/** Orders rows by the sort items, first item most significant. */
@Getter
@EqualsAndHashCode(callSuper = true)
public class LogicalSort extends LogicalPlan {

  private final List<SortItem> sortList;

  public LogicalSort(LogicalPlan child, List<SortItem> sortList) {
    super(List.of(child));
    Preconditions.checkArgument(!sortList.isEmpty(), "Sort requires at least one key");
    this.sortList =
        sortList.stream()
            .map(item -> item.withExpression(
                ExpressionBinder.bind(item.getExpression(), child.getSchema())))
            .collect(Collectors.toUnmodifiableList());
    for (SortItem item : this.sortList) {
      if (ExpressionUtils.containsAggregate(item.getExpression())) {
        throw new TypeCheckException("Aggregate functions are not allowed in a sort key");
      }
    }
  }

  public LogicalPlan getInput() {
    return getChild().get(0);
  }

  @Override
  public Schema getSchema() {
    return getInput().getSchema();
  }

  @Override
  public LogicalPlan replaceChildPlans(List<LogicalPlan> children) {
    Preconditions.checkArgument(children.size() == 1);
    return new LogicalSort(children.get(0), sortList);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitSort(this, context);
  }
}
