/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.physical;

import java.util.List;
import lombok.Getter;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionBinder;

@Getter
public class FilterExec extends PhysicalPlan {

  private final PhysicalPlan input;
  private final Expression condition;

  public FilterExec(PhysicalPlan input, Expression condition) {
    super(List.of(input));
    this.input = input;
    this.condition = ExpressionBinder.bind(condition, input.getSchema());
  }

  @Override
  public Schema getSchema() {
    return input.getSchema();
  }

  @Override
  public PartitioningScheme getPartitioning() {
    return input.getPartitioning();
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.FILTER;
  }

  @Override
  public String describe() {
    return "FilterExec[" + condition + "]";
  }

  @Override
  public <R, C> R accept(PhysicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitFilter(this, context);
  }
}
