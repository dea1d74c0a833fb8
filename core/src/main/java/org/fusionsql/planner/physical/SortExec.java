/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.physical;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.expression.ExpressionBinder;
import org.fusionsql.planner.logical.SortItem;

/** Sorts each partition in memory. The compiler gathers its input into one partition first. */
@Getter
public class SortExec extends PhysicalPlan {

  private final PhysicalPlan input;
  private final List<SortItem> sortList;

  public SortExec(PhysicalPlan input, List<SortItem> sortList) {
    super(List.of(input));
    this.input = input;
    this.sortList = sortList.stream()
        .map(item -> item.withExpression(
            ExpressionBinder.bind(item.getExpression(), input.getSchema())))
        .collect(Collectors.toUnmodifiableList());
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
    return PhysicalOperatorType.SORT;
  }

  @Override
  public String describe() {
    return "SortExec" + sortList;
  }

  @Override
  public <R, C> R accept(PhysicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitSort(this, context);
  }
}
