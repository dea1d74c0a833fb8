/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.physical;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.planner.logical.LogicalUnion;

/**
 * Concatenates the partitions of its inputs: partition {@code i} of the output is the partition of
 * one input, taken in input order.
 */
@Getter
public class UnionExec extends PhysicalPlan {

  private final Schema schema;

  public UnionExec(List<PhysicalPlan> inputs) {
    super(inputs);
    this.schema = LogicalUnion.outputSchema(
        inputs.stream().map(PhysicalPlan::getSchema).collect(Collectors.toList()));
  }

  @Override
  public PartitioningScheme getPartitioning() {
    return PartitioningScheme.roundRobin(
        getChildren().stream().mapToInt(c -> c.getPartitioning().getPartitionCount()).sum());
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.UNION;
  }

  @Override
  public String describe() {
    return "UnionExec[inputs=" + getChildren().size() + "]";
  }

  @Override
  public <R, C> R accept(PhysicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitUnion(this, context);
  }
}
