/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.physical;

import java.util.List;
import lombok.Getter;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.expression.ExpressionBinder;

/**
 * Redistributes the rows of its input according to {@code target}. Every repartition is a stage
 * boundary: the input runs as its own stage and the consumer reads its output through an exchange.
 */
@Getter
public class RepartitionExec extends PhysicalPlan {

  private final PhysicalPlan input;
  private final PartitioningScheme target;

  public RepartitionExec(PhysicalPlan input, PartitioningScheme target) {
    super(List.of(input));
    this.input = input;
    this.target = target.getKind() == PartitioningScheme.Kind.HASH
        ? PartitioningScheme.hash(
            ExpressionBinder.bindAll(target.getHashKeys(), input.getSchema()),
            target.getPartitionCount())
        : target;
  }

  @Override
  public Schema getSchema() {
    return input.getSchema();
  }

  @Override
  public PartitioningScheme getPartitioning() {
    return target;
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.REPARTITION;
  }

  @Override
  public String describe() {
    return "RepartitionExec[" + target + "]";
  }

  @Override
  public <R, C> R accept(PhysicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitRepartition(this, context);
  }
}
