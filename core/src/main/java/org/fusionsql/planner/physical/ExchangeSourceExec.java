/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.physical;

import java.util.List;
import lombok.Getter;
import org.fusionsql.data.schema.Schema;

/** Reads the rows an upstream stage wrote to the partition of the running task. */
@Getter
public class ExchangeSourceExec extends PhysicalPlan {

  private final String sourceStageId;
  private final Schema schema;
  private final PartitioningScheme partitioning;

  public ExchangeSourceExec(
      String sourceStageId, Schema schema, PartitioningScheme partitioning) {
    super(List.of());
    this.sourceStageId = sourceStageId;
    this.schema = schema;
    this.partitioning = partitioning;
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.EXCHANGE_SOURCE;
  }

  @Override
  public String describe() {
    return "ExchangeSourceExec[" + sourceStageId + "]";
  }

  @Override
  public <R, C> R accept(PhysicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitExchangeSource(this, context);
  }
}
