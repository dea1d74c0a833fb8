/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.physical;

import java.util.List;
import lombok.Getter;
import org.fusionsql.data.schema.Schema;

/** Skips {@code offset} rows of each partition, then passes at most {@code limit} rows. */
@Getter
public class LimitExec extends PhysicalPlan {

  private final PhysicalPlan input;
  private final long limit;
  private final long offset;

  public LimitExec(PhysicalPlan input, long limit, long offset) {
    super(List.of(input));
    this.input = input;
    this.limit = limit;
    this.offset = offset;
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
    return PhysicalOperatorType.LIMIT;
  }

  @Override
  public String describe() {
    return String.format("LimitExec[limit=%d, offset=%d]", limit, offset);
  }

  @Override
  public <R, C> R accept(PhysicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitLimit(this, context);
  }
}
