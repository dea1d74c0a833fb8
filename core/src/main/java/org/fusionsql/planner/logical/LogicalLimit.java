/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.logical;

import com.google.common.base.Preconditions;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.fusionsql.data.schema.Schema;

/** Skips {@code offset} rows, then returns at most {@code limit} rows. */
@Getter
@EqualsAndHashCode(callSuper = true)
public class LogicalLimit extends LogicalPlan {

  private final long limit;
  private final long offset;

  public LogicalLimit(LogicalPlan child, long limit, long offset) {
    super(List.of(child));
    Preconditions.checkArgument(limit >= 0, "Limit must not be negative: %s", limit);
    Preconditions.checkArgument(offset >= 0, "Offset must not be negative: %s", offset);
    this.limit = limit;
    this.offset = offset;
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
    return new LogicalLimit(children.get(0), limit, offset);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitLimit(this, context);
  }
}
