/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.logical;

import java.util.List;
import lombok.EqualsAndHashCode;
import org.fusionsql.data.schema.Schema;

/**
 * Node of a logical plan tree. Nodes are immutable, own their children exclusively and validate
 * their expressions against the child schemas when constructed, so a node that exists is a valid
 * plan. Rewrites build new nodes through {@link #replaceChildPlans(List)}.
 */
@EqualsAndHashCode
public abstract class LogicalPlan {

  private final List<LogicalPlan> childPlans;

  protected LogicalPlan(List<LogicalPlan> childPlans) {
    this.childPlans = List.copyOf(childPlans);
  }

  public List<LogicalPlan> getChild() {
    return childPlans;
  }

  /** Output schema of this node. */
  public abstract Schema getSchema();

  /** Returns a copy of this node over new children. */
  public abstract LogicalPlan replaceChildPlans(List<LogicalPlan> children);

  public abstract <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context);

  @Override
  public String toString() {
    return LogicalPlanPrinter.print(this);
  }
}
