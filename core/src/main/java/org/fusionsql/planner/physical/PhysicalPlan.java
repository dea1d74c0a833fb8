/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.physical;

import java.util.List;
import org.fusionsql.data.schema.Schema;

/**
 * Node of a physical plan: a logical operation with a chosen algorithm and a declared output
 * distribution. Physical plans are immutable and shared read-only by every task running them.
 */
public abstract class PhysicalPlan {

  private final List<PhysicalPlan> children;

  protected PhysicalPlan(List<PhysicalPlan> children) {
    this.children = List.copyOf(children);
  }

  public List<PhysicalPlan> getChildren() {
    return children;
  }

  public abstract Schema getSchema();

  public abstract PartitioningScheme getPartitioning();

  public abstract PhysicalOperatorType getOperatorType();

  /** One-line description of this node's configuration. */
  public abstract String describe();

  public abstract <R, C> R accept(PhysicalPlanNodeVisitor<R, C> visitor, C context);

  /** Renders the subtree rooted here, one node per line. */
  public String explain() {
    StringBuilder out = new StringBuilder();
    explain(this, 0, out);
    return out.toString();
  }

  private static void explain(PhysicalPlan plan, int depth, StringBuilder out) {
    out.append("  ".repeat(depth))
        .append(plan.describe())
        .append(" partitioning=")
        .append(plan.getPartitioning())
        .append('\n');
    for (PhysicalPlan child : plan.getChildren()) {
      explain(child, depth + 1, out);
    }
  }

  @Override
  public String toString() {
    return explain();
  }
}
