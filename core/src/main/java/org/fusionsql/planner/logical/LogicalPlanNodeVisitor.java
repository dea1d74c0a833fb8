/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.logical;

/**
 * Visitor over every logical plan variant. Adding a variant adds a method here, so every visitor
 * has to handle it before the code compiles again.
 *
 * @param <R> return type
 * @param <C> context type
 */
public interface LogicalPlanNodeVisitor<R, C> {

  R visitScan(LogicalScan plan, C context);

  R visitFilter(LogicalFilter plan, C context);

  R visitProject(LogicalProject plan, C context);

  R visitAggregate(LogicalAggregate plan, C context);

  R visitJoin(LogicalJoin plan, C context);

  R visitSort(LogicalSort plan, C context);

  R visitLimit(LogicalLimit plan, C context);

  R visitUnion(LogicalUnion plan, C context);

  R visitRepartition(LogicalRepartition plan, C context);
}
