/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.physical;

/** Visitor over every physical plan variant. */
public interface PhysicalPlanNodeVisitor<R, C> {

  R visitScan(ScanExec node, C context);

  R visitFilter(FilterExec node, C context);

  R visitProject(ProjectExec node, C context);

  R visitHashAggregate(HashAggregateExec node, C context);

  R visitHashJoin(HashJoinExec node, C context);

  R visitSort(SortExec node, C context);

  R visitLimit(LimitExec node, C context);

  R visitUnion(UnionExec node, C context);

  R visitRepartition(RepartitionExec node, C context);

  R visitExchangeSource(ExchangeSourceExec node, C context);
}
