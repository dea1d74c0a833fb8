/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.physical;

import java.util.List;
import lombok.Getter;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.storage.DataSource;

/** Reads {@code partitionCount} disjoint partitions of a table, one per task. */
@Getter
public class ScanExec extends PhysicalPlan {

  private final String tableName;
  private final DataSource source;
  private final List<String> projection;
  private final String qualifier;
  private final int partitionCount;
  private final Schema schema;

  public ScanExec(
      String tableName,
      DataSource source,
      List<String> projection,
      String qualifier,
      int partitionCount) {
    super(List.of());
    this.tableName = tableName;
    this.source = source;
    this.projection = List.copyOf(projection);
    this.qualifier = qualifier;
    this.partitionCount = partitionCount;
    this.schema = source.getSchema().project(projection).withQualifier(qualifier);
  }

  @Override
  public PartitioningScheme getPartitioning() {
    return PartitioningScheme.roundRobin(partitionCount);
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.SCAN;
  }

  @Override
  public String describe() {
    return String.format("ScanExec[%s AS %s, columns=%s]", tableName, qualifier, projection);
  }

  @Override
  public <R, C> R accept(PhysicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitScan(this, context);
  }
}
