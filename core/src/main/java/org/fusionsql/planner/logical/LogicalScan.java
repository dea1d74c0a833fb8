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
import org.fusionsql.storage.DataSource;

/**
 * Reads a table. The output fields are the projected columns, qualified by the alias or, without
 * one, by the table name.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class LogicalScan extends LogicalPlan {

  private final String tableName;
  @EqualsAndHashCode.Exclude private final DataSource source;
  private final List<String> projection;
  private final String alias;
  @EqualsAndHashCode.Exclude private final Schema schema;

  /**
   * Constructor of LogicalScan.
   *
   * @param projection columns to read, or null for every column of the table
   * @param alias qualifier of the output columns, or null to use the table name
   */
  public LogicalScan(
      String tableName, DataSource source, List<String> projection, String alias) {
    super(List.of());
    this.tableName = Preconditions.checkNotNull(tableName, "tableName");
    this.source = Preconditions.checkNotNull(source, "source");
    this.projection =
        List.copyOf(projection == null ? source.getSchema().getFieldNames() : projection);
    this.alias = alias;
    this.schema =
        source.getSchema().project(this.projection).withQualifier(getQualifier());
  }

  public LogicalScan(String tableName, DataSource source) {
    this(tableName, source, null, null);
  }

  public String getQualifier() {
    return alias == null ? tableName : alias;
  }

  public LogicalScan withProjection(List<String> newProjection) {
    return new LogicalScan(tableName, source, newProjection, alias);
  }

  @Override
  public LogicalPlan replaceChildPlans(List<LogicalPlan> children) {
    return this;
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitScan(this, context);
  }
}
