/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.physical;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.expression.AggregateExpr;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionBinder;
import org.fusionsql.expression.ExpressionUtils;
import org.fusionsql.expression.aggregation.Accumulators;
import org.fusionsql.planner.logical.LogicalProject;

/**
 * Hash aggregation. Group and aggregate expressions are bound against {@code aggregationInput},
 * the schema of the rows being aggregated. In {@code PARTIAL} and {@code SINGLE} mode that is the
 * schema of the child. In {@code FINAL} mode the child delivers partial states instead: the group
 * values followed by the state columns of each aggregate, in order.
 */
@Getter
public class HashAggregateExec extends PhysicalPlan {

  private final PhysicalPlan input;
  private final AggregationMode mode;
  private final List<Expression> groupByList;
  private final List<Expression> aggregatorList;
  private final Schema aggregationInput;
  private final Schema schema;

  public HashAggregateExec(
      PhysicalPlan input,
      AggregationMode mode,
      List<Expression> groupByList,
      List<Expression> aggregatorList,
      Schema aggregationInput) {
    super(List.of(input));
    this.input = input;
    this.mode = mode;
    this.aggregationInput = aggregationInput;
    this.groupByList = List.copyOf(ExpressionBinder.bindAll(groupByList, aggregationInput));
    this.aggregatorList =
        List.copyOf(ExpressionBinder.bindAll(aggregatorList, aggregationInput));
    this.schema = mode == AggregationMode.PARTIAL ? partialSchema() : finalSchema();
    if (mode == AggregationMode.FINAL) {
      Schema expected = partialSchema();
      Preconditions.checkArgument(
          input.getSchema().size() == expected.size(),
          "Final aggregation expects partial states %s but input is %s",
          expected,
          input.getSchema());
    } else {
      Preconditions.checkArgument(
          input.getSchema().equals(aggregationInput),
          "Aggregation input schema must be the schema of the child");
    }
  }

  public HashAggregateExec(
      PhysicalPlan input,
      AggregationMode mode,
      List<Expression> groupByList,
      List<Expression> aggregatorList) {
    this(input, mode, groupByList, aggregatorList, input.getSchema());
  }

  public List<AggregateExpr> getAggregates() {
    List<AggregateExpr> aggregates = new ArrayList<>(aggregatorList.size());
    for (Expression aggregator : aggregatorList) {
      aggregates.add((AggregateExpr) ExpressionUtils.stripAlias(aggregator));
    }
    return aggregates;
  }

  /** Layout of the partial states: group values, then the state columns of each aggregate. */
  public Schema partialSchema() {
    List<Field> fields = new ArrayList<>(LogicalProject.outputSchema(groupByList).getFields());
    for (Expression aggregator : aggregatorList) {
      fields.addAll(
          Accumulators.stateFields(
              (AggregateExpr) ExpressionUtils.stripAlias(aggregator), aggregator.getName()));
    }
    return new Schema(fields);
  }

  private Schema finalSchema() {
    List<Expression> outputs = new ArrayList<>(groupByList);
    outputs.addAll(aggregatorList);
    return LogicalProject.outputSchema(outputs);
  }

  @Override
  public PartitioningScheme getPartitioning() {
    int count = input.getPartitioning().getPartitionCount();
    if (count == 1) {
      return PartitioningScheme.single();
    }
    if (mode == AggregationMode.FINAL && !groupByList.isEmpty()) {
      return PartitioningScheme.columnKeys(groupByList, schema)
          .map(keys -> PartitioningScheme.hash(keys, count))
          .orElse(PartitioningScheme.roundRobin(count));
    }
    return PartitioningScheme.roundRobin(count);
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.HASH_AGGREGATE;
  }

  @Override
  public String describe() {
    return String.format(
        "HashAggregateExec[mode=%s, groupBy=%s, aggregates=%s]",
        mode, groupByList, aggregatorList);
  }

  @Override
  public <R, C> R accept(PhysicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitHashAggregate(this, context);
  }
}
