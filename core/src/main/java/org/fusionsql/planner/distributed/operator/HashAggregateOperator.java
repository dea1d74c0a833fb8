/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.data.vector.ColumnVectorBuilder;
import org.fusionsql.expression.AggregateExpr;
import org.fusionsql.expression.aggregation.Accumulator;
import org.fusionsql.expression.aggregation.Accumulators;
import org.fusionsql.expression.eval.CompiledExpression;
import org.fusionsql.planner.physical.AggregationMode;

/**
 * Blocking hash aggregation. Consumes its whole input on the first pull, then emits one row per
 * group in batches of at most the context batch size.
 *
 * <ul>
 *   <li>{@code PARTIAL} accumulates raw rows and emits partial states
 *   <li>{@code FINAL} merges partial states and emits final values
 *   <li>{@code SINGLE} accumulates raw rows and emits final values
 * </ul>
 *
 * <p>A global aggregation (no group keys) in {@code FINAL} or {@code SINGLE} mode always emits
 * exactly one row, even over empty input.
 */
public class HashAggregateOperator extends AbstractPhysicalOperator {

  private final AggregationMode mode;
  private final List<CompiledExpression> groupKeys;
  private final List<AggregateExpr> aggregates;
  private final List<CompiledExpression> arguments;
  private final List<Integer> stateOffsets;
  private Iterator<RecordBatch> output;

  /**
   * @param groupKeys compiled group expressions; ignored in {@code FINAL} mode where the group
   *     values are the leading input columns
   * @param arguments compiled aggregate arguments, null entries for {@code COUNT(*)}; ignored in
   *     {@code FINAL} mode
   */
  public HashAggregateOperator(
      OperatorContext context,
      Schema schema,
      PhysicalOperator input,
      AggregationMode mode,
      List<CompiledExpression> groupKeys,
      List<AggregateExpr> aggregates,
      List<CompiledExpression> arguments) {
    super(context, schema, List.of(input));
    this.mode = mode;
    this.groupKeys = groupKeys;
    this.aggregates = aggregates;
    this.arguments = arguments;
    this.stateOffsets = new ArrayList<>(aggregates.size());
    int offset = groupKeys.size();
    for (AggregateExpr aggregate : aggregates) {
      stateOffsets.add(offset);
      offset += Accumulators.stateFields(aggregate, "state").size();
    }
  }

  @Override
  protected Optional<RecordBatch> produceNext() {
    if (output == null) {
      output = aggregate();
    }
    return output.hasNext() ? Optional.of(output.next()) : Optional.empty();
  }

  @Override
  protected void doClose() {
    output = null;
  }

  private Iterator<RecordBatch> aggregate() {
    Map<List<Object>, Accumulator[]> groups = new LinkedHashMap<>();
    Optional<RecordBatch> next = pullInput();
    while (next.isPresent()) {
      RecordBatch batch = next.get();
      if (mode == AggregationMode.FINAL) {
        mergeStates(batch, groups);
      } else {
        accumulateRows(batch, groups);
      }
      context.checkCancelled();
      next = pullInput();
    }
    if (groups.isEmpty() && groupKeys.isEmpty() && mode != AggregationMode.PARTIAL) {
      groups.put(List.of(), newAccumulators());
    }
    return emit(groups);
  }

  private void accumulateRows(RecordBatch batch, Map<List<Object>, Accumulator[]> groups) {
    List<ColumnVector> keys = new ArrayList<>(groupKeys.size());
    for (CompiledExpression key : groupKeys) {
      keys.add(key.evaluate(batch));
    }
    List<ColumnVector> values = new ArrayList<>(arguments.size());
    for (CompiledExpression argument : arguments) {
      values.add(argument == null ? null : argument.evaluate(batch));
    }
    for (int row = 0; row < batch.getRowCount(); row++) {
      Accumulator[] accumulators =
          groups.computeIfAbsent(HashKeys.rowKey(keys, row), k -> newAccumulators());
      for (int i = 0; i < accumulators.length; i++) {
        accumulators[i].accumulate(values.get(i), row);
      }
    }
  }

  private void mergeStates(RecordBatch batch, Map<List<Object>, Accumulator[]> groups) {
    List<ColumnVector> keys = batch.getColumns().subList(0, groupKeys.size());
    List<List<ColumnVector>> states = new ArrayList<>(aggregates.size());
    for (int i = 0; i < aggregates.size(); i++) {
      int from = stateOffsets.get(i);
      int width = Accumulators.stateFields(aggregates.get(i), "state").size();
      states.add(batch.getColumns().subList(from, from + width));
    }
    for (int row = 0; row < batch.getRowCount(); row++) {
      Accumulator[] accumulators =
          groups.computeIfAbsent(HashKeys.rowKey(keys, row), k -> newAccumulators());
      for (int i = 0; i < accumulators.length; i++) {
        accumulators[i].merge(states.get(i), row);
      }
    }
  }

  private Accumulator[] newAccumulators() {
    Accumulator[] accumulators = new Accumulator[aggregates.size()];
    for (int i = 0; i < accumulators.length; i++) {
      accumulators[i] = Accumulators.create(aggregates.get(i));
    }
    return accumulators;
  }

  private Iterator<RecordBatch> emit(Map<List<Object>, Accumulator[]> groups) {
    Schema schema = getSchema();
    int groupCount = groupKeys.size();
    List<ColumnVectorBuilder> builders = new ArrayList<>(schema.size());
    for (int i = 0; i < schema.size(); i++) {
      builders.add(ColumnVectorBuilder.create(schema.getField(i).getType(), groups.size()));
    }
    for (Map.Entry<List<Object>, Accumulator[]> group : groups.entrySet()) {
      for (int i = 0; i < groupCount; i++) {
        builders.get(i).append(group.getKey().get(i));
      }
      int column = groupCount;
      for (int i = 0; i < aggregates.size(); i++) {
        Accumulator accumulator = group.getValue()[i];
        if (mode == AggregationMode.PARTIAL) {
          int width = Accumulators.stateFields(aggregates.get(i), "state").size();
          accumulator.writeState(builders.subList(column, column + width));
          column += width;
        } else {
          accumulator.writeResult(builders.get(column++));
        }
      }
    }
    List<ColumnVector> columns = new ArrayList<>(builders.size());
    for (ColumnVectorBuilder builder : builders) {
      columns.add(builder.build());
    }
    RecordBatch all = new RecordBatch(schema, columns, groups.size());
    List<RecordBatch> batches = new ArrayList<>();
    for (int offset = 0; offset < all.getRowCount(); offset += context.getBatchSize()) {
      batches.add(all.slice(offset, Math.min(context.getBatchSize(), all.getRowCount() - offset)));
    }
    return batches.iterator();
  }
}
