/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.data.vector.ColumnVectorBuilder;
import org.fusionsql.expression.eval.CompiledExpression;
import org.fusionsql.planner.logical.JoinType;

/**
 * Equi hash join. Builds a hash table on the right input (build side) on the first pull and
 * streams the left input (probe side) through it.
 *
 * <p>Supports INNER, LEFT, RIGHT, FULL, SEMI and ANTI joins. NULL keys never match. Unmatched
 * build rows of RIGHT and FULL joins are emitted after the probe side is exhausted.
 */
public class HashJoinOperator extends AbstractPhysicalOperator {

  private static final int NO_MATCH = -1;

  private final JoinType joinType;
  private final List<CompiledExpression> leftKeys;
  private final List<CompiledExpression> rightKeys;
  private final Deque<RecordBatch> pending = new ArrayDeque<>();
  private RecordBatch buildSide;
  private Map<List<Object>, List<Integer>> hashTable;
  private BitSet matchedBuildRows;
  private boolean probeExhausted;

  public HashJoinOperator(
      OperatorContext context,
      Schema schema,
      PhysicalOperator left,
      PhysicalOperator right,
      JoinType joinType,
      List<CompiledExpression> leftKeys,
      List<CompiledExpression> rightKeys) {
    super(context, schema, List.of(left, right));
    this.joinType = joinType;
    this.leftKeys = leftKeys;
    this.rightKeys = rightKeys;
  }

  @Override
  protected Optional<RecordBatch> produceNext() {
    if (hashTable == null) {
      build();
    }
    while (pending.isEmpty() && !probeExhausted) {
      Optional<RecordBatch> probe = getChildren().get(0).nextBatch();
      if (probe.isPresent()) {
        enqueue(probe(probe.get()));
      } else {
        probeExhausted = true;
        if (joinType.preservesRight()) {
          enqueue(unmatchedBuildRows());
        }
      }
    }
    return Optional.ofNullable(pending.poll());
  }

  @Override
  protected void doClose() {
    pending.clear();
    buildSide = null;
    hashTable = null;
    matchedBuildRows = null;
  }

  private void build() {
    PhysicalOperator right = getChildren().get(1);
    List<RecordBatch> batches = new ArrayList<>();
    Optional<RecordBatch> next = right.nextBatch();
    while (next.isPresent()) {
      batches.add(next.get());
      next = right.nextBatch();
    }
    buildSide = RecordBatch.concat(right.getSchema(), batches);
    List<ColumnVector> keys = evaluate(rightKeys, buildSide);
    hashTable = new HashMap<>();
    for (int row = 0; row < buildSide.getRowCount(); row++) {
      List<Object> key = HashKeys.joinKey(keys, row);
      if (key != null) {
        hashTable.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
      }
    }
    matchedBuildRows = new BitSet(buildSide.getRowCount());
  }

  private RecordBatch probe(RecordBatch batch) {
    List<ColumnVector> keys = evaluate(leftKeys, batch);
    List<Integer> leftRows = new ArrayList<>();
    List<Integer> rightRows = new ArrayList<>();
    for (int row = 0; row < batch.getRowCount(); row++) {
      List<Object> key = HashKeys.joinKey(keys, row);
      List<Integer> matches = key == null ? null : hashTable.get(key);
      boolean hasMatch = matches != null && !matches.isEmpty();
      switch (joinType) {
        case SEMI:
          if (hasMatch) {
            leftRows.add(row);
          }
          break;
        case ANTI:
          if (!hasMatch) {
            leftRows.add(row);
          }
          break;
        default:
          if (hasMatch) {
            for (int match : matches) {
              leftRows.add(row);
              rightRows.add(match);
              matchedBuildRows.set(match);
            }
          } else if (joinType.preservesLeft()) {
            leftRows.add(row);
            rightRows.add(NO_MATCH);
          }
      }
    }
    if (!joinType.outputsRight()) {
      return batch.take(toArray(leftRows)).withSchema(getSchema());
    }
    return combine(batch, leftRows, rightRows);
  }

  private RecordBatch unmatchedBuildRows() {
    List<Integer> leftRows = new ArrayList<>();
    List<Integer> rightRows = new ArrayList<>();
    for (int row = matchedBuildRows.nextClearBit(0);
        row < buildSide.getRowCount();
        row = matchedBuildRows.nextClearBit(row + 1)) {
      leftRows.add(NO_MATCH);
      rightRows.add(row);
    }
    return combine(null, leftRows, rightRows);
  }

  private RecordBatch combine(RecordBatch probe, List<Integer> leftRows, List<Integer> rightRows) {
    Schema schema = getSchema();
    int leftWidth = getChildren().get(0).getSchema().size();
    List<ColumnVector> columns = new ArrayList<>(schema.size());
    for (int column = 0; column < schema.size(); column++) {
      boolean fromLeft = column < leftWidth;
      RecordBatch source = fromLeft ? probe : buildSide;
      ColumnVector vector =
          source == null ? null : source.getColumn(fromLeft ? column : column - leftWidth);
      List<Integer> positions = fromLeft ? leftRows : rightRows;
      ColumnVectorBuilder builder =
          ColumnVectorBuilder.create(schema.getField(column).getType(), positions.size());
      for (int position : positions) {
        if (position == NO_MATCH) {
          builder.appendNull();
        } else {
          builder.appendFrom(vector, position);
        }
      }
      columns.add(builder.build());
    }
    return new RecordBatch(schema, columns, leftRows.size());
  }

  private void enqueue(RecordBatch batch) {
    int batchSize = context.getBatchSize();
    for (int offset = 0; offset < batch.getRowCount(); offset += batchSize) {
      pending.add(batch.slice(offset, Math.min(batchSize, batch.getRowCount() - offset)));
    }
  }

  private static List<ColumnVector> evaluate(List<CompiledExpression> keys, RecordBatch batch) {
    List<ColumnVector> columns = new ArrayList<>(keys.size());
    for (CompiledExpression key : keys) {
      columns.add(key.evaluate(batch));
    }
    return columns;
  }

  private static int[] toArray(List<Integer> positions) {
    return positions.stream().mapToInt(Integer::intValue).toArray();
  }
}
