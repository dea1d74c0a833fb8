/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.exchange;

import java.util.ArrayList;
import java.util.List;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.expression.eval.CompiledExpression;
import org.fusionsql.expression.eval.ExpressionCompiler;
import org.fusionsql.planner.distributed.operator.HashKeys;
import org.fusionsql.planner.physical.PartitioningScheme;

/**
 * Splits task output into the partitions of a target {@link PartitioningScheme}. Rows with equal
 * hash keys always land in the same partition, whichever task produced them.
 */
public class OutputPartitioner {

  private final PartitioningScheme target;
  private final List<CompiledExpression> hashKeys;
  private long nextRow;

  public OutputPartitioner(PartitioningScheme target, Schema schema) {
    this.target = target;
    this.hashKeys = ExpressionCompiler.compileAll(target.getHashKeys(), schema);
  }

  public int getPartitionCount() {
    return target.getPartitionCount();
  }

  /**
   * Splits one batch. The result holds one entry per target partition; entries with no rows are
   * null.
   */
  public List<RecordBatch> split(RecordBatch batch) {
    int count = target.getPartitionCount();
    List<RecordBatch> parts = new ArrayList<>(count);
    if (count == 1) {
      parts.add(batch);
      return parts;
    }
    int[] assignment = new int[batch.getRowCount()];
    if (target.getKind() == PartitioningScheme.Kind.HASH) {
      List<ColumnVector> keys = new ArrayList<>(hashKeys.size());
      for (CompiledExpression key : hashKeys) {
        keys.add(key.evaluate(batch));
      }
      for (int row = 0; row < assignment.length; row++) {
        assignment[row] = HashKeys.partitionOf(keys, row, count);
      }
    } else {
      for (int row = 0; row < assignment.length; row++) {
        assignment[row] = (int) (nextRow++ % count);
      }
    }
    int[] sizes = new int[count];
    for (int partition : assignment) {
      sizes[partition]++;
    }
    for (int partition = 0; partition < count; partition++) {
      if (sizes[partition] == 0) {
        parts.add(null);
        continue;
      }
      int[] positions = new int[sizes[partition]];
      int next = 0;
      for (int row = 0; row < assignment.length; row++) {
        if (assignment[row] == partition) {
          positions[next++] = row;
        }
      }
      parts.add(batch.take(positions));
    }
    return parts;
  }
}
