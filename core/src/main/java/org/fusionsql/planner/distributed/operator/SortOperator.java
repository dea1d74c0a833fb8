/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.expression.eval.ComparisonKernels;
import org.fusionsql.expression.eval.CompiledExpression;

/** Blocking sort of its whole input. The sort is stable. */
public class SortOperator extends AbstractPhysicalOperator {

  /** One compiled sort key. */
  @RequiredArgsConstructor
  public static class SortKey {
    private final CompiledExpression expression;
    private final boolean ascending;
    private final boolean nullsFirst;
  }

  private final List<SortKey> sortKeys;
  private Iterator<RecordBatch> output;

  public SortOperator(OperatorContext context, PhysicalOperator input, List<SortKey> sortKeys) {
    super(context, input.getSchema(), List.of(input));
    this.sortKeys = sortKeys;
  }

  @Override
  protected Optional<RecordBatch> produceNext() {
    if (output == null) {
      output = sort();
    }
    return output.hasNext() ? Optional.of(output.next()) : Optional.empty();
  }

  @Override
  protected void doClose() {
    output = null;
  }

  private Iterator<RecordBatch> sort() {
    List<RecordBatch> batches = new ArrayList<>();
    Optional<RecordBatch> next = pullInput();
    while (next.isPresent()) {
      batches.add(next.get());
      next = pullInput();
    }
    RecordBatch all = RecordBatch.concat(getSchema(), batches);
    List<ColumnVector> keys = new ArrayList<>(sortKeys.size());
    for (SortKey key : sortKeys) {
      keys.add(key.expression.evaluate(all));
    }
    Integer[] order = new Integer[all.getRowCount()];
    Arrays.setAll(order, i -> i);
    Arrays.sort(order, comparator(keys));
    RecordBatch sorted = all.take(Arrays.stream(order).mapToInt(Integer::intValue).toArray());

    List<RecordBatch> result = new ArrayList<>();
    int batchSize = context.getBatchSize();
    for (int offset = 0; offset < sorted.getRowCount(); offset += batchSize) {
      result.add(sorted.slice(offset, Math.min(batchSize, sorted.getRowCount() - offset)));
    }
    return result.iterator();
  }

  private Comparator<Integer> comparator(List<ColumnVector> keys) {
    return (a, b) -> {
      for (int i = 0; i < keys.size(); i++) {
        SortKey key = sortKeys.get(i);
        ColumnVector column = keys.get(i);
        boolean aNull = column.isNull(a);
        boolean bNull = column.isNull(b);
        int cmp;
        if (aNull || bNull) {
          if (aNull && bNull) {
            continue;
          }
          cmp = aNull == key.nullsFirst ? -1 : 1;
        } else {
          cmp = ComparisonKernels.compare(column, a, column, b);
          if (!key.ascending) {
            cmp = -cmp;
          }
        }
        if (cmp != 0) {
          return cmp;
        }
      }
      return 0;
    };
  }
}
