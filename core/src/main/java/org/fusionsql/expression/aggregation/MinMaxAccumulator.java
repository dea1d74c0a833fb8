/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.aggregation;

import java.util.List;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.data.vector.ColumnVectorBuilder;

class MinMaxAccumulator implements Accumulator {

  private final boolean max;
  private Comparable<Object> best;

  MinMaxAccumulator(boolean max) {
    this.max = max;
  }

  @Override
  @SuppressWarnings("unchecked")
  public void accumulate(ColumnVector argument, int row) {
    Object value = argument.getObject(row);
    if (value == null) {
      return;
    }
    if (best == null) {
      best = (Comparable<Object>) value;
      return;
    }
    int comparison = best.compareTo(value);
    if (max ? comparison < 0 : comparison > 0) {
      best = (Comparable<Object>) value;
    }
  }

  @Override
  public void merge(List<ColumnVector> state, int row) {
    accumulate(state.get(0), row);
  }

  @Override
  public void writeState(List<ColumnVectorBuilder> state) {
    writeResult(state.get(0));
  }

  @Override
  public void writeResult(ColumnVectorBuilder result) {
    result.append(best);
  }
}
