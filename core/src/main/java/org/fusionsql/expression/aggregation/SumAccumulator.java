/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.aggregation;

import java.util.List;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.data.vector.ColumnVectorBuilder;

/** SUM over integers (saturating INT64) or floats (FLOAT64). Null when no row was non-null. */
class SumAccumulator implements Accumulator {

  private final boolean floating;
  private long longSum;
  private double doubleSum;
  private boolean seen;

  SumAccumulator(boolean floating) {
    this.floating = floating;
  }

  @Override
  public void accumulate(ColumnVector argument, int row) {
    if (argument.isNull(row)) {
      return;
    }
    seen = true;
    if (floating) {
      doubleSum += argument.getAsDouble(row);
    } else {
      longSum = saturatingAdd(longSum, argument.getAsLong(row));
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
    if (!seen) {
      result.appendNull();
    } else if (floating) {
      result.appendDouble(doubleSum);
    } else {
      result.appendLong(longSum);
    }
  }

  static long saturatingAdd(long a, long b) {
    long sum = a + b;
    if (((a ^ sum) & (b ^ sum)) < 0) {
      return a < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
    return sum;
  }
}
