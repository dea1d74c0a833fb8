/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.aggregation;

import java.util.List;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.data.vector.ColumnVectorBuilder;

/** AVG keeps (sum, count) as state; the result is null when count is zero. */
class AvgAccumulator implements Accumulator {

  private double sum;
  private long count;

  @Override
  public void accumulate(ColumnVector argument, int row) {
    if (!argument.isNull(row)) {
      sum += argument.getAsDouble(row);
      count++;
    }
  }

  @Override
  public void merge(List<ColumnVector> state, int row) {
    if (!state.get(0).isNull(row)) {
      sum += state.get(0).getAsDouble(row);
    }
    count += state.get(1).getAsLong(row);
  }

  @Override
  public void writeState(List<ColumnVectorBuilder> state) {
    state.get(0).appendDouble(sum);
    state.get(1).appendLong(count);
  }

  @Override
  public void writeResult(ColumnVectorBuilder result) {
    if (count == 0) {
      result.appendNull();
    } else {
      result.appendDouble(sum / count);
    }
  }
}
