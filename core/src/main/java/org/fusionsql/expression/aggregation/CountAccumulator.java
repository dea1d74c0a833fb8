/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.aggregation;

import java.util.List;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.data.vector.ColumnVectorBuilder;

/** COUNT(x) counts non-null rows, COUNT(*) counts all rows. */
class CountAccumulator implements Accumulator {

  private long count;

  @Override
  public void accumulate(ColumnVector argument, int row) {
    if (argument == null || !argument.isNull(row)) {
      count++;
    }
  }

  @Override
  public void merge(List<ColumnVector> state, int row) {
    count += state.get(0).getAsLong(row);
  }

  @Override
  public void writeState(List<ColumnVectorBuilder> state) {
    state.get(0).appendLong(count);
  }

  @Override
  public void writeResult(ColumnVectorBuilder result) {
    result.appendLong(count);
  }
}
