/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.aggregation;

import java.util.List;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.data.vector.ColumnVectorBuilder;

/**
 * Running state of one aggregate for one group. The state can be written out as partial state
 * columns and merged back in, which is how aggregation is split across partitions.
 */
public interface Accumulator {

  /** Adds one input row. The argument is null for {@code COUNT(*)}. */
  void accumulate(ColumnVector argument, int row);

  /** Merges the partial state found at {@code row} of the state columns. */
  void merge(List<ColumnVector> state, int row);

  /** Appends the partial state, one value per state column. */
  void writeState(List<ColumnVectorBuilder> state);

  /** Appends the final value. */
  void writeResult(ColumnVectorBuilder result);
}
