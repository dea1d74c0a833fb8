/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import java.util.List;
import java.util.Optional;
import org.fusionsql.data.batch.RecordBatch;

/** Skips {@code offset} rows, then passes at most {@code limit} rows. Stops pulling once done. */
public class LimitOperator extends AbstractPhysicalOperator {

  private final long limit;
  private long toSkip;
  private long emitted;

  public LimitOperator(OperatorContext context, PhysicalOperator input, long limit, long offset) {
    super(context, input.getSchema(), List.of(input));
    this.limit = limit;
    this.toSkip = offset;
  }

  @Override
  protected Optional<RecordBatch> produceNext() {
    while (emitted < limit) {
      Optional<RecordBatch> next = pullInput();
      if (next.isEmpty()) {
        return Optional.empty();
      }
      RecordBatch batch = next.get();
      int start = (int) Math.min(toSkip, batch.getRowCount());
      toSkip -= start;
      int length = (int) Math.min(limit - emitted, batch.getRowCount() - start);
      if (length > 0) {
        emitted += length;
        return Optional.of(batch.slice(start, length));
      }
    }
    return Optional.empty();
  }
}
