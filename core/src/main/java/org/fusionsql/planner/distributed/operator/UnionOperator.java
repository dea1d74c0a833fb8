/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import java.util.List;
import java.util.Optional;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.schema.Schema;

/** Bag union. Drains its inputs one after another under the union schema. */
public class UnionOperator extends AbstractPhysicalOperator {

  private int current;

  public UnionOperator(OperatorContext context, Schema schema, List<PhysicalOperator> inputs) {
    super(context, schema, inputs);
  }

  @Override
  protected Optional<RecordBatch> produceNext() {
    List<PhysicalOperator> inputs = getChildren();
    while (current < inputs.size()) {
      Optional<RecordBatch> next = inputs.get(current).nextBatch();
      if (next.isPresent()) {
        return Optional.of(next.get().withSchema(getSchema()));
      }
      current++;
    }
    return Optional.empty();
  }
}
