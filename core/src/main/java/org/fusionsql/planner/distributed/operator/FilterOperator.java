/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import java.util.List;
import java.util.Optional;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.vector.BooleanVector;
import org.fusionsql.expression.eval.CompiledExpression;

/** Keeps the rows whose predicate is TRUE. FALSE and NULL rows are dropped. */
public class FilterOperator extends AbstractPhysicalOperator {

  private final CompiledExpression predicate;

  public FilterOperator(
      OperatorContext context, PhysicalOperator input, CompiledExpression predicate) {
    super(context, input.getSchema(), List.of(input));
    this.predicate = predicate;
  }

  @Override
  protected Optional<RecordBatch> produceNext() {
    return pullInput().map(batch -> batch.filter((BooleanVector) predicate.evaluate(batch)));
  }
}
