/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.eval;

import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.vector.ColumnVector;

/** An expression turned into a function from a batch to one output column. */
@FunctionalInterface
public interface CompiledExpression {

  /**
   * Evaluates the expression over every row of the batch.
   *
   * @throws org.fusionsql.exception.CastException if a value cannot be converted
   * @throws org.fusionsql.exception.EvaluationException on arithmetic failures
   */
  ColumnVector evaluate(RecordBatch batch);
}
