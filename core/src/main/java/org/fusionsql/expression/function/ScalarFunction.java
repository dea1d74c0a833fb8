/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.function;

import java.util.List;
import org.fusionsql.data.type.DataType;
import org.fusionsql.data.vector.ColumnVector;

/** Vectorized scalar function: one output row per input row. */
public interface ScalarFunction {

  String getName();

  /**
   * Resolves the output type for the given argument types.
   *
   * @throws org.fusionsql.exception.TypeCheckException if the arguments are not accepted
   */
  DataType getReturnType(List<DataType> argumentTypes);

  /**
   * Evaluates the function over whole argument columns.
   *
   * @param arguments argument vectors, all of {@code rowCount} rows
   * @param returnType the type returned by {@link #getReturnType(List)} for these arguments
   * @param rowCount number of rows in the batch
   */
  ColumnVector evaluate(List<ColumnVector> arguments, DataType returnType, int rowCount);

  /** Whether a null argument always yields a null result. */
  default boolean isNullPropagating() {
    return true;
  }
}
