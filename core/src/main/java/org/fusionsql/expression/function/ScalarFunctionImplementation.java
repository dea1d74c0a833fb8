/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.function;

import java.util.List;
import org.fusionsql.data.vector.ColumnVector;

/** Column-at-a-time body of a user defined function. */
@FunctionalInterface
public interface ScalarFunctionImplementation {

  ColumnVector apply(List<ColumnVector> arguments, int rowCount);
}
