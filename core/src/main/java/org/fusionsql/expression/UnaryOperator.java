/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression;

public enum UnaryOperator {
  NOT,
  NEGATE,
  IS_NULL,
  IS_NOT_NULL
}
