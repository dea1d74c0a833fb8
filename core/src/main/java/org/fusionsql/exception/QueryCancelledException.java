/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.exception;

/** Raised to the caller when a query has been cancelled. */
public class QueryCancelledException extends QueryEngineException {

  public QueryCancelledException(String message) {
    super(ErrorKind.CANCELLED, message);
  }

  public QueryCancelledException(String message, Throwable cause) {
    super(ErrorKind.CANCELLED, message, cause);
  }
}
