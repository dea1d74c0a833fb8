/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.exception;

/** Raised when a value cannot be converted to the requested type. Fails the whole batch. */
public class CastException extends QueryEngineException {

  public CastException(String message) {
    super(ErrorKind.CAST, message);
  }

  public CastException(String message, Throwable cause) {
    super(ErrorKind.CAST, message, cause);
  }
}
