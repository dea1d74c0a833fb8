/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.exception;

/** Raised when an expression is applied to operands of the wrong type. */
public class TypeCheckException extends QueryEngineException {

  public TypeCheckException(String message) {
    super(ErrorKind.TYPE, message);
  }

  public TypeCheckException(String message, Throwable cause) {
    super(ErrorKind.TYPE, message, cause);
  }
}
