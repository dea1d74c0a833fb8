/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.exception;

/** Raised when evaluating an expression fails at runtime, e.g. integer division by zero. */
public class EvaluationException extends QueryEngineException {

  public EvaluationException(String message) {
    super(ErrorKind.EVALUATION, message);
  }

  public EvaluationException(String message, Throwable cause) {
    super(ErrorKind.EVALUATION, message, cause);
  }
}
