/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.exception;

/** Raised when a column name is absent or ambiguous, or two schemas are incompatible. */
public class SchemaException extends QueryEngineException {

  public SchemaException(String message) {
    super(ErrorKind.SCHEMA, message);
  }

  public SchemaException(String message, Throwable cause) {
    super(ErrorKind.SCHEMA, message, cause);
  }
}
