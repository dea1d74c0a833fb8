/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.sql;

import org.fusionsql.exception.ErrorKind;
import org.fusionsql.exception.QueryEngineException;

/** Raised when a SQL string cannot be parsed or uses syntax the engine does not support. */
public class SqlParseException extends QueryEngineException {

  public SqlParseException(String message) {
    super(ErrorKind.PARSE, message);
  }

  public SqlParseException(String message, Throwable cause) {
    super(ErrorKind.PARSE, message, cause);
  }
}
