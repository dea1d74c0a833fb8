/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.exception;

import lombok.Getter;

/** Base class of every error raised by the engine. */
public class QueryEngineException extends RuntimeException {

  @Getter private final ErrorKind kind;

  public QueryEngineException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public QueryEngineException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }
}
