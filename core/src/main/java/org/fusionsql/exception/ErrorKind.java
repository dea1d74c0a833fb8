/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.exception;

/** Classification of engine errors, preserved when an error crosses a stage boundary. */
public enum ErrorKind {
  SCHEMA,
  TYPE,
  CAST,
  EVALUATION,
  PARSE,
  STAGE,
  WORKER_UNAVAILABLE,
  RETRIES_EXHAUSTED,
  CANCELLED;

  /** Construction time errors abort planning before anything is dispatched. */
  public boolean isConstructionError() {
    return this == SCHEMA || this == TYPE || this == PARSE;
  }
}
