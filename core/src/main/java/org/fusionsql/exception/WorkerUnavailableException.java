/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.exception;

/** Transient failure to reach a worker or to obtain capacity on it. */
public class WorkerUnavailableException extends QueryEngineException {

  public WorkerUnavailableException(String message) {
    super(ErrorKind.WORKER_UNAVAILABLE, message);
  }

  public WorkerUnavailableException(String message, Throwable cause) {
    super(ErrorKind.WORKER_UNAVAILABLE, message, cause);
  }
}
