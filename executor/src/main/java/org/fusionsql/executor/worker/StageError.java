/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.executor.worker;

import lombok.Value;
import org.fusionsql.exception.ErrorKind;
import org.fusionsql.exception.QueryEngineException;
import org.fusionsql.exception.StageExecutionException;

/** Failure reported by a worker for one task attempt. Keeps the kind of the original error. */
@Value
public class StageError {

  String stageId;
  ErrorKind kind;
  String message;

  /** Only transient worker failures are retried. */
  public boolean isRetryable() {
    return kind == ErrorKind.WORKER_UNAVAILABLE;
  }

  public static StageError from(String stageId, Throwable failure) {
    ErrorKind kind = ErrorKind.STAGE;
    if (failure instanceof StageExecutionException) {
      kind = ((StageExecutionException) failure).getOriginKind();
    } else if (failure instanceof QueryEngineException) {
      kind = ((QueryEngineException) failure).getKind();
    }
    String message = failure.getMessage() == null ? failure.toString() : failure.getMessage();
    return new StageError(stageId, kind, message);
  }

  /** Rebuilds an exception to surface on the coordinator side. */
  public StageExecutionException toException() {
    return new StageExecutionException(stageId, kind, message);
  }
}
