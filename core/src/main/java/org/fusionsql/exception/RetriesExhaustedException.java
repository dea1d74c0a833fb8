/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.exception;

import lombok.Getter;

/** A stage kept failing with transient errors after the configured number of retries. */
@Getter
public class RetriesExhaustedException extends QueryEngineException {

  private final String stageId;
  private final int attempts;

  public RetriesExhaustedException(String stageId, int attempts, Throwable lastFailure) {
    super(
        ErrorKind.RETRIES_EXHAUSTED,
        String.format(
            "Stage %s failed after %d attempts: %s",
            stageId, attempts, lastFailure == null ? "unknown" : lastFailure.getMessage()),
        lastFailure);
    this.stageId = stageId;
    this.attempts = attempts;
  }
}
