/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.exception;

import lombok.Getter;

/**
 * Failure of a stage on a worker. Keeps the kind of the error that originally failed the stage so
 * the coordinator can decide whether it is transient.
 */
@Getter
public class StageExecutionException extends QueryEngineException {

  private final String stageId;
  private final ErrorKind originKind;

  public StageExecutionException(String stageId, ErrorKind originKind, String message) {
    super(ErrorKind.STAGE, message);
    this.stageId = stageId;
    this.originKind = originKind;
  }

  public StageExecutionException(
      String stageId, ErrorKind originKind, String message, Throwable cause) {
    super(ErrorKind.STAGE, message, cause);
    this.stageId = stageId;
    this.originKind = originKind;
  }
}
