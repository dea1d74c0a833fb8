/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.exception;

import lombok.Getter;

/**
 * Terminal error of a query. Carries the stage the failure originated from, the original error
 * kind and whether some result batches had already been delivered to the caller, in which case
 * those results are incomplete.
 */
@Getter
public class QueryFailedException extends QueryEngineException {

  private final String queryId;
  private final String originStageId;
  private final ErrorKind originKind;
  private final boolean partialResultsDelivered;

  public QueryFailedException(
      String queryId,
      String originStageId,
      ErrorKind originKind,
      boolean partialResultsDelivered,
      Throwable cause) {
    super(
        originKind,
        String.format(
            "Query %s failed in stage %s (%s): %s%s",
            queryId,
            originStageId,
            originKind,
            cause == null ? "unknown error" : cause.getMessage(),
            partialResultsDelivered ? " [results delivered so far are incomplete]" : ""),
        cause);
    this.queryId = queryId;
    this.originStageId = originStageId;
    this.originKind = originKind;
    this.partialResultsDelivered = partialResultsDelivered;
  }
}
