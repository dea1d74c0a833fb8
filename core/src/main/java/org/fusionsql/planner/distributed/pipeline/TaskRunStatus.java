/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.pipeline;

/** Outcome of one {@link StageTaskRunner#run} call. */
public enum TaskRunStatus {
  CREATED,
  RUNNING,
  FINISHED,
  FAILED,
  CANCELLED
}
