/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.executor.worker;

/**
 * Callbacks a worker issues for one task attempt. Exactly one of {@link #onCompleted}, {@link
 * #onFailed} or {@link #onCancelled} ends an attempt. Callbacks may arrive on any thread.
 */
public interface StageResultListener {

  /** The attempt started running on the worker. */
  void onStarted(StageDescriptor descriptor);

  /** A result batch of the root stage, encoded by the record batch codec. */
  void onBatch(StageDescriptor descriptor, byte[] batch);

  void onCompleted(StageDescriptor descriptor, long rowCount);

  void onFailed(StageDescriptor descriptor, StageError error);

  void onCancelled(StageDescriptor descriptor);
}
