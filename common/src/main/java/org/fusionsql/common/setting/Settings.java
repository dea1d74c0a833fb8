/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.common.setting;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Engine settings. */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {
    /** Number of workers created by an embedded engine; also caps scan parallelism. */
    WORKER_POOL_SIZE("fusion.executor.worker_pool_size"),
    /** Concurrent stage tasks a single worker accepts. */
    WORKER_SLOTS("fusion.executor.worker_slots"),
    TARGET_PARTITIONS("fusion.planner.target_partitions"),
    BATCH_SIZE("fusion.execution.batch_size"),
    MAX_STAGE_RETRIES("fusion.coordinator.max_retries"),
    TASK_TIMEOUT_MILLIS("fusion.coordinator.task_timeout");

    @Getter private final String keyValue;

    private static final Map<String, Key> ALL_KEYS;

    static {
      ImmutableMap.Builder<String, Key> builder = new ImmutableMap.Builder<>();
      for (Key key : Key.values()) {
        builder.put(key.getKeyValue(), key);
      }
      ALL_KEYS = builder.build();
    }

    public static Optional<Key> of(String keyValue) {
      return Optional.ofNullable(ALL_KEYS.get(keyValue));
    }
  }

  /** Get Setting Value. */
  public abstract <T> T getSettingValue(Key key);

  public abstract List<?> getSettings();
}
