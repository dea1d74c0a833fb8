/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.common.setting;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * In-memory {@link Settings} with defaults for every key. Values can be overridden through the
 * {@link Builder} or loaded from a JSON object keyed by setting name.
 */
public class EngineSettings extends Settings {

  private static final Logger LOG = LogManager.getLogger();

  private static final Map<Key, Object> DEFAULTS =
      ImmutableMap.<Key, Object>builder()
          .put(Key.WORKER_POOL_SIZE, 4)
          .put(Key.WORKER_SLOTS, 2)
          .put(Key.TARGET_PARTITIONS, 4)
          .put(Key.BATCH_SIZE, 1024)
          .put(Key.MAX_STAGE_RETRIES, 3)
          .put(Key.TASK_TIMEOUT_MILLIS, 300_000L)
          .build();

  private final Map<Key, Object> values;

  private EngineSettings(Map<Key, Object> values) {
    this.values = new EnumMap<>(values);
  }

  public static EngineSettings defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads settings from a JSON object such as {@code {"fusion.execution.batch_size": 512}}.
   * Unknown keys are ignored with a warning.
   *
   * @param inputStream json input.
   * @return settings with the given overrides applied on top of the defaults.
   */
  public static EngineSettings fromInputStream(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    Map<String, Object> raw;
    try {
      raw = objectMapper.readValue(inputStream, new TypeReference<Map<String, Object>>() {});
    } catch (IOException e) {
      LOG.error("Engine settings file is malformed.");
      throw new IllegalArgumentException("Malformed engine settings json: " + e.getMessage(), e);
    }
    Builder builder = builder();
    raw.forEach(
        (name, value) -> {
          Key key = Key.of(name).orElse(null);
          if (key == null) {
            LOG.warn("Ignoring unknown setting {}", name);
          } else {
            builder.put(key, value);
          }
        });
    return builder.build();
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    return (T) values.get(key);
  }

  @Override
  public List<?> getSettings() {
    return new ArrayList<>(values.entrySet());
  }

  public int getWorkerPoolSize() {
    return intValue(Key.WORKER_POOL_SIZE);
  }

  public int getWorkerSlots() {
    return intValue(Key.WORKER_SLOTS);
  }

  public int getTargetPartitions() {
    return intValue(Key.TARGET_PARTITIONS);
  }

  public int getBatchSize() {
    return intValue(Key.BATCH_SIZE);
  }

  public int getMaxStageRetries() {
    return intValue(Key.MAX_STAGE_RETRIES);
  }

  public long getTaskTimeoutMillis() {
    return ((Number) values.get(Key.TASK_TIMEOUT_MILLIS)).longValue();
  }

  private int intValue(Key key) {
    return ((Number) values.get(key)).intValue();
  }

  /** Builder seeded with defaults. */
  public static class Builder {
    private final Map<Key, Object> values = new EnumMap<>(DEFAULTS);

    public Builder put(Key key, Object value) {
      Preconditions.checkArgument(
          value instanceof Number, "Setting %s must be numeric but was %s", key, value);
      long number = ((Number) value).longValue();
      Preconditions.checkArgument(
          number >= (key == Key.MAX_STAGE_RETRIES ? 0 : 1),
          "Setting %s out of range: %s",
          key.getKeyValue(),
          value);
      values.put(key, value);
      return this;
    }

    public Builder workerPoolSize(int size) {
      return put(Key.WORKER_POOL_SIZE, size);
    }

    public Builder workerSlots(int slots) {
      return put(Key.WORKER_SLOTS, slots);
    }

    public Builder targetPartitions(int partitions) {
      return put(Key.TARGET_PARTITIONS, partitions);
    }

    public Builder batchSize(int batchSize) {
      return put(Key.BATCH_SIZE, batchSize);
    }

    public Builder maxStageRetries(int retries) {
      return put(Key.MAX_STAGE_RETRIES, retries);
    }

    public Builder taskTimeoutMillis(long millis) {
      return put(Key.TASK_TIMEOUT_MILLIS, millis);
    }

    public EngineSettings build() {
      return new EngineSettings(values);
    }
  }
}
