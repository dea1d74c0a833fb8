/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.executor.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Everything a worker needs to run one task: the serialized stage fragment, the partition to
 * compute, and how to split the output for the consuming stage. Self contained so it can cross a
 * process boundary as JSON.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class StageDescriptor {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  String queryId;
  String stageId;
  int partition;
  int attempt;
  /** Stage fragment as written by {@code PhysicalPlanCodec}. */
  String fragment;
  /** Output partitioning encoded by the same codec. */
  String outputPartitioning;
  List<String> sourceStageIds;
  boolean root;
  int batchSize;

  /** Identifier of the task, stable across attempts. */
  public String taskId() {
    return queryId + "/" + stageId + "/" + partition;
  }

  public String toJson() {
    try {
      return MAPPER.writeValueAsString(this);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode stage descriptor " + taskId(), e);
    }
  }

  /**
   * @throws IllegalArgumentException if the text is not a stage descriptor
   */
  public static StageDescriptor fromJson(String json) {
    try {
      return MAPPER.readValue(json, StageDescriptor.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed stage descriptor", e);
    }
  }
}
