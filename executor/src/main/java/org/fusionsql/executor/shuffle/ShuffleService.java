/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.executor.shuffle;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import lombok.Value;
import lombok.extern.log4j.Log4j2;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.exception.ErrorKind;
import org.fusionsql.exception.StageExecutionException;
import org.fusionsql.planner.distributed.codec.RecordBatchCodec;
import org.fusionsql.planner.distributed.exchange.ExchangeManager;

/**
 * Holds the encoded output of finished non-root tasks until the consuming stage has read it.
 * Output of a task becomes visible only when the whole attempt commits, and the first committed
 * attempt of a task wins.
 */
@Log4j2
public class ShuffleService {

  private final RecordBatchCodec codec = new RecordBatchCodec();

  /** query id -> stage id -> task partition -> committed output. */
  private final Map<String, Map<String, NavigableMap<Integer, TaskOutput>>> outputs =
      new ConcurrentHashMap<>();

  /**
   * Publishes the output of one task attempt.
   *
   * @param partitions encoded batches per consumer partition
   * @return false if another attempt of the same task already committed
   */
  public boolean commit(
      String queryId, String stageId, int task, int attempt, List<List<byte[]>> partitions) {
    NavigableMap<Integer, TaskOutput> stage =
        outputs
            .computeIfAbsent(queryId, id -> new ConcurrentHashMap<>())
            .computeIfAbsent(stageId, id -> new ConcurrentSkipListMap<>());
    TaskOutput previous = stage.putIfAbsent(task, new TaskOutput(attempt, copy(partitions)));
    if (previous != null) {
      log.debug(
          "Discarding output of {}/{}/{} attempt {}, attempt {} already committed",
          queryId,
          stageId,
          task,
          attempt,
          previous.getAttempt());
      return false;
    }
    return true;
  }

  /** Encoded batches of one consumer partition, concatenated over the committed tasks in order. */
  public List<byte[]> read(String queryId, String stageId, int partition) {
    Map<String, NavigableMap<Integer, TaskOutput>> query = outputs.get(queryId);
    NavigableMap<Integer, TaskOutput> stage = query == null ? null : query.get(stageId);
    if (stage == null) {
      throw new StageExecutionException(
          stageId, ErrorKind.STAGE, "No committed output for stage " + stageId);
    }
    List<byte[]> batches = new ArrayList<>();
    for (TaskOutput output : stage.values()) {
      if (partition >= output.getPartitions().size()) {
        throw new StageExecutionException(
            stageId, ErrorKind.STAGE, "Stage " + stageId + " has no output partition " + partition);
      }
      batches.addAll(output.getPartitions().get(partition));
    }
    return batches;
  }

  /** Exchange reads for tasks of one query. Batches are decoded lazily. */
  public ExchangeManager exchangeFor(String queryId) {
    return (sourceStageId, partition) -> {
      Iterator<byte[]> encoded = read(queryId, sourceStageId, partition).iterator();
      return new Iterator<RecordBatch>() {
        @Override
        public boolean hasNext() {
          return encoded.hasNext();
        }

        @Override
        public RecordBatch next() {
          return codec.decode(encoded.next());
        }
      };
    };
  }

  /** Drops all output of a finished query. */
  public void release(String queryId) {
    if (outputs.remove(queryId) != null) {
      log.debug("Released shuffle output of query {}", queryId);
    }
  }

  public boolean hasOutput(String queryId) {
    return outputs.containsKey(queryId);
  }

  private static List<List<byte[]>> copy(List<List<byte[]>> partitions) {
    ImmutableList.Builder<List<byte[]>> builder = ImmutableList.builder();
    partitions.forEach(batches -> builder.add(ImmutableList.copyOf(batches)));
    return builder.build();
  }

  @Value
  private static class TaskOutput {
    int attempt;
    List<List<byte[]>> partitions;
  }
}
