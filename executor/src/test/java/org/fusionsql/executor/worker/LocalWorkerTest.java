/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.executor.worker;

import static org.fusionsql.planner.logical.LogicalPlanDSL.scan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.List;
import org.fusionsql.catalog.DefaultCatalogService;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.type.DataType;
import org.fusionsql.exception.ErrorKind;
import org.fusionsql.exception.WorkerUnavailableException;
import org.fusionsql.executor.shuffle.ShuffleService;
import org.fusionsql.expression.function.FunctionRegistry;
import org.fusionsql.planner.distributed.codec.PhysicalPlanCodec;
import org.fusionsql.planner.distributed.codec.RecordBatchCodec;
import org.fusionsql.planner.physical.PartitioningScheme;
import org.fusionsql.planner.physical.PhysicalPlanCompiler;
import org.fusionsql.storage.MemoryTable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LocalWorkerTest {

  private static final long WAIT_MILLIS = 5000;

  @Mock private StageResultListener listener;

  private final DefaultCatalogService catalog = new DefaultCatalogService();
  private final FunctionRegistry functions = FunctionRegistry.createDefault();
  private final ShuffleService shuffle = new ShuffleService();
  private final PhysicalPlanCodec codec = new PhysicalPlanCodec(catalog, functions);
  private MemoryTable table;
  private LocalWorker worker;

  @BeforeEach
  void setUp() {
    table =
        MemoryTable.fromRows(
            Schema.of(new Field("k", DataType.INT64)),
            List.of(List.of(1L), List.of(2L), List.of(3L)));
    catalog.registerTable("t", table);
    worker = new LocalWorker("worker-0", 2, catalog, functions, shuffle);
  }

  @AfterEach
  void tearDown() {
    worker.shutdown();
  }

  @Test
  void should_stream_root_output_to_the_listener() {
    // Given
    StageDescriptor descriptor = descriptor(true, PartitioningScheme.single());

    // When
    worker.execute(descriptor, listener);

    // Then
    verify(listener, timeout(WAIT_MILLIS)).onCompleted(descriptor, 3L);
    verify(listener).onStarted(descriptor);
    ArgumentCaptor<byte[]> batches = ArgumentCaptor.forClass(byte[].class);
    verify(listener, atLeastOnce()).onBatch(eq(descriptor), batches.capture());
    List<List<Object>> rows = new ArrayList<>();
    RecordBatchCodec batchCodec = new RecordBatchCodec();
    batches.getAllValues().forEach(b -> rows.addAll(batchCodec.decode(b).toRows()));
    assertEquals(List.of(List.of(1L), List.of(2L), List.of(3L)), rows);
    assertFalse(shuffle.hasOutput("q1"));
  }

  @Test
  void should_commit_non_root_output_to_the_shuffle() {
    StageDescriptor descriptor = descriptor(false, PartitioningScheme.roundRobin(2));

    worker.execute(descriptor, listener);

    verify(listener, timeout(WAIT_MILLIS)).onCompleted(descriptor, 3L);
    verify(listener, never()).onBatch(any(), any());
    assertTrue(shuffle.hasOutput("q1"));
    int rows = 0;
    RecordBatchCodec batchCodec = new RecordBatchCodec();
    for (int p = 0; p < 2; p++) {
      for (byte[] batch : shuffle.read("q1", "stage-1", p)) {
        rows += batchCodec.decode(batch).getRowCount();
      }
    }
    assertEquals(3, rows);
  }

  @Test
  void should_report_a_failed_task_with_its_error_kind() {
    // Given
    StageDescriptor descriptor = descriptor(true, PartitioningScheme.single());
    catalog.dropTable("t");

    // When
    worker.execute(descriptor, listener);

    // Then
    ArgumentCaptor<StageError> error = ArgumentCaptor.forClass(StageError.class);
    verify(listener, timeout(WAIT_MILLIS)).onFailed(eq(descriptor), error.capture());
    assertEquals(ErrorKind.SCHEMA, error.getValue().getKind());
    assertFalse(error.getValue().isRetryable());
    verify(listener, never()).onCompleted(any(), anyLong());
  }

  @Test
  void should_refuse_tasks_while_unavailable() {
    worker.setAvailable(false);

    assertThrows(
        WorkerUnavailableException.class,
        () -> worker.execute(descriptor(true, PartitioningScheme.single()), listener));
    verify(listener, never()).onStarted(any());
  }

  @Test
  void should_carry_a_descriptor_across_json() {
    StageDescriptor descriptor = descriptor(false, PartitioningScheme.roundRobin(2));

    StageDescriptor decoded = StageDescriptor.fromJson(descriptor.toJson());

    assertEquals(descriptor, decoded);
    assertEquals("q1/stage-1/0", decoded.taskId());
    assertThrows(IllegalArgumentException.class, () -> StageDescriptor.fromJson("{"));
  }

  private StageDescriptor descriptor(boolean root, PartitioningScheme output) {
    return StageDescriptor.builder()
        .queryId("q1")
        .stageId("stage-1")
        .partition(0)
        .attempt(1)
        .fragment(codec.encode(new PhysicalPlanCompiler(1, 1).compile(scan("t", table))))
        .outputPartitioning(codec.encodePartitioningToString(output))
        .sourceStageIds(List.of())
        .root(root)
        .batchSize(2)
        .build();
  }
}
