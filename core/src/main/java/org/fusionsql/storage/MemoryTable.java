/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.storage;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import lombok.Getter;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.batch.RecordBatchBuilder;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.exception.SchemaException;

/**
 * Table held in memory as a list of batches. Partitioned scans hand out contiguous row ranges, so
 * row order inside a partition follows table order.
 */
public class MemoryTable implements DataSource {

  @Getter private final Schema schema;
  private final List<RecordBatch> batches;

  public MemoryTable(Schema schema, List<RecordBatch> batches) {
    for (RecordBatch batch : batches) {
      if (!batch.getSchema().equals(schema)) {
        throw new SchemaException(
            String.format("Batch schema %s does not match table schema %s",
                batch.getSchema(), schema));
      }
    }
    this.schema = schema;
    this.batches = ImmutableList.copyOf(batches);
  }

  /** Builds a table from rows, cut into batches of {@code batchSize} rows. */
  public static MemoryTable fromRows(Schema schema, List<List<Object>> rows, int batchSize) {
    List<RecordBatch> batches = new ArrayList<>();
    RecordBatchBuilder builder = new RecordBatchBuilder(schema);
    for (List<Object> row : rows) {
      builder.addRow(row.toArray());
      if (builder.getRowCount() == batchSize) {
        batches.add(builder.build());
      }
    }
    if (!builder.isEmpty()) {
      batches.add(builder.build());
    }
    return new MemoryTable(schema, batches);
  }

  public static MemoryTable fromRows(Schema schema, List<List<Object>> rows) {
    return fromRows(schema, rows, 1024);
  }

  public long getRowCount() {
    return batches.stream().mapToLong(RecordBatch::getRowCount).sum();
  }

  @Override
  public Iterator<RecordBatch> scan(List<String> projectedColumns) {
    return scan(projectedColumns, 0, 1);
  }

  @Override
  public Iterator<RecordBatch> scan(
      List<String> projectedColumns, int partition, int partitionCount) {
    long total = getRowCount();
    long start = total * partition / partitionCount;
    long end = total * (partition + 1) / partitionCount;
    List<RecordBatch> selected = new ArrayList<>();
    long position = 0;
    for (RecordBatch batch : batches) {
      long batchStart = position;
      long batchEnd = position + batch.getRowCount();
      position = batchEnd;
      long from = Math.max(start, batchStart);
      long to = Math.min(end, batchEnd);
      if (from < to) {
        RecordBatch slice =
            batch.slice((int) (from - batchStart), (int) (to - from)).project(projectedColumns);
        selected.add(slice);
      }
    }
    return selected.iterator();
  }
}
