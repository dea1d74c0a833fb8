/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.storage;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.schema.Schema;

/**
 * Capability of an external table: a schema and a lazy, finite sequence of record batches. A
 * returned iterator is consumed once; scanning again requires another call to {@link
 * #scan(List)}.
 */
public interface DataSource {

  Schema getSchema();

  /**
   * Scans the table.
   *
   * @param projectedColumns names of the columns to return, in order
   * @return batches with exactly the projected columns
   */
  Iterator<RecordBatch> scan(List<String> projectedColumns);

  /**
   * Scans one of {@code partitionCount} disjoint partitions of the table. The default keeps every
   * {@code partitionCount}-th batch of a full scan, starting at {@code partition}.
   */
  default Iterator<RecordBatch> scan(
      List<String> projectedColumns, int partition, int partitionCount) {
    Iterator<RecordBatch> all = scan(projectedColumns);
    if (partitionCount == 1) {
      return all;
    }
    return new Iterator<>() {
      private int index = 0;
      private RecordBatch next = advance();

      private RecordBatch advance() {
        while (all.hasNext()) {
          RecordBatch batch = all.next();
          if (index++ % partitionCount == partition) {
            return batch;
          }
        }
        return null;
      }

      @Override
      public boolean hasNext() {
        return next != null;
      }

      @Override
      public RecordBatch next() {
        if (next == null) {
          throw new NoSuchElementException();
        }
        RecordBatch current = next;
        next = advance();
        return current;
      }
    };
  }
}
