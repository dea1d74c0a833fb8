/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.data.batch;

import java.util.ArrayList;
import java.util.List;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.data.vector.ColumnVectorBuilder;

/**
 * Builds a {@link RecordBatch} row by row. Call {@link #beginRow()}, set values via {@link
 * #setValue(int, Object)}, then {@link #endRow()} to commit. Call {@link #build()} to produce the
 * batch; the builder is reset afterwards.
 */
public class RecordBatchBuilder {

  private final Schema schema;
  private List<ColumnVectorBuilder> columns;
  private Object[] currentRow;
  private int rowCount;

  public RecordBatchBuilder(Schema schema) {
    this.schema = schema;
    reset();
  }

  /** Starts a new row. Values default to null. */
  public void beginRow() {
    currentRow = new Object[schema.size()];
  }

  public void setValue(int channel, Object value) {
    if (currentRow == null) {
      throw new IllegalStateException("beginRow() must be called before setValue()");
    }
    if (channel < 0 || channel >= currentRow.length) {
      throw new IndexOutOfBoundsException(
          "Channel " + channel + " out of range [0, " + currentRow.length + ")");
    }
    currentRow[channel] = value;
  }

  public void endRow() {
    if (currentRow == null) {
      throw new IllegalStateException("beginRow() must be called before endRow()");
    }
    for (int i = 0; i < currentRow.length; i++) {
      columns.get(i).append(currentRow[i]);
    }
    rowCount++;
    currentRow = null;
  }

  /** Appends a whole row at once. */
  public RecordBatchBuilder addRow(Object... values) {
    beginRow();
    for (int i = 0; i < values.length; i++) {
      setValue(i, values[i]);
    }
    endRow();
    return this;
  }

  public int getRowCount() {
    return rowCount;
  }

  public boolean isEmpty() {
    return rowCount == 0;
  }

  public RecordBatch build() {
    if (currentRow != null) {
      throw new IllegalStateException("endRow() must be called before build()");
    }
    List<ColumnVector> vectors = new ArrayList<>(columns.size());
    columns.forEach(c -> vectors.add(c.build()));
    RecordBatch batch = new RecordBatch(schema, vectors, rowCount);
    reset();
    return batch;
  }

  private void reset() {
    columns = new ArrayList<>(schema.size());
    schema.getFields().forEach(f -> columns.add(ColumnVectorBuilder.create(f.getType(), 16)));
    rowCount = 0;
  }
}
