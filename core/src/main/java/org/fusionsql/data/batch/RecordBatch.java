/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.data.batch;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.vector.BooleanVector;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.data.vector.ColumnVectorBuilder;
import org.fusionsql.exception.SchemaException;

/**
 * Immutable columnar chunk of rows sharing one {@link Schema}. The unit of data movement between
 * operators and between processes. Every transformation returns a new batch.
 */
public class RecordBatch {

  private final Schema schema;
  private final List<ColumnVector> columns;
  private final int rowCount;

  public RecordBatch(Schema schema, List<ColumnVector> columns, int rowCount) {
    Preconditions.checkArgument(
        schema.size() == columns.size(),
        "Schema has %s fields but %s columns were given",
        schema.size(),
        columns.size());
    for (int i = 0; i < columns.size(); i++) {
      ColumnVector column = columns.get(i);
      Preconditions.checkArgument(
          column.size() == rowCount,
          "Column %s has %s rows, expected %s",
          i,
          column.size(),
          rowCount);
      Preconditions.checkArgument(
          column.getType() == schema.getField(i).getType(),
          "Column %s has type %s but schema declares %s",
          i,
          column.getType(),
          schema.getField(i).getType());
    }
    this.schema = schema;
    this.columns = ImmutableList.copyOf(columns);
    this.rowCount = rowCount;
  }

  /** Creates a batch whose row count is taken from its first column. */
  public static RecordBatch of(Schema schema, List<ColumnVector> columns) {
    Preconditions.checkArgument(!columns.isEmpty(), "Row count required for zero column batch");
    return new RecordBatch(schema, columns, columns.get(0).size());
  }

  public static RecordBatch empty(Schema schema) {
    List<ColumnVector> columns = new ArrayList<>();
    schema.getFields().forEach(f -> columns.add(ColumnVector.nulls(f.getType(), 0)));
    return new RecordBatch(schema, columns, 0);
  }

  public Schema getSchema() {
    return schema;
  }

  public List<ColumnVector> getColumns() {
    return columns;
  }

  public ColumnVector getColumn(int index) {
    return columns.get(index);
  }

  public ColumnVector getColumn(String name) {
    return columns.get(schema.indexOf(name));
  }

  public int getRowCount() {
    return rowCount;
  }

  public int getColumnCount() {
    return columns.size();
  }

  public boolean isEmpty() {
    return rowCount == 0;
  }

  public Object getValue(int row, int column) {
    return columns.get(column).getObject(row);
  }

  /**
   * Returns {@code length} rows starting at {@code offset}. The result may share storage with this
   * batch; callers must not rely on either sharing or copying.
   */
  public RecordBatch slice(int offset, int length) {
    Preconditions.checkPositionIndexes(offset, offset + length, rowCount);
    List<ColumnVector> sliced = new ArrayList<>(columns.size());
    for (ColumnVector column : columns) {
      sliced.add(column.slice(offset, length));
    }
    return new RecordBatch(schema, sliced, length);
  }

  /** Keeps the columns at the given positions. */
  public RecordBatch select(List<Integer> indices) {
    List<ColumnVector> selected = new ArrayList<>(indices.size());
    for (int index : indices) {
      selected.add(columns.get(index));
    }
    return new RecordBatch(schema.select(indices), selected, rowCount);
  }

  /**
   * Keeps the named columns.
   *
   * @throws SchemaException if a name is absent
   */
  public RecordBatch project(List<String> names) {
    List<Integer> indices = new ArrayList<>(names.size());
    for (String name : names) {
      indices.add(schema.indexOf(name));
    }
    return select(indices);
  }

  /** Gathers rows by position; a negative position yields an all-null row. */
  public RecordBatch take(int[] positions) {
    List<ColumnVector> taken = new ArrayList<>(columns.size());
    for (ColumnVector column : columns) {
      taken.add(column.take(positions));
    }
    return new RecordBatch(schema, taken, positions.length);
  }

  /** Keeps rows where the mask is true; null mask entries drop the row. */
  public RecordBatch filter(BooleanVector mask) {
    Preconditions.checkArgument(mask.size() == rowCount, "Mask size does not match batch");
    int selected = 0;
    for (int i = 0; i < rowCount; i++) {
      if (mask.isTrue(i)) {
        selected++;
      }
    }
    if (selected == rowCount) {
      return this;
    }
    int[] positions = new int[selected];
    int next = 0;
    for (int i = 0; i < rowCount; i++) {
      if (mask.isTrue(i)) {
        positions[next++] = i;
      }
    }
    return take(positions);
  }

  /** Same columns under a schema with identical types, e.g. after renaming. */
  public RecordBatch withSchema(Schema newSchema) {
    return new RecordBatch(newSchema, columns, rowCount);
  }

  /**
   * Concatenates batches of one schema.
   *
   * @throws SchemaException if the schemas differ
   */
  public static RecordBatch concat(Schema schema, List<RecordBatch> batches) {
    int total = 0;
    for (RecordBatch batch : batches) {
      if (!batch.schema.equals(schema)) {
        throw new SchemaException(
            String.format(
                "Cannot concatenate batch with schema %s into %s", batch.schema, schema));
      }
      total += batch.rowCount;
    }
    if (batches.size() == 1) {
      return batches.get(0);
    }
    List<ColumnVector> merged = new ArrayList<>(schema.size());
    for (int c = 0; c < schema.size(); c++) {
      ColumnVectorBuilder builder = ColumnVectorBuilder.create(schema.getField(c).getType(), total);
      for (RecordBatch batch : batches) {
        ColumnVector column = batch.columns.get(c);
        for (int r = 0; r < batch.rowCount; r++) {
          builder.appendFrom(column, r);
        }
      }
      merged.add(builder.build());
    }
    return new RecordBatch(schema, merged, total);
  }

  /** Materializes the rows, mostly for tests and result printing. */
  public List<List<Object>> toRows() {
    List<List<Object>> rows = new ArrayList<>(rowCount);
    for (int r = 0; r < rowCount; r++) {
      List<Object> row = new ArrayList<>(columns.size());
      for (ColumnVector column : columns) {
        row.add(column.getObject(r));
      }
      rows.add(row);
    }
    return rows;
  }

  @Override
  public String toString() {
    return "RecordBatch{schema=" + schema + ", rows=" + rowCount + '}';
  }
}
