/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.type.DataType;
import org.fusionsql.data.vector.BooleanVector;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.data.vector.ColumnVectorBuilder;

/**
 * Wire form of a {@link RecordBatch}: the schema, the row count and one array per column with
 * JSON null for null rows. Floating values are written as raw IEEE bits.
 */
public class RecordBatchCodec {

  private final ObjectMapper mapper = new ObjectMapper();

  public byte[] encode(RecordBatch batch) {
    ObjectNode json = mapper.createObjectNode();
    json.set("schema", SchemaCodec.encode(mapper, batch.getSchema()));
    json.put("rows", batch.getRowCount());
    ArrayNode columns = json.putArray("columns");
    for (ColumnVector column : batch.getColumns()) {
      ArrayNode values = columns.addArray();
      DataType type = column.getType();
      for (int row = 0; row < batch.getRowCount(); row++) {
        if (column.isNull(row)) {
          values.addNull();
        } else if (type.isLongBacked()) {
          values.add(column.getAsLong(row));
        } else if (type.isFloating()) {
          values.add(Double.doubleToRawLongBits(column.getAsDouble(row)));
        } else if (type == DataType.BOOLEAN) {
          values.add(((BooleanVector) column).getBoolean(row));
        } else {
          values.add(column.getObject(row).toString());
        }
      }
    }
    try {
      return mapper.writeValueAsBytes(json);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to encode record batch", e);
    }
  }

  /**
   * Decodes a batch produced by {@link #encode(RecordBatch)}.
   *
   * @throws IllegalArgumentException if the bytes are not a valid batch
   */
  public RecordBatch decode(byte[] bytes) {
    JsonNode json;
    try {
      json = mapper.readTree(bytes);
    } catch (IOException e) {
      throw new IllegalArgumentException("Malformed record batch", e);
    }
    Schema schema = SchemaCodec.decode(json.get("schema"));
    int rows = json.get("rows").asInt();
    List<ColumnVector> columns = new ArrayList<>(schema.size());
    for (int c = 0; c < schema.size(); c++) {
      DataType type = schema.getField(c).getType();
      ColumnVectorBuilder builder = ColumnVectorBuilder.create(type, rows);
      for (JsonNode value : json.get("columns").get(c)) {
        if (value.isNull()) {
          builder.appendNull();
        } else if (type.isLongBacked()) {
          builder.appendLong(value.asLong());
        } else if (type.isFloating()) {
          builder.appendDouble(Double.longBitsToDouble(value.asLong()));
        } else if (type == DataType.BOOLEAN) {
          builder.appendBoolean(value.asBoolean());
        } else {
          builder.appendString(value.asText());
        }
      }
      columns.add(builder.build());
    }
    return new RecordBatch(schema, columns, rows);
  }
}
