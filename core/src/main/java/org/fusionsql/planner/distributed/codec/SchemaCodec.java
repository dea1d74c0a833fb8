/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import lombok.experimental.UtilityClass;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.type.DataType;

/** JSON form of a {@link Schema}: an array of {@code {name, type, nullable, qualifier}}. */
@UtilityClass
public class SchemaCodec {

  public static ArrayNode encode(ObjectMapper mapper, Schema schema) {
    ArrayNode fields = mapper.createArrayNode();
    for (Field field : schema.getFields()) {
      ObjectNode node = fields.addObject();
      node.put("name", field.getName());
      node.put("type", field.getType().name());
      node.put("nullable", field.isNullable());
      if (field.getQualifier() != null) {
        node.put("qualifier", field.getQualifier());
      }
    }
    return fields;
  }

  public static Schema decode(JsonNode fields) {
    List<Field> result = new ArrayList<>(fields.size());
    for (JsonNode node : fields) {
      result.add(
          new Field(
              node.get("name").asText(),
              DataType.valueOf(node.get("type").asText()),
              node.get("nullable").asBoolean(),
              node.hasNonNull("qualifier") ? node.get("qualifier").asText() : null));
    }
    return new Schema(result);
  }
}
