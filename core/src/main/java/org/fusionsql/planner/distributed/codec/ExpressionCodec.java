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
import org.fusionsql.data.type.DataType;
import org.fusionsql.expression.AggregateExpr;
import org.fusionsql.expression.AggregateFunction;
import org.fusionsql.expression.AliasExpr;
import org.fusionsql.expression.BinaryExpr;
import org.fusionsql.expression.BinaryOperator;
import org.fusionsql.expression.CastExpr;
import org.fusionsql.expression.ColumnRef;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionNodeVisitor;
import org.fusionsql.expression.Literal;
import org.fusionsql.expression.ScalarFunctionExpr;
import org.fusionsql.expression.UnaryExpr;
import org.fusionsql.expression.UnaryOperator;
import org.fusionsql.expression.function.FunctionRegistry;

/**
 * JSON form of expressions. Column references travel by name and are bound again by the plan
 * node that receives them; functions travel by name and are resolved in the receiver's
 * {@link FunctionRegistry}. Floating literals are written as raw IEEE bits so that NaN and signed
 * zero survive.
 */
public class ExpressionCodec implements ExpressionNodeVisitor<JsonNode, Void> {

  private final ObjectMapper mapper;
  private final FunctionRegistry functions;

  public ExpressionCodec(ObjectMapper mapper, FunctionRegistry functions) {
    this.mapper = mapper;
    this.functions = functions;
  }

  public JsonNode encode(Expression expression) {
    return expression.accept(this, null);
  }

  public ArrayNode encodeAll(List<? extends Expression> expressions) {
    ArrayNode array = mapper.createArrayNode();
    expressions.forEach(e -> array.add(encode(e)));
    return array;
  }

  /**
   * Rebuilds an expression.
   *
   * @throws IllegalArgumentException if the node is not a known expression
   * @throws org.fusionsql.exception.SchemaException if a function is not registered
   */
  public Expression decode(JsonNode node) {
    String kind = node.get("kind").asText();
    switch (kind) {
      case "column":
        return new ColumnRef(node.get("name").asText());
      case "literal":
        return decodeLiteral(node);
      case "binary":
        return new BinaryExpr(
            BinaryOperator.valueOf(node.get("op").asText()),
            decode(node.get("left")),
            decode(node.get("right")));
      case "unary":
        return new UnaryExpr(
            UnaryOperator.valueOf(node.get("op").asText()), decode(node.get("operand")));
      case "aggregate":
        return new AggregateExpr(
            AggregateFunction.valueOf(node.get("function").asText()),
            node.hasNonNull("argument") ? decode(node.get("argument")) : null);
      case "function":
        return new ScalarFunctionExpr(
            functions.resolve(node.get("name").asText()), decodeAll(node.get("arguments")));
      case "cast":
        return new CastExpr(
            decode(node.get("child")), DataType.valueOf(node.get("type").asText()));
      case "alias":
        return new AliasExpr(decode(node.get("child")), node.get("alias").asText());
      default:
        throw new IllegalArgumentException("Unknown expression kind: " + kind);
    }
  }

  public List<Expression> decodeAll(JsonNode array) {
    List<Expression> result = new ArrayList<>(array.size());
    for (JsonNode node : array) {
      result.add(decode(node));
    }
    return result;
  }

  @Override
  public JsonNode visitColumnRef(ColumnRef node, Void context) {
    return kind("column").put("name", node.getReference());
  }

  @Override
  public JsonNode visitLiteral(Literal node, Void context) {
    ObjectNode json = kind("literal").put("type", node.getType().name());
    Object value = node.getValue();
    if (value == null) {
      json.putNull("value");
    } else if (node.getType().isLongBacked()) {
      json.put("value", ((Number) value).longValue());
    } else if (node.getType().isFloating()) {
      json.put("value", Double.doubleToRawLongBits(((Number) value).doubleValue()));
    } else if (node.getType() == DataType.BOOLEAN) {
      json.put("value", (Boolean) value);
    } else {
      json.put("value", value.toString());
    }
    return json;
  }

  private Literal decodeLiteral(JsonNode node) {
    DataType type = DataType.valueOf(node.get("type").asText());
    JsonNode value = node.get("value");
    if (value == null || value.isNull()) {
      return Literal.nullOf(type);
    }
    if (type.isLongBacked()) {
      return new Literal(value.asLong(), type);
    }
    if (type.isFloating()) {
      return new Literal(Double.longBitsToDouble(value.asLong()), type);
    }
    if (type == DataType.BOOLEAN) {
      return new Literal(value.asBoolean(), type);
    }
    return new Literal(value.asText(), type);
  }

  @Override
  public JsonNode visitBinary(BinaryExpr node, Void context) {
    ObjectNode json = kind("binary").put("op", node.getOperator().name());
    json.set("left", encode(node.getLeft()));
    json.set("right", encode(node.getRight()));
    return json;
  }

  @Override
  public JsonNode visitUnary(UnaryExpr node, Void context) {
    ObjectNode json = kind("unary").put("op", node.getOperator().name());
    json.set("operand", encode(node.getOperand()));
    return json;
  }

  @Override
  public JsonNode visitAggregate(AggregateExpr node, Void context) {
    ObjectNode json = kind("aggregate").put("function", node.getFunction().name());
    if (!node.isCountStar()) {
      json.set("argument", encode(node.getArgument()));
    }
    return json;
  }

  @Override
  public JsonNode visitFunction(ScalarFunctionExpr node, Void context) {
    ObjectNode json = kind("function").put("name", node.getFunctionName());
    json.set("arguments", encodeAll(node.getArguments()));
    return json;
  }

  @Override
  public JsonNode visitCast(CastExpr node, Void context) {
    ObjectNode json = kind("cast").put("type", node.getTargetType().name());
    json.set("child", encode(node.getChild()));
    return json;
  }

  @Override
  public JsonNode visitAlias(AliasExpr node, Void context) {
    ObjectNode json = kind("alias").put("alias", node.getAlias());
    json.set("child", encode(node.getChild()));
    return json;
  }

  private ObjectNode kind(String kind) {
    return mapper.createObjectNode().put("kind", kind);
  }
}
