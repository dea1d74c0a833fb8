/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import org.fusionsql.catalog.CatalogService;
import org.fusionsql.expression.function.FunctionRegistry;
import org.fusionsql.planner.logical.JoinType;
import org.fusionsql.planner.logical.SortItem;
import org.fusionsql.planner.physical.AggregationMode;
import org.fusionsql.planner.physical.ExchangeSourceExec;
import org.fusionsql.planner.physical.FilterExec;
import org.fusionsql.planner.physical.HashAggregateExec;
import org.fusionsql.planner.physical.HashJoinExec;
import org.fusionsql.planner.physical.LimitExec;
import org.fusionsql.planner.physical.PartitioningScheme;
import org.fusionsql.planner.physical.PhysicalOperatorType;
import org.fusionsql.planner.physical.PhysicalPlan;
import org.fusionsql.planner.physical.PhysicalPlanNodeVisitor;
import org.fusionsql.planner.physical.ProjectExec;
import org.fusionsql.planner.physical.RepartitionExec;
import org.fusionsql.planner.physical.ScanExec;
import org.fusionsql.planner.physical.SortExec;
import org.fusionsql.planner.physical.UnionExec;

/**
 * Serializes stage fragments so they can be shipped to workers. Tables travel by name and are
 * resolved in the receiver's {@link CatalogService}; both sides must therefore share the catalog
 * and the function registry.
 */
public class PhysicalPlanCodec implements PhysicalPlanNodeVisitor<JsonNode, Void> {

  private final ObjectMapper mapper;
  private final ExpressionCodec expressions;
  private final CatalogService catalog;

  public PhysicalPlanCodec(CatalogService catalog, FunctionRegistry functions) {
    this.mapper = new ObjectMapper();
    this.expressions = new ExpressionCodec(mapper, functions);
    this.catalog = catalog;
  }

  /** Encodes a plan to a JSON string. */
  public String encode(PhysicalPlan plan) {
    try {
      return mapper.writeValueAsString(plan.accept(this, null));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode plan " + plan.describe(), e);
    }
  }

  /**
   * Decodes a plan produced by {@link #encode(PhysicalPlan)}.
   *
   * @throws IllegalArgumentException if the text is not a valid plan
   * @throws org.fusionsql.exception.SchemaException if a table or column cannot be resolved
   */
  public PhysicalPlan decode(String json) {
    try {
      return decodeNode(mapper.readTree(json));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed plan fragment", e);
    }
  }

  public JsonNode encodePartitioning(PartitioningScheme scheme) {
    ObjectNode json = mapper.createObjectNode();
    json.put("kind", scheme.getKind().name());
    json.put("partitions", scheme.getPartitionCount());
    json.set("keys", expressions.encodeAll(scheme.getHashKeys()));
    return json;
  }

  /** Partitioning as a JSON string, for stage descriptors. */
  public String encodePartitioningToString(PartitioningScheme scheme) {
    try {
      return mapper.writeValueAsString(encodePartitioning(scheme));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode partitioning " + scheme, e);
    }
  }

  public PartitioningScheme decodePartitioning(String json) {
    try {
      return decodePartitioning(mapper.readTree(json));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed partitioning", e);
    }
  }

  public PartitioningScheme decodePartitioning(JsonNode json) {
    int count = json.get("partitions").asInt();
    switch (PartitioningScheme.Kind.valueOf(json.get("kind").asText())) {
      case HASH:
        return PartitioningScheme.hash(expressions.decodeAll(json.get("keys")), count);
      case ROUND_ROBIN:
        return PartitioningScheme.roundRobin(count);
      default:
        return PartitioningScheme.single();
    }
  }

  private PhysicalPlan decodeNode(JsonNode json) {
    PhysicalOperatorType type = PhysicalOperatorType.valueOf(json.get("op").asText());
    switch (type) {
      case SCAN:
        return new ScanExec(
            json.get("table").asText(),
            catalog.getTable(json.get("table").asText()),
            strings(json.get("projection")),
            json.hasNonNull("qualifier") ? json.get("qualifier").asText() : null,
            json.get("partitions").asInt());
      case FILTER:
        return new FilterExec(
            decodeNode(json.get("input")), expressions.decode(json.get("condition")));
      case PROJECTION:
        return new ProjectExec(
            decodeNode(json.get("input")), expressions.decodeAll(json.get("projections")));
      case HASH_AGGREGATE:
        return new HashAggregateExec(
            decodeNode(json.get("input")),
            AggregationMode.valueOf(json.get("mode").asText()),
            expressions.decodeAll(json.get("groups")),
            expressions.decodeAll(json.get("aggregates")),
            SchemaCodec.decode(json.get("aggregationInput")));
      case HASH_JOIN:
        return new HashJoinExec(
            decodeNode(json.get("left")),
            decodeNode(json.get("right")),
            expressions.decodeAll(json.get("leftKeys")),
            expressions.decodeAll(json.get("rightKeys")),
            JoinType.valueOf(json.get("joinType").asText()));
      case SORT:
        List<SortItem> items = new ArrayList<>();
        for (JsonNode item : json.get("sort")) {
          items.add(
              new SortItem(
                  expressions.decode(item.get("expression")),
                  item.get("ascending").asBoolean(),
                  item.get("nullsFirst").asBoolean()));
        }
        return new SortExec(decodeNode(json.get("input")), items);
      case LIMIT:
        return new LimitExec(
            decodeNode(json.get("input")), json.get("limit").asLong(), json.get("offset").asLong());
      case UNION:
        List<PhysicalPlan> inputs = new ArrayList<>();
        for (JsonNode input : json.get("inputs")) {
          inputs.add(decodeNode(input));
        }
        return new UnionExec(inputs);
      case REPARTITION:
        return new RepartitionExec(
            decodeNode(json.get("input")), decodePartitioning(json.get("target")));
      case EXCHANGE_SOURCE:
        return new ExchangeSourceExec(
            json.get("sourceStage").asText(),
            SchemaCodec.decode(json.get("schema")),
            decodePartitioning(json.get("partitioning")));
      default:
        throw new IllegalArgumentException("Unknown operator: " + type);
    }
  }

  private static List<String> strings(JsonNode array) {
    List<String> result = new ArrayList<>(array.size());
    array.forEach(node -> result.add(node.asText()));
    return result;
  }

  private ObjectNode node(PhysicalPlan plan) {
    return mapper.createObjectNode().put("op", plan.getOperatorType().name());
  }

  @Override
  public JsonNode visitScan(ScanExec node, Void context) {
    ObjectNode json = node(node).put("table", node.getTableName());
    ArrayNode projection = json.putArray("projection");
    node.getProjection().forEach(projection::add);
    if (node.getQualifier() != null) {
      json.put("qualifier", node.getQualifier());
    }
    return json.put("partitions", node.getPartitionCount());
  }

  @Override
  public JsonNode visitFilter(FilterExec node, Void context) {
    ObjectNode json = node(node);
    json.set("input", node.getInput().accept(this, context));
    json.set("condition", expressions.encode(node.getCondition()));
    return json;
  }

  @Override
  public JsonNode visitProject(ProjectExec node, Void context) {
    ObjectNode json = node(node);
    json.set("input", node.getInput().accept(this, context));
    json.set("projections", expressions.encodeAll(node.getProjectList()));
    return json;
  }

  @Override
  public JsonNode visitHashAggregate(HashAggregateExec node, Void context) {
    ObjectNode json = node(node).put("mode", node.getMode().name());
    json.set("input", node.getInput().accept(this, context));
    json.set("groups", expressions.encodeAll(node.getGroupByList()));
    json.set("aggregates", expressions.encodeAll(node.getAggregatorList()));
    json.set("aggregationInput", SchemaCodec.encode(mapper, node.getAggregationInput()));
    return json;
  }

  @Override
  public JsonNode visitHashJoin(HashJoinExec node, Void context) {
    ObjectNode json = node(node).put("joinType", node.getJoinType().name());
    json.set("left", node.getLeft().accept(this, context));
    json.set("right", node.getRight().accept(this, context));
    json.set("leftKeys", expressions.encodeAll(node.getLeftKeys()));
    json.set("rightKeys", expressions.encodeAll(node.getRightKeys()));
    return json;
  }

  @Override
  public JsonNode visitSort(SortExec node, Void context) {
    ObjectNode json = node(node);
    json.set("input", node.getInput().accept(this, context));
    ArrayNode sort = json.putArray("sort");
    for (SortItem item : node.getSortList()) {
      ObjectNode entry = sort.addObject();
      entry.set("expression", expressions.encode(item.getExpression()));
      entry.put("ascending", item.isAscending());
      entry.put("nullsFirst", item.isNullsFirst());
    }
    return json;
  }

  @Override
  public JsonNode visitLimit(LimitExec node, Void context) {
    ObjectNode json = node(node).put("limit", node.getLimit()).put("offset", node.getOffset());
    json.set("input", node.getInput().accept(this, context));
    return json;
  }

  @Override
  public JsonNode visitUnion(UnionExec node, Void context) {
    ObjectNode json = node(node);
    ArrayNode inputs = json.putArray("inputs");
    node.getChildren().forEach(child -> inputs.add(child.accept(this, context)));
    return json;
  }

  @Override
  public JsonNode visitRepartition(RepartitionExec node, Void context) {
    ObjectNode json = node(node);
    json.set("input", node.getInput().accept(this, context));
    json.set("target", encodePartitioning(node.getTarget()));
    return json;
  }

  @Override
  public JsonNode visitExchangeSource(ExchangeSourceExec node, Void context) {
    ObjectNode json = node(node).put("sourceStage", node.getSourceStageId());
    json.set("schema", SchemaCodec.encode(mapper, node.getSchema()));
    json.set("partitioning", encodePartitioning(node.getPartitioning()));
    return json;
  }
}
