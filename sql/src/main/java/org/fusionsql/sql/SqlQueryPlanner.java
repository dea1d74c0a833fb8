/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import org.apache.calcite.avatica.util.Casing;
import org.apache.calcite.sql.JoinConditionType;
import org.apache.calcite.sql.SqlBasicCall;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlJoin;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNodeList;
import org.apache.calcite.sql.SqlNumericLiteral;
import org.apache.calcite.sql.SqlOrderBy;
import org.apache.calcite.sql.SqlSelect;
import org.apache.calcite.sql.SqlSetOperator;
import org.apache.calcite.sql.parser.SqlParser;
import org.apache.calcite.sql.validate.SqlConformanceEnum;
import org.fusionsql.catalog.CatalogService;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.dataframe.DataFrame;
import org.fusionsql.expression.AliasExpr;
import org.fusionsql.expression.BinaryExpr;
import org.fusionsql.expression.BinaryOperator;
import org.fusionsql.expression.ColumnRef;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionBinder;
import org.fusionsql.expression.ExpressionUtils;
import org.fusionsql.expression.function.FunctionRegistry;
import org.fusionsql.planner.logical.JoinKey;
import org.fusionsql.planner.logical.JoinType;
import org.fusionsql.planner.logical.LogicalAggregate;
import org.fusionsql.planner.logical.LogicalFilter;
import org.fusionsql.planner.logical.LogicalJoin;
import org.fusionsql.planner.logical.LogicalLimit;
import org.fusionsql.planner.logical.LogicalPlan;
import org.fusionsql.planner.logical.LogicalProject;
import org.fusionsql.planner.logical.LogicalScan;
import org.fusionsql.planner.logical.LogicalSort;
import org.fusionsql.planner.logical.LogicalUnion;
import org.fusionsql.planner.logical.SortItem;

/**
 * Turns SQL text into a {@link DataFrame}. Parsing is done by Calcite with identifiers kept as
 * written; the parse tree is then translated directly into a logical plan.
 *
 * <p>Plan shape of a SELECT: scan and joins, WHERE filter, aggregate, HAVING filter, sort,
 * projection, limit. The sort sits below the projection so ORDER BY may use columns that are not
 * selected.
 */
@Log4j2
public class SqlQueryPlanner {

  private static final SqlParser.Config PARSER_CONFIG =
      SqlParser.config()
          .withUnquotedCasing(Casing.UNCHANGED)
          .withQuotedCasing(Casing.UNCHANGED)
          .withCaseSensitive(true)
          .withConformance(SqlConformanceEnum.LENIENT);

  private final CatalogService catalog;
  private final SqlExpressionTranslator expressions;

  public SqlQueryPlanner(CatalogService catalog, FunctionRegistry functions) {
    this.catalog = catalog;
    this.expressions = new SqlExpressionTranslator(functions);
  }

  /**
   * Plans a query.
   *
   * @throws SqlParseException if the text is not valid or uses unsupported syntax
   * @throws org.fusionsql.exception.SchemaException if a table or column does not exist
   * @throws org.fusionsql.exception.TypeCheckException if an expression is ill typed
   */
  public DataFrame plan(String sql) {
    SqlNode parsed = parse(sql);
    LogicalPlan plan = translateQuery(parsed);
    log.debug("Planned SQL [{}] as\n{}", sql, plan);
    return DataFrame.of(plan);
  }

  static SqlNode parse(String sql) {
    try {
      return SqlParser.create(sql, PARSER_CONFIG).parseQuery();
    } catch (org.apache.calcite.sql.parser.SqlParseException e) {
      throw new SqlParseException(e.getMessage(), e);
    }
  }

  private LogicalPlan translateQuery(SqlNode node) {
    if (node instanceof SqlOrderBy) {
      SqlOrderBy orderBy = (SqlOrderBy) node;
      if (orderBy.query instanceof SqlSelect) {
        return translateSelect(
            (SqlSelect) orderBy.query, orderBy.orderList, orderBy.offset, orderBy.fetch);
      }
      LogicalPlan input = translateQuery(orderBy.query);
      return limit(sortOutput(input, orderBy.orderList), orderBy.offset, orderBy.fetch);
    }
    if (node instanceof SqlSelect) {
      SqlSelect select = (SqlSelect) node;
      return translateSelect(select, select.getOrderList(), select.getOffset(), select.getFetch());
    }
    if (node.getKind() == SqlKind.UNION) {
      SqlCall union = (SqlCall) node;
      if (!((SqlSetOperator) union.getOperator()).isAll()) {
        throw new SqlParseException("Only UNION ALL is supported");
      }
      List<LogicalPlan> inputs = new ArrayList<>();
      for (SqlNode operand : union.getOperandList()) {
        LogicalPlan input = translateQuery(operand);
        if (input instanceof LogicalUnion) {
          inputs.addAll(input.getChild());
        } else {
          inputs.add(input);
        }
      }
      return new LogicalUnion(inputs);
    }
    throw new SqlParseException("Unsupported statement: " + node.getKind());
  }

  private LogicalPlan translateSelect(
      SqlSelect select, SqlNodeList orderList, SqlNode offset, SqlNode fetch) {
    if (select.getFrom() == null) {
      throw new SqlParseException("SELECT without FROM is not supported");
    }
    LogicalPlan plan = translateFrom(select.getFrom());
    if (select.getWhere() != null) {
      plan = new LogicalFilter(plan, expressions.translate(select.getWhere()));
    }

    List<SelectItem> items = selectItems(select.getSelectList(), plan);
    boolean star = items.isEmpty();
    boolean aggregated =
        select.isDistinct()
            || (select.getGroup() != null && !select.getGroup().isEmpty())
            || select.getHaving() != null
            || items.stream().anyMatch(i -> ExpressionUtils.containsAggregate(i.expression));
    if (star && aggregated) {
      throw new SqlParseException("SELECT * cannot be combined with aggregation");
    }

    if (aggregated) {
      AggregationRewriter rewriter;
      Schema input = plan.getSchema();
      List<Expression> groups = new ArrayList<>();
      if (select.isDistinct()) {
        items.forEach(item -> groups.add(ExpressionBinder.bind(item.expression, input)));
      }
      if (select.getGroup() != null) {
        for (SqlNode group : select.getGroup()) {
          groups.add(ExpressionBinder.bind(expressions.translate(group), input));
        }
      }
      rewriter = new AggregationRewriter(input, groups);
      for (SelectItem item : items) {
        item.rewritten = rewriter.rewrite(item.expression);
      }
      Expression having =
          select.getHaving() == null
              ? null
              : rewriter.rewrite(expressions.translate(select.getHaving()));
      List<SortItem> sortItems = sortItems(orderList, items, rewriter);
      plan =
          new LogicalAggregate(plan, rewriter.groupOutputs(), rewriter.aggregateOutputs());
      if (having != null) {
        plan = new LogicalFilter(plan, having);
      }
      if (!sortItems.isEmpty()) {
        plan = new LogicalSort(plan, sortItems);
      }
    } else {
      items.forEach(item -> item.rewritten = item.expression);
      List<SortItem> sortItems = sortItems(orderList, items, null);
      if (!sortItems.isEmpty()) {
        plan = new LogicalSort(plan, sortItems);
      }
    }

    if (!star) {
      List<Expression> projections = new ArrayList<>(items.size());
      for (SelectItem item : items) {
        projections.add(item.output());
      }
      plan = new LogicalProject(plan, projections);
    }
    return limit(plan, offset, fetch);
  }

  private LogicalPlan translateFrom(SqlNode from) {
    if (from instanceof SqlIdentifier) {
      return scan((SqlIdentifier) from, null);
    }
    if (from.getKind() == SqlKind.AS) {
      SqlCall as = (SqlCall) from;
      if (!(as.operand(0) instanceof SqlIdentifier)) {
        throw new SqlParseException("Only tables can be aliased in FROM: " + from);
      }
      return scan(as.operand(0), SqlExpressionTranslator.alias(as.operand(1)));
    }
    if (from instanceof SqlJoin) {
      return translateJoin((SqlJoin) from);
    }
    throw new SqlParseException("Unsupported FROM item: " + from);
  }

  private LogicalPlan scan(SqlIdentifier table, String alias) {
    String name = String.join(".", table.names);
    return new LogicalScan(name, catalog.getTable(name), null, alias);
  }

  private LogicalPlan translateJoin(SqlJoin join) {
    LogicalPlan left = translateFrom(join.getLeft());
    LogicalPlan right = translateFrom(join.getRight());
    JoinType type = joinType(join);
    if (join.getConditionType() != JoinConditionType.ON || join.isNatural()) {
      throw new SqlParseException("Joins require an ON condition: " + join);
    }
    List<JoinKey> keys = new ArrayList<>();
    List<Expression> residual = new ArrayList<>();
    for (Expression conjunct :
        ExpressionUtils.splitConjuncts(expressions.translate(join.getCondition()))) {
      Optional<JoinKey> key = joinKey(conjunct, left, right);
      if (key.isPresent()) {
        keys.add(key.get());
      } else {
        residual.add(conjunct);
      }
    }
    if (keys.isEmpty()) {
      throw new SqlParseException("Join condition needs at least one equality between both sides");
    }
    LogicalPlan plan = new LogicalJoin(left, right, keys, type);
    if (!residual.isEmpty()) {
      if (type != JoinType.INNER) {
        throw new SqlParseException("Non equality join conditions require an INNER join");
      }
      plan = new LogicalFilter(plan, ExpressionUtils.conjunction(residual));
    }
    return plan;
  }

  private static JoinType joinType(SqlJoin join) {
    switch (join.getJoinType()) {
      case INNER:
        return JoinType.INNER;
      case LEFT:
        return JoinType.LEFT;
      case RIGHT:
        return JoinType.RIGHT;
      case FULL:
        return JoinType.FULL;
      default:
        throw new SqlParseException("Unsupported join type: " + join.getJoinType());
    }
  }

  private static Optional<JoinKey> joinKey(
      Expression conjunct, LogicalPlan left, LogicalPlan right) {
    if (!(conjunct instanceof BinaryExpr)
        || ((BinaryExpr) conjunct).getOperator() != BinaryOperator.EQ) {
      return Optional.empty();
    }
    Expression a = ((BinaryExpr) conjunct).getLeft();
    Expression b = ((BinaryExpr) conjunct).getRight();
    if (bindsTo(a, left) && bindsTo(b, right)) {
      return Optional.of(new JoinKey(a, b));
    }
    if (bindsTo(b, left) && bindsTo(a, right)) {
      return Optional.of(new JoinKey(b, a));
    }
    return Optional.empty();
  }

  private static boolean bindsTo(Expression expression, LogicalPlan side) {
    return !ExpressionUtils.columnRefs(expression).isEmpty()
        && ExpressionBinder.canBind(expression, side.getSchema());
  }

  private List<SelectItem> selectItems(SqlNodeList selectList, LogicalPlan input) {
    List<SelectItem> items = new ArrayList<>();
    if (selectList.size() == 1 && isStar(selectList.get(0))
        && ((SqlIdentifier) selectList.get(0)).names.size() == 1) {
      return items;
    }
    for (SqlNode node : selectList) {
      if (isStar(node)) {
        items.addAll(expandStar((SqlIdentifier) node, input));
      } else if (node.getKind() == SqlKind.AS) {
        SqlCall as = (SqlCall) node;
        items.add(
            new SelectItem(
                expressions.translate(as.operand(0)),
                SqlExpressionTranslator.alias(as.operand(1))));
      } else {
        items.add(new SelectItem(expressions.translate(node), null));
      }
    }
    return items;
  }

  private static boolean isStar(SqlNode node) {
    return node instanceof SqlIdentifier && ((SqlIdentifier) node).isStar();
  }

  private static List<SelectItem> expandStar(SqlIdentifier star, LogicalPlan input) {
    String qualifier = star.names.size() > 1 ? star.names.get(star.names.size() - 2) : null;
    List<SelectItem> items = new ArrayList<>();
    for (Field field : input.getSchema().getFields()) {
      if (qualifier == null || qualifier.equals(field.getQualifier())) {
        String reference =
            field.getQualifier() == null
                ? field.getName()
                : field.getQualifier() + "." + field.getName();
        items.add(new SelectItem(new ColumnRef(reference), null));
      }
    }
    if (items.isEmpty()) {
      throw new SqlParseException("No columns match " + star);
    }
    return items;
  }

  /** ORDER BY items; a bare name matching a select alias and an ordinal refer to select items. */
  private List<SortItem> sortItems(
      SqlNodeList orderList, List<SelectItem> items, AggregationRewriter rewriter) {
    List<SortItem> result = new ArrayList<>();
    if (orderList == null) {
      return result;
    }
    for (SqlNode node : orderList) {
      boolean ascending = true;
      Boolean nullsFirst = null;
      SqlNode key = node;
      while (key instanceof SqlBasicCall) {
        SqlKind kind = key.getKind();
        if (kind == SqlKind.DESCENDING) {
          ascending = false;
        } else if (kind == SqlKind.NULLS_FIRST) {
          nullsFirst = true;
        } else if (kind == SqlKind.NULLS_LAST) {
          nullsFirst = false;
        } else {
          break;
        }
        key = ((SqlBasicCall) key).operand(0);
      }
      Expression expression = sortKey(key, items, rewriter);
      result.add(
          nullsFirst == null
              ? new SortItem(expression, ascending)
              : new SortItem(expression, ascending, nullsFirst));
    }
    return result;
  }

  private Expression sortKey(SqlNode key, List<SelectItem> items, AggregationRewriter rewriter) {
    if (key instanceof SqlNumericLiteral) {
      int ordinal = ((SqlNumericLiteral) key).intValue(true);
      if (ordinal < 1 || ordinal > items.size()) {
        throw new SqlParseException("ORDER BY position " + ordinal + " is out of range");
      }
      return items.get(ordinal - 1).rewritten;
    }
    if (key instanceof SqlIdentifier && ((SqlIdentifier) key).isSimple()) {
      String name = ((SqlIdentifier) key).getSimple();
      for (SelectItem item : items) {
        if (name.equals(item.alias)) {
          return item.rewritten;
        }
      }
    }
    Expression expression = expressions.translate(key);
    return rewriter == null ? expression : rewriter.rewrite(expression);
  }

  /** Sorts the output of a set operation; keys are output names or ordinals. */
  private LogicalPlan sortOutput(LogicalPlan input, SqlNodeList orderList) {
    List<SelectItem> items = new ArrayList<>();
    for (Field field : input.getSchema().getFields()) {
      SelectItem item = new SelectItem(new ColumnRef(field.getName()), field.getName());
      item.rewritten = item.expression;
      items.add(item);
    }
    List<SortItem> sortItems = sortItems(orderList, items, null);
    return sortItems.isEmpty() ? input : new LogicalSort(input, sortItems);
  }

  private static LogicalPlan limit(LogicalPlan plan, SqlNode offset, SqlNode fetch) {
    if (offset == null && fetch == null) {
      return plan;
    }
    long limit = fetch == null ? Long.MAX_VALUE : count(fetch, "LIMIT");
    long skip = offset == null ? 0 : count(offset, "OFFSET");
    return new LogicalLimit(plan, limit, skip);
  }

  private static long count(SqlNode node, String clause) {
    if (!(node instanceof SqlNumericLiteral)) {
      throw new SqlParseException(clause + " requires an integer literal: " + node);
    }
    long value = ((SqlNumericLiteral) node).longValue(true);
    if (value < 0) {
      throw new SqlParseException(clause + " must not be negative: " + value);
    }
    return value;
  }

  private static class SelectItem {
    private final Expression expression;
    private final String alias;
    private Expression rewritten;

    SelectItem(Expression expression, String alias) {
      this.expression = expression;
      this.alias = alias;
    }

    Expression output() {
      if (alias != null) {
        return new AliasExpr(rewritten, alias);
      }
      if (expression instanceof ColumnRef || rewritten.equals(expression)) {
        return rewritten;
      }
      return new AliasExpr(rewritten, expression.getName());
    }
  }
}
