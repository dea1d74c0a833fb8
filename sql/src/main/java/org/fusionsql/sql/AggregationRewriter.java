/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.sql;

import java.util.ArrayList;
import java.util.List;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.exception.SchemaException;
import org.fusionsql.exception.TypeCheckException;
import org.fusionsql.expression.AggregateExpr;
import org.fusionsql.expression.AliasExpr;
import org.fusionsql.expression.ColumnRef;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionBinder;
import org.fusionsql.expression.ExpressionUtils;

/**
 * Rewrites select, HAVING and ORDER BY expressions of an aggregate query so they read the output
 * of the aggregation. Group expressions become references to the group columns and every
 * aggregate call becomes a reference to an aggregate output column; equal calls share a column.
 */
class AggregationRewriter {

  private final Schema input;
  private final List<Expression> groups;
  private final List<Expression> groupOutputs = new ArrayList<>();
  private final List<ColumnRef> groupRefs = new ArrayList<>();
  private final List<AggregateExpr> aggregates = new ArrayList<>();

  AggregationRewriter(Schema input, List<Expression> groups) {
    this.input = input;
    this.groups = groups;
    for (int i = 0; i < groups.size(); i++) {
      Expression group = groups.get(i);
      if (group instanceof ColumnRef) {
        groupOutputs.add(group);
        groupRefs.add(new ColumnRef(((ColumnRef) group).getReference()));
      } else {
        String name = "$g" + i;
        groupOutputs.add(new AliasExpr(group, name));
        groupRefs.add(new ColumnRef(name));
      }
    }
  }

  Expression rewrite(Expression expression) {
    return replace(ExpressionBinder.bind(expression, input));
  }

  List<Expression> groupOutputs() {
    return groupOutputs;
  }

  List<Expression> aggregateOutputs() {
    List<Expression> outputs = new ArrayList<>(aggregates.size());
    for (int i = 0; i < aggregates.size(); i++) {
      outputs.add(new AliasExpr(aggregates.get(i), "$a" + i));
    }
    return outputs;
  }

  private Expression replace(Expression expression) {
    for (int i = 0; i < groups.size(); i++) {
      if (sameExpression(expression, groups.get(i))) {
        return groupRefs.get(i);
      }
    }
    if (expression instanceof AggregateExpr) {
      AggregateExpr aggregate = (AggregateExpr) expression;
      if (!aggregate.isCountStar() && ExpressionUtils.containsAggregate(aggregate.getArgument())) {
        throw new TypeCheckException("Aggregate calls cannot be nested: " + aggregate);
      }
      int index = aggregates.indexOf(aggregate);
      if (index < 0) {
        aggregates.add(aggregate);
        index = aggregates.size() - 1;
      }
      return new ColumnRef("$a" + index);
    }
    if (expression instanceof ColumnRef) {
      throw new SchemaException(
          String.format(
              "Column %s must appear in GROUP BY or be used in an aggregate function",
              expression.getName()));
    }
    List<Expression> children = expression.getChildren();
    if (children.isEmpty()) {
      return expression;
    }
    List<Expression> rewritten = new ArrayList<>(children.size());
    for (Expression child : children) {
      rewritten.add(replace(child));
    }
    return expression.withChildren(rewritten);
  }

  private static boolean sameExpression(Expression a, Expression b) {
    if (a instanceof ColumnRef && b instanceof ColumnRef) {
      return ((ColumnRef) a).getField().equals(((ColumnRef) b).getField());
    }
    return a.equals(b);
  }
}
