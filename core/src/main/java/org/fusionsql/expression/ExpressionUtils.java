/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import lombok.experimental.UtilityClass;
import org.fusionsql.data.type.DataType;

/** Structural helpers over expression trees. */
@UtilityClass
public class ExpressionUtils {

  public static boolean containsAggregate(Expression expression) {
    if (expression instanceof AggregateExpr) {
      return true;
    }
    return expression.getChildren().stream().anyMatch(ExpressionUtils::containsAggregate);
  }

  /** True when the expression reads no column and aggregates nothing. */
  public static boolean isConstant(Expression expression) {
    if (expression instanceof ColumnRef || expression instanceof AggregateExpr) {
      return false;
    }
    return expression.getChildren().stream().allMatch(ExpressionUtils::isConstant);
  }

  public static List<ColumnRef> columnRefs(Expression expression) {
    List<ColumnRef> refs = new ArrayList<>();
    collectColumnRefs(expression, refs);
    return refs;
  }

  private static void collectColumnRefs(Expression expression, List<ColumnRef> refs) {
    if (expression instanceof ColumnRef) {
      refs.add((ColumnRef) expression);
    }
    expression.getChildren().forEach(child -> collectColumnRefs(child, refs));
  }

  /** Aggregate calls in the expression, outermost first. */
  public static List<AggregateExpr> aggregates(Expression expression) {
    List<AggregateExpr> found = new ArrayList<>();
    collectAggregates(expression, found);
    return found;
  }

  private static void collectAggregates(Expression expression, List<AggregateExpr> found) {
    if (expression instanceof AggregateExpr) {
      found.add((AggregateExpr) expression);
      return;
    }
    expression.getChildren().forEach(child -> collectAggregates(child, found));
  }

  /** Splits {@code a AND b AND c} into its conjuncts. */
  public static List<Expression> splitConjuncts(Expression predicate) {
    List<Expression> conjuncts = new ArrayList<>();
    splitConjuncts(predicate, conjuncts);
    return conjuncts;
  }

  private static void splitConjuncts(Expression predicate, List<Expression> conjuncts) {
    if (predicate instanceof BinaryExpr
        && ((BinaryExpr) predicate).getOperator() == BinaryOperator.AND) {
      splitConjuncts(((BinaryExpr) predicate).getLeft(), conjuncts);
      splitConjuncts(((BinaryExpr) predicate).getRight(), conjuncts);
    } else {
      conjuncts.add(predicate);
    }
  }

  /** Joins predicates with AND, left-deep; an empty list is {@code TRUE}. */
  public static Expression conjunction(List<Expression> conjuncts) {
    if (conjuncts.isEmpty()) {
      return new Literal(true, DataType.BOOLEAN);
    }
    Expression result = conjuncts.get(0);
    for (Expression next : conjuncts.subList(1, conjuncts.size())) {
      result = new BinaryExpr(BinaryOperator.AND, result, next);
    }
    return result;
  }

  public static Expression stripAlias(Expression expression) {
    Expression current = expression;
    while (current instanceof AliasExpr) {
      current = ((AliasExpr) current).getChild();
    }
    return current;
  }

  /**
   * Rewrites the tree bottom-up. The function sees each node after its children were rewritten;
   * nodes whose children did not change are passed through unchanged.
   */
  public static Expression transformUp(
      Expression expression, Function<Expression, Expression> rewrite) {
    List<Expression> children = expression.getChildren();
    Expression current = expression;
    if (!children.isEmpty()) {
      List<Expression> rewritten = new ArrayList<>(children.size());
      boolean changed = false;
      for (Expression child : children) {
        Expression newChild = transformUp(child, rewrite);
        changed |= newChild != child;
        rewritten.add(newChild);
      }
      if (changed) {
        current = expression.withChildren(rewritten);
      }
    }
    return rewrite.apply(current);
  }
}
