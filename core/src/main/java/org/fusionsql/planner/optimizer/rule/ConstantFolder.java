/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.optimizer.rule;

import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.exception.QueryEngineException;
import org.fusionsql.expression.AliasExpr;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionUtils;
import org.fusionsql.expression.Literal;
import org.fusionsql.expression.eval.ExpressionCompiler;

/**
 * Replaces column-free subexpressions by their value. An expression whose evaluation fails is left
 * as it is; the failure then surfaces at execution time.
 */
@Log4j2
final class ConstantFolder {

  private static final RecordBatch SINGLE_ROW = new RecordBatch(Schema.empty(), List.of(), 1);

  private ConstantFolder() {}

  /** Folds every constant subtree. Returns the same instance when nothing was folded. */
  static Expression fold(Expression expression) {
    return ExpressionUtils.transformUp(expression, ConstantFolder::foldNode);
  }

  /** Folds an output expression, keeping its output name with an alias when folding renamed it. */
  static Expression foldNamed(Expression expression) {
    Expression folded = fold(expression);
    if (folded != expression && !folded.getName().equals(expression.getName())) {
      return new AliasExpr(folded, expression.getName());
    }
    return folded;
  }

  private static Expression foldNode(Expression node) {
    if (node instanceof Literal || node instanceof AliasExpr || !node.isResolved()
        || !ExpressionUtils.isConstant(node)) {
      return node;
    }
    try {
      Object value = ExpressionCompiler.compile(node, Schema.empty())
          .evaluate(SINGLE_ROW)
          .getObject(0);
      return new Literal(value, node.getType());
    } catch (QueryEngineException e) {
      log.debug("Leaving {} unfolded: {}", node, e.getMessage());
      return node;
    }
  }
}
