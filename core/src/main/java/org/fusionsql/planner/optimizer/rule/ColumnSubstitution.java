/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.optimizer.rule;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.expression.ColumnRef;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionUtils;

/**
 * Rewrites a predicate over the output of a node into a predicate over its input, for nodes whose
 * output columns are computed by a list of expressions (projection, group keys).
 */
final class ColumnSubstitution {

  private ColumnSubstitution() {}

  /**
   * Maps each column of the predicate to the input column it was copied from.
   *
   * @param output output schema of the node
   * @param sources expression computing the output column at the same position; positions past
   *     the end of the list are not rewritable
   * @return the rewritten predicate, or empty if a referenced column is computed by anything but
   *     a plain column reference or if the predicate reads no column at all
   */
  static Optional<Expression> rewrite(
      Expression predicate, Schema output, List<Expression> sources) {
    List<ColumnRef> refs = ExpressionUtils.columnRefs(predicate);
    if (refs.isEmpty()) {
      return Optional.empty();
    }
    Map<String, Expression> replacements = new HashMap<>();
    for (ColumnRef ref : refs) {
      Optional<Integer> index = output.findIndex(ref.getReference());
      if (index.isEmpty() || index.get() >= sources.size()) {
        return Optional.empty();
      }
      Expression source = ExpressionUtils.stripAlias(sources.get(index.get()));
      if (!(source instanceof ColumnRef)) {
        return Optional.empty();
      }
      replacements.put(ref.getReference(), new ColumnRef(((ColumnRef) source).getReference()));
    }
    return Optional.of(
        ExpressionUtils.transformUp(
            predicate,
            node -> node instanceof ColumnRef
                ? replacements.get(((ColumnRef) node).getReference())
                : node));
  }
}
