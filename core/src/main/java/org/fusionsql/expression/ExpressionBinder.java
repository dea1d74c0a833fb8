/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression;

import java.util.List;
import java.util.stream.Collectors;
import lombok.experimental.UtilityClass;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.exception.SchemaException;

/**
 * Binds column references to an input schema and re-runs type inference bottom-up, so that the
 * returned tree is resolved.
 */
@UtilityClass
public class ExpressionBinder {

  /**
   * Binds an expression.
   *
   * @throws SchemaException if a referenced column is absent or ambiguous
   * @throws org.fusionsql.exception.TypeCheckException if operand types do not fit
   */
  public static Expression bind(Expression expression, Schema schema) {
    if (expression instanceof ColumnRef) {
      ColumnRef ref = (ColumnRef) expression;
      return ref.bind(schema.getField(ref.getReference()));
    }
    List<Expression> children = expression.getChildren();
    if (children.isEmpty()) {
      return expression;
    }
    return expression.withChildren(
        children.stream().map(child -> bind(child, schema)).collect(Collectors.toList()));
  }

  public static List<Expression> bindAll(List<Expression> expressions, Schema schema) {
    return expressions.stream().map(e -> bind(e, schema)).collect(Collectors.toList());
  }

  /** True when every column the expression reads exists unambiguously in the schema. */
  public static boolean canBind(Expression expression, Schema schema) {
    try {
      for (ColumnRef ref : ExpressionUtils.columnRefs(expression)) {
        if (schema.findIndex(ref.getReference()).isEmpty()) {
          return false;
        }
      }
      return true;
    } catch (SchemaException e) {
      return false;
    }
  }
}
