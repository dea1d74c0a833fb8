/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.fusionsql.data.type.DataType;

/** Names the column an expression produces. */
@Getter
@EqualsAndHashCode(callSuper = false)
public class AliasExpr extends Expression {

  private final Expression child;
  private final String alias;

  public AliasExpr(Expression child, String alias) {
    this.child = child;
    this.alias = alias;
  }

  @Override
  public DataType getType() {
    return child.getType();
  }

  @Override
  public boolean isNullable() {
    return child.isNullable();
  }

  @Override
  public boolean isResolved() {
    return child.isResolved();
  }

  @Override
  public String getName() {
    return alias;
  }

  @Override
  public List<Expression> getChildren() {
    return ImmutableList.of(child);
  }

  @Override
  public Expression withChildren(List<Expression> children) {
    Preconditions.checkArgument(children.size() == 1);
    return new AliasExpr(children.get(0), alias);
  }

  @Override
  public <R, C> R accept(ExpressionNodeVisitor<R, C> visitor, C context) {
    return visitor.visitAlias(this, context);
  }

  @Override
  public String toString() {
    return child + " AS " + alias;
  }
}
