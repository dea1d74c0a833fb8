/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression;

/**
 * Visitor over the closed set of expression variants. Every variant has an abstract method so an
 * implementation that forgets one does not compile.
 *
 * @param <R> return type
 * @param <C> context type
 */
public interface ExpressionNodeVisitor<R, C> {

  R visitColumnRef(ColumnRef node, C context);

  R visitLiteral(Literal node, C context);

  R visitBinary(BinaryExpr node, C context);

  R visitUnary(UnaryExpr node, C context);

  R visitAggregate(AggregateExpr node, C context);

  R visitFunction(ScalarFunctionExpr node, C context);

  R visitCast(CastExpr node, C context);

  R visitAlias(AliasExpr node, C context);
}
