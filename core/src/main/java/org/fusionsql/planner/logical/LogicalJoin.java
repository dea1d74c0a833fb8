/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.logical;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.type.DataType;
import org.fusionsql.exception.TypeCheckException;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionBinder;
import org.fusionsql.expression.ExpressionUtils;

/**
 * Equi-join of two inputs. The output is the left columns followed by the right columns; the
 * columns of a side that may be padded with nulls become nullable.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class LogicalJoin extends LogicalPlan {

  private final List<JoinKey> joinKeys;
  private final JoinType joinType;
  @EqualsAndHashCode.Exclude private final Schema schema;

  /**
   * Constructor of LogicalJoin.
   *
   * @throws org.fusionsql.exception.SchemaException if a key column is unknown or both inputs
   *     share a qualified column name
   * @throws TypeCheckException if a key pair cannot be compared
   */
  public LogicalJoin(
      LogicalPlan left, LogicalPlan right, List<JoinKey> joinKeys, JoinType joinType) {
    super(List.of(left, right));
    Preconditions.checkArgument(!joinKeys.isEmpty(), "Join requires at least one key");
    List<JoinKey> bound = new ArrayList<>(joinKeys.size());
    for (JoinKey key : joinKeys) {
      Expression l = ExpressionBinder.bind(key.getLeft(), left.getSchema());
      Expression r = ExpressionBinder.bind(key.getRight(), right.getSchema());
      if (ExpressionUtils.containsAggregate(l) || ExpressionUtils.containsAggregate(r)) {
        throw new TypeCheckException("Aggregate functions are not allowed in join keys");
      }
      if (!isKeyCompatible(l.getType(), r.getType())) {
        throw new TypeCheckException(
            String.format(
                "Join key %s of type %s cannot be matched with %s of type %s",
                l, l.getType(), r, r.getType()));
      }
      bound.add(new JoinKey(l, r));
    }
    this.joinKeys = List.copyOf(bound);
    this.joinType = joinType;
    this.schema = outputSchema(left.getSchema(), right.getSchema(), joinType);
  }

  /**
   * Keys are compared on their normalized values, so integers only match integers and floats
   * only match floats.
   */
  public static boolean isKeyCompatible(DataType left, DataType right) {
    if (left.isInteger() || right.isInteger()) {
      return left.isInteger() && right.isInteger();
    }
    return left.getCategory() == right.getCategory();
  }

  /** Output schema of a join of the two input schemas. */
  public static Schema outputSchema(Schema left, Schema right, JoinType joinType) {
    if (!joinType.outputsRight()) {
      return left;
    }
    Schema l = joinType.preservesRight() ? left.asNullable() : left;
    Schema r = joinType.preservesLeft() ? right.asNullable() : right;
    return l.merge(r);
  }

  public LogicalPlan getLeft() {
    return getChild().get(0);
  }

  public LogicalPlan getRight() {
    return getChild().get(1);
  }

  public List<Expression> getLeftKeys() {
    return joinKeys.stream().map(JoinKey::getLeft).collect(Collectors.toList());
  }

  public List<Expression> getRightKeys() {
    return joinKeys.stream().map(JoinKey::getRight).collect(Collectors.toList());
  }

  @Override
  public LogicalPlan replaceChildPlans(List<LogicalPlan> children) {
    Preconditions.checkArgument(children.size() == 2);
    return new LogicalJoin(children.get(0), children.get(1), joinKeys, joinType);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitJoin(this, context);
  }
}
