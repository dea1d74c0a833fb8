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
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.exception.SchemaException;

/**
 * Concatenation of inputs with identical column names and types (UNION ALL). Output columns are
 * unqualified and nullable when any input column is.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class LogicalUnion extends LogicalPlan {

  @EqualsAndHashCode.Exclude private final Schema schema;

  public LogicalUnion(List<LogicalPlan> inputs) {
    super(inputs);
    Preconditions.checkArgument(inputs.size() >= 2, "Union requires at least two inputs");
    this.schema =
        outputSchema(inputs.stream().map(LogicalPlan::getSchema).collect(Collectors.toList()));
  }

  /**
   * Output schema of a union: columns match by position and take the names of the first input.
   *
   * @throws SchemaException if the inputs differ in column count or types
   */
  public static Schema outputSchema(List<Schema> inputs) {
    Schema first = inputs.get(0);
    boolean[] nullable = new boolean[first.size()];
    for (Schema other : inputs) {
      if (!first.isUnionCompatible(other)) {
        throw new SchemaException(
            String.format("Union inputs have incompatible schemas %s and %s", first, other));
      }
      for (int i = 0; i < nullable.length; i++) {
        nullable[i] |= other.getField(i).isNullable();
      }
    }
    List<Field> fields = new ArrayList<>(first.size());
    for (int i = 0; i < nullable.length; i++) {
      Field field = first.getField(i);
      fields.add(new Field(field.getName(), field.getType(), nullable[i]));
    }
    return new Schema(fields);
  }

  @Override
  public LogicalPlan replaceChildPlans(List<LogicalPlan> children) {
    return new LogicalUnion(children);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitUnion(this, context);
  }
}
