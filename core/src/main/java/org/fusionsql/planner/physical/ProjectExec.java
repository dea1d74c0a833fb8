/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.physical;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.expression.ColumnRef;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionBinder;
import org.fusionsql.expression.ExpressionUtils;
import org.fusionsql.planner.logical.LogicalProject;

@Getter
public class ProjectExec extends PhysicalPlan {

  private final PhysicalPlan input;
  private final List<Expression> projectList;
  private final Schema schema;
  private final PartitioningScheme partitioning;

  public ProjectExec(PhysicalPlan input, List<Expression> projectList) {
    super(List.of(input));
    this.input = input;
    this.projectList = List.copyOf(ExpressionBinder.bindAll(projectList, input.getSchema()));
    this.schema = LogicalProject.outputSchema(this.projectList);
    this.partitioning = outputPartitioning();
  }

  /** Keeps hash partitioning when every key column is projected unchanged. */
  private PartitioningScheme outputPartitioning() {
    PartitioningScheme in = input.getPartitioning();
    if (in.getKind() != PartitioningScheme.Kind.HASH) {
      return in;
    }
    List<Expression> keys = new ArrayList<>();
    for (Expression key : in.getHashKeys()) {
      if (!(key instanceof ColumnRef)) {
        return PartitioningScheme.roundRobin(in.getPartitionCount());
      }
      Expression projected = null;
      for (int i = 0; i < projectList.size() && projected == null; i++) {
        Expression candidate = ExpressionUtils.stripAlias(projectList.get(i));
        if (candidate instanceof ColumnRef
            && ((ColumnRef) candidate).getField().equals(((ColumnRef) key).getField())) {
          projected = new ColumnRef(schema.getField(i).getQualifiedName()).bind(schema.getField(i));
        }
      }
      if (projected == null) {
        return PartitioningScheme.roundRobin(in.getPartitionCount());
      }
      keys.add(projected);
    }
    return PartitioningScheme.hash(keys, in.getPartitionCount());
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.PROJECTION;
  }

  @Override
  public String describe() {
    return "ProjectExec" + projectList;
  }

  @Override
  public <R, C> R accept(PhysicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitProject(this, context);
  }
}
