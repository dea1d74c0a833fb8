/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.expression.eval.CompiledExpression;

/** Evaluates the projection list over each input batch. */
public class ProjectionOperator extends AbstractPhysicalOperator {

  private final List<CompiledExpression> projections;

  public ProjectionOperator(
      OperatorContext context,
      Schema schema,
      PhysicalOperator input,
      List<CompiledExpression> projections) {
    super(context, schema, List.of(input));
    this.projections = projections;
  }

  @Override
  protected Optional<RecordBatch> produceNext() {
    return pullInput().map(this::project);
  }

  private RecordBatch project(RecordBatch batch) {
    List<ColumnVector> columns = new ArrayList<>(projections.size());
    for (CompiledExpression projection : projections) {
      columns.add(projection.evaluate(batch));
    }
    return new RecordBatch(getSchema(), columns, batch.getRowCount());
  }
}
