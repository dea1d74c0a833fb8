/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.storage.DataSource;

/** Reads one partition of a table, restricted to the projected columns. */
public class ScanOperator extends AbstractPhysicalOperator {

  private final DataSource source;
  private final List<String> projection;
  private final int partition;
  private final int partitionCount;
  private Iterator<RecordBatch> batches;

  public ScanOperator(
      OperatorContext context,
      Schema schema,
      DataSource source,
      List<String> projection,
      int partition,
      int partitionCount) {
    super(context, schema, List.of());
    this.source = source;
    this.projection = projection;
    this.partition = partition;
    this.partitionCount = partitionCount;
  }

  @Override
  protected void doOpen() {
    batches = source.scan(projection, partition, partitionCount);
  }

  @Override
  protected Optional<RecordBatch> produceNext() {
    if (!batches.hasNext()) {
      return Optional.empty();
    }
    // Source batches carry unqualified fields.
    return Optional.of(batches.next().withSchema(getSchema()));
  }

  @Override
  protected void doClose() {
    batches = null;
  }
}
