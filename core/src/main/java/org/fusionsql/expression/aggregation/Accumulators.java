/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.aggregation;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.experimental.UtilityClass;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.type.DataType;
import org.fusionsql.expression.AggregateExpr;

/** Creates accumulators and describes the partial state layout of each aggregate function. */
@UtilityClass
public class Accumulators {

  public static Accumulator create(AggregateExpr aggregate) {
    switch (aggregate.getFunction()) {
      case COUNT:
        return new CountAccumulator();
      case SUM:
        return new SumAccumulator(aggregate.getType().isFloating());
      case MIN:
        return new MinMaxAccumulator(false);
      case MAX:
        return new MinMaxAccumulator(true);
      default:
        return new AvgAccumulator();
    }
  }

  /**
   * Fields of the partial state an aggregate emits between the partial and the final phase.
   *
   * @param aggregate resolved aggregate
   * @param name output name of the aggregate, used as prefix of the state columns
   */
  public static List<Field> stateFields(AggregateExpr aggregate, String name) {
    switch (aggregate.getFunction()) {
      case COUNT:
        return ImmutableList.of(new Field(name, DataType.INT64, false));
      case AVG:
        return ImmutableList.of(
            new Field(name + "#sum", DataType.FLOAT64, false),
            new Field(name + "#count", DataType.INT64, false));
      default:
        return ImmutableList.of(new Field(name, aggregate.getType(), true));
    }
  }
}
