/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.optimizer.pattern;

import com.facebook.presto.matching.Property;
import java.util.Optional;
import lombok.experimental.UtilityClass;
import org.fusionsql.planner.logical.LogicalPlan;

/** Pattern properties shared by the optimizer rules. */
@UtilityClass
public class Patterns {

  /** The only child of a single-input plan node. */
  public static <T extends LogicalPlan> Property<T, LogicalPlan> source() {
    return Property.optionalProperty(
        "source",
        plan -> plan.getChild().size() == 1
            ? Optional.of(plan.getChild().get(0))
            : Optional.empty());
  }
}
