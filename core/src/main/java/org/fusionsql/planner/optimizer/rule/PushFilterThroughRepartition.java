/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.optimizer.rule;

import static com.facebook.presto.matching.Pattern.typeOf;
import static org.fusionsql.planner.optimizer.pattern.Patterns.source;

import com.facebook.presto.matching.Capture;
import com.facebook.presto.matching.Captures;
import com.facebook.presto.matching.Pattern;
import java.util.List;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.fusionsql.planner.logical.LogicalFilter;
import org.fusionsql.planner.logical.LogicalPlan;
import org.fusionsql.planner.logical.LogicalRepartition;
import org.fusionsql.planner.optimizer.Rule;

/** Swaps a filter with the repartition below it. */
public class PushFilterThroughRepartition implements Rule<LogicalFilter> {

  private final Capture<LogicalRepartition> capture;

  @Getter
  @Accessors(fluent = true)
  private final Pattern<LogicalFilter> pattern;

  /** Constructor of PushFilterThroughRepartition. */
  public PushFilterThroughRepartition() {
    this.capture = Capture.newCapture();
    this.pattern = typeOf(LogicalFilter.class)
        .with(source().matching(typeOf(LogicalRepartition.class).capturedAs(capture)));
  }

  @Override
  public LogicalPlan apply(LogicalFilter filter, Captures captures) {
    LogicalRepartition child = captures.get(capture);
    return child.replaceChildPlans(
        List.of(new LogicalFilter(child.getInput(), filter.getCondition())));
  }
}
