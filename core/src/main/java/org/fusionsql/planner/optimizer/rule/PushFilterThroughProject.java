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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionUtils;
import org.fusionsql.planner.logical.LogicalFilter;
import org.fusionsql.planner.logical.LogicalPlan;
import org.fusionsql.planner.logical.LogicalProject;
import org.fusionsql.planner.optimizer.Rule;

/**
 * Moves the conjuncts that only read columns passed through unchanged by the projection below it.
 */
public class PushFilterThroughProject implements Rule<LogicalFilter> {

  private final Capture<LogicalProject> projectCapture;

  @Getter
  @Accessors(fluent = true)
  private final Pattern<LogicalFilter> pattern;

  /** Constructor of PushFilterThroughProject. */
  public PushFilterThroughProject() {
    this.projectCapture = Capture.newCapture();
    this.pattern = typeOf(LogicalFilter.class)
        .with(source().matching(typeOf(LogicalProject.class).capturedAs(projectCapture)));
  }

  @Override
  public LogicalPlan apply(LogicalFilter filter, Captures captures) {
    LogicalProject project = captures.get(projectCapture);
    List<Expression> pushed = new ArrayList<>();
    List<Expression> kept = new ArrayList<>();
    for (Expression conjunct : ExpressionUtils.splitConjuncts(filter.getCondition())) {
      Optional<Expression> rewritten =
          ColumnSubstitution.rewrite(conjunct, project.getSchema(), project.getProjectList());
      if (rewritten.isPresent()) {
        pushed.add(rewritten.get());
      } else {
        kept.add(conjunct);
      }
    }
    if (pushed.isEmpty()) {
      return filter;
    }
    LogicalPlan result = new LogicalProject(
        new LogicalFilter(project.getInput(), ExpressionUtils.conjunction(pushed)),
        project.getProjectList());
    return kept.isEmpty() ? result : new LogicalFilter(result, ExpressionUtils.conjunction(kept));
  }
}
