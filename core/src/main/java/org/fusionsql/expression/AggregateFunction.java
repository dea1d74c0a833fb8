/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression;

import java.util.Locale;
import java.util.Optional;

public enum AggregateFunction {
  COUNT,
  SUM,
  MIN,
  MAX,
  AVG;

  public static Optional<AggregateFunction> fromName(String name) {
    try {
      return Optional.of(valueOf(name.toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
