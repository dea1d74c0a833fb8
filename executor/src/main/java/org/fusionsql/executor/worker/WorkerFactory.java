/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.executor.worker;

import org.fusionsql.catalog.CatalogService;
import org.fusionsql.executor.shuffle.ShuffleService;
import org.fusionsql.expression.function.FunctionRegistry;

/** Creates the workers of an engine. All workers share the catalog, functions and shuffle. */
@FunctionalInterface
public interface WorkerFactory {

  WorkerFactory LOCAL = LocalWorker::new;

  Worker create(
      String workerId,
      int slots,
      CatalogService catalog,
      FunctionRegistry functions,
      ShuffleService shuffle);
}
