/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.catalog;

import java.util.Set;
import org.fusionsql.storage.DataSource;

/** Registry of named tables visible to queries. */
public interface CatalogService {

  /**
   * Returns the table with the given name.
   *
   * @throws org.fusionsql.exception.SchemaException if no such table is registered
   */
  DataSource getTable(String name);

  boolean hasTable(String name);

  void registerTable(String name, DataSource table);

  void dropTable(String name);

  Set<String> getTableNames();
}
