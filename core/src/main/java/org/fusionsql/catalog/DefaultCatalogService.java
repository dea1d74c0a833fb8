/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.catalog;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.log4j.Log4j2;
import org.fusionsql.exception.SchemaException;
import org.fusionsql.storage.DataSource;

/** Thread safe in-memory catalog. Table names are case sensitive. */
@Log4j2
public class DefaultCatalogService implements CatalogService {

  private final Map<String, DataSource> tables = new ConcurrentHashMap<>();

  @Override
  public DataSource getTable(String name) {
    DataSource table = tables.get(name);
    if (table == null) {
      throw new SchemaException(String.format("Table '%s' does not exist", name));
    }
    return table;
  }

  @Override
  public boolean hasTable(String name) {
    return tables.containsKey(name);
  }

  @Override
  public void registerTable(String name, DataSource table) {
    if (tables.put(name, table) != null) {
      log.info("Replaced table {}", name);
    } else {
      log.debug("Registered table {} with schema {}", name, table.getSchema());
    }
  }

  @Override
  public void dropTable(String name) {
    tables.remove(name);
  }

  @Override
  public Set<String> getTableNames() {
    return new TreeSet<>(tables.keySet());
  }
}
