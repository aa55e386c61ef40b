/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.tessera.exec.catalog;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

import org.tessera.common.exceptions.UserException;
import org.tessera.common.logical.DatabaseEngineType;
import org.tessera.common.types.Schema;

import com.google.common.collect.ImmutableList;

/**
 * In-process database whose metadata is lost with the process. Table ids are drawn from
 * {@link DatabaseCatalog#LOCAL_TBL_ID_BEGIN} upward and never reused.
 */
public class LocalDatabase extends AbstractDatabase {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(LocalDatabase.class);

  private static final AtomicLong NEXT_TABLE_ID = new AtomicLong(DatabaseCatalog.LOCAL_TBL_ID_BEGIN);

  private final ConcurrentNavigableMap<String, TableMeta> tables = new ConcurrentSkipListMap<>();

  public LocalDatabase(String name) {
    super(name);
  }

  @Override
  public DatabaseEngineType getEngine() {
    return DatabaseEngineType.LOCAL;
  }

  @Override
  public boolean isLocal() {
    return true;
  }

  /**
   * Registers a new table at version 0.
   *
   * @throws UserException SYSTEM if a table of that name already exists
   */
  public TableMeta createTable(String tableName, Schema schema) {
    String key = tableName.toLowerCase(Locale.ROOT);
    TableMeta table = new TableMeta(NEXT_TABLE_ID.getAndIncrement(), 0, getName(), key, schema);
    if (tables.putIfAbsent(key, table) != null) {
      throw UserException.systemError(null)
          .message("Table '%s.%s' already exists", getName(), key)
          .build(logger);
    }
    logger.info("Created table {}.{} with id {}", getName(), key, table.getId());
    return table;
  }

  /**
   * @throws UserException UNKNOWN_TABLE
   */
  public void dropTable(String tableName) {
    if (tables.remove(tableName.toLowerCase(Locale.ROOT)) == null) {
      throw unknownTable(tableName);
    }
    logger.info("Dropped table {}.{}", getName(), tableName);
  }

  @Override
  public TableMeta getTable(String tableName) {
    TableMeta table = tables.get(tableName.toLowerCase(Locale.ROOT));
    if (table == null) {
      throw unknownTable(tableName);
    }
    return table;
  }

  @Override
  public List<TableMeta> getTables() {
    return ImmutableList.copyOf(tables.values());
  }
}
