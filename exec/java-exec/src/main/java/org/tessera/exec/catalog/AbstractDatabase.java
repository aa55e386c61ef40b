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

import org.tessera.common.exceptions.UserException;

import com.google.common.collect.ImmutableList;

/**
 * Table lookups over {@link #getTables()}. Table names are case insensitive.
 */
public abstract class AbstractDatabase implements Database {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(AbstractDatabase.class);

  private final String name;

  protected AbstractDatabase(String name) {
    this.name = name.toLowerCase(Locale.ROOT);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public TableMeta getTable(String tableName) {
    for (TableMeta table : getTables()) {
      if (table.getName().equalsIgnoreCase(tableName)) {
        return table;
      }
    }
    throw unknownTable(tableName);
  }

  @Override
  public TableMeta getTableById(long tableId, Long tableVersion) {
    for (TableMeta table : getTables()) {
      if (table.matches(tableId, tableVersion)) {
        return table;
      }
    }
    throw UserException.unknownTableError()
        .message("Unknown table id: %d%s", tableId, tableVersion == null ? "" : ", version: " + tableVersion)
        .addContext("Database", name)
        .build(logger);
  }

  @Override
  public List<TableFunctionMeta> getTableFunctions() {
    return ImmutableList.of();
  }

  protected UserException unknownTable(String tableName) {
    return UserException.unknownTableError()
        .message("Unknown table: '%s.%s'", name, tableName)
        .addContext("Database", name)
        .build(logger);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + name + "]";
  }
}
