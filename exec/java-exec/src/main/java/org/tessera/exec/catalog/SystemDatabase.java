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

import org.tessera.common.logical.DatabaseEngineType;
import org.tessera.common.types.Field;
import org.tessera.common.types.LogicalType;
import org.tessera.common.types.Schema;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The read-only {@code system} database. Its tables take the ids {@link DatabaseCatalog#SYS_TBL_ID_BEGIN} onward,
 * in declaration order.
 */
public class SystemDatabase extends AbstractDatabase {

  public static final String NAME = "system";

  private static final Schema NUMBERS_SCHEMA = Schema.of(Field.of("number", LogicalType.UINT64));

  private final List<TableMeta> tables;
  private final List<TableFunctionMeta> tableFunctions;

  public SystemDatabase() {
    super(NAME);
    tables = ImmutableList.of(
        table(0, "databases", Schema.of(Field.of("name", LogicalType.UTF8))),
        table(1, "tables", Schema.of(
            Field.of("database", LogicalType.UTF8),
            Field.of("name", LogicalType.UTF8),
            Field.of("engine", LogicalType.UTF8))),
        table(2, "functions", Schema.of(
            Field.of("name", LogicalType.UTF8),
            Field.of("is_aggregate", LogicalType.BOOLEAN))),
        table(3, "settings", Schema.of(
            Field.of("name", LogicalType.UTF8),
            Field.of("value", LogicalType.UTF8))),
        table(4, "one", Schema.of(Field.of("dummy", LogicalType.UINT8))));
    tableFunctions = ImmutableList.of(
        new TableFunctionMeta("numbers", NAME, 1, NUMBERS_SCHEMA),
        new TableFunctionMeta("numbers_mt", NAME, 1, NUMBERS_SCHEMA),
        new TableFunctionMeta("numbers_local", NAME, 1, NUMBERS_SCHEMA));
  }

  private static TableMeta table(int ordinal, String name, Schema schema) {
    long id = DatabaseCatalog.SYS_TBL_ID_BEGIN + ordinal;
    Preconditions.checkArgument(id < DatabaseCatalog.SYS_TBL_ID_END, "System table id %s out of range", id);
    return new TableMeta(id, 0, NAME, name, schema);
  }

  @Override
  public DatabaseEngineType getEngine() {
    return DatabaseEngineType.LOCAL;
  }

  @Override
  public boolean isLocal() {
    return true;
  }

  @Override
  public List<TableMeta> getTables() {
    return tables;
  }

  @Override
  public List<TableFunctionMeta> getTableFunctions() {
    return tableFunctions;
  }
}
