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

import org.tessera.common.logical.data.CreateDatabasePlan;
import org.tessera.common.logical.data.DropDatabasePlan;

import com.google.common.collect.ListMultimap;

/**
 * Name keyed registry of the databases, tables and table functions a query can refer to. Database names are
 * case insensitive.
 */
public interface Catalog {

  /**
   * Registers databases known at start up, replacing any database of the same name, together with their
   * table functions.
   */
  void registerDatabase(List<Database> databases);

  /**
   * @throws org.tessera.common.exceptions.UserException UNKNOWN_DATABASE
   */
  Database getDatabase(String databaseName);

  /**
   * @return the names of all local and remote databases, sorted
   */
  List<String> getDatabases();

  /**
   * @throws org.tessera.common.exceptions.UserException UNKNOWN_DATABASE or UNKNOWN_TABLE
   */
  TableMeta getTable(String databaseName, String tableName);

  /**
   * @param tableVersion the required version, or null for the current one
   * @throws org.tessera.common.exceptions.UserException UNKNOWN_DATABASE or UNKNOWN_TABLE
   */
  TableMeta getTableById(String databaseName, long tableId, Long tableVersion);

  /**
   * @return tables keyed by database name. Remote databases shadowed by a local database of the same name are
   *         left out.
   */
  ListMultimap<String, TableMeta> getAllTables();

  /**
   * @throws org.tessera.common.exceptions.UserException UNKNOWN_TABLE_FUNCTION
   */
  TableFunctionMeta getTableFunction(String name);

  /**
   * @throws org.tessera.common.exceptions.UserException DATABASE_ALREADY_EXISTS unless the plan allows an
   *         existing database
   */
  void createDatabase(CreateDatabasePlan plan);

  /**
   * @throws org.tessera.common.exceptions.UserException UNKNOWN_DATABASE unless the plan allows a missing
   *         database
   */
  void dropDatabase(DropDatabasePlan plan);
}
