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

public interface Database {

  String getName();

  DatabaseEngineType getEngine();

  /**
   * @return true when the metadata lives in this process and dropping the database only forgets it
   */
  boolean isLocal();

  /**
   * @throws org.tessera.common.exceptions.UserException UNKNOWN_TABLE
   */
  TableMeta getTable(String tableName);

  /**
   * @param tableVersion the required version, or null for the current one
   * @throws org.tessera.common.exceptions.UserException UNKNOWN_TABLE
   */
  TableMeta getTableById(long tableId, Long tableVersion);

  List<TableMeta> getTables();

  List<TableFunctionMeta> getTableFunctions();
}
