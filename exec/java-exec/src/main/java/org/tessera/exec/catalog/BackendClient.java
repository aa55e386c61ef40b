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
 * Client of the remote catalog store. The store arbitrates concurrent writes; implementations report failures
 * as {@link org.tessera.common.exceptions.UserException}s.
 */
public interface BackendClient {

  /**
   * @throws org.tessera.common.exceptions.UserException UNKNOWN_DATABASE
   */
  Database getDatabase(String databaseName);

  List<String> getDatabases();

  ListMultimap<String, TableMeta> getAllTables();

  void createDatabase(CreateDatabasePlan plan);

  void dropDatabase(DropDatabasePlan plan);
}
