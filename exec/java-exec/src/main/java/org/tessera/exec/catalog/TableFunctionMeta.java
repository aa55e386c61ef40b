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

import org.tessera.common.types.Schema;

import com.google.common.base.MoreObjects;

/**
 * A table valued function, such as {@code numbers(n)}, provided by a database.
 */
public class TableFunctionMeta {

  private final String name;
  private final String database;
  private final int numArguments;
  private final Schema schema;

  public TableFunctionMeta(String name, String database, int numArguments, Schema schema) {
    this.name = name;
    this.database = database;
    this.numArguments = numArguments;
    this.schema = schema;
  }

  public String getName() {
    return name;
  }

  public String getDatabase() {
    return database;
  }

  public int getNumArguments() {
    return numArguments;
  }

  /**
   * @return the columns of the produced table
   */
  public Schema getSchema() {
    return schema;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("database", database)
        .add("numArguments", numArguments)
        .toString();
  }
}
