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

import java.util.Objects;

import org.tessera.common.types.Schema;

import com.google.common.base.MoreObjects;

/**
 * Immutable description of one version of a table.
 */
public class TableMeta {

  private final long id;
  private final long version;
  private final String database;
  private final String name;
  private final Schema schema;

  public TableMeta(long id, long version, String database, String name, Schema schema) {
    this.id = id;
    this.version = version;
    this.database = database;
    this.name = name;
    this.schema = schema;
  }

  public long getId() {
    return id;
  }

  public long getVersion() {
    return version;
  }

  public String getDatabase() {
    return database;
  }

  public String getName() {
    return name;
  }

  public Schema getSchema() {
    return schema;
  }

  /**
   * @return true when {@code tableVersion} is null or names this version
   */
  public boolean matches(long tableId, Long tableVersion) {
    return id == tableId && (tableVersion == null || tableVersion == version);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    TableMeta that = (TableMeta) o;
    return id == that.id
        && version == that.version
        && database.equals(that.database)
        && name.equals(that.name)
        && schema.equals(that.schema);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, version, database, name, schema);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("version", version)
        .add("database", database)
        .add("name", name)
        .add("schema", schema)
        .toString();
  }
}
