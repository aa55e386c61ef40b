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
package org.tessera.common.logical.data;

import java.util.List;

import org.tessera.common.logical.PlanNode;
import org.tessera.common.types.Schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.collect.ImmutableList;

@JsonTypeName("scan")
public class Scan extends PlanNode {

  private final String database;
  private final String table;
  private final Schema schema;

  @JsonCreator
  public Scan(@JsonProperty("database") String database,
              @JsonProperty("table") String table,
              @JsonProperty("schema") Schema schema) {
    this.database = database;
    this.table = table;
    this.schema = schema == null ? Schema.EMPTY : schema;
  }

  @JsonProperty("database")
  public String getDatabase() {
    return database;
  }

  @JsonProperty("table")
  public String getTable() {
    return table;
  }

  @Override
  @JsonProperty("schema")
  public Schema getSchema() {
    return schema;
  }

  @Override
  public List<PlanNode> getInputs() {
    return ImmutableList.of();
  }

  @Override
  public String display() {
    return "Scan: " + database + "." + table;
  }
}
