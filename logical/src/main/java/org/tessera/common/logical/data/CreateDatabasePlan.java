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
import java.util.Map;

import org.tessera.common.logical.DatabaseEngineType;
import org.tessera.common.logical.PlanNode;
import org.tessera.common.types.Schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * {@code CREATE DATABASE [IF NOT EXISTS] name ENGINE = engine}.
 */
@JsonTypeName("create-database")
public class CreateDatabasePlan extends PlanNode {

  private final String database;
  private final DatabaseEngineType engine;
  private final boolean ifNotExists;
  private final Map<String, String> options;

  @JsonCreator
  public CreateDatabasePlan(@JsonProperty("database") String database,
                            @JsonProperty("engine") DatabaseEngineType engine,
                            @JsonProperty("ifNotExists") boolean ifNotExists,
                            @JsonProperty("options") Map<String, String> options) {
    this.database = database;
    this.engine = engine == null ? DatabaseEngineType.LOCAL : engine;
    this.ifNotExists = ifNotExists;
    this.options = options == null ? ImmutableMap.of() : ImmutableMap.copyOf(options);
  }

  public CreateDatabasePlan(String database, DatabaseEngineType engine, boolean ifNotExists) {
    this(database, engine, ifNotExists, null);
  }

  @JsonProperty("database")
  public String getDatabase() {
    return database;
  }

  @JsonProperty("engine")
  public DatabaseEngineType getEngine() {
    return engine;
  }

  @JsonProperty("ifNotExists")
  public boolean isIfNotExists() {
    return ifNotExists;
  }

  @JsonProperty("options")
  public Map<String, String> getOptions() {
    return options;
  }

  @Override
  public Schema getSchema() {
    return Schema.EMPTY;
  }

  @Override
  public List<PlanNode> getInputs() {
    return ImmutableList.of();
  }

  @Override
  public String display() {
    return "Create database " + database + ", engine: " + engine + ", if_not_exists:" + ifNotExists
        + (options.isEmpty() ? "" : ", option: " + options);
  }
}
