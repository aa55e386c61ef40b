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
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

@JsonTypeName("project")
public class Projection extends SingleInputPlan {

  private final List<String> expressions;
  private final Schema schema;

  @JsonCreator
  public Projection(@JsonProperty("input") PlanNode input,
                    @JsonProperty("expressions") List<String> expressions,
                    @JsonProperty("schema") Schema schema) {
    super(input);
    this.expressions = expressions == null ? ImmutableList.of() : ImmutableList.copyOf(expressions);
    this.schema = schema == null ? Schema.EMPTY : schema;
  }

  @JsonProperty("expressions")
  public List<String> getExpressions() {
    return expressions;
  }

  @Override
  @JsonProperty("schema")
  public Schema getSchema() {
    return schema;
  }

  @Override
  public String display() {
    return "Projection: " + Joiner.on(", ").join(expressions);
  }
}
