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

import org.tessera.common.logical.PlanNode;
import org.tessera.common.types.Schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.base.Preconditions;

@JsonTypeName("limit")
public class Limit extends SingleInputPlan {

  private final long n;

  @JsonCreator
  public Limit(@JsonProperty("input") PlanNode input, @JsonProperty("n") long n) {
    super(input);
    Preconditions.checkArgument(n >= 0, "Limit must not be negative: %s", n);
    this.n = n;
  }

  @JsonProperty("n")
  public long getN() {
    return n;
  }

  @Override
  public Schema getSchema() {
    return getInput().getSchema();
  }

  @Override
  public String display() {
    return "Limit: " + n;
  }
}
