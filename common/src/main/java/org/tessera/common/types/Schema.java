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
package org.tessera.common.types;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Ordered list of fields produced by a plan node.
 */
public class Schema {

  public static final Schema EMPTY = new Schema(ImmutableList.of());

  private final List<Field> fields;

  @JsonCreator
  public Schema(@JsonProperty("fields") List<Field> fields) {
    this.fields = fields == null ? ImmutableList.of() : ImmutableList.copyOf(fields);
  }

  public static Schema of(Field... fields) {
    return new Schema(ImmutableList.copyOf(fields));
  }

  @JsonProperty("fields")
  public List<Field> getFields() {
    return fields;
  }

  @JsonIgnore
  public int getFieldCount() {
    return fields.size();
  }

  public Optional<Field> findField(String name) {
    return fields.stream().filter(f -> f.getName().equalsIgnoreCase(name)).findFirst();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Schema && fields.equals(((Schema) o).fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "[" + Joiner.on(", ").join(fields) + "]";
  }
}
