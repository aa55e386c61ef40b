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

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named, typed column slot of a {@link Schema}.
 */
public class Field {

  private final String name;
  private final LogicalType type;
  private final boolean nullable;

  @JsonCreator
  public Field(@JsonProperty("name") String name,
               @JsonProperty("type") LogicalType type,
               @JsonProperty("nullable") boolean nullable) {
    this.name = name;
    this.type = type;
    this.nullable = nullable;
  }

  public static Field of(String name, LogicalType type) {
    return new Field(name, type, true);
  }

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @JsonProperty("type")
  public LogicalType getType() {
    return type;
  }

  @JsonProperty("nullable")
  public boolean isNullable() {
    return nullable;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Field)) {
      return false;
    }
    Field field = (Field) o;
    return nullable == field.nullable && name.equals(field.name) && type.equals(field.type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, nullable);
  }

  @Override
  public String toString() {
    return name + ":" + type + (nullable ? ";N" : "");
  }
}
