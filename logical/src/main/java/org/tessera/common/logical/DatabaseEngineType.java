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
package org.tessera.common.logical;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a database keeps its metadata.
 */
public enum DatabaseEngineType {
  /** In-process metadata, lost with the process. */
  LOCAL("Local"),
  /** Metadata owned by the remote catalog store. */
  REMOTE("Remote");

  private final String displayName;

  DatabaseEngineType(String displayName) {
    this.displayName = displayName;
  }

  @JsonCreator
  public static DatabaseEngineType fromString(String name) {
    return valueOf(name.trim().toUpperCase(Locale.ROOT));
  }

  @JsonValue
  @Override
  public String toString() {
    return displayName;
  }
}
