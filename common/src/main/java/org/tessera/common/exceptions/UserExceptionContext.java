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
package org.tessera.common.exceptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.google.common.collect.ImmutableList;

/**
 * Ordered context entries of a {@link UserException} plus its error id. An entry is either a named value, such
 * as the offending row, or a free text line. Entries render one per line below the error message.
 */
public class UserExceptionContext {

  private static class Entry {
    final String name;
    final String value;

    Entry(String name, String value) {
      this.name = name;
      this.value = value;
    }

    @Override
    public String toString() {
      return name == null ? value : name + ": " + value;
    }
  }

  private final String errorId = UUID.randomUUID().toString();
  private final List<Entry> entries = new ArrayList<>();

  UserExceptionContext() {
  }

  UserExceptionContext add(String line) {
    entries.add(new Entry(null, line));
    return this;
  }

  UserExceptionContext add(String name, String value) {
    entries.add(new Entry(name, value));
    return this;
  }

  UserExceptionContext add(String name, long value) {
    return add(name, Long.toString(value));
  }

  /**
   * Inserts a named value above every existing entry.
   */
  UserExceptionContext push(String name, String value) {
    entries.add(0, new Entry(name, value));
    return this;
  }

  UserExceptionContext push(String name, long value) {
    return push(name, Long.toString(value));
  }

  String getErrorId() {
    return errorId;
  }

  /**
   * @return the value of the first entry called {@code name}
   */
  public Optional<String> get(String name) {
    for (Entry entry : entries) {
      if (name.equals(entry.name)) {
        return Optional.of(entry.value);
      }
    }
    return Optional.empty();
  }

  /**
   * @return the rendered entries, top first
   */
  public List<String> getLines() {
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    for (Entry entry : entries) {
      lines.add(entry.toString());
    }
    return lines.build();
  }

  String generateContextMessage(boolean includeErrorId) {
    StringBuilder sb = new StringBuilder();
    for (Entry entry : entries) {
      sb.append(entry).append('\n');
    }
    if (includeErrorId) {
      sb.append("\n[Error Id: ").append(errorId).append(']');
    }
    return sb.toString();
  }
}
