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

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lists which casts are possible at all. Whether a particular value survives a permitted cast is decided per
 * row when the cast runs.
 */
public class CastRules {

  /** target type family -> families it can be cast from */
  private static final Map<TypeId, Set<TypeId>> rules = new EnumMap<>(TypeId.class);

  static {
    initTypeRules();
  }

  private CastRules() {
  }

  private static void initTypeRules() {
    Set<TypeId> numeric = EnumSet.noneOf(TypeId.class);
    for (TypeId typeId : TypeId.values()) {
      if (typeId.isNumeric()) {
        numeric.add(typeId);
      }
    }

    Set<TypeId> rule;

    /** integers cast able from **/
    for (TypeId typeId : TypeId.values()) {
      if (!typeId.isInteger()) {
        continue;
      }
      rule = EnumSet.copyOf(numeric);
      rule.add(TypeId.BOOLEAN);
      rule.add(TypeId.UTF8);
      rule.add(TypeId.DATE32);
      rule.add(TypeId.DATE64);
      rule.add(TypeId.TIMESTAMP);
      rule.add(TypeId.INTERVAL);
      rules.put(typeId, rule);
    }

    /** floats cast able from **/
    rule = EnumSet.copyOf(numeric);
    rule.add(TypeId.BOOLEAN);
    rule.add(TypeId.UTF8);
    rules.put(TypeId.FLOAT32, rule);
    rules.put(TypeId.FLOAT64, EnumSet.copyOf(rule));

    /** BOOLEAN cast able from **/
    rule = EnumSet.noneOf(TypeId.class);
    rule.add(TypeId.BOOLEAN);
    rule.addAll(numeric);
    rule.add(TypeId.UTF8);
    rules.put(TypeId.BOOLEAN, rule);

    /** UTF8 cast able from everything **/
    rules.put(TypeId.UTF8, EnumSet.allOf(TypeId.class));

    /** BINARY cast able from **/
    rule = EnumSet.of(TypeId.BINARY, TypeId.UTF8);
    rules.put(TypeId.BINARY, rule);

    /** DATE32, DATE64 and TIMESTAMP cast able from **/
    rule = EnumSet.of(TypeId.DATE32, TypeId.DATE64, TypeId.TIMESTAMP, TypeId.UTF8);
    for (TypeId typeId : numeric) {
      if (typeId.isInteger()) {
        rule.add(typeId);
      }
    }
    rules.put(TypeId.DATE32, rule);
    rules.put(TypeId.DATE64, EnumSet.copyOf(rule));
    rules.put(TypeId.TIMESTAMP, EnumSet.copyOf(rule));

    /** INTERVAL cast able from **/
    rule = EnumSet.of(TypeId.INTERVAL, TypeId.UTF8);
    for (TypeId typeId : numeric) {
      if (typeId.isInteger()) {
        rule.add(typeId);
      }
    }
    rules.put(TypeId.INTERVAL, rule);
  }

  public static boolean isCastable(TypeId from, TypeId to) {
    Set<TypeId> rule = rules.get(to);
    return rule != null && rule.contains(from);
  }

  /**
   * Intervals of different units measure different things (months versus milliseconds) and never convert.
   */
  public static boolean isCastable(LogicalType from, LogicalType to) {
    if (from.equals(to)) {
      return true;
    }
    if (from.getTypeId() == TypeId.INTERVAL && to.getTypeId() == TypeId.INTERVAL) {
      return false;
    }
    return isCastable(from.getTypeId(), to.getTypeId());
  }
}
