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
import java.util.Locale;
import java.util.Map;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;

/**
 * Static helpers over {@link LogicalType}.
 */
public class Types {

  private static final Map<String, TypeId> TYPES_BY_NAME;

  static {
    ImmutableMap.Builder<String, TypeId> builder = ImmutableMap.builder();
    for (TypeId typeId : TypeId.values()) {
      builder.put(typeId.getDisplayName().toLowerCase(Locale.ROOT), typeId);
    }
    TYPES_BY_NAME = builder.build();
  }

  private Types() {
  }

  /**
   * Parses the canonical form produced by {@link LogicalType#toString()}, for example {@code Int32},
   * {@code Timestamp(MILLISECOND, UTC)} or {@code Interval(DAY_TIME)}. Family names are case insensitive.
   *
   * @throws IllegalArgumentException if the text is not a logical type
   */
  public static LogicalType parse(String text) {
    if (text == null) {
      throw new IllegalArgumentException("Logical type name is null");
    }
    String trimmed = text.trim();
    int paren = trimmed.indexOf('(');
    String family = paren < 0 ? trimmed : trimmed.substring(0, paren).trim();
    TypeId typeId = TYPES_BY_NAME.get(family.toLowerCase(Locale.ROOT));
    if (typeId == null) {
      throw new IllegalArgumentException("Unknown logical type: " + text);
    }

    if (typeId != TypeId.TIMESTAMP && typeId != TypeId.INTERVAL) {
      if (paren >= 0) {
        throw new IllegalArgumentException(family + " takes no parameters: " + text);
      }
      return LogicalType.of(typeId);
    }

    if (paren < 0 || !trimmed.endsWith(")")) {
      throw new IllegalArgumentException(family + " requires parameters: " + text);
    }
    List<String> params = Splitter.on(',')
        .trimResults()
        .omitEmptyStrings()
        .splitToList(trimmed.substring(paren + 1, trimmed.length() - 1));

    if (typeId == TypeId.INTERVAL) {
      if (params.size() != 1) {
        throw new IllegalArgumentException("Interval takes one parameter: " + text);
      }
      return LogicalType.interval(parseEnum(IntervalUnit.class, params.get(0), text));
    }
    if (params.isEmpty() || params.size() > 2) {
      throw new IllegalArgumentException("Timestamp takes a unit and an optional timezone: " + text);
    }
    TimestampUnit unit = parseEnum(TimestampUnit.class, params.get(0), text);
    return LogicalType.timestamp(unit, params.size() == 2 ? params.get(1) : null);
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> enumClass, String name, String text) {
    try {
      return Enum.valueOf(enumClass, name.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid " + enumClass.getSimpleName() + " in " + text, e);
    }
  }

  /**
   * Temporal operands are only comparable when their logical types are identical, so that units never mix.
   */
  public static boolean isComparable(LogicalType left, LogicalType right) {
    if (left.equals(right)) {
      return true;
    }
    if (left.isTemporal() || right.isTemporal()) {
      return false;
    }
    if (left.isBinaryLike() && right.isBinaryLike()) {
      return true;
    }
    return TypePrecedence.getPromotionType(left.getTypeId(), right.getTypeId()).isPresent();
  }

  public static boolean isUnsigned(LogicalType type) {
    return type.isNumeric() && !type.getTypeId().isSigned();
  }
}
