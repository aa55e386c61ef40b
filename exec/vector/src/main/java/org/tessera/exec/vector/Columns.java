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
package org.tessera.exec.vector;

import java.time.Duration;
import java.time.LocalDate;
import java.time.Period;
import java.util.Arrays;
import java.util.List;

import org.tessera.common.types.LogicalType;
import org.tessera.common.types.TimestampUnit;

/**
 * Factories for small columns, mostly used by tests and by constant folding. A null element becomes a null
 * row.
 */
public final class Columns {

  private Columns() {
  }

  public static Column of(LogicalType type, Object... values) {
    return of(type, Arrays.asList(values));
  }

  public static Column of(LogicalType type, List<?> values) {
    try (ColumnBuilder builder = ColumnBuilder.create(type, values.size())) {
      for (Object value : values) {
        builder.appendObject(value);
      }
      return builder.build();
    }
  }

  public static Column int8(Byte... values) {
    return of(LogicalType.INT8, (Object[]) values);
  }

  public static Column int16(Short... values) {
    return of(LogicalType.INT16, (Object[]) values);
  }

  public static Column int32(Integer... values) {
    return of(LogicalType.INT32, (Object[]) values);
  }

  public static Column int64(Long... values) {
    return of(LogicalType.INT64, (Object[]) values);
  }

  public static Column uint8(Integer... values) {
    return of(LogicalType.UINT8, (Object[]) values);
  }

  public static Column uint16(Integer... values) {
    return of(LogicalType.UINT16, (Object[]) values);
  }

  public static Column uint32(Long... values) {
    return of(LogicalType.UINT32, (Object[]) values);
  }

  /**
   * @param values raw 64 bit patterns
   */
  public static Column uint64(Long... values) {
    return of(LogicalType.UINT64, (Object[]) values);
  }

  public static Column float32(Float... values) {
    return of(LogicalType.FLOAT32, (Object[]) values);
  }

  public static Column float64(Double... values) {
    return of(LogicalType.FLOAT64, (Object[]) values);
  }

  public static Column bool(Boolean... values) {
    return of(LogicalType.BOOLEAN, (Object[]) values);
  }

  public static Column utf8(String... values) {
    return of(LogicalType.UTF8, (Object[]) values);
  }

  public static Column binary(byte[]... values) {
    return of(LogicalType.BINARY, (Object[]) values);
  }

  public static Column date32(LocalDate... values) {
    return of(LogicalType.DATE32, (Object[]) values);
  }

  public static Column date64(LocalDate... values) {
    return of(LogicalType.DATE64, (Object[]) values);
  }

  /**
   * @param ticks values in {@code unit} since the epoch
   */
  public static Column timestamp(TimestampUnit unit, Long... ticks) {
    return of(LogicalType.timestamp(unit), (Object[]) ticks);
  }

  public static Column intervalDayTime(Duration... values) {
    return of(LogicalType.INTERVAL_DAY_TIME, (Object[]) values);
  }

  public static Column intervalYearMonth(Period... values) {
    return of(LogicalType.INTERVAL_YEAR_MONTH, (Object[]) values);
  }

  /**
   * Returns a column of logical length {@code valueCount} holding {@code value} in every row.
   */
  public static Column constant(ScalarValue value, int valueCount) {
    try (ColumnBuilder builder = ColumnBuilder.create(value.getType(), 1)) {
      builder.appendScalar(value);
      Column single = builder.build();
      return new Column(new ConstantColumn(single.getTypedColumn(), valueCount));
    }
  }

  public static Column nulls(LogicalType type, int valueCount) {
    return constant(ScalarValue.nullOf(type), valueCount);
  }
}
