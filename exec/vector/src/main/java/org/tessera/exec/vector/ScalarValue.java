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

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Period;
import java.util.Arrays;
import java.util.Objects;

import org.tessera.common.types.LogicalType;

import com.google.common.base.Preconditions;
import com.google.common.primitives.UnsignedLong;

/**
 * A single typed value, or a typed null.
 * <p>Values are held as plain Java objects:
 * <ul>
 * <li>Int8, Int16, Int32, Int64: Byte, Short, Integer, Long</li>
 * <li>UInt8, UInt16, UInt32: Short, Integer, Long, widened so that they stay positive</li>
 * <li>UInt64: Long holding the raw 64 bits</li>
 * <li>Float32, Float64, Boolean: Float, Double, Boolean</li>
 * <li>Utf8: String, Binary: byte[]</li>
 * <li>Date32: LocalDate, Date64: LocalDate at midnight UTC, otherwise LocalDateTime in UTC</li>
 * <li>Timestamp: Instant</li>
 * <li>Interval(YEAR_MONTH): normalized Period, Interval(DAY_TIME): Duration</li>
 * </ul>
 */
public final class ScalarValue {

  private final LogicalType type;
  private final Object value;

  private ScalarValue(LogicalType type, Object value) {
    this.type = Preconditions.checkNotNull(type, "type");
    this.value = value;
  }

  public static ScalarValue nullOf(LogicalType type) {
    return new ScalarValue(type, null);
  }

  /**
   * Creates a value from any object {@link ColumnBuilder#appendObject(Object)} accepts for the type.
   */
  public static ScalarValue of(LogicalType type, Object value) {
    if (value == null) {
      return nullOf(type);
    }
    try (ColumnBuilder builder = ColumnBuilder.create(type, 1)) {
      builder.appendObject(value);
      try (Column column = builder.build()) {
        return fromColumn(column.getTypedColumn(), 0);
      }
    }
  }

  public static ScalarValue ofLong(long value) {
    return new ScalarValue(LogicalType.INT64, value);
  }

  public static ScalarValue ofDouble(double value) {
    return new ScalarValue(LogicalType.FLOAT64, value);
  }

  public static ScalarValue ofBoolean(boolean value) {
    return new ScalarValue(LogicalType.BOOLEAN, value);
  }

  public static ScalarValue ofString(String value) {
    return value == null ? nullOf(LogicalType.UTF8) : new ScalarValue(LogicalType.UTF8, value);
  }

  static ScalarValue fromColumn(TypedColumn column, int index) {
    LogicalType type = column.getLogicalType();
    if (column.isNull(index)) {
      return nullOf(type);
    }
    switch (type.getTypeId()) {
      case INT8:
        return new ScalarValue(type, (byte) column.getLong(index));
      case INT16:
      case UINT8:
        return new ScalarValue(type, (short) column.getLong(index));
      case INT32:
      case UINT16:
        return new ScalarValue(type, (int) column.getLong(index));
      case INT64:
      case UINT32:
      case UINT64:
        return new ScalarValue(type, column.getLong(index));
      case FLOAT32:
        return new ScalarValue(type, (float) column.getDouble(index));
      case FLOAT64:
        return new ScalarValue(type, column.getDouble(index));
      case BOOLEAN:
        return new ScalarValue(type, column.getBoolean(index));
      case UTF8:
        return new ScalarValue(type, new String(column.getBytes(index), StandardCharsets.UTF_8));
      case BINARY:
        return new ScalarValue(type, column.getBytes(index));
      case DATE32:
        return new ScalarValue(type, DateUtilities.epochDaysToLocalDate(column.getLong(index)));
      case DATE64:
        return new ScalarValue(type, DateUtilities.epochMillisToDate64Object(column.getLong(index)));
      case TIMESTAMP:
        return new ScalarValue(type, DateUtilities.ticksToInstant(column.getLong(index), type.getTimestampUnit()));
      case INTERVAL:
        switch (type.getIntervalUnit()) {
          case YEAR_MONTH:
            return new ScalarValue(type, Period.ofMonths((int) column.getLong(index)).normalized());
          case DAY_TIME:
            return new ScalarValue(type, Duration.ofMillis(column.getLong(index)));
          default:
            throw new IllegalStateException("Unexpected interval unit " + type.getIntervalUnit());
        }
      default:
        throw new IllegalStateException("Unexpected type " + type);
    }
  }

  public LogicalType getType() {
    return type;
  }

  public boolean isNull() {
    return value == null;
  }

  public Object getObject() {
    return value;
  }

  /**
   * Renders the value the way a cast to Utf8 does.
   */
  public String format() {
    if (value == null) {
      return null;
    }
    switch (type.getTypeId()) {
      case UINT64:
        return UnsignedLong.fromLongBits((Long) value).toString();
      case BINARY:
        return new String((byte[]) value, StandardCharsets.UTF_8);
      default:
        return value.toString();
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ScalarValue)) {
      return false;
    }
    ScalarValue that = (ScalarValue) o;
    if (!type.equals(that.type)) {
      return false;
    }
    if (value instanceof byte[] && that.value instanceof byte[]) {
      return Arrays.equals((byte[]) value, (byte[]) that.value);
    }
    return Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return 31 * type.hashCode() + (value instanceof byte[] ? Arrays.hashCode((byte[]) value) : Objects.hashCode(value));
  }

  @Override
  public String toString() {
    return type + "(" + (value == null ? "NULL" : format()) + ")";
  }
}
