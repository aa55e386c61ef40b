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
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;

/**
 * Semantic type of a column. Immutable; two logical types are equal when their {@link TypeId} and all
 * parameters are equal.
 * <p>Date, timestamp and interval types have no native primitive representation. They are backed by the
 * integer type reported by {@code PhysicalTypeMapper}.
 */
public final class LogicalType {

  public static final LogicalType INT8 = new LogicalType(TypeId.INT8, null, null, null);
  public static final LogicalType INT16 = new LogicalType(TypeId.INT16, null, null, null);
  public static final LogicalType INT32 = new LogicalType(TypeId.INT32, null, null, null);
  public static final LogicalType INT64 = new LogicalType(TypeId.INT64, null, null, null);
  public static final LogicalType UINT8 = new LogicalType(TypeId.UINT8, null, null, null);
  public static final LogicalType UINT16 = new LogicalType(TypeId.UINT16, null, null, null);
  public static final LogicalType UINT32 = new LogicalType(TypeId.UINT32, null, null, null);
  public static final LogicalType UINT64 = new LogicalType(TypeId.UINT64, null, null, null);
  public static final LogicalType FLOAT32 = new LogicalType(TypeId.FLOAT32, null, null, null);
  public static final LogicalType FLOAT64 = new LogicalType(TypeId.FLOAT64, null, null, null);
  public static final LogicalType BOOLEAN = new LogicalType(TypeId.BOOLEAN, null, null, null);
  public static final LogicalType UTF8 = new LogicalType(TypeId.UTF8, null, null, null);
  public static final LogicalType BINARY = new LogicalType(TypeId.BINARY, null, null, null);
  public static final LogicalType DATE32 = new LogicalType(TypeId.DATE32, null, null, null);
  public static final LogicalType DATE64 = new LogicalType(TypeId.DATE64, null, null, null);
  public static final LogicalType INTERVAL_YEAR_MONTH =
      new LogicalType(TypeId.INTERVAL, null, null, IntervalUnit.YEAR_MONTH);
  public static final LogicalType INTERVAL_DAY_TIME =
      new LogicalType(TypeId.INTERVAL, null, null, IntervalUnit.DAY_TIME);

  private final TypeId typeId;
  private final TimestampUnit timestampUnit;
  private final String timezone;
  private final IntervalUnit intervalUnit;

  private LogicalType(TypeId typeId, TimestampUnit timestampUnit, String timezone, IntervalUnit intervalUnit) {
    this.typeId = typeId;
    this.timestampUnit = timestampUnit;
    this.timezone = timezone;
    this.intervalUnit = intervalUnit;
  }

  public static LogicalType timestamp(TimestampUnit unit) {
    return timestamp(unit, null);
  }

  public static LogicalType timestamp(TimestampUnit unit, String timezone) {
    Preconditions.checkNotNull(unit, "timestamp unit");
    return new LogicalType(TypeId.TIMESTAMP, unit, timezone, null);
  }

  public static LogicalType interval(IntervalUnit unit) {
    Preconditions.checkNotNull(unit, "interval unit");
    return unit == IntervalUnit.YEAR_MONTH ? INTERVAL_YEAR_MONTH : INTERVAL_DAY_TIME;
  }

  /**
   * Returns the logical type of a family that takes no parameters.
   *
   * @throws IllegalArgumentException for {@link TypeId#TIMESTAMP} and {@link TypeId#INTERVAL}
   */
  public static LogicalType of(TypeId typeId) {
    switch (typeId) {
      case INT8: return INT8;
      case INT16: return INT16;
      case INT32: return INT32;
      case INT64: return INT64;
      case UINT8: return UINT8;
      case UINT16: return UINT16;
      case UINT32: return UINT32;
      case UINT64: return UINT64;
      case FLOAT32: return FLOAT32;
      case FLOAT64: return FLOAT64;
      case BOOLEAN: return BOOLEAN;
      case UTF8: return UTF8;
      case BINARY: return BINARY;
      case DATE32: return DATE32;
      case DATE64: return DATE64;
      default:
        throw new IllegalArgumentException(typeId.getDisplayName() + " requires parameters");
    }
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static LogicalType valueOf(String name) {
    return Types.parse(name);
  }

  public TypeId getTypeId() {
    return typeId;
  }

  /**
   * @return the unit of a timestamp type, null for every other family
   */
  public TimestampUnit getTimestampUnit() {
    return timestampUnit;
  }

  /**
   * @return the timezone of a timestamp type, null when absent
   */
  public String getTimezone() {
    return timezone;
  }

  public IntervalUnit getIntervalUnit() {
    return intervalUnit;
  }

  /**
   * @return width in bytes of one element, 0 for Boolean and -1 for variable width types
   */
  public int getByteWidth() {
    if (typeId == TypeId.INTERVAL) {
      return intervalUnit == IntervalUnit.YEAR_MONTH ? 4 : 8;
    }
    return typeId.getByteWidth();
  }

  public boolean isFixedWidth() {
    return getByteWidth() > 0;
  }

  /**
   * @return true when values of this type are stored in their native primitive form
   */
  public boolean isPhysical() {
    return !typeId.isTemporal();
  }

  public boolean isNumeric() {
    return typeId.isNumeric();
  }

  public boolean isTemporal() {
    return typeId.isTemporal();
  }

  public boolean isBinaryLike() {
    return typeId.isBinaryLike();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof LogicalType)) {
      return false;
    }
    LogicalType that = (LogicalType) obj;
    return typeId == that.typeId
        && timestampUnit == that.timestampUnit
        && Objects.equals(timezone, that.timezone)
        && intervalUnit == that.intervalUnit;
  }

  @Override
  public int hashCode() {
    return Objects.hash(typeId, timestampUnit, timezone, intervalUnit);
  }

  @JsonValue
  @Override
  public String toString() {
    switch (typeId) {
      case TIMESTAMP:
        return timezone == null
            ? typeId.getDisplayName() + "(" + timestampUnit + ")"
            : typeId.getDisplayName() + "(" + timestampUnit + ", " + timezone + ")";
      case INTERVAL:
        return typeId.getDisplayName() + "(" + intervalUnit + ")";
      default:
        return typeId.getDisplayName();
    }
  }
}
