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

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import org.tessera.common.types.LogicalType;
import org.tessera.common.types.TimestampUnit;

/**
 * Conversions between the stored form of temporal values and java.time. All conversions are in UTC; a timestamp
 * timezone is carried as metadata only.
 */
public class DateUtilities {

  public static final long MILLIS_PER_DAY = 86_400_000L;
  private static final long NANOS_PER_SECOND = 1_000_000_000L;

  private DateUtilities() {
  }

  public static LocalDate epochDaysToLocalDate(long days) {
    return LocalDate.ofEpochDay(days);
  }

  public static LocalDate epochMillisToLocalDate(long millis) {
    return LocalDate.ofEpochDay(Math.floorDiv(millis, MILLIS_PER_DAY));
  }

  public static long localDateToEpochMillis(LocalDate date) {
    return Math.multiplyExact(date.toEpochDay(), MILLIS_PER_DAY);
  }

  /**
   * Returns a stored Date64 value as a LocalDate when it falls on midnight UTC, else as a LocalDateTime in UTC.
   */
  public static Object epochMillisToDate64Object(long millis) {
    if (Math.floorMod(millis, MILLIS_PER_DAY) == 0) {
      return epochMillisToLocalDate(millis);
    }
    return LocalDateTime.ofInstant(Instant.ofEpochMilli(millis), ZoneOffset.UTC);
  }

  public static long localDateTimeToEpochMillis(LocalDateTime dateTime) {
    return dateTime.toInstant(ZoneOffset.UTC).toEpochMilli();
  }

  public static Instant ticksToInstant(long ticks, TimestampUnit unit) {
    long perSecond = unit.ticksPerSecond();
    long seconds = Math.floorDiv(ticks, perSecond);
    long nanos = Math.floorMod(ticks, perSecond) * (NANOS_PER_SECOND / perSecond);
    return Instant.ofEpochSecond(seconds, nanos);
  }

  /**
   * Converts an instant into ticks, truncating precision finer than the unit.
   */
  public static long instantToTicks(Instant instant, TimestampUnit unit) {
    long perSecond = unit.ticksPerSecond();
    return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), perSecond),
        instant.getNano() / (NANOS_PER_SECOND / perSecond));
  }

  /**
   * Adds calendar months to a stored Date32, Date64 or Timestamp value. Days past the end of the target
   * month are clamped, as {@link LocalDate#plusMonths(long)} does.
   */
  public static long plusMonths(long value, LogicalType type, long months) {
    switch (type.getTypeId()) {
      case DATE32:
        return LocalDate.ofEpochDay(value).plusMonths(months).toEpochDay();
      case DATE64: {
        LocalDateTime dateTime = LocalDateTime.ofInstant(Instant.ofEpochMilli(value), ZoneOffset.UTC);
        return dateTime.plusMonths(months).toInstant(ZoneOffset.UTC).toEpochMilli();
      }
      case TIMESTAMP: {
        TimestampUnit unit = type.getTimestampUnit();
        LocalDateTime dateTime = LocalDateTime.ofInstant(ticksToInstant(value, unit), ZoneOffset.UTC);
        return instantToTicks(dateTime.plusMonths(months).toInstant(ZoneOffset.UTC), unit);
      }
      default:
        throw new IllegalArgumentException("Cannot add months to " + type);
    }
  }
}
