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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Period;
import java.time.ZoneOffset;

import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.tessera.categories.VectorTest;
import org.tessera.common.exceptions.ErrorType;
import org.tessera.common.exceptions.UserException;
import org.tessera.common.types.LogicalType;
import org.tessera.common.types.TimestampUnit;

@Category(VectorTest.class)
public class TestColumnCaster {

  private static void assertCast(Column source, LogicalType target, Object... expected) {
    try (Column cast = source.castTo(target)) {
      assertEquals(target, cast.getLogicalType());
      assertEquals(expected.length, cast.getValueCount());
      for (int i = 0; i < expected.length; i++) {
        if (expected[i] instanceof byte[]) {
          assertArrayEquals((byte[]) expected[i], (byte[]) cast.getObject(i));
        } else {
          assertEquals("row " + i, expected[i], cast.getObject(i));
        }
      }
    } finally {
      source.close();
    }
  }

  private static UserException assertCastFails(Column source, LogicalType target) {
    try (Column cast = source.castTo(target)) {
      fail("expected " + source.getLogicalType() + " to " + target + " to fail, got " + cast);
      return null;
    } catch (UserException e) {
      assertEquals(ErrorType.UNSUPPORTED_CAST, e.getErrorType());
      return e;
    } finally {
      source.close();
    }
  }

  @Test
  public void testSameTypeIsAView() {
    assertCast(Columns.int32(1, null), LogicalType.INT32, 1, null);
  }

  @Test
  public void testWidening() {
    assertCast(Columns.int32(1, null, -3), LogicalType.INT64, 1L, null, -3L);
    assertCast(Columns.uint8(200), LogicalType.INT16, (short) 200);
    assertCast(Columns.int32(16_777_216), LogicalType.FLOAT32, 16_777_216f);
    assertCast(Columns.float32(0.1f), LogicalType.FLOAT64, (double) 0.1f);
  }

  @Test
  public void testNarrowingChecksEveryValue() {
    assertCast(Columns.int64(1L, 2L), LogicalType.INT32, 1, 2);
    UserException e = assertCastFails(Columns.int64(1L, 1L << 40), LogicalType.INT32);
    assertThat(e.getOriginalMessage(), containsString("Int64"));
    assertThat(e.getOriginalMessage(), containsString("Int32"));
    assertThat(e.getOriginalMessage(), containsString("row 1"));

    assertCastFails(Columns.int32(-1), LogicalType.UINT32);
    assertCastFails(Columns.uint64(-1L), LogicalType.INT64);
    assertCastFails(Columns.int16((short) 300), LogicalType.UINT8);
    assertCast(Columns.uint64(Long.MAX_VALUE), LogicalType.INT64, Long.MAX_VALUE);
  }

  @Test
  public void testFloatingPointExactness() {
    assertCast(Columns.float64(2.0, -8.0), LogicalType.INT32, 2, -8);
    assertCastFails(Columns.float64(1.5), LogicalType.INT32);
    assertCastFails(Columns.float64(Double.NaN), LogicalType.INT64);
    assertCastFails(Columns.float64(0.1), LogicalType.FLOAT32);
    assertCastFails(Columns.int64((1L << 53) + 1), LogicalType.FLOAT64);
    assertCastFails(Columns.uint64(-1L), LogicalType.FLOAT64);
    assertCast(Columns.float64(Double.NaN, Double.POSITIVE_INFINITY), LogicalType.FLOAT32,
        Float.NaN, Float.POSITIVE_INFINITY);
  }

  @Test
  public void testBooleanConversions() {
    assertCast(Columns.bool(true, false, null), LogicalType.INT32, 1, 0, null);
    assertCast(Columns.int8((byte) 1, (byte) 0), LogicalType.BOOLEAN, true, false);
    assertCast(Columns.bool(true), LogicalType.FLOAT64, 1.0);
    UserException e = assertCastFails(Columns.int32(0, 1, 2), LogicalType.BOOLEAN);
    assertThat(e.getOriginalMessage(), containsString("row 2"));
  }

  @Test
  public void testToUtf8() {
    assertCast(Columns.int32(42, null), LogicalType.UTF8, "42", null);
    assertCast(Columns.float64(1.5), LogicalType.UTF8, "1.5");
    assertCast(Columns.bool(true), LogicalType.UTF8, "true");
    assertCast(Columns.uint64(-1L), LogicalType.UTF8, "18446744073709551615");
    assertCast(Columns.date32(LocalDate.of(2021, 1, 1)), LogicalType.UTF8, "2021-01-01");
    assertCast(Columns.intervalDayTime(Duration.ofHours(26)), LogicalType.UTF8, "PT26H");
  }

  @Test
  public void testFromUtf8() {
    assertCast(Columns.utf8(" 42 ", "-7", null), LogicalType.INT8, (byte) 42, (byte) -7, null);
    assertCast(Columns.utf8("1.5"), LogicalType.FLOAT64, 1.5);
    assertCast(Columns.utf8("TRUE", "false"), LogicalType.BOOLEAN, true, false);
    assertCast(Columns.utf8("2021-01-01"), LogicalType.DATE32, LocalDate.of(2021, 1, 1));
    assertCast(Columns.utf8("2021-01-01T00:00:01Z"), LogicalType.timestamp(TimestampUnit.SECOND),
        Instant.parse("2021-01-01T00:00:01Z"));
    assertCast(Columns.utf8("PT24H"), LogicalType.INTERVAL_DAY_TIME, Duration.ofDays(1));
    assertCast(Columns.utf8("P1Y2M"), LogicalType.INTERVAL_YEAR_MONTH, Period.of(1, 2, 0));
    assertCastFails(Columns.utf8("abc"), LogicalType.INT32);
    assertCastFails(Columns.utf8("300"), LogicalType.INT8);
    assertCastFails(Columns.utf8("yes"), LogicalType.BOOLEAN);
    assertCastFails(Columns.utf8("2021-13-01"), LogicalType.DATE64);
  }

  @Test
  public void testBinaryAndUtf8() {
    byte[] abc = "abc".getBytes(StandardCharsets.UTF_8);
    assertCast(Columns.utf8("abc"), LogicalType.BINARY, (Object) abc);
    assertCast(Columns.binary(abc, null), LogicalType.UTF8, "abc", null);
    assertCastFails(Columns.binary(new byte[] {(byte) 0xFF, (byte) 0xFE}), LogicalType.UTF8);
  }

  @Test
  public void testTemporalReinterpretation() {
    LocalDate date = LocalDate.of(2021, 1, 1);
    assertCast(Columns.date32(date), LogicalType.INT32, (int) date.toEpochDay());
    assertCast(Columns.int32((int) date.toEpochDay()), LogicalType.DATE32, date);
    assertCast(Columns.intervalYearMonth(Period.ofMonths(14)), LogicalType.INT32, 14);
    assertCast(Columns.int64(86_400_000L), LogicalType.INTERVAL_DAY_TIME, Duration.ofDays(1));
  }

  @Test
  public void testTemporalRescaling() {
    LocalDate date = LocalDate.of(2021, 6, 15);
    assertCast(Columns.date32(date), LogicalType.DATE64, date);
    assertCast(Columns.date64(date), LogicalType.DATE32, date);
    assertCast(Columns.timestamp(TimestampUnit.SECOND, 1L), LogicalType.timestamp(TimestampUnit.MILLISECOND),
        Instant.ofEpochSecond(1));
    assertCast(Columns.date32(date), LogicalType.timestamp(TimestampUnit.MICROSECOND),
        date.atStartOfDay().toInstant(ZoneOffset.UTC));
    assertCastFails(Columns.timestamp(TimestampUnit.MILLISECOND, 1500L), LogicalType.timestamp(TimestampUnit.SECOND));
    assertCastFails(Columns.of(LogicalType.DATE64, 1L), LogicalType.DATE32);
    assertCastFails(Columns.of(LogicalType.DATE64, LocalDateTime.of(2021, 1, 1, 1, 0)), LogicalType.DATE32);
    assertCastFails(Columns.int64(1L << 40), LogicalType.DATE32);
  }

  @Test
  public void testDate64TimeOfDayText() {
    LocalDateTime dateTime = LocalDateTime.of(2021, 1, 1, 1, 30);
    assertCast(Columns.of(LogicalType.DATE64, dateTime), LogicalType.UTF8, "2021-01-01T01:30");
    assertCast(Columns.utf8("2021-01-01T01:30", "2021-01-02"), LogicalType.DATE64,
        dateTime, LocalDate.of(2021, 1, 2));
  }

  @Test
  public void testCastsWithoutRule() {
    UserException e = assertCastFails(Columns.bool(true), LogicalType.DATE32);
    assertEquals("Cannot cast Boolean to Date32", e.getOriginalMessage());
    assertCastFails(Columns.intervalYearMonth(Period.ofMonths(1)), LogicalType.INTERVAL_DAY_TIME);
    assertCastFails(Columns.date32(LocalDate.of(2021, 1, 1)), LogicalType.FLOAT64);
    assertCastFails(Columns.int32(1), LogicalType.BINARY);
  }

  @Test
  public void testConstantStaysConstant() {
    try (Column constant = Columns.constant(ScalarValue.of(LogicalType.INT64, 5L), 3);
         Column cast = constant.castTo(LogicalType.INT32)) {
      assertTrue(cast.isConstant());
      assertEquals(3, cast.getValueCount());
      assertEquals(ScalarValue.of(LogicalType.INT32, 5), cast.tryGet(2));
    }
    try (Column nulls = Columns.nulls(LogicalType.UTF8, 2);
         Column cast = nulls.castTo(LogicalType.INT32)) {
      assertNull(cast.getObject(1));
      assertEquals(2, cast.getNullCount());
    }
  }
}
