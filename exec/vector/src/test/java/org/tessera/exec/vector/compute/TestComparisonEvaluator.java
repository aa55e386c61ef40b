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
package org.tessera.exec.vector.compute;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.tessera.categories.VectorTest;
import org.tessera.common.exceptions.ErrorType;
import org.tessera.common.exceptions.UserException;
import org.tessera.common.types.LogicalType;
import org.tessera.common.types.TimestampUnit;
import org.tessera.common.types.TypeId;
import org.tessera.exec.vector.Column;
import org.tessera.exec.vector.Columns;
import org.tessera.exec.vector.ScalarValue;

@Category(VectorTest.class)
public class TestComparisonEvaluator {

  static List<Object> values(Column column) {
    List<Object> values = new ArrayList<>();
    for (int i = 0; i < column.getValueCount(); i++) {
      values.add(column.getObject(i));
    }
    return values;
  }

  private static List<Object> compare(ComparisonOperator op, Column left, Column right) {
    try (Column result = ComparisonEvaluator.evaluate(op, left, right)) {
      assertEquals(LogicalType.BOOLEAN, result.getLogicalType());
      assertEquals(left.getValueCount(), result.getValueCount());
      return values(result);
    }
  }

  private static List<Column> nonNullColumns() {
    return Arrays.asList(
        Columns.int8((byte) -1, (byte) 7),
        Columns.int16((short) 300, (short) -300),
        Columns.int32(1, Integer.MIN_VALUE),
        Columns.int64(Long.MAX_VALUE, 0L),
        Columns.uint8(255, 0),
        Columns.uint16(65535, 1),
        Columns.uint32(4_000_000_000L, 2L),
        Columns.uint64(-1L, 3L),
        Columns.float32(Float.NaN, -0.0f),
        Columns.float64(Double.NaN, Double.NEGATIVE_INFINITY),
        Columns.bool(true, false),
        Columns.utf8("Abc", ""),
        Columns.binary(new byte[] {(byte) 0xFF}, new byte[0]),
        Columns.date32(LocalDate.of(2021, 1, 1), LocalDate.of(1969, 12, 31)),
        Columns.date64(LocalDate.of(2021, 1, 1), LocalDate.of(2021, 6, 15)),
        Columns.timestamp(TimestampUnit.NANOSECOND, 1L, -1L),
        Columns.intervalDayTime(Duration.ofDays(1), Duration.ZERO),
        Columns.intervalYearMonth(Period.ofMonths(3), Period.ofYears(-1)));
  }

  @Test
  public void testReflexivity() {
    for (Column column : nonNullColumns()) {
      try (Column c = column) {
        assertEquals(c.toString(), Arrays.asList(true, true), compare(ComparisonOperator.EQ, c, c));
        assertEquals(c.toString(), Arrays.asList(true, true), compare(ComparisonOperator.LTE, c, c));
        assertEquals(c.toString(), Arrays.asList(false, false), compare(ComparisonOperator.NEQ, c, c));
      }
    }
  }

  @Test
  public void testNullPropagation() {
    for (ComparisonOperator op : ComparisonOperator.values()) {
      try (Column left = Columns.int32(1, null, 3);
           Column right = Columns.int64(null, 2L, 3L);
           Column sameType = Columns.int32(null, 2, 3)) {
        List<Object> promoted = compare(op, left, right);
        assertNull(promoted.get(0));
        assertNull(promoted.get(1));
        assertEquals(op.test(0), promoted.get(2));

        List<Object> lanes = compare(op, left, sameType);
        assertNull(lanes.get(0));
        assertNull(lanes.get(1));
        assertEquals(op.test(0), lanes.get(2));
      }
      try (Column left = Columns.utf8("a", null);
           Column right = Columns.utf8(null, "a")) {
        assertEquals(Arrays.asList(null, null), compare(op, left, right));
      }
      try (Column left = Columns.bool(true, null);
           Column right = Columns.bool(null, false)) {
        assertEquals(Arrays.asList(null, null), compare(op, left, right));
      }
    }
  }

  @Test
  public void testPromotion() {
    try (Column left = Columns.int32(1, 2, 3);
         Column right = Columns.int64(1L, 2L, 4L)) {
      assertEquals(Arrays.asList(true, true, false), compare(ComparisonOperator.EQ, left, right));
      assertEquals(Arrays.asList(false, false, true), compare(ComparisonOperator.LT, left, right));
    }
    try (Column unsigned = Columns.uint32(4_000_000_000L);
         Column signed = Columns.int32(-1)) {
      assertEquals(Arrays.asList(true), compare(ComparisonOperator.GT, unsigned, signed));
    }
    try (Column max = Columns.uint64(-1L);
         Column one = Columns.uint64(1L)) {
      assertEquals(Arrays.asList(true), compare(ComparisonOperator.GT, max, one));
    }
    try (Column ints = Columns.int32(1, 2);
         Column floats = Columns.float32(1.0f, 2.5f)) {
      assertEquals(Arrays.asList(true, false), compare(ComparisonOperator.EQ, ints, floats));
    }
  }

  @Test
  public void testFloatTotalOrder() {
    try (Column left = Columns.float64(Double.NaN, -0.0, 1.0, Double.NaN);
         Column right = Columns.float64(Double.NaN, 0.0, Double.NaN, Double.POSITIVE_INFINITY)) {
      assertEquals(Arrays.asList(true, true, false, false), compare(ComparisonOperator.EQ, left, right));
      assertEquals(Arrays.asList(false, false, true, false), compare(ComparisonOperator.LT, left, right));
      assertEquals(Arrays.asList(false, false, false, true), compare(ComparisonOperator.GT, left, right));
    }
    try (Column left = Columns.float32(Float.NaN, -0.0f);
         Column right = Columns.float64(Double.NaN, 0.0)) {
      assertEquals(Arrays.asList(true, true), compare(ComparisonOperator.EQ, left, right));
    }
  }

  @Test
  public void testLanesAgreeWithPromotion() {
    Integer[] a = new Integer[200];
    Integer[] b = new Integer[200];
    for (int i = 0; i < a.length; i++) {
      a[i] = i % 11 == 0 ? null : i % 7;
      b[i] = i % 13 == 0 ? null : i % 5;
    }
    try (Column left = Columns.int32(a);
         Column right = Columns.int32(b);
         Column leftSlice = left.slice(3, 150);
         Column rightSlice = right.slice(5, 150);
         Column rightWide = rightSlice.castTo(LogicalType.INT64)) {
      for (ComparisonOperator op : ComparisonOperator.values()) {
        List<Object> lanes = compare(op, leftSlice, rightSlice);
        List<Object> promoted = compare(op, leftSlice, rightWide);
        assertEquals(op.toString(), promoted, lanes);
        for (int i = 0; i < 150; i++) {
          Integer l = a[3 + i];
          Integer r = b[5 + i];
          Object expected = l == null || r == null ? null : op.test(Integer.compare(l, r));
          assertEquals(op + " row " + i, expected, lanes.get(i));
        }
      }
    }
  }

  @Test
  public void testBooleanWordWise() {
    try (Column left = Columns.bool(true, false);
         Column right = Columns.bool(true, true)) {
      assertEquals(Arrays.asList(true, false), compare(ComparisonOperator.EQ, left, right));
      assertEquals(Arrays.asList(false, true), compare(ComparisonOperator.NEQ, left, right));
      assertEquals(Arrays.asList(false, true), compare(ComparisonOperator.LT, left, right));
      assertEquals(Arrays.asList(true, true), compare(ComparisonOperator.LTE, left, right));
      assertEquals(Arrays.asList(false, false), compare(ComparisonOperator.GT, left, right));
      assertEquals(Arrays.asList(true, false), compare(ComparisonOperator.GTE, left, right));
    }
  }

  @Test
  public void testBooleanWithConstant() {
    try (Column column = Columns.bool(true, false, null);
         Column yes = Columns.constant(ScalarValue.ofBoolean(true), 3);
         Column no = Columns.constant(ScalarValue.ofBoolean(false), 3);
         Column unknown = Columns.nulls(LogicalType.BOOLEAN, 3)) {
      assertEquals(values(column), compare(ComparisonOperator.EQ, column, yes));
      assertEquals(Arrays.asList(false, true, null), compare(ComparisonOperator.EQ, column, no));
      assertEquals(Arrays.asList(false, true, null), compare(ComparisonOperator.NEQ, column, yes));
      assertEquals(values(column), compare(ComparisonOperator.NEQ, column, no));
      assertEquals(Arrays.asList(true, true, null), compare(ComparisonOperator.GTE, column, no));
      assertEquals(Arrays.asList(false, true, null), compare(ComparisonOperator.LT, column, yes));
      assertEquals(Arrays.asList(true, false, null), compare(ComparisonOperator.LT, no, column));
      assertEquals(Arrays.asList(true, false, null), compare(ComparisonOperator.EQ, yes, column));
      assertEquals(Arrays.asList(null, null, null), compare(ComparisonOperator.EQ, column, unknown));
      assertEquals(Arrays.asList(true, true, true), compare(ComparisonOperator.EQ, yes, yes));
    }
  }

  @Test
  public void testRawBytes() {
    try (Column left = Columns.utf8("Abc");
         Column same = Columns.utf8("Abc");
         Column lower = Columns.utf8("abc")) {
      assertEquals(Arrays.asList(true), compare(ComparisonOperator.EQ, left, same));
      assertEquals(Arrays.asList(false), compare(ComparisonOperator.EQ, left, lower));
      assertEquals(Arrays.asList(true), compare(ComparisonOperator.LT, left, lower));
    }
    try (Column utf8 = Columns.utf8("a", "b", "ab");
         Column binary = Columns.binary(bytes("b"), bytes("a"), bytes("a"))) {
      assertEquals(Arrays.asList(true, false, false), compare(ComparisonOperator.LT, utf8, binary));
      assertEquals(Arrays.asList(false, true, true), compare(ComparisonOperator.GT, utf8, binary));
    }
    try (Column column = Columns.utf8("b", "a", null);
         Column constant = Columns.constant(ScalarValue.ofString("a"), 3)) {
      assertEquals(Arrays.asList(true, false, null), compare(ComparisonOperator.GT, column, constant));
      assertEquals(Arrays.asList(true, false, null), compare(ComparisonOperator.LT, constant, column));
      assertEquals(Arrays.asList(false, true, null), compare(ComparisonOperator.EQ, constant, column));
    }
  }

  private static byte[] bytes(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  public void testTemporal() {
    try (Column dates = Columns.date64(LocalDate.of(2021, 1, 1), LocalDate.of(2021, 6, 15))) {
      assertEquals(Arrays.asList(true, true), compare(ComparisonOperator.EQ, dates, dates));
    }
    try (Column left = Columns.date32(LocalDate.of(2021, 1, 1), LocalDate.of(2021, 1, 3));
         Column right = Columns.date32(LocalDate.of(2021, 1, 2), LocalDate.of(2021, 1, 2))) {
      assertEquals(Arrays.asList(true, false), compare(ComparisonOperator.LT, left, right));
    }
  }

  @Test
  public void testNumericWithConstant() {
    try (Column column = Columns.int32(1, 5, null);
         Column three = Columns.constant(ScalarValue.ofLong(3), 3)) {
      assertEquals(Arrays.asList(false, true, null), compare(ComparisonOperator.GT, column, three));
      assertEquals(Arrays.asList(true, false, null), compare(ComparisonOperator.GT, three, column));
    }
  }

  @Test
  public void testTypeMismatch() {
    expectMismatch(Columns.date32(LocalDate.of(2021, 1, 1)), Columns.date64(LocalDate.of(2021, 1, 1)));
    expectMismatch(Columns.timestamp(TimestampUnit.SECOND, 1L), Columns.timestamp(TimestampUnit.MILLISECOND, 1L));
    expectMismatch(Columns.date32(LocalDate.of(2021, 1, 1)), Columns.int32(1));
    expectMismatch(Columns.bool(true), Columns.int32(1));
    expectMismatch(Columns.utf8("1"), Columns.int32(1));
  }

  private static void expectMismatch(Column left, Column right) {
    try (Column l = left; Column r = right) {
      ComparisonEvaluator.evaluate(ComparisonOperator.EQ, l, r).close();
      fail("expected a type mismatch for " + l + " and " + r);
    } catch (UserException e) {
      assertEquals(ErrorType.TYPE_MISMATCH, e.getErrorType());
      assertTrue(e.getOriginalMessage().contains(left.getLogicalType().toString()));
      assertTrue(e.getOriginalMessage().contains(right.getLogicalType().toString()));
    }
  }

  @Test
  public void testLengthMismatch() {
    try (Column left = Columns.int32(1, 2);
         Column right = Columns.int32(1)) {
      ComparisonEvaluator.evaluate(ComparisonOperator.EQ, left, right);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.FUNCTION, e.getErrorType());
    }
  }

  @Test
  public void testLaneCapability() {
    assertTrue(LaneKernels.supports(TypeId.INT8, ComparisonOperator.LT));
    assertTrue(LaneKernels.supports(TypeId.FLOAT64, ComparisonOperator.EQ));
    assertFalse(LaneKernels.supports(TypeId.UINT32, ComparisonOperator.EQ));
    assertFalse(LaneKernels.supports(TypeId.UTF8, ComparisonOperator.EQ));
  }
}
