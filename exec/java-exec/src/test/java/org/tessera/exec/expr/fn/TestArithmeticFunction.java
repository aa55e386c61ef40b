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
package org.tessera.exec.expr.fn;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Arrays;

import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.tessera.categories.SqlFunctionTest;
import org.tessera.common.exceptions.ErrorType;
import org.tessera.common.exceptions.UserException;
import org.tessera.common.types.LogicalType;
import org.tessera.common.types.TimestampUnit;
import org.tessera.exec.vector.Column;
import org.tessera.exec.vector.Columns;
import org.tessera.exec.vector.compute.ArithmeticOperator;
import org.tessera.exec.vector.compute.EvalContext;

import com.google.common.collect.ImmutableList;

@Category(SqlFunctionTest.class)
public class TestArithmeticFunction {

  private static LogicalType returnType(ArithmeticOperator op, LogicalType left, LogicalType right) {
    return new ArithmeticFunction(op).getReturnType(ImmutableList.of(left, right));
  }

  @Test
  public void testNumericReturnTypes() {
    assertEquals(LogicalType.INT64, returnType(ArithmeticOperator.ADD, LogicalType.INT32, LogicalType.INT64));
    assertEquals(LogicalType.FLOAT64, returnType(ArithmeticOperator.MULTIPLY, LogicalType.INT32, LogicalType.FLOAT32));
    assertEquals(LogicalType.INT64, returnType(ArithmeticOperator.SUBTRACT, LogicalType.UINT32, LogicalType.INT32));
    assertEquals(LogicalType.FLOAT64, returnType(ArithmeticOperator.DIVIDE, LogicalType.INT8, LogicalType.INT8));
    assertEquals(LogicalType.UINT16, returnType(ArithmeticOperator.REMAINDER, LogicalType.UINT8, LogicalType.UINT16));
  }

  @Test
  public void testTemporalReturnTypes() {
    LogicalType timestamp = LogicalType.timestamp(TimestampUnit.MICROSECOND);
    assertEquals(LogicalType.DATE32,
        returnType(ArithmeticOperator.ADD, LogicalType.DATE32, LogicalType.INTERVAL_DAY_TIME));
    assertEquals(timestamp,
        returnType(ArithmeticOperator.ADD, LogicalType.INTERVAL_YEAR_MONTH, timestamp));
    assertEquals(LogicalType.DATE64,
        returnType(ArithmeticOperator.SUBTRACT, LogicalType.DATE64, LogicalType.INTERVAL_YEAR_MONTH));
    assertEquals(LogicalType.INTERVAL_DAY_TIME,
        returnType(ArithmeticOperator.ADD, LogicalType.INTERVAL_DAY_TIME, LogicalType.INTERVAL_DAY_TIME));
    assertEquals(LogicalType.FLOAT64,
        returnType(ArithmeticOperator.DIVIDE, LogicalType.DATE32, LogicalType.DATE32));
  }

  @Test
  public void testReturnTypeMismatch() {
    try {
      returnType(ArithmeticOperator.SUBTRACT, LogicalType.INTERVAL_DAY_TIME, LogicalType.DATE32);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.TYPE_MISMATCH, e.getErrorType());
    }
    try {
      returnType(ArithmeticOperator.ADD, LogicalType.UTF8, LogicalType.INT32);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.TYPE_MISMATCH, e.getErrorType());
    }
  }

  @Test
  public void testReturnTypeMatchesResult() {
    ArithmeticFunction plus = new ArithmeticFunction(ArithmeticOperator.ADD);
    try (Column dates = Columns.date32(LocalDate.of(2021, 1, 1));
         Column days = Columns.intervalDayTime(Duration.ofDays(1));
         Column result = plus.eval(ImmutableList.of(dates, days), new EvalContext())) {
      assertEquals(plus.getReturnType(ImmutableList.of(dates.getLogicalType(), days.getLogicalType())),
          result.getLogicalType());
      assertEquals(Arrays.asList(LocalDate.of(2021, 1, 2)), TestFunctionRegistry.values(result));
    }
  }
}
