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

import java.time.DateTimeException;

import org.tessera.common.exceptions.UserException;
import org.tessera.common.types.IntervalUnit;
import org.tessera.common.types.LogicalType;
import org.tessera.common.types.TypeId;
import org.tessera.exec.vector.Column;
import org.tessera.exec.vector.ColumnBuilder;
import org.tessera.exec.vector.Columns;
import org.tessera.exec.vector.DateUtilities;
import org.tessera.exec.vector.PhysicalTypeMapper;
import org.tessera.exec.vector.ScalarValue;
import org.tessera.exec.vector.TypedColumn;

/**
 * Arithmetic with date, timestamp and interval operands.
 * <ul>
 * <li>A day-time interval added to or subtracted from a date or timestamp is first rescaled into the unit of
 * that type (days for Date32, milliseconds for Date64, the timestamp unit), so the physical result restores to
 * the date or timestamp type. Subtraction negates the interval before rescaling and then adds, so
 * {@code d - i} and {@code d + (-i)} round to the same value.</li>
 * <li>A year-month interval moves dates and timestamps by calendar months, clamping to the end of the month.</li>
 * <li>Operands of one temporal type use their physical type directly.</li>
 * </ul>
 * Every other combination is a type mismatch.
 */
final class TemporalArithmetic {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(TemporalArithmetic.class);

  private TemporalArithmetic() {
  }

  static Column evaluate(ArithmeticOperator op, Column left, Column right, EvalContext context) {
    LogicalType leftType = left.getLogicalType();
    LogicalType rightType = right.getLogicalType();

    if (leftType.equals(rightType)) {
      logger.debug("Evaluating {} {} {} through its physical type", leftType, op.getSymbol(), rightType);
      return PhysicalTypeMapper.dispatch(left, right, (l, r) -> ArithmeticEvaluator.evaluate(op, l, r, context));
    }
    if (op == ArithmeticOperator.ADD && isInterval(leftType) && isPointInTime(rightType)) {
      return evaluate(op, right, left, context);
    }
    if ((op == ArithmeticOperator.ADD || op == ArithmeticOperator.SUBTRACT)
        && isPointInTime(leftType) && isInterval(rightType)) {
      if (rightType.getIntervalUnit() == IntervalUnit.DAY_TIME) {
        return addDayTime(op, left, right, context);
      }
      return addMonths(op, left, right);
    }
    throw ArithmeticEvaluator.mismatch(op, leftType, rightType);
  }

  private static boolean isInterval(LogicalType type) {
    return type.getTypeId() == TypeId.INTERVAL;
  }

  private static boolean isPointInTime(LogicalType type) {
    switch (type.getTypeId()) {
      case DATE32:
      case DATE64:
      case TIMESTAMP:
        return true;
      default:
        return false;
    }
  }

  private static Column addDayTime(ArithmeticOperator op, Column left, Column interval, EvalContext context) {
    LogicalType leftType = left.getLogicalType();
    logger.debug("Rescaling {} into {} for {}", interval.getLogicalType(), leftType, op.getSymbol());
    boolean negate = op == ArithmeticOperator.SUBTRACT;
    try (Column rescaled = rescale(interval, leftType, negate)) {
      return PhysicalTypeMapper.dispatch(left, rescaled,
          (l, r) -> ArithmeticEvaluator.evaluate(ArithmeticOperator.ADD, l, r, context));
    }
  }

  /**
   * Converts day-time interval milliseconds, negated first when {@code negate} is set, into the physical unit
   * of {@code target}. Rounding is toward negative infinity.
   */
  private static Column rescale(Column interval, LogicalType target, boolean negate) {
    LogicalType physical = PhysicalTypeMapper.physicalOf(target);
    TypedColumn typed = interval.getTypedColumn();
    int valueCount = typed.getValueCount();
    try {
      if (typed.isConstant()) {
        ScalarValue value = typed.isNull(0)
            ? ScalarValue.nullOf(physical)
            : ScalarValue.of(physical, rescaleMillis(signed(typed.getLong(0), negate), target));
        return Columns.constant(value, valueCount);
      }
      try (ColumnBuilder builder = ColumnBuilder.create(physical, valueCount)) {
        for (int i = 0; i < valueCount; i++) {
          if (typed.isNull(i)) {
            builder.appendNull();
          } else {
            builder.appendLong(rescaleMillis(signed(typed.getLong(i), negate), target));
          }
        }
        return builder.build();
      }
    } catch (ArithmeticException e) {
      throw UserException.functionError(e)
          .message("%s values do not fit into %s", interval.getLogicalType(), target)
          .build(logger);
    }
  }

  private static long signed(long millis, boolean negate) {
    return negate ? Math.negateExact(millis) : millis;
  }

  private static long rescaleMillis(long millis, LogicalType target) {
    switch (target.getTypeId()) {
      case DATE32:
        return Math.toIntExact(Math.floorDiv(millis, DateUtilities.MILLIS_PER_DAY));
      case DATE64:
        return millis;
      case TIMESTAMP:
        return target.getTimestampUnit().fromMillis(millis);
      default:
        throw new IllegalStateException("Unexpected temporal type " + target);
    }
  }

  private static Column addMonths(ArithmeticOperator op, Column left, Column interval) {
    LogicalType type = left.getLogicalType();
    TypedColumn l = left.getTypedColumn();
    TypedColumn r = interval.getTypedColumn();
    int valueCount = l.getValueCount();
    long sign = op == ArithmeticOperator.SUBTRACT ? -1 : 1;
    logger.debug("Adding calendar months to {}", type);
    try (ColumnBuilder builder = ColumnBuilder.create(type, valueCount)) {
      for (int i = 0; i < valueCount; i++) {
        if (l.isNull(i) || r.isNull(i)) {
          builder.appendNull();
          continue;
        }
        try {
          builder.appendLong(DateUtilities.plusMonths(l.getLong(i), type, sign * r.getLong(i)));
        } catch (DateTimeException | ArithmeticException e) {
          throw UserException.functionError(e)
              .message("%s %s %s is out of range at row %d", type, op.getSymbol(), interval.getLogicalType(), i)
              .addContext("Row", i)
              .build(logger);
        }
      }
      return builder.build();
    }
  }
}
