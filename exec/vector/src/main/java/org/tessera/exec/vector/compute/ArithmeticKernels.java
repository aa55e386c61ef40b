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

import org.tessera.common.exceptions.UserException;
import org.tessera.common.types.LogicalType;
import org.tessera.common.types.TypeId;
import org.tessera.exec.vector.Column;
import org.tessera.exec.vector.ColumnBuilder;
import org.tessera.exec.vector.TypedColumn;

/**
 * Row by row arithmetic in the promotion type of the operands. Integer results wrap within the width of the
 * promotion type and raise the overflow flag of the {@link EvalContext}; division is carried out in Float64.
 */
public final class ArithmeticKernels {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ArithmeticKernels.class);

  private ArithmeticKernels() {
  }

  /**
   * @return the type of {@code op}'s result over operands promoted to {@code promotion}
   */
  public static LogicalType resultType(ArithmeticOperator op, TypeId promotion) {
    return op == ArithmeticOperator.DIVIDE ? LogicalType.FLOAT64 : LogicalType.of(promotion);
  }

  public static Column apply(ArithmeticOperator op, TypedColumn left, TypedColumn right, TypeId promotion,
                             EvalContext context) {
    int valueCount = left.getValueCount();
    long[] validity = ValidityWords.and(left, right, valueCount);
    boolean floating = op == ArithmeticOperator.DIVIDE || promotion.isFloatingPoint();
    try (ColumnBuilder builder = ColumnBuilder.create(resultType(op, promotion), valueCount)) {
      for (int i = 0; i < valueCount; i++) {
        if (!ValidityWords.isSet(validity, i)) {
          builder.appendNull();
        } else if (op.hasZeroDivisor() && isZero(right, i, promotion) && divideByZero(op, i, context)) {
          builder.appendNull();
        } else if (floating) {
          // getDouble widens UInt64 through its unsigned value
          builder.appendDouble(applyDouble(op, left.getDouble(i), right.getDouble(i)));
        } else {
          builder.appendLong(applyLong(op, left.getLong(i), right.getLong(i), promotion, context));
        }
      }
      return builder.build();
    }
  }

  private static boolean isZero(TypedColumn column, int i, TypeId promotion) {
    return promotion.isFloatingPoint() ? column.getDouble(i) == 0.0 : column.getLong(i) == 0;
  }

  /**
   * Applies the divide by zero policy.
   *
   * @return true when the row becomes null
   */
  private static boolean divideByZero(ArithmeticOperator op, int row, EvalContext context) {
    if (context.getDivideByZeroPolicy() == DivideByZeroPolicy.ERROR) {
      throw UserException.divideByZeroError()
          .message("Division by zero at row %d", row)
          .addContext("Operator", op.getSymbol())
          .addContext("Row", row)
          .build(logger);
    }
    context.recordDivideByZero();
    return true;
  }

  static double applyDouble(ArithmeticOperator op, double a, double b) {
    switch (op) {
      case ADD:
        return a + b;
      case SUBTRACT:
        return a - b;
      case MULTIPLY:
        return a * b;
      case DIVIDE:
        return a / b;
      case REMAINDER:
        return a % b;
      default:
        throw new IllegalStateException("Unexpected operator " + op);
    }
  }

  /**
   * Computes {@code a op b} for integers already widened to 64 bits. The caller's builder truncates the result
   * to the width of {@code promotion}.
   */
  static long applyLong(ArithmeticOperator op, long a, long b, TypeId promotion, EvalContext context) {
    boolean unsigned = !promotion.isSigned();
    long result;
    switch (op) {
      case ADD:
        result = a + b;
        break;
      case SUBTRACT:
        result = a - b;
        break;
      case MULTIPLY:
        result = a * b;
        break;
      case REMAINDER:
        return unsigned ? Long.remainderUnsigned(a, b) : a % b;
      default:
        throw new IllegalStateException("Unexpected operator " + op);
    }
    if (overflows(op, a, b, result, promotion)) {
      context.recordOverflow();
    }
    return result;
  }

  private static boolean overflows(ArithmeticOperator op, long a, long b, long result, TypeId promotion) {
    boolean unsigned = !promotion.isSigned();
    if (promotion == TypeId.INT64) {
      switch (op) {
        case ADD:
          return ((a ^ result) & (b ^ result)) < 0;
        case SUBTRACT:
          return ((a ^ b) & (a ^ result)) < 0;
        default:
          return Math.multiplyHigh(a, b) != (result >> 63);
      }
    }
    if (promotion == TypeId.UINT64) {
      switch (op) {
        case ADD:
          return Long.compareUnsigned(result, a) < 0;
        case SUBTRACT:
          return Long.compareUnsigned(a, b) < 0;
        default:
          long high = Math.multiplyHigh(a, b) + ((a >> 63) & b) + ((b >> 63) & a);
          return high != 0;
      }
    }
    // narrower operands are exact in 64 bits, unsigned 32 bit products included when read as unsigned
    int bits = width(promotion) * 8;
    if (unsigned) {
      return Long.compareUnsigned(result, (1L << bits) - 1) > 0;
    }
    long narrowed = (result << (64 - bits)) >> (64 - bits);
    return narrowed != result;
  }

  private static int width(TypeId promotion) {
    switch (promotion) {
      case INT8:
      case UINT8:
        return 1;
      case INT16:
      case UINT16:
        return 2;
      case INT32:
      case UINT32:
        return 4;
      default:
        return 8;
    }
  }
}
