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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Period;

import org.tessera.common.exceptions.UserException;
import org.tessera.common.types.CastRules;
import org.tessera.common.types.IntervalUnit;
import org.tessera.common.types.LogicalType;
import org.tessera.common.types.TypeId;

import com.google.common.primitives.UnsignedLong;

/**
 * Implements {@link Column#castTo(LogicalType)}.
 * <p>{@link CastRules} decides whether a cast is possible at all. A permitted cast then succeeds only when every
 * non-null value survives it unchanged: narrowing integers must stay in range, floating point values must be
 * integral to become integers and integers must be exactly representable to become floating point, temporal
 * rescaling must not drop a remainder. Casts between a temporal type and its backing integer type, and from
 * Utf8 to Binary, share the source buffers.
 */
final class ColumnCaster {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ColumnCaster.class);

  private static final BigInteger UINT64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);
  private static final long NANOS_PER_DAY = DateUtilities.MILLIS_PER_DAY * 1_000_000L;

  private ColumnCaster() {
  }

  static Column cast(Column source, LogicalType target) {
    LogicalType from = source.getLogicalType();
    if (from.equals(target)) {
      return source.slice(0, source.getValueCount());
    }
    if (!CastRules.isCastable(from, target)) {
      throw UserException.unsupportedCastError()
          .message("Cannot cast %s to %s", from, target)
          .build(logger);
    }
    if (isReinterpretation(from, target)) {
      return source.withType(target);
    }

    TypedColumn typed = source.getTypedColumn();
    if (typed.isConstant()) {
      try (Column single = new Column(((ConstantColumn) typed).getValue().slice(0, 1));
           Column converted = convert(single, from, target)) {
        return new Column(new ConstantColumn(converted.getTypedColumn().slice(0, 1), source.getValueCount()));
      }
    }
    return convert(source, from, target);
  }

  private static boolean isReinterpretation(LogicalType from, LogicalType target) {
    if (from.isTemporal() && target.equals(PhysicalTypeMapper.physicalOf(from))) {
      return true;
    }
    if (target.isTemporal() && from.equals(PhysicalTypeMapper.physicalOf(target))) {
      return true;
    }
    return from.getTypeId() == TypeId.UTF8 && target.getTypeId() == TypeId.BINARY;
  }

  private static Column convert(Column source, LogicalType from, LogicalType target) {
    TypedColumn typed = source.getTypedColumn();
    int valueCount = typed.getValueCount();

    if (from.getTypeId() == TypeId.BINARY && target.getTypeId() == TypeId.UTF8) {
      validateUtf8(typed, from, target);
      return source.withType(target);
    }

    try (ColumnBuilder builder = ColumnBuilder.create(target, valueCount)) {
      for (int i = 0; i < valueCount; i++) {
        if (typed.isNull(i)) {
          builder.appendNull();
          continue;
        }
        try {
          convertRow(typed, i, from, target, builder);
        } catch (ArithmeticException | IllegalArgumentException | DateTimeException e) {
          throw castFailure(typed, i, from, target, e);
        }
      }
      return builder.build();
    }
  }

  private static void convertRow(TypedColumn typed, int i, LogicalType from, LogicalType target,
                                 ColumnBuilder builder) {
    TypeId fromId = from.getTypeId();
    TypeId to = target.getTypeId();

    if (to == TypeId.UTF8) {
      builder.appendString(ScalarValue.fromColumn(typed, i).format());
    } else if (fromId == TypeId.UTF8) {
      parseInto(new String(typed.getBytes(i), StandardCharsets.UTF_8).trim(), target, builder);
    } else if (from.isTemporal() && target.isTemporal()) {
      builder.appendLong(rescaleTemporal(typed.getLong(i), from, target));
    } else if (to == TypeId.BOOLEAN) {
      BigDecimal value = exactValue(typed, i, fromId);
      if (value.signum() == 0) {
        builder.appendBoolean(false);
      } else if (value.compareTo(BigDecimal.ONE) == 0) {
        builder.appendBoolean(true);
      } else {
        throw new ArithmeticException("only 0 and 1 convert to Boolean");
      }
    } else if (to.isFloatingPoint()) {
      builder.appendDouble(toFloatingPoint(typed, i, fromId, to));
    } else {
      builder.appendLong(toInteger(exactValue(typed, i, fromId), target));
    }
  }

  /**
   * @return the exact value of a numeric, Boolean or temporal row
   */
  private static BigDecimal exactValue(TypedColumn typed, int i, TypeId fromId) {
    switch (fromId) {
      case FLOAT32:
      case FLOAT64: {
        double value = typed.getDouble(i);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
          throw new ArithmeticException("not a finite number");
        }
        return new BigDecimal(value);
      }
      case UINT64:
        return new BigDecimal(UnsignedLong.fromLongBits(typed.getLong(i)).bigIntegerValue());
      case BOOLEAN:
        return typed.getBoolean(i) ? BigDecimal.ONE : BigDecimal.ZERO;
      default:
        return BigDecimal.valueOf(typed.getLong(i));
    }
  }

  private static double toFloatingPoint(TypedColumn typed, int i, TypeId fromId, TypeId to) {
    if (fromId.isFloatingPoint()) {
      double value = typed.getDouble(i);
      if (to == TypeId.FLOAT32 && !Double.isNaN(value) && (double) (float) value != value) {
        throw new ArithmeticException("not representable as Float32");
      }
      return value;
    }
    BigDecimal exact = exactValue(typed, i, fromId);
    double value = to == TypeId.FLOAT32 ? exact.floatValue() : exact.doubleValue();
    if (Double.isInfinite(value) || new BigDecimal(value).compareTo(exact) != 0) {
      throw new ArithmeticException("not exactly representable as " + to.getDisplayName());
    }
    return value;
  }

  /**
   * Converts an exact value into the stored form of an integer, or of a temporal type backed by an integer.
   */
  private static long toInteger(BigDecimal value, LogicalType target) {
    BigInteger exact = value.toBigIntegerExact();
    TypeId storage = target.isTemporal()
        ? PhysicalTypeMapper.physicalOf(target).getTypeId()
        : target.getTypeId();
    BigInteger min;
    BigInteger max;
    switch (storage) {
      case INT8:
        min = BigInteger.valueOf(Byte.MIN_VALUE);
        max = BigInteger.valueOf(Byte.MAX_VALUE);
        break;
      case INT16:
        min = BigInteger.valueOf(Short.MIN_VALUE);
        max = BigInteger.valueOf(Short.MAX_VALUE);
        break;
      case INT32:
        min = BigInteger.valueOf(Integer.MIN_VALUE);
        max = BigInteger.valueOf(Integer.MAX_VALUE);
        break;
      case INT64:
        min = BigInteger.valueOf(Long.MIN_VALUE);
        max = BigInteger.valueOf(Long.MAX_VALUE);
        break;
      case UINT8:
        min = BigInteger.ZERO;
        max = BigInteger.valueOf(0xFFL);
        break;
      case UINT16:
        min = BigInteger.ZERO;
        max = BigInteger.valueOf(0xFFFFL);
        break;
      case UINT32:
        min = BigInteger.ZERO;
        max = BigInteger.valueOf(0xFFFF_FFFFL);
        break;
      case UINT64:
        min = BigInteger.ZERO;
        max = UINT64_MAX;
        break;
      default:
        throw new IllegalStateException("Unexpected integer storage " + storage);
    }
    if (exact.compareTo(min) < 0 || exact.compareTo(max) > 0) {
      throw new ArithmeticException("out of range");
    }
    // the low 64 bits are the stored pattern, UInt64 included
    return exact.longValue();
  }

  private static void parseInto(String text, LogicalType target, ColumnBuilder builder) {
    switch (target.getTypeId()) {
      case BOOLEAN:
        if ("true".equalsIgnoreCase(text)) {
          builder.appendBoolean(true);
        } else if ("false".equalsIgnoreCase(text)) {
          builder.appendBoolean(false);
        } else {
          throw new IllegalArgumentException("not a Boolean: " + text);
        }
        break;
      case FLOAT32:
        builder.appendDouble(Float.parseFloat(text));
        break;
      case FLOAT64:
        builder.appendDouble(Double.parseDouble(text));
        break;
      case DATE32:
        builder.appendObject(LocalDate.parse(text));
        break;
      case DATE64:
        builder.appendObject(text.indexOf('T') >= 0 ? LocalDateTime.parse(text) : LocalDate.parse(text));
        break;
      case TIMESTAMP:
        builder.appendObject(Instant.parse(text));
        break;
      case INTERVAL:
        if (target.getIntervalUnit() == IntervalUnit.YEAR_MONTH) {
          builder.appendLong(Math.toIntExact(Period.parse(text).toTotalMonths()));
        } else {
          builder.appendLong(Duration.parse(text).toMillis());
        }
        break;
      default:
        builder.appendLong(toInteger(new BigDecimal(text), target));
    }
  }

  private static long nanosPerTick(LogicalType type) {
    switch (type.getTypeId()) {
      case DATE32:
        return NANOS_PER_DAY;
      case DATE64:
        return 1_000_000L;
      case TIMESTAMP:
        return 1_000_000_000L / type.getTimestampUnit().ticksPerSecond();
      default:
        throw new IllegalStateException("Unexpected temporal type " + type);
    }
  }

  /**
   * Converts between Date32, Date64 and timestamps of any unit. Fails when the value is not a whole number of
   * target ticks.
   */
  private static long rescaleTemporal(long value, LogicalType from, LogicalType target) {
    BigInteger nanos = BigInteger.valueOf(value).multiply(BigInteger.valueOf(nanosPerTick(from)));
    BigInteger[] quotientAndRemainder = nanos.divideAndRemainder(BigInteger.valueOf(nanosPerTick(target)));
    if (quotientAndRemainder[1].signum() != 0) {
      throw new ArithmeticException("not a whole number of " + target);
    }
    return toInteger(new BigDecimal(quotientAndRemainder[0]), target);
  }

  private static void validateUtf8(TypedColumn typed, LogicalType from, LogicalType target) {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    for (int i = 0; i < typed.getValueCount(); i++) {
      if (typed.isNull(i)) {
        continue;
      }
      try {
        decoder.reset();
        decoder.decode(ByteBuffer.wrap(typed.getBytes(i)));
      } catch (CharacterCodingException e) {
        throw castFailure(typed, i, from, target, e);
      }
    }
  }

  private static UserException castFailure(TypedColumn typed, int row, LogicalType from, LogicalType target,
                                           Exception cause) {
    return UserException.unsupportedCastError(cause)
        .message("Cannot cast %s to %s: value %s at row %d cannot be represented",
            from, target, ScalarValue.fromColumn(typed, row).format(), row)
        .addContext("Row", row)
        .build(logger);
  }
}
