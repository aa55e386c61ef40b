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
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Period;
import java.util.Arrays;

import org.tessera.common.types.LogicalType;

import com.google.common.base.Preconditions;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

/**
 * Append-only builder of a {@link Column}. A builder produces one column; closing it after {@link #build()}
 * does nothing, closing it before releases what was appended.
 */
public class ColumnBuilder implements AutoCloseable {

  private static final int INITIAL_VALUE_ALLOCATION = 64;

  private final LogicalType type;
  private final int width;

  private ByteBuf data;
  private ByteBuf offsets;
  private long[] bitWords;
  private long[] validityWords;

  private int count;
  private boolean anyNull;
  private boolean done;

  private ColumnBuilder(LogicalType type, int expectedCount) {
    this.type = type;
    this.width = type.getByteWidth();
    int initial = Math.max(expectedCount, 1);
    int words = (initial + ValidityBitmap.WORD_BITS - 1) / ValidityBitmap.WORD_BITS;
    this.validityWords = new long[words];
    if (width > 0) {
      data = Unpooled.buffer(initial * width);
    } else if (width == 0) {
      bitWords = new long[words];
    } else {
      data = Unpooled.buffer(initial * 8);
      offsets = Unpooled.buffer((initial + 1) * 4);
      offsets.writeIntLE(0);
    }
  }

  public static ColumnBuilder create(LogicalType type) {
    return create(type, INITIAL_VALUE_ALLOCATION);
  }

  public static ColumnBuilder create(LogicalType type, int expectedCount) {
    return new ColumnBuilder(type, expectedCount);
  }

  public LogicalType getType() {
    return type;
  }

  public int getCount() {
    return count;
  }

  private void ensureWords() {
    int needed = (count >>> 6) + 1;
    if (needed > validityWords.length) {
      int newLength = Math.max(needed, validityWords.length * 2);
      validityWords = Arrays.copyOf(validityWords, newLength);
      if (bitWords != null) {
        bitWords = Arrays.copyOf(bitWords, newLength);
      }
    }
  }

  private void markValid() {
    validityWords[count >>> 6] |= 1L << (count & 63);
  }

  public ColumnBuilder appendNull() {
    Preconditions.checkState(!done, "builder already built");
    ensureWords();
    anyNull = true;
    if (width > 0) {
      data.writeZero(width);
    } else if (width < 0) {
      offsets.writeIntLE(data.writerIndex());
    }
    count++;
    return this;
  }

  /**
   * Appends an integer, or the stored form of a temporal value. Floating point columns receive the value
   * converted to double.
   */
  public ColumnBuilder appendLong(long value) {
    Preconditions.checkState(!done, "builder already built");
    if (type.getTypeId().isFloatingPoint()) {
      return appendDouble(value);
    }
    if (width == 0) {
      return appendBoolean(value != 0);
    }
    Preconditions.checkState(width > 0, "Cannot append a long to %s", type);
    ensureWords();
    switch (width) {
      case 1:
        data.writeByte((int) value);
        break;
      case 2:
        data.writeShortLE((int) value);
        break;
      case 4:
        data.writeIntLE((int) value);
        break;
      default:
        data.writeLongLE(value);
    }
    markValid();
    count++;
    return this;
  }

  public ColumnBuilder appendDouble(double value) {
    Preconditions.checkState(!done, "builder already built");
    Preconditions.checkState(type.getTypeId().isFloatingPoint(), "Cannot append a double to %s", type);
    ensureWords();
    if (width == 4) {
      data.writeFloatLE((float) value);
    } else {
      data.writeDoubleLE(value);
    }
    markValid();
    count++;
    return this;
  }

  public ColumnBuilder appendBoolean(boolean value) {
    Preconditions.checkState(!done, "builder already built");
    Preconditions.checkState(width == 0, "Cannot append a boolean to %s", type);
    ensureWords();
    if (value) {
      bitWords[count >>> 6] |= 1L << (count & 63);
    }
    markValid();
    count++;
    return this;
  }

  public ColumnBuilder appendBytes(byte[] value) {
    Preconditions.checkState(!done, "builder already built");
    Preconditions.checkState(width < 0, "Cannot append bytes to %s", type);
    ensureWords();
    data.writeBytes(value);
    offsets.writeIntLE(data.writerIndex());
    markValid();
    count++;
    return this;
  }

  public ColumnBuilder appendString(String value) {
    return value == null ? appendNull() : appendBytes(value.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Appends a plain Java value. Numbers are accepted for every numeric and temporal type (as the stored form),
   * java.time values for the matching temporal types, Strings and byte arrays for Utf8 and Binary.
   */
  public ColumnBuilder appendObject(Object value) {
    if (value == null) {
      return appendNull();
    }
    switch (type.getTypeId()) {
      case FLOAT32:
      case FLOAT64:
        return appendDouble(((Number) value).doubleValue());
      case BOOLEAN:
        return appendBoolean((Boolean) value);
      case UTF8:
      case BINARY:
        return value instanceof String ? appendString((String) value) : appendBytes((byte[]) value);
      case DATE32:
        return appendLong(value instanceof LocalDate ? ((LocalDate) value).toEpochDay() : ((Number) value).longValue());
      case DATE64:
        if (value instanceof LocalDate) {
          return appendLong(DateUtilities.localDateToEpochMillis((LocalDate) value));
        }
        if (value instanceof LocalDateTime) {
          return appendLong(DateUtilities.localDateTimeToEpochMillis((LocalDateTime) value));
        }
        if (value instanceof Instant) {
          return appendLong(((Instant) value).toEpochMilli());
        }
        return appendLong(((Number) value).longValue());
      case TIMESTAMP:
        if (value instanceof Instant) {
          return appendLong(DateUtilities.instantToTicks((Instant) value, type.getTimestampUnit()));
        }
        return appendLong(((Number) value).longValue());
      case INTERVAL:
        if (value instanceof Period) {
          return appendLong(((Period) value).toTotalMonths());
        }
        if (value instanceof Duration) {
          return appendLong(((Duration) value).toMillis());
        }
        return appendLong(((Number) value).longValue());
      default:
        return appendLong(((Number) value).longValue());
    }
  }

  public ColumnBuilder appendScalar(ScalarValue value) {
    return appendObject(value.getObject());
  }

  /**
   * Appends row {@code index} of a column of the same storage.
   */
  public ColumnBuilder appendFrom(TypedColumn source, int index) {
    if (source.isNull(index)) {
      return appendNull();
    }
    if (width == 0) {
      return appendBoolean(source.getBoolean(index));
    }
    if (width < 0) {
      return appendBytes(source.getBytes(index));
    }
    if (type.getTypeId().isFloatingPoint()) {
      return appendDouble(source.getDouble(index));
    }
    return appendLong(source.getLong(index));
  }

  public Column build() {
    Preconditions.checkState(!done, "builder already built");
    done = true;
    ByteBuf validity = anyNull ? ValidityBitmap.fromWords(validityWords, count) : null;
    TypedColumn column;
    if (width > 0) {
      column = new FixedWidthColumn(type, 0, count, data, validity);
    } else if (width == 0) {
      column = new BitColumn(0, count, ValidityBitmap.fromWords(bitWords, count), validity);
    } else {
      column = new VarWidthColumn(type, 0, count, offsets, data, validity);
    }
    data = null;
    offsets = null;
    return new Column(column);
  }

  @Override
  public void close() {
    if (!done) {
      done = true;
      if (data != null) {
        data.release();
      }
      if (offsets != null) {
        offsets.release();
      }
    }
  }
}
