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

import org.tessera.common.types.LogicalType;
import org.tessera.common.types.TypeId;

import com.google.common.base.Preconditions;
import com.google.common.primitives.UnsignedLong;

import io.netty.buffer.ByteBuf;

/**
 * Column of fixed width values: integers, floats, dates, timestamps and intervals. Width and signedness come
 * from the logical type. Values are little endian.
 */
public final class FixedWidthColumn extends TypedColumn {

  private final ByteBuf data;
  private final int width;
  private final TypeId storage;

  FixedWidthColumn(LogicalType type, int offset, int valueCount, ByteBuf data, ByteBuf validity) {
    super(type, offset, valueCount, validity);
    Preconditions.checkArgument(type.isFixedWidth(), "%s is not a fixed width type", type);
    this.data = data;
    this.width = type.getByteWidth();
    this.storage = storageOf(type);
  }

  /**
   * Temporal types are read through the integer type of the same width.
   */
  private static TypeId storageOf(LogicalType type) {
    if (!type.isTemporal()) {
      return type.getTypeId();
    }
    return type.getByteWidth() == 4 ? TypeId.INT32 : TypeId.INT64;
  }

  public int getWidth() {
    return width;
  }

  public boolean isFloatingPoint() {
    return storage.isFloatingPoint();
  }

  @Override
  public long getLong(int index) {
    int pos = (offset + index) * width;
    switch (storage) {
      case INT8:
        return data.getByte(pos);
      case INT16:
        return data.getShortLE(pos);
      case INT32:
        return data.getIntLE(pos);
      case INT64:
      case UINT64:
        return data.getLongLE(pos);
      case UINT8:
        return data.getUnsignedByte(pos);
      case UINT16:
        return data.getUnsignedShortLE(pos);
      case UINT32:
        return data.getUnsignedIntLE(pos);
      case FLOAT32:
        return (long) data.getFloatLE(pos);
      case FLOAT64:
        return (long) data.getDoubleLE(pos);
      default:
        throw new IllegalStateException("Unexpected storage " + storage);
    }
  }

  @Override
  public double getDouble(int index) {
    int pos = (offset + index) * width;
    switch (storage) {
      case FLOAT32:
        return data.getFloatLE(pos);
      case FLOAT64:
        return data.getDoubleLE(pos);
      case UINT64:
        return UnsignedLong.fromLongBits(data.getLongLE(pos)).doubleValue();
      default:
        return getLong(index);
    }
  }

  /**
   * Copies rows {@code [start, start + n)} into {@code dst}, sign or zero extended to 64 bits.
   */
  public void readLongs(int start, long[] dst, int n) {
    int pos = (offset + start) * width;
    switch (storage) {
      case INT8:
        for (int i = 0; i < n; i++) {
          dst[i] = data.getByte(pos + i);
        }
        break;
      case INT16:
        for (int i = 0; i < n; i++) {
          dst[i] = data.getShortLE(pos + 2 * i);
        }
        break;
      case INT32:
        for (int i = 0; i < n; i++) {
          dst[i] = data.getIntLE(pos + 4 * i);
        }
        break;
      case INT64:
        for (int i = 0; i < n; i++) {
          dst[i] = data.getLongLE(pos + 8 * i);
        }
        break;
      default:
        for (int i = 0; i < n; i++) {
          dst[i] = getLong(start + i);
        }
    }
  }

  /**
   * Copies rows {@code [start, start + n)} into {@code dst} as doubles.
   */
  public void readDoubles(int start, double[] dst, int n) {
    int pos = (offset + start) * width;
    switch (storage) {
      case FLOAT32:
        for (int i = 0; i < n; i++) {
          dst[i] = data.getFloatLE(pos + 4 * i);
        }
        break;
      case FLOAT64:
        for (int i = 0; i < n; i++) {
          dst[i] = data.getDoubleLE(pos + 8 * i);
        }
        break;
      default:
        for (int i = 0; i < n; i++) {
          dst[i] = getDouble(start + i);
        }
    }
  }

  @Override
  public Object getObject(int index) {
    if (isNull(index)) {
      return null;
    }
    return ScalarValue.fromColumn(this, index).getObject();
  }

  @Override
  public boolean equalElementUnchecked(int i, int j, TypedColumn other) {
    if (storage.isFloatingPoint()) {
      double a = getDouble(i);
      double b = other.getDouble(j);
      return a == b || (a != a && b != b);
    }
    return getLong(i) == other.getLong(j);
  }

  @Override
  public FixedWidthColumn slice(int from, int length) {
    data.retain();
    return new FixedWidthColumn(type, offset + from, length, data, retainedValidity());
  }

  @Override
  public FixedWidthColumn withType(LogicalType newType) {
    Preconditions.checkArgument(newType.getByteWidth() == width,
        "Cannot reinterpret %s as %s", type, newType);
    data.retain();
    return new FixedWidthColumn(newType, offset, valueCount, data, retainedValidity());
  }

  @Override
  public long getMemoryFootprint() {
    return capacity(data) + capacity(validity);
  }

  @Override
  protected void releaseBuffers() {
    data.release();
  }
}
