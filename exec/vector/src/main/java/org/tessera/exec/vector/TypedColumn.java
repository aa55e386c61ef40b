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

import java.util.concurrent.atomic.AtomicBoolean;

import org.tessera.common.types.LogicalType;

import com.google.common.base.Preconditions;

import io.netty.buffer.ByteBuf;

/**
 * Owner of the buffers of one column view of a single {@link LogicalType}. The family is closed:
 * {@link FixedWidthColumn}, {@link BitColumn}, {@link VarWidthColumn} and {@link ConstantColumn}.
 * <p>A view addresses rows {@code [offset, offset + valueCount)} of its buffers. Row indexes passed to the
 * accessors are relative to the view and are not checked; {@link Column} performs the checks.
 * <p>Each view holds one reference to each of its buffers. {@link #slice(int, int)} and
 * {@link #withType(LogicalType)} retain the buffers for the new view, {@link #close()} releases them once.
 */
public abstract class TypedColumn implements AutoCloseable {

  protected final LogicalType type;
  protected final int offset;
  protected final int valueCount;
  /** absent means every row is valid */
  protected final ByteBuf validity;

  private final AtomicBoolean closed = new AtomicBoolean(false);
  private volatile int nullCount = -1;

  TypedColumn(LogicalType type, int offset, int valueCount, ByteBuf validity) {
    Preconditions.checkArgument(offset >= 0 && valueCount >= 0, "invalid view [%s, +%s)", offset, valueCount);
    this.type = type;
    this.offset = offset;
    this.valueCount = valueCount;
    this.validity = validity;
  }

  public LogicalType getLogicalType() {
    return type;
  }

  public int getValueCount() {
    return valueCount;
  }

  public boolean hasValidity() {
    return validity != null;
  }

  public boolean isNull(int index) {
    return validity != null && !ValidityBitmap.get(validity, offset + index);
  }

  /**
   * @return validity of rows {@code [start, start + 64)}, bit i set when row {@code start + i} is valid. Bits
   *         beyond the end of the view are unspecified.
   */
  public long getValidityWord(int start) {
    return validity == null ? -1L : ValidityBitmap.readWord(validity, offset + start);
  }

  public int getNullCount() {
    int count = nullCount;
    if (count < 0) {
      count = validity == null ? 0 : ValidityBitmap.countZeros(validity, offset, valueCount);
      nullCount = count;
    }
    return count;
  }

  public boolean isConstant() {
    return false;
  }

  public long getLong(int index) {
    throw new UnsupportedOperationException(type + " values cannot be read as long");
  }

  public double getDouble(int index) {
    throw new UnsupportedOperationException(type + " values cannot be read as double");
  }

  public boolean getBoolean(int index) {
    throw new UnsupportedOperationException(type + " values cannot be read as boolean");
  }

  /**
   * @return data bits of rows {@code [start, start + 64)} for bit packed columns
   */
  public long getBitWord(int start) {
    throw new UnsupportedOperationException(type + " values are not bit packed");
  }

  public byte[] getBytes(int index) {
    throw new UnsupportedOperationException(type + " values cannot be read as bytes");
  }

  /**
   * @return the value of a row as a plain Java object, null for a null row
   */
  public abstract Object getObject(int index);

  /**
   * Compares row {@code i} of this column with row {@code j} of {@code other} without bounds or validity checks.
   * Callers guarantee that both indexes are in range and that both columns share a physical representation.
   */
  public abstract boolean equalElementUnchecked(int i, int j, TypedColumn other);

  /**
   * Returns a view of {@code [from, from + length)} of this view sharing its buffers.
   */
  public abstract TypedColumn slice(int from, int length);

  /**
   * Returns a view of the same buffers under another logical type of identical storage width.
   */
  public abstract TypedColumn withType(LogicalType newType);

  public abstract long getMemoryFootprint();

  protected abstract void releaseBuffers();

  protected static long capacity(ByteBuf buf) {
    return buf == null ? 0 : buf.capacity();
  }

  protected ByteBuf retainedValidity() {
    return validity == null ? null : validity.retain();
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      if (validity != null) {
        validity.release();
      }
      releaseBuffers();
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + type + ", " + valueCount + "]";
  }
}
