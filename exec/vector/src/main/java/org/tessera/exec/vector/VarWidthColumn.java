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
import java.util.Arrays;

import org.tessera.common.types.LogicalType;

import com.google.common.base.Preconditions;

import io.netty.buffer.ByteBuf;

/**
 * Utf8 or Binary column. Row i spans {@code [offsets[i], offsets[i + 1])} of the data buffer, offsets are
 * little endian int32.
 */
public final class VarWidthColumn extends TypedColumn {

  private final ByteBuf offsets;
  private final ByteBuf data;

  VarWidthColumn(LogicalType type, int offset, int valueCount, ByteBuf offsets, ByteBuf data, ByteBuf validity) {
    super(type, offset, valueCount, validity);
    Preconditions.checkArgument(type.isBinaryLike(), "%s is not a variable width type", type);
    this.offsets = offsets;
    this.data = data;
  }

  public ByteBuf getData() {
    return data;
  }

  /**
   * @return absolute start of the row in {@link #getData()}
   */
  public int getStart(int index) {
    return offsets.getIntLE((offset + index) * 4);
  }

  /**
   * @return absolute end (exclusive) of the row in {@link #getData()}
   */
  public int getEnd(int index) {
    return offsets.getIntLE((offset + index + 1) * 4);
  }

  @Override
  public byte[] getBytes(int index) {
    int start = getStart(index);
    byte[] bytes = new byte[getEnd(index) - start];
    data.getBytes(start, bytes);
    return bytes;
  }

  public String getString(int index) {
    int start = getStart(index);
    return data.toString(start, getEnd(index) - start, StandardCharsets.UTF_8);
  }

  @Override
  public Object getObject(int index) {
    if (isNull(index)) {
      return null;
    }
    return type.equals(LogicalType.UTF8) ? getString(index) : getBytes(index);
  }

  @Override
  public boolean equalElementUnchecked(int i, int j, TypedColumn other) {
    if (other instanceof VarWidthColumn) {
      VarWidthColumn that = (VarWidthColumn) other;
      return ByteFunctionHelpers.equal(data, getStart(i), getEnd(i),
          that.data, that.getStart(j), that.getEnd(j)) == 1;
    }
    return Arrays.equals(getBytes(i), other.getBytes(j));
  }

  @Override
  public VarWidthColumn slice(int from, int length) {
    offsets.retain();
    data.retain();
    return new VarWidthColumn(type, offset + from, length, offsets, data, retainedValidity());
  }

  @Override
  public VarWidthColumn withType(LogicalType newType) {
    Preconditions.checkArgument(newType.isBinaryLike(), "Cannot reinterpret %s as %s", type, newType);
    offsets.retain();
    data.retain();
    return new VarWidthColumn(newType, offset, valueCount, offsets, data, retainedValidity());
  }

  @Override
  public long getMemoryFootprint() {
    return capacity(offsets) + capacity(data) + capacity(validity);
  }

  @Override
  protected void releaseBuffers() {
    offsets.release();
    data.release();
  }
}
