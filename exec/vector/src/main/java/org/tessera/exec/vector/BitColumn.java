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

import com.google.common.base.Preconditions;

import io.netty.buffer.ByteBuf;

/**
 * Boolean column, one bit per row.
 */
public final class BitColumn extends TypedColumn {

  private final ByteBuf data;

  BitColumn(int offset, int valueCount, ByteBuf data, ByteBuf validity) {
    super(LogicalType.BOOLEAN, offset, valueCount, validity);
    this.data = data;
  }

  /**
   * Builds a Boolean column from whole words, bit i of word w holding row {@code 64 * w + i}.
   *
   * @param values data words
   * @param validity validity words, or null when every row is valid
   * @param valueCount number of rows
   */
  public static Column fromWords(long[] values, long[] validity, int valueCount) {
    ByteBuf data = ValidityBitmap.fromWords(values, valueCount);
    ByteBuf valid = validity == null ? null : ValidityBitmap.fromWords(validity, valueCount);
    return new Column(new BitColumn(0, valueCount, data, valid));
  }

  @Override
  public boolean getBoolean(int index) {
    return ValidityBitmap.get(data, offset + index);
  }

  @Override
  public long getLong(int index) {
    return getBoolean(index) ? 1L : 0L;
  }

  @Override
  public double getDouble(int index) {
    return getLong(index);
  }

  @Override
  public long getBitWord(int start) {
    return ValidityBitmap.readWord(data, offset + start);
  }

  @Override
  public Object getObject(int index) {
    return isNull(index) ? null : getBoolean(index);
  }

  @Override
  public boolean equalElementUnchecked(int i, int j, TypedColumn other) {
    return getBoolean(i) == other.getBoolean(j);
  }

  @Override
  public BitColumn slice(int from, int length) {
    data.retain();
    return new BitColumn(offset + from, length, data, retainedValidity());
  }

  @Override
  public BitColumn withType(LogicalType newType) {
    Preconditions.checkArgument(newType.equals(LogicalType.BOOLEAN), "Cannot reinterpret %s as %s", type, newType);
    return slice(0, valueCount);
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
