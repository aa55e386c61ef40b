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

/**
 * One value repeated over a logical length. Backs the scalar operand of vector/scalar evaluations.
 */
public final class ConstantColumn extends TypedColumn {

  /** length 1 column holding the value */
  private final TypedColumn value;

  ConstantColumn(TypedColumn value, int valueCount) {
    super(value.getLogicalType(), 0, valueCount, null);
    this.value = value;
  }

  public TypedColumn getValue() {
    return value;
  }

  @Override
  public boolean isConstant() {
    return true;
  }

  @Override
  public boolean isNull(int index) {
    return value.isNull(0);
  }

  @Override
  public boolean hasValidity() {
    return value.isNull(0);
  }

  @Override
  public long getValidityWord(int start) {
    return value.isNull(0) ? 0L : -1L;
  }

  @Override
  public int getNullCount() {
    return value.isNull(0) ? valueCount : 0;
  }

  @Override
  public long getLong(int index) {
    return value.getLong(0);
  }

  @Override
  public double getDouble(int index) {
    return value.getDouble(0);
  }

  @Override
  public boolean getBoolean(int index) {
    return value.getBoolean(0);
  }

  @Override
  public long getBitWord(int start) {
    return value.getBoolean(0) ? -1L : 0L;
  }

  @Override
  public byte[] getBytes(int index) {
    return value.getBytes(0);
  }

  @Override
  public Object getObject(int index) {
    return value.getObject(0);
  }

  @Override
  public boolean equalElementUnchecked(int i, int j, TypedColumn other) {
    if (other instanceof ConstantColumn) {
      return value.equalElementUnchecked(0, 0, ((ConstantColumn) other).value);
    }
    return value.equalElementUnchecked(0, j, other);
  }

  @Override
  public ConstantColumn slice(int from, int length) {
    return new ConstantColumn(value.slice(0, 1), length);
  }

  @Override
  public ConstantColumn withType(LogicalType newType) {
    return new ConstantColumn(value.withType(newType), valueCount);
  }

  @Override
  public long getMemoryFootprint() {
    return value.getMemoryFootprint();
  }

  @Override
  protected void releaseBuffers() {
    value.close();
  }
}
