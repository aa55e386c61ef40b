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
package org.tessera.exec.hash;

import org.tessera.common.types.LogicalType;
import org.tessera.exec.vector.Column;
import org.tessera.exec.vector.ColumnBuilder;
import org.tessera.exec.vector.PhysicalTypeMapper;
import org.tessera.exec.vector.TypedColumn;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

/**
 * Per row keyed hashing of column content with SipHash-2-4. Equal values hash equally whatever the storage
 * layout of their column: slices, constants and temporal columns hash like their plain counterparts. Null rows
 * hash to a value of their own.
 */
public final class KeyedHashing {

  private KeyedHashing() {
  }

  /**
   * @return a UInt64 column holding one hash per row
   */
  public static Column contentHash(Column column, HashKey key) {
    if (column.getLogicalType().isTemporal()) {
      return PhysicalTypeMapper.castAndApply(column, physical -> contentHash(physical, key));
    }
    HashFunction function = Hashing.sipHash24(key.getK0(), key.getK1());
    TypedColumn typed = column.getTypedColumn();
    int valueCount = typed.getValueCount();
    try (ColumnBuilder builder = ColumnBuilder.create(LogicalType.UINT64, valueCount)) {
      for (int i = 0; i < valueCount; i++) {
        builder.appendLong(hashRow(function, typed, i));
      }
      return builder.build();
    }
  }

  private static long hashRow(HashFunction function, TypedColumn typed, int i) {
    Hasher hasher = function.newHasher();
    if (typed.isNull(i)) {
      return hasher.putBoolean(false).hash().asLong();
    }
    hasher.putBoolean(true);
    LogicalType type = typed.getLogicalType();
    switch (type.getTypeId()) {
      case FLOAT32:
      case FLOAT64:
        hasher.putLong(Double.doubleToLongBits(canonicalize(typed.getDouble(i))));
        break;
      case BOOLEAN:
        hasher.putBoolean(typed.getBoolean(i));
        break;
      case UTF8:
      case BINARY:
        hasher.putBytes(typed.getBytes(i));
        break;
      default:
        hasher.putLong(typed.getLong(i));
    }
    return hasher.hash().asLong();
  }

  /**
   * Folds -0.0 into 0.0. {@link Double#doubleToLongBits(double)} already folds every NaN into one pattern.
   */
  private static double canonicalize(double value) {
    return value == 0.0 ? 0.0 : value;
  }
}
