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

import org.tessera.common.types.TypeId;
import org.tessera.exec.vector.BitColumn;
import org.tessera.exec.vector.Column;
import org.tessera.exec.vector.TypedColumn;

/**
 * Row by row comparison of numeric operands converted to their promotion type. Handles every numeric shape the
 * lane kernels do not: mixed types, constant operands and unsigned types.
 */
public final class PromotionKernels {

  private PromotionKernels() {
  }

  /**
   * @param promotion numeric type both operands convert into losslessly
   */
  public static Column compare(ComparisonOperator op, TypedColumn left, TypedColumn right, TypeId promotion) {
    int valueCount = left.getValueCount();
    long[] validity = ValidityWords.and(left, right, valueCount);
    long[] values = new long[ValidityWords.wordCount(valueCount)];
    for (int i = 0; i < valueCount; i++) {
      if (!ValidityWords.isSet(validity, i)) {
        continue;
      }
      if (op.test(compareRow(left, right, i, promotion))) {
        values[i >>> 6] |= 1L << (i & 63);
      }
    }
    return BitColumn.fromWords(values, validity, valueCount);
  }

  static int compareRow(TypedColumn left, TypedColumn right, int i, TypeId promotion) {
    if (promotion.isFloatingPoint()) {
      return FloatOrder.compare(left.getDouble(i), right.getDouble(i));
    }
    // every integer type reads as a long that keeps its value, UInt64 keeps its bit pattern
    if (promotion == TypeId.UINT64) {
      return Long.compareUnsigned(left.getLong(i), right.getLong(i));
    }
    return Long.compare(left.getLong(i), right.getLong(i));
  }
}
