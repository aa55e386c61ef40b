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

import java.util.Arrays;

import org.tessera.exec.vector.BitColumn;
import org.tessera.exec.vector.ByteFunctionHelpers;
import org.tessera.exec.vector.Column;
import org.tessera.exec.vector.ConstantColumn;
import org.tessera.exec.vector.TypedColumn;
import org.tessera.exec.vector.VarWidthColumn;

import io.netty.buffer.ByteBuf;

/**
 * Comparison of Utf8 and Binary values as raw bytes: unsigned lexicographic order, byte exact equality. Utf8
 * and Binary operands mix freely.
 */
public final class ByteComparisons {

  private ByteComparisons() {
  }

  public static Column compare(ComparisonOperator op, TypedColumn left, TypedColumn right) {
    int valueCount = left.getValueCount();
    long[] validity = ValidityWords.and(left, right, valueCount);
    long[] values = new long[ValidityWords.wordCount(valueCount)];

    if (left instanceof VarWidthColumn && right instanceof VarWidthColumn) {
      VarWidthColumn l = (VarWidthColumn) left;
      VarWidthColumn r = (VarWidthColumn) right;
      for (int i = 0; i < valueCount; i++) {
        if (ValidityWords.isSet(validity, i) && test(op, l.getData(), l.getStart(i), l.getEnd(i),
            r.getData(), r.getStart(i), r.getEnd(i))) {
          values[i >>> 6] |= 1L << (i & 63);
        }
      }
    } else if (left instanceof VarWidthColumn && right instanceof ConstantColumn) {
      compareWithConstant(op, (VarWidthColumn) left, right, validity, values);
    } else if (left instanceof ConstantColumn && right instanceof VarWidthColumn) {
      compareWithConstant(op.flip(), (VarWidthColumn) right, left, validity, values);
    } else {
      for (int i = 0; i < valueCount; i++) {
        if (ValidityWords.isSet(validity, i) && op.test(compareBytes(left.getBytes(i), right.getBytes(i)))) {
          values[i >>> 6] |= 1L << (i & 63);
        }
      }
    }
    return BitColumn.fromWords(values, validity, valueCount);
  }

  private static void compareWithConstant(ComparisonOperator op, VarWidthColumn vector, TypedColumn constant,
                                          long[] validity, long[] values) {
    if (constant.isNull(0)) {
      return;
    }
    byte[] value = constant.getBytes(0);
    ByteBuf data = vector.getData();
    for (int i = 0; i < vector.getValueCount(); i++) {
      if (ValidityWords.isSet(validity, i)
          && op.test(ByteFunctionHelpers.compare(data, vector.getStart(i), vector.getEnd(i), value))) {
        values[i >>> 6] |= 1L << (i & 63);
      }
    }
  }

  private static boolean test(ComparisonOperator op, ByteBuf left, int lStart, int lEnd,
                              ByteBuf right, int rStart, int rEnd) {
    switch (op) {
      case EQ:
        return ByteFunctionHelpers.equal(left, lStart, lEnd, right, rStart, rEnd) == 1;
      case NEQ:
        return ByteFunctionHelpers.equal(left, lStart, lEnd, right, rStart, rEnd) == 0;
      default:
        return op.test(ByteFunctionHelpers.compare(left, lStart, lEnd, right, rStart, rEnd));
    }
  }

  static int compareBytes(byte[] left, byte[] right) {
    int cmp = Arrays.compareUnsigned(left, right);
    return Integer.signum(cmp);
  }
}
