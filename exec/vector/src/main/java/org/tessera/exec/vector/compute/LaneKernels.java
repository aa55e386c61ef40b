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

import java.util.EnumSet;
import java.util.Set;

import org.tessera.common.types.TypeId;
import org.tessera.exec.vector.BitColumn;
import org.tessera.exec.vector.Column;
import org.tessera.exec.vector.FixedWidthColumn;
import org.tessera.exec.vector.TypedColumn;
import org.tessera.exec.vector.ValidityBitmap;

/**
 * Batch comparison of two vectors of the same primitive type. Rows are processed in lanes of
 * {@link #LANE_WIDTH}: a lane is loaded into a primitive array, compared in a tight loop and packed into one
 * result word. The validity word of a lane is the AND of the operands' validity words.
 */
public final class LaneKernels {

  public static final int LANE_WIDTH = ValidityBitmap.WORD_BITS;

  private static final Set<TypeId> LANE_TYPES = EnumSet.of(
      TypeId.INT8, TypeId.INT16, TypeId.INT32, TypeId.INT64, TypeId.FLOAT32, TypeId.FLOAT64);

  private LaneKernels() {
  }

  /**
   * @return true when a lane kernel exists for {@code op} over values of {@code typeId}
   */
  public static boolean supports(TypeId typeId, ComparisonOperator op) {
    return op != null && LANE_TYPES.contains(typeId);
  }

  /**
   * @return true when both operands are non constant vectors of one type that has a lane kernel
   */
  public static boolean applies(TypedColumn left, TypedColumn right, ComparisonOperator op) {
    return left instanceof FixedWidthColumn
        && right instanceof FixedWidthColumn
        && left.getLogicalType().equals(right.getLogicalType())
        && supports(left.getLogicalType().getTypeId(), op);
  }

  public static Column compare(ComparisonOperator op, FixedWidthColumn left, FixedWidthColumn right) {
    int valueCount = left.getValueCount();
    long[] values = new long[ValidityWords.wordCount(valueCount)];
    if (left.isFloatingPoint()) {
      double[] a = new double[LANE_WIDTH];
      double[] b = new double[LANE_WIDTH];
      for (int w = 0; w < values.length; w++) {
        int start = w * LANE_WIDTH;
        int n = Math.min(LANE_WIDTH, valueCount - start);
        left.readDoubles(start, a, n);
        right.readDoubles(start, b, n);
        values[w] = compareDoubleLane(op, a, b, n);
      }
    } else {
      long[] a = new long[LANE_WIDTH];
      long[] b = new long[LANE_WIDTH];
      for (int w = 0; w < values.length; w++) {
        int start = w * LANE_WIDTH;
        int n = Math.min(LANE_WIDTH, valueCount - start);
        left.readLongs(start, a, n);
        right.readLongs(start, b, n);
        values[w] = compareLongLane(op, a, b, n);
      }
    }
    return BitColumn.fromWords(values, ValidityWords.and(left, right, valueCount), valueCount);
  }

  static long compareLongLane(ComparisonOperator op, long[] a, long[] b, int n) {
    long word = 0;
    switch (op) {
      case EQ:
        for (int i = 0; i < n; i++) {
          word |= (a[i] == b[i] ? 1L : 0L) << i;
        }
        break;
      case NEQ:
        for (int i = 0; i < n; i++) {
          word |= (a[i] != b[i] ? 1L : 0L) << i;
        }
        break;
      case LT:
        for (int i = 0; i < n; i++) {
          word |= (a[i] < b[i] ? 1L : 0L) << i;
        }
        break;
      case LTE:
        for (int i = 0; i < n; i++) {
          word |= (a[i] <= b[i] ? 1L : 0L) << i;
        }
        break;
      case GT:
        for (int i = 0; i < n; i++) {
          word |= (a[i] > b[i] ? 1L : 0L) << i;
        }
        break;
      case GTE:
        for (int i = 0; i < n; i++) {
          word |= (a[i] >= b[i] ? 1L : 0L) << i;
        }
        break;
      default:
        throw new IllegalStateException("Unexpected operator " + op);
    }
    return word;
  }

  static long compareDoubleLane(ComparisonOperator op, double[] a, double[] b, int n) {
    long word = 0;
    switch (op) {
      case EQ:
        for (int i = 0; i < n; i++) {
          word |= (FloatOrder.equal(a[i], b[i]) ? 1L : 0L) << i;
        }
        break;
      case NEQ:
        for (int i = 0; i < n; i++) {
          word |= (FloatOrder.equal(a[i], b[i]) ? 0L : 1L) << i;
        }
        break;
      default:
        for (int i = 0; i < n; i++) {
          word |= (op.test(FloatOrder.compare(a[i], b[i])) ? 1L : 0L) << i;
        }
    }
    return word;
  }
}
