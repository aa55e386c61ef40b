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

import org.tessera.common.types.LogicalType;
import org.tessera.exec.vector.BitColumn;
import org.tessera.exec.vector.Column;
import org.tessera.exec.vector.Columns;
import org.tessera.exec.vector.ScalarValue;
import org.tessera.exec.vector.TypedColumn;

/**
 * Word wise comparison of Boolean columns, false sorting before true. For data words a and b:
 * <pre>
 *   eq  ~(a ^ b)    lt  ~a &amp; b    gt  a &amp; ~b
 *   neq a ^ b       lte ~a | b    gte a | ~b
 * </pre>
 * Comparing with a constant reduces to the column itself or its negation where possible.
 */
public final class BooleanComparisons {

  private BooleanComparisons() {
  }

  public static Column vectorVector(ComparisonOperator op, Column left, Column right) {
    TypedColumn l = left.getTypedColumn();
    TypedColumn r = right.getTypedColumn();
    int valueCount = l.getValueCount();
    long[] values = new long[ValidityWords.wordCount(valueCount)];
    for (int w = 0; w < values.length; w++) {
      int start = w * LaneKernels.LANE_WIDTH;
      values[w] = apply(op, l.getBitWord(start), r.getBitWord(start));
    }
    return BitColumn.fromWords(values, ValidityWords.and(l, r, valueCount), valueCount);
  }

  /**
   * Compares every row of {@code column} with {@code constant}: {@code column op constant}.
   */
  public static Column vectorConst(ComparisonOperator op, Column column, ScalarValue constant) {
    int valueCount = column.getValueCount();
    if (constant.isNull()) {
      return Columns.nulls(LogicalType.BOOLEAN, valueCount);
    }
    boolean value = (Boolean) constant.getObject();
    switch (op) {
      case EQ:
        return value ? column.slice(0, valueCount) : not(column);
      case NEQ:
        return value ? not(column) : column.slice(0, valueCount);
      default:
        long constantWord = value ? -1L : 0L;
        TypedColumn typed = column.getTypedColumn();
        long[] values = new long[ValidityWords.wordCount(valueCount)];
        for (int w = 0; w < values.length; w++) {
          values[w] = apply(op, typed.getBitWord(w * LaneKernels.LANE_WIDTH), constantWord);
        }
        return BitColumn.fromWords(values, validityOf(typed), valueCount);
    }
  }

  /**
   * Compares {@code constant} with every row of {@code column}: {@code constant op column}.
   */
  public static Column constVector(ComparisonOperator op, ScalarValue constant, Column column) {
    return vectorConst(op.flip(), column, constant);
  }

  /**
   * Negates every row, null rows stay null.
   */
  public static Column not(Column column) {
    TypedColumn typed = column.getTypedColumn();
    int valueCount = typed.getValueCount();
    long[] values = new long[ValidityWords.wordCount(valueCount)];
    for (int w = 0; w < values.length; w++) {
      values[w] = ~typed.getBitWord(w * LaneKernels.LANE_WIDTH);
    }
    return BitColumn.fromWords(values, validityOf(typed), valueCount);
  }

  private static long[] validityOf(TypedColumn typed) {
    if (!typed.hasValidity()) {
      return null;
    }
    long[] words = new long[ValidityWords.wordCount(typed.getValueCount())];
    for (int w = 0; w < words.length; w++) {
      words[w] = typed.getValidityWord(w * LaneKernels.LANE_WIDTH);
    }
    return words;
  }

  static long apply(ComparisonOperator op, long a, long b) {
    switch (op) {
      case EQ:
        return ~(a ^ b);
      case NEQ:
        return a ^ b;
      case LT:
        return ~a & b;
      case LTE:
        return ~a | b;
      case GT:
        return a & ~b;
      case GTE:
        return a | ~b;
      default:
        throw new IllegalStateException("Unexpected operator " + op);
    }
  }
}
