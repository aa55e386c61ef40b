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

import org.tessera.exec.vector.TypedColumn;
import org.tessera.exec.vector.ValidityBitmap;

/**
 * Word level validity of binary results: a row is valid only when it is valid in both operands.
 */
final class ValidityWords {

  private ValidityWords() {
  }

  static int wordCount(int valueCount) {
    return (valueCount + ValidityBitmap.WORD_BITS - 1) / ValidityBitmap.WORD_BITS;
  }

  /**
   * @return the combined validity words, or null when neither operand has a null row
   */
  static long[] and(TypedColumn left, TypedColumn right, int valueCount) {
    if (!left.hasValidity() && !right.hasValidity()) {
      return null;
    }
    long[] words = new long[wordCount(valueCount)];
    for (int w = 0; w < words.length; w++) {
      int start = w * ValidityBitmap.WORD_BITS;
      words[w] = left.getValidityWord(start) & right.getValidityWord(start);
    }
    return words;
  }

  static boolean isSet(long[] words, int row) {
    return words == null || (words[row >>> 6] & (1L << (row & 63))) != 0;
  }
}
