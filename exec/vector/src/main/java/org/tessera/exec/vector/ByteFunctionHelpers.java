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

import io.netty.buffer.ByteBuf;

/**
 * Raw byte comparison of variable width values. Bytes compare unsigned and lexicographically, a prefix
 * sorts before the longer value.
 */
public class ByteFunctionHelpers {

  private ByteFunctionHelpers() {
  }

  /**
   * Helper function to check for equality of bytes in two buffers.
   *
   * @return 1 if equals, 0 otherwise
   */
  public static int equal(final ByteBuf left, int lStart, int lEnd, final ByteBuf right, int rStart, int rEnd) {
    int n = lEnd - lStart;
    if (n != rEnd - rStart) {
      return 0;
    }

    int lPos = lStart;
    int rPos = rStart;

    while (n > 7) {
      if (left.getLong(lPos) != right.getLong(rPos)) {
        return 0;
      }
      lPos += 8;
      rPos += 8;
      n -= 8;
    }
    while (n > 0) {
      if (left.getByte(lPos) != right.getByte(rPos)) {
        return 0;
      }
      lPos++;
      rPos++;
      n--;
    }
    return 1;
  }

  /**
   * Helper function to compare a set of bytes in two buffers.
   *
   * @return 1 if left is bigger, -1 if right is bigger, 0 if equal
   */
  public static int compare(final ByteBuf left, int lStart, int lEnd, final ByteBuf right, int rStart, int rEnd) {
    int lLen = lEnd - lStart;
    int rLen = rEnd - rStart;
    int n = Math.min(lLen, rLen);

    int lPos = lStart;
    int rPos = rStart;

    // big endian words compare in byte order
    while (n > 7) {
      long leftWord = left.getLong(lPos);
      long rightWord = right.getLong(rPos);
      if (leftWord != rightWord) {
        return Long.compareUnsigned(leftWord, rightWord) < 0 ? -1 : 1;
      }
      lPos += 8;
      rPos += 8;
      n -= 8;
    }

    while (n-- != 0) {
      int leftByte = left.getByte(lPos) & 0xff;
      int rightByte = right.getByte(rPos) & 0xff;
      if (leftByte != rightByte) {
        return leftByte < rightByte ? -1 : 1;
      }
      lPos++;
      rPos++;
    }

    if (lLen == rLen) {
      return 0;
    }

    return lLen > rLen ? 1 : -1;
  }

  /**
   * Compares a buffer range with a byte array.
   */
  public static int compare(final ByteBuf left, int lStart, int lEnd, final byte[] right) {
    int lLen = lEnd - lStart;
    int n = Math.min(lLen, right.length);
    for (int i = 0; i < n; i++) {
      int leftByte = left.getByte(lStart + i) & 0xff;
      int rightByte = right[i] & 0xff;
      if (leftByte != rightByte) {
        return leftByte < rightByte ? -1 : 1;
      }
    }
    if (lLen == right.length) {
      return 0;
    }
    return lLen > right.length ? 1 : -1;
  }
}
