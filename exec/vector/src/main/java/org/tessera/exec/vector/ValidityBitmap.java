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
import io.netty.buffer.Unpooled;

/**
 * Static helpers over little endian, LSB-first bitmaps. Bitmaps are used both for validity (bit set means the
 * row is valid) and for Boolean data.
 * <p>Every bitmap allocated here is padded so that a 64 bit word can be read starting at any bit position below
 * its length.
 */
public final class ValidityBitmap {

  public static final int WORD_BITS = 64;

  private ValidityBitmap() {
  }

  /**
   * @return number of bytes allocated for a bitmap of {@code bits} bits, padding included
   */
  static int paddedByteLength(int bits) {
    return ((bits + WORD_BITS - 1) / WORD_BITS) * 8 + 8;
  }

  /**
   * @return mask selecting the low {@code n} bits of a word, {@code n} in [0, 64]
   */
  public static long mask(int n) {
    return n >= WORD_BITS ? -1L : (1L << n) - 1;
  }

  /**
   * Allocates a zeroed bitmap.
   */
  static ByteBuf allocate(int bits) {
    int length = paddedByteLength(bits);
    ByteBuf buf = Unpooled.buffer(length, length);
    buf.setZero(0, length);
    buf.writerIndex(length);
    return buf;
  }

  /**
   * Writes whole words into a new bitmap. Bits at and beyond {@code bits} are cleared.
   */
  static ByteBuf fromWords(long[] words, int bits) {
    ByteBuf buf = allocate(bits);
    int wordCount = (bits + WORD_BITS - 1) / WORD_BITS;
    for (int w = 0; w < wordCount; w++) {
      long word = words[w];
      if (w == wordCount - 1) {
        word &= mask(bits - w * WORD_BITS);
      }
      buf.setLongLE(w * 8, word);
    }
    return buf;
  }

  /**
   * Reads 64 bits starting at {@code bitOffset}. Bits beyond the bitmap's logical length are unspecified.
   */
  static long readWord(ByteBuf buf, int bitOffset) {
    int byteIndex = bitOffset >>> 3;
    int shift = bitOffset & 7;
    long lo = buf.getLongLE(byteIndex);
    if (shift == 0) {
      return lo;
    }
    long hi = buf.getByte(byteIndex + 8) & 0xFFL;
    return (lo >>> shift) | (hi << (WORD_BITS - shift));
  }

  static boolean get(ByteBuf buf, int bitIndex) {
    return (buf.getByte(bitIndex >>> 3) & (1 << (bitIndex & 7))) != 0;
  }

  static void set(ByteBuf buf, int bitIndex) {
    int byteIndex = bitIndex >>> 3;
    buf.setByte(byteIndex, buf.getByte(byteIndex) | (1 << (bitIndex & 7)));
  }

  /**
   * Counts the cleared bits in {@code [bitOffset, bitOffset + bits)}.
   */
  static int countZeros(ByteBuf buf, int bitOffset, int bits) {
    int zeros = 0;
    for (int start = 0; start < bits; start += WORD_BITS) {
      int n = Math.min(WORD_BITS, bits - start);
      long word = readWord(buf, bitOffset + start) & mask(n);
      zeros += n - Long.bitCount(word);
    }
    return zeros;
  }
}
