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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.tessera.categories.VectorTest;

import io.netty.buffer.ByteBuf;

@Category(VectorTest.class)
public class TestValidityBitmap {

  @Test
  public void testPadding() {
    assertEquals(8, ValidityBitmap.paddedByteLength(0));
    assertEquals(16, ValidityBitmap.paddedByteLength(1));
    assertEquals(16, ValidityBitmap.paddedByteLength(64));
    assertEquals(24, ValidityBitmap.paddedByteLength(65));
  }

  @Test
  public void testFromWordsClearsTail() {
    ByteBuf buf = ValidityBitmap.fromWords(new long[] {-1L}, 10);
    try {
      assertEquals(0x3FFL, ValidityBitmap.readWord(buf, 0));
      assertEquals(0, ValidityBitmap.countZeros(buf, 0, 10));
    } finally {
      buf.release();
    }
  }

  @Test
  public void testReadWordAtUnalignedOffset() {
    ByteBuf buf = ValidityBitmap.fromWords(new long[] {0xF0L, 0x1L}, 128);
    try {
      assertEquals(0xFL, ValidityBitmap.readWord(buf, 4) & 0xFFL);
      // bit 64 lands at position 61 when reading from bit 3
      assertEquals(1L, ValidityBitmap.readWord(buf, 3) >>> 61);
    } finally {
      buf.release();
    }
  }

  @Test
  public void testGetSetAndCount() {
    ByteBuf buf = ValidityBitmap.allocate(100);
    try {
      assertEquals(100, ValidityBitmap.countZeros(buf, 0, 100));
      ValidityBitmap.set(buf, 3);
      ValidityBitmap.set(buf, 70);
      assertTrue(ValidityBitmap.get(buf, 3));
      assertTrue(ValidityBitmap.get(buf, 70));
      assertFalse(ValidityBitmap.get(buf, 4));
      assertEquals(98, ValidityBitmap.countZeros(buf, 0, 100));
      assertEquals(66, ValidityBitmap.countZeros(buf, 4, 67));
    } finally {
      buf.release();
    }
  }

  @Test
  public void testMask() {
    assertEquals(0L, ValidityBitmap.mask(0));
    assertEquals(0x7L, ValidityBitmap.mask(3));
    assertEquals(-1L, ValidityBitmap.mask(64));
  }
}
