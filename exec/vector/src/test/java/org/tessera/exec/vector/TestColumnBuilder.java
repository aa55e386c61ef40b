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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.time.Instant;

import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.tessera.categories.VectorTest;
import org.tessera.common.types.LogicalType;
import org.tessera.common.types.TimestampUnit;

@Category(VectorTest.class)
public class TestColumnBuilder {

  @Test
  public void testGrowsPastInitialAllocation() {
    try (ColumnBuilder builder = ColumnBuilder.create(LogicalType.INT16, 1)) {
      for (int i = 0; i < 300; i++) {
        if (i % 7 == 0) {
          builder.appendNull();
        } else {
          builder.appendLong(i);
        }
      }
      assertEquals(300, builder.getCount());
      try (Column column = builder.build()) {
        assertEquals(300, column.getValueCount());
        assertEquals(43, column.getNullCount());
        assertTrue(column.isNull(294));
        assertEquals(Short.valueOf((short) 299), column.getObject(299));
        assertEquals(Short.valueOf((short) 130), column.getObject(130));
      }
    }
  }

  @Test
  public void testBooleans() {
    try (ColumnBuilder builder = ColumnBuilder.create(LogicalType.BOOLEAN)) {
      for (int i = 0; i < 130; i++) {
        builder.appendBoolean(i % 3 == 0);
      }
      try (Column column = builder.build()) {
        assertEquals(0, column.getNullCount());
        assertFalse(column.getTypedColumn().hasValidity());
        assertEquals(Boolean.TRUE, column.getObject(129));
        assertEquals(Boolean.FALSE, column.getObject(128));
      }
    }
  }

  @Test
  public void testVariableWidth() {
    try (ColumnBuilder builder = ColumnBuilder.create(LogicalType.UTF8, 2)) {
      builder.appendString("héllo").appendNull().appendString("").appendString(null);
      try (Column column = builder.build()) {
        assertEquals("héllo", column.getObject(0));
        assertNull(column.getObject(1));
        assertEquals("", column.getObject(2));
        assertEquals(2, column.getNullCount());
      }
    }
  }

  @Test
  public void testFloatColumnAcceptsLongs() {
    try (ColumnBuilder builder = ColumnBuilder.create(LogicalType.FLOAT32)) {
      builder.appendLong(3).appendDouble(0.5);
      try (Column column = builder.build()) {
        assertEquals(Float.valueOf(3f), column.getObject(0));
        assertEquals(Float.valueOf(0.5f), column.getObject(1));
      }
    }
  }

  @Test
  public void testTimestampFromInstant() {
    LogicalType micros = LogicalType.timestamp(TimestampUnit.MICROSECOND, "UTC");
    try (ColumnBuilder builder = ColumnBuilder.create(micros)) {
      builder.appendObject(Instant.ofEpochSecond(2, 5_000));
      try (Column column = builder.build()) {
        assertEquals(micros, column.getLogicalType());
        assertEquals(Instant.ofEpochSecond(2, 5_000), column.getObject(0));
        try (Column raw = column.castTo(LogicalType.INT64)) {
          assertEquals(Long.valueOf(2_000_005L), raw.getObject(0));
        }
      }
    }
  }

  @Test
  public void testAppendFrom() {
    try (Column source = Columns.int64(5L, null, 7L);
         ColumnBuilder builder = ColumnBuilder.create(LogicalType.INT64)) {
      builder.appendFrom(source.getTypedColumn(), 2).appendFrom(source.getTypedColumn(), 1);
      try (Column column = builder.build()) {
        assertEquals(Long.valueOf(7L), column.getObject(0));
        assertTrue(column.isNull(1));
      }
    }
  }

  @Test(expected = IllegalStateException.class)
  public void testBuildTwice() {
    try (ColumnBuilder builder = ColumnBuilder.create(LogicalType.INT32)) {
      builder.build().close();
      builder.build();
    }
  }
}
