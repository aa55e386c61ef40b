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
package org.tessera.common.types;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TestCastRules {

  @Test
  public void testNumericCasts() {
    assertTrue(CastRules.isCastable(LogicalType.INT64, LogicalType.INT32));
    assertTrue(CastRules.isCastable(LogicalType.FLOAT64, LogicalType.UINT8));
    assertTrue(CastRules.isCastable(LogicalType.BOOLEAN, LogicalType.INT32));
  }

  @Test
  public void testEverythingCastsToUtf8() {
    for (TypeId typeId : TypeId.values()) {
      assertTrue(typeId.toString(), CastRules.isCastable(typeId, TypeId.UTF8));
    }
  }

  @Test
  public void testTemporalCasts() {
    assertTrue(CastRules.isCastable(LogicalType.DATE32, LogicalType.INT32));
    assertTrue(CastRules.isCastable(LogicalType.DATE32, LogicalType.DATE64));
    assertTrue(CastRules.isCastable(LogicalType.timestamp(TimestampUnit.SECOND), LogicalType.DATE64));
    assertFalse(CastRules.isCastable(LogicalType.FLOAT64, LogicalType.DATE32));
    assertFalse(CastRules.isCastable(LogicalType.INTERVAL_DAY_TIME, LogicalType.INTERVAL_YEAR_MONTH));
    assertFalse(CastRules.isCastable(LogicalType.INTERVAL_DAY_TIME, LogicalType.DATE64));
  }

  @Test
  public void testBinary() {
    assertTrue(CastRules.isCastable(LogicalType.UTF8, LogicalType.BINARY));
    assertFalse(CastRules.isCastable(LogicalType.INT32, LogicalType.BINARY));
  }
}
