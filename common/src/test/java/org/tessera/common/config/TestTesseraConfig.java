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
package org.tessera.common.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Properties;

import org.junit.Test;
import org.tessera.common.exceptions.ErrorType;
import org.tessera.common.exceptions.UserException;

public class TestTesseraConfig {

  @Test
  public void testDefaults() {
    TesseraConfig config = TesseraConfig.create();

    assertEquals("null", config.getString(CommonConstants.DIVIDE_BY_ZERO_POLICY));
    assertEquals("", config.getString(CommonConstants.HASH_KEY));
    assertEquals("fallback", config.getString(CommonConstants.CATALOG_STORE_ADDRESS, "fallback"));
  }

  @Test
  public void testOverrideFile() {
    TesseraConfig config = TesseraConfig.create("tessera-test-override.conf", null);

    assertEquals("error", config.getString(CommonConstants.DIVIDE_BY_ZERO_POLICY));
    assertEquals("store-host:9191", config.getString(CommonConstants.CATALOG_STORE_ADDRESS));
    // untouched keys fall back to the defaults
    assertTrue(config.hasPath(CommonConstants.HASH_KEY));
  }

  @Test
  public void testPropertiesWinOverFiles() {
    Properties props = new Properties();
    props.put(CommonConstants.DIVIDE_BY_ZERO_POLICY, "null");

    TesseraConfig config = TesseraConfig.create("tessera-test-override.conf", props);

    assertEquals("null", config.getString(CommonConstants.DIVIDE_BY_ZERO_POLICY));
  }

  @Test
  public void testWithValue() {
    TesseraConfig config = TesseraConfig.create().withValue(CommonConstants.HASH_KEY, "00");

    assertEquals("00", config.getString(CommonConstants.HASH_KEY));
    assertFalse(config.hasPath("tessera.no.such.key"));
  }

  @Test
  public void testMissingKey() {
    try {
      TesseraConfig.create().getString("tessera.no.such.key");
    } catch (UserException e) {
      assertEquals(ErrorType.SYSTEM, e.getErrorType());
      return;
    }
    throw new AssertionError("expected a failure");
  }
}
