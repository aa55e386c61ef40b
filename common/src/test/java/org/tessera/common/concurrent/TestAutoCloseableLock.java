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
package org.tessera.common.concurrent;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.junit.Test;

public class TestAutoCloseableLock {

  @Test
  public void testReleasedOnClose() {
    ReentrantReadWriteLock readWriteLock = new ReentrantReadWriteLock();
    AutoCloseableLock writeLock = new AutoCloseableLock(readWriteLock.writeLock());
    try (AutoCloseableLock lock = writeLock.open()) {
      assertTrue(readWriteLock.isWriteLockedByCurrentThread());
    }
    assertFalse(readWriteLock.isWriteLocked());
  }

  @Test
  public void testReleasedOnException() {
    ReentrantReadWriteLock readWriteLock = new ReentrantReadWriteLock();
    AutoCloseableLock readLock = new AutoCloseableLock(readWriteLock.readLock());
    try (AutoCloseableLock lock = readLock.open()) {
      assertEquals(1, readWriteLock.getReadLockCount());
      throw new IllegalStateException("boom");
    } catch (IllegalStateException e) {
      assertEquals("boom", e.getMessage());
    }
    assertEquals(0, readWriteLock.getReadLockCount());
  }
}
