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

public interface CommonConstants {
  public static final String CONFIG_DEFAULT = "tessera-default.conf";
  public static final String CONFIG_OVERRIDE = "tessera-override.conf";

  /** {@code null} turns rows divided by zero into nulls, {@code error} fails the evaluation. */
  public static final String DIVIDE_BY_ZERO_POLICY = "tessera.exec.arithmetic.divide_by_zero";
  /** Empty for a random SipHash key per process, else 32 hex digits. */
  public static final String HASH_KEY = "tessera.exec.hash.key";
  /** Address of the remote catalog store. Empty means no remote store. */
  public static final String CATALOG_STORE_ADDRESS = "tessera.catalog.store.address";
}
