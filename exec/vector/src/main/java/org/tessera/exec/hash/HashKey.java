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
package org.tessera.exec.hash;

import java.security.SecureRandom;
import java.util.Locale;

import org.tessera.common.config.CommonConstants;
import org.tessera.common.config.TesseraConfig;
import org.tessera.common.exceptions.UserException;

import com.google.common.io.BaseEncoding;
import com.google.common.primitives.Longs;

/**
 * The 128 bit key of the SipHash-2-4 function used by {@link KeyedHashing}.
 */
public final class HashKey {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(HashKey.class);

  private static final SecureRandom RANDOM = new SecureRandom();

  private final long k0;
  private final long k1;

  public HashKey(long k0, long k1) {
    this.k0 = k0;
    this.k1 = k1;
  }

  public static HashKey random() {
    return new HashKey(RANDOM.nextLong(), RANDOM.nextLong());
  }

  /**
   * @param hex 32 hexadecimal digits, k0 first
   */
  public static HashKey fromHex(String hex) {
    String digits = hex.trim().toLowerCase(Locale.ROOT);
    if (digits.length() != 32) {
      throw invalidKey(hex, null);
    }
    try {
      byte[] bytes = BaseEncoding.base16().lowerCase().decode(digits);
      return new HashKey(Longs.fromBytes(bytes[0], bytes[1], bytes[2], bytes[3], bytes[4], bytes[5], bytes[6],
          bytes[7]), Longs.fromBytes(bytes[8], bytes[9], bytes[10], bytes[11], bytes[12], bytes[13], bytes[14],
          bytes[15]));
    } catch (IllegalArgumentException e) {
      throw invalidKey(hex, e);
    }
  }

  /**
   * Reads {@link CommonConstants#HASH_KEY}. An empty value draws a random key.
   */
  public static HashKey fromConfig(TesseraConfig config) {
    String hex = config.getString(CommonConstants.HASH_KEY, "");
    if (hex.isEmpty()) {
      return random();
    }
    return fromHex(hex);
  }

  private static UserException invalidKey(String hex, Throwable cause) {
    return UserException.systemError(cause)
        .message("Invalid value '%s' for %s, expected 32 hexadecimal digits", hex, CommonConstants.HASH_KEY)
        .build(logger);
  }

  public long getK0() {
    return k0;
  }

  public long getK1() {
    return k1;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HashKey)) {
      return false;
    }
    HashKey that = (HashKey) o;
    return k0 == that.k0 && k1 == that.k1;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(k0) * 31 + Long.hashCode(k1);
  }

  @Override
  public String toString() {
    // never print key material
    return "HashKey[...]";
  }
}
