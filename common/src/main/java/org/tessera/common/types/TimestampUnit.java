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

/**
 * Resolution of a timestamp column. Values are ticks of this unit since the epoch.
 */
public enum TimestampUnit {
  SECOND(1L),
  MILLISECOND(1_000L),
  MICROSECOND(1_000_000L),
  NANOSECOND(1_000_000_000L);

  private final long ticksPerSecond;

  TimestampUnit(long ticksPerSecond) {
    this.ticksPerSecond = ticksPerSecond;
  }

  public long ticksPerSecond() {
    return ticksPerSecond;
  }

  /**
   * Converts a millisecond count into ticks of this unit, rounding toward negative infinity for
   * {@link #SECOND}.
   */
  public long fromMillis(long millis) {
    switch (this) {
      case SECOND:
        return Math.floorDiv(millis, 1_000L);
      case MILLISECOND:
        return millis;
      case MICROSECOND:
        return Math.multiplyExact(millis, 1_000L);
      case NANOSECOND:
        return Math.multiplyExact(millis, 1_000_000L);
      default:
        throw new IllegalStateException("Unexpected unit " + this);
    }
  }

  public long toMillis(long ticks) {
    switch (this) {
      case SECOND:
        return Math.multiplyExact(ticks, 1_000L);
      case MILLISECOND:
        return ticks;
      case MICROSECOND:
        return Math.floorDiv(ticks, 1_000L);
      case NANOSECOND:
        return Math.floorDiv(ticks, 1_000_000L);
      default:
        throw new IllegalStateException("Unexpected unit " + this);
    }
  }
}
