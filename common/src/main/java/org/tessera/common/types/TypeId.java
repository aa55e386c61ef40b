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
 * Identifies the family of a {@link LogicalType}. Parameterized families (timestamps and intervals) carry
 * their parameters on the logical type itself.
 */
public enum TypeId {
  INT8("Int8", 1),
  INT16("Int16", 2),
  INT32("Int32", 4),
  INT64("Int64", 8),
  UINT8("UInt8", 1),
  UINT16("UInt16", 2),
  UINT32("UInt32", 4),
  UINT64("UInt64", 8),
  FLOAT32("Float32", 4),
  FLOAT64("Float64", 8),
  /** Bit packed, one bit per row. */
  BOOLEAN("Boolean", 0),
  UTF8("Utf8", -1),
  BINARY("Binary", -1),
  /** Days since the epoch. */
  DATE32("Date32", 4),
  /** Milliseconds since the epoch. */
  DATE64("Date64", 8),
  TIMESTAMP("Timestamp", 8),
  /** Width depends on the interval unit. */
  INTERVAL("Interval", -1);

  private final String displayName;
  private final int byteWidth;

  TypeId(String displayName, int byteWidth) {
    this.displayName = displayName;
    this.byteWidth = byteWidth;
  }

  public String getDisplayName() {
    return displayName;
  }

  /**
   * @return width in bytes of one element, 0 for bit packed types and -1 for variable width or
   *         parameter dependent widths
   */
  int getByteWidth() {
    return byteWidth;
  }

  public boolean isNumeric() {
    return isInteger() || isFloatingPoint();
  }

  public boolean isInteger() {
    switch (this) {
      case INT8:
      case INT16:
      case INT32:
      case INT64:
      case UINT8:
      case UINT16:
      case UINT32:
      case UINT64:
        return true;
      default:
        return false;
    }
  }

  public boolean isSigned() {
    switch (this) {
      case INT8:
      case INT16:
      case INT32:
      case INT64:
      case FLOAT32:
      case FLOAT64:
        return true;
      default:
        return false;
    }
  }

  public boolean isFloatingPoint() {
    return this == FLOAT32 || this == FLOAT64;
  }

  public boolean isTemporal() {
    switch (this) {
      case DATE32:
      case DATE64:
      case TIMESTAMP:
      case INTERVAL:
        return true;
      default:
        return false;
    }
  }

  public boolean isBinaryLike() {
    return this == UTF8 || this == BINARY;
  }
}
