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
package org.tessera.common.exceptions;

/**
 * Classification of every error raised by the engine. Each {@link UserException} carries exactly one.
 */
public enum ErrorType {
  /** No defined or lossless mapping between two logical types. */
  UNSUPPORTED_CAST,
  /** Operands are not comparable or arithmetic-compatible and no promotion exists. */
  TYPE_MISMATCH,
  /** Row index at or beyond the column length. */
  INDEX_OUT_OF_RANGE,
  /** Division or remainder by zero under the error policy. */
  DIVIDE_BY_ZERO,
  /** No function registered under the requested name. */
  UNKNOWN_FUNCTION,
  /** A function was invoked with arguments it cannot accept. */
  FUNCTION,
  UNKNOWN_DATABASE,
  DATABASE_ALREADY_EXISTS,
  UNKNOWN_TABLE,
  UNKNOWN_TABLE_FUNCTION,
  /** A programming error. Must fail fast and never be retried. */
  INVARIANT_VIOLATION,
  /** Anything that was not classified when it was raised. */
  SYSTEM
}
