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

import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

import org.tessera.common.exceptions.UserException;
import org.tessera.common.types.IntervalUnit;
import org.tessera.common.types.LogicalType;
import org.tessera.common.util.function.CheckedFunction;

/**
 * Lets date, timestamp and interval columns reuse the kernels of the integer type backing them.
 * <p>For a column of logical type L backed by P = {@link #physicalOf(LogicalType)}, every dispatch variant
 * <ol>
 * <li>reinterprets the operand as P without copying,</li>
 * <li>runs the operation,</li>
 * <li>reinterprets the result back to L when its type is exactly P, and passes it through otherwise (a
 * comparison yields Boolean).</li>
 * </ol>
 * Intermediate columns are closed before returning.
 */
public final class PhysicalTypeMapper {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(PhysicalTypeMapper.class);

  private PhysicalTypeMapper() {
  }

  /**
   * @return the primitive type backing a temporal type
   * @throws UserException INVARIANT_VIOLATION when {@code type} is already physical
   */
  public static LogicalType physicalOf(LogicalType type) {
    switch (type.getTypeId()) {
      case DATE32:
        return LogicalType.INT32;
      case DATE64:
      case TIMESTAMP:
        return LogicalType.INT64;
      case INTERVAL:
        return type.getIntervalUnit() == IntervalUnit.YEAR_MONTH ? LogicalType.INT32 : LogicalType.INT64;
      default:
        throw UserException.invariantViolation()
            .message("%s has a native representation and cannot be mapped to a physical type", type)
            .build(logger);
    }
  }

  /**
   * @return the type whose element comparison applies to values of {@code type}: the backing type for
   *         temporal types, Binary for Utf8 and the type itself otherwise
   */
  public static LogicalType representationOf(LogicalType type) {
    if (type.isTemporal()) {
      return physicalOf(type);
    }
    if (type.isBinaryLike()) {
      return LogicalType.BINARY;
    }
    return type;
  }

  /**
   * Runs an operation that cannot fail on the physical form of {@code column}.
   */
  public static Column dispatch(Column column, Function<Column, Column> operation) {
    LogicalType logical = column.getLogicalType();
    LogicalType physical = physicalOf(logical);
    Column result;
    try (Column reinterpreted = column.castTo(physical)) {
      result = operation.apply(reinterpreted);
    }
    return restoreOrFail(result, logical, physical);
  }

  /**
   * Binary flavour of {@link #dispatch(Column, Function)}. The restored type is the one of {@code left};
   * temporal operands on either side are reinterpreted, physical ones are passed as they are.
   */
  public static Column dispatch(Column left, Column right, BiFunction<Column, Column, Column> operation) {
    LogicalType logical = left.getLogicalType();
    LogicalType physical = physicalOf(logical);
    Column result;
    try (Column leftPhysical = left.castTo(physical);
         Column rightPhysical = toPhysical(right)) {
      result = operation.apply(leftPhysical, rightPhysical == null ? right : rightPhysical);
    }
    return restoreOrFail(result, logical, physical);
  }

  /**
   * Runs an operation that may fail. Errors of the operation propagate unchanged, a failing restore becomes an
   * UNSUPPORTED_CAST error.
   */
  public static <E extends Exception> Column tryDispatch(Column column, CheckedFunction<Column, Column, E> operation)
      throws E {
    LogicalType logical = column.getLogicalType();
    LogicalType physical = physicalOf(logical);
    Column result;
    try (Column reinterpreted = column.castTo(physical)) {
      result = operation.apply(reinterpreted);
    }
    if (!result.getLogicalType().equals(physical)) {
      return result;
    }
    try (Column toRestore = result) {
      return toRestore.castTo(logical);
    } catch (UserException e) {
      throw UserException.unsupportedCastError()
          .message("Cannot restore %s to %s: %s", physical, logical, e.getOriginalMessage())
          .addContext("Cause error id", e.getErrorId())
          .build(logger);
    }
  }

  /**
   * Runs an operation that may produce no column. An empty result is passed through.
   */
  public static Optional<Column> optionalDispatch(Column column, Function<Column, Optional<Column>> operation) {
    LogicalType logical = column.getLogicalType();
    LogicalType physical = physicalOf(logical);
    Optional<Column> result;
    try (Column reinterpreted = column.castTo(physical)) {
      result = operation.apply(reinterpreted);
    }
    return result.map(c -> restoreOrFail(c, logical, physical));
  }

  /**
   * Reinterprets {@code column} as its physical type and applies {@code operation} to it, without restoring
   * anything. Used where only the stored values matter, such as hashing.
   */
  public static <T> T castAndApply(Column column, Function<Column, T> operation) {
    try (Column reinterpreted = column.castTo(physicalOf(column.getLogicalType()))) {
      return operation.apply(reinterpreted);
    }
  }

  private static Column toPhysical(Column column) {
    LogicalType type = column.getLogicalType();
    return type.isTemporal() ? column.castTo(physicalOf(type)) : null;
  }

  private static Column restoreOrFail(Column result, LogicalType logical, LogicalType physical) {
    if (!result.getLogicalType().equals(physical)) {
      return result;
    }
    try (Column toRestore = result) {
      return toRestore.castTo(logical);
    } catch (UserException e) {
      // a wrapped user exception would keep its own type, so only its message is carried over
      throw UserException.invariantViolation()
          .message("Cannot restore %s to %s: %s", physical, logical, e.getOriginalMessage())
          .addContext("Cause error id", e.getErrorId())
          .build(logger);
    }
  }
}
