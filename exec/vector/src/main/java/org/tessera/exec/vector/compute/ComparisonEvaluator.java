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
package org.tessera.exec.vector.compute;

import org.tessera.common.exceptions.UserException;
import org.tessera.common.types.LogicalType;
import org.tessera.common.types.TypeId;
import org.tessera.common.types.TypePrecedence;
import org.tessera.exec.vector.Column;
import org.tessera.exec.vector.FixedWidthColumn;
import org.tessera.exec.vector.PhysicalTypeMapper;
import org.tessera.exec.vector.ScalarValue;
import org.tessera.exec.vector.TypedColumn;

/**
 * Evaluates a comparison over two columns of equal length and picks the execution path from the operand shapes:
 * <ul>
 * <li>temporal operands of one type are compared through their physical type,</li>
 * <li>Boolean operands word by word,</li>
 * <li>Utf8 and Binary operands as raw bytes,</li>
 * <li>two vectors of one primitive type with a lane kernel in batches of 64 rows,</li>
 * <li>any other numeric pair row by row in its promotion type.</li>
 * </ul>
 * A row of the result is null when the row is null in either operand.
 */
public final class ComparisonEvaluator {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ComparisonEvaluator.class);

  private ComparisonEvaluator() {
  }

  public static Column evaluate(ComparisonOperator op, Column left, Column right) {
    checkLengths(op.getSymbol(), left, right, logger);
    LogicalType leftType = left.getLogicalType();
    LogicalType rightType = right.getLogicalType();
    checkComparable(op, leftType, rightType);

    if (leftType.isTemporal()) {
      logger.debug("Comparing {} {} {} through its physical type", leftType, op.getSymbol(), rightType);
      return PhysicalTypeMapper.dispatch(left, right, (l, r) -> evaluate(op, l, r));
    }

    TypedColumn l = left.getTypedColumn();
    TypedColumn r = right.getTypedColumn();

    if (leftType.getTypeId() == TypeId.BOOLEAN) {
      logger.debug("Comparing Boolean operands word wise");
      if (r.isConstant() && !l.isConstant()) {
        return BooleanComparisons.vectorConst(op, left, constantValue(r));
      }
      if (l.isConstant() && !r.isConstant()) {
        return BooleanComparisons.constVector(op, constantValue(l), right);
      }
      return BooleanComparisons.vectorVector(op, left, right);
    }

    if (leftType.isBinaryLike()) {
      logger.debug("Comparing {} {} {} as raw bytes", leftType, op.getSymbol(), rightType);
      return ByteComparisons.compare(op, l, r);
    }

    if (LaneKernels.applies(l, r, op)) {
      logger.debug("Comparing {} {} {} in lanes of {}", leftType, op.getSymbol(), rightType, LaneKernels.LANE_WIDTH);
      return LaneKernels.compare(op, (FixedWidthColumn) l, (FixedWidthColumn) r);
    }

    TypeId promotion = TypePrecedence.getPromotionType(leftType.getTypeId(), rightType.getTypeId()).get();
    logger.debug("Comparing {} {} {} promoted to {}", leftType, op.getSymbol(), rightType, promotion);
    return PromotionKernels.compare(op, l, r, promotion);
  }

  /**
   * Fails with TYPE_MISMATCH unless {@code op} can compare the two types: temporal operands of one type,
   * two Booleans, two of Utf8 and Binary, or numeric operands with a promotion type.
   */
  public static void checkComparable(ComparisonOperator op, LogicalType leftType, LogicalType rightType) {
    boolean comparable;
    if (leftType.isTemporal() || rightType.isTemporal()
        || leftType.getTypeId() == TypeId.BOOLEAN || rightType.getTypeId() == TypeId.BOOLEAN) {
      comparable = leftType.equals(rightType);
    } else if (leftType.isBinaryLike() || rightType.isBinaryLike()) {
      comparable = leftType.isBinaryLike() && rightType.isBinaryLike();
    } else {
      comparable = TypePrecedence.getPromotionType(leftType.getTypeId(), rightType.getTypeId()).isPresent();
    }
    if (!comparable) {
      throw mismatch(op, leftType, rightType);
    }
  }

  private static ScalarValue constantValue(TypedColumn constant) {
    return constant.isNull(0)
        ? ScalarValue.nullOf(constant.getLogicalType())
        : ScalarValue.ofBoolean(constant.getBoolean(0));
  }

  private static UserException mismatch(ComparisonOperator op, LogicalType left, LogicalType right) {
    return UserException.typeMismatchError()
        .message("Cannot compare %s with %s", left, right)
        .addContext("Operator", op.getSymbol())
        .build(logger);
  }

  public static void checkLengths(String operator, Column left, Column right, org.slf4j.Logger callerLogger) {
    if (left.getValueCount() != right.getValueCount()) {
      throw UserException.functionError()
          .message("Operands of %s have different lengths: %d and %d",
              operator, left.getValueCount(), right.getValueCount())
          .build(callerLogger);
    }
  }
}
