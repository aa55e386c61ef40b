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

import java.util.Optional;

import org.tessera.common.exceptions.UserException;
import org.tessera.common.types.LogicalType;
import org.tessera.common.types.TypeId;
import org.tessera.common.types.TypePrecedence;
import org.tessera.exec.vector.Column;

/**
 * Evaluates an arithmetic operator over two columns of equal length. Numeric operands are promoted to their
 * common type, temporal operands are handled by {@link TemporalArithmetic}.
 */
public final class ArithmeticEvaluator {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ArithmeticEvaluator.class);

  private ArithmeticEvaluator() {
  }

  public static Column evaluate(ArithmeticOperator op, Column left, Column right, EvalContext context) {
    ComparisonEvaluator.checkLengths(op.getSymbol(), left, right, logger);
    LogicalType leftType = left.getLogicalType();
    LogicalType rightType = right.getLogicalType();

    if (leftType.isTemporal() || rightType.isTemporal()) {
      return TemporalArithmetic.evaluate(op, left, right, context);
    }

    Optional<TypeId> promotion = TypePrecedence.getPromotionType(leftType.getTypeId(), rightType.getTypeId());
    if (!promotion.isPresent()) {
      throw mismatch(op, leftType, rightType);
    }
    logger.debug("Evaluating {} {} {} promoted to {}", leftType, op.getSymbol(), rightType, promotion.get());
    return ArithmeticKernels.apply(op, left.getTypedColumn(), right.getTypedColumn(), promotion.get(), context);
  }

  static UserException mismatch(ArithmeticOperator op, LogicalType left, LogicalType right) {
    return UserException.typeMismatchError()
        .message("Cannot apply %s to %s and %s", op.getSymbol(), left, right)
        .build(logger);
  }
}
