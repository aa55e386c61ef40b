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
package org.tessera.exec.expr.fn;

import java.util.List;
import java.util.Optional;

import org.tessera.common.exceptions.UserException;
import org.tessera.common.types.LogicalType;
import org.tessera.common.types.TypeId;
import org.tessera.common.types.TypePrecedence;
import org.tessera.exec.vector.Column;
import org.tessera.exec.vector.compute.ArithmeticEvaluator;
import org.tessera.exec.vector.compute.ArithmeticKernels;
import org.tessera.exec.vector.compute.ArithmeticOperator;
import org.tessera.exec.vector.compute.EvalContext;

public class ArithmeticFunction extends AbstractScalarFunction {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ArithmeticFunction.class);

  private final ArithmeticOperator op;

  public ArithmeticFunction(ArithmeticOperator op) {
    super(op.getSymbol(), 2);
    this.op = op;
  }

  public ArithmeticOperator getOperator() {
    return op;
  }

  /**
   * Mirrors the type rules of {@link ArithmeticEvaluator}: numeric operands yield the result type of their
   * promotion, a point in time shifted by an interval keeps its type and two operands of one temporal type keep
   * it except under division.
   */
  @Override
  protected LogicalType resolveReturnType(List<LogicalType> argTypes) {
    LogicalType left = argTypes.get(0);
    LogicalType right = argTypes.get(1);
    if (!left.isTemporal() && !right.isTemporal()) {
      Optional<TypeId> promotion = TypePrecedence.getPromotionType(left.getTypeId(), right.getTypeId());
      if (promotion.isPresent()) {
        return ArithmeticKernels.resultType(op, promotion.get());
      }
    } else if (left.equals(right)) {
      return op == ArithmeticOperator.DIVIDE ? LogicalType.FLOAT64 : left;
    } else if (op == ArithmeticOperator.ADD && isInterval(left) && isPointInTime(right)) {
      return right;
    } else if ((op == ArithmeticOperator.ADD || op == ArithmeticOperator.SUBTRACT)
        && isPointInTime(left) && isInterval(right)) {
      return left;
    }
    throw UserException.typeMismatchError()
        .message("Cannot apply %s to %s and %s", op.getSymbol(), left, right)
        .build(logger);
  }

  private static boolean isInterval(LogicalType type) {
    return type.getTypeId() == TypeId.INTERVAL;
  }

  private static boolean isPointInTime(LogicalType type) {
    return type.isTemporal() && !isInterval(type);
  }

  @Override
  protected Column doEval(List<Column> columns, EvalContext context) {
    return ArithmeticEvaluator.evaluate(op, columns.get(0), columns.get(1), context);
  }
}
