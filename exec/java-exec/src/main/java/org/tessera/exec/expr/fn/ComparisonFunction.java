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

import org.tessera.common.types.LogicalType;
import org.tessera.exec.vector.Column;
import org.tessera.exec.vector.compute.ComparisonEvaluator;
import org.tessera.exec.vector.compute.ComparisonOperator;
import org.tessera.exec.vector.compute.EvalContext;

public class ComparisonFunction extends AbstractScalarFunction {

  private final ComparisonOperator op;

  public ComparisonFunction(ComparisonOperator op) {
    super(op.getSymbol(), 2);
    this.op = op;
  }

  public ComparisonOperator getOperator() {
    return op;
  }

  @Override
  protected LogicalType resolveReturnType(List<LogicalType> argTypes) {
    ComparisonEvaluator.checkComparable(op, argTypes.get(0), argTypes.get(1));
    return LogicalType.BOOLEAN;
  }

  @Override
  protected Column doEval(List<Column> columns, EvalContext context) {
    return ComparisonEvaluator.evaluate(op, columns.get(0), columns.get(1));
  }
}
