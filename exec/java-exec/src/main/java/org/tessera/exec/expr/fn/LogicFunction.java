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
import java.util.stream.Collectors;

import org.tessera.common.exceptions.UserException;
import org.tessera.common.types.LogicalType;
import org.tessera.exec.vector.BitColumn;
import org.tessera.exec.vector.Column;
import org.tessera.exec.vector.TypedColumn;
import org.tessera.exec.vector.ValidityBitmap;
import org.tessera.exec.vector.compute.BooleanComparisons;
import org.tessera.exec.vector.compute.ComparisonEvaluator;
import org.tessera.exec.vector.compute.EvalContext;

/**
 * SQL three valued logic over Boolean columns, evaluated 64 rows at a time. With data words a, b and validity
 * words va, vb:
 * <pre>
 *   and  value a &amp; b              valid (va &amp; vb) | (va &amp; ~a) | (vb &amp; ~b)
 *   or   value (a &amp; va) | (b &amp; vb)  valid (va &amp; vb) | (va &amp; a) | (vb &amp; b)
 *   xor  value a ^ b              valid va &amp; vb
 * </pre>
 * A known false decides {@code and}, a known true decides {@code or}.
 */
public class LogicFunction extends AbstractScalarFunction {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(LogicFunction.class);

  public enum Operator {
    AND("and", 2),
    OR("or", 2),
    XOR("xor", 2),
    NOT("not", 1);

    private final String functionName;
    private final int numArguments;

    Operator(String functionName, int numArguments) {
      this.functionName = functionName;
      this.numArguments = numArguments;
    }

    public String getFunctionName() {
      return functionName;
    }
  }

  private final Operator op;

  public LogicFunction(Operator op) {
    super(op.functionName, op.numArguments);
    this.op = op;
  }

  @Override
  protected LogicalType resolveReturnType(List<LogicalType> argTypes) {
    for (LogicalType type : argTypes) {
      if (!type.equals(LogicalType.BOOLEAN)) {
        throw UserException.typeMismatchError()
            .message("Function %s expects Boolean arguments, but got %s", name(), type)
            .addContext("Function", name())
            .build(logger);
      }
    }
    return LogicalType.BOOLEAN;
  }

  @Override
  protected Column doEval(List<Column> columns, EvalContext context) {
    resolveReturnType(columns.stream().map(Column::getLogicalType).collect(Collectors.toList()));
    if (op == Operator.NOT) {
      return BooleanComparisons.not(columns.get(0));
    }
    Column left = columns.get(0);
    Column right = columns.get(1);
    ComparisonEvaluator.checkLengths(name(), left, right, logger);

    TypedColumn l = left.getTypedColumn();
    TypedColumn r = right.getTypedColumn();
    int valueCount = l.getValueCount();
    int wordCount = (valueCount + ValidityBitmap.WORD_BITS - 1) / ValidityBitmap.WORD_BITS;
    boolean nullable = l.hasValidity() || r.hasValidity();
    long[] values = new long[wordCount];
    long[] validity = nullable ? new long[wordCount] : null;
    for (int w = 0; w < wordCount; w++) {
      int start = w * ValidityBitmap.WORD_BITS;
      long a = l.getBitWord(start);
      long b = r.getBitWord(start);
      long va = l.getValidityWord(start);
      long vb = r.getValidityWord(start);
      switch (op) {
        case AND:
          values[w] = a & b;
          if (nullable) {
            validity[w] = (va & vb) | (va & ~a) | (vb & ~b);
          }
          break;
        case OR:
          values[w] = (a & va) | (b & vb);
          if (nullable) {
            validity[w] = (va & vb) | (va & a) | (vb & b);
          }
          break;
        case XOR:
          values[w] = a ^ b;
          if (nullable) {
            validity[w] = va & vb;
          }
          break;
        default:
          throw new IllegalStateException("Unexpected operator " + op);
      }
    }
    return BitColumn.fromWords(values, validity, valueCount);
  }
}
