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

import org.tessera.common.exceptions.UserException;
import org.tessera.common.types.LogicalType;
import org.tessera.exec.vector.Column;
import org.tessera.exec.vector.compute.EvalContext;

/**
 * Checks the argument count before handing over to the function body.
 */
public abstract class AbstractScalarFunction implements ScalarFunction {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(AbstractScalarFunction.class);

  private final String name;
  private final int numArguments;

  protected AbstractScalarFunction(String name, int numArguments) {
    this.name = name;
    this.numArguments = numArguments;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public int getNumArguments() {
    return numArguments;
  }

  @Override
  public final LogicalType getReturnType(List<LogicalType> argTypes) {
    checkArgumentCount(argTypes.size());
    return resolveReturnType(argTypes);
  }

  @Override
  public final Column eval(List<Column> columns, EvalContext context) {
    checkArgumentCount(columns.size());
    return doEval(columns, context);
  }

  protected abstract LogicalType resolveReturnType(List<LogicalType> argTypes);

  protected abstract Column doEval(List<Column> columns, EvalContext context);

  private void checkArgumentCount(int actual) {
    if (actual != numArguments) {
      throw UserException.functionError()
          .message("Function %s expects %d argument%s, but got %d", name, numArguments,
              numArguments == 1 ? "" : "s", actual)
          .addContext("Function", name)
          .build(logger);
    }
  }

  @Override
  public String toString() {
    return name + "/" + numArguments;
  }
}
