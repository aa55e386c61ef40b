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
import org.tessera.exec.vector.compute.EvalContext;

/**
 * A vectorized scalar function: one output row per input row.
 */
public interface ScalarFunction {

  /**
   * @return the canonical name the function is registered under
   */
  String name();

  int getNumArguments();

  /**
   * Resolves the result type without evaluating anything.
   *
   * @throws org.tessera.common.exceptions.UserException if the argument count or types are not accepted
   */
  LogicalType getReturnType(List<LogicalType> argTypes);

  /**
   * Evaluates the function over columns of equal length. The caller owns, and must close, the returned column.
   */
  Column eval(List<Column> columns, EvalContext context);
}
