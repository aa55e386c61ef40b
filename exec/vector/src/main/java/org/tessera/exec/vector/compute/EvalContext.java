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

import org.tessera.common.config.CommonConstants;
import org.tessera.common.config.TesseraConfig;

/**
 * Accumulator threaded through one evaluation call. Not thread safe; create one per call.
 */
public class EvalContext {

  private final DivideByZeroPolicy divideByZeroPolicy;

  private long divideByZeroCount;
  private boolean overflow;

  public EvalContext() {
    this(DivideByZeroPolicy.NULL);
  }

  public EvalContext(DivideByZeroPolicy divideByZeroPolicy) {
    this.divideByZeroPolicy = divideByZeroPolicy;
  }

  public static EvalContext fromConfig(TesseraConfig config) {
    return new EvalContext(DivideByZeroPolicy.fromString(
        config.getString(CommonConstants.DIVIDE_BY_ZERO_POLICY, DivideByZeroPolicy.NULL.name())));
  }

  public DivideByZeroPolicy getDivideByZeroPolicy() {
    return divideByZeroPolicy;
  }

  /**
   * @return number of rows nulled because their divisor was zero
   */
  public long getDivideByZeroCount() {
    return divideByZeroCount;
  }

  void recordDivideByZero() {
    divideByZeroCount++;
  }

  /**
   * @return true when an integer result wrapped around its type's width
   */
  public boolean hasOverflowed() {
    return overflow;
  }

  void recordOverflow() {
    overflow = true;
  }
}
