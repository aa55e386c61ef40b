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

/**
 * The six comparison operators.
 */
public enum ComparisonOperator {
  EQ("="),
  NEQ("!="),
  LT("<"),
  LTE("<="),
  GT(">"),
  GTE(">=");

  private final String symbol;

  ComparisonOperator(String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }

  /**
   * @return the operator giving the same result with the operands swapped
   */
  public ComparisonOperator flip() {
    switch (this) {
      case LT:
        return GT;
      case LTE:
        return GTE;
      case GT:
        return LT;
      case GTE:
        return LTE;
      default:
        return this;
    }
  }

  /**
   * @param cmp negative, zero or positive as the left operand is less than, equal to or greater than the right
   */
  public boolean test(int cmp) {
    switch (this) {
      case EQ:
        return cmp == 0;
      case NEQ:
        return cmp != 0;
      case LT:
        return cmp < 0;
      case LTE:
        return cmp <= 0;
      case GT:
        return cmp > 0;
      case GTE:
        return cmp >= 0;
      default:
        throw new IllegalStateException("Unexpected operator " + this);
    }
  }
}
