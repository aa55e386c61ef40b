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

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.tessera.common.exceptions.UserException;
import org.tessera.exec.vector.compute.ArithmeticOperator;
import org.tessera.exec.vector.compute.ComparisonOperator;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Registry of the built-in scalar functions. Names are case insensitive; every alias of a function creates the
 * same implementation. Functions are stateless, but each lookup hands out a fresh instance.
 */
public class FunctionRegistry {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(FunctionRegistry.class);

  private final ImmutableMap<String, Supplier<ScalarFunction>> factories;

  public FunctionRegistry() {
    Stopwatch watch = Stopwatch.createStarted();
    ImmutableMap.Builder<String, Supplier<ScalarFunction>> builder = ImmutableMap.builder();

    register(builder, () -> new ComparisonFunction(ComparisonOperator.EQ), "=", "eq", "equal");
    register(builder, () -> new ComparisonFunction(ComparisonOperator.NEQ), "!=", "<>", "neq", "not_equal");
    register(builder, () -> new ComparisonFunction(ComparisonOperator.LT), "<", "lt", "less_than");
    register(builder, () -> new ComparisonFunction(ComparisonOperator.LTE), "<=", "lte");
    register(builder, () -> new ComparisonFunction(ComparisonOperator.GT), ">", "gt", "greater_than");
    register(builder, () -> new ComparisonFunction(ComparisonOperator.GTE), ">=", "gte");

    register(builder, () -> new ArithmeticFunction(ArithmeticOperator.ADD), "+", "plus", "add");
    register(builder, () -> new ArithmeticFunction(ArithmeticOperator.SUBTRACT), "-", "minus", "subtract");
    register(builder, () -> new ArithmeticFunction(ArithmeticOperator.MULTIPLY), "*", "multiply");
    register(builder, () -> new ArithmeticFunction(ArithmeticOperator.DIVIDE), "/", "divide");
    register(builder, () -> new ArithmeticFunction(ArithmeticOperator.REMAINDER), "%", "modulo", "remainder");

    for (LogicFunction.Operator op : LogicFunction.Operator.values()) {
      register(builder, () -> new LogicFunction(op), op.getFunctionName());
    }

    register(builder, StringCaseFunction::upper, "upper", "ucase");
    register(builder, StringCaseFunction::lower, "lower", "lcase");

    factories = builder.build();
    logger.debug("Registered {} function names in {}ms", factories.size(), watch.elapsed(TimeUnit.MILLISECONDS));
    if (logger.isTraceEnabled()) {
      logger.trace("Registered functions: {}", getFunctionNames());
    }
  }

  private static void register(ImmutableMap.Builder<String, Supplier<ScalarFunction>> builder,
                               Supplier<ScalarFunction> factory, String... names) {
    for (String name : names) {
      builder.put(name.toLowerCase(Locale.ROOT), factory);
    }
  }

  /**
   * Creates the function registered under {@code name}, ignoring case.
   *
   * @throws UserException of type UNKNOWN_FUNCTION when no function has that name
   */
  public ScalarFunction tryCreate(String name) {
    Supplier<ScalarFunction> factory = factories.get(name.trim().toLowerCase(Locale.ROOT));
    if (factory == null) {
      throw UserException.unknownFunctionError()
          .message("Unsupported function: '%s'", name)
          .build(logger);
    }
    return factory.get();
  }

  public boolean contains(String name) {
    return factories.containsKey(name.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * @return every registered name and alias, sorted
   */
  public Set<String> getFunctionNames() {
    return ImmutableSortedSet.copyOf(factories.keySet());
  }

  public int size() {
    return factories.size();
  }
}
