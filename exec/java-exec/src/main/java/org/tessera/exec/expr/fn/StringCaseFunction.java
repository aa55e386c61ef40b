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

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

import org.tessera.common.exceptions.UserException;
import org.tessera.common.types.LogicalType;
import org.tessera.exec.vector.Column;
import org.tessera.exec.vector.ColumnBuilder;
import org.tessera.exec.vector.TypedColumn;
import org.tessera.exec.vector.compute.EvalContext;

import com.google.common.collect.ImmutableList;

/**
 * {@code upper} and {@code lower} over Utf8, with the case mappings of {@link Locale#ROOT}.
 */
public class StringCaseFunction extends AbstractScalarFunction {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(StringCaseFunction.class);

  private final boolean upper;

  private StringCaseFunction(String name, boolean upper) {
    super(name, 1);
    this.upper = upper;
  }

  public static StringCaseFunction upper() {
    return new StringCaseFunction("upper", true);
  }

  public static StringCaseFunction lower() {
    return new StringCaseFunction("lower", false);
  }

  @Override
  protected LogicalType resolveReturnType(List<LogicalType> argTypes) {
    LogicalType type = argTypes.get(0);
    if (!type.equals(LogicalType.UTF8)) {
      throw UserException.typeMismatchError()
          .message("Function %s expects a Utf8 argument, but got %s", name(), type)
          .addContext("Function", name())
          .build(logger);
    }
    return LogicalType.UTF8;
  }

  @Override
  protected Column doEval(List<Column> columns, EvalContext context) {
    Column input = columns.get(0);
    resolveReturnType(ImmutableList.of(input.getLogicalType()));
    TypedColumn typed = input.getTypedColumn();
    int valueCount = typed.getValueCount();
    try (ColumnBuilder builder = ColumnBuilder.create(LogicalType.UTF8, valueCount)) {
      for (int i = 0; i < valueCount; i++) {
        if (typed.isNull(i)) {
          builder.appendNull();
        } else {
          String value = new String(typed.getBytes(i), StandardCharsets.UTF_8);
          builder.appendString(upper ? value.toUpperCase(Locale.ROOT) : value.toLowerCase(Locale.ROOT));
        }
      }
      return builder.build();
    }
  }
}
