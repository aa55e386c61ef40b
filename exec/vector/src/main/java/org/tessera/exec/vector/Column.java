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
package org.tessera.exec.vector;

import org.tessera.common.exceptions.UserException;
import org.tessera.common.types.LogicalType;
import org.tessera.exec.hash.HashKey;
import org.tessera.exec.hash.KeyedHashing;
import org.tessera.exec.vector.compute.ArithmeticEvaluator;
import org.tessera.exec.vector.compute.ArithmeticOperator;
import org.tessera.exec.vector.compute.EvalContext;

/**
 * Type erased handle over a {@link TypedColumn}. Every operation returns a new column and leaves this one
 * untouched; the caller owns and closes what it gets back.
 * <p>Row indexes are checked here. Out of range indexes raise an {@code INDEX_OUT_OF_RANGE} user exception.
 */
public final class Column implements AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(Column.class);

  private final TypedColumn column;

  public Column(TypedColumn column) {
    this.column = column;
  }

  public TypedColumn getTypedColumn() {
    return column;
  }

  public LogicalType getLogicalType() {
    return column.getLogicalType();
  }

  public int getValueCount() {
    return column.getValueCount();
  }

  public boolean isEmpty() {
    return column.getValueCount() == 0;
  }

  public int getNullCount() {
    return column.getNullCount();
  }

  public long getMemoryFootprint() {
    return column.getMemoryFootprint();
  }

  public boolean isConstant() {
    return column.isConstant();
  }

  private void checkIndex(int index) {
    if (index < 0 || index >= column.getValueCount()) {
      throw UserException.indexOutOfRangeError()
          .message("Index %d out of range for a column of length %d", index, column.getValueCount())
          .addContext("Type", getLogicalType().toString())
          .build(logger);
    }
  }

  public boolean isNull(int index) {
    checkIndex(index);
    return column.isNull(index);
  }

  public ScalarValue tryGet(int index) {
    checkIndex(index);
    return ScalarValue.fromColumn(column, index);
  }

  /**
   * @return the row as a plain Java value, see {@link ScalarValue} for the mapping
   */
  public Object getObject(int index) {
    checkIndex(index);
    return column.getObject(index);
  }

  /**
   * Returns a view of rows {@code [offset, offset + length)} sharing this column's buffers.
   */
  public Column slice(int offset, int length) {
    if (offset < 0 || length < 0 || (long) offset + length > column.getValueCount()) {
      throw UserException.indexOutOfRangeError()
          .message("Slice [%d, %d) out of range for a column of length %d",
              offset, (long) offset + length, column.getValueCount())
          .build(logger);
    }
    return new Column(column.slice(offset, length));
  }

  /**
   * Compares row {@code i} of this column with row {@code j} of {@code other}. Two nulls are equal, a null and
   * a value are not.
   */
  public boolean equalElement(int i, int j, Column other) {
    checkIndex(i);
    other.checkIndex(j);
    LogicalType left = PhysicalTypeMapper.representationOf(getLogicalType());
    LogicalType right = PhysicalTypeMapper.representationOf(other.getLogicalType());
    if (!left.equals(right)) {
      throw UserException.typeMismatchError()
          .message("Cannot compare elements of %s and %s", getLogicalType(), other.getLogicalType())
          .build(logger);
    }
    boolean leftNull = column.isNull(i);
    boolean rightNull = other.column.isNull(j);
    if (leftNull || rightNull) {
      return leftNull && rightNull;
    }
    return column.equalElementUnchecked(i, j, other.column);
  }

  /**
   * Unchecked variant of {@link #equalElement(int, int, Column)}: no bounds, validity or type checks.
   */
  boolean equalElementUnchecked(int i, int j, Column other) {
    return column.equalElementUnchecked(i, j, other.column);
  }

  public Column castTo(LogicalType target) {
    return ColumnCaster.cast(this, target);
  }

  /**
   * @return one keyed 64 bit hash per row as a UInt64 column
   */
  public Column contentHash(HashKey key) {
    return KeyedHashing.contentHash(this, key);
  }

  public Column addTo(Column other) {
    return addTo(other, new EvalContext());
  }

  public Column addTo(Column other, EvalContext context) {
    return ArithmeticEvaluator.evaluate(ArithmeticOperator.ADD, this, other, context);
  }

  public Column subtract(Column other) {
    return subtract(other, new EvalContext());
  }

  public Column subtract(Column other, EvalContext context) {
    return ArithmeticEvaluator.evaluate(ArithmeticOperator.SUBTRACT, this, other, context);
  }

  public Column multiply(Column other) {
    return multiply(other, new EvalContext());
  }

  public Column multiply(Column other, EvalContext context) {
    return ArithmeticEvaluator.evaluate(ArithmeticOperator.MULTIPLY, this, other, context);
  }

  public Column divide(Column other) {
    return divide(other, new EvalContext());
  }

  public Column divide(Column other, EvalContext context) {
    return ArithmeticEvaluator.evaluate(ArithmeticOperator.DIVIDE, this, other, context);
  }

  public Column remainder(Column other) {
    return remainder(other, new EvalContext());
  }

  public Column remainder(Column other, EvalContext context) {
    return ArithmeticEvaluator.evaluate(ArithmeticOperator.REMAINDER, this, other, context);
  }

  /**
   * Zero copy view of the same buffers under a logical type of identical storage.
   */
  Column withType(LogicalType type) {
    return new Column(column.withType(type));
  }

  @Override
  public void close() {
    column.close();
  }

  @Override
  public String toString() {
    return "Column[" + getLogicalType() + ", " + getValueCount() + "]";
  }
}
