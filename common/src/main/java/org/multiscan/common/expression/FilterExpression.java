/*
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
package org.multiscan.common.expression;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import org.multiscan.common.types.ScalarValue;

/**
 * Bound filter predicate pushed down into a multi-file scan. Columns are
 * referenced by {@link ColumnReference}, literals are {@link ScalarValue}s.
 */
public interface FilterExpression {

  Operator operator();

  <T> T accept(Visitor<T> visitor);

  /**
   * Indicates list of supported operators that can be used in filter expressions.
   */
  enum Operator {
    EQUAL,
    NOT_EQUAL,
    LESS_THAN,
    LESS_THAN_OR_EQUAL,
    GREATER_THAN,
    GREATER_THAN_OR_EQUAL,
    IN,
    NOT_IN,
    IS_NULL,
    IS_NOT_NULL,
    NOT,
    AND,
    OR
  }

  /**
   * Transforms {@link FilterExpression} implementations into another
   * representation or evaluates them.
   * Is handy when needed to traverse through complex filter expressions.
   *
   * @param <T> type into which {@link FilterExpression} will be transformed
   */
  interface Visitor<T> {

    T visit(SimplePredicate.Equal expression);
    T visit(SimplePredicate.NotEqual expression);
    T visit(SimplePredicate.LessThan expression);
    T visit(SimplePredicate.LessThanOrEqual expression);
    T visit(SimplePredicate.GreaterThan expression);
    T visit(SimplePredicate.GreaterThanOrEqual expression);
    T visit(ListPredicate.In expression);
    T visit(ListPredicate.NotIn expression);
    T visit(IsPredicate.IsNull expression);
    T visit(IsPredicate.IsNotNull expression);
    T visit(SingleExpressionPredicate.Not expression);
    T visit(DoubleExpressionPredicate.And expression);
    T visit(DoubleExpressionPredicate.Or expression);

    default T visit(FilterExpression expression) {
      throw new UnsupportedOperationException("Unsupported filter expression: " + expression);
    }
  }

  static FilterExpression equal(ColumnReference reference, ScalarValue value) {
    return new SimplePredicate.Equal(reference, value);
  }

  static FilterExpression notEqual(ColumnReference reference, ScalarValue value) {
    return new SimplePredicate.NotEqual(reference, value);
  }

  static FilterExpression lessThan(ColumnReference reference, ScalarValue value) {
    return new SimplePredicate.LessThan(reference, value);
  }

  static FilterExpression lessThanOrEqual(ColumnReference reference, ScalarValue value) {
    return new SimplePredicate.LessThanOrEqual(reference, value);
  }

  static FilterExpression greaterThan(ColumnReference reference, ScalarValue value) {
    return new SimplePredicate.GreaterThan(reference, value);
  }

  static FilterExpression greaterThanOrEqual(ColumnReference reference, ScalarValue value) {
    return new SimplePredicate.GreaterThanOrEqual(reference, value);
  }

  static FilterExpression in(ColumnReference reference, List<ScalarValue> values) {
    return new ListPredicate.In(reference, values);
  }

  static FilterExpression in(ColumnReference reference, ScalarValue... values) {
    return in(reference, Arrays.asList(values));
  }

  static FilterExpression notIn(ColumnReference reference, List<ScalarValue> values) {
    return new ListPredicate.NotIn(reference, values);
  }

  static FilterExpression notIn(ColumnReference reference, ScalarValue... values) {
    return notIn(reference, Arrays.asList(values));
  }

  static FilterExpression isNull(ColumnReference reference) {
    return new IsPredicate.IsNull(reference);
  }

  static FilterExpression isNotNull(ColumnReference reference) {
    return new IsPredicate.IsNotNull(reference);
  }

  static FilterExpression not(FilterExpression expression) {
    return new SingleExpressionPredicate.Not(expression);
  }

  static FilterExpression and(FilterExpression right, FilterExpression left) {
    return new DoubleExpressionPredicate.And(right, left);
  }

  static FilterExpression and(FilterExpression right, FilterExpression left, FilterExpression... expressions) {
    return Stream.of(expressions)
      .reduce(and(right, left), FilterExpression::and);
  }

  static FilterExpression or(FilterExpression right, FilterExpression left) {
    return new DoubleExpressionPredicate.Or(right, left);
  }
}
