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

import java.util.StringJoiner;

import org.multiscan.common.types.ScalarValue;

/**
 * Indicates simple predicate implementations which have column reference and one value.
 */
public abstract class SimplePredicate implements FilterExpression {

  private final ColumnReference reference;
  private final Operator operator;
  private final ScalarValue value;

  protected SimplePredicate(ColumnReference reference, Operator operator, ScalarValue value) {
    this.reference = reference;
    this.operator = operator;
    this.value = value;
  }

  public ColumnReference reference() {
    return reference;
  }

  public ScalarValue value() {
    return value;
  }

  @Override
  public Operator operator() {
    return operator;
  }

  @Override
  public String toString() {
    return new StringJoiner(", ", SimplePredicate.class.getSimpleName() + "[", "]")
      .add("reference=" + reference)
      .add("operator=" + operator)
      .add("value=" + value)
      .toString();
  }

  /**
   * Indicates {@link FilterExpression.Operator#EQUAL} operator expression:
   * year = '2020'.
   */
  public static class Equal extends SimplePredicate {

    public Equal(ColumnReference reference, ScalarValue value) {
      super(reference, Operator.EQUAL, value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * Indicates {@link FilterExpression.Operator#NOT_EQUAL} operator expression:
   * year != '2020'.
   */
  public static class NotEqual extends SimplePredicate {

    public NotEqual(ColumnReference reference, ScalarValue value) {
      super(reference, Operator.NOT_EQUAL, value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * Indicates {@link FilterExpression.Operator#LESS_THAN} operator expression:
   * month &lt; 6.
   */
  public static class LessThan extends SimplePredicate {

    public LessThan(ColumnReference reference, ScalarValue value) {
      super(reference, Operator.LESS_THAN, value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * Indicates {@link FilterExpression.Operator#LESS_THAN_OR_EQUAL} operator expression:
   * month &lt;= 6.
   */
  public static class LessThanOrEqual extends SimplePredicate {

    public LessThanOrEqual(ColumnReference reference, ScalarValue value) {
      super(reference, Operator.LESS_THAN_OR_EQUAL, value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * Indicates {@link FilterExpression.Operator#GREATER_THAN} operator expression:
   * month &gt; 6.
   */
  public static class GreaterThan extends SimplePredicate {

    public GreaterThan(ColumnReference reference, ScalarValue value) {
      super(reference, Operator.GREATER_THAN, value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * Indicates {@link FilterExpression.Operator#GREATER_THAN_OR_EQUAL} operator expression:
   * month &gt;= 6.
   */
  public static class GreaterThanOrEqual extends SimplePredicate {

    public GreaterThanOrEqual(ColumnReference reference, ScalarValue value) {
      super(reference, Operator.GREATER_THAN_OR_EQUAL, value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visit(this);
    }
  }
}
