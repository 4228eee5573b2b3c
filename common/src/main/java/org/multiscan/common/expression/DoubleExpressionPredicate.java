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

/**
 * Indicates double expression predicate implementations.
 */
public abstract class DoubleExpressionPredicate implements FilterExpression {

  private final FilterExpression right;
  private final FilterExpression left;
  private final Operator operator;

  protected DoubleExpressionPredicate(FilterExpression right, FilterExpression left, Operator operator) {
    this.right = right;
    this.left = left;
    this.operator = operator;
  }

  public FilterExpression right() {
    return right;
  }

  public FilterExpression left() {
    return left;
  }

  @Override
  public Operator operator() {
    return operator;
  }

  @Override
  public String toString() {
    return new StringJoiner(", ", DoubleExpressionPredicate.class.getSimpleName() + "[", "]")
      .add("right=" + right)
      .add("left=" + left)
      .add("operator=" + operator)
      .toString();
  }

  /**
   * Indicates {@link FilterExpression.Operator#AND} operator expression:
   * year = '2020' and month = '01'.
   */
  public static class And extends DoubleExpressionPredicate {

    public And(FilterExpression right, FilterExpression left) {
      super(right, left, Operator.AND);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * Indicates {@link FilterExpression.Operator#OR} operator expression:
   * year = '2020' or year = '2021'.
   */
  public static class Or extends DoubleExpressionPredicate {

    public Or(FilterExpression right, FilterExpression left) {
      super(right, left, Operator.OR);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visit(this);
    }
  }
}
