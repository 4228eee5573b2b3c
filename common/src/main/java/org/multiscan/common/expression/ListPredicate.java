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

import java.util.List;
import java.util.StringJoiner;

import org.multiscan.common.types.ScalarValue;

import com.google.common.collect.ImmutableList;

/**
 * Indicates list predicate implementations which have column reference and list of values.
 */
public abstract class ListPredicate implements FilterExpression {

  private final ColumnReference reference;
  private final Operator operator;
  private final List<ScalarValue> values;

  protected ListPredicate(ColumnReference reference, Operator operator, List<ScalarValue> values) {
    this.reference = reference;
    this.operator = operator;
    this.values = ImmutableList.copyOf(values);
  }

  public ColumnReference reference() {
    return reference;
  }

  public List<ScalarValue> values() {
    return values;
  }

  @Override
  public Operator operator() {
    return operator;
  }

  @Override
  public String toString() {
    return new StringJoiner(", ", ListPredicate.class.getSimpleName() + "[", "]")
      .add("reference=" + reference)
      .add("operator=" + operator)
      .add("values=" + values)
      .toString();
  }

  /**
   * Indicates {@link FilterExpression.Operator#IN} operator expression:
   * region in ('eu', 'us').
   */
  public static class In extends ListPredicate {

    public In(ColumnReference reference, List<ScalarValue> values) {
      super(reference, Operator.IN, values);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * Indicates {@link FilterExpression.Operator#NOT_IN} operator expression:
   * region not in ('eu', 'us').
   */
  public static class NotIn extends ListPredicate {

    public NotIn(ColumnReference reference, List<ScalarValue> values) {
      super(reference, Operator.NOT_IN, values);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visit(this);
    }
  }
}
