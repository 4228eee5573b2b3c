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
package org.multiscan.exec.store.multifile;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.function.IntPredicate;

import org.multiscan.common.expression.ColumnReference;
import org.multiscan.common.expression.DoubleExpressionPredicate;
import org.multiscan.common.expression.FilterExpression;
import org.multiscan.common.expression.IsPredicate;
import org.multiscan.common.expression.ListPredicate;
import org.multiscan.common.expression.SimplePredicate;
import org.multiscan.common.expression.SingleExpressionPredicate;
import org.multiscan.common.types.ScalarValue;

import com.google.common.collect.ImmutableMap;

/**
 * Evaluates a filter for one file, with the columns whose value is known for
 * the whole file (file name, partition values) replaced by that value.
 * Evaluation follows SQL three-valued logic, extended with
 * {@link FilterResult#UNKNOWN} for predicates that depend on data in the file.
 */
public class ConstantFilterEvaluator implements FilterExpression.Visitor<ConstantFilterEvaluator.FilterResult> {

  /**
   * Outcome of evaluating a filter over the constant columns of a file.
   */
  public enum FilterResult {
    TRUE,
    FALSE,
    /** SQL NULL: no row of the file can match. */
    NULL,
    /** Depends on columns read from the file. */
    UNKNOWN;

    /**
     * @return true if no row of the file can satisfy the filter
     */
    public boolean excludesFile() {
      return this == FALSE || this == NULL;
    }

    FilterResult not() {
      switch (this) {
        case TRUE:
          return FALSE;
        case FALSE:
          return TRUE;
        default:
          return this;
      }
    }

    static FilterResult of(boolean value) {
      return value ? TRUE : FALSE;
    }
  }

  private final int tableIndex;
  private final Map<Integer, String> knownValues;

  /**
   * @param tableIndex table index of the scan; references to other tables
   *        are never evaluated
   * @param knownValues column index to the value of that column in the file
   */
  public ConstantFilterEvaluator(int tableIndex, Map<Integer, String> knownValues) {
    this.tableIndex = tableIndex;
    this.knownValues = ImmutableMap.copyOf(knownValues);
  }

  public FilterResult evaluate(FilterExpression filter) {
    return filter.accept(this);
  }

  @Override
  public FilterResult visit(SimplePredicate.Equal expression) {
    return compare(expression, c -> c == 0);
  }

  @Override
  public FilterResult visit(SimplePredicate.NotEqual expression) {
    return compare(expression, c -> c != 0);
  }

  @Override
  public FilterResult visit(SimplePredicate.LessThan expression) {
    return compare(expression, c -> c < 0);
  }

  @Override
  public FilterResult visit(SimplePredicate.LessThanOrEqual expression) {
    return compare(expression, c -> c <= 0);
  }

  @Override
  public FilterResult visit(SimplePredicate.GreaterThan expression) {
    return compare(expression, c -> c > 0);
  }

  @Override
  public FilterResult visit(SimplePredicate.GreaterThanOrEqual expression) {
    return compare(expression, c -> c >= 0);
  }

  @Override
  public FilterResult visit(ListPredicate.In expression) {
    final String known = knownValue(expression.reference());
    if (known == null) {
      return FilterResult.UNKNOWN;
    }
    boolean sawUnknown = false;
    boolean sawNull = false;
    for (ScalarValue value : expression.values()) {
      if (value == null || value.isNull()) {
        sawNull = true;
        continue;
      }
      final Integer result = compareToLiteral(known, value);
      if (result == null) {
        sawUnknown = true;
      } else if (result == 0) {
        return FilterResult.TRUE;
      }
    }
    if (sawUnknown) {
      return FilterResult.UNKNOWN;
    }
    return sawNull ? FilterResult.NULL : FilterResult.FALSE;
  }

  @Override
  public FilterResult visit(ListPredicate.NotIn expression) {
    return visit(new ListPredicate.In(expression.reference(), expression.values())).not();
  }

  @Override
  public FilterResult visit(IsPredicate.IsNull expression) {
    return knownValue(expression.reference()) == null ? FilterResult.UNKNOWN : FilterResult.FALSE;
  }

  @Override
  public FilterResult visit(IsPredicate.IsNotNull expression) {
    return knownValue(expression.reference()) == null ? FilterResult.UNKNOWN : FilterResult.TRUE;
  }

  @Override
  public FilterResult visit(SingleExpressionPredicate.Not expression) {
    return expression.expression().accept(this).not();
  }

  @Override
  public FilterResult visit(DoubleExpressionPredicate.And expression) {
    final FilterResult left = expression.left().accept(this);
    final FilterResult right = expression.right().accept(this);
    if (left == FilterResult.FALSE || right == FilterResult.FALSE) {
      return FilterResult.FALSE;
    }
    if (left == FilterResult.UNKNOWN || right == FilterResult.UNKNOWN) {
      return FilterResult.UNKNOWN;
    }
    if (left == FilterResult.NULL || right == FilterResult.NULL) {
      return FilterResult.NULL;
    }
    return FilterResult.TRUE;
  }

  @Override
  public FilterResult visit(DoubleExpressionPredicate.Or expression) {
    final FilterResult left = expression.left().accept(this);
    final FilterResult right = expression.right().accept(this);
    if (left == FilterResult.TRUE || right == FilterResult.TRUE) {
      return FilterResult.TRUE;
    }
    if (left == FilterResult.UNKNOWN || right == FilterResult.UNKNOWN) {
      return FilterResult.UNKNOWN;
    }
    if (left == FilterResult.NULL || right == FilterResult.NULL) {
      return FilterResult.NULL;
    }
    return FilterResult.FALSE;
  }

  @Override
  public FilterResult visit(FilterExpression expression) {
    return FilterResult.UNKNOWN;
  }

  private FilterResult compare(SimplePredicate expression, IntPredicate test) {
    final String known = knownValue(expression.reference());
    if (known == null) {
      return FilterResult.UNKNOWN;
    }
    final ScalarValue literal = expression.value();
    if (literal == null || literal.isNull()) {
      return FilterResult.NULL;
    }
    final Integer result = compareToLiteral(known, literal);
    if (result == null) {
      return FilterResult.UNKNOWN;
    }
    return FilterResult.of(test.test(result));
  }

  private String knownValue(ColumnReference reference) {
    if (reference == null || reference.tableIndex() != tableIndex) {
      return null;
    }
    return knownValues.get(reference.columnIndex());
  }

  /**
   * Compares the string value of a constant column with a literal, reading
   * the string as a value of the literal's type.
   *
   * @return the sign of the comparison, or {@code null} if the string cannot
   *         be read as the literal's type
   */
  private static Integer compareToLiteral(String known, ScalarValue literal) {
    switch (literal.getType()) {
      case VARCHAR:
        return Integer.signum(known.compareTo(literal.getString()));
      case TINYINT:
      case SMALLINT:
      case INT:
      case BIGINT:
        return compareDecimal(known, BigDecimal.valueOf(literal.getLong()));
      case VARDECIMAL:
        return compareDecimal(known, (BigDecimal) literal.getValue());
      case FLOAT4:
      case FLOAT8:
        final double doubleValue = (Double) literal.getValue();
        if (Double.isNaN(doubleValue) || Double.isInfinite(doubleValue)) {
          return null;
        }
        return compareDecimal(known, BigDecimal.valueOf(doubleValue));
      case BIT:
        if ("true".equalsIgnoreCase(known)) {
          return Boolean.compare(true, literal.getBoolean());
        } else if ("false".equalsIgnoreCase(known)) {
          return Boolean.compare(false, literal.getBoolean());
        }
        return null;
      case DATE:
        try {
          return Integer.signum(LocalDate.parse(known.trim()).compareTo((LocalDate) literal.getValue()));
        } catch (DateTimeParseException e) {
          return null;
        }
      case TIMESTAMP:
        try {
          return Integer.signum(LocalDateTime.parse(known.trim().replace(' ', 'T'))
              .compareTo((LocalDateTime) literal.getValue()));
        } catch (DateTimeParseException e) {
          return null;
        }
      default:
        return null;
    }
  }

  private static Integer compareDecimal(String known, BigDecimal literal) {
    try {
      return new BigDecimal(known.trim()).compareTo(literal);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
