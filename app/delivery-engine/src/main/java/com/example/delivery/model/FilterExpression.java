/*
 * どこで: レンダリングのモデル
 * 何を: エクスポート/レポートに適用する (field, operator, operands) 形式のフィルタ
 * なぜ: 自由形式の Map ではなく検証済みの型付き式で扱うため
 */
package com.example.delivery.model;

import java.util.List;

public record FilterExpression(String field, FilterOperator operator, List<String> operands) {

  public FilterExpression {
    if (field == null || field.isBlank()) {
      throw new IllegalArgumentException("filter field is required");
    }
    if (operator == null) {
      throw new IllegalArgumentException("filter operator is required for field " + field);
    }
    operands = operands == null ? List.of() : List.copyOf(operands);
    if (!operator.accepts(operands.size())) {
      throw new IllegalArgumentException(
          "operator " + operator + " expects " + operator.arity() + " operand(s) but got "
              + operands.size() + " for field " + field);
    }
  }

  public static FilterExpression of(String field, FilterOperator operator, String... operands) {
    return new FilterExpression(field, operator, List.of(operands));
  }
}
