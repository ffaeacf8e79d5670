package com.example.delivery.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FilterExpressionTest {

  @Test
  void acceptsOperandCountMatchingOperatorArity() {
    assertThat(FilterExpression.of("status", FilterOperator.EQ, "open").operands())
        .containsExactly("open");
    assertThat(FilterExpression.of("created_at", FilterOperator.BETWEEN, "2026-01-01", "2026-02-01")
            .operands())
        .hasSize(2);
    assertThat(FilterExpression.of("stage", FilterOperator.IN, "a", "b", "c").operands()).hasSize(3);
    assertThat(FilterExpression.of("deleted_at", FilterOperator.IS_NULL).operands()).isEmpty();
  }

  @Test
  void rejectsWrongOperandCount() {
    assertThatThrownBy(() -> FilterExpression.of("created_at", FilterOperator.BETWEEN, "2026-01-01"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("BETWEEN");
    assertThatThrownBy(() -> FilterExpression.of("stage", FilterOperator.IN))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> FilterExpression.of("deleted_at", FilterOperator.NOT_NULL, "x"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsBlankFieldAndMissingOperator() {
    assertThatThrownBy(() -> FilterExpression.of(" ", FilterOperator.EQ, "x"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new FilterExpression("status", null, List.of("x")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void operandsAreCopied() {
    final List<String> operands = new ArrayList<>(List.of("a"));
    final FilterExpression expression = new FilterExpression("stage", FilterOperator.IN, operands);

    operands.add("b");

    assertThat(expression.operands()).containsExactly("a");
  }
}
