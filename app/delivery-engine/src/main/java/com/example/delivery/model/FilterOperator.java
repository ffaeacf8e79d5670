/*
 * どこで: レンダリングのモデル
 * 何を: ジョブのフィルタが使える演算子の閉じた集合とオペランド数
 * なぜ: 未対応の演算子をレンダリング時ではなくコンパイル時に弾くため
 */
package com.example.delivery.model;

public enum FilterOperator {
  EQ(Arity.ONE),
  NE(Arity.ONE),
  GT(Arity.ONE),
  GTE(Arity.ONE),
  LT(Arity.ONE),
  LTE(Arity.ONE),
  CONTAINS(Arity.ONE),
  BETWEEN(Arity.TWO),
  IN(Arity.AT_LEAST_ONE),
  IS_NULL(Arity.NONE),
  NOT_NULL(Arity.NONE);

  public enum Arity {
    NONE,
    ONE,
    TWO,
    AT_LEAST_ONE
  }

  private final Arity arity;

  FilterOperator(Arity arity) {
    this.arity = arity;
  }

  public Arity arity() {
    return arity;
  }

  public boolean accepts(int operandCount) {
    return switch (arity) {
      case NONE -> operandCount == 0;
      case ONE -> operandCount == 1;
      case TWO -> operandCount == 2;
      case AT_LEAST_ONE -> operandCount >= 1;
    };
  }
}
