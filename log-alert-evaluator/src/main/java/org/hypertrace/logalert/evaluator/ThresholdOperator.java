package org.hypertrace.logalert.evaluator;

public enum ThresholdOperator {
  GT(">"),
  GTE(">="),
  LT("<"),
  LTE("<="),
  EQ("=="),
  NEQ("!=");

  private final String symbol;

  ThresholdOperator(String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }

  public static ThresholdOperator fromSymbol(String symbol) {
    for (ThresholdOperator operator : values()) {
      if (operator.symbol.equals(symbol)) {
        return operator;
      }
    }
    throw new IllegalArgumentException(String.format("Unsupported threshold operator:%s", symbol));
  }

  public boolean apply(double lhs, double rhs) {
    switch (this) {
      case GT:
        return lhs > rhs;
      case GTE:
        return lhs >= rhs;
      case LT:
        return lhs < rhs;
      case LTE:
        return lhs <= rhs;
      case EQ:
        return lhs == rhs;
      case NEQ:
        return lhs != rhs;
      default:
        throw new UnsupportedOperationException("Unsupported threshold operator: " + this);
    }
  }
}
