package constrictor;

/** Unary operators of the number protocol. */
public enum UnaryOperator {
  NEGATIVE("-", "PyNumber_Negative"),
  POSITIVE("+", "PyNumber_Positive"),
  INVERT("~", "PyNumber_Invert");

  private final String symbol;
  private final String function;

  UnaryOperator(final String symbol, final String function) {
    this.symbol = symbol;
    this.function = function;
  }

  public String symbol() {
    return symbol;
  }

  public String function() {
    return function;
  }
}
