package constrictor;

/** Operators of the rich comparison protocol, with the operation codes CPython expects. */
public enum Comparison {
  LT(0, "<"),
  LE(1, "<="),
  EQ(2, "=="),
  NE(3, "!="),
  GT(4, ">"),
  GE(5, ">=");

  private final int code;
  private final String symbol;

  Comparison(final int code, final String symbol) {
    this.code = code;
    this.symbol = symbol;
  }

  /** The {@code Py_LT} .. {@code Py_GE} value. */
  public int code() {
    return code;
  }

  public String symbol() {
    return symbol;
  }
}
