package constrictor;

/**
 * Binary operators of the number protocol.
 *
 * <p>Each constant knows the C API function implementing it and its in-place variant, so a
 * {@link CallTable} can bind all of them in one place.
 */
public enum BinaryOperator {
  ADD("+", "Add"),
  SUBTRACT("-", "Subtract"),
  MULTIPLY("*", "Multiply"),
  MATRIX_MULTIPLY("@", "MatrixMultiply"),
  FLOOR_DIVIDE("//", "FloorDivide"),
  TRUE_DIVIDE("/", "TrueDivide"),
  REMAINDER("%", "Remainder"),
  POWER("**", "Power"),
  LSHIFT("<<", "Lshift"),
  RSHIFT(">>", "Rshift"),
  AND("&", "And"),
  XOR("^", "Xor"),
  OR("|", "Or");

  private final String symbol;
  private final String function;

  BinaryOperator(final String symbol, final String function) {
    this.symbol = symbol;
    this.function = function;
  }

  public String symbol() {
    return symbol;
  }

  /** Name of the C function, e.g. {@code PyNumber_Add}. */
  public String function() {
    return "PyNumber_" + function;
  }

  /** Name of the in-place C function, e.g. {@code PyNumber_InPlaceAdd}. */
  public String inPlaceFunction() {
    return "PyNumber_InPlace" + function;
  }

  /** {@code PyNumber_Power} takes an extra modulus argument. */
  public boolean ternary() {
    return this == POWER;
  }
}
