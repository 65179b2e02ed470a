package constrictor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A live Python object.
 *
 * <p>Owns one reference count on the object, given back by {@link #close()} or, failing that,
 * after the proxy is garbage collected. Equality, hashing and string conversion are Python's:
 * two proxies are equal when {@code ==} holds between their objects.
 *
 * <p>In-place operators may leave the proxy pointing to a different object, exactly as the
 * augmented assignment would rebind a Python variable.
 */
public class PyObject implements Iterable<PyObject>, AutoCloseable {

  private final Interpreter interpreter;
  private Reference reference;

  PyObject(final Interpreter interpreter, final Reference reference) {
    this.interpreter = interpreter;
    this.reference = reference;
  }

  public Interpreter interpreter() {
    return interpreter;
  }

  /** The {@code PyObject*} currently held. */
  public long handle() {
    return reference.handle();
  }

  Reference reference() {
    return reference;
  }

  // Attributes and items

  public PyObject getAttribute(final String name) {
    return interpreter.wrap(table().getAttr(handle(), name));
  }

  public void setAttribute(final String name, final PyObject value) {
    errors().checkStatus(table().setAttr(handle(), name, value.handle()));
  }

  /** Whether {@code getattr} succeeds. Errors other than {@code AttributeError} propagate. */
  public boolean hasAttribute(final String name) {
    try (PyObject attributeError = interpreter.builtin("AttributeError")) {
      final long attribute = table().getAttr(handle(), name);
      if (attribute == 0 && table().errorMatches(attributeError.handle())) {
        table().clearError();
        return false;
      }
      table().decRef(errors().check(attribute));
      return true;
    }
  }

  /** {@code self[key]}. */
  public PyObject getItem(final PyObject key) {
    return interpreter.wrap(table().getItem(handle(), key.handle()));
  }

  /** {@code self[index]} through the sequence protocol. */
  public PyObject getItem(final long index) {
    return interpreter.wrap(table().sequenceGetItem(handle(), index));
  }

  /** {@code self[key] = value}. */
  public void setItem(final PyObject key, final PyObject value) {
    errors().checkStatus(table().setItem(handle(), key.handle(), value.handle()));
  }

  // Calls

  public boolean callable() {
    return table().callableCheck(handle());
  }

  /** Calls the object with positional arguments. */
  public PyObject call(final PyObject... args) {
    return interpreter.wrap(table().callObjArgs(handle(), handles(args)));
  }

  /** Calls the object with positional and named arguments. */
  public PyObject call(final List<PyObject> args, final Map<String, PyObject> kwargs) {
    try (PyObject tuple = Converters.tuple(interpreter, args);
        PyObject dict = Converters.keywords(interpreter, kwargs)) {
      return interpreter.wrap(table().call(handle(), tuple.handle(), dict.handle()));
    }
  }

  /**
   * Gets an item or calls the object, whichever {@code self(args)} or {@code self[arg]} means.
   *
   * <p>A single argument is a key unless the object is callable. Any other number of arguments
   * is a call.
   */
  public PyObject apply(final PyObject... args) {
    if (args.length == 1 && !callable()) {
      return getItem(args[0]);
    }
    return call(args);
  }

  /** Calls a method with positional arguments. */
  public PyObject callMethod(final String name, final PyObject... args) {
    try (PyObject methodName = interpreter.of(name)) {
      return interpreter.wrap(table().callMethodObjArgs(handle(), methodName.handle(), handles(args)));
    }
  }

  /** Calls a method with positional and named arguments. */
  public PyObject callMethod(
      final String name,
      final List<PyObject> args,
      final Map<String, PyObject> kwargs
  ) {
    try (PyObject method = getAttribute(name)) {
      return method.call(args, kwargs);
    }
  }

  // Comparison

  public boolean compare(final Comparison comparison, final PyObject that) {
    return errors().checkStatus(table().richCompareBool(handle(), that.handle(), comparison)) > 0;
  }

  public boolean lessThan(final PyObject that) {
    return compare(Comparison.LT, that);
  }

  public boolean lessOrEqual(final PyObject that) {
    return compare(Comparison.LE, that);
  }

  public boolean greaterThan(final PyObject that) {
    return compare(Comparison.GT, that);
  }

  public boolean greaterOrEqual(final PyObject that) {
    return compare(Comparison.GE, that);
  }

  public boolean notEqual(final PyObject that) {
    return compare(Comparison.NE, that);
  }

  /** Python equality. Anything that is not a {@link PyObject} is unequal, without asking Python. */
  @Override
  public boolean equals(final Object obj) {
    if (!(obj instanceof PyObject)) {
      return false;
    }
    return compare(Comparison.EQ, (PyObject) obj);
  }

  /** Python's {@code hash()}, truncated. */
  @Override
  public int hashCode() {
    return (int) hash();
  }

  /** Python's {@code hash()}. */
  public long hash() {
    return errors().checkLong(table().hash(handle()));
  }

  /** Python's {@code str()}. */
  @Override
  public String toString() {
    try (PyObject str = interpreter.wrap(table().str(handle()))) {
      return errors().checkString(table().unicodeAsUtf8(str.handle()));
    }
  }

  /** Python's {@code repr()}. */
  public String repr() {
    try (PyObject repr = interpreter.wrap(table().repr(handle()))) {
      return errors().checkString(table().unicodeAsUtf8(repr.handle()));
    }
  }

  public boolean isTrue() {
    return errors().checkStatus(table().isTrue(handle())) > 0;
  }

  public boolean isNone() {
    return handle() == table().none();
  }

  // Operators

  public PyObject binary(final BinaryOperator operator, final PyObject that) {
    return interpreter.wrap(table().numberBinary(operator, handle(), that.handle()));
  }

  /** Applies an augmented assignment, rebinding this proxy to the result. */
  public PyObject inPlace(final BinaryOperator operator, final PyObject that) {
    replace(interpreter.take(table().numberInPlace(operator, handle(), that.handle())));
    return this;
  }

  public PyObject unary(final UnaryOperator operator) {
    return interpreter.wrap(table().numberUnary(operator, handle()));
  }

  public PyObject add(final PyObject that) {
    return binary(BinaryOperator.ADD, that);
  }

  public PyObject subtract(final PyObject that) {
    return binary(BinaryOperator.SUBTRACT, that);
  }

  public PyObject multiply(final PyObject that) {
    return binary(BinaryOperator.MULTIPLY, that);
  }

  public PyObject matrixMultiply(final PyObject that) {
    return binary(BinaryOperator.MATRIX_MULTIPLY, that);
  }

  public PyObject floorDivide(final PyObject that) {
    return binary(BinaryOperator.FLOOR_DIVIDE, that);
  }

  public PyObject trueDivide(final PyObject that) {
    return binary(BinaryOperator.TRUE_DIVIDE, that);
  }

  public PyObject remainder(final PyObject that) {
    return binary(BinaryOperator.REMAINDER, that);
  }

  public PyObject power(final PyObject exponent) {
    return binary(BinaryOperator.POWER, exponent);
  }

  /** Three-argument {@code pow()}. */
  public PyObject power(final PyObject exponent, final PyObject modulus) {
    return interpreter.wrap(table().numberPower(handle(), exponent.handle(), modulus.handle(), false));
  }

  public PyObject leftShift(final PyObject that) {
    return binary(BinaryOperator.LSHIFT, that);
  }

  public PyObject rightShift(final PyObject that) {
    return binary(BinaryOperator.RSHIFT, that);
  }

  public PyObject and(final PyObject that) {
    return binary(BinaryOperator.AND, that);
  }

  public PyObject xor(final PyObject that) {
    return binary(BinaryOperator.XOR, that);
  }

  public PyObject or(final PyObject that) {
    return binary(BinaryOperator.OR, that);
  }

  public PyObject negative() {
    return unary(UnaryOperator.NEGATIVE);
  }

  public PyObject positive() {
    return unary(UnaryOperator.POSITIVE);
  }

  public PyObject invert() {
    return unary(UnaryOperator.INVERT);
  }

  public PyObject addInPlace(final PyObject that) {
    return inPlace(BinaryOperator.ADD, that);
  }

  public PyObject subtractInPlace(final PyObject that) {
    return inPlace(BinaryOperator.SUBTRACT, that);
  }

  public PyObject multiplyInPlace(final PyObject that) {
    return inPlace(BinaryOperator.MULTIPLY, that);
  }

  public PyObject matrixMultiplyInPlace(final PyObject that) {
    return inPlace(BinaryOperator.MATRIX_MULTIPLY, that);
  }

  public PyObject floorDivideInPlace(final PyObject that) {
    return inPlace(BinaryOperator.FLOOR_DIVIDE, that);
  }

  public PyObject trueDivideInPlace(final PyObject that) {
    return inPlace(BinaryOperator.TRUE_DIVIDE, that);
  }

  public PyObject remainderInPlace(final PyObject that) {
    return inPlace(BinaryOperator.REMAINDER, that);
  }

  public PyObject powerInPlace(final PyObject exponent) {
    return inPlace(BinaryOperator.POWER, exponent);
  }

  public PyObject powerInPlace(final PyObject exponent, final PyObject modulus) {
    replace(interpreter.take(table().numberPower(handle(), exponent.handle(), modulus.handle(), true)));
    return this;
  }

  public PyObject leftShiftInPlace(final PyObject that) {
    return inPlace(BinaryOperator.LSHIFT, that);
  }

  public PyObject rightShiftInPlace(final PyObject that) {
    return inPlace(BinaryOperator.RSHIFT, that);
  }

  public PyObject andInPlace(final PyObject that) {
    return inPlace(BinaryOperator.AND, that);
  }

  public PyObject xorInPlace(final PyObject that) {
    return inPlace(BinaryOperator.XOR, that);
  }

  public PyObject orInPlace(final PyObject that) {
    return inPlace(BinaryOperator.OR, that);
  }

  // Conversions

  public long toLong() {
    return errors().checkLong(table().longAsLong(handle()));
  }

  public int toInt() {
    return (int) toLong();
  }

  public short toShort() {
    return (short) toLong();
  }

  public byte toByte() {
    return (byte) toLong();
  }

  public double toDouble() {
    return errors().checkDouble(table().floatAsDouble(handle()));
  }

  public float toFloat() {
    return (float) toDouble();
  }

  public boolean toBoolean() {
    return isTrue();
  }

  /** Collects the elements produced by iterating over the object. */
  public List<PyObject> toList() {
    final List<PyObject> elements = new ArrayList<>();
    try (PyIterator iterator = iterator()) {
      iterator.forEachRemaining(elements::add);
    }
    return elements;
  }

  /** Collects the elements produced by iterating over the object. */
  public Set<PyObject> toSet() {
    final Set<PyObject> elements = new LinkedHashSet<>();
    try (PyIterator iterator = iterator()) {
      iterator.forEachRemaining(elements::add);
    }
    return elements;
  }

  /** Collects the {@code items()} of a mapping. */
  public Map<PyObject, PyObject> toMap() {
    final Map<PyObject, PyObject> entries = new LinkedHashMap<>();
    try (PyObject items = interpreter.wrap(table().mappingItems(handle()));
        PyIterator iterator = items.iterator()) {
      while (iterator.hasNext()) {
        try (PyObject pair = iterator.next()) {
          entries.put(pair.getItem(0), pair.getItem(1));
        }
      }
    }
    return entries;
  }

  /** Calls {@code iter()} on the object. */
  @Override
  public PyIterator iterator() {
    return new PyIterator(interpreter, interpreter.take(table().getIter(handle())));
  }

  @Override
  public void close() {
    reference.close();
  }

  private void replace(final Reference next) {
    final Reference previous = reference;
    reference = next;
    previous.close();
  }

  private CallTable table() {
    return interpreter.table();
  }

  private ErrorTranslator errors() {
    return interpreter.errors();
  }

  private static long[] handles(final PyObject[] args) {
    final long[] handles = new long[args.length];
    for (int i = 0; i < args.length; i++) {
      handles[i] = args[i].handle();
    }
    return handles;
  }
}
