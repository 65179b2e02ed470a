package constrictor;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Everything a {@link PyObject} needs to talk to one embedded interpreter: the C API, the
 * reference bookkeeping and the error translation.
 *
 * <p>CPython can be initialized once per process, so there is one instance per process, created
 * by whatever loaded the library. It is never re-initialized and has no {@code close}.
 */
public final class Interpreter {

  private final CallTable table;
  private final ReferenceManager references;
  private final ErrorTranslator errors;
  private final PyObject builtins;

  public Interpreter(final CallTable table) {
    this.table = table;
    this.references = new ReferenceManager(table);
    this.errors = new ErrorTranslator(this);
    this.builtins = borrow(table.builtins());
  }

  public CallTable table() {
    return table;
  }

  public ReferenceManager references() {
    return references;
  }

  public ErrorTranslator errors() {
    return errors;
  }

  /** The {@code builtins} dictionary. */
  public PyObject builtins() {
    return builtins;
  }

  /** Gets a built-in function or type, e.g. {@code len} or {@code complex}. */
  public PyObject builtin(final String name) {
    try (PyObject key = of(name)) {
      return builtins.getItem(key);
    }
  }

  public PyObject importModule(final String name) {
    return wrap(table.importModule(name));
  }

  public PyObject none() {
    return borrow(table.none());
  }

  // Conversions

  public PyObject of(final long value) {
    return Converters.LONG.toPython(this, value);
  }

  public PyObject of(final double value) {
    return Converters.DOUBLE.toPython(this, value);
  }

  public PyObject of(final boolean value) {
    return Converters.BOOLEAN.toPython(this, value);
  }

  public PyObject of(final char value) {
    return Converters.CHARACTER.toPython(this, value);
  }

  public PyObject of(final String value) {
    return Converters.STRING.toPython(this, value);
  }

  /** Converts a value of any type supported by {@link Converters#toPython}. */
  public PyObject toPython(final @Nullable Object value) {
    return Converters.toPython(this, value);
  }

  public PyObject list(final Collection<?> elements) {
    return Converters.LIST.toPython(this, elements);
  }

  public PyObject list(final Object... elements) {
    return list(Arrays.asList(elements));
  }

  public PyObject tuple(final List<?> elements) {
    return Converters.TUPLE.toPython(this, elements);
  }

  public PyObject tuple(final Object... elements) {
    return tuple(Arrays.asList(elements));
  }

  public PyObject set(final Set<?> elements) {
    return Converters.SET.toPython(this, elements);
  }

  public PyObject dict(final Map<?, ?> entries) {
    return Converters.DICT.toPython(this, entries);
  }

  public PyObject slice(final IntRange range) {
    return Converters.SLICE.toPython(this, range);
  }

  // Acquisition

  /** Wraps a borrowed reference. */
  PyObject borrow(final long handle) {
    final Reference reference = references.borrow(errors.check(handle));
    if (reference == null) {
      throw new AssertionError("Borrowed a NULL reference.");
    }
    return new PyObject(this, reference);
  }

  /** Wraps a new reference returned by the C API, raising the pending error if it is NULL. */
  PyObject wrap(final long handle) {
    return new PyObject(this, take(handle));
  }

  /** Takes a new reference returned by the C API, raising the pending error if it is NULL. */
  Reference take(final long handle) {
    final Reference reference = references.receive(errors.check(handle));
    if (reference == null) {
      throw new AssertionError("Received a NULL reference.");
    }
    return reference;
  }
}
