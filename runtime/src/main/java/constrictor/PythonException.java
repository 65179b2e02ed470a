package constrictor;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Represents a Python exception.
 *
 * <p>The stack trace starts with the Python frames, innermost first, tagged with the library
 * name in place of a class name, and continues with the JVM frames of the caller.
 */
public class PythonException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String typeName;
  private final transient PyObject type;
  private final transient @Nullable PyObject value;
  private final transient @Nullable PyObject traceback;

  PythonException(
      final String typeName,
      final String text,
      final PyObject type,
      final @Nullable PyObject value,
      final @Nullable PyObject traceback
  ) {
    super(String.format("[%1$s] %2$s", typeName, text));
    this.typeName = typeName;
    this.type = type;
    this.value = value;
    this.traceback = traceback;
  }

  /** Gets the {@code __name__} of the exception class, e.g. {@code ValueError}. */
  public String getTypeName() {
    return typeName;
  }

  /** Gets the exception class. */
  public PyObject getType() {
    return type;
  }

  /** Gets the exception instance. */
  public @Nullable PyObject getValue() {
    return value;
  }

  /** Gets the traceback object, if Python attached one. */
  public @Nullable PyObject getTraceback() {
    return traceback;
  }
}
