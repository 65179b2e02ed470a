package constrictor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts the Python error indicator into {@link PythonException}s.
 *
 * <p>Every operation that can fail checks its result with one of the {@code check} methods
 * right after the C API call returns. A failure sentinel with no error set is a bug in this
 * library and raises an {@link AssertionError}.
 */
public final class ErrorTranslator {

  private final Interpreter interpreter;

  ErrorTranslator(final Interpreter interpreter) {
    this.interpreter = interpreter;
  }

  /**
   * Retrieves and clears the error indicator.
   *
   * @return {@code null} if no error is set.
   */
  public @Nullable PythonException fetch() {
    final CallTable table = interpreter.table();
    if (!table.errOccurred()) {
      return null;
    }

    final RaisedError error = table.normalizeError(table.fetchError());
    final ReferenceManager references = interpreter.references();
    final Reference type = references.receive(error.type);
    final Reference value = references.receive(error.value);
    final Reference traceback = references.receive(error.traceback);
    if (type == null) {
      throw new AssertionError("Error indicator was set but held no exception type.");
    }
    return translate(
        new PyObject(interpreter, type),
        value == null ? null : new PyObject(interpreter, value),
        traceback == null ? null : new PyObject(interpreter, traceback)
    );
  }

  /** Checks a {@code PyObject*} result. */
  public long check(final long handle) {
    if (handle == 0) {
      throw failure();
    }
    return handle;
  }

  /** Checks an {@code int} status or boolean result. */
  public int checkStatus(final int status) {
    if (status == -1) {
      throw failure();
    }
    return status;
  }

  /** Checks a result for which {@code -1} is both the failure sentinel and a valid value. */
  public long checkLong(final long result) {
    if (result == -1) {
      throwIfSet();
    }
    return result;
  }

  /** Checks a result for which {@code -1.0} is both the failure sentinel and a valid value. */
  public double checkDouble(final double result) {
    if (result == -1.0) {
      throwIfSet();
    }
    return result;
  }

  /** Checks a {@code const char*} result. */
  public String checkString(final @Nullable String result) {
    if (result == null) {
      throw failure();
    }
    return result;
  }

  private void throwIfSet() {
    final PythonException error = fetch();
    if (error != null) {
      throw error;
    }
  }

  private PythonException failure() {
    final PythonException error = fetch();
    if (error == null) {
      throw new AssertionError("Python reported a failure without setting an error.");
    }
    return error;
  }

  private PythonException translate(
      final PyObject type,
      final @Nullable PyObject value,
      final @Nullable PyObject traceback
  ) {
    final String typeName;
    try (PyObject name = type.getAttribute("__name__")) {
      typeName = name.toString();
    }
    final PythonException exception = new PythonException(
        typeName,
        value == null ? "" : value.toString(),
        type,
        value,
        traceback
    );

    final List<StackTraceElement> stackTrace = pythonStackTrace(traceback);
    Collections.reverse(stackTrace);
    stackTrace.addAll(callerStackTrace(exception.getStackTrace()));
    exception.setStackTrace(stackTrace.toArray(new StackTraceElement[0]));
    return exception;
  }

  /** Frames of a traceback chain, outermost first. */
  private List<StackTraceElement> pythonStackTrace(final @Nullable PyObject traceback) {
    final String marker = "<" + interpreter.table().name() + ">";
    final List<StackTraceElement> frames = new ArrayList<>();
    PyObject current = traceback;
    while (current != null && !current.isNone()) {
      try (PyObject frame = current.getAttribute("tb_frame");
          PyObject code = frame.getAttribute("f_code");
          PyObject function = code.getAttribute("co_name");
          PyObject file = code.getAttribute("co_filename");
          PyObject line = current.getAttribute("tb_lineno")) {
        frames.add(new StackTraceElement(
            marker,
            function.toString(),
            file.toString(),
            line.toInt()
        ));
      }
      final PyObject next = current.getAttribute("tb_next");
      if (current != traceback) {
        current.close();
      }
      current = next;
    }
    if (current != null && current != traceback) {
      current.close();
    }
    return frames;
  }

  /** Drops every frame up to and including the last one inside this class. */
  private static List<StackTraceElement> callerStackTrace(final StackTraceElement[] frames) {
    int first = 0;
    for (int i = 0; i < frames.length; i++) {
      if (frames[i].getClassName().equals(ErrorTranslator.class.getName())) {
        first = i + 1;
      }
    }
    return Arrays.asList(frames).subList(first, frames.length);
  }
}
