package constrictor;

/**
 * Conversion of one kind of JVM value into a new Python object.
 *
 * @param <T> Type of the JVM value.
 */
@FunctionalInterface
public interface Converter<T> {

  /** Creates a Python object equivalent to {@code value}. */
  PyObject toPython(Interpreter interpreter, T value);
}
