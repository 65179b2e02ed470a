package constrictor;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * {@link Converter}s for the JVM types with a natural Python counterpart.
 *
 * <p>Containers are converted element by element, each element with {@link #toPython}. Elements
 * that already are {@link PyObject}s are stored as they are.
 */
public final class Converters {
  private Converters() {}

  public static final Converter<Long> LONG =
      (interpreter, value) -> interpreter.wrap(interpreter.table().longFromLong(value));

  public static final Converter<Integer> INTEGER =
      (interpreter, value) -> LONG.toPython(interpreter, value.longValue());

  public static final Converter<Short> SHORT =
      (interpreter, value) -> LONG.toPython(interpreter, value.longValue());

  public static final Converter<Byte> BYTE =
      (interpreter, value) -> LONG.toPython(interpreter, value.longValue());

  public static final Converter<Boolean> BOOLEAN =
      (interpreter, value) -> interpreter.wrap(interpreter.table().boolFromLong(value ? 1 : 0));

  public static final Converter<Double> DOUBLE =
      (interpreter, value) -> interpreter.wrap(interpreter.table().floatFromDouble(value));

  public static final Converter<Float> FLOAT =
      (interpreter, value) -> DOUBLE.toPython(interpreter, value.doubleValue());

  public static final Converter<String> STRING =
      (interpreter, value) -> interpreter.wrap(interpreter.table().unicodeFromString(value));

  public static final Converter<Character> CHARACTER =
      (interpreter, value) -> STRING.toPython(interpreter, String.valueOf(value));

  /** Any collection becomes a {@code list}, in iteration order. */
  public static final Converter<Collection<?>> LIST = Converters::list;

  /** A fixed-arity argument pack becomes a {@code tuple}. */
  public static final Converter<List<?>> TUPLE = Converters::tuple;

  public static final Converter<Set<?>> SET = Converters::set;

  public static final Converter<Map<?, ?>> DICT = Converters::dict;

  public static final Converter<IntRange> SLICE = Converters::slice;

  /**
   * Converts a value of any supported type. {@code null} becomes {@code None} and a
   * {@link PyObject} gets a new proxy of the same object.
   *
   * @throws MarshalException If the type is not supported.
   */
  public static PyObject toPython(final Interpreter interpreter, final @Nullable Object value) {
    if (value == null) {
      return interpreter.none();
    } else if (value instanceof PyObject) {
      return interpreter.borrow(((PyObject) value).handle());
    } else if (value instanceof Long) {
      return LONG.toPython(interpreter, (Long) value);
    } else if (value instanceof Integer) {
      return INTEGER.toPython(interpreter, (Integer) value);
    } else if (value instanceof Short) {
      return SHORT.toPython(interpreter, (Short) value);
    } else if (value instanceof Byte) {
      return BYTE.toPython(interpreter, (Byte) value);
    } else if (value instanceof Boolean) {
      return BOOLEAN.toPython(interpreter, (Boolean) value);
    } else if (value instanceof Double) {
      return DOUBLE.toPython(interpreter, (Double) value);
    } else if (value instanceof Float) {
      return FLOAT.toPython(interpreter, (Float) value);
    } else if (value instanceof Character) {
      return CHARACTER.toPython(interpreter, (Character) value);
    } else if (value instanceof String) {
      return STRING.toPython(interpreter, (String) value);
    } else if (value instanceof Set) {
      return SET.toPython(interpreter, (Set<?>) value);
    } else if (value instanceof Collection) {
      return LIST.toPython(interpreter, (Collection<?>) value);
    } else if (value instanceof Map) {
      return DICT.toPython(interpreter, (Map<?, ?>) value);
    } else if (value instanceof IntRange) {
      return SLICE.toPython(interpreter, (IntRange) value);
    }
    throw new MarshalException("Cannot convert " + value.getClass().getName() + " to Python.");
  }

  static PyObject list(final Interpreter interpreter, final Collection<?> elements) {
    final CallTable table = interpreter.table();
    final PyObject list = interpreter.wrap(table.listNew(elements.size()));
    try {
      long index = 0;
      for (final Object element : elements) {
        final long item = stolen(interpreter, element);
        interpreter.errors().checkStatus(table.listSetItem(list.handle(), index++, item));
      }
    } catch (final RuntimeException err) {
      list.close();
      throw err;
    }
    return list;
  }

  static PyObject tuple(final Interpreter interpreter, final List<?> elements) {
    final CallTable table = interpreter.table();
    final PyObject tuple = interpreter.wrap(table.tupleNew(elements.size()));
    try {
      long position = 0;
      for (final Object element : elements) {
        final long item = stolen(interpreter, element);
        interpreter.errors().checkStatus(table.tupleSetItem(tuple.handle(), position++, item));
      }
    } catch (final RuntimeException err) {
      tuple.close();
      throw err;
    }
    return tuple;
  }

  static PyObject set(final Interpreter interpreter, final Set<?> elements) {
    final CallTable table = interpreter.table();
    final PyObject set = interpreter.wrap(table.setNew(0));
    try {
      for (final Object element : elements) {
        try (PyObject key = toPython(interpreter, element)) {
          interpreter.errors().checkStatus(table.setAdd(set.handle(), key.handle()));
        }
      }
    } catch (final RuntimeException err) {
      set.close();
      throw err;
    }
    return set;
  }

  static PyObject dict(final Interpreter interpreter, final Map<?, ?> entries) {
    final CallTable table = interpreter.table();
    final PyObject dict = interpreter.wrap(table.dictNew());
    try {
      for (final Map.Entry<?, ?> entry : entries.entrySet()) {
        try (PyObject key = toPython(interpreter, entry.getKey());
            PyObject value = toPython(interpreter, entry.getValue())) {
          interpreter.errors().checkStatus(table.dictSetItem(dict.handle(), key.handle(), value.handle()));
        }
      }
    } catch (final RuntimeException err) {
      dict.close();
      throw err;
    }
    return dict;
  }

  /** Named arguments of a call. */
  static PyObject keywords(final Interpreter interpreter, final Map<String, PyObject> kwargs) {
    return dict(interpreter, kwargs);
  }

  static PyObject slice(final Interpreter interpreter, final IntRange range) {
    try (PyObject start = LONG.toPython(interpreter, range.start());
        PyObject stop = range.bounded() ? LONG.toPython(interpreter, range.stop()) : interpreter.none();
        PyObject step = LONG.toPython(interpreter, range.step())) {
      return interpreter.wrap(interpreter.table().sliceNew(start.handle(), stop.handle(), step.handle()));
    }
  }

  /**
   * A reference to {@code element} for a {@code SetItem} call that steals it. The count handed
   * over is either the one of a freshly converted object or an extra one on an existing proxy.
   */
  private static long stolen(final Interpreter interpreter, final @Nullable Object element) {
    final PyObject converted = toPython(interpreter, element);
    final long item = converted.handle();
    interpreter.table().incRef(item);
    converted.close();
    return item;
  }
}
