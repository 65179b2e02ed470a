package constrictor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Marshals BSON values to and from Python objects. */
public class Marshaler {
  private Marshaler() {}

  /**
   * Builds the Python equivalent of a BSON value: documents become {@code dict}s, arrays
   * {@code list}s.
   *
   * @throws MarshalException If the value has no Python equivalent.
   */
  public static PyObject toPython(final Interpreter interpreter, final BsonValue src) {
    return interpreter.toPython(unwrap(src));
  }

  /**
   * Reads a Python object made of {@code None}, {@code bool}, {@code int}, {@code float},
   * {@code str}, {@code list}, {@code tuple} and {@code dict} with {@code str} keys.
   *
   * @throws MarshalException If the object contains anything else.
   */
  public static BsonValue toBson(final PyObject src) {
    final String type = typeName(src);
    switch (type) {
      case "NoneType":
        return BsonNull.VALUE;
      case "bool":
        return BsonBoolean.valueOf(src.isTrue());
      case "int":
        final long value = src.toLong();
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
          return new BsonInt32((int) value);
        }
        return new BsonInt64(value);
      case "float":
        return new BsonDouble(src.toDouble());
      case "str":
        return new BsonString(src.toString());
      case "list":
      case "tuple":
        final BsonArray array = new BsonArray();
        try (PyIterator iterator = src.iterator()) {
          while (iterator.hasNext()) {
            try (PyObject element = iterator.next()) {
              array.add(toBson(element));
            }
          }
        }
        return array;
      case "dict":
        final BsonDocument document = new BsonDocument();
        for (final Map.Entry<PyObject, PyObject> entry : src.toMap().entrySet()) {
          try (PyObject key = entry.getKey(); PyObject element = entry.getValue()) {
            if (!"str".equals(typeName(key))) {
              throw new MarshalException("Document keys must be str, not " + typeName(key) + ".");
            }
            document.put(key.toString(), toBson(element));
          }
        }
        return document;
      default:
        throw new MarshalException("Cannot marshal a Python " + type + " as BSON.");
    }
  }

  private static @Nullable Object unwrap(final BsonValue src) {
    switch (src.getBsonType()) {
      case NULL:
        return null;
      case BOOLEAN:
        return src.asBoolean().getValue();
      case INT32:
        return (long) src.asInt32().getValue();
      case INT64:
        return src.asInt64().getValue();
      case DOUBLE:
        return src.asDouble().getValue();
      case STRING:
        return src.asString().getValue();
      case ARRAY:
        final List<@Nullable Object> elements = new ArrayList<>();
        for (final BsonValue element : src.asArray()) {
          elements.add(unwrap(element));
        }
        return elements;
      case DOCUMENT:
        final Map<String, @Nullable Object> entries = new LinkedHashMap<>();
        for (final Map.Entry<String, BsonValue> entry : src.asDocument().entrySet()) {
          entries.put(entry.getKey(), unwrap(entry.getValue()));
        }
        return entries;
      default:
        throw new MarshalException("Cannot marshal BSON " + src.getBsonType() + " to Python.");
    }
  }

  private static String typeName(final PyObject src) {
    try (PyObject type = src.getAttribute("__class__"); PyObject name = type.getAttribute("__name__")) {
      return name.toString();
    }
  }
}
