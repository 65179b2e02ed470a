package constrictor;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Raw entry points into the Python C API.
 *
 * <p>Objects are passed around as {@code PyObject*} addresses, with {@code 0} standing for
 * {@code NULL}. Unless a method says otherwise, a returned object is a <em>new reference</em>
 * owned by the caller and must be handed to {@link ReferenceManager#receive(long)}. A {@code 0}
 * result, a {@code -1} status or a {@code -1} numeric result signals failure, with the details
 * left in the error indicator.
 *
 * <p>None of these methods are thread-safe; callers serialize access the same way the
 * interpreter does.
 */
public interface CallTable {

  /** Name of the loaded library, used to tag Python frames in translated stack traces. */
  String name();

  // Reference counting

  /** {@code Py_IncRef}. Does nothing for {@code 0}. */
  void incRef(long o);

  /** {@code Py_DecRef}. Does nothing for {@code 0}. */
  void decRef(long o);

  // Error indicator

  /** {@code PyErr_Occurred}. */
  boolean errOccurred();

  /** {@code PyErr_ExceptionMatches}. Whether the pending error is an instance of {@code type}. */
  boolean errorMatches(long type);

  /** {@code PyErr_Clear}. Drops the pending error, if any. */
  void clearError();

  /**
   * {@code PyErr_Fetch}. Clears the indicator and transfers ownership of all three objects to
   * the caller. The traceback, and even the value, may be {@code 0}.
   */
  RaisedError fetchError();

  /**
   * {@code PyErr_NormalizeException}. Consumes the references in {@code error} and returns the
   * normalized triple, also owned by the caller.
   */
  RaisedError normalizeError(RaisedError error);

  // Object protocol

  /** {@code PyObject_GetAttrString}. */
  long getAttr(long o, String name);

  /** {@code PyObject_SetAttrString}. Returns {@code -1} on failure. */
  int setAttr(long o, String name, long value);

  /** {@code PyObject_GetItem}. */
  long getItem(long o, long key);

  /** {@code PyObject_SetItem}. Does not steal {@code value}. Returns {@code -1} on failure. */
  int setItem(long o, long key, long value);

  /** {@code PyObject_RichCompareBool}. Returns {@code 1}, {@code 0} or {@code -1} on failure. */
  int richCompareBool(long o1, long o2, Comparison comparison);

  /** {@code PyObject_Str}. */
  long str(long o);

  /** {@code PyObject_Repr}. */
  long repr(long o);

  /** {@code PyObject_Hash}. Returns {@code -1} on failure, which is also a valid hash. */
  long hash(long o);

  /** {@code PyObject_IsTrue}. Returns {@code 1}, {@code 0} or {@code -1} on failure. */
  int isTrue(long o);

  /** {@code PyObject_GetIter}. */
  long getIter(long o);

  /** {@code PyObject_Call}. {@code kwargs} may be {@code 0}. */
  long call(long callable, long args, long kwargs);

  /** {@code PyObject_CallFunctionObjArgs}. The terminating {@code NULL} is added here. */
  long callObjArgs(long callable, long... args);

  /** {@code PyObject_CallMethodObjArgs}. {@code name} is a {@code str} object. */
  long callMethodObjArgs(long o, long name, long... args);

  /** {@code PyCallable_Check}. Never fails. */
  boolean callableCheck(long o);

  // Number protocol

  /** The {@code PyNumber_*} binary function for {@code operator}. */
  long numberBinary(BinaryOperator operator, long o1, long o2);

  /** The {@code PyNumber_InPlace*} function for {@code operator}. */
  long numberInPlace(BinaryOperator operator, long o1, long o2);

  /** The {@code PyNumber_*} unary function for {@code operator}. */
  long numberUnary(UnaryOperator operator, long o);

  /** {@code PyNumber_Power} or {@code PyNumber_InPlacePower}. {@code modulus} is never 0. */
  long numberPower(long base, long exponent, long modulus, boolean inPlace);

  // Sequences, mappings and iterators

  /** {@code PySequence_GetItem}. */
  long sequenceGetItem(long o, long index);

  /** {@code PyMapping_Items}. A list of {@code (key, value)} tuples. */
  long mappingItems(long o);

  /**
   * {@code PyIter_Next}. Returns {@code 0} both when the iterator is exhausted and on failure;
   * only the error indicator tells them apart.
   */
  long iterNext(long iterator);

  // Concrete objects

  /** {@code PyLong_FromLongLong}. */
  long longFromLong(long value);

  /** {@code PyLong_AsLongLong}. Returns {@code -1} on failure, which is also a valid value. */
  long longAsLong(long o);

  /** {@code PyBool_FromLong}. */
  long boolFromLong(long value);

  /** {@code PyFloat_FromDouble}. */
  long floatFromDouble(double value);

  /** {@code PyFloat_AsDouble}. Returns {@code -1.0} on failure, which is also a valid value. */
  double floatAsDouble(long o);

  /** {@code PyUnicode_FromString}. */
  long unicodeFromString(String value);

  /** {@code PyUnicode_AsUTF8}. Returns {@code null} on failure. */
  @Nullable
  String unicodeAsUtf8(long o);

  /** {@code PyTuple_New}. */
  long tupleNew(long length);

  /** {@code PyTuple_SetItem}. <em>Steals</em> {@code item}, even on failure. */
  int tupleSetItem(long tuple, long position, long item);

  /** {@code PyList_New}. */
  long listNew(long length);

  /** {@code PyList_SetItem}. <em>Steals</em> {@code item}, even on failure. */
  int listSetItem(long list, long index, long item);

  /** {@code PyList_Append}. Does not steal {@code item}. */
  int listAppend(long list, long item);

  /** {@code PyDict_New}. */
  long dictNew();

  /** {@code PyDict_SetItem}. Steals neither key nor value. */
  int dictSetItem(long dict, long key, long value);

  /** {@code PySet_New}. {@code iterable} may be {@code 0} for an empty set. */
  long setNew(long iterable);

  /** {@code PySet_Add}. Does not steal {@code key}. */
  int setAdd(long set, long key);

  /** {@code PySlice_New}. Any bound may be {@code 0}, meaning {@code None}. */
  long sliceNew(long start, long stop, long step);

  // Namespaces

  /** {@code PyEval_GetBuiltins}. <em>Borrowed</em> reference to the built-ins dictionary. */
  long builtins();

  /** {@code Py_None}. <em>Borrowed</em> reference. */
  long none();

  /** {@code PyImport_ImportModule}. */
  long importModule(String name);
}
