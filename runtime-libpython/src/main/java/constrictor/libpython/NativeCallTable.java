package constrictor.libpython;

import static constrictor.libpython.NativeFunction.Type.DOUBLE;
import static constrictor.libpython.NativeFunction.Type.INT;
import static constrictor.libpython.NativeFunction.Type.LONG;
import static constrictor.libpython.NativeFunction.Type.POINTER;
import static constrictor.libpython.NativeFunction.Type.VOID;

import constrictor.BinaryOperator;
import constrictor.CallTable;
import constrictor.Comparison;
import constrictor.RaisedError;
import constrictor.UnaryOperator;
import java.nio.ByteBuffer;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.lwjgl.PointerBuffer;
import org.lwjgl.system.MemoryStack;
import org.lwjgl.system.MemoryUtil;
import org.lwjgl.system.SharedLibrary;

/** {@link CallTable} bound to a loaded libpython. */
final class NativeCallTable implements CallTable {

  private static final NativeFunction.Type[] CALL_FIXED = {POINTER};
  private static final NativeFunction.Type[] CALL_METHOD_FIXED = {POINTER, POINTER};

  private final SharedLibrary library;
  private final String name;
  private final long none;

  private final NativeFunction incRef;
  private final NativeFunction decRef;
  private final NativeFunction errOccurred;
  private final NativeFunction errMatches;
  private final NativeFunction errClear;
  private final NativeFunction errFetch;
  private final NativeFunction errNormalize;
  private final NativeFunction getAttr;
  private final NativeFunction setAttr;
  private final NativeFunction getItem;
  private final NativeFunction setItem;
  private final NativeFunction richCompareBool;
  private final NativeFunction str;
  private final NativeFunction repr;
  private final NativeFunction hash;
  private final NativeFunction isTrue;
  private final NativeFunction getIter;
  private final NativeFunction call;
  private final NativeFunction callableCheck;
  private final Map<BinaryOperator, NativeFunction> binary = new EnumMap<>(BinaryOperator.class);
  private final Map<BinaryOperator, NativeFunction> inPlace = new EnumMap<>(BinaryOperator.class);
  private final Map<UnaryOperator, NativeFunction> unary = new EnumMap<>(UnaryOperator.class);
  private final NativeFunction sequenceGetItem;
  private final NativeFunction mappingItems;
  private final NativeFunction iterNext;
  private final NativeFunction longFromLong;
  private final NativeFunction longAsLong;
  private final NativeFunction boolFromLong;
  private final NativeFunction floatFromDouble;
  private final NativeFunction floatAsDouble;
  private final NativeFunction unicodeFromString;
  private final NativeFunction unicodeAsUtf8;
  private final NativeFunction tupleNew;
  private final NativeFunction tupleSetItem;
  private final NativeFunction listNew;
  private final NativeFunction listSetItem;
  private final NativeFunction listAppend;
  private final NativeFunction dictNew;
  private final NativeFunction dictSetItem;
  private final NativeFunction setNew;
  private final NativeFunction setAdd;
  private final NativeFunction sliceNew;
  private final NativeFunction builtins;
  private final NativeFunction importModule;

  // One prepared call per arity of the variadic functions.
  private final Map<Integer, NativeFunction> callObjArgs = new ConcurrentHashMap<>();
  private final Map<Integer, NativeFunction> callMethodObjArgs = new ConcurrentHashMap<>();

  NativeCallTable(final SharedLibrary library, final String name) {
    this.library = library;
    this.name = name;
    this.none = NativeFunction.address(library, "_Py_NoneStruct");

    incRef = bind("Py_IncRef", VOID, POINTER);
    decRef = bind("Py_DecRef", VOID, POINTER);
    errOccurred = bind("PyErr_Occurred", POINTER);
    errMatches = bind("PyErr_ExceptionMatches", INT, POINTER);
    errClear = bind("PyErr_Clear", VOID);
    errFetch = bind("PyErr_Fetch", VOID, POINTER, POINTER, POINTER);
    errNormalize = bind("PyErr_NormalizeException", VOID, POINTER, POINTER, POINTER);
    getAttr = bind("PyObject_GetAttrString", POINTER, POINTER, POINTER);
    setAttr = bind("PyObject_SetAttrString", INT, POINTER, POINTER, POINTER);
    getItem = bind("PyObject_GetItem", POINTER, POINTER, POINTER);
    setItem = bind("PyObject_SetItem", INT, POINTER, POINTER, POINTER);
    richCompareBool = bind("PyObject_RichCompareBool", INT, POINTER, POINTER, INT);
    str = bind("PyObject_Str", POINTER, POINTER);
    repr = bind("PyObject_Repr", POINTER, POINTER);
    hash = bind("PyObject_Hash", LONG, POINTER);
    isTrue = bind("PyObject_IsTrue", INT, POINTER);
    getIter = bind("PyObject_GetIter", POINTER, POINTER);
    call = bind("PyObject_Call", POINTER, POINTER, POINTER, POINTER);
    callableCheck = bind("PyCallable_Check", INT, POINTER);

    for (final BinaryOperator operator : BinaryOperator.values()) {
      if (operator.ternary()) {
        binary.put(operator, bind(operator.function(), POINTER, POINTER, POINTER, POINTER));
        inPlace.put(operator, bind(operator.inPlaceFunction(), POINTER, POINTER, POINTER, POINTER));
      } else {
        binary.put(operator, bind(operator.function(), POINTER, POINTER, POINTER));
        inPlace.put(operator, bind(operator.inPlaceFunction(), POINTER, POINTER, POINTER));
      }
    }
    for (final UnaryOperator operator : UnaryOperator.values()) {
      unary.put(operator, bind(operator.function(), POINTER, POINTER));
    }

    sequenceGetItem = bind("PySequence_GetItem", POINTER, POINTER, LONG);
    mappingItems = bind("PyMapping_Items", POINTER, POINTER);
    iterNext = bind("PyIter_Next", POINTER, POINTER);
    longFromLong = bind("PyLong_FromLongLong", POINTER, LONG);
    longAsLong = bind("PyLong_AsLongLong", LONG, POINTER);
    boolFromLong = bind("PyBool_FromLong", POINTER, LONG);
    floatFromDouble = bind("PyFloat_FromDouble", POINTER, DOUBLE);
    floatAsDouble = bind("PyFloat_AsDouble", DOUBLE, POINTER);
    unicodeFromString = bind("PyUnicode_FromStringAndSize", POINTER, POINTER, LONG);
    unicodeAsUtf8 = bind("PyUnicode_AsUTF8AndSize", POINTER, POINTER, POINTER);
    tupleNew = bind("PyTuple_New", POINTER, LONG);
    tupleSetItem = bind("PyTuple_SetItem", INT, POINTER, LONG, POINTER);
    listNew = bind("PyList_New", POINTER, LONG);
    listSetItem = bind("PyList_SetItem", INT, POINTER, LONG, POINTER);
    listAppend = bind("PyList_Append", INT, POINTER, POINTER);
    dictNew = bind("PyDict_New", POINTER);
    dictSetItem = bind("PyDict_SetItem", INT, POINTER, POINTER, POINTER);
    setNew = bind("PySet_New", POINTER, POINTER);
    setAdd = bind("PySet_Add", INT, POINTER, POINTER);
    sliceNew = bind("PySlice_New", POINTER, POINTER, POINTER, POINTER);
    builtins = bind("PyEval_GetBuiltins", POINTER);
    importModule = bind("PyImport_ImportModule", POINTER, POINTER);
  }

  private NativeFunction bind(
      final String function,
      final NativeFunction.Type result,
      final NativeFunction.Type... arguments
  ) {
    return NativeFunction.bind(library, function, result, arguments);
  }

  @Override
  public String name() {
    return name;
  }

  // Reference counting

  @Override
  public void incRef(final long o) {
    incRef.invoke(o);
  }

  @Override
  public void decRef(final long o) {
    decRef.invoke(o);
  }

  // Error indicator

  @Override
  public boolean errOccurred() {
    return errOccurred.invoke() != MemoryUtil.NULL;
  }

  @Override
  public boolean errorMatches(final long type) {
    return errMatches.invokeInt(type) != 0;
  }

  @Override
  public void clearError() {
    errClear.invoke();
  }

  @Override
  public RaisedError fetchError() {
    return transfer(errFetch, new RaisedError(0, 0, 0));
  }

  @Override
  public RaisedError normalizeError(final RaisedError error) {
    return transfer(errNormalize, error);
  }

  /** Calls one of the {@code PyErr} functions taking three {@code PyObject**}. */
  private static RaisedError transfer(final NativeFunction function, final RaisedError error) {
    try (MemoryStack stack = MemoryStack.stackPush()) {
      final PointerBuffer slots = stack.pointers(error.type, error.value, error.traceback);
      function.invoke(slots.address(0), slots.address(1), slots.address(2));
      return new RaisedError(slots.get(0), slots.get(1), slots.get(2));
    }
  }

  // Object protocol

  @Override
  public long getAttr(final long o, final String name) {
    final ByteBuffer encoded = MemoryUtil.memUTF8(name);
    try {
      return getAttr.invoke(o, MemoryUtil.memAddress(encoded));
    } finally {
      MemoryUtil.memFree(encoded);
    }
  }

  @Override
  public int setAttr(final long o, final String name, final long value) {
    final ByteBuffer encoded = MemoryUtil.memUTF8(name);
    try {
      return setAttr.invokeInt(o, MemoryUtil.memAddress(encoded), value);
    } finally {
      MemoryUtil.memFree(encoded);
    }
  }

  @Override
  public long getItem(final long o, final long key) {
    return getItem.invoke(o, key);
  }

  @Override
  public int setItem(final long o, final long key, final long value) {
    return setItem.invokeInt(o, key, value);
  }

  @Override
  public int richCompareBool(final long o1, final long o2, final Comparison comparison) {
    return richCompareBool.invokeInt(o1, o2, comparison.code());
  }

  @Override
  public long str(final long o) {
    return str.invoke(o);
  }

  @Override
  public long repr(final long o) {
    return repr.invoke(o);
  }

  @Override
  public long hash(final long o) {
    return hash.invoke(o);
  }

  @Override
  public int isTrue(final long o) {
    return isTrue.invokeInt(o);
  }

  @Override
  public long getIter(final long o) {
    return getIter.invoke(o);
  }

  @Override
  public long call(final long callable, final long args, final long kwargs) {
    return call.invoke(callable, args, kwargs);
  }

  @Override
  public long callObjArgs(final long callable, final long... args) {
    final NativeFunction function = callObjArgs.computeIfAbsent(args.length, arity -> NativeFunction
        .bindVariadic(library, "PyObject_CallFunctionObjArgs", POINTER, CALL_FIXED, arity + 1));
    final long[] values = new long[args.length + 2];
    values[0] = callable;
    System.arraycopy(args, 0, values, 1, args.length);
    return function.invoke(values);
  }

  @Override
  public long callMethodObjArgs(final long o, final long name, final long... args) {
    final NativeFunction function = callMethodObjArgs.computeIfAbsent(args.length, arity -> NativeFunction
        .bindVariadic(library, "PyObject_CallMethodObjArgs", POINTER, CALL_METHOD_FIXED, arity + 1));
    final long[] values = new long[args.length + 3];
    values[0] = o;
    values[1] = name;
    System.arraycopy(args, 0, values, 2, args.length);
    return function.invoke(values);
  }

  @Override
  public boolean callableCheck(final long o) {
    return callableCheck.invokeInt(o) == 1;
  }

  // Number protocol

  @Override
  public long numberBinary(final BinaryOperator operator, final long o1, final long o2) {
    if (operator.ternary()) {
      return numberPower(o1, o2, none, false);
    }
    return binary.get(operator).invoke(o1, o2);
  }

  @Override
  public long numberInPlace(final BinaryOperator operator, final long o1, final long o2) {
    if (operator.ternary()) {
      return numberPower(o1, o2, none, true);
    }
    return inPlace.get(operator).invoke(o1, o2);
  }

  @Override
  public long numberUnary(final UnaryOperator operator, final long o) {
    return unary.get(operator).invoke(o);
  }

  @Override
  public long numberPower(final long base, final long exponent, final long modulus,
      final boolean inPlace) {
    final NativeFunction function = (inPlace ? this.inPlace : binary).get(BinaryOperator.POWER);
    return function.invoke(base, exponent, modulus);
  }

  // Sequences, mappings and iterators

  @Override
  public long sequenceGetItem(final long o, final long index) {
    return sequenceGetItem.invoke(o, index);
  }

  @Override
  public long mappingItems(final long o) {
    return mappingItems.invoke(o);
  }

  @Override
  public long iterNext(final long iterator) {
    return iterNext.invoke(iterator);
  }

  // Concrete objects

  @Override
  public long longFromLong(final long value) {
    return longFromLong.invoke(value);
  }

  @Override
  public long longAsLong(final long o) {
    return longAsLong.invoke(o);
  }

  @Override
  public long boolFromLong(final long value) {
    return boolFromLong.invoke(value);
  }

  @Override
  public long floatFromDouble(final double value) {
    return floatFromDouble.invoke(Double.doubleToRawLongBits(value));
  }

  @Override
  public double floatAsDouble(final long o) {
    return floatAsDouble.invokeDouble(o);
  }

  @Override
  public long unicodeFromString(final String value) {
    final ByteBuffer encoded = MemoryUtil.memUTF8(value, false);
    try {
      return unicodeFromString.invoke(MemoryUtil.memAddress(encoded), encoded.remaining());
    } finally {
      MemoryUtil.memFree(encoded);
    }
  }

  @Override
  public @Nullable String unicodeAsUtf8(final long o) {
    try (MemoryStack stack = MemoryStack.stackPush()) {
      final PointerBuffer size = stack.mallocPointer(1);
      final long utf8 = unicodeAsUtf8.invoke(o, size.address());
      if (utf8 == MemoryUtil.NULL) {
        return null;
      }
      return MemoryUtil.memUTF8(utf8, (int) size.get(0));
    }
  }

  @Override
  public long tupleNew(final long length) {
    return tupleNew.invoke(length);
  }

  @Override
  public int tupleSetItem(final long tuple, final long position, final long item) {
    return tupleSetItem.invokeInt(tuple, position, item);
  }

  @Override
  public long listNew(final long length) {
    return listNew.invoke(length);
  }

  @Override
  public int listSetItem(final long list, final long index, final long item) {
    return listSetItem.invokeInt(list, index, item);
  }

  @Override
  public int listAppend(final long list, final long item) {
    return listAppend.invokeInt(list, item);
  }

  @Override
  public long dictNew() {
    return dictNew.invoke();
  }

  @Override
  public int dictSetItem(final long dict, final long key, final long value) {
    return dictSetItem.invokeInt(dict, key, value);
  }

  @Override
  public long setNew(final long iterable) {
    return setNew.invoke(iterable);
  }

  @Override
  public int setAdd(final long set, final long key) {
    return setAdd.invokeInt(set, key);
  }

  @Override
  public long sliceNew(final long start, final long stop, final long step) {
    return sliceNew.invoke(start, stop, step);
  }

  // Namespaces

  @Override
  public long builtins() {
    return builtins.invoke();
  }

  @Override
  public long none() {
    return none;
  }

  @Override
  public long importModule(final String name) {
    final ByteBuffer encoded = MemoryUtil.memUTF8(name);
    try {
      return importModule.invoke(MemoryUtil.memAddress(encoded));
    } finally {
      MemoryUtil.memFree(encoded);
    }
  }
}
