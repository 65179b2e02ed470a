package constrictor.libpython;

import java.nio.ByteBuffer;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.lwjgl.BufferUtils;
import org.lwjgl.PointerBuffer;
import org.lwjgl.system.MemoryStack;
import org.lwjgl.system.MemoryUtil;
import org.lwjgl.system.SharedLibrary;
import org.lwjgl.system.libffi.FFICIF;
import org.lwjgl.system.libffi.FFIType;
import org.lwjgl.system.libffi.LibFFI;

/**
 * A C function called through libffi.
 *
 * <p>Arguments and results travel as {@code long}s: pointers and integers as they are, doubles
 * as their raw bits. C {@code long} and {@code Py_ssize_t} are 64 bits wide, so this only runs
 * on LP64 platforms.
 */
final class NativeFunction {

  /** C types appearing in the signatures of the bound functions. */
  enum Type {
    VOID(LibFFI.ffi_type_void),
    INT(LibFFI.ffi_type_sint32),
    LONG(LibFFI.ffi_type_sint64),
    DOUBLE(LibFFI.ffi_type_double),
    POINTER(LibFFI.ffi_type_pointer);

    private final FFIType ffiType;

    Type(final FFIType ffiType) {
      this.ffiType = ffiType;
    }
  }

  private final String name;
  private final long address;
  private final Type result;
  private final Type[] arguments;
  private final FFICIF cif = FFICIF.create();
  private final PointerBuffer argumentTypes;

  private NativeFunction(
      final String name,
      final long address,
      final int fixedArguments,
      final Type result,
      final Type... arguments
  ) {
    this.name = name;
    this.address = address;
    this.result = result;
    this.arguments = arguments;
    // libffi keeps a pointer to this array for as long as the CIF lives.
    this.argumentTypes = BufferUtils.createPointerBuffer(Math.max(arguments.length, 1));
    for (int i = 0; i < arguments.length; i++) {
      argumentTypes.put(i, arguments[i].ffiType);
    }
    argumentTypes.limit(arguments.length);

    final int status = fixedArguments < arguments.length
        ? LibFFI.ffi_prep_cif_var(cif, LibFFI.FFI_DEFAULT_ABI, fixedArguments, result.ffiType, argumentTypes)
        : LibFFI.ffi_prep_cif(cif, LibFFI.FFI_DEFAULT_ABI, result.ffiType, argumentTypes);
    if (status != LibFFI.FFI_OK) {
      throw new LibPythonException(String.format("Cannot prepare call to %s (status %d).", name, status));
    }
  }

  /**
   * Binds a function that the library must export.
   *
   * @throws LibPythonException If the symbol is missing.
   */
  static NativeFunction bind(
      final SharedLibrary library,
      final String name,
      final Type result,
      final Type... arguments
  ) {
    return new NativeFunction(name, address(library, name), arguments.length, result, arguments);
  }

  /** Binds a function that older or newer versions of the library may lack. */
  static @Nullable NativeFunction bindOptional(
      final SharedLibrary library,
      final String name,
      final Type result,
      final Type... arguments
  ) {
    final long address = library.getFunctionAddress(name);
    if (address == MemoryUtil.NULL) {
      return null;
    }
    return new NativeFunction(name, address, arguments.length, result, arguments);
  }

  /**
   * Binds a variadic function for one particular number of variadic arguments, all of which are
   * pointers.
   */
  static NativeFunction bindVariadic(
      final SharedLibrary library,
      final String name,
      final Type result,
      final Type[] fixed,
      final int variadic
  ) {
    final Type[] arguments = new Type[fixed.length + variadic];
    System.arraycopy(fixed, 0, arguments, 0, fixed.length);
    for (int i = fixed.length; i < arguments.length; i++) {
      arguments[i] = Type.POINTER;
    }
    return new NativeFunction(name, address(library, name), fixed.length, result, arguments);
  }

  /** Address of an exported symbol, function or data. */
  static long address(final SharedLibrary library, final String name) {
    final long address = library.getFunctionAddress(name);
    if (address == MemoryUtil.NULL) {
      throw new LibPythonException("Missing symbol " + name + " in " + library.getName() + ".");
    }
    return address;
  }

  String name() {
    return name;
  }

  /** Calls the function. Returns 0 for {@code void} functions. */
  long invoke(final long... args) {
    try (MemoryStack stack = MemoryStack.stackPush()) {
      final ByteBuffer value = call(stack, args);
      switch (result) {
        case VOID:
          return 0;
        case INT:
          return (int) value.getLong(0);
        case DOUBLE:
          return Double.doubleToRawLongBits(value.getDouble(0));
        default:
          return value.getLong(0);
      }
    }
  }

  /** Calls a function returning {@code int}. */
  int invokeInt(final long... args) {
    return (int) invoke(args);
  }

  /** Calls a function returning {@code double}. */
  double invokeDouble(final long... args) {
    return Double.longBitsToDouble(invoke(args));
  }

  private ByteBuffer call(final MemoryStack stack, final long[] args) {
    if (args.length != arguments.length) {
      throw new IllegalArgumentException(String.format(
          "%s takes %d arguments, got %d.", name, arguments.length, args.length));
    }
    final PointerBuffer values = stack.mallocPointer(Math.max(args.length, 1));
    for (int i = 0; i < args.length; i++) {
      switch (arguments[i]) {
        case INT:
          values.put(i, MemoryUtil.memAddress(stack.ints((int) args[i])));
          break;
        case DOUBLE:
          values.put(i, MemoryUtil.memAddress(stack.doubles(Double.longBitsToDouble(args[i]))));
          break;
        default:
          values.put(i, MemoryUtil.memAddress(stack.longs(args[i])));
          break;
      }
    }
    values.limit(args.length);
    // Large enough for ffi_arg, which integer results are widened to.
    final ByteBuffer value = stack.malloc(8, 8);
    LibFFI.ffi_call(cif, address, value, values);
    return value;
  }

  @Override
  public String toString() {
    return name;
  }
}
