package constrictor.libpython;

import static constrictor.libpython.NativeFunction.Type.INT;
import static constrictor.libpython.NativeFunction.Type.POINTER;
import static constrictor.libpython.NativeFunction.Type.VOID;

import constrictor.Interpreter;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.lwjgl.system.Library;
import org.lwjgl.system.MemoryUtil;
import org.lwjgl.system.Platform;
import org.lwjgl.system.SharedLibrary;
import org.lwjgl.system.linux.DynamicLinkLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads libpython into the JVM and starts the interpreter.
 *
 * <p>CPython cannot be restarted, so the first successful {@link #start} wins for the lifetime
 * of the process. The interpreter belongs to the thread that started it: that thread holds the
 * GIL and is the one expected to make every call.
 */
public final class LibPython {

  private static final Logger log = LoggerFactory.getLogger(LibPython.class);

  private static @Nullable LibPythonConfig config;
  private static @Nullable Interpreter interpreter;

  private LibPython() {}

  /** Starts the interpreter with {@link LibPythonConfig#defaults()}. */
  public static Interpreter start() {
    return start(LibPythonConfig.defaults());
  }

  /**
   * Starts the interpreter, or returns the running one if it was started with the same
   * configuration.
   *
   * @throws LibPythonException If the library cannot be found, loaded or initialized.
   * @throws IllegalStateException If the interpreter already runs with another configuration.
   */
  public static synchronized Interpreter start(final LibPythonConfig config) {
    if (interpreter != null) {
      if (!config.equals(LibPython.config)) {
        throw new IllegalStateException("Python is already running with " + LibPython.config + ".");
      }
      return interpreter;
    }

    final PythonInstallation installation = PythonLocator.locate(config.executable());
    final Path path = installation.libraryPath();
    final SharedLibrary library = load(path);
    initialize(library, config);
    run(library, fixupScript(installation.executable(), config.searchPaths()));

    final Interpreter started = new Interpreter(new NativeCallTable(library, installation.libraryName()));
    LibPython.config = config;
    LibPython.interpreter = started;
    log.info("Started {} from {}", installation.libraryName(), path);
    return started;
  }

  private static SharedLibrary load(final Path path) {
    if (!Files.isRegularFile(path)) {
      throw new LibPythonException("No shared library at " + path + ". Was Python built with --enable-shared?");
    }
    if (Platform.get() == Platform.LINUX) {
      // C extension modules resolve the C API through the global symbol namespace.
      final long handle = DynamicLinkLoader.dlopen(
          path.toString(),
          DynamicLinkLoader.RTLD_LAZY | DynamicLinkLoader.RTLD_GLOBAL
      );
      if (handle == MemoryUtil.NULL) {
        throw new LibPythonException("Cannot load " + path + ": " + DynamicLinkLoader.dlerror());
      }
    }
    try {
      return Library.loadNative(LibPython.class, "constrictor", path.toString());
    } catch (final UnsatisfiedLinkError err) {
      throw new LibPythonException("Cannot load " + path + ".", err);
    }
  }

  private static void initialize(final SharedLibrary library, final LibPythonConfig config) {
    if (NativeFunction.bind(library, "Py_IsInitialized", INT).invokeInt() != 0) {
      log.debug("{} was already initialized by the host process", library.getName());
      return;
    }

    final NativeFunction decodeLocale =
        NativeFunction.bindOptional(library, "Py_DecodeLocale", POINTER, POINTER, POINTER);
    final NativeFunction setProgramName =
        NativeFunction.bindOptional(library, "Py_SetProgramName", VOID, POINTER);
    if (decodeLocale != null && setProgramName != null) {
      final ByteBuffer name = MemoryUtil.memUTF8(config.programName());
      try {
        // Python keeps the decoded name, so it is never freed.
        setProgramName.invoke(decodeLocale.invoke(MemoryUtil.memAddress(name), MemoryUtil.NULL));
      } finally {
        MemoryUtil.memFree(name);
      }
    } else {
      log.warn("{} cannot set the program name, sys.prefix may be wrong", library.getName());
    }

    log.debug("Initializing {}", library.getName());
    NativeFunction.bind(library, "Py_InitializeEx", VOID, INT).invoke(config.initializeSignals() ? 1 : 0);

    final NativeFunction initThreads = NativeFunction.bindOptional(library, "PyEval_InitThreads", VOID);
    if (initThreads != null) {
      initThreads.invoke();
    } else {
      log.debug("{} has no PyEval_InitThreads, the GIL is created on initialization", library.getName());
    }
  }

  private static void run(final SharedLibrary library, final String script) {
    final ByteBuffer encoded = MemoryUtil.memUTF8(script);
    try {
      final int status = NativeFunction.bind(library, "PyRun_SimpleString", INT, POINTER)
          .invokeInt(MemoryUtil.memAddress(encoded));
      if (status != 0) {
        throw new LibPythonException("Start-up script failed, see the traceback on stderr:\n" + script);
      }
    } finally {
      MemoryUtil.memFree(encoded);
    }
  }

  /** Makes the embedded interpreter look like one started from the command line. */
  static String fixupScript(final String executable, final List<String> searchPaths) {
    final StringBuilder script = new StringBuilder()
        .append("import sys\n")
        // Some modules expect at least one argument.
        .append("sys.argv = ['']\n")
        .append("sys.executable = ").append(literal(executable)).append('\n')
        .append("sys.path.insert(0, '')\n");
    for (int i = 0; i < searchPaths.size(); i++) {
      script.append("sys.path.insert(")
          .append(i + 1)
          .append(", ")
          .append(literal(searchPaths.get(i)))
          .append(")\n");
    }
    return script.toString();
  }

  static String literal(final String value) {
    return "'" + value
        .replace("\\", "\\\\")
        .replace("'", "\\'")
        .replace("\n", "\\n")
        + "'";
  }
}
