package constrictor.libpython;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/** Where a Python interpreter and its shared library live. */
public final class PythonInstallation {

  private final String executable;
  private final String libraryDirectory;
  private final String libraryName;
  private final String ldLibrary;

  PythonInstallation(
      final String executable,
      final String libraryDirectory,
      final String libraryName,
      final String ldLibrary
  ) {
    this.executable = executable;
    this.libraryDirectory = libraryDirectory;
    this.libraryName = libraryName;
    this.ldLibrary = ldLibrary;
  }

  /**
   * Reads the output of {@link PythonLocator#QUERY}: executable, {@code LIBDIR},
   * {@code python{VERSION}{ABIFLAGS}} and {@code LDLIBRARY}, one per line.
   *
   * @throws LibPythonException If lines are missing.
   */
  static PythonInstallation parse(final List<String> lines) {
    if (lines.size() < 4) {
      throw new LibPythonException("Unexpected output of the sysconfig query: " + lines);
    }
    return new PythonInstallation(
        lines.get(0).trim(),
        lines.get(1).trim(),
        lines.get(2).trim(),
        lines.get(3).trim()
    );
  }

  /** Path of the interpreter, as {@code sys.executable} reports it. */
  public String executable() {
    return executable;
  }

  /** Library name without prefix or suffix, e.g. {@code python3.11}. */
  public String libraryName() {
    return libraryName;
  }

  /** Path of the shared library on the current platform. */
  public Path libraryPath() {
    return libraryPath(System.getProperty("os.name", ""));
  }

  Path libraryPath(final String osName) {
    final String os = osName.toLowerCase(Locale.ROOT);
    if (os.startsWith("windows")) {
      // python311.dll sits next to python.exe, and LIBDIR is not set.
      final Path directory = Paths.get(executable).toAbsolutePath().getParent();
      return directory.resolve(libraryName.replace(".", "") + ".dll");
    }
    final String suffix = os.startsWith("mac") ? ".dylib" : ".so";
    final Path directory = Paths.get(libraryDirectory);
    if (ldLibrary.contains(suffix)) {
      return directory.resolve(ldLibrary);
    }
    // Statically linked interpreters may still ship the shared library.
    return directory.resolve("lib" + libraryName + suffix);
  }

  @Override
  public String toString() {
    return String.format("%s (%s in %s)", executable, libraryName, libraryDirectory);
  }
}
