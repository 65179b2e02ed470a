package constrictor.libpython;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Asks a Python interpreter where its shared library is. */
public final class PythonLocator {

  private static final Logger log = LoggerFactory.getLogger(PythonLocator.class);

  static final String QUERY = String.join("\n",
      "import sys, sysconfig",
      "print(sys.executable)",
      "print(sysconfig.get_config_var('LIBDIR'))",
      "print('python{}{}'.format(sysconfig.get_config_var('VERSION'),"
          + " sysconfig.get_config_var('ABIFLAGS') or ''))",
      "print(sysconfig.get_config_var('LDLIBRARY'))"
  );

  private static final long TIMEOUT_SECONDS = 30;

  private PythonLocator() {}

  /**
   * Runs {@code executable} with a sysconfig query script.
   *
   * @throws LibPythonException If the interpreter cannot be run or fails.
   */
  public static PythonInstallation locate(final String executable) {
    log.debug("Probing {}", executable);
    final Process process;
    try {
      process = new ProcessBuilder(executable, "-c", QUERY)
          .redirectErrorStream(true)
          .start();
    } catch (final IOException err) {
      throw new LibPythonException("Cannot run " + executable + ".", err);
    }

    final List<String> lines;
    try (BufferedReader reader = new BufferedReader(
        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
      lines = reader.lines().collect(Collectors.toList());
      if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new LibPythonException(executable + " did not answer the sysconfig query in time.");
      }
    } catch (final IOException err) {
      throw new LibPythonException("Cannot read the output of " + executable + ".", err);
    } catch (final InterruptedException err) {
      Thread.currentThread().interrupt();
      throw new LibPythonException("Interrupted while probing " + executable + ".", err);
    }

    if (process.exitValue() != 0) {
      throw new LibPythonException(String.format(
          "%s exited with %d: %s", executable, process.exitValue(), String.join("\n", lines)));
    }
    final PythonInstallation installation = PythonInstallation.parse(lines);
    log.debug("Found {}", installation);
    return installation;
  }
}
