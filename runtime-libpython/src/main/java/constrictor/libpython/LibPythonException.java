package constrictor.libpython;

/** Failure to locate, load or initialize libpython. */
public class LibPythonException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public LibPythonException(final String message) {
    super(message);
  }

  public LibPythonException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
