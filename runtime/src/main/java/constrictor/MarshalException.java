package constrictor;

/** Error when converting a JVM value to or from a Python object. */
public class MarshalException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public MarshalException(final String message) {
    super(message);
  }

  public MarshalException(final String message, final Exception cause) {
    super(message, cause);
  }
}
