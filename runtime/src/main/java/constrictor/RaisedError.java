package constrictor;

/** Contents of the error indicator, as handed out by {@link CallTable#fetchError()}. */
public final class RaisedError {

  /** Exception type, {@code 0} if no error was set. */
  public final long type;

  /** Exception value, possibly {@code 0} or not yet an instance of {@link #type}. */
  public final long value;

  /** Traceback, possibly {@code 0}. */
  public final long traceback;

  public RaisedError(final long type, final long value, final long traceback) {
    this.type = type;
    this.value = value;
    this.traceback = traceback;
  }

  public boolean isSet() {
    return type != 0;
  }
}
