package constrictor;

/**
 * An arithmetic progression of integers, exported to Python as a {@code slice}.
 *
 * <p>An inclusive range is turned into Python's half-open form by moving the end one step
 * further. If that would cross the start of a sequence or leave the range of {@code long}, the
 * slice is left without a stop bound.
 */
public final class IntRange {

  private final long start;
  private final long end;
  private final long step;
  private final boolean inclusive;

  private IntRange(final long start, final long end, final long step, final boolean inclusive) {
    if (step == 0) {
      throw new IllegalArgumentException("Step must not be zero.");
    }
    this.start = start;
    this.end = end;
    this.step = step;
    this.inclusive = inclusive;
  }

  /** {@code start} up to but excluding {@code end}. */
  public static IntRange until(final long start, final long end) {
    return new IntRange(start, end, 1, false);
  }

  /** {@code start} up to and including {@code end}. */
  public static IntRange to(final long start, final long end) {
    return new IntRange(start, end, 1, true);
  }

  /** Same bounds with a different step. */
  public IntRange by(final long step) {
    return new IntRange(start, end, step, inclusive);
  }

  public long start() {
    return start;
  }

  public long end() {
    return end;
  }

  public long step() {
    return step;
  }

  public boolean inclusive() {
    return inclusive;
  }

  /** Whether the exported slice has a stop bound at all. */
  boolean bounded() {
    if (!inclusive) {
      return true;
    }
    return step > 0
        ? end != -1 && end != Long.MAX_VALUE
        : end != 0 && end != Long.MIN_VALUE;
  }

  /** The exclusive stop bound of the exported slice. Only meaningful if {@link #bounded()}. */
  long stop() {
    if (!inclusive) {
      return end;
    }
    return step > 0 ? end + 1 : end - 1;
  }

  @Override
  public String toString() {
    return String.format("%d %s %d by %d", start, inclusive ? "to" : "until", end, step);
  }
}
