package constrictor;

import java.lang.ref.Cleaner;
import java.util.concurrent.atomic.AtomicLong;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw {@code PyObject*} handles into {@link Reference}s.
 *
 * <p>The C API hands out objects under two conventions. A <em>new</em> reference already carries
 * a count for the caller and is taken with {@link #receive(long)}. A <em>borrowed</em> reference
 * does not, so {@link #borrow(long)} adds one. Which one applies is a property of the entry point
 * and is documented on {@link CallTable}.
 *
 * <p>Counts of references that were garbage collected without being closed are given back at the
 * start of the next acquisition, on the acquiring thread.
 */
public final class ReferenceManager {

  private static final Logger log = LoggerFactory.getLogger(ReferenceManager.class);

  private final CallTable table;
  private final Cleaner cleaner;
  private final ReclamationQueue queue = new ReclamationQueue();
  private final AtomicLong live = new AtomicLong();

  public ReferenceManager(final CallTable table) {
    this(table, Cleaner.create());
  }

  ReferenceManager(final CallTable table, final Cleaner cleaner) {
    this.table = table;
    this.cleaner = cleaner;
  }

  /**
   * Takes a borrowed reference, incrementing its count.
   *
   * @return {@code null} if {@code handle} is {@code NULL}.
   */
  @Nullable
  public Reference borrow(final long handle) {
    reclaim();
    if (handle == 0) {
      return null;
    }
    table.incRef(handle);
    return track(handle);
  }

  /**
   * Takes a new reference whose count the caller already owns.
   *
   * @return {@code null} if {@code handle} is {@code NULL}.
   */
  @Nullable
  public Reference receive(final long handle) {
    reclaim();
    if (handle == 0) {
      return null;
    }
    return track(handle);
  }

  /**
   * Decrements the count of every handle queued by the garbage collector so far.
   *
   * @return Number of handles released.
   */
  public int reclaim() {
    final int released = queue.drain(this::decrement);
    if (released > 0) {
      log.debug("Reclaimed {} unreachable references, {} still live", released, live.get());
    }
    return released;
  }

  /** Number of references taken and not yet given back to Python. */
  public long liveReferences() {
    return live.get();
  }

  /** Number of handles waiting for the next {@link #reclaim()}. */
  public int pendingReclamations() {
    return queue.size();
  }

  ReclamationQueue queue() {
    return queue;
  }

  void decrement(final long handle) {
    table.decRef(handle);
    live.decrementAndGet();
  }

  private Reference track(final long handle) {
    live.incrementAndGet();
    return new Reference(handle, this, cleaner);
  }
}
