package constrictor;

import java.lang.ref.Cleaner;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One owned reference count on a Python object.
 *
 * <p>The count is given back exactly once: synchronously by {@link #close()}, or, if the
 * reference becomes unreachable first, by queueing the handle for the next
 * {@link ReferenceManager#reclaim()}.
 */
public final class Reference implements AutoCloseable {

  private final long handle;
  private final ReferenceManager manager;
  private final Release release;
  private final Cleaner.Cleanable cleanable;

  Reference(final long handle, final ReferenceManager manager, final Cleaner cleaner) {
    this.handle = handle;
    this.manager = manager;
    this.release = new Release(handle, manager.queue());
    this.cleanable = cleaner.register(this, release);
  }

  /** The {@code PyObject*} this reference owns a count on. */
  public long handle() {
    assertAlive();
    return handle;
  }

  public boolean alive() {
    return !release.released.get();
  }

  @Override
  public void close() {
    if (release.claim()) {
      manager.decrement(handle);
    }
    cleanable.clean();
  }

  /**
   * Checks if the count is still held. This method should be used before every use of the
   * handle.
   *
   * @throws AssertionError If the reference is closed.
   */
  void assertAlive() {
    assert alive() : "Attempt of use after free.";
  }

  @Override
  public String toString() {
    return String.format("Reference[0x%x%s]", handle, alive() ? "" : ", closed");
  }

  /**
   * Cleaning action. Must not refer to the {@link Reference} itself, otherwise the reference
   * never becomes phantom reachable.
   */
  private static final class Release implements Runnable {

    private final long handle;
    private final ReclamationQueue queue;
    private final AtomicBoolean released = new AtomicBoolean();

    Release(final long handle, final ReclamationQueue queue) {
      this.handle = handle;
      this.queue = queue;
    }

    boolean claim() {
      return released.compareAndSet(false, true);
    }

    @Override
    public void run() {
      if (claim()) {
        queue.enqueue(handle);
      }
    }
  }
}
