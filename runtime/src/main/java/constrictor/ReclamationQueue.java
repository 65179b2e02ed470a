package constrictor;

import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.LongConsumer;

/**
 * Handles whose owners became unreachable but whose reference counts have not been decremented
 * yet.
 *
 * <p>Any thread may enqueue, typically the {@link java.lang.ref.Cleaner} thread. Draining
 * happens on a thread that is allowed to call into Python and stops as soon as the queue is
 * observed empty.
 */
final class ReclamationQueue {

  private final ConcurrentLinkedQueue<Long> handles = new ConcurrentLinkedQueue<>();

  void enqueue(final long handle) {
    handles.add(handle);
  }

  /**
   * Polls handles until the queue is empty, passing each one to {@code release}.
   *
   * @return Number of handles released.
   */
  int drain(final LongConsumer release) {
    int drained = 0;
    for (Long handle = handles.poll(); handle != null; handle = handles.poll()) {
      release.accept(handle);
      drained++;
    }
    return drained;
  }

  int size() {
    return handles.size();
  }
}
