package constrictor;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ReclamationQueueTests {

  @Test
  void drainsEveryHandleExactlyOnceUnderConcurrentEnqueue() throws Exception {
    final ReclamationQueue queue = new ReclamationQueue();
    final int producerThreads = 4;
    final int perProducer = 5_000;
    final int total = producerThreads * perProducer;

    final ExecutorService pool = Executors.newFixedThreadPool(producerThreads);
    final CountDownLatch start = new CountDownLatch(1);
    final Map<Long, Boolean> seen = new ConcurrentHashMap<>();
    final AtomicInteger drained = new AtomicInteger();
    try {
      final Future<?>[] producers = new Future<?>[producerThreads];
      for (int p = 0; p < producerThreads; p++) {
        final long base = (long) p * perProducer;
        producers[p] = pool.submit(() -> {
          start.await();
          for (long i = 0; i < perProducer; i++) {
            queue.enqueue(base + i);
          }
          return null;
        });
      }

      start.countDown();
      while (drained.get() < total) {
        drained.addAndGet(queue.drain(handle -> {
          if (seen.putIfAbsent(handle, Boolean.TRUE) != null) {
            throw new IllegalStateException("Handle drained twice: " + handle);
          }
        }));
      }
      for (final Future<?> producer : producers) {
        producer.get(20, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    Assertions.assertEquals(total, seen.size());
    Assertions.assertEquals(0, queue.size());
    Assertions.assertEquals(0, queue.drain(handle -> Assertions.fail("Queue should be empty")));
  }
}
