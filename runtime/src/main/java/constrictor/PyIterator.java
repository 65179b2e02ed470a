package constrictor;

import io.reactivex.rxjava3.core.BackpressureStrategy;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.FlowableOnSubscribe;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A Python iterator.
 *
 * <p>Elements are fetched one at a time, when {@link #hasNext()} needs to know whether there is
 * one. The iterator cannot be restarted and gives back its own reference as soon as Python
 * reports the end.
 */
public final class PyIterator implements Iterator<PyObject>, AutoCloseable {

  private final Interpreter interpreter;
  private final Reference iterator;
  private @Nullable Reference next;
  private boolean exhausted = false;

  PyIterator(final Interpreter interpreter, final Reference iterator) {
    this.interpreter = interpreter;
    this.iterator = iterator;
  }

  /**
   * Checks if there are more elements.
   *
   * @throws PythonException If advancing the Python iterator raised an exception.
   */
  @Override
  public boolean hasNext() {
    if (next == null && !exhausted) {
      advance();
    }
    return next != null;
  }

  @Override
  public PyObject next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    final Reference current = next;
    next = null;
    return new PyObject(interpreter, current);
  }

  @Override
  public void close() {
    exhausted = true;
    if (next != null) {
      next.close();
      next = null;
    }
    iterator.close();
  }

  /**
   * Consumes this iterator into a {@link Flowable}. The iterator is closed when the
   * {@link Flowable} completes, fails or is cancelled.
   *
   * <p>Elements are produced on the subscribing thread.
   */
  public Flowable<PyObject> toRxJavaFlowable() {
    final FlowableOnSubscribe<PyObject> impl = emitter -> {
      try {
        while (!emitter.isCancelled() && hasNext()) {
          emitter.onNext(next());
        }
        emitter.onComplete();
      } catch (final PythonException err) {
        emitter.onError(err);
      }
    };
    return Flowable
        .create(impl, BackpressureStrategy.BUFFER)
        .doFinally(PyIterator.this::close);
  }

  private void advance() {
    final long item = interpreter.table().iterNext(iterator.handle());
    if (item != 0) {
      next = interpreter.references().receive(item);
      return;
    }

    exhausted = true;
    final PythonException error = interpreter.errors().fetch();
    iterator.close();
    if (error != null) {
      throw error;
    }
  }
}
