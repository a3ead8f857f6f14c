package io.intellixity.ignitekv.store;

import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

public interface CloseableIterator<T> extends Iterator<T>, AutoCloseable {
  @Override
  void close();

  /** Ordered stream over the remaining elements; closing the stream closes this iterator. */
  default Stream<T> stream() {
    return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
        .onClose(this::close);
  }

  static <T> CloseableIterator<T> wrap(Iterator<T> iterator) {
    return new CloseableIterator<>() {
      private boolean closed;

      @Override public boolean hasNext() { return !closed && iterator.hasNext(); }

      @Override
      public T next() {
        if (closed) throw new java.util.NoSuchElementException("iterator closed");
        return iterator.next();
      }

      @Override public void close() { closed = true; }
    };
  }
}
