package io.seqwarehouse.core.tabular;

import io.seqwarehouse.core.model.RawRow;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/** Adapts row iterators backed by an open file into closeable streams. */
final class RowStreams {

    private RowStreams() {}

    /**
     * Wraps a row iterator in a sequential stream that closes {@code resource} when the stream is
     * closed.
     */
    static Stream<RawRow> of(Iterator<RawRow> rows, Closeable resource) {
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(rows, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(() -> {
                    try {
                        resource.close();
                    } catch (IOException e) {
                        throw new UncheckedIOException("Failed to close source", e);
                    }
                });
    }

    /**
     * Iterator that computes rows on demand. {@link #computeNext()} returns {@code null} once the
     * source is exhausted.
     */
    abstract static class LazyIterator implements Iterator<RawRow> {

        private RawRow next;
        private boolean done;

        protected abstract RawRow computeNext();

        @Override
        public final boolean hasNext() {
            if (next == null && !done) {
                next = computeNext();
                done = next == null;
            }
            return next != null;
        }

        @Override
        public final RawRow next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            RawRow row = next;
            next = null;
            return row;
        }
    }
}
