package com.openforge.searchmate.llm;

import java.util.Collections;
import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Helpers for incremental answers, which are plain {@code Stream<String>}s:
 * ordered, lazy, single-use, and closeable.
 *
 * Streams built here never look ahead. The supplier behind a deferred stream
 * runs on the first pull, not when the stream is created, and only the
 * fragment being asked for is produced.
 */
public final class Fragments {

    private Fragments() {
    }

    /** A complete text re-wrapped as a one-fragment stream. */
    public static Stream<String> single(String text) {
        return Stream.of(text == null ? "" : text);
    }

    /**
     * A stream whose content is produced by {@code supplier} on first pull.
     * Closing it closes the supplied stream, if one was ever opened.
     */
    public static Stream<String> deferred(Supplier<Stream<String>> supplier) {
        DeferredIterator iterator = new DeferredIterator(supplier);
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(iterator::close);
    }

    /** {@code first}, then the deferred content of {@code rest}. */
    public static Stream<String> prefixed(String first, Supplier<Stream<String>> rest) {
        return Stream.concat(Stream.of(first), deferred(rest));
    }

    /**
     * {@code source} unchanged, except that a failure raised while pulling a
     * fragment is first handed to {@code onFailure} and then rethrown.
     */
    public static Stream<String> observed(Stream<String> source, Consumer<RuntimeException> onFailure) {
        Iterator<String> delegate = source.iterator();
        Iterator<String> iterator = new Iterator<>() {
            @Override
            public boolean hasNext() {
                try {
                    return delegate.hasNext();
                } catch (RuntimeException e) {
                    onFailure.accept(e);
                    throw e;
                }
            }

            @Override
            public String next() {
                try {
                    return delegate.next();
                } catch (RuntimeException e) {
                    onFailure.accept(e);
                    throw e;
                }
            }
        };
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(source::close);
    }

    private static final class DeferredIterator implements Iterator<String> {

        private final Supplier<Stream<String>> supplier;
        private boolean          opened;
        private Stream<String>   delegate;
        private Iterator<String> iterator = Collections.emptyIterator();

        private DeferredIterator(Supplier<Stream<String>> supplier) {
            this.supplier = supplier;
        }

        @Override
        public boolean hasNext() {
            return open().hasNext();
        }

        @Override
        public String next() {
            return open().next();
        }

        private Iterator<String> open() {
            if (!opened) {
                opened = true;
                delegate = supplier.get();
                if (delegate != null) {
                    iterator = delegate.iterator();
                }
            }
            return iterator;
        }

        private void close() {
            if (delegate != null) {
                delegate.close();
            }
        }
    }
}
