package org.pragmatica.unipeg.lazy;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Pull-based lazy sequence of candidates produced by a backtracking search.
 *
 * <p>Each call to {@link #hasNext()} resumes the search up to the next candidate. A sequence
 * owns whatever the search has acquired along the way (variable bindings, grammar call-history
 * entries) and gives it back exactly once: when it is exhausted, when it is {@linkplain #close()
 * closed} or when it is {@linkplain #abandon() abandoned}. Consumers that stop pulling early must
 * close the sequence, preferably with try-with-resources:
 *
 * <pre>{@code
 * try (var derivations = expression.derive(Input.of("ab"), 0)) {
 *     if (derivations.hasNext()) {
 *         use(derivations.next());
 *     }
 * }
 * }</pre>
 *
 * <p>Sequences are single-threaded and single-use.
 */
public abstract class LazySequence<T> extends AbstractIterator<T> implements AutoCloseable {

    /**
     * How a sequence gives back what it acquired.
     */
    public enum Release {
        /**
         * Undo everything: unbind variables and drop grammar call-history entries.
         */
        CLOSE,
        /**
         * Drop grammar call-history entries but leave variables bound.
         */
        ABANDON
    }

    private boolean released;

    @Override
    protected final T computeNext() {
        return released ? endOfData() : produce();
    }

    /**
     * Produce the next element, or return {@link #endOfData()} when there are no more.
     * Implementations give back their resources themselves before signalling the end.
     */
    protected abstract T produce();

    /**
     * Hook invoked once, on the first {@link #release(Release)} call.
     */
    protected void onRelease(Release mode) {}

    /**
     * Stop the enumeration and undo every binding made by it.
     */
    @Override
    public final void close() {
        release(Release.CLOSE);
    }

    /**
     * Stop the enumeration, keeping variable bindings made by the current element.
     */
    public final void abandon() {
        release(Release.ABANDON);
    }

    public final void release(Release mode) {
        if (!released) {
            released = true;
            onRelease(mode);
        }
    }

    public final boolean isReleased() {
        return released;
    }

    // === Combinators ===

    public <R> LazySequence<R> map(Function<? super T, ? extends R> mapper) {
        return new MappedSequence<>(this, mapper);
    }

    /**
     * For each element, enumerate the sequence produced by {@code expander} from it. The element
     * stays current (its bindings stay in place) until the expanded sequence is exhausted.
     */
    public <R> LazySequence<R> flatMap(Function<? super T, ? extends LazySequence<? extends R>> expander) {
        return new FlatMappedSequence<>(this, expander);
    }

    /**
     * All elements of this sequence, then all elements of the one supplied. The second sequence
     * is not created until this one is exhausted.
     */
    public LazySequence<T> concat(Supplier<? extends LazySequence<? extends T>> next) {
        return new ConcatSequence<>(this, next);
    }

    public LazySequence<T> filter(Predicate<? super T> predicate) {
        return new FilteredSequence<>(this, predicate);
    }

    // === Terminal operations ===

    /**
     * Take the first element, if any, and close the sequence.
     */
    public Optional<T> first() {
        try {
            return hasNext()
                   ? Optional.ofNullable(next())
                   : Optional.empty();
        } finally {
            close();
        }
    }

    /**
     * Drain the sequence. Bindings of individual elements are undone by the time this returns.
     */
    public List<T> toList() {
        var result = new ArrayList<T>();
        try {
            while (hasNext()) {
                result.add(next());
            }
        } finally {
            close();
        }
        return result;
    }

    // === Factories ===

    public static <T> LazySequence<T> empty() {
        return new IterableSequence<>(ImmutableList.<T>of());
    }

    public static <T> LazySequence<T> of(T value) {
        return new SingletonSequence<>(value);
    }

    public static <T> LazySequence<T> fromIterable(Iterable<? extends T> values) {
        return new IterableSequence<>(values);
    }

    /**
     * Sequence whose source is created on first pull.
     */
    public static <T> LazySequence<T> defer(Supplier<? extends LazySequence<? extends T>> source) {
        return new DeferredSequence<>(source);
    }
}
