package org.pragmatica.unipeg.lazy;

import java.util.function.Predicate;

final class FilteredSequence<T> extends LazySequence<T> {
    private final LazySequence<T> source;
    private final Predicate<? super T> predicate;

    FilteredSequence(LazySequence<T> source, Predicate<? super T> predicate) {
        this.source = source;
        this.predicate = predicate;
    }

    @Override
    protected T produce() {
        while (source.hasNext()) {
            var candidate = source.next();
            if (predicate.test(candidate)) {
                return candidate;
            }
        }
        return endOfData();
    }

    @Override
    protected void onRelease(Release mode) {
        source.release(mode);
    }
}
