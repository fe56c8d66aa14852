package org.pragmatica.unipeg.lazy;

import java.util.function.Function;

/**
 * Depth-first expansion: the inner sequence of an element is drained (and thereby releases its
 * own bindings) before the outer sequence is resumed.
 */
final class FlatMappedSequence<T, R> extends LazySequence<R> {
    private final LazySequence<T> outer;
    private final Function<? super T, ? extends LazySequence<? extends R>> expander;
    private LazySequence<? extends R> inner;

    FlatMappedSequence(LazySequence<T> outer, Function<? super T, ? extends LazySequence<? extends R>> expander) {
        this.outer = outer;
        this.expander = expander;
    }

    @Override
    protected R produce() {
        while (true) {
            if (inner != null) {
                if (inner.hasNext()) {
                    return inner.next();
                }
                inner.close();
                inner = null;
            }
            if (!outer.hasNext()) {
                return endOfData();
            }
            inner = expander.apply(outer.next());
        }
    }

    @Override
    protected void onRelease(Release mode) {
        if (inner != null) {
            inner.release(mode);
            inner = null;
        }
        outer.release(mode);
    }
}
