package org.pragmatica.unipeg.lazy;

import java.util.function.Supplier;

final class ConcatSequence<T> extends LazySequence<T> {
    private final LazySequence<? extends T> first;
    private final Supplier<? extends LazySequence<? extends T>> secondSupplier;
    private LazySequence<? extends T> second;

    ConcatSequence(LazySequence<? extends T> first, Supplier<? extends LazySequence<? extends T>> secondSupplier) {
        this.first = first;
        this.secondSupplier = secondSupplier;
    }

    @Override
    protected T produce() {
        if (second == null) {
            if (first.hasNext()) {
                return first.next();
            }
            first.close();
            second = secondSupplier.get();
        }
        return second.hasNext()
               ? second.next()
               : endOfData();
    }

    @Override
    protected void onRelease(Release mode) {
        first.release(mode);
        if (second != null) {
            second.release(mode);
        }
    }
}
