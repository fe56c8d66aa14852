package org.pragmatica.unipeg.lazy;

import java.util.function.Supplier;

final class DeferredSequence<T> extends LazySequence<T> {
    private final Supplier<? extends LazySequence<? extends T>> supplier;
    private LazySequence<? extends T> source;

    DeferredSequence(Supplier<? extends LazySequence<? extends T>> supplier) {
        this.supplier = supplier;
    }

    @Override
    protected T produce() {
        if (source == null) {
            source = supplier.get();
        }
        return source.hasNext()
               ? source.next()
               : endOfData();
    }

    @Override
    protected void onRelease(Release mode) {
        if (source != null) {
            source.release(mode);
        }
    }
}
