package org.pragmatica.unipeg.lazy;

import java.util.function.Function;

final class MappedSequence<T, R> extends LazySequence<R> {
    private final LazySequence<T> source;
    private final Function<? super T, ? extends R> mapper;

    MappedSequence(LazySequence<T> source, Function<? super T, ? extends R> mapper) {
        this.source = source;
        this.mapper = mapper;
    }

    @Override
    protected R produce() {
        return source.hasNext()
               ? mapper.apply(source.next())
               : endOfData();
    }

    @Override
    protected void onRelease(Release mode) {
        source.release(mode);
    }
}
