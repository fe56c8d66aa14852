package org.pragmatica.unipeg.lazy;

import java.util.Iterator;

final class IterableSequence<T> extends LazySequence<T> {
    private final Iterator<? extends T> source;

    IterableSequence(Iterable<? extends T> values) {
        this.source = values.iterator();
    }

    @Override
    protected T produce() {
        return source.hasNext()
               ? source.next()
               : endOfData();
    }
}
