package org.pragmatica.unipeg.lazy;

final class SingletonSequence<T> extends LazySequence<T> {
    private final T value;
    private boolean produced;

    SingletonSequence(T value) {
        this.value = value;
    }

    @Override
    protected T produce() {
        if (produced) {
            return endOfData();
        }
        produced = true;
        return value;
    }
}
