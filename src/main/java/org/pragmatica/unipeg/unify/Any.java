package org.pragmatica.unipeg.unify;

import org.pragmatica.unipeg.lazy.LazySequence;

/**
 * Accepts every value unchanged.
 */
public enum Any implements Unifiable {
    INSTANCE;

    @Override
    public LazySequence<Object> unify(Object value) {
        return LazySequence.of(value);
    }
}
