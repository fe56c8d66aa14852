package org.pragmatica.unipeg.unify;

import org.pragmatica.unipeg.lazy.LazySequence;

/**
 * Rejects every value.
 */
public enum Nothing implements Unifiable {
    INSTANCE;

    @Override
    public LazySequence<Object> unify(Object value) {
        return LazySequence.empty();
    }
}
