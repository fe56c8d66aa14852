package org.pragmatica.unipeg.unify;

import org.pragmatica.unipeg.lazy.LazySequence;

/**
 * Disjunctive pattern: everything {@code one} yields, then everything {@code other} yields.
 */
public record Either(Unifiable one, Unifiable other) implements Unifiable {

    @Override
    public LazySequence<Object> unify(Object value) {
        return one.unify(value)
                  .concat(() -> other.unify(value));
    }
}
