package org.pragmatica.unipeg.unify;

import org.pragmatica.unipeg.lazy.LazySequence;
import org.pragmatica.unipeg.result.Instance;

import java.util.function.Predicate;

/**
 * Accepts values whose unpacked form satisfies a predicate.
 */
public record Where(Predicate<Object> predicate) implements Unifiable {

    @Override
    public LazySequence<Object> unify(Object value) {
        return predicate.test(Instance.unpackValue(value))
               ? LazySequence.of(value)
               : LazySequence.empty();
    }
}
