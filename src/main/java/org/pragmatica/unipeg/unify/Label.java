package org.pragmatica.unipeg.unify;

import org.pragmatica.unipeg.lazy.LazySequence;
import org.pragmatica.unipeg.result.Instance;

/**
 * Tags any value with a name. Always succeeds exactly once.
 */
public record Label(String name) implements Unifiable {

    @Override
    public LazySequence<Object> unify(Object value) {
        return LazySequence.of(new Instance.Labeled(Instance.lift(value, Instance.NO_POSITION), name));
    }
}
