package org.pragmatica.unipeg.unify;

import org.pragmatica.unipeg.lazy.LazySequence;
import org.pragmatica.unipeg.result.Instance;

import java.util.Objects;

/**
 * Matches values equal to a constant, either directly or once unpacked, and yields the constant.
 */
public record Constant(Object value) implements Unifiable {

    @Override
    public LazySequence<Object> unify(Object input) {
        return matches(input)
               ? LazySequence.of(value)
               : LazySequence.empty();
    }

    private boolean matches(Object input) {
        return Objects.equals(value, input) || Objects.equals(value, Instance.unpackValue(input));
    }

    public Object unpack() {
        return Instance.unpackValue(value);
    }

    @Override
    public String toString() {
        return "Constant(" + value + ")";
    }
}
