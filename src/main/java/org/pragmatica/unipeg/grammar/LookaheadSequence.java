package org.pragmatica.unipeg.grammar;

import org.pragmatica.unipeg.input.Input;
import org.pragmatica.unipeg.lazy.LazySequence;
import org.pragmatica.unipeg.result.Derivation;
import org.pragmatica.unipeg.result.Instance;

/**
 * Zero-width assertion. Only the first derivation of the probed expression is examined, and
 * bindings made while probing are undone before the assertion succeeds.
 */
final class LookaheadSequence extends LazySequence<Derivation> {
    private final Expression expression;
    private final Input<?> input;
    private final int position;
    private final boolean positive;
    private boolean done;

    LookaheadSequence(Expression expression, Input<?> input, int position, boolean positive) {
        this.expression = expression;
        this.input = input;
        this.position = position;
        this.positive = positive;
    }

    @Override
    protected Derivation produce() {
        if (done) {
            return endOfData();
        }
        done = true;
        boolean matched;
        try (var probe = expression.derive(input, position)) {
            matched = probe.hasNext();
        }
        return matched == positive
               ? Derivation.of(Instance.empty(), position)
               : endOfData();
    }
}
