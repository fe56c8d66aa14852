package org.pragmatica.unipeg.grammar;

import org.pragmatica.unipeg.input.Input;
import org.pragmatica.unipeg.lazy.LazySequence;
import org.pragmatica.unipeg.result.Derivation;
import org.pragmatica.unipeg.result.Instance;

/**
 * Deterministic repetition. Each step keeps the first derivation and abandons the rest of its
 * enumeration, so grammar call history is released but variable bindings of the kept
 * derivation stay in place.
 */
final class GreedyRepeatSequence extends LazySequence<Derivation> {
    private final Expression expression;
    private final boolean requireOne;
    private final Input<?> input;
    private final int position;
    private boolean done;

    GreedyRepeatSequence(Expression expression, boolean requireOne, Input<?> input, int position) {
        this.expression = expression;
        this.requireOne = requireOne;
        this.input = input;
        this.position = position;
    }

    @Override
    protected Derivation produce() {
        if (done) {
            return endOfData();
        }
        done = true;

        var result = Instance.empty();
        var current = position;
        var steps = 0;

        while (true) {
            var step = expression.derive(input, current);
            Derivation derivation;
            try {
                if (!step.hasNext()) {
                    step.close();
                    break;
                }
                derivation = step.next();
            } catch (RuntimeException e) {
                step.close();
                throw e;
            }
            step.abandon();

            result = Instance.combine(result, derivation.result());
            steps++;

            // A step that consumed nothing would match forever
            if (derivation.next() == current) {
                break;
            }
            current = derivation.next();
        }

        if (requireOne && steps == 0) {
            return endOfData();
        }
        return Derivation.of(result, current);
    }
}
