package org.pragmatica.unipeg.grammar;

import org.pragmatica.unipeg.input.Input;
import org.pragmatica.unipeg.lazy.LazySequence;
import org.pragmatica.unipeg.result.Derivation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazy reference to a grammar rule. The rule is looked up when the reference is derived, so
 * rules may refer to each other regardless of definition order.
 *
 * <p>References compare by identity: the recursion guard of the grammar tells apart two
 * references to the same symbol.
 */
public final class Reference implements Expression {
    private static final Logger log = LoggerFactory.getLogger(Reference.class);

    private final Grammar grammar;
    private final String symbol;

    Reference(Grammar grammar, String symbol) {
        this.grammar = grammar;
        this.symbol = symbol;
    }

    public Grammar grammar() {
        return grammar;
    }

    public String symbol() {
        return symbol;
    }

    @Override
    public LazySequence<Derivation> derive(Input<?> input, int position) {
        return new RuleInvocation(input, position);
    }

    @Override
    public String toString() {
        return "Reference(" + symbol + ")";
    }

    /**
     * One invocation of the referenced rule. Occupies a grammar call-history entry from the
     * first pull until it is exhausted or released.
     */
    private final class RuleInvocation extends LazySequence<Derivation> {
        private final Input<?> input;
        private final int position;
        private boolean started;
        private Grammar.Call call;
        private LazySequence<Derivation> body;

        private RuleInvocation(Input<?> input, int position) {
            this.input = input;
            this.position = position;
        }

        @Override
        protected Derivation produce() {
            if (!started) {
                started = true;
                if (grammar.isReentered(Reference.this, position)) {
                    log.warn("Instantiation of rule '{}' at position {} may be infinite, backtracking", symbol, position);
                    return endOfData();
                }
                var rule = grammar.rule(symbol);
                call = grammar.enter(Reference.this, position);
                body = rule.derive(input, position);
            }
            if (body != null && body.hasNext()) {
                return body.next();
            }
            leave();
            return endOfData();
        }

        @Override
        protected void onRelease(Release mode) {
            if (body != null) {
                body.release(mode);
            }
            leave();
        }

        private void leave() {
            if (call != null) {
                grammar.exit(call);
                call = null;
            }
        }
    }
}
