package org.pragmatica.unipeg.unify;

import org.pragmatica.unipeg.lazy.LazySequence;

import java.util.function.Predicate;

/**
 * Pattern that a parse result is piped through.
 *
 * <p>Unification yields zero or more (possibly transformed) values. Zero values reject the
 * enclosing derivation; more than one makes the pattern non-deterministic and every value is
 * tried in order. Unification may bind {@link Variable}s; such bindings last exactly as long as
 * the element of the returned sequence that made them.
 */
public interface Unifiable {

    LazySequence<Object> unify(Object value);

    /**
     * Pattern trying this one first, then {@code other}.
     */
    default Unifiable or(Unifiable other) {
        return new Either(this, other);
    }

    /**
     * Use a value as a pattern: patterns are kept, anything else is matched as a constant.
     */
    static Unifiable lift(Object value) {
        return value instanceof Unifiable pattern
               ? pattern
               : new Constant(value);
    }

    static Unifiable any() {
        return Any.INSTANCE;
    }

    static Unifiable nothing() {
        return Nothing.INSTANCE;
    }

    static Constant constant(Object value) {
        return new Constant(value);
    }

    static Label label(String name) {
        return new Label(name);
    }

    static Where where(Predicate<Object> predicate) {
        return new Where(predicate);
    }
}
