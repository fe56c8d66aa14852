package org.pragmatica.unipeg.unify;

import org.pragmatica.unipeg.lazy.LazySequence;
import org.pragmatica.unipeg.result.Instance;

import java.util.Objects;

/**
 * Logic variable: captures the first value it is unified with and from then on matches only
 * values that unify with the captured one.
 *
 * <p>A binding is made by one element of the sequence returned from {@link #unify(Object)} and
 * is undone exactly once, when that sequence moves past the element, is exhausted or is closed.
 * Abandoning the sequence (see {@link LazySequence#abandon()}) keeps the binding in place;
 * {@link #unbind()} clears it explicitly.
 *
 * <p>A variable may appear in many expressions, but only one parse may use it at a time.
 */
public final class Variable implements Unifiable {
    private final String name;
    private Object value;
    private boolean bound;

    private Variable(String name) {
        this.name = name;
    }

    public static Variable variable() {
        return new Variable("_");
    }

    public static Variable variable(String name) {
        return new Variable(name);
    }

    public String name() {
        return name;
    }

    public boolean isBound() {
        return bound;
    }

    /**
     * Captured value as bound, {@code null} when unbound.
     */
    public Object value() {
        return value;
    }

    /**
     * Captured value projected down to plain data, {@code null} when unbound.
     */
    public Object unpack() {
        return bound
               ? Instance.unpackValue(value)
               : null;
    }

    public void unbind() {
        value = null;
        bound = false;
    }

    private void bindTo(Object newValue) {
        value = newValue;
        bound = true;
    }

    @Override
    public LazySequence<Object> unify(Object input) {
        return new Binding(input);
    }

    private LazySequence<Object> unifyBound(Object input) {
        if (value instanceof Unifiable pattern) {
            return pattern.unify(input);
        }
        if (input instanceof Unifiable pattern) {
            return pattern.unify(value);
        }
        return Objects.equals(value, input)
               ? LazySequence.of(input)
               : LazySequence.empty();
    }

    @Override
    public String toString() {
        return bound
               ? "<" + name + " bound to " + value + ">"
               : "<" + name + " unbound>";
    }

    /**
     * Trail entry of one unification. Whether it binds or checks against the existing binding
     * is decided on the first pull.
     */
    private final class Binding extends LazySequence<Object> {
        private final Object input;
        private boolean started;
        private boolean owner;
        private LazySequence<Object> check;

        private Binding(Object input) {
            this.input = input;
        }

        @Override
        protected Object produce() {
            if (!started) {
                started = true;
                if (!bound) {
                    bindTo(input);
                    owner = true;
                    return input;
                }
                check = unifyBound(input);
            }
            if (owner) {
                undo();
                return endOfData();
            }
            return check.hasNext()
                   ? check.next()
                   : endOfData();
        }

        private void undo() {
            owner = false;
            unbind();
        }

        @Override
        protected void onRelease(Release mode) {
            if (owner) {
                if (mode == Release.CLOSE) {
                    undo();
                } else {
                    owner = false;
                }
            }
            if (check != null) {
                check.release(mode);
            }
        }
    }
}
