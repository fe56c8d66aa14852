package org.pragmatica.unipeg.grammar;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import org.pragmatica.unipeg.input.Cursor;
import org.pragmatica.unipeg.input.Input;
import org.pragmatica.unipeg.lazy.LazySequence;
import org.pragmatica.unipeg.result.Derivation;
import org.pragmatica.unipeg.result.Instance;
import org.pragmatica.unipeg.unify.Label;
import org.pragmatica.unipeg.unify.Unifiable;

import java.util.function.Function;

/**
 * Parsing expression - a node of the combinator algebra.
 *
 * <p>Expressions are immutable. Deriving an expression at a position lazily enumerates every way
 * it matches from there, depth first and in a fixed order. Failure to match is an empty
 * sequence, never an exception.
 *
 * <p>Expressions form a monad: {@link Return} is the unit, {@link Bind} the bind,
 * {@link Alternative} the addition and {@link Zero} its identity.
 */
public sealed interface Expression permits Expression.Return, Expression.Zero, Expression.Element, Expression.Item,
    Expression.OneOf, Expression.Chain, Expression.Alternative, Expression.Bind, Expression.Unify, Expression.Ahead, Expression.Not,
    Expression.Locate, Expression.GreedyRepeat, Expression.BacktrackingRepeat, Expression.EndOfInput, Reference,
    Grammar {

    /**
     * Enumerate the derivations of this expression over {@code input} starting at {@code position}.
     */
    LazySequence<Derivation> derive(Input<?> input, int position);

    default LazySequence<Derivation> derive(Cursor cursor) {
        return derive(cursor.input(), cursor.position());
    }

    // === Composition ===

    /**
     * This expression followed by {@code next}; results are combined into one flat sequence.
     */
    default Expression then(Expression next) {
        return new Chain(this, next);
    }

    /**
     * Every derivation of this expression, then every derivation of {@code other}.
     */
    default Expression or(Expression other) {
        return new Alternative(this, other);
    }

    /**
     * Pipe each result through a pattern.
     */
    default Expression unify(Unifiable pattern) {
        return new Unify(this, pattern);
    }

    /**
     * Unify the position this expression starts matching at with a pattern.
     */
    default Expression locate(Unifiable pattern) {
        return new Locate(this, pattern);
    }

    default Expression bind(Function<? super Instance, ? extends Expression> continuation) {
        return new Bind(this, continuation);
    }

    default Expression label(String name) {
        return unify(new Label(name));
    }

    // === Monad ===

    /**
     * Matches without consuming input, yielding the value.
     */
    record Return(Object value) implements Expression {
        @Override
        public LazySequence<Derivation> derive(Input<?> input, int position) {
            return LazySequence.of(Derivation.of(Instance.lift(value, position), position));
        }
    }

    /**
     * Never matches.
     */
    record Zero() implements Expression {
        @Override
        public LazySequence<Derivation> derive(Input<?> input, int position) {
            return LazySequence.empty();
        }
    }

    /**
     * Monadic bind: for each derivation of {@code expression}, the derivations of the expression
     * the continuation builds from its result.
     */
    record Bind(Expression expression, Function<? super Instance, ? extends Expression> continuation) implements Expression {
        @Override
        public LazySequence<Derivation> derive(Input<?> input, int position) {
            return expression.derive(input, position)
                             .flatMap(first -> continuation.apply(first.result())
                                                           .derive(input, first.next()));
        }
    }

    /**
     * Monadic addition: all derivations of {@code one}, then all of {@code other}, from the same position.
     */
    record Alternative(Expression one, Expression other) implements Expression {
        @Override
        public LazySequence<Derivation> derive(Input<?> input, int position) {
            return one.derive(input, position)
                      .concat(() -> other.derive(input, position));
        }
    }

    // === Terminals ===

    /**
     * Consumes any single element.
     */
    record Element() implements Expression {
        @Override
        public LazySequence<Derivation> derive(Input<?> input, int position) {
            return position < input.length()
                   ? LazySequence.of(Derivation.of(new Instance.Item(input.at(position), position), position + 1))
                   : LazySequence.empty();
        }
    }

    /**
     * Consumes a single element that unifies with the pattern, once per unification result.
     */
    record Item(Unifiable pattern) implements Expression {
        @Override
        public LazySequence<Derivation> derive(Input<?> input, int position) {
            if (position >= input.length()) {
                return LazySequence.empty();
            }
            return pattern.unify(input.at(position))
                          .map(value -> Derivation.of(Instance.lift(value, position), position + 1));
        }
    }

    /**
     * Consumes a single element contained in a set of choices. Choice sets combine by set
     * arithmetic.
     */
    record OneOf(ImmutableSet<Object> choices) implements Expression {
        public static OneOf of(Iterable<?> choices) {
            return new OneOf(ImmutableSet.<Object>copyOf(choices));
        }

        public OneOf union(OneOf other) {
            return new OneOf(Sets.union(choices, other.choices()).immutableCopy());
        }

        public OneOf intersection(OneOf other) {
            return new OneOf(Sets.intersection(choices, other.choices()).immutableCopy());
        }

        public OneOf symmetricDifference(OneOf other) {
            return new OneOf(Sets.symmetricDifference(choices, other.choices()).immutableCopy());
        }

        public OneOf difference(OneOf other) {
            return new OneOf(Sets.difference(choices, other.choices()).immutableCopy());
        }

        @Override
        public LazySequence<Derivation> derive(Input<?> input, int position) {
            return position < input.length() && choices.contains(input.at(position))
                   ? LazySequence.of(Derivation.of(new Instance.Item(input.at(position), position), position + 1))
                   : LazySequence.empty();
        }
    }

    /**
     * Matches at the end of input only.
     */
    record EndOfInput() implements Expression {
        @Override
        public LazySequence<Derivation> derive(Input<?> input, int position) {
            return position == input.length()
                   ? LazySequence.of(Derivation.of(new Instance.End(position), position))
                   : LazySequence.empty();
        }
    }

    // === Combinators ===

    /**
     * Sequencing: {@code right} is derived from where each derivation of {@code left} ends.
     */
    record Chain(Expression left, Expression right) implements Expression {
        @Override
        public LazySequence<Derivation> derive(Input<?> input, int position) {
            return left.derive(input, position)
                       .flatMap(first -> right.derive(input, first.next())
                                              .map(second -> Derivation.of(Instance.combine(first.result(),
                                                                                            second.result()),
                                                                           second.next())));
        }
    }

    /**
     * Pipes each result of {@code expression} through {@code pattern}. Values the pattern yields
     * that are not results themselves become items at the starting position.
     */
    record Unify(Expression expression, Unifiable pattern) implements Expression {
        @Override
        public LazySequence<Derivation> derive(Input<?> input, int position) {
            return expression.derive(input, position)
                             .flatMap(derivation -> pattern.unify(derivation.result())
                                                           .map(value -> Derivation.of(Instance.lift(value, position),
                                                                                       derivation.next())));
        }
    }

    /**
     * Keeps the derivations of {@code expression} for which the starting position unifies with
     * {@code pattern}.
     */
    record Locate(Expression expression, Unifiable pattern) implements Expression {
        @Override
        public LazySequence<Derivation> derive(Input<?> input, int position) {
            return expression.derive(input, position)
                             .flatMap(derivation -> pattern.unify(position)
                                                           .map(ignored -> derivation));
        }
    }

    // === Predicates ===

    /**
     * Positive lookahead: succeeds with an empty result, consuming nothing, if {@code expression}
     * has a derivation here.
     */
    record Ahead(Expression expression) implements Expression {
        @Override
        public LazySequence<Derivation> derive(Input<?> input, int position) {
            return new LookaheadSequence(expression, input, position, true);
        }
    }

    /**
     * Negative lookahead: succeeds with an empty result, consuming nothing, if {@code expression}
     * has no derivation here.
     */
    record Not(Expression expression) implements Expression {
        @Override
        public LazySequence<Derivation> derive(Input<?> input, int position) {
            return new LookaheadSequence(expression, input, position, false);
        }
    }

    // === Repetition ===

    /**
     * Greedy repetition ({@code star}/{@code plus}): takes the first derivation at every step and
     * never backtracks into earlier steps. Yields the combined result once, unless
     * {@code requireOne} is set and no step matched.
     *
     * <p>Variables bound during a step are not unbound afterwards; call
     * {@link org.pragmatica.unipeg.unify.Variable#unbind()} when capturing inside a greedy repetition.
     */
    record GreedyRepeat(Expression expression, boolean requireOne) implements Expression {
        @Override
        public LazySequence<Derivation> derive(Input<?> input, int position) {
            return new GreedyRepeatSequence(expression, requireOne, input, position);
        }
    }

    /**
     * Backtracking repetition ({@code some}/{@code many}): every number of repetitions is a
     * candidate, the longest first. Recursion depth grows with the number of repetitions.
     */
    record BacktrackingRepeat(Expression expression, boolean requireOne) implements Expression {
        @Override
        public LazySequence<Derivation> derive(Input<?> input, int position) {
            var atLeastOnce = expression.derive(input, position)
                                        .flatMap(first -> continueFrom(first, input, position));
            return requireOne
                   ? atLeastOnce
                   : atLeastOnce.concat(() -> LazySequence.of(Derivation.of(Instance.empty(), position)));
        }

        private LazySequence<Derivation> continueFrom(Derivation first, Input<?> input, int position) {
            if (first.next() == position) {
                return LazySequence.of(first);
            }
            return new BacktrackingRepeat(expression, false)
                .derive(input, first.next())
                .map(rest -> Derivation.of(Instance.combine(first.result(), rest.result()), rest.next()));
        }
    }
}
