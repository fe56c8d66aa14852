package org.pragmatica.unipeg;

import org.pragmatica.unipeg.grammar.Expression;
import org.pragmatica.unipeg.grammar.Grammar;
import org.pragmatica.unipeg.parser.Parser;
import org.pragmatica.unipeg.parser.ParserConfig;
import org.pragmatica.unipeg.result.Instance;
import org.pragmatica.unipeg.unify.Unifiable;
import org.pragmatica.unipeg.unify.Variable;

import java.util.Arrays;
import java.util.function.Predicate;

/**
 * Entry point for building parsing expressions.
 *
 * <p>Example usage:
 * <pre>{@code
 * import static org.pragmatica.unipeg.Peg.*;
 *
 * var left = variable();
 * var right = variable();
 * var digit = item('0').or(item('1')).unify(Make.from(v -> v.equals('1') ? 1 : 0));
 * var add = digit.unify(left).then(item('+')).then(digit.unify(right))
 *                .unify(Make.record(BinaryAdd.class).bind("left", left).bind("right", right));
 *
 * var sum = parser(add).parseValue("1+0");
 * }</pre>
 */
public final class Peg {
    private static final Expression ELEMENT = new Expression.Element();
    private static final Expression ZERO = new Expression.Zero();
    private static final Expression END = new Expression.EndOfInput();

    private Peg() {}

    // === Basics ===

    /**
     * Consumes the next element, whatever it is.
     */
    public static Expression element() {
        return ELEMENT;
    }

    /**
     * Consumes the next element if it unifies with {@code value}; plain values match by equality.
     */
    public static Expression item(Object value) {
        return new Expression.Item(Unifiable.lift(value));
    }

    /**
     * Consumes the next element if it is one of the given values.
     */
    public static Expression.OneOf oneOf(Object... choices) {
        return Expression.OneOf.of(Arrays.asList(choices));
    }

    public static Expression.OneOf oneOf(Iterable<?> choices) {
        return Expression.OneOf.of(choices);
    }

    /**
     * Consumes the next element if its value satisfies the predicate.
     */
    public static Expression when(Predicate<Object> predicate) {
        return element().bind(result -> predicate.test(result.unpack())
                                        ? ret(result)
                                        : zero());
    }

    public static Expression ret(Object value) {
        return new Expression.Return(value);
    }

    public static Expression zero() {
        return ZERO;
    }

    public static Expression end() {
        return END;
    }

    public static Expression ahead(Expression expression) {
        return new Expression.Ahead(expression);
    }

    public static Expression not(Expression expression) {
        return new Expression.Not(expression);
    }

    public static Expression optional(Expression expression) {
        return expression.or(ret(Instance.empty()));
    }

    /**
     * Expressions in order, results combined.
     */
    public static Expression sequence(Expression first, Expression... rest) {
        var result = first;
        for (var next : rest) {
            result = result.then(next);
        }
        return result;
    }

    /**
     * Alternatives tried in order.
     */
    public static Expression choice(Expression first, Expression... rest) {
        var result = first;
        for (var next : rest) {
            result = result.or(next);
        }
        return result;
    }

    // === Repetition ===

    /**
     * Greedy zero or more. Does not unbind variables bound inside.
     */
    public static Expression star(Expression expression) {
        return new Expression.GreedyRepeat(expression, false);
    }

    /**
     * Greedy one or more. Does not unbind variables bound inside.
     */
    public static Expression plus(Expression expression) {
        return new Expression.GreedyRepeat(expression, true);
    }

    /**
     * Backtracking zero or more.
     */
    public static Expression many(Expression expression) {
        return new Expression.BacktrackingRepeat(expression, false);
    }

    /**
     * Backtracking one or more.
     */
    public static Expression some(Expression expression) {
        return new Expression.BacktrackingRepeat(expression, true);
    }

    // === Grammars, variables, parsers ===

    public static Grammar grammar(String start) {
        return Grammar.create(start);
    }

    public static Grammar grammar(String start, ParserConfig config) {
        return Grammar.create(start, config);
    }

    public static Variable variable() {
        return Variable.variable();
    }

    public static Variable variable(String name) {
        return Variable.variable(name);
    }

    public static Parser parser(Expression root) {
        return Parser.of(root);
    }

    public static Parser parser(Expression root, ParserConfig config) {
        return Parser.of(root, config);
    }
}
