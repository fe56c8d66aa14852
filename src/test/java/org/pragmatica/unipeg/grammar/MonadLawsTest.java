package org.pragmatica.unipeg.grammar;

import org.junit.jupiter.api.Test;
import org.pragmatica.unipeg.result.Instance;

import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.unipeg.Peg.*;
import static org.pragmatica.unipeg.grammar.ExpressionTest.derive;

/**
 * Algebraic laws of the combinators, checked by comparing derivation lists over a few inputs.
 */
class MonadLawsTest {

    private static final List<String> INPUTS = List.of("", "a", "ab", "aab", "ba", "abab");

    private static final List<Expression> PARSERS = List.of(
        item('a'),
        element(),
        item('a').or(element()),
        some(item('a').or(item('b'))),
        star(item('a')),
        element().then(item('b')),
        zero(),
        ret(Instance.empty())
    );

    // Continuation that consumes another copy of the element it is given
    private static final Function<Instance, Expression> REPEAT = result -> item(result.unpack());

    private static final Function<Instance, Expression> ANY_NEXT = result -> element().or(ret(result));

    // === Monad laws ===

    @Test
    void rightIdentity_bindWithReturn_isIdentity() {
        for (var p : PARSERS) {
            assertEquivalent(p.bind(Expression.Return::new), p);
        }
    }

    @Test
    void leftIdentity_returnThenBind_isApplication() {
        var x = new Instance.Item('a', 0);

        assertEquivalent(ret(x).bind(REPEAT), REPEAT.apply(x));
        assertEquivalent(ret(x).bind(ANY_NEXT), ANY_NEXT.apply(x));
    }

    @Test
    void associativity_nestedBinds_areEquivalent() {
        for (var p : PARSERS) {
            var leftNested = p.bind(REPEAT).bind(ANY_NEXT);
            var rightNested = p.bind(a -> REPEAT.apply(a).bind(ANY_NEXT));

            assertEquivalent(leftNested, rightNested);
        }
    }

    @Test
    void chain_withReturnOfEmpty_isIdentity() {
        for (var p : PARSERS) {
            assertEquivalent(p.then(ret(Instance.empty())), p);
            assertEquivalent(ret(Instance.empty()).then(p), p);
        }
    }

    @Test
    void chain_isAssociative() {
        for (var p : PARSERS) {
            for (var q : PARSERS) {
                var r = element();
                assertEquivalent(p.then(q).then(r), p.then(q.then(r)));
            }
        }
    }

    // === Alternative laws ===

    @Test
    void zero_isIdentityOfAlternative() {
        for (var p : PARSERS) {
            assertEquivalent(p.or(zero()), p);
            assertEquivalent(zero().or(p), p);
        }
    }

    @Test
    void alternative_isAssociative() {
        var r = item('b');
        for (var p : PARSERS) {
            for (var q : PARSERS) {
                assertEquivalent(p.or(q).or(r), p.or(q.or(r)));
            }
        }
    }

    @Test
    void alternative_distributesOverChain() {
        var f = element().or(ret(Instance.empty()));
        for (var p : PARSERS) {
            for (var q : PARSERS) {
                assertEquivalent(p.or(q).then(f), p.then(f).or(q.then(f)));
            }
        }
    }

    @Test
    void alternative_distributesOverBind() {
        for (var p : PARSERS) {
            var q = item('b');
            assertEquivalent(p.or(q).bind(ANY_NEXT), p.bind(ANY_NEXT).or(q.bind(ANY_NEXT)));
        }
    }

    @Test
    void zero_isLeftAnnihilatorOfChain() {
        for (var p : PARSERS) {
            assertEquivalent(zero().then(p), zero());
            assertEquivalent(zero().bind(REPEAT), zero());
        }
    }

    private static void assertEquivalent(Expression actual, Expression expected) {
        for (var input : INPUTS) {
            assertEquals(derive(expected, input), derive(actual, input), () -> "on input '" + input + "'");
        }
    }
}
