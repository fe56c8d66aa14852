package org.pragmatica.unipeg.grammar;

import org.junit.jupiter.api.Test;
import org.pragmatica.unipeg.error.PegError;
import org.pragmatica.unipeg.error.PegException;
import org.pragmatica.unipeg.input.Input;
import org.pragmatica.unipeg.parser.ParserConfig;
import org.pragmatica.unipeg.result.Derivation;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.unipeg.Peg.*;
import static org.pragmatica.unipeg.grammar.ExpressionTest.derive;
import static org.pragmatica.unipeg.grammar.ExpressionTest.values;

class GrammarTest {

    // === Rule resolution ===

    @Test
    void grammar_rulesDefinedInAnyOrder_resolveLazily() {
        var g = grammar("pair");
        g.define("pair", g.ref("digit").then(g.ref("digit")));
        g.define("digit", item('0').or(item('1')));

        var derivations = derive(g, "10");

        assertEquals(1, derivations.size());
        assertEquals(List.of('1', '0'), derivations.get(0).unpack());
        assertEquals(2, derivations.get(0).next());
        assertEquals(0, g.activeCalls());
    }

    @Test
    void define_existingSymbol_replacesRule() {
        var g = grammar("digit");
        g.define("digit", item('0'));
        g.define("digit", item('1'));

        assertTrue(derive(g, "0").isEmpty());
        assertThat(values(g, "1")).containsExactly('1');
        assertEquals(List.of("digit"), List.copyOf(g.symbols()));
    }

    @Test
    void grammar_embeddedInAnotherGrammar_behavesAsExpression() {
        var digits = grammar("digit");
        digits.define("digit", item('0').or(item('1')));

        var g = grammar("start");
        g.define("start", digits.then(digits).then(end()));

        assertEquals(List.of(List.of('1', '0')), values(g, "10"));
        assertTrue(g.undefinedSymbols().isEmpty());
    }

    @Test
    void findRule_undefinedSymbol_isEmpty() {
        var g = grammar("start");
        g.define("start", element());

        assertTrue(g.findRule("start").isPresent());
        assertTrue(g.findRule("other").isEmpty());
    }

    // === Undefined symbols ===

    @Test
    void derive_undefinedSymbol_throwsAndReleasesHistory() {
        var g = grammar("start");
        g.define("start", item('a').then(g.ref("missing")));

        var exception = assertThrows(PegException.class, () -> derive(g, "a"));

        assertEquals(new PegError.UndefinedSymbol("missing"), exception.error());
        assertEquals("Undefined symbol: 'missing'", exception.getMessage());
        assertEquals(0, g.activeCalls());
    }

    @Test
    void derive_undefinedSymbolOnUntakenBranch_isNotAnError() {
        var g = grammar("start");
        g.define("start", item('a').or(item('b').then(g.ref("missing"))));

        assertThat(values(g, "a")).containsExactly('a');
    }

    @Test
    void undefinedSymbols_listsMissingRulesAndStartSymbol() {
        var g = grammar("main");
        g.define("list", g.ref("digit").or(star(g.ref("letter"))));
        g.define("digit", item('0'));

        assertEquals(List.of("main", "letter"), g.undefinedSymbols());

        var exception = assertThrows(PegException.class, g::validate);
        assertEquals(new PegError.UndefinedSymbol("main"), exception.error());
    }

    @Test
    void validate_completeGrammar_returnsGrammar() {
        var g = grammar("start");
        g.define("start", not(g.ref("digit")).then(element()));
        g.define("digit", item('0'));

        assertSame(g, g.validate());
    }

    // === Recursion ===

    @Test
    void selfReferentialRule_terminatesWithoutDerivations() {
        var g = grammar("rule");
        g.define("rule", g.ref("rule"));

        assertTrue(derive(g, "a").isEmpty());
        assertTrue(derive(g, "").isEmpty());
        assertEquals(0, g.activeCalls());
    }

    @Test
    void leftRecursion_isAbortedLocally() {
        var g = grammar("expr");
        g.define("expr", g.ref("expr").then(item('+')).then(item('1'))
                          .or(item('1')));

        assertThat(values(g, "1")).containsExactly('1');
        assertEquals(List.of(List.of('1', '+', '1'), '1'), values(g, "1+1"));
        assertEquals(0, g.activeCalls());
    }

    @Test
    void rightRecursion_yieldsEveryLengthLongestFirst() {
        var g = grammar("list");
        g.define("list", g.ref("digit").then(g.ref("list"))
                          .or(g.ref("digit")));
        g.define("digit", item('0').or(item('1')));

        var derivations = derive(g, "101");

        assertEquals(List.of(3, 2, 1), derivations.stream().map(Derivation::next).toList());
        assertEquals(List.of('1', '0', '1'), derivations.get(0).unpack());
    }

    @Test
    void mutualRecursion_endingAtEndOfInput() {
        var g = grammar("a");
        g.define("a", item('a').then(g.ref("b"))
                       .or(end()));
        g.define("b", item('b').then(g.ref("a")));

        assertEquals(List.of(List.of('a', 'b', 'a', 'b')), values(g, "abab"));
        assertTrue(derive(g, "aba").isEmpty());
    }

    @Test
    void recursionGuardDisabled_rightRecursionStillTerminates() {
        var config = ParserConfig.DEFAULT.withRecursionGuard(false);
        var g = grammar("start", config);
        g.define("start", item('a').then(g.ref("start")).or(end()));

        assertFalse(g.config().recursionGuard());
        assertEquals(List.of(List.of('a', 'a')), values(g, "aa"));
    }

    // === Call history ===

    @Test
    void activeCalls_countsInvocationsStillBeingEnumerated() {
        var g = grammar("start");
        g.define("start", g.ref("digit"));
        g.define("digit", item('1'));

        try (var derivations = g.derive(Input.of("1"), 0)) {
            assertTrue(derivations.hasNext());
            derivations.next();

            assertEquals(2, g.activeCalls());
        }
        assertEquals(0, g.activeCalls());
    }

    @Test
    void lookahead_releasesHistoryOfProbe() {
        var g = grammar("start");
        var digit = g.ref("digit");
        g.define("start", ahead(digit).then(digit));
        g.define("digit", item('1'));

        assertThat(values(g, "1")).containsExactly('1');
        assertEquals(0, g.activeCalls());
    }
}
