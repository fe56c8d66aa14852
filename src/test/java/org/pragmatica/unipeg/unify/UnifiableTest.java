package org.pragmatica.unipeg.unify;

import org.junit.jupiter.api.Test;
import org.pragmatica.unipeg.result.Instance;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UnifiableTest {

    @Test
    void any_yieldsValueUnchanged() {
        assertEquals(List.of("x"), Unifiable.any().unify("x").toList());
    }

    @Test
    void nothing_yieldsNothing() {
        assertTrue(Unifiable.nothing().unify("x").toList().isEmpty());
    }

    @Test
    void constant_matchesEqualValue() {
        assertEquals(List.of('a'), Unifiable.constant('a').unify('a').toList());
        assertTrue(Unifiable.constant('a').unify('b').toList().isEmpty());
    }

    @Test
    void constant_matchesUnpackedResult() {
        assertEquals(List.of('a'), Unifiable.constant('a').unify(new Instance.Item('a', 3)).toList());
        assertEquals(List.of(List.of('a', 'b')),
                     Unifiable.constant(List.of('a', 'b'))
                              .unify(Instance.combine(new Instance.Item('a', 0), new Instance.Item('b', 1)))
                              .toList());
    }

    @Test
    void label_wrapsValueOnce() {
        var item = new Instance.Item('a', 0);

        var labeled = Unifiable.label("letter").unify(item).toList();

        assertEquals(List.of(new Instance.Labeled(item, "letter")), labeled);
    }

    @Test
    void label_ofPlainValue_wrapsItWithoutPosition() {
        var labeled = (Instance.Labeled) Unifiable.label("n").unify(5).toList().get(0);

        assertEquals(5, labeled.unpack());
        assertEquals(Instance.NO_POSITION, labeled.position());
    }

    @Test
    void either_yieldsBothSidesInOrder() {
        var pattern = Unifiable.constant('a').or(Unifiable.any());

        assertEquals(List.of('a', 'a'), pattern.unify('a').toList());
        assertEquals(List.of('b'), pattern.unify('b').toList());
    }

    @Test
    void where_filtersByUnpackedValue() {
        var digit = Unifiable.where(value -> value instanceof Character c && Character.isDigit(c));

        assertEquals(1, digit.unify(new Instance.Item('7', 0)).toList().size());
        assertTrue(digit.unify('x').toList().isEmpty());
    }

    @Test
    void lift_keepsPatterns_andWrapsValuesAsConstants() {
        var variable = Variable.variable();

        assertSame(variable, Unifiable.lift(variable));
        assertEquals(new Constant("x"), Unifiable.lift("x"));
    }
}
