package org.pragmatica.unipeg.lazy;

import org.junit.jupiter.api.Test;
import org.pragmatica.unipeg.lazy.LazySequence.Release;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LazySequenceTest {

    // === Factories ===

    @Test
    void empty_hasNoElements() {
        assertFalse(LazySequence.empty().hasNext());
    }

    @Test
    void of_yieldsSingleElement() {
        assertEquals(List.of("x"), LazySequence.of("x").toList());
    }

    @Test
    void defer_createsSourceOnFirstPull() {
        var created = new AtomicInteger();
        var sequence = LazySequence.defer(() -> {
            created.incrementAndGet();
            return LazySequence.fromIterable(List.of(1, 2));
        });

        assertEquals(0, created.get());
        assertEquals(List.of(1, 2), sequence.toList());
        assertEquals(1, created.get());
    }

    // === Combinators ===

    @Test
    void map_transformsEachElement() {
        var result = LazySequence.fromIterable(List.of(1, 2, 3))
                                 .map(i -> i * 10)
                                 .toList();

        assertEquals(List.of(10, 20, 30), result);
    }

    @Test
    void filter_keepsMatchingElements() {
        var result = LazySequence.fromIterable(List.of(1, 2, 3, 4))
                                 .filter(i -> i % 2 == 0)
                                 .toList();

        assertEquals(List.of(2, 4), result);
    }

    @Test
    void flatMap_expandsDepthFirst() {
        var result = LazySequence.fromIterable(List.of("a", "b"))
                                 .flatMap(s -> LazySequence.fromIterable(List.of(s + 1, s + 2)))
                                 .toList();

        assertEquals(List.of("a1", "a2", "b1", "b2"), result);
    }

    @Test
    void flatMap_closesExhaustedInnerBeforeResumingOuter() {
        var outer = new Tracked(1, 2);
        var inners = new ArrayList<Tracked>();
        var sequence = outer.flatMap(i -> {
            var inner = new Tracked(i * 10);
            inners.add(inner);
            return inner;
        });

        assertEquals(10, sequence.next());
        assertTrue(inners.get(0).releases.isEmpty());

        assertEquals(20, sequence.next());
        assertEquals(List.of(Release.CLOSE), inners.get(0).releases);
        assertTrue(inners.get(1).releases.isEmpty());
    }

    @Test
    void concat_createsSecondOnlyAfterFirstIsExhausted() {
        var created = new AtomicInteger();
        var sequence = LazySequence.fromIterable(List.of(1, 2))
                                   .concat(() -> {
                                       created.incrementAndGet();
                                       return LazySequence.of(3);
                                   });

        assertEquals(1, sequence.next());
        assertEquals(2, sequence.next());
        assertEquals(0, created.get());

        assertEquals(3, sequence.next());
        assertEquals(1, created.get());
        assertFalse(sequence.hasNext());
    }

    // === Release ===

    @Test
    void close_propagatesToLiveSources() {
        var outer = new Tracked(1, 2);
        var inner = new Tracked(10, 20);
        var sequence = outer.flatMap(i -> inner);

        sequence.next();
        sequence.close();

        assertEquals(List.of(Release.CLOSE), outer.releases);
        assertEquals(List.of(Release.CLOSE), inner.releases);
    }

    @Test
    void abandon_propagatesAbandonMode() {
        var source = new Tracked(1, 2);
        var sequence = source.map(i -> i + 1);

        sequence.next();
        sequence.abandon();

        assertEquals(List.of(Release.ABANDON), source.releases);
    }

    @Test
    void release_happensOnlyOnce() {
        var source = new Tracked(1);

        source.close();
        source.close();
        source.abandon();

        assertEquals(List.of(Release.CLOSE), source.releases);
        assertTrue(source.isReleased());
    }

    @Test
    void closedSequence_producesNothingMore() {
        var source = new Tracked(1, 2, 3);

        source.close();

        assertFalse(source.hasNext());
    }

    @Test
    void first_takesFirstElementAndCloses() {
        var source = new Tracked(1, 2, 3);

        assertEquals(1, source.first().orElseThrow());
        assertEquals(List.of(Release.CLOSE), source.releases);
    }

    @Test
    void first_ofEmptySequence_isEmpty() {
        assertTrue(LazySequence.empty().first().isEmpty());
    }

    private static final class Tracked extends LazySequence<Integer> {
        private final Iterator<Integer> values;
        private final List<Release> releases = new ArrayList<>();

        private Tracked(Integer... values) {
            this.values = List.of(values).iterator();
        }

        @Override
        protected Integer produce() {
            return values.hasNext()
                   ? values.next()
                   : endOfData();
        }

        @Override
        protected void onRelease(Release mode) {
            releases.add(mode);
        }
    }
}
