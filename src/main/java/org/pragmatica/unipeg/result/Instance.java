package org.pragmatica.unipeg.result;

import com.google.common.collect.ImmutableList;
import org.pragmatica.unipeg.lazy.LazySequence;
import org.pragmatica.unipeg.unify.Constant;
import org.pragmatica.unipeg.unify.Unifiable;
import org.pragmatica.unipeg.unify.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Value produced by one successful match step.
 *
 * <p>Instances form a monoid under {@link #combine(Instance, Instance)}: {@link #empty()} is the
 * identity and adjacent results are collected into one flat {@link Sequence}. Instances are also
 * patterns, so a previously matched result can be unified against a new one.
 */
public sealed interface Instance extends Unifiable permits Instance.Empty, Instance.End, Instance.Item, Instance.Sequence, Instance.Labeled {

    int NO_POSITION = -1;

    /**
     * Input position the result was matched at, or {@link #NO_POSITION}.
     */
    int position();

    /**
     * Project this result down to plain data.
     */
    Object unpack();

    /**
     * Success without payload.
     */
    enum Empty implements Instance {
        INSTANCE;

        @Override
        public int position() {
            return NO_POSITION;
        }

        @Override
        public Object unpack() {
            return null;
        }

        @Override
        public String toString() {
            return "Empty";
        }
    }

    /**
     * End-of-input marker.
     */
    record End(int position) implements Instance {
        @Override
        public Object unpack() {
            return null;
        }

        @Override
        public LazySequence<Object> unify(Object value) {
            return value instanceof End
                   ? LazySequence.of(value)
                   : LazySequence.empty();
        }

        @Override
        public String toString() {
            return "<End at " + position + ">";
        }
    }

    /**
     * One consumed element together with the position it was consumed at.
     */
    record Item(Object value, int position) implements Instance {
        @Override
        public Object unpack() {
            return unpackValue(value);
        }

        /**
         * Matches another item or a raw value carrying the same payload; the position is ignored.
         */
        @Override
        public LazySequence<Object> unify(Object other) {
            var payload = other instanceof Item item
                          ? item.value()
                          : other;
            return Objects.equals(value, payload)
                   ? LazySequence.of(other)
                   : LazySequence.empty();
        }

        @Override
        public String toString() {
            return "<" + value + " at " + position + ">";
        }
    }

    /**
     * Ordered, flat collection of results. Never contains {@link Empty} or another sequence.
     */
    record Sequence(ImmutableList<Instance> items) implements Instance {
        public Sequence {
            if (items.size() < 2) {
                throw new IllegalArgumentException("Sequence requires at least two items, got " + items);
            }
        }

        @Override
        public int position() {
            return items.get(0).position();
        }

        @Override
        public Object unpack() {
            var values = new ArrayList<>(items.size());
            for (var item : items) {
                values.add(item.unpack());
            }
            return Collections.unmodifiableList(values);
        }

        /**
         * Matches a sequence of the same length whose items unify pairwise with this one's.
         */
        @Override
        public LazySequence<Object> unify(Object value) {
            if (!(value instanceof Sequence other) || other.items().size() != items.size()) {
                return LazySequence.empty();
            }
            for (int i = 0; i < items.size(); i++) {
                try (var unified = items.get(i).unify(other.items().get(i))) {
                    if (!unified.hasNext()) {
                        return LazySequence.empty();
                    }
                }
            }
            return LazySequence.of(value);
        }

        @Override
        public String toString() {
            return "Sequence" + items;
        }
    }

    /**
     * Result tagged with a name, e.g. the grammar rule that produced it.
     */
    record Labeled(Instance result, String label) implements Instance {
        @Override
        public int position() {
            return result.position();
        }

        @Override
        public Object unpack() {
            return result.unpack();
        }

        @Override
        public String toString() {
            return "<" + label + ": " + result + ">";
        }
    }

    /**
     * Identity unification: yields the value if it equals this instance.
     */
    @Override
    default LazySequence<Object> unify(Object value) {
        return equals(value)
               ? LazySequence.of(value)
               : LazySequence.empty();
    }

    static Instance empty() {
        return Empty.INSTANCE;
    }

    // === Combination ===

    /**
     * Combine two results of consecutive match steps.
     *
     * <ul>
     *   <li>{@link #empty()} on either side is absorbed;</li>
     *   <li>an {@link End} on the right is absorbed, since it contributes no payload after a match;</li>
     *   <li>everything else is concatenated into one flat {@link Sequence}.</li>
     * </ul>
     */
    static Instance combine(Instance left, Instance right) {
        if (left instanceof Empty) {
            return right;
        }
        if (right instanceof Empty || right instanceof End) {
            return left;
        }
        var items = ImmutableList.<Instance>builder();
        appendItems(items, left);
        appendItems(items, right);
        return new Sequence(items.build());
    }

    private static void appendItems(ImmutableList.Builder<Instance> builder, Instance instance) {
        if (instance instanceof Sequence sequence) {
            builder.addAll(sequence.items());
        } else {
            builder.add(instance);
        }
    }

    /**
     * Build the result of a list of consecutive match steps.
     */
    static Instance combineAll(List<? extends Instance> instances) {
        var result = empty();
        for (var instance : instances) {
            result = combine(result, instance);
        }
        return result;
    }

    // === Conversions ===

    /**
     * Use an arbitrary value as a result: instances are kept as is, anything else becomes an
     * {@link Item} at the given position.
     */
    static Instance lift(Object value, int position) {
        return value instanceof Instance instance
               ? instance
               : new Item(value, position);
    }

    /**
     * Recursively project a result, pattern or plain value down to plain data.
     */
    static Object unpackValue(Object value) {
        if (value instanceof Instance instance) {
            return instance.unpack();
        }
        if (value instanceof Variable variable) {
            return variable.unpack();
        }
        if (value instanceof Constant constant) {
            return constant.unpack();
        }
        return value;
    }
}
