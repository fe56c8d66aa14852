package org.pragmatica.unipeg.input;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Indexable sequence being parsed. Only its length and random access to elements are needed,
 * so anything from a string to a list of tokens or a tree node's children can be parsed.
 */
public interface Input<T> {

    int length();

    /**
     * Element at the given index, {@code 0 <= index < length()}.
     */
    T at(int index);

    default boolean isEmpty() {
        return length() == 0;
    }

    default Cursor start() {
        return Cursor.at(this, 0);
    }

    static Input<Character> of(CharSequence text) {
        return new TextInput(text);
    }

    static <T> Input<T> of(List<? extends T> elements) {
        return new ListInput<>(elements);
    }

    @SafeVarargs
    static <T> Input<T> of(T... elements) {
        return new ListInput<>(ImmutableList.copyOf(elements));
    }

    record TextInput(CharSequence text) implements Input<Character> {
        @Override
        public int length() {
            return text.length();
        }

        @Override
        public Character at(int index) {
            return text.charAt(index);
        }

        @Override
        public String toString() {
            return text.toString();
        }
    }

    record ListInput<T>(List<? extends T> elements) implements Input<T> {
        @Override
        public int length() {
            return elements.size();
        }

        @Override
        public T at(int index) {
            return elements.get(index);
        }

        @Override
        public String toString() {
            return elements.toString();
        }
    }
}
