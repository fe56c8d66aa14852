package org.pragmatica.unipeg.input;

import com.google.common.base.Preconditions;

/**
 * A position within an {@link Input}. Cursors are values; moving produces a new cursor.
 */
public record Cursor(Input<?> input, int position) {

    public Cursor {
        Preconditions.checkPositionIndex(position, input.length(), "position");
    }

    public static Cursor at(Input<?> input, int position) {
        return new Cursor(input, position);
    }

    public boolean atEnd() {
        return position == input.length();
    }

    public int remaining() {
        return input.length() - position;
    }

    /**
     * Element under the cursor. Must not be called at the end of input.
     */
    public Object current() {
        return input.at(position);
    }

    public Cursor advance() {
        return moveTo(position + 1);
    }

    public Cursor moveTo(int newPosition) {
        return new Cursor(input, newPosition);
    }

    @Override
    public String toString() {
        return "@" + position;
    }
}
