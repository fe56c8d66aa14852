package org.pragmatica.unipeg.result;

/**
 * One way an expression matched: the result and the position right after the match.
 */
public record Derivation(Instance result, int next) {

    public static Derivation of(Instance result, int next) {
        return new Derivation(result, next);
    }

    /**
     * The result projected down to plain data.
     */
    public Object unpack() {
        return result.unpack();
    }

    @Override
    public String toString() {
        return result + " -> " + next;
    }
}
