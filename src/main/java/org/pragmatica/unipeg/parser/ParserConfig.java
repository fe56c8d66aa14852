package org.pragmatica.unipeg.parser;

/**
 * Parser configuration options.
 *
 * @param recursionGuard abort a rule invoked again at the same position by the same reference;
 *                       applied by a {@link org.pragmatica.unipeg.grammar.Grammar} created with this
 *                       configuration
 * @param completeMatch  {@link Parser} accepts only derivations that consume the whole input
 */
public record ParserConfig(
    boolean recursionGuard,
    boolean completeMatch
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        true,
        true
    );

    public ParserConfig withRecursionGuard(boolean enabled) {
        return new ParserConfig(enabled, completeMatch);
    }

    public ParserConfig withCompleteMatch(boolean enabled) {
        return new ParserConfig(recursionGuard, enabled);
    }
}
