package org.pragmatica.unipeg.parser;

import org.pragmatica.unipeg.grammar.Expression;
import org.pragmatica.unipeg.grammar.Grammar;
import org.pragmatica.unipeg.input.Input;
import org.pragmatica.unipeg.lazy.LazySequence;
import org.pragmatica.unipeg.result.Derivation;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Runs a root expression (usually a {@link Grammar}) over whole inputs.
 *
 * <p>With {@link ParserConfig#completeMatch()} only derivations ending at the end of the input are
 * reported; otherwise every derivation from position 0 is.
 */
public final class Parser {
    private final Expression root;
    private final ParserConfig config;

    private Parser(Expression root, ParserConfig config) {
        this.root = root;
        this.config = config;
    }

    /**
     * Parser with the configuration of the root grammar, or {@link ParserConfig#DEFAULT} for
     * other expressions.
     */
    public static Parser of(Expression root) {
        return of(root, root instanceof Grammar grammar
                        ? grammar.config()
                        : ParserConfig.DEFAULT);
    }

    /**
     * Parser with an explicit configuration. The parser itself applies only
     * {@link ParserConfig#completeMatch()}; recursion guarding belongs to each grammar and is
     * fixed when the grammar is created.
     *
     * @throws IllegalArgumentException if {@code config.recursionGuard()} differs from the root
     *         grammar's setting, or is disabled for a root that is not a grammar
     */
    public static Parser of(Expression root, ParserConfig config) {
        if (root instanceof Grammar grammar) {
            checkArgument(grammar.config().recursionGuard() == config.recursionGuard(),
                          "Recursion guard of grammar '%s' is %s and cannot be changed by the parser",
                          grammar.start(), grammar.config().recursionGuard());
        } else {
            checkArgument(config.recursionGuard(),
                          "Recursion guard can only be disabled on a grammar, not on %s", root);
        }
        return new Parser(root, config);
    }

    public Expression root() {
        return root;
    }

    public ParserConfig config() {
        return config;
    }

    /**
     * Lazily enumerate accepted derivations. The caller must close the sequence if it stops
     * before exhausting it.
     */
    public LazySequence<Derivation> derivations(Input<?> input) {
        var derivations = root.derive(input.start());
        return config.completeMatch()
               ? derivations.filter(derivation -> derivation.next() == input.length())
               : derivations;
    }

    public LazySequence<Derivation> derivations(CharSequence text) {
        return derivations(Input.of(text));
    }

    /**
     * First accepted derivation, if any.
     */
    public Optional<Derivation> parse(Input<?> input) {
        return derivations(input).first();
    }

    public Optional<Derivation> parse(CharSequence text) {
        return parse(Input.of(text));
    }

    /**
     * Unpacked result of the first accepted derivation, if any.
     */
    public Optional<Object> parseValue(Input<?> input) {
        return parse(input).map(Derivation::unpack);
    }

    public Optional<Object> parseValue(CharSequence text) {
        return parseValue(Input.of(text));
    }

    /**
     * Every accepted derivation, in enumeration order.
     */
    public List<Derivation> parseAll(Input<?> input) {
        return derivations(input).toList();
    }

    public List<Derivation> parseAll(CharSequence text) {
        return parseAll(Input.of(text));
    }
}
