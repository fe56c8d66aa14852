package org.pragmatica.unipeg.grammar;

import org.pragmatica.unipeg.error.PegError;
import org.pragmatica.unipeg.input.Input;
import org.pragmatica.unipeg.lazy.LazySequence;
import org.pragmatica.unipeg.parser.ParserConfig;
import org.pragmatica.unipeg.result.Derivation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named, possibly mutually recursive, rules with a designated start symbol.
 *
 * <p>Rules are defined at setup time, in any order, and referred to through
 * {@link #ref(String) references} resolved lazily. Deriving the grammar derives its start symbol.
 *
 * <p>The grammar keeps the call history of the parse in progress - (position, reference) pairs of
 * the rule invocations currently being enumerated. A reference invoked again at a position it is
 * already being enumerated at would recurse without consuming input; that invocation alone is
 * aborted and yields nothing. The history makes a grammar usable by one parse at a time.
 *
 * <pre>{@code
 * var g = Grammar.create("pair");
 * g.define("pair", g.ref("digit").then(g.ref("digit")));
 * g.define("digit", item('0').or(item('1')));
 * }</pre>
 */
public final class Grammar implements Expression {
    private static final Logger log = LoggerFactory.getLogger(Grammar.class);

    /**
     * Call-history entry.
     */
    record Call(Reference reference, int position) {}

    private final String start;
    private final ParserConfig config;
    private final Map<String, Expression> rules = new LinkedHashMap<>();
    private final Deque<Call> history = new ArrayDeque<>();
    private final Reference startReference;

    private Grammar(String start, ParserConfig config) {
        this.start = start;
        this.config = config;
        this.startReference = new Reference(this, start);
    }

    public static Grammar create(String start) {
        return create(start, ParserConfig.DEFAULT);
    }

    public static Grammar create(String start, ParserConfig config) {
        return new Grammar(start, config);
    }

    // === Definition ===

    /**
     * Register or replace the rule for a symbol.
     */
    public Grammar define(String symbol, Expression expression) {
        if (rules.put(symbol, expression) != null) {
            log.debug("Rule '{}' replaced", symbol);
        } else {
            log.debug("Rule '{}' defined", symbol);
        }
        return this;
    }

    /**
     * A new reference to the symbol. The symbol need not be defined yet.
     */
    public Reference ref(String symbol) {
        return new Reference(this, symbol);
    }

    public String start() {
        return start;
    }

    public ParserConfig config() {
        return config;
    }

    public Set<String> symbols() {
        return Collections.unmodifiableSet(rules.keySet());
    }

    public Optional<Expression> findRule(String symbol) {
        return Optional.ofNullable(rules.get(symbol));
    }

    /**
     * Rule for the symbol.
     *
     * @throws org.pragmatica.unipeg.error.PegException with {@link PegError.UndefinedSymbol} if
     *         the symbol is not defined
     */
    public Expression rule(String symbol) {
        var rule = rules.get(symbol);
        if (rule == null) {
            throw new PegError.UndefinedSymbol(symbol).asException();
        }
        return rule;
    }

    // === Evaluation ===

    @Override
    public LazySequence<Derivation> derive(Input<?> input, int position) {
        return startReference.derive(input, position);
    }

    boolean isReentered(Reference reference, int position) {
        if (!config.recursionGuard()) {
            return false;
        }
        var calls = history.descendingIterator();
        while (calls.hasNext()) {
            var call = calls.next();
            if (call.reference() == reference && call.position() == position) {
                return true;
            }
        }
        return false;
    }

    Call enter(Reference reference, int position) {
        var call = new Call(reference, position);
        history.addLast(call);
        return call;
    }

    void exit(Call call) {
        history.removeLastOccurrence(call);
    }

    /**
     * Number of rule invocations currently being enumerated.
     */
    public int activeCalls() {
        return history.size();
    }

    // === Validation ===

    /**
     * Symbols referenced from this grammar's rules, or used as start symbol, that have no rule.
     * References hidden inside {@link Expression.Bind} continuations cannot be seen.
     */
    public List<String> undefinedSymbols() {
        var referenced = new LinkedHashSet<String>();
        referenced.add(start);
        var visited = Collections.newSetFromMap(new IdentityHashMap<Expression, Boolean>());
        rules.values()
             .forEach(rule -> collectReferences(rule, referenced, visited));
        var undefined = new ArrayList<String>();
        for (var symbol : referenced) {
            if (!rules.containsKey(symbol)) {
                undefined.add(symbol);
            }
        }
        return undefined;
    }

    /**
     * Check that every referenced symbol is defined.
     *
     * @throws org.pragmatica.unipeg.error.PegException with {@link PegError.UndefinedSymbol}
     *         naming the first undefined symbol
     */
    public Grammar validate() {
        var undefined = undefinedSymbols();
        if (!undefined.isEmpty()) {
            throw new PegError.UndefinedSymbol(undefined.get(0)).asException();
        }
        return this;
    }

    private void collectReferences(Expression expr, Set<String> referenced, Set<Expression> visited) {
        if (!visited.add(expr)) {
            return;
        }
        if (expr instanceof Reference ref) {
            if (ref.grammar() == this) {
                referenced.add(ref.symbol());
            }
        } else if (expr instanceof Chain chain) {
            collectReferences(chain.left(), referenced, visited);
            collectReferences(chain.right(), referenced, visited);
        } else if (expr instanceof Alternative alternative) {
            collectReferences(alternative.one(), referenced, visited);
            collectReferences(alternative.other(), referenced, visited);
        } else if (expr instanceof Bind bind) {
            collectReferences(bind.expression(), referenced, visited);
        } else if (expr instanceof Unify unify) {
            collectReferences(unify.expression(), referenced, visited);
        } else if (expr instanceof Locate locate) {
            collectReferences(locate.expression(), referenced, visited);
        } else if (expr instanceof Ahead ahead) {
            collectReferences(ahead.expression(), referenced, visited);
        } else if (expr instanceof Not not) {
            collectReferences(not.expression(), referenced, visited);
        } else if (expr instanceof GreedyRepeat repeat) {
            collectReferences(repeat.expression(), referenced, visited);
        } else if (expr instanceof BacktrackingRepeat repeat) {
            collectReferences(repeat.expression(), referenced, visited);
        }
        // Terminals and nested grammars have no references of their own
    }

    @Override
    public String toString() {
        return "Grammar(" + start + ", " + rules.keySet() + ")";
    }
}
