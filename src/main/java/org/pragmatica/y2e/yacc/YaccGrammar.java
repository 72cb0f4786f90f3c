package org.pragmatica.y2e.yacc;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.y2e.error.ConversionError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A YACC grammar - productions by name, in definition order.
 *
 * <p>Built one production at a time; each insertion checks that the name is new and
 * that the production has at most one empty alternative.
 */
public record YaccGrammar(Map<String, List<YaccRule>> productions) {
    private static final int MAX_EMPTY_RULES = 1;

    public YaccGrammar {
        productions = Collections.unmodifiableMap(new LinkedHashMap<>(productions));
    }

    public static YaccGrammar empty() {
        return new YaccGrammar(Map.of());
    }

    /**
     * Fold productions into a grammar, stopping at the first invariant violation.
     */
    public static Either<ConversionError, YaccGrammar> of(List<YaccProduction> productions) {
        var grammar = empty();
        for (var production : productions) {
            var next = grammar.with(production);
            if (next.isLeft()) {
                return next;
            }
            grammar = next.get();
        }
        return Either.right(grammar);
    }

    /**
     * Grammar extended with one more production.
     */
    public Either<ConversionError, YaccGrammar> with(YaccProduction production) {
        if (productions.containsKey(production.name())) {
            return Either.left(new ConversionError.DuplicateName(production.name()));
        }
        int empty = production.emptyRules();
        if (empty > MAX_EMPTY_RULES) {
            return Either.left(new ConversionError.TooManyEmptyRules(production.name(), empty));
        }
        var extended = new LinkedHashMap<>(productions);
        extended.put(production.name(), production.rules());
        return Either.right(new YaccGrammar(extended));
    }

    public boolean contains(String name) {
        return productions.containsKey(name);
    }

    public Option<YaccProduction> production(String name) {
        return Option.of(productions.get(name))
                     .map(rules -> new YaccProduction(name, rules));
    }

    public List<YaccProduction> asProductions() {
        return productions.entrySet()
                          .stream()
                          .map(entry -> new YaccProduction(entry.getKey(), entry.getValue()))
                          .toList();
    }

    public int size() {
        return productions.size();
    }
}
