package org.pragmatica.y2e.convert;

import io.vavr.control.Either;
import org.pragmatica.y2e.analysis.DependencyGraph;
import org.pragmatica.y2e.ebnf.Definition;
import org.pragmatica.y2e.ebnf.Ebnf;
import org.pragmatica.y2e.error.ConversionError;
import org.pragmatica.y2e.yacc.YaccElement;
import org.pragmatica.y2e.yacc.YaccGrammar;
import org.pragmatica.y2e.yacc.YaccProduction;
import org.pragmatica.y2e.yacc.YaccRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Converts a YACC grammar into EBNF definitions.
 *
 * <p>Productions are converted one dependency component at a time, dependencies first, so every
 * trivial definition a production refers to is already known when the production is converted.
 * Supplementary definitions take part in the dependency analysis and may be inlined, but are
 * emitted unchanged after the converted productions.
 */
public final class Converter {
    private static final Logger logger = LoggerFactory.getLogger(Converter.class);

    private final ConverterConfig config;

    private Converter(ConverterConfig config) {
        this.config = config;
    }

    public static Converter create() {
        return create(ConverterConfig.DEFAULT);
    }

    public static Converter create(ConverterConfig config) {
        return new Converter(config);
    }

    public Either<ConversionError, List<Definition>> convert(YaccGrammar grammar) {
        return convert(grammar, List.of());
    }

    public Either<ConversionError, List<Definition>> convert(YaccGrammar grammar, List<Definition> supplement) {
        for (var definition : supplement) {
            if (grammar.contains(definition.name())) {
                return Either.left(new ConversionError.DuplicateName(definition.name()));
            }
        }

        var graph = dependencies(grammar, supplement);
        var inliner = Inliner.create(config, graph);
        var trivial = new LinkedHashMap<String, Ebnf>();
        for (var definition : supplement) {
            if (inliner.isTrivial(definition)) {
                trivial.put(definition.name(), definition.body());
            }
        }

        var components = graph.components();
        logger.debug("Dependency order: {}", components);

        var converted = new ArrayList<Definition>(grammar.size() + supplement.size());
        for (var component : components) {
            boolean recursive = graph.isRecursiveGroup(component);
            for (var name : component) {
                var production = grammar.production(name);
                if (production.isEmpty()) {
                    continue;
                }
                var body = inliner.inline(name, toEbnf(production.get()), trivial);
                if (body.isLeft()) {
                    return Either.left(body.getLeft());
                }
                var definition = new Definition(name, body.get());
                if (!recursive && inliner.isTrivial(definition)) {
                    logger.debug("'{}' is trivial: {}", name, definition);
                    trivial.put(name, definition.body());
                }
                converted.add(definition);
            }
        }
        converted.addAll(supplement);
        return Either.right(List.copyOf(converted));
    }

    static DependencyGraph dependencies(YaccGrammar grammar, List<Definition> supplement) {
        var references = new LinkedHashMap<String, Set<String>>();
        for (var production : grammar.asProductions()) {
            references.put(production.name(), production.references());
        }
        for (var definition : supplement) {
            references.put(definition.name(), Ebnf.references(definition.body()));
        }
        return DependencyGraph.of(references);
    }

    /**
     * Alternation of the production's rules, each rule a sequence of its elements. Not normalized.
     */
    static Ebnf toEbnf(YaccProduction production) {
        return new Ebnf.Alternation(production.rules()
                                              .stream()
                                              .map(Converter::toSequence)
                                              .toList());
    }

    private static Ebnf toSequence(YaccRule rule) {
        return new Ebnf.Sequence(rule.elements()
                                     .stream()
                                     .map(Converter::toAtom)
                                     .toList());
    }

    private static Ebnf toAtom(YaccElement element) {
        if (element instanceof YaccElement.Terminal terminal) {
            return Ebnf.terminal(terminal.literal());
        }
        return Ebnf.nonTerminal(((YaccElement.NonTerminal) element).name());
    }
}
