package org.pragmatica.y2e.convert;

import io.vavr.control.Either;
import org.pragmatica.y2e.analysis.DependencyGraph;
import org.pragmatica.y2e.ebnf.Definition;
import org.pragmatica.y2e.ebnf.Ebnf;
import org.pragmatica.y2e.ebnf.Normalizer;
import org.pragmatica.y2e.error.ConversionError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Decides which definitions are trivial and substitutes their bodies at reference sites.
 *
 * <p>A definition is trivial when it is not recursive and its body is one of:
 * <ul>
 *   <li>an atom, or an alternation of at most {@link ConverterConfig#maxTrivialAlternatives()} atoms;</li>
 *   <li>a sequence of at most {@link ConverterConfig#maxTrivialSequenceElements()} elements, each an atom
 *       or itself trivial by these rules;</li>
 *   <li>a quantified atom.</li>
 * </ul>
 */
public final class Inliner {
    private static final Logger logger = LoggerFactory.getLogger(Inliner.class);

    private final ConverterConfig config;
    private final DependencyGraph graph;

    private Inliner(ConverterConfig config, DependencyGraph graph) {
        this.config = config;
        this.graph = graph;
    }

    public static Inliner create(ConverterConfig config, DependencyGraph graph) {
        return new Inliner(config, graph);
    }

    public boolean isTrivial(Definition definition) {
        return config.inlining()
               && !graph.isRecursive(definition.name())
               && isSimple(definition.body());
    }

    boolean isSimple(Ebnf body) {
        if (body.isAtomic()) {
            return true;
        }
        if (body instanceof Ebnf.Alternation alternation) {
            return alternation.alternatives().size() <= config.maxTrivialAlternatives()
                   && alternation.alternatives()
                                 .stream()
                                 .allMatch(Ebnf::isAtomic);
        }
        if (body instanceof Ebnf.Sequence sequence) {
            return sequence.elements().size() <= config.maxTrivialSequenceElements()
                   && sequence.elements()
                              .stream()
                              .allMatch(this::isSimple);
        }
        if (body instanceof Ebnf.Quantified quantified) {
            return quantified.expression()
                             .isAtomic();
        }
        return false;
    }

    /**
     * Replace references to trivial definitions inside {@code body} and normalize, repeating until
     * nothing changes. References to {@code name} itself are never replaced.
     *
     * <p>Under a quantifier a reference is kept when substituting the bodies there would leave the
     * quantifier applied to another quantifier or to nothing.
     *
     * @param name    name of the definition being built
     * @param body    its body, normalized or not
     * @param trivial bodies of the trivial definitions known so far
     */
    public Either<ConversionError, Ebnf> inline(String name, Ebnf body, Map<String, Ebnf> trivial) {
        var current = body;
        for (int pass = 0; pass < config.maxInlinePasses(); pass++) {
            var substitution = new Substitution(name, trivial);
            var next = Normalizer.normalize(substitute(current, substitution, false));
            substitution.log();
            if (next.isLeft() || next.get().equals(current)) {
                return next;
            }
            current = next.get();
        }
        logger.warn("Inlining of '{}' did not settle after {} passes", name, config.maxInlinePasses());
        return Normalizer.normalize(current);
    }

    private Ebnf substitute(Ebnf expression, Substitution substitution, boolean guarded) {
        if (expression instanceof Ebnf.NonTerminal reference) {
            return substitution.replace(reference, guarded);
        }
        if (expression instanceof Ebnf.Alternation alternation) {
            return new Ebnf.Alternation(alternation.alternatives()
                                                   .stream()
                                                   .map(child -> substitute(child, substitution, guarded))
                                                   .toList());
        }
        if (expression instanceof Ebnf.Sequence sequence) {
            return new Ebnf.Sequence(sequence.elements()
                                             .stream()
                                             .map(child -> substitute(child, substitution, guarded))
                                             .toList());
        }
        if (expression instanceof Ebnf.Quantified quantified) {
            return substituteQuantified(quantified, substitution);
        }
        return expression;
    }

    /**
     * Substitute everything below the quantifier if the result is still well formed, otherwise
     * keep the references whose bodies are quantified or empty.
     */
    private Ebnf substituteQuantified(Ebnf.Quantified quantified, Substitution substitution) {
        var attempt = substitution.fork();
        var candidate = new Ebnf.Quantified(substitute(quantified.expression(), attempt, false),
                                            quantified.quantifier());
        if (isWellFormed(candidate)) {
            substitution.join(attempt);
            return candidate;
        }
        var guarded = substitution.fork();
        var fallback = new Ebnf.Quantified(substitute(quantified.expression(), guarded, true),
                                           quantified.quantifier());
        substitution.join(guarded);
        return fallback;
    }

    private static boolean isWellFormed(Ebnf.Quantified candidate) {
        var normalized = Normalizer.normalize(candidate);
        return normalized.isRight()
               && !Ebnf.Sequence.EMPTY.equals(((Ebnf.Quantified) normalized.get()).expression());
    }

    /**
     * One pass of substitutions into a single definition. Outcomes are collected so that
     * rejected attempts under a quantifier are not logged.
     */
    private static final class Substitution {
        private final String name;
        private final Map<String, Ebnf> trivial;
        private final List<String> inlined = new ArrayList<>();
        private final List<String> kept = new ArrayList<>();

        Substitution(String name, Map<String, Ebnf> trivial) {
            this.name = name;
            this.trivial = trivial;
        }

        Ebnf replace(Ebnf.NonTerminal reference, boolean guarded) {
            if (reference.name().equals(name) || !trivial.containsKey(reference.name())) {
                return reference;
            }
            var body = trivial.get(reference.name());
            if (guarded && (body instanceof Ebnf.Quantified || Ebnf.Sequence.EMPTY.equals(body))) {
                kept.add(reference.name());
                return reference;
            }
            inlined.add(reference.name());
            return body;
        }

        Substitution fork() {
            return new Substitution(name, trivial);
        }

        void join(Substitution other) {
            inlined.addAll(other.inlined);
            kept.addAll(other.kept);
        }

        void log() {
            inlined.forEach(reference -> logger.debug("Inlining '{}' into '{}'", reference, name));
            kept.forEach(reference -> logger.debug("Keeping reference to '{}' inside '{}' to avoid a nested quantifier",
                                                   reference, name));
        }
    }
}
