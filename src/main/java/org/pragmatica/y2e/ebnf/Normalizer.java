package org.pragmatica.y2e.ebnf;

import io.vavr.control.Either;
import org.pragmatica.y2e.error.ConversionError;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites EBNF expressions into canonical form without changing the language they describe.
 *
 * <p>Children are normalized before their parents, so a single bottom-up pass is enough:
 * <ul>
 *   <li>nested alternations and nested sequences are spliced into their parent;</li>
 *   <li>empty alternatives are dropped and the rest becomes optional; when the rest is already
 *       quantified the quantifiers are merged ({@code a+} becomes {@code a*}) instead of nested;</li>
 *   <li>single-child alternations and sequences are unwrapped;</li>
 *   <li>a quantifier over a quantified expression is rejected.</li>
 * </ul>
 */
public final class Normalizer {
    private Normalizer() {}

    public static Either<ConversionError, Ebnf> normalize(Ebnf expression) {
        if (expression instanceof Ebnf.Alternation alternation) {
            return normalizeAlternation(alternation);
        }
        if (expression instanceof Ebnf.Sequence sequence) {
            return normalizeSequence(sequence);
        }
        if (expression instanceof Ebnf.Quantified quantified) {
            return normalizeQuantified(quantified);
        }
        // NonTerminal and Terminal are already canonical
        return Either.right(expression);
    }

    public static Either<ConversionError, Definition> normalize(Definition definition) {
        return normalize(definition.body()).map(body -> new Definition(definition.name(), body));
    }

    private static Either<ConversionError, Ebnf> normalizeAlternation(Ebnf.Alternation alternation) {
        return normalizeAll(alternation.alternatives()).map(children -> {
            var flat = new ArrayList<Ebnf>();
            for (var child : children) {
                if (child instanceof Ebnf.Alternation nested) {
                    flat.addAll(nested.alternatives());
                } else {
                    flat.add(child);
                }
            }
            var remaining = flat.stream()
                                .filter(child -> !Ebnf.Sequence.EMPTY.equals(child))
                                .toList();
            var body = remaining.isEmpty()
                       ? Ebnf.empty()
                       : remaining.size() == 1
                         ? remaining.get(0)
                         : new Ebnf.Alternation(remaining);
            return remaining.size() == flat.size()
                   ? body
                   : optional(body);
        });
    }

    /**
     * Make an already normalized expression optional without nesting quantifiers.
     */
    private static Ebnf optional(Ebnf body) {
        if (Ebnf.Sequence.EMPTY.equals(body)) {
            return body;
        }
        if (body instanceof Ebnf.Quantified quantified) {
            return quantified.quantifier()
                             .allowsEmpty()
                   ? quantified
                   : Ebnf.zeroOrMore(quantified.expression());
        }
        return Ebnf.optional(body);
    }

    private static Either<ConversionError, Ebnf> normalizeSequence(Ebnf.Sequence sequence) {
        return normalizeAll(sequence.elements()).map(children -> {
            var flat = new ArrayList<Ebnf>();
            for (var child : children) {
                if (child instanceof Ebnf.Sequence nested) {
                    flat.addAll(nested.elements());
                } else {
                    flat.add(child);
                }
            }
            return flat.size() == 1
                   ? flat.get(0)
                   : new Ebnf.Sequence(flat);
        });
    }

    private static Either<ConversionError, Ebnf> normalizeQuantified(Ebnf.Quantified quantified) {
        return normalize(quantified.expression()).flatMap(inner -> {
            var partial = new Ebnf.Quantified(inner, quantified.quantifier());
            if (inner instanceof Ebnf.Quantified) {
                return Either.<ConversionError, Ebnf>left(new ConversionError.DoubleQuantification(quantified, partial));
            }
            return Either.<ConversionError, Ebnf>right(partial);
        });
    }

    private static Either<ConversionError, List<Ebnf>> normalizeAll(List<Ebnf> expressions) {
        var normalized = new ArrayList<Ebnf>(expressions.size());
        for (var expression : expressions) {
            var result = normalize(expression);
            if (result.isLeft()) {
                return Either.left(result.getLeft());
            }
            normalized.add(result.get());
        }
        return Either.right(normalized);
    }
}
