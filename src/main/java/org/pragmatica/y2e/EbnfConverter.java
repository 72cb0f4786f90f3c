package org.pragmatica.y2e;

import io.vavr.control.Either;
import org.pragmatica.y2e.convert.Converter;
import org.pragmatica.y2e.convert.ConverterConfig;
import org.pragmatica.y2e.ebnf.Definition;
import org.pragmatica.y2e.ebnf.EbnfParser;
import org.pragmatica.y2e.error.ConversionError;
import org.pragmatica.y2e.io.Resource;
import org.pragmatica.y2e.yacc.YaccParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for converting YACC grammars to EBNF.
 *
 * <p>Example usage:
 * <pre>{@code
 * var definitions = EbnfConverter.convert("""
 *     %%
 *     list : item sep item ;
 *     %%
 *     """, """
 *     sep ::= ',' | ';'
 *     """).get();
 *
 * EbnfConverter.render(definitions).forEach(System.out::println);
 * }</pre>
 */
public final class EbnfConverter {
    private static final String GRAMMAR = "grammar";
    private static final String SUPPLEMENT = "supplement";

    private EbnfConverter() {}

    /**
     * Convert a YACC grammar with no supplementary definitions.
     */
    public static Either<ConversionError, List<Definition>> convert(String grammarText) {
        return convert(grammarText, "");
    }

    public static Either<ConversionError, List<Definition>> convert(String grammarText, String supplementText) {
        return convert(grammarText, supplementText, ConverterConfig.DEFAULT);
    }

    public static Either<ConversionError, List<Definition>> convert(String grammarText,
                                                                    String supplementText,
                                                                    ConverterConfig config) {
        return convert(Resource.of(GRAMMAR, grammarText), Resource.of(SUPPLEMENT, supplementText), config);
    }

    /**
     * Convert named resources. Errors are attributed to the resource they were found in.
     */
    public static Either<ConversionError, List<Definition>> convert(Resource grammar,
                                                                    Resource supplement,
                                                                    ConverterConfig config) {
        return YaccParser.parse(grammar.text())
                         .mapLeft(error -> ConversionError.in(grammar.name(), error))
                         .flatMap(yacc -> EbnfParser.parse(supplement.text())
                                                    .mapLeft(error -> ConversionError.in(supplement.name(), error))
                                                    .flatMap(definitions -> Converter.create(config)
                                                                                     .convert(yacc, definitions)
                                                                                     .mapLeft(error -> ConversionError.in(grammar.name(), error))));
    }

    /**
     * Output lines: one per definition, then a blank line.
     */
    public static List<String> render(List<Definition> definitions) {
        var lines = new ArrayList<String>(definitions.size() + 1);
        definitions.forEach(definition -> lines.add(definition.toString()));
        lines.add("");
        return List.copyOf(lines);
    }

    /**
     * Create a builder for more complex converter configuration.
     */
    public static Builder builder(String grammarText) {
        return new Builder(grammarText);
    }

    public static final class Builder {
        private final String grammarText;
        private String supplementText = "";
        private int maxTrivialAlternatives = ConverterConfig.DEFAULT_MAX_TRIVIAL_ALTERNATIVES;
        private int maxTrivialSequenceElements = ConverterConfig.DEFAULT_MAX_TRIVIAL_SEQUENCE_ELEMENTS;
        private boolean inlining = true;
        private int maxInlinePasses = ConverterConfig.DEFAULT_MAX_INLINE_PASSES;

        private Builder(String grammarText) {
            this.grammarText = grammarText;
        }

        public Builder supplement(String text) {
            this.supplementText = text;
            return this;
        }

        public Builder maxTrivialAlternatives(int limit) {
            this.maxTrivialAlternatives = limit;
            return this;
        }

        public Builder maxTrivialSequenceElements(int limit) {
            this.maxTrivialSequenceElements = limit;
            return this;
        }

        public Builder inlining(boolean enabled) {
            this.inlining = enabled;
            return this;
        }

        public Builder maxInlinePasses(int passes) {
            this.maxInlinePasses = passes;
            return this;
        }

        public Either<ConversionError, List<Definition>> build() {
            var config = new ConverterConfig(maxTrivialAlternatives, maxTrivialSequenceElements, inlining, maxInlinePasses);
            return convert(grammarText, supplementText, config);
        }
    }
}
