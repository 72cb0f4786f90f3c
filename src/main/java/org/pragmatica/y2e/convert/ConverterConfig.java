package org.pragmatica.y2e.convert;

/**
 * Converter configuration options.
 *
 * @param maxTrivialAlternatives     largest alternation of atoms that is still inlined
 * @param maxTrivialSequenceElements largest sequence that is still inlined
 * @param inlining                   whether trivial definitions are inlined at all
 * @param maxInlinePasses            upper bound on substitution passes per definition
 */
public record ConverterConfig(
    int maxTrivialAlternatives,
    int maxTrivialSequenceElements,
    boolean inlining,
    int maxInlinePasses
) {
    public static final int DEFAULT_MAX_TRIVIAL_ALTERNATIVES = 4;
    public static final int DEFAULT_MAX_TRIVIAL_SEQUENCE_ELEMENTS = 3;
    public static final int DEFAULT_MAX_INLINE_PASSES = 64;

    public static final ConverterConfig DEFAULT = new ConverterConfig(
        DEFAULT_MAX_TRIVIAL_ALTERNATIVES,
        DEFAULT_MAX_TRIVIAL_SEQUENCE_ELEMENTS,
        true,
        DEFAULT_MAX_INLINE_PASSES
    );

    public ConverterConfig withoutInlining() {
        return new ConverterConfig(maxTrivialAlternatives, maxTrivialSequenceElements, false, maxInlinePasses);
    }
}
