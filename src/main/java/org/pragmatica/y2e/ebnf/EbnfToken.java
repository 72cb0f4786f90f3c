package org.pragmatica.y2e.ebnf;

import org.pragmatica.y2e.tree.SourceLocation;

/**
 * Token types for the supplementary EBNF notation.
 */
public sealed interface EbnfToken {
    SourceLocation location();

    // Names and opaque terminal text
    record Identifier(SourceLocation location, String name) implements EbnfToken {}

    // 'c' or "text", quotes included
    record Literal(SourceLocation location, String text) implements EbnfToken {}

    // [a-z], brackets included
    record CharClass(SourceLocation location, String text) implements EbnfToken {}

    // ::=
    record Define(SourceLocation location) implements EbnfToken {}

    // |
    record Bar(SourceLocation location) implements EbnfToken {}

    // (
    record LParen(SourceLocation location) implements EbnfToken {}

    // )
    record RParen(SourceLocation location) implements EbnfToken {}

    // ? * +
    record Suffix(SourceLocation location, Ebnf.Quantifier quantifier) implements EbnfToken {}

    // ;
    record Semicolon(SourceLocation location) implements EbnfToken {}

    // Special
    record Eof(SourceLocation location) implements EbnfToken {}

    record Error(SourceLocation location, String reason, String excerpt) implements EbnfToken {}

    /**
     * Short human readable description used in error messages.
     */
    static String describe(EbnfToken token) {
        if (token instanceof Identifier identifier) {
            return "identifier '" + identifier.name() + "'";
        }
        if (token instanceof Literal literal) {
            return "literal " + literal.text();
        }
        if (token instanceof CharClass charClass) {
            return "character class " + charClass.text();
        }
        if (token instanceof Define) {
            return "'::='";
        }
        if (token instanceof Bar) {
            return "'|'";
        }
        if (token instanceof LParen) {
            return "'('";
        }
        if (token instanceof RParen) {
            return "')'";
        }
        if (token instanceof Suffix suffix) {
            return "'" + suffix.quantifier()
                               .symbol() + "'";
        }
        if (token instanceof Semicolon) {
            return "';'";
        }
        if (token instanceof Error error) {
            return "'" + error.excerpt() + "'";
        }
        return "end of input";
    }
}
