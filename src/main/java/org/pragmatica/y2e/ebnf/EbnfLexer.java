package org.pragmatica.y2e.ebnf;

import io.vavr.control.Option;
import org.pragmatica.y2e.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the supplementary EBNF notation.
 *
 * <p>The token list always ends with {@link EbnfToken.Eof} or, if scanning hit a fault,
 * with a single {@link EbnfToken.Error}. There is no resynchronization after an error.
 */
public final class EbnfLexer {
    private static final int DEFAULT_TOKEN_CAPACITY = 32;
    private static final int MAX_EXCERPT = 20;

    private final String input;
    private int pos;
    private int line;
    private int column;

    private EbnfLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<EbnfToken> tokenize(String input) {
        return new EbnfLexer(input).tokenizeAll();
    }

    private List<EbnfToken> tokenizeAll() {
        var tokens = new ArrayList<EbnfToken>();
        while (true) {
            var commentError = skipWhitespaceAndComments();
            if (commentError.isDefined()) {
                tokens.add(commentError.get());
                return tokens;
            }
            if (isAtEnd()) {
                tokens.add(new EbnfToken.Eof(currentLocation()));
                return tokens;
            }
            var token = nextToken();
            tokens.add(token);
            if (token instanceof EbnfToken.Error) {
                return tokens;
            }
        }
    }

    private EbnfToken nextToken() {
        var start = currentLocation();
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        if (c == '\'' || c == '"') {
            return scanLiteral(start);
        }
        if (c == '[') {
            return scanCharClass(start);
        }
        return scanOperator(start);
    }

    private EbnfToken scanIdentifier(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return new EbnfToken.Identifier(start, sb.toString());
    }

    private EbnfToken scanLiteral(SourceLocation start) {
        char quote = advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        sb.append(quote);
        while (!isAtEnd() && peek() != quote && peek() != '\n') {
            if (peek() == '\\' && pos + 1 < input.length() && input.charAt(pos + 1) != '\n') {
                sb.append(advance());
            }
            sb.append(advance());
        }
        if (isAtEnd() || peek() != quote) {
            return error(start, "Unterminated literal");
        }
        sb.append(advance());
        return new EbnfToken.Literal(start, sb.toString());
    }

    private EbnfToken scanCharClass(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        sb.append(advance());
        while (!isAtEnd() && peek() != ']' && peek() != '\n') {
            if (peek() == '\\' && pos + 1 < input.length() && input.charAt(pos + 1) != '\n') {
                sb.append(advance());
            }
            sb.append(advance());
        }
        if (isAtEnd() || peek() != ']') {
            return error(start, "Unterminated character class");
        }
        sb.append(advance());
        return new EbnfToken.CharClass(start, sb.toString());
    }

    private EbnfToken scanOperator(SourceLocation start) {
        if (input.startsWith("::=", pos)) {
            advance();
            advance();
            advance();
            return new EbnfToken.Define(start);
        }
        char c = peek();
        var quantifier = Ebnf.Quantifier.fromSymbol(c);
        if (quantifier.isDefined()) {
            advance();
            return new EbnfToken.Suffix(start, quantifier.get());
        }
        return switch (c) {
            case '|' -> single(new EbnfToken.Bar(start));
            case '(' -> single(new EbnfToken.LParen(start));
            case ')' -> single(new EbnfToken.RParen(start));
            case ';' -> single(new EbnfToken.Semicolon(start));
            default -> error(start, "Unexpected character");
        };
    }

    private EbnfToken single(EbnfToken token) {
        advance();
        return token;
    }

    /**
     * Skip whitespace and block comments. Yields an error token for an unterminated comment.
     */
    private Option<EbnfToken> skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (input.startsWith("/*", pos)) {
                var start = currentLocation();
                int end = input.indexOf("*/", pos + 2);
                if (end < 0) {
                    return Option.some(error(start, "Unterminated comment"));
                }
                while (pos < end + 2) {
                    advance();
                }
            } else {
                break;
            }
        }
        return Option.none();
    }

    private EbnfToken error(SourceLocation start, String reason) {
        int from = start.offset();
        int to = Math.min(input.length(), from + MAX_EXCERPT);
        var excerpt = input.substring(from, to);
        int newline = excerpt.indexOf('\n');
        if (newline >= 0) {
            excerpt = excerpt.substring(0, newline);
        }
        return new EbnfToken.Error(start, reason, excerpt);
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9') || c == '.';
    }
}
