package org.pragmatica.y2e.yacc;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.y2e.combinator.Input;
import org.pragmatica.y2e.combinator.ParseResult;
import org.pragmatica.y2e.combinator.Parser;
import org.pragmatica.y2e.combinator.Parsers;
import org.pragmatica.y2e.error.ConversionError;
import org.pragmatica.y2e.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for the rules section of a YACC grammar, working directly on characters.
 *
 * <pre>
 * grammar    <- skip production* EOF
 * production <- Identifier (':' / '::=' / '=') rule ('|' rule)* ';'
 * rule       <- (Literal / Identifier / Action / '%prec' Symbol / '%empty')*
 * </pre>
 *
 * Whitespace, block comments and line comments are skipped after every token.
 * Actions are skipped by a brace-balancing scanner; only the grammar shape is kept.
 * Unterminated literals and comments and characters that cannot start any token are
 * reported as lexical errors, everything else as syntax errors.
 */
public final class YaccParser {
    private static final String UNTERMINATED_LITERAL = "Unterminated literal";
    private static final String UNTERMINATED_COMMENT = "Unterminated comment";
    private static final String UNEXPECTED_CHARACTER = "Unexpected character";
    private static final int MAX_EXCERPT = 20;

    private static final Parser<Character, Boolean> WHITESPACE =
        ignore(Parsers.<Character>satisfy(c -> Character.isWhitespace(c), "whitespace"));

    private static final Parser<Character, Boolean> BLOCK_COMMENT =
        ignore(lexical(Parsers.literal("/*")
                              .then(Parsers.<Character>any("'*/'")
                                           .until(Parsers.literal("*/"))),
                       UNTERMINATED_COMMENT));

    private static final Parser<Character, Boolean> LINE_COMMENT =
        ignore(Parsers.literal("//")
                      .then(Parsers.<Character>satisfy(c -> c != '\n', "comment")
                                   .many()));

    private static final Parser<Character, List<Boolean>> SKIP =
        WHITESPACE.or(BLOCK_COMMENT)
                  .or(LINE_COMMENT)
                  .many();

    private static final Parser<Character, String> IDENTIFIER =
        Parsers.<Character>satisfy(YaccParser::isIdentifierStart, "identifier")
               .flatMap(first -> Parsers.<Character>satisfy(YaccParser::isIdentifierPart, "identifier")
                                        .many()
                                        .map(rest -> join(first, rest)));

    private static final Parser<Character, String> QUOTED =
        quoted('\'').or(quoted('"'));

    private static final Parser<Character, String> ACTION = YaccParser::scanAction;

    private static final Parser<Character, Boolean> PREC =
        ignore(lexeme(Parsers.literal("%prec")).then(lexeme(IDENTIFIER.or(QUOTED))));

    private static final Parser<Character, Boolean> EMPTY_MARKER =
        ignore(lexeme(Parsers.literal("%empty")));

    private static final Parser<Character, YaccElement> ELEMENT =
        lexeme(QUOTED).<YaccElement>map(YaccElement.Terminal::new)
                      .or(lexeme(IDENTIFIER).map(YaccElement.NonTerminal::new));

    private static final Parser<Character, Option<YaccElement>> ITEM =
        ELEMENT.<Option<YaccElement>>map(Option::some)
               .or(lexeme(ACTION).map(action -> Option.<YaccElement>none()))
               .or(PREC.map(prec -> Option.<YaccElement>none()))
               .or(EMPTY_MARKER.map(empty -> Option.<YaccElement>none()));

    private static final Parser<Character, YaccRule> RULE =
        ITEM.many()
            .map(YaccParser::toRule);

    private static final Parser<Character, String> SEPARATOR =
        lexeme(Parsers.literal("::=")
                      .or(Parsers.literal(":"))
                      .or(Parsers.literal("="))).label("':', '::=' or '='");

    private static final Parser<Character, Character> BAR =
        lexeme(Parsers.symbol('|', "'|'"));

    private static final Parser<Character, Character> TERMINATOR =
        lexeme(Parsers.symbol(';', "';'")).label("'|' or ';'");

    private static final Parser<Character, YaccProduction> PRODUCTION =
        lexeme(IDENTIFIER).label("production name")
                          .flatMap(name -> SEPARATOR.then(RULE.sepBy1(BAR))
                                                    .skip(TERMINATOR)
                                                    .map(rules -> new YaccProduction(name, rules)));

    private static final Parser<Character, List<YaccProduction>> GRAMMAR =
        SKIP.then(PRODUCTION.many())
            .skip(Parsers.<Character>endOfInput().label("production"));

    private YaccParser() {}

    /**
     * Parse a complete YACC file, looking only at the rules section between the {@code %%} markers.
     */
    public static Either<ConversionError, YaccGrammar> parse(String source) {
        return YaccSection.extract(source)
                          .flatMap(section -> parseSection(source, section));
    }

    /**
     * Parse rules text with no surrounding declarations.
     */
    public static Either<ConversionError, YaccGrammar> parseRules(String rules) {
        return parseSection(rules, new YaccSection(rules, 0));
    }

    private static Either<ConversionError, YaccGrammar> parseSection(String source, YaccSection section) {
        return GRAMMAR.run(Input.of(section.text()))
                      .<ConversionError>mapLeft(failure -> syntaxError(source, section, failure))
                      .flatMap(YaccGrammar::of);
    }

    private static ConversionError syntaxError(String source,
                                               YaccSection section,
                                               ParseResult.Failure<Character, ?> failure) {
        var text = section.text();
        int position = failure.position();
        var location = SourceLocation.of(source, section.offset() + position);
        if (failure.expected().equals(UNTERMINATED_LITERAL) || failure.expected().equals(UNTERMINATED_COMMENT)) {
            return new ConversionError.LexicalError(location, failure.expected(), excerpt(text, position));
        }
        if (position < text.length() && !isTokenStart(text.charAt(position))) {
            return new ConversionError.LexicalError(location, UNEXPECTED_CHARACTER, excerpt(text, position));
        }
        return new ConversionError.SyntaxError(location, describe(text, position), failure.expected());
    }

    private static String excerpt(String text, int position) {
        var excerpt = text.substring(position, Math.min(text.length(), position + MAX_EXCERPT));
        int newline = excerpt.indexOf('\n');
        return newline >= 0
               ? excerpt.substring(0, newline)
               : excerpt;
    }

    private static String describe(String text, int position) {
        if (position >= text.length()) {
            return "end of input";
        }
        char c = text.charAt(position);
        return switch (c) {
            case '\n' -> "end of line";
            case '\t' -> "tab";
            default -> "'" + c + "'";
        };
    }

    // === Lexical building blocks ===

    private static <T> Parser<Character, T> lexeme(Parser<Character, T> parser) {
        return parser.skip(Parsers.lazy(() -> SKIP));
    }

    /**
     * A failure after {@code parser} consumed input is reported at its start with {@code reason}.
     */
    private static <T> Parser<Character, T> lexical(Parser<Character, T> parser, String reason) {
        return input -> {
            var result = parser.parse(input);
            if (result.isFailure() && result.consumed()) {
                return new ParseResult.Failure<>(input.position(), reason, true);
            }
            return result;
        };
    }

    private static <T> Parser<Character, Boolean> ignore(Parser<Character, T> parser) {
        return parser.map(value -> Boolean.TRUE);
    }

    private static Parser<Character, String> quoted(char quote) {
        var escape = Parsers.symbol('\\', "escape")
                            .then(Parsers.<Character>satisfy(c -> c != '\n', "escaped character"))
                            .map(c -> "\\" + c);
        var plain = Parsers.<Character>satisfy(c -> c != quote && c != '\\' && c != '\n', "literal character")
                           .map(String::valueOf);
        return lexical(Parsers.symbol(quote, "literal")
                              .then(escape.or(plain)
                                          .many())
                              .flatMap(body -> Parsers.symbol(quote, "closing quote")
                                                      .map(closing -> quote + String.join("", body) + quote)),
                       UNTERMINATED_LITERAL);
    }

    /**
     * Skip a brace-delimited action. Nested braces are counted; braces inside quotes and comments are not.
     */
    private static ParseResult<Character, String> scanAction(Input<Character> input) {
        if (input.atEnd() || input.current() != '{') {
            return ParseResult.failure(input, "action block");
        }
        var text = new StringBuilder();
        var current = input;
        int depth = 0;
        char quote = 0;
        while (!current.atEnd()) {
            char c = current.current();
            text.append(c);
            current = current.advance();
            if (quote != 0) {
                if (c == '\\' && !current.atEnd()) {
                    text.append(current.current());
                    current = current.advance();
                } else if (c == quote || c == '\n') {
                    quote = 0;
                }
            } else if (c == '/' && !current.atEnd() && current.current() == '*') {
                text.append('*');
                current = current.advance();
                char previous = 0;
                while (!current.atEnd() && !(previous == '*' && current.current() == '/')) {
                    previous = current.current();
                    text.append(previous);
                    current = current.advance();
                }
                if (!current.atEnd()) {
                    text.append('/');
                    current = current.advance();
                }
            } else if (c == '/' && !current.atEnd() && current.current() == '/') {
                while (!current.atEnd() && current.current() != '\n') {
                    text.append(current.current());
                    current = current.advance();
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return ParseResult.success(text.toString(), current, true);
                }
            }
        }
        return new ParseResult.Failure<>(input.position(), "'}' closing the action block", true);
    }

    private static YaccRule toRule(List<Option<YaccElement>> items) {
        var elements = new ArrayList<YaccElement>();
        items.forEach(item -> item.forEach(elements::add));
        return new YaccRule(elements);
    }

    private static String join(Character first, List<Character> rest) {
        var sb = new StringBuilder(rest.size() + 1);
        sb.append(first.charValue());
        rest.forEach(sb::append);
        return sb.toString();
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isTokenStart(char c) {
        return Character.isWhitespace(c) || isIdentifierStart(c) || "'\"{%/:=|;".indexOf(c) >= 0;
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9') || c == '.';
    }
}
