package org.pragmatica.y2e.combinator;

import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Primitive parsers the combinators in {@link Parser} are built from.
 */
public final class Parsers {
    private Parsers() {}

    /**
     * Always succeeds with the given value, consuming nothing.
     */
    public static <S, T> Parser<S, T> success(T value) {
        return input -> ParseResult.success(value, input, false);
    }

    /**
     * Consume one symbol matching the predicate.
     */
    public static <S> Parser<S, S> satisfy(Predicate<? super S> predicate, String expected) {
        return input -> {
            if (input.atEnd() || !predicate.test(input.current())) {
                return ParseResult.failure(input, expected);
            }
            return ParseResult.success(input.current(), input.advance(), true);
        };
    }

    /**
     * Consume any single symbol.
     */
    public static <S> Parser<S, S> any(String expected) {
        return satisfy(symbol -> true, expected);
    }

    /**
     * Consume one symbol equal to the given one.
     */
    public static <S> Parser<S, S> symbol(S expected, String label) {
        return satisfy(expected::equals, label);
    }

    /**
     * Match literal text as a whole. Partial matches consume nothing.
     */
    public static Parser<Character, String> literal(String text) {
        var expected = "'" + text + "'";
        return input -> {
            var current = input;
            for (int i = 0; i < text.length(); i++) {
                if (current.atEnd() || current.current() != text.charAt(i)) {
                    return ParseResult.failure(input, expected);
                }
                current = current.advance();
            }
            return ParseResult.success(text, current, !text.isEmpty());
        };
    }

    /**
     * Succeeds, consuming nothing, only when {@code parser} does not match here.
     */
    public static <S, T> Parser<S, Boolean> notFollowedBy(Parser<S, T> parser, String expected) {
        return input -> parser.parse(input)
                              .isSuccess()
                        ? ParseResult.failure(input, expected)
                        : ParseResult.success(Boolean.TRUE, input, false);
    }

    /**
     * Succeeds only at end of input.
     */
    public static <S> Parser<S, Boolean> endOfInput() {
        return input -> input.atEnd()
                        ? ParseResult.success(Boolean.TRUE, input, false)
                        : ParseResult.failure(input, "end of input");
    }

    /**
     * Defer construction of a parser, for recursive grammars.
     */
    public static <S, T> Parser<S, T> lazy(Supplier<Parser<S, T>> supplier) {
        return input -> supplier.get()
                                .parse(input);
    }
}
