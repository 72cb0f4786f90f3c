package org.pragmatica.y2e.combinator;

import io.vavr.control.Either;
import io.vavr.control.Option;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Backtracking parser over a sequence of symbols.
 *
 * <p>Parsers are pure: the input is an immutable cursor and no state is shared between runs.
 * Alternation backtracks only over failures that consumed no input; use {@link #attempt()}
 * to make a consuming failure recoverable.
 *
 * @param <S> symbol type
 * @param <T> value type
 */
@FunctionalInterface
public interface Parser<S, T> {

    ParseResult<S, T> parse(Input<S> input);

    /**
     * Run parser and return either the failure or the parsed value.
     */
    default Either<ParseResult.Failure<S, T>, T> run(Input<S> input) {
        var result = parse(input);
        if (result instanceof ParseResult.Success<S, T> success) {
            return Either.right(success.value());
        }
        return Either.left((ParseResult.Failure<S, T>) result);
    }

    // === Sequencing ===

    default <U> Parser<S, U> map(Function<? super T, ? extends U> mapper) {
        return input -> {
            var result = parse(input);
            if (result instanceof ParseResult.Success<S, T> success) {
                return ParseResult.success(mapper.apply(success.value()), success.rest(), success.consumed());
            }
            return ((ParseResult.Failure<S, T>) result).retype();
        };
    }

    /**
     * Sequence with a parser chosen from this parser's value. Keeps whatever the continuation keeps.
     */
    default <U> Parser<S, U> flatMap(Function<? super T, Parser<S, U>> next) {
        return input -> {
            var result = parse(input);
            if (result instanceof ParseResult.Success<S, T> success) {
                return next.apply(success.value())
                           .parse(success.rest())
                           .afterConsuming(success.consumed());
            }
            return ((ParseResult.Failure<S, T>) result).retype();
        };
    }

    /**
     * Sequence, keeping the result of {@code next}.
     */
    default <U> Parser<S, U> then(Parser<S, U> next) {
        return flatMap(ignored -> next);
    }

    /**
     * Sequence, keeping the result of this parser.
     */
    default <U> Parser<S, T> skip(Parser<S, U> next) {
        return flatMap(value -> next.map(ignored -> value));
    }

    // === Choice ===

    /**
     * Ordered choice. {@code other} is tried only if this parser failed without consuming input.
     */
    default Parser<S, T> or(Parser<S, T> other) {
        return input -> {
            var left = parse(input);
            if (left.isSuccess() || left.consumed()) {
                return left;
            }
            var right = other.parse(input);
            if (right.isSuccess() || right.consumed()) {
                return right;
            }
            return ((ParseResult.Failure<S, T>) left).merge((ParseResult.Failure<S, T>) right);
        };
    }

    /**
     * Failure of this parser no longer counts as committed, so enclosing alternatives are tried.
     */
    default Parser<S, T> attempt() {
        return input -> {
            var result = parse(input);
            if (result instanceof ParseResult.Failure<S, T> failure) {
                return failure.uncommitted();
            }
            return result;
        };
    }

    /**
     * Replace the expectation of an uncommitted failure with the given label.
     */
    default Parser<S, T> label(String expected) {
        return input -> {
            var result = parse(input);
            if (result.isFailure() && !result.consumed()) {
                return ParseResult.failure(input, expected);
            }
            return result;
        };
    }

    // === Repetition ===

    default Parser<S, List<T>> many() {
        return input -> {
            var values = new ArrayList<T>();
            var current = input;
            var consumed = false;
            while (true) {
                var result = parse(current);
                if (result instanceof ParseResult.Failure<S, T> failure) {
                    if (failure.consumed()) {
                        return failure.retype();
                    }
                    break;
                }
                var success = (ParseResult.Success<S, T>) result;
                values.add(success.value());
                current = success.rest();
                if (!success.consumed()) {
                    break;
                }
                consumed = true;
            }
            return ParseResult.success(Collections.unmodifiableList(values), current, consumed);
        };
    }

    default Parser<S, List<T>> many1() {
        return flatMap(first -> many().map(rest -> prepend(first, rest)));
    }

    default Parser<S, Option<T>> optional() {
        return this.<Option<T>>map(Option::some)
                   .or(Parsers.success(Option.none()));
    }

    /**
     * One or more occurrences separated by {@code delimiter}.
     */
    default <D> Parser<S, List<T>> sepBy1(Parser<S, D> delimiter) {
        return flatMap(first -> delimiter.then(this)
                                         .many()
                                         .map(rest -> prepend(first, rest)));
    }

    /**
     * Repeat this parser until {@code end} matches; the values before {@code end} are kept.
     */
    default <E> Parser<S, List<T>> until(Parser<S, E> end) {
        return input -> {
            var values = new ArrayList<T>();
            var current = input;
            var consumed = false;
            while (true) {
                var terminator = end.parse(current);
                if (terminator instanceof ParseResult.Success<S, E> success) {
                    return ParseResult.success(Collections.unmodifiableList(values),
                                               success.rest(),
                                               consumed || success.consumed());
                }
                if (terminator.consumed()) {
                    return ((ParseResult.Failure<S, E>) terminator).<List<T>>retype();
                }
                var result = parse(current);
                if (result.isFailure() || !result.consumed()) {
                    return ((ParseResult.Failure<S, E>) terminator).<List<T>>retype()
                                                                   .afterConsuming(consumed);
                }
                var success = (ParseResult.Success<S, T>) result;
                values.add(success.value());
                current = success.rest();
                consumed = consumed || success.consumed();
            }
        };
    }

    private static <T> List<T> prepend(T first, List<T> rest) {
        var all = new ArrayList<T>(rest.size() + 1);
        all.add(first);
        all.addAll(rest);
        return Collections.unmodifiableList(all);
    }
}
