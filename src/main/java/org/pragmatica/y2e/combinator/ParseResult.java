package org.pragmatica.y2e.combinator;

/**
 * Result of running a parser - either success with a value or failure with an expectation.
 *
 * <p>Both variants record whether input was consumed. A failure after consumption is committed:
 * alternation does not try further alternatives past it.
 *
 * @param <S> symbol type
 * @param <T> value type
 */
public sealed interface ParseResult<S, T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Whether input was consumed before this result was produced.
     */
    boolean consumed();

    /**
     * Same result, marked as consumed when an earlier step already consumed input.
     */
    ParseResult<S, T> afterConsuming(boolean earlier);

    static <S, T> ParseResult<S, T> success(T value, Input<S> rest, boolean consumed) {
        return new Success<>(value, rest, consumed);
    }

    static <S, T> ParseResult<S, T> failure(Input<S> input, String expected) {
        return new Failure<>(input.position(), expected, false);
    }

    /**
     * Successful parse with value and remaining input.
     */
    record Success<S, T>(T value, Input<S> rest, boolean consumed) implements ParseResult<S, T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public ParseResult<S, T> afterConsuming(boolean earlier) {
            return earlier && !consumed
                   ? new Success<>(value, rest, true)
                   : this;
        }
    }

    /**
     * Failed parse - what was expected at which position.
     */
    record Failure<S, T>(int position, String expected, boolean consumed) implements ParseResult<S, T> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public ParseResult<S, T> afterConsuming(boolean earlier) {
            return earlier && !consumed
                   ? new Failure<>(position, expected, true)
                   : this;
        }

        public <U> Failure<S, U> retype() {
            return new Failure<>(position, expected, consumed);
        }

        public Failure<S, T> uncommitted() {
            return consumed
                   ? new Failure<>(position, expected, false)
                   : this;
        }

        /**
         * Combine with another failure: the furthest one wins, equal positions join their expectations.
         */
        public Failure<S, T> merge(Failure<S, T> other) {
            if (other.position > position) {
                return other;
            }
            if (other.position < position || expected.contains(other.expected)) {
                return this;
            }
            var joined = expected.isEmpty()
                         ? other.expected
                         : expected + " or " + other.expected;
            return new Failure<>(position, joined, consumed || other.consumed);
        }
    }
}
