package org.pragmatica.y2e.combinator;

import java.util.List;

/**
 * Immutable cursor over a sequence of input symbols.
 *
 * @param <S> symbol type
 */
public interface Input<S> {

    /**
     * Index of the current symbol, 0-based.
     */
    int position();

    boolean atEnd();

    /**
     * Symbol under the cursor. Must not be called when {@link #atEnd()}.
     */
    S current();

    /**
     * Cursor moved one symbol forward.
     */
    Input<S> advance();

    static Input<Character> of(CharSequence text) {
        return new TextInput(text, 0);
    }

    static <S> Input<S> of(List<S> symbols) {
        return new SymbolInput<>(List.copyOf(symbols), 0);
    }

    /**
     * Character input backed by text.
     */
    record TextInput(CharSequence text, int position) implements Input<Character> {
        @Override
        public boolean atEnd() {
            return position >= text.length();
        }

        @Override
        public Character current() {
            return text.charAt(position);
        }

        @Override
        public Input<Character> advance() {
            return new TextInput(text, position + 1);
        }
    }

    /**
     * Input backed by a list of symbols, usually tokens.
     */
    record SymbolInput<S>(List<S> symbols, int position) implements Input<S> {
        @Override
        public boolean atEnd() {
            return position >= symbols.size();
        }

        @Override
        public S current() {
            return symbols.get(position);
        }

        @Override
        public Input<S> advance() {
            return new SymbolInput<>(symbols, position + 1);
        }
    }
}
