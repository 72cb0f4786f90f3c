package org.pragmatica.y2e.ebnf;

import io.vavr.control.Option;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * EBNF expression - the closed set of node kinds a definition body is built from.
 *
 * <p>Values are immutable and compare structurally. Every transformation produces a new tree.
 */
public sealed interface Ebnf {

    int ALTERNATION = 0;
    int SEQUENCE = 1;
    int QUANTIFIED = 2;
    int ATOMIC = 3;

    /**
     * Display precedence, used only to decide parenthesization on output.
     */
    int precedence();

    default boolean isAtomic() {
        return precedence() == ATOMIC;
    }

    /**
     * Alternatives: e1 | e2 | e3
     */
    record Alternation(List<Ebnf> alternatives) implements Ebnf {
        public Alternation {
            alternatives = List.copyOf(alternatives);
        }

        @Override
        public int precedence() {
            return ALTERNATION;
        }
    }

    /**
     * Sequence: e1 e2 e3. The empty sequence stands for "nothing".
     */
    record Sequence(List<Ebnf> elements) implements Ebnf {
        public static final Sequence EMPTY = new Sequence(List.of());

        public Sequence {
            elements = List.copyOf(elements);
        }

        public boolean isEmpty() {
            return elements.isEmpty();
        }

        @Override
        public int precedence() {
            return SEQUENCE;
        }
    }

    /**
     * Quantified expression: e?, e*, e+
     */
    record Quantified(Ebnf expression, Quantifier quantifier) implements Ebnf {
        @Override
        public int precedence() {
            return QUANTIFIED;
        }
    }

    /**
     * Reference to a named definition.
     */
    record NonTerminal(String name) implements Ebnf {
        @Override
        public int precedence() {
            return ATOMIC;
        }
    }

    /**
     * Terminal text, kept exactly as written (quotes and brackets included).
     */
    record Terminal(String text) implements Ebnf {
        @Override
        public int precedence() {
            return ATOMIC;
        }
    }

    enum Quantifier {
        ZERO_OR_ONE('?'),
        ZERO_OR_MANY('*'),
        ONE_OR_MANY('+');

        private final char symbol;

        Quantifier(char symbol) {
            this.symbol = symbol;
        }

        public char symbol() {
            return symbol;
        }

        /**
         * Whether the quantified expression also matches nothing.
         */
        public boolean allowsEmpty() {
            return this != ONE_OR_MANY;
        }

        public static Option<Quantifier> fromSymbol(char symbol) {
            for (var quantifier : values()) {
                if (quantifier.symbol == symbol) {
                    return Option.some(quantifier);
                }
            }
            return Option.none();
        }
    }

    // === Factories ===

    static Ebnf alternation(Ebnf... alternatives) {
        return new Alternation(List.of(alternatives));
    }

    static Ebnf sequence(Ebnf... elements) {
        return new Sequence(List.of(elements));
    }

    static Ebnf empty() {
        return Sequence.EMPTY;
    }

    static Ebnf optional(Ebnf expression) {
        return new Quantified(expression, Quantifier.ZERO_OR_ONE);
    }

    static Ebnf zeroOrMore(Ebnf expression) {
        return new Quantified(expression, Quantifier.ZERO_OR_MANY);
    }

    static Ebnf oneOrMore(Ebnf expression) {
        return new Quantified(expression, Quantifier.ONE_OR_MANY);
    }

    static Ebnf nonTerminal(String name) {
        return new NonTerminal(name);
    }

    static Ebnf terminal(String text) {
        return new Terminal(text);
    }

    /**
     * Names of all definitions referenced anywhere inside the expression, in order of first appearance.
     */
    static Set<String> references(Ebnf expression) {
        var names = new LinkedHashSet<String>();
        collectReferences(expression, names);
        return names;
    }

    private static void collectReferences(Ebnf expression, Set<String> names) {
        if (expression instanceof Alternation alternation) {
            alternation.alternatives()
                       .forEach(alternative -> collectReferences(alternative, names));
        } else if (expression instanceof Sequence sequence) {
            sequence.elements()
                    .forEach(element -> collectReferences(element, names));
        } else if (expression instanceof Quantified quantified) {
            collectReferences(quantified.expression(), names);
        } else if (expression instanceof NonTerminal nonTerminal) {
            names.add(nonTerminal.name());
        }
        // Terminals reference nothing
    }
}
