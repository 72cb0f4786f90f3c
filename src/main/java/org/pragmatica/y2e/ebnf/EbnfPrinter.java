package org.pragmatica.y2e.ebnf;

/**
 * Renders EBNF expressions as text.
 *
 * <p>A child is parenthesized iff its precedence is lower than its context requires:
 * alternatives need at least a sequence, sequence elements at least a quantified
 * expression, and a quantified expression an atom.
 */
public final class EbnfPrinter {
    private EbnfPrinter() {}

    public static String render(Ebnf expression) {
        var sb = new StringBuilder();
        render(expression, Ebnf.ALTERNATION, sb);
        return sb.toString();
    }

    /**
     * Render a definition as one line: {@code name ::= body}.
     */
    public static String render(Definition definition) {
        var body = render(definition.body());
        return body.isEmpty()
               ? definition.name() + " ::="
               : definition.name() + " ::= " + body;
    }

    private static void render(Ebnf expression, int required, StringBuilder sb) {
        var parenthesize = expression.precedence() < required;
        if (parenthesize) {
            sb.append('(');
        }
        if (expression instanceof Ebnf.Alternation alternation) {
            var first = true;
            for (var alternative : alternation.alternatives()) {
                if (!first) {
                    sb.append('|');
                }
                render(alternative, Ebnf.SEQUENCE, sb);
                first = false;
            }
        } else if (expression instanceof Ebnf.Sequence sequence) {
            var first = true;
            for (var element : sequence.elements()) {
                if (!first) {
                    sb.append(' ');
                }
                render(element, Ebnf.QUANTIFIED, sb);
                first = false;
            }
        } else if (expression instanceof Ebnf.Quantified quantified) {
            render(quantified.expression(), Ebnf.ATOMIC, sb);
            sb.append(quantified.quantifier()
                                .symbol());
        } else if (expression instanceof Ebnf.NonTerminal nonTerminal) {
            sb.append(nonTerminal.name());
        } else if (expression instanceof Ebnf.Terminal terminal) {
            sb.append(terminal.text());
        }
        if (parenthesize) {
            sb.append(')');
        }
    }
}
