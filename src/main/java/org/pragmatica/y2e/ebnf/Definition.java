package org.pragmatica.y2e.ebnf;

/**
 * A name bound to exactly one EBNF expression. Recursion is a property of the
 * {@link org.pragmatica.y2e.analysis.DependencyGraph} the definition belongs to.
 */
public record Definition(String name, Ebnf body) {

    @Override
    public String toString() {
        return EbnfPrinter.render(this);
    }
}
