package org.pragmatica.y2e.yacc;

/**
 * Symbol on the right-hand side of a YACC rule.
 */
public sealed interface YaccElement {

    /**
     * Quoted literal, kept with its quotes.
     */
    record Terminal(String literal) implements YaccElement {}

    /**
     * Bare identifier naming a production or token.
     */
    record NonTerminal(String name) implements YaccElement {}
}
