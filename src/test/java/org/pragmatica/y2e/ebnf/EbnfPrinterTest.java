package org.pragmatica.y2e.ebnf;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.y2e.ebnf.Ebnf.*;

class EbnfPrinterTest {

    @Test
    void render_alternationOfSequences_needsNoParentheses() {
        var expression = alternation(sequence(nonTerminal("a"), terminal("'+'")), nonTerminal("b"));

        assertEquals("a '+'|b", EbnfPrinter.render(expression));
    }

    @Test
    void render_alternationInSequence_isParenthesized() {
        var expression = sequence(nonTerminal("item"),
                                  alternation(terminal("','"), terminal("';'")),
                                  nonTerminal("item"));

        assertEquals("item (','|';') item", EbnfPrinter.render(expression));
    }

    @Test
    void render_quantifiedSequence_isParenthesized() {
        assertEquals("('a' start)?", EbnfPrinter.render(optional(sequence(terminal("'a'"), nonTerminal("start")))));
        assertEquals("x*", EbnfPrinter.render(zeroOrMore(nonTerminal("x"))));
        assertEquals("(x|y)+", EbnfPrinter.render(oneOrMore(alternation(nonTerminal("x"), nonTerminal("y")))));
    }

    @Test
    void render_quantifiedInsideSequence_keepsSuffix() {
        var expression = sequence(nonTerminal("a"), optional(nonTerminal("b")), zeroOrMore(terminal("[0-9]")));

        assertEquals("a b? [0-9]*", EbnfPrinter.render(expression));
    }

    @Test
    void render_definition_usesDefineOperator() {
        assertEquals("sep ::= ','|';'",
                     EbnfPrinter.render(new Definition("sep", alternation(terminal("','"), terminal("';'")))));
        assertEquals("nothing ::=", new Definition("nothing", empty()).toString());
    }

    @Test
    void render_thenParse_yieldsSameTree() {
        var samples = new String[]{
            "a (b|c)* d",
            "('x' y)?|z+",
            "'(' (arg (',' arg)*)? ')'",
            "[a-z] [a-z0-9_]*",
            "((a b)|c) d"
        };

        for (var sample : samples) {
            var tree = EbnfParser.parseExpression(sample).get();
            var reparsed = EbnfParser.parseExpression(EbnfPrinter.render(tree)).get();
            assertEquals(tree, reparsed, sample);
        }
    }

    @Test
    void render_converterOutputLine_canBeReadBack() {
        var definition = new Definition("list",
                                        sequence(nonTerminal("item"),
                                                 zeroOrMore(sequence(terminal("','"), nonTerminal("item")))));

        var reparsed = EbnfParser.parse(definition.toString()).get();

        assertEquals(List.of(definition), reparsed);
    }
}
