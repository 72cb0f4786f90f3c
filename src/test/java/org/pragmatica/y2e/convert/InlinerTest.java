package org.pragmatica.y2e.convert;

import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;
import org.pragmatica.y2e.analysis.DependencyGraph;
import org.pragmatica.y2e.ebnf.Definition;
import org.pragmatica.y2e.ebnf.Ebnf;
import org.pragmatica.y2e.testsupport.LogCapture;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.y2e.ebnf.Ebnf.*;

class InlinerTest {

    private static final DependencyGraph GRAPH = DependencyGraph.of(Map.of(
        "sep", List.of(),
        "list", List.of("sep", "item"),
        "item", List.of(),
        "self", List.of("self"),
        "ping", List.of("pong"),
        "pong", List.of("ping")));

    private final Inliner inliner = Inliner.create(ConverterConfig.DEFAULT, GRAPH);

    @Test
    void isTrivial_smallAlternationOfAtoms() {
        assertTrue(inliner.isTrivial(new Definition("sep", alternation(terminal("','"), terminal("';'")))));
        assertTrue(inliner.isTrivial(new Definition("sep", alternation(terminal("'a'"), terminal("'b'"),
                                                                       terminal("'c'"), terminal("'d'")))));
        assertFalse(inliner.isTrivial(new Definition("sep", alternation(terminal("'a'"), terminal("'b'"),
                                                                        terminal("'c'"), terminal("'d'"),
                                                                        terminal("'e'")))));
    }

    @Test
    void isTrivial_alternationWithNonAtom_isNotTrivial() {
        var body = alternation(terminal("'a'"), sequence(terminal("'b'"), terminal("'c'")));

        assertFalse(inliner.isTrivial(new Definition("sep", body)));
    }

    @Test
    void isTrivial_shortSequence() {
        assertTrue(inliner.isTrivial(new Definition("item", sequence(terminal("'a'"), nonTerminal("x"), terminal("'b'")))));
        assertFalse(inliner.isTrivial(new Definition("item", sequence(terminal("'a'"), terminal("'b'"),
                                                                      terminal("'c'"), terminal("'d'")))));
    }

    @Test
    void isTrivial_sequenceOfTrivialParts() {
        var body = sequence(nonTerminal("x"),
                            alternation(terminal("'+'"), terminal("'-'")),
                            optional(nonTerminal("y")));

        assertTrue(inliner.isTrivial(new Definition("item", body)));
    }

    @Test
    void isTrivial_quantifiedAtomOnly() {
        assertTrue(inliner.isTrivial(new Definition("item", zeroOrMore(terminal("[0-9]")))));
        assertFalse(inliner.isTrivial(new Definition("item", zeroOrMore(sequence(terminal("'a'"), terminal("'b'"))))));
    }

    @Test
    void isTrivial_recursiveDefinition_isNever() {
        assertFalse(inliner.isTrivial(new Definition("self", alternation(terminal("'a'"), nonTerminal("self")))));
        assertFalse(inliner.isTrivial(new Definition("ping", nonTerminal("pong"))));
    }

    @Test
    void isTrivial_disabledInlining_isNever() {
        var disabled = Inliner.create(ConverterConfig.DEFAULT.withoutInlining(), GRAPH);

        assertFalse(disabled.isTrivial(new Definition("item", terminal("'x'"))));
    }

    @Test
    void inline_replacesReferenceByBody() {
        var body = sequence(nonTerminal("item"), nonTerminal("sep"), nonTerminal("item"));
        var trivial = Map.<String, Ebnf>of("sep", alternation(terminal("','"), terminal("';'")));

        var result = inliner.inline("list", body, trivial);

        assertEquals(sequence(nonTerminal("item"), alternation(terminal("','"), terminal("';'")), nonTerminal("item")),
                     result.get());
    }

    @Test
    void inline_renormalizesAfterSubstitution() {
        var body = alternation(sequence(nonTerminal("digits")), sequence());
        var trivial = Map.<String, Ebnf>of("digits", oneOrMore(terminal("[0-9]")));

        var result = inliner.inline("number", body, trivial);

        assertEquals(zeroOrMore(terminal("[0-9]")), result.get());
    }

    @Test
    void inline_reachesFixpointThroughTrivialBodies() {
        var trivial = Map.<String, Ebnf>of(
            "sign", alternation(terminal("'+'"), terminal("'-'")),
            "signed", sequence(nonTerminal("sign"), nonTerminal("digit")),
            "digit", terminal("[0-9]"));

        var result = inliner.inline("value", sequence(nonTerminal("signed"), terminal("';'")), trivial);

        assertEquals(sequence(alternation(terminal("'+'"), terminal("'-'")), terminal("[0-9]"), terminal("';'")),
                     result.get());
    }

    @Test
    void inline_neverReplacesOwnName() {
        var trivial = Map.<String, Ebnf>of("start", terminal("'x'"));

        var result = inliner.inline("start", sequence(terminal("'a'"), nonTerminal("start")), trivial);

        assertEquals(sequence(terminal("'a'"), nonTerminal("start")), result.get());
    }

    @Test
    void inline_quantifiedBodyUnderQuantifier_keepsReference() {
        var trivial = Map.<String, Ebnf>of("digits", oneOrMore(terminal("[0-9]")),
                                           "nothing", empty());

        var body = sequence(optional(nonTerminal("digits")), zeroOrMore(nonTerminal("nothing")));

        var result = inliner.inline("number", body, trivial);

        assertTrue(result.isRight());
        assertEquals(body, result.get());
    }

    @Test
    void inline_quantifiedBodyInsideRepeatedSequence_isReplaced() {
        var trivial = Map.<String, Ebnf>of("digits", oneOrMore(terminal("[0-9]")));

        var result = inliner.inline("list", zeroOrMore(sequence(nonTerminal("digits"), terminal("','"))), trivial);

        assertEquals(zeroOrMore(sequence(oneOrMore(terminal("[0-9]")), terminal("','"))), result.get());
    }

    @Test
    void inline_nestedTrivialBodiesUnderQuantifier_areAllReplaced() {
        var trivial = Map.<String, Ebnf>of(
            "opt", optional(terminal("'a'")),
            "pair", sequence(nonTerminal("opt"), terminal("'b'")),
            "pairs", zeroOrMore(nonTerminal("pair")));

        var result = inliner.inline("top", sequence(nonTerminal("pairs"), terminal("'c'")), trivial);

        assertEquals(sequence(zeroOrMore(sequence(optional(terminal("'a'")), terminal("'b'"))), terminal("'c'")),
                     result.get());
    }

    @Test
    void inline_emptyAlternativeUnderQuantifier_keepsReference() {
        var trivial = Map.<String, Ebnf>of("nothing", empty());
        var body = zeroOrMore(alternation(nonTerminal("nothing"), terminal("'y'")));

        var result = inliner.inline("list", body, trivial);

        assertEquals(body, result.get());
    }

    @Test
    void inline_atomicBodyUnderQuantifier_isReplaced() {
        var trivial = Map.<String, Ebnf>of("digit", terminal("[0-9]"));

        var result = inliner.inline("number", oneOrMore(nonTerminal("digit")), trivial);

        assertEquals(oneOrMore(terminal("[0-9]")), result.get());
    }

    @Test
    void inline_logsEachSubstitution() {
        var trivial = Map.<String, Ebnf>of("sep", terminal("','"));

        try (var capture = LogCapture.of(Inliner.class, Level.DEBUG)) {
            inliner.inline("list", sequence(nonTerminal("item"), nonTerminal("sep")), trivial);

            assertThat(capture.messages()).containsExactly("Inlining 'sep' into 'list'");
        }
    }
}
