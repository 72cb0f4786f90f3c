package org.pragmatica.y2e.yacc;

import org.junit.jupiter.api.Test;
import org.pragmatica.y2e.error.ConversionError;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class YaccParserTest {

    private static YaccElement t(String literal) {
        return new YaccElement.Terminal(literal);
    }

    private static YaccElement n(String name) {
        return new YaccElement.NonTerminal(name);
    }

    @Test
    void parse_simpleProduction_succeeds() {
        var result = YaccParser.parse("""
            %%
            list : item ',' list
                 | item
                 ;
            %%
            """);

        assertTrue(result.isRight());
        var grammar = result.get();
        assertEquals(1, grammar.size());
        assertEquals(List.of(YaccRule.of(n("item"), t("','"), n("list")),
                             YaccRule.of(n("item"))),
                     grammar.productions().get("list"));
    }

    @Test
    void parse_allSeparators_accepted() {
        var result = YaccParser.parseRules("""
            a : 'x' ;
            b ::= 'y' ;
            c = "z" ;
            """);

        assertTrue(result.isRight());
        assertThat(result.get().productions()).containsOnlyKeys("a", "b", "c");
        assertEquals(List.of(YaccRule.of(t("\"z\""))), result.get().productions().get("c"));
    }

    @Test
    void parse_keepsProductionOrder() {
        var grammar = YaccParser.parseRules("z : ; a : z ; m : a ;").get();

        assertThat(grammar.productions().keySet()).containsExactly("z", "a", "m");
    }

    @Test
    void parse_commentsAreSkipped() {
        var result = YaccParser.parseRules("""
            /* leading
               comment */
            a : b /* inline */ c  // trailing
              | /* empty */
              ;
            """);

        assertEquals(List.of(YaccRule.of(n("b"), n("c")), YaccRule.EMPTY),
                     result.get().productions().get("a"));
    }

    @Test
    void parse_actionsAreSkipped() {
        var result = YaccParser.parseRules("""
            expr : expr '+' term { $$ = node('+', $1, $3); if (x) { y(); } }
                 | term { $$ = $1; /* } */ }
                 | '{' { puts("}"); } '}'
                 ;
            """);

        assertTrue(result.isRight(), () -> result.getLeft().message());
        assertEquals(List.of(YaccRule.of(n("expr"), t("'+'"), n("term")),
                             YaccRule.of(n("term")),
                             YaccRule.of(t("'{'"), t("'}'"))),
                     result.get().productions().get("expr"));
    }

    @Test
    void parse_unmatchedBraceInAction_fails() {
        var result = YaccParser.parseRules("a : b { if (x) { y(); } ;\n");

        assertTrue(result.isLeft());
        var error = assertInstanceOf(ConversionError.SyntaxError.class, result.getLeft());
        assertEquals("'}' closing the action block", error.expected());
        assertEquals(1, error.location().line());
        assertEquals(7, error.location().column());
    }

    @Test
    void parse_precAndEmptyMarkers_areIgnored() {
        var result = YaccParser.parseRules("""
            e : '-' e %prec UMINUS
              | %empty
              ;
            """);

        assertEquals(List.of(YaccRule.of(t("'-'"), n("e")), YaccRule.EMPTY),
                     result.get().productions().get("e"));
    }

    @Test
    void parse_duplicateName_fails() {
        var result = YaccParser.parseRules("""
            expr : 'a' ;
            term : 'b' ;
            expr : 'c' ;
            """);

        assertEquals(new ConversionError.DuplicateName("expr"), result.getLeft());
    }

    @Test
    void parse_twoEmptyAlternatives_fails() {
        var result = YaccParser.parseRules("opt : | 'x' | ;");

        assertEquals(new ConversionError.TooManyEmptyRules("opt", 2), result.getLeft());
    }

    @Test
    void parse_missingTerminator_reportsLocation() {
        var result = YaccParser.parse("""
            %token A
            %%
            a : b
            c : d ;
            """);

        var error = assertInstanceOf(ConversionError.SyntaxError.class, result.getLeft());
        assertEquals("'|' or ';'", error.expected());
        assertEquals("':'", error.found());
        assertEquals(4, error.location().line());
        assertEquals(3, error.location().column());
    }

    @Test
    void parse_unterminatedComment_isLexicalError() {
        var result = YaccParser.parseRules("a : 'x' ; /* never closed");

        var error = assertInstanceOf(ConversionError.LexicalError.class, result.getLeft());
        assertEquals("Unterminated comment", error.reason());
        assertEquals("/* never closed", error.excerpt());
        assertEquals(11, error.location().column());
    }

    @Test
    void parse_unexpectedCharacterBetweenProductions_isLexicalError() {
        var result = YaccParser.parseRules("a : 'x' ;\n# junk");

        var error = assertInstanceOf(ConversionError.LexicalError.class, result.getLeft());
        assertEquals("Unexpected character", error.reason());
        assertEquals("# junk", error.excerpt());
        assertEquals(2, error.location().line());
    }

    @Test
    void parse_unexpectedCharacterInRule_isLexicalError() {
        var result = YaccParser.parseRules("a : @ ;");

        var error = assertInstanceOf(ConversionError.LexicalError.class, result.getLeft());
        assertEquals("Unexpected character", error.reason());
        assertEquals("@ ;", error.excerpt());
        assertEquals(1, error.location().line());
        assertEquals(5, error.location().column());
    }

    @Test
    void parse_unterminatedLiteral_isLexicalError() {
        var result = YaccParser.parseRules("a : 'x ;\nb : 'y' ;");

        var error = assertInstanceOf(ConversionError.LexicalError.class, result.getLeft());
        assertEquals("Unterminated literal", error.reason());
        assertEquals("'x ;", error.excerpt());
        assertEquals(1, error.location().line());
        assertEquals(5, error.location().column());
    }

    @Test
    void parse_unterminatedLiteralInSection_reportsPositionInFile() {
        var result = YaccParser.parse("""
            %token X
            %%
            a : "x ;
            %%
            """);

        var error = assertInstanceOf(ConversionError.LexicalError.class, result.getLeft());
        assertEquals(3, error.location().line());
        assertEquals(5, error.location().column());
    }

    @Test
    void parse_noSection_fails() {
        assertInstanceOf(ConversionError.MissingSection.class, YaccParser.parse("a : 'x' ;").getLeft());
    }
}
