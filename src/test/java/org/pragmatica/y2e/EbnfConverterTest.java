package org.pragmatica.y2e;

import org.junit.jupiter.api.Test;
import org.pragmatica.y2e.convert.ConverterConfig;
import org.pragmatica.y2e.ebnf.Definition;
import org.pragmatica.y2e.error.ConversionError;
import org.pragmatica.y2e.io.Resource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class EbnfConverterTest {

    static final List<String> EXPR_OUTPUT = List.of(
        "addop ::= '+'|'-'",
        "mulop ::= '*'|'/'",
        "expr ::= expr ('+'|'-') term|term",
        "term ::= term ('*'|'/') factor|factor",
        "factor ::= [0-9]+|[a-zA-Z_] [a-zA-Z0-9_]*|'(' expr ')'|'-' factor",
        "terminator ::= ';'|'\\n'",
        "statement ::= expr (';'|'\\n')",
        "statements ::= (statements expr (';'|'\\n'))?",
        "program ::= statements",
        "NUMBER ::= [0-9]+",
        "IDENT ::= [a-zA-Z_] [a-zA-Z0-9_]*",
        "NEWLINE ::= '\\n'",
        "");

    static String fixture(String name) {
        try (var stream = EbnfConverterTest.class.getResourceAsStream("/grammars/" + name)) {
            assertNotNull(stream, "missing fixture " + name);
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Test
    void convert_grammarOnly_succeeds() {
        var result = EbnfConverter.convert("""
            %%
            start : 'a' start | ;
            %%
            """);

        assertTrue(result.isRight());
        assertEquals(List.of("start ::= ('a' start)?", ""), EbnfConverter.render(result.get()));
    }

    @Test
    void convert_withSupplement_inlinesTrivialDefinitions() {
        var result = EbnfConverter.convert("""
            %%
            list : item sep item ;
            """, """
            sep ::= ',' | ';'
            """);

        assertEquals(List.of("list ::= item (','|';') item", "sep ::= ','|';'", ""),
                     EbnfConverter.render(result.get()));
    }

    @Test
    void convert_expressionGrammarFixture_producesExpectedLines() {
        var result = EbnfConverter.convert(Resource.of("expr.y", fixture("expr.y")),
                                           Resource.of("expr.ebnf", fixture("expr.ebnf")),
                                           ConverterConfig.DEFAULT);

        assertTrue(result.isRight(), () -> result.getLeft().message());
        assertEquals(EXPR_OUTPUT, EbnfConverter.render(result.get()));
    }

    @Test
    void convert_errorInGrammar_namesResource() {
        var result = EbnfConverter.convert(Resource.of("broken.y", "%%\na : 'x' | | ;\n"),
                                           Resource.of("extra.ebnf", ""),
                                           ConverterConfig.DEFAULT);

        var error = assertInstanceOf(ConversionError.InResource.class, result.getLeft());
        assertEquals("broken.y", error.resource());
        assertEquals(new ConversionError.TooManyEmptyRules("a", 2), error.cause());
        assertThat(error.message()).startsWith("broken.y: ");
    }

    @Test
    void convert_errorInSupplement_namesResource() {
        var result = EbnfConverter.convert(Resource.of("ok.y", "%%\na : b ;\n"),
                                           Resource.of("broken.ebnf", "b ::= 'x'*+"),
                                           ConverterConfig.DEFAULT);

        var error = assertInstanceOf(ConversionError.InResource.class, result.getLeft());
        assertEquals("broken.ebnf", error.resource());
        assertInstanceOf(ConversionError.DoubleQuantification.class, error.cause());
    }

    @Test
    void builder_appliesConfiguration() {
        var result = EbnfConverter.builder("%%\nlist : item sep item ;\n")
                                  .supplement("sep ::= ',' | ';' | ':'")
                                  .maxTrivialAlternatives(2)
                                  .build();

        assertEquals("list ::= item sep item", result.get().get(0).toString());
    }

    @Test
    void builder_inliningDisabled_keepsAllReferences() {
        var result = EbnfConverter.builder("%%\na : b ;\nb : 'x' ;\n")
                                  .inlining(false)
                                  .build();

        assertThat(result.get()).extracting(Definition::toString)
                                .containsExactly("b ::= 'x'", "a ::= b");
    }

    @Test
    void render_emptyList_isSingleBlankLine() {
        assertEquals(List.of(""), EbnfConverter.render(List.of()));
    }
}
