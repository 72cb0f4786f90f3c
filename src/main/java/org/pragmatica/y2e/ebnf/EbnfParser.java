package org.pragmatica.y2e.ebnf;

import io.vavr.control.Either;
import org.pragmatica.y2e.combinator.Input;
import org.pragmatica.y2e.combinator.ParseResult;
import org.pragmatica.y2e.combinator.Parser;
import org.pragmatica.y2e.combinator.Parsers;
import org.pragmatica.y2e.error.ConversionError;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Parser for the supplementary EBNF notation.
 *
 * <pre>
 * definitions <- definition* EOF
 * definition  <- Identifier '::=' alternation ';'?
 * alternation <- sequence ('|' sequence)*
 * sequence    <- quantified*
 * quantified  <- atom ('?' / '*' / '+')*
 * atom        <- Identifier !'::=' / Literal / CharClass / '(' alternation ')'
 * </pre>
 *
 * Every definition is normalized as soon as it is parsed.
 */
public final class EbnfParser {

    private static final Parser<EbnfToken, EbnfToken> DEFINE = token(EbnfToken.Define.class, "'::='");
    private static final Parser<EbnfToken, EbnfToken> BAR = token(EbnfToken.Bar.class, "'|'");
    private static final Parser<EbnfToken, EbnfToken> LPAREN = token(EbnfToken.LParen.class, "'('");
    private static final Parser<EbnfToken, EbnfToken> RPAREN = token(EbnfToken.RParen.class, "')'");
    private static final Parser<EbnfToken, EbnfToken> SEMICOLON = token(EbnfToken.Semicolon.class, "';'");
    private static final Parser<EbnfToken, EbnfToken> EOF = token(EbnfToken.Eof.class, "definition");

    private static final Parser<EbnfToken, String> NAME =
        token(EbnfToken.Identifier.class, "identifier").map(token -> ((EbnfToken.Identifier) token).name());

    private static final Parser<EbnfToken, Ebnf> REFERENCE =
        NAME.skip(Parsers.notFollowedBy(DEFINE, "reference"))
            .attempt()
            .map(Ebnf::nonTerminal);

    private static final Parser<EbnfToken, Ebnf> TERMINAL =
        Parsers.<EbnfToken>satisfy(token -> token instanceof EbnfToken.Literal || token instanceof EbnfToken.CharClass,
                                   "terminal")
               .map(EbnfParser::terminalText);

    private static final Parser<EbnfToken, Ebnf> GROUP =
        LPAREN.then(Parsers.lazy(EbnfParser::alternation))
              .skip(RPAREN);

    private static final Parser<EbnfToken, Ebnf> ATOM =
        REFERENCE.or(TERMINAL)
                 .or(GROUP)
                 .label("expression");

    private static final Parser<EbnfToken, Ebnf.Quantifier> SUFFIX =
        token(EbnfToken.Suffix.class, "quantifier").map(token -> ((EbnfToken.Suffix) token).quantifier());

    private static final Parser<EbnfToken, Ebnf> QUANTIFIED =
        ATOM.flatMap(atom -> SUFFIX.many()
                                   .map(quantifiers -> quantify(atom, quantifiers)));

    private static final Parser<EbnfToken, Ebnf> SEQUENCE =
        QUANTIFIED.many()
                  .map(Ebnf.Sequence::new);

    private static final Parser<EbnfToken, Ebnf> ALTERNATION =
        SEQUENCE.sepBy1(BAR)
                .map(Ebnf.Alternation::new);

    private static final Parser<EbnfToken, Definition> DEFINITION =
        NAME.skip(DEFINE)
            .flatMap(name -> ALTERNATION.skip(SEMICOLON.optional())
                                        .map(body -> new Definition(name, body)));

    private static final Parser<EbnfToken, List<Definition>> DEFINITIONS =
        DEFINITION.many()
                  .skip(EOF);

    private static final Parser<EbnfToken, Ebnf> EXPRESSION =
        ALTERNATION.skip(EOF.label("end of input"));

    private EbnfParser() {}

    /**
     * Parse a list of definitions. Names must be unique.
     */
    public static Either<ConversionError, List<Definition>> parse(String text) {
        return run(text, DEFINITIONS).flatMap(EbnfParser::normalizeAll);
    }

    /**
     * Parse a single definition body.
     */
    public static Either<ConversionError, Ebnf> parseExpression(String text) {
        return run(text, EXPRESSION).flatMap(Normalizer::normalize);
    }

    private static Parser<EbnfToken, Ebnf> alternation() {
        return ALTERNATION;
    }

    private static <T> Either<ConversionError, T> run(String text, Parser<EbnfToken, T> parser) {
        var tokens = EbnfLexer.tokenize(text);
        var last = tokens.get(tokens.size() - 1);
        if (last instanceof EbnfToken.Error error) {
            return Either.left(new ConversionError.LexicalError(error.location(), error.reason(), error.excerpt()));
        }
        return parser.run(Input.of(tokens))
                     .mapLeft(failure -> syntaxError(tokens, failure));
    }

    private static ConversionError syntaxError(List<EbnfToken> tokens, ParseResult.Failure<EbnfToken, ?> failure) {
        var token = tokens.get(Math.min(failure.position(), tokens.size() - 1));
        return new ConversionError.SyntaxError(token.location(), EbnfToken.describe(token), failure.expected());
    }

    private static Either<ConversionError, List<Definition>> normalizeAll(List<Definition> definitions) {
        var names = new HashSet<String>();
        var normalized = new ArrayList<Definition>(definitions.size());
        for (var definition : definitions) {
            if (!names.add(definition.name())) {
                return Either.left(new ConversionError.DuplicateName(definition.name()));
            }
            var result = Normalizer.normalize(definition);
            if (result.isLeft()) {
                return Either.left(result.getLeft());
            }
            normalized.add(result.get());
        }
        return Either.right(List.copyOf(normalized));
    }

    private static Ebnf quantify(Ebnf atom, List<Ebnf.Quantifier> quantifiers) {
        var expression = atom;
        for (var quantifier : quantifiers) {
            expression = new Ebnf.Quantified(expression, quantifier);
        }
        return expression;
    }

    private static Ebnf terminalText(EbnfToken token) {
        return token instanceof EbnfToken.Literal literal
               ? Ebnf.terminal(literal.text())
               : Ebnf.terminal(((EbnfToken.CharClass) token).text());
    }

    private static Parser<EbnfToken, EbnfToken> token(Class<? extends EbnfToken> type, String expected) {
        return Parsers.satisfy(type::isInstance, expected);
    }
}
