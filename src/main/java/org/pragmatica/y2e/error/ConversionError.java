package org.pragmatica.y2e.error;

import org.pragmatica.y2e.ebnf.Ebnf;
import org.pragmatica.y2e.ebnf.EbnfPrinter;
import org.pragmatica.y2e.tree.SourceLocation;

/**
 * Error produced while reading, parsing or converting a grammar. Every kind ends the run.
 */
public sealed interface ConversionError {

    String message();

    /**
     * Unrecognized character or malformed literal. Scanning stops here.
     */
    record LexicalError(SourceLocation location, String reason, String excerpt) implements ConversionError {
        @Override
        public String message() {
            return reason + " '" + excerpt + "' at " + location;
        }
    }

    /**
     * Input did not match the notation.
     */
    record SyntaxError(SourceLocation location, String found, String expected) implements ConversionError {
        @Override
        public String message() {
            return "Unexpected " + found + " at " + location + ", expected " + expected;
        }
    }

    /**
     * A name is bound by more than one production or definition.
     */
    record DuplicateName(String name) implements ConversionError {
        @Override
        public String message() {
            return "Duplicate definition of '" + name + "'";
        }
    }

    /**
     * A production has more than one empty alternative.
     */
    record TooManyEmptyRules(String production, int count) implements ConversionError {
        @Override
        public String message() {
            return "Production '" + production + "' has " + count + " empty alternatives, at most one is allowed";
        }
    }

    /**
     * A quantifier applied directly to a quantified expression.
     */
    record DoubleQuantification(Ebnf original, Ebnf partial) implements ConversionError {
        @Override
        public String message() {
            return "Illegal double quantification in " + EbnfPrinter.render(original)
                   + " (normalized so far: " + EbnfPrinter.render(partial) + ")";
        }
    }

    /**
     * The grammar section marker does not occur in the input.
     */
    record MissingSection(String marker) implements ConversionError {
        @Override
        public String message() {
            return "No grammar section: marker line '" + marker + "' not found";
        }
    }

    /**
     * A named resource could not be read or written.
     */
    record ResourceError(String resource, String reason) implements ConversionError {
        @Override
        public String message() {
            return "Cannot access '" + resource + "': " + reason;
        }
    }

    /**
     * An error attributed to the resource it was found in.
     */
    record InResource(String resource, ConversionError cause) implements ConversionError {
        @Override
        public String message() {
            return resource + ": " + cause.message();
        }
    }

    /**
     * Attribute an error to a resource.
     */
    static ConversionError in(String resource, ConversionError cause) {
        if (cause instanceof ResourceError || cause instanceof InResource) {
            return cause;
        }
        return new InResource(resource, cause);
    }
}
