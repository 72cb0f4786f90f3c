package org.pragmatica.y2e.yacc;

import io.vavr.control.Either;
import org.pragmatica.y2e.error.ConversionError;

/**
 * The rules section of a YACC file: the text strictly between the first and second marker line.
 * Declarations before and the trailer after are ignored. Without a second marker the section
 * runs to the end of the text.
 *
 * @param text   section text
 * @param offset offset of the section within the whole file
 */
public record YaccSection(String text, int offset) {
    public static final String MARKER = "%%";

    public static Either<ConversionError, YaccSection> extract(String source) {
        int first = findMarkerLine(source, 0);
        if (first < 0) {
            return Either.left(new ConversionError.MissingSection(MARKER));
        }
        int start = lineEnd(source, first);
        int second = findMarkerLine(source, start);
        int end = second < 0
                  ? source.length()
                  : second;
        return Either.right(new YaccSection(source.substring(start, end), start));
    }

    /**
     * Offset of the first line at or after {@code from} consisting of the marker (trailing blanks allowed).
     */
    private static int findMarkerLine(String source, int from) {
        int lineStart = from;
        while (lineStart < source.length()) {
            int next = lineEnd(source, lineStart);
            var line = source.substring(lineStart, next)
                             .stripTrailing();
            if (line.equals(MARKER)) {
                return lineStart;
            }
            lineStart = next;
        }
        return -1;
    }

    /**
     * Offset just past the line terminator of the line starting at {@code lineStart}.
     */
    private static int lineEnd(String source, int lineStart) {
        int newline = source.indexOf('\n', lineStart);
        return newline < 0
               ? source.length()
               : newline + 1;
    }
}
