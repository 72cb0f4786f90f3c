package org.pragmatica.y2e.io;

import java.io.PrintStream;
import java.util.List;

/**
 * Receives the output lines of a run.
 */
@FunctionalInterface
public interface LineWriter {

    void write(List<String> lines);

    static LineWriter to(PrintStream stream) {
        return lines -> {
            lines.forEach(stream::println);
            stream.flush();
        };
    }
}
