package org.pragmatica.y2e.io;

/**
 * Named text input.
 *
 * @param name name the text was read from, used in error reports
 * @param text full content
 */
public record Resource(String name, String text) {
    public static Resource of(String name, String text) {
        return new Resource(name, text);
    }
}
