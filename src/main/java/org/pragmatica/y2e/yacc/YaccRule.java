package org.pragmatica.y2e.yacc;

import java.util.List;

/**
 * One alternative of a production: an ordered, possibly empty list of elements.
 */
public record YaccRule(List<YaccElement> elements) {
    public static final YaccRule EMPTY = new YaccRule(List.of());

    public YaccRule {
        elements = List.copyOf(elements);
    }

    public static YaccRule of(YaccElement... elements) {
        return new YaccRule(List.of(elements));
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }
}
