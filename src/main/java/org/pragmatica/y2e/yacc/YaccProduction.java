package org.pragmatica.y2e.yacc;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A YACC production: name and its alternative rules.
 */
public record YaccProduction(String name, List<YaccRule> rules) {
    public YaccProduction {
        rules = List.copyOf(rules);
    }

    public int emptyRules() {
        return (int) rules.stream()
                          .filter(YaccRule::isEmpty)
                          .count();
    }

    /**
     * Names referenced directly by any alternative, in order of first appearance.
     */
    public Set<String> references() {
        var names = new LinkedHashSet<String>();
        for (var rule : rules) {
            for (var element : rule.elements()) {
                if (element instanceof YaccElement.NonTerminal nonTerminal) {
                    names.add(nonTerminal.name());
                }
            }
        }
        return names;
    }
}
