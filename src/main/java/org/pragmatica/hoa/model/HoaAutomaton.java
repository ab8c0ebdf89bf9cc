package org.pragmatica.hoa.model;

import io.vavr.control.Option;
import org.pragmatica.hoa.tree.AccNameInfo;
import org.pragmatica.hoa.tree.AcceptanceCondition;
import org.pragmatica.hoa.tree.BooleanExpression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Automaton as declared by a HOA document. Aliases are kept as declared, not resolved.
 */
public record HoaAutomaton(
    String version,
    Option<Integer> numberOfStates,
    List<List<Integer>> startStates,
    List<String> aps,
    Map<String, BooleanExpression> aliases,
    Option<Acceptance> acceptance,
    Option<AcceptanceName> acceptanceName,
    List<String> tool,
    Option<String> name,
    List<String> properties,
    List<State> states
) {
    /**
     * Declared acceptance condition with its number of acceptance sets.
     */
    public record Acceptance(int setCount, AcceptanceCondition condition) {}

    /**
     * {@code acc-name:} header.
     */
    public record AcceptanceName(String name, List<AccNameInfo> extraInfo) {}

    public HoaAutomaton {
        startStates = startStates.stream().map(List::copyOf).toList();
        aps = List.copyOf(aps);
        aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        tool = List.copyOf(tool);
        properties = List.copyOf(properties);
        states = List.copyOf(states);
    }

    public Option<BooleanExpression> alias(String aliasName) {
        return Option.of(aliases.get(aliasName));
    }

    public Option<State> state(int number) {
        return Option.ofOptional(states.stream()
                                       .filter(state -> state.number() == number)
                                       .findFirst());
    }

    public boolean hasProperty(String property) {
        return properties.contains(property);
    }
}
