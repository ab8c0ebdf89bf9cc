package org.pragmatica.hoa.consumer;

import io.vavr.control.Option;
import org.pragmatica.hoa.model.Edge;
import org.pragmatica.hoa.model.HoaAutomaton;
import org.pragmatica.hoa.model.State;
import org.pragmatica.hoa.tree.AccNameInfo;
import org.pragmatica.hoa.tree.AcceptanceCondition;
import org.pragmatica.hoa.tree.BooleanExpression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consumer that assembles a {@link HoaAutomaton} from parse events.
 * A builder instance is meant for a single parse.
 */
public final class AutomatonBuilder implements HoaConsumer {

    private Option<String> version = Option.none();
    private Option<Integer> numberOfStates = Option.none();
    private final List<List<Integer>> startStates = new ArrayList<>();
    private final List<String> aps = new ArrayList<>();
    private final Map<String, BooleanExpression> aliases = new LinkedHashMap<>();
    private Option<HoaAutomaton.Acceptance> acceptance = Option.none();
    private Option<HoaAutomaton.AcceptanceName> acceptanceName = Option.none();
    private final List<String> tool = new ArrayList<>();
    private Option<String> name = Option.none();
    private final List<String> properties = new ArrayList<>();
    private final List<State> states = new ArrayList<>();

    // State currently being defined
    private Option<OpenState> current = Option.none();

    private record OpenState(int number,
                             Option<String> name,
                             Option<BooleanExpression> label,
                             Option<List<Integer>> accSignature,
                             List<Edge> edges) {}

    @Override
    public void notifyHeaderStart(String headerVersion) {
        version = Option.some(headerVersion);
    }

    @Override
    public void setNumberOfStates(int count) {
        numberOfStates = Option.some(count);
    }

    @Override
    public void addStartStates(List<Integer> states) {
        startStates.add(List.copyOf(states));
    }

    @Override
    public void setAps(List<String> names) {
        aps.clear();
        aps.addAll(names);
    }

    @Override
    public void addAlias(String aliasName, BooleanExpression expression) {
        aliases.put(aliasName, expression);
    }

    @Override
    public void setAcceptanceCondition(int setCount, AcceptanceCondition condition) {
        acceptance = Option.some(new HoaAutomaton.Acceptance(setCount, condition));
    }

    @Override
    public void provideAcceptanceName(String accName, List<AccNameInfo> extraInfo) {
        acceptanceName = Option.some(new HoaAutomaton.AcceptanceName(accName, List.copyOf(extraInfo)));
    }

    @Override
    public void setTool(List<String> info) {
        tool.clear();
        tool.addAll(info);
    }

    @Override
    public void setName(String automatonName) {
        name = Option.some(automatonName);
    }

    @Override
    public void addProperties(List<String> props) {
        properties.addAll(props);
    }

    @Override
    public void addState(int number,
                         Option<String> stateName,
                         Option<BooleanExpression> label,
                         Option<List<Integer>> accSignature) {
        if (current.isDefined()) {
            throw new IllegalStateException("State " + current.get().number()
                                            + " is still open when state " + number + " starts");
        }
        current = Option.some(new OpenState(number, stateName, label, accSignature, new ArrayList<>()));
    }

    @Override
    public void addEdgeWithLabel(int state,
                                 BooleanExpression label,
                                 List<Integer> targets,
                                 Option<List<Integer>> accSignature) {
        openState(state).edges().add(Edge.labelled(label, targets, accSignature));
    }

    @Override
    public void addEdgeImplicit(int state, List<Integer> targets, Option<List<Integer>> accSignature) {
        openState(state).edges().add(Edge.implicit(targets, accSignature));
    }

    @Override
    public void notifyEndOfState(int state) {
        var open = openState(state);
        states.add(new State(open.number(), open.name(), open.label(), open.accSignature(), open.edges()));
        current = Option.none();
    }

    /**
     * Assemble the automaton from the events received so far.
     *
     * @throws IllegalStateException if no header was seen or a state is still open
     */
    public HoaAutomaton build() {
        if (version.isEmpty()) {
            throw new IllegalStateException("No HOA header received");
        }
        if (current.isDefined()) {
            throw new IllegalStateException("State " + current.get().number() + " was never finished");
        }
        return new HoaAutomaton(version.get(),
                                numberOfStates,
                                startStates,
                                aps,
                                aliases,
                                acceptance,
                                acceptanceName,
                                tool,
                                name,
                                properties,
                                states);
    }

    private OpenState openState(int state) {
        return current.filter(open -> open.number() == state)
                      .getOrElseThrow(() -> new IllegalStateException("State " + state + " is not open"));
    }
}
