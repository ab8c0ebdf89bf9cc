package org.pragmatica.hoa.consumer;

import io.vavr.control.Option;
import org.pragmatica.hoa.tree.AccNameInfo;
import org.pragmatica.hoa.tree.AcceptanceCondition;
import org.pragmatica.hoa.tree.BooleanExpression;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Consumer that writes every event back out as HOA text.
 * Expressions are printed fully parenthesized.
 */
public final class PrintingConsumer implements HoaConsumer {

    private static final Pattern BARE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");

    private final Appendable out;

    public PrintingConsumer(Appendable out) {
        this.out = out;
    }

    @Override
    public void notifyHeaderStart(String version) {
        line("HOA: " + version);
    }

    @Override
    public void setNumberOfStates(int count) {
        line("States: " + count);
    }

    @Override
    public void addStartStates(List<Integer> states) {
        line("Start: " + join(states, " "));
    }

    @Override
    public void setAps(List<String> names) {
        line("AP: " + names.size() + (names.isEmpty() ? "" : " " + quoted(names)));
    }

    @Override
    public void addAlias(String name, BooleanExpression expression) {
        line("Alias: @" + name + " " + expression);
    }

    @Override
    public void setAcceptanceCondition(int setCount, AcceptanceCondition condition) {
        line("Acceptance: " + setCount + " " + condition);
    }

    @Override
    public void provideAcceptanceName(String name, List<AccNameInfo> extraInfo) {
        line("acc-name: " + name + (extraInfo.isEmpty() ? "" : " " + join(extraInfo, " ")));
    }

    @Override
    public void setTool(List<String> info) {
        line("tool: " + quoted(info));
    }

    @Override
    public void setName(String name) {
        line("name: \"" + name + "\"");
    }

    @Override
    public void addProperties(List<String> properties) {
        line("properties: " + properties.stream()
                                        .map(PrintingConsumer::property)
                                        .collect(Collectors.joining(" ")));
    }

    @Override
    public void notifyBodyStart() {
        line("--BODY--");
    }

    @Override
    public void addState(int number,
                         Option<String> name,
                         Option<BooleanExpression> label,
                         Option<List<Integer>> accSignature) {
        var sb = new StringBuilder("State: ");
        label.forEach(expression -> sb.append("[").append(expression).append("] "));
        sb.append(number);
        name.forEach(text -> sb.append(" \"").append(text).append("\""));
        accSignature.forEach(sets -> sb.append(" ").append(signature(sets)));
        line(sb.toString());
    }

    @Override
    public void addEdgeWithLabel(int state,
                                 BooleanExpression label,
                                 List<Integer> targets,
                                 Option<List<Integer>> accSignature) {
        line("  [" + label + "] " + edgeTail(targets, accSignature));
    }

    @Override
    public void addEdgeImplicit(int state, List<Integer> targets, Option<List<Integer>> accSignature) {
        line("  " + edgeTail(targets, accSignature));
    }

    @Override
    public void notifyEndOfState(int state) {
    }

    @Override
    public void notifyEnd() {
        line("--END--");
    }

    @Override
    public void notifyAbort() {
        line("--ABORT--");
    }

    private static String edgeTail(List<Integer> targets, Option<List<Integer>> accSignature) {
        return join(targets, " & ") + accSignature.map(sets -> " " + signature(sets)).getOrElse("");
    }

    private static String signature(List<Integer> sets) {
        return "{" + join(sets, " ") + "}";
    }

    private static String quoted(List<String> values) {
        return values.stream()
                     .map(value -> "\"" + value + "\"")
                     .collect(Collectors.joining(" "));
    }

    /**
     * Bare identifiers stay bare, anything else is quoted. {@code t} and {@code f} would read back as literals.
     */
    private static String property(String value) {
        return BARE_IDENTIFIER.matcher(value).matches() && !value.equals("t") && !value.equals("f")
               ? value
               : "\"" + value + "\"";
    }

    private static String join(List<?> values, String separator) {
        return values.stream()
                     .map(String::valueOf)
                     .collect(Collectors.joining(separator));
    }

    private void line(String text) {
        try {
            out.append(text).append('\n');
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
