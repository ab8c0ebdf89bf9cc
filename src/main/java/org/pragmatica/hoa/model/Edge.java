package org.pragmatica.hoa.model;

import io.vavr.control.Option;
import org.pragmatica.hoa.tree.BooleanExpression;

import java.util.List;

/**
 * Edge of a state. Implicit edges carry no label.
 */
public record Edge(Option<BooleanExpression> label, List<Integer> targets, Option<List<Integer>> accSignature) {

    public static Edge labelled(BooleanExpression label, List<Integer> targets, Option<List<Integer>> accSignature) {
        return new Edge(Option.some(label), List.copyOf(targets), accSignature.map(List::copyOf));
    }

    public static Edge implicit(List<Integer> targets, Option<List<Integer>> accSignature) {
        return new Edge(Option.none(), List.copyOf(targets), accSignature.map(List::copyOf));
    }

    public boolean isImplicit() {
        return label.isEmpty();
    }

    /**
     * More than one target means a universal (AND) successor.
     */
    public boolean isUniversal() {
        return targets.size() > 1;
    }
}
