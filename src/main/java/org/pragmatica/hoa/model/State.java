package org.pragmatica.hoa.model;

import io.vavr.control.Option;
import org.pragmatica.hoa.tree.BooleanExpression;

import java.util.List;

/**
 * State definition from the body, with the edges listed under it.
 */
public record State(
    int number,
    Option<String> name,
    Option<BooleanExpression> label,
    Option<List<Integer>> accSignature,
    List<Edge> edges
) {
    public State {
        accSignature = accSignature.map(List::copyOf);
        edges = List.copyOf(edges);
    }
}
