package io.mirrorme.core.network;

import java.util.List;

/**
 * Interest graph over the topic taxonomy. Only nodes are derived; edges are always empty.
 */
public record InterestNetwork(List<InterestNode> nodes, List<InterestEdge> edges, int totalInteractions) {
    public InterestNetwork {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public static InterestNetwork empty() {
        return new InterestNetwork(List.of(), List.of(), 0);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public record InterestEdge(String source, String target, double weight) {
    }
}
