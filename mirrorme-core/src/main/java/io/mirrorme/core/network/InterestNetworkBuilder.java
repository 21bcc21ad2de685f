package io.mirrorme.core.network;

import io.mirrorme.core.topic.Topic;
import io.mirrorme.core.topic.TopicCounts;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class InterestNetworkBuilder {
    private static final double MAX_NODE_SIZE = 10.0;

    public InterestNetwork build(TopicCounts counts) {
        if (counts == null || counts.isEmpty()) {
            return InterestNetwork.empty();
        }
        int total = counts.total();
        List<InterestNode> nodes = new ArrayList<>();
        for (Map.Entry<Topic, Integer> entry : counts.entries().entrySet()) {
            nodes.add(toNode(entry.getKey(), entry.getValue(), total));
        }
        return new InterestNetwork(nodes, List.of(), total);
    }

    private InterestNode toNode(Topic topic, int count, int total) {
        return new InterestNode(
            topic.id(),
            topic.displayLabel(),
            (double) count / total,
            Math.min(count / 5.0, MAX_NODE_SIZE)
        );
    }
}
