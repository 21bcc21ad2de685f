package io.mirrorme.core.perception;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dispatches perceivers to their strategies. Every {@link PerceiverType} has exactly one strategy.
 */
public final class PerceptionSimulator {
    private final Map<PerceiverType, PerceptionStrategy> strategies;

    public PerceptionSimulator() {
        this(List.of(
            new AdvertiserPerception(),
            new ContentFeederPerception(),
            new DataBrokerPerception(),
            new AiSystemPerception(),
            new RecruiterPerception(),
            new RomanticPartnerPerception(),
            new ColleaguePerception(),
            new FamilyMemberPerception(),
            new GeneralPerception()
        ));
    }

    public PerceptionSimulator(List<PerceptionStrategy> strategies) {
        Map<PerceiverType, PerceptionStrategy> table = new EnumMap<>(PerceiverType.class);
        for (PerceptionStrategy strategy : strategies) {
            table.put(strategy.type(), strategy);
        }
        for (PerceiverType type : PerceiverType.values()) {
            if (!table.containsKey(type)) {
                throw new IllegalArgumentException("No perception strategy for " + type.id());
            }
        }
        this.strategies = table;
    }

    public PerceptionResult simulate(PerceiverType type, PerceptionInputs inputs) {
        Objects.requireNonNull(type, "type must not be null");
        return strategies.get(type).evaluate(inputs);
    }

    public PerceptionResult simulate(String perceiverName, PerceptionInputs inputs) {
        return simulate(PerceiverType.fromName(perceiverName), inputs);
    }
}
