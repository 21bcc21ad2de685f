package io.mirrorme.core.perception;

/**
 * Scores how one kind of observer would read the user's aggregates.
 */
public interface PerceptionStrategy {
    PerceiverType type();

    PerceptionResult evaluate(PerceptionInputs inputs);
}
