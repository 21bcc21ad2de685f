package io.mirrorme.core.ingest;

import io.mirrorme.core.model.BehaviorRecord;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies the boundary contract to unfiltered records: one user, a trailing window, records excluded
 * from analysis dropped, and sensitive records dropped unless requested.
 */
public final class RecordFilter {
    private final Clock clock;

    public RecordFilter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param userId keep only this user's records; {@code null} keeps every user
     */
    public List<BehaviorRecord> apply(List<BehaviorRecord> records, String userId, int windowDays, boolean includeSensitive) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(windowDays));
        List<BehaviorRecord> kept = new ArrayList<>();
        for (BehaviorRecord record : records) {
            if (userId != null && !userId.equals(record.userId())) {
                continue;
            }
            if (record.timestamp().isBefore(cutoff)) {
                continue;
            }
            if (!Boolean.TRUE.equals(record.includeInAnalysis())) {
                continue;
            }
            if (record.sensitive() && !includeSensitive) {
                continue;
            }
            kept.add(record);
        }
        return kept;
    }
}
