package io.mirrorme.core.persona;

import io.mirrorme.core.model.BehaviorRecord;
import java.util.List;

public record EngagementPatterns(int searches, int socialInteractions, int videoConsumption, int totalSessions) {

    public static EngagementPatterns of(List<BehaviorRecord> records) {
        int searches = 0;
        int social = 0;
        int video = 0;
        for (BehaviorRecord record : records) {
            if (record.isSearch()) {
                searches++;
            }
            if (record.isTweet()) {
                social++;
            }
            if (record.isYoutube()) {
                video++;
            }
        }
        return new EngagementPatterns(searches, social, video, records.size());
    }
}
