package io.mirrorme.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One labeled unit of user activity as handed over by the external store.
 *
 * <p>Records are read-only input. Filtering by user, time window and the two privacy flags
 * happens at the boundary (see {@link io.mirrorme.core.ingest.RecordFilter}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BehaviorRecord(
    @JsonAlias({"user_id"}) String userId,
    String source,
    @JsonAlias({"behavior_type"}) String behaviorType,
    String category,
    List<String> keywords,
    String content,
    Sentiment sentiment,
    @JsonAlias({"political_tilt"}) PoliticalTilt politicalTilt,
    String author,
    @JsonAlias({"video_id"}) String videoId,
    String channel,
    Instant timestamp,
    @JsonProperty("is_sensitive") @JsonAlias({"sensitive"}) boolean sensitive,
    @JsonAlias({"include_in_analysis"}) Boolean includeInAnalysis
) {

    public BehaviorRecord {
        Objects.requireNonNull(behaviorType, "behaviorType must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        includeInAnalysis = includeInAnalysis == null ? Boolean.TRUE : includeInAnalysis;
    }

    public boolean hasVideo() {
        return videoId != null && !videoId.isBlank();
    }

    public boolean isSearch() {
        return "search".equals(behaviorType);
    }

    public boolean isTweet() {
        return behaviorType.startsWith("tweet_");
    }

    public boolean isYoutube() {
        return behaviorType.startsWith("youtube_");
    }

    /**
     * Every keyword of the given records, in record order.
     */
    public static List<String> keywordsOf(List<BehaviorRecord> records) {
        List<String> keywords = new ArrayList<>();
        for (BehaviorRecord record : records) {
            keywords.addAll(record.keywords());
        }
        return keywords;
    }
}
