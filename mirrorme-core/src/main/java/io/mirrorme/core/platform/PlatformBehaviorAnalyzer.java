package io.mirrorme.core.platform;

import io.mirrorme.core.distribution.DistributionAnalyzer;
import io.mirrorme.core.model.BehaviorRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits records into the Twitter/X and YouTube buckets and summarizes each.
 *
 * <p>The buckets are not exclusive: a record with a Twitter author and a video id lands in both.
 */
public final class PlatformBehaviorAnalyzer {
    static final int TOP_CHANNEL_LIMIT = 5;

    public PlatformBehavior analyze(List<BehaviorRecord> records) {
        if (records == null || records.isEmpty()) {
            return PlatformBehavior.none();
        }
        List<BehaviorRecord> twitter = new ArrayList<>();
        List<BehaviorRecord> youtube = new ArrayList<>();
        for (BehaviorRecord record : records) {
            if (isTwitter(record)) {
                twitter.add(record);
            }
            if (record.isYoutube() || record.hasVideo()) {
                youtube.add(record);
            }
        }
        return new PlatformBehavior(
            twitter.isEmpty() ? null : summarizeTwitter(twitter),
            youtube.isEmpty() ? null : summarizeYoutube(youtube)
        );
    }

    private PlatformSummary summarizeTwitter(List<BehaviorRecord> records) {
        Map<String, Integer> engagement = new LinkedHashMap<>();
        engagement.put("views", countType(records, "tweet_view"));
        engagement.put("likes", countType(records, "tweet_like"));
        engagement.put("retweets", countType(records, "tweet_retweet"));
        engagement.put("compositions", countType(records, "tweet_compose"));
        return new PlatformSummary(
            Platform.TWITTER,
            records.size(),
            DistributionAnalyzer.SENTIMENT.analyze(records),
            DistributionAnalyzer.POLITICAL_TILT.analyze(records),
            List.of(),
            engagement
        );
    }

    private PlatformSummary summarizeYoutube(List<BehaviorRecord> records) {
        Map<String, Integer> engagement = new LinkedHashMap<>();
        engagement.put("video_watches", countType(records, "youtube_video_watch"));
        engagement.put("comment_views", countType(records, "youtube_comment_view"));
        return new PlatformSummary(
            Platform.YOUTUBE,
            records.size(),
            DistributionAnalyzer.SENTIMENT.analyze(records),
            DistributionAnalyzer.POLITICAL_TILT.analyze(records),
            topChannels(records),
            engagement
        );
    }

    private List<ChannelCount> topChannels(List<BehaviorRecord> records) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (BehaviorRecord record : records) {
            if (record.channel() != null && !record.channel().isBlank()) {
                counts.merge(record.channel(), 1, Integer::sum);
            }
        }
        List<ChannelCount> ranked = new ArrayList<>();
        counts.forEach((channel, count) -> ranked.add(new ChannelCount(channel, count)));
        ranked.sort(Comparator.comparingInt(ChannelCount::count).reversed());
        return ranked.subList(0, Math.min(TOP_CHANNEL_LIMIT, ranked.size()));
    }

    private static boolean isTwitter(BehaviorRecord record) {
        String author = record.author();
        if (author != null && (author.contains("twitter.com") || author.contains("x.com"))) {
            return true;
        }
        return record.isTweet();
    }

    private static int countType(List<BehaviorRecord> records, String behaviorType) {
        int count = 0;
        for (BehaviorRecord record : records) {
            if (behaviorType.equals(record.behaviorType())) {
                count++;
            }
        }
        return count;
    }
}
