package io.mirrorme.core.platform;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Optional;

/**
 * Per-platform summaries. A platform is absent when none of the records fall into its bucket.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlatformBehavior(PlatformSummary twitter, PlatformSummary youtube) {
    private static final PlatformBehavior NONE = new PlatformBehavior(null, null);

    public static PlatformBehavior none() {
        return NONE;
    }

    public Optional<PlatformSummary> twitterSummary() {
        return Optional.ofNullable(twitter);
    }

    public Optional<PlatformSummary> youtubeSummary() {
        return Optional.ofNullable(youtube);
    }
}
