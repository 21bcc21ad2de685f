package io.mirrorme.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * @param windowDays trailing window applied to every analysis
 * @param zone zone used for calendar days and hour-of-day buckets
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisSettings(
    @JsonAlias({"window_days", "days_back"}) int windowDays,
    @JsonAlias({"include_sensitive"}) boolean includeSensitive,
    String zone,
    @JsonAlias({"max_content_samples"}) int maxContentSamples,
    @JsonAlias({"max_content_length"}) int maxContentLength
) {

    public static AnalysisSettings defaults() {
        return new AnalysisSettings(30, false, "UTC", 50, 280);
    }

    public AnalysisSettings withWindowDays(int days) {
        return new AnalysisSettings(days, includeSensitive, zone, maxContentSamples, maxContentLength);
    }

    public AnalysisSettings withIncludeSensitive(boolean include) {
        return new AnalysisSettings(windowDays, include, zone, maxContentSamples, maxContentLength);
    }

    /**
     * Configured zone, or UTC when blank or unknown.
     */
    @JsonIgnore
    public ZoneId zoneId() {
        if (zone == null || zone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            return ZoneOffset.UTC;
        }
    }
}
