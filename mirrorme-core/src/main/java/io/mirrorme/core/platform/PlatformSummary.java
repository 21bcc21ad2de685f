package io.mirrorme.core.platform;

import io.mirrorme.core.distribution.Distribution;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record PlatformSummary(
    Platform platform,
    int interactionCount,
    Distribution sentiment,
    Distribution political,
    List<ChannelCount> topChannels,
    Map<String, Integer> engagement
) {
    public PlatformSummary {
        Objects.requireNonNull(platform, "platform must not be null");
        topChannels = topChannels == null ? List.of() : List.copyOf(topChannels);
        engagement = engagement == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(engagement));
    }

    public int engagement(String kind) {
        return engagement.getOrDefault(kind, 0);
    }
}
