package io.mirrorme.core.perception;

import io.mirrorme.core.model.BehaviorRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Selects the content snippets that may leave the process in a prompt: newest first,
 * truncated, capped in count, with e-mail addresses, phone numbers and IPv4 addresses masked.
 */
public final class ContentSampler {
    private static final Pattern EMAIL = Pattern.compile("(?i)([a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,})");
    private static final Pattern PHONE = Pattern.compile("(\\+\\d{1,2}\\s)?\\(?\\d{3}\\)?[\\s.-]\\d{3}[\\s.-]\\d{4}");
    private static final Pattern IPV4 = Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b");

    private final int maxSamples;
    private final int maxLength;

    public ContentSampler(int maxSamples, int maxLength) {
        if (maxSamples < 0 || maxLength <= 0) {
            throw new IllegalArgumentException("maxSamples must be >= 0 and maxLength > 0");
        }
        this.maxSamples = maxSamples;
        this.maxLength = maxLength;
    }

    public List<String> sample(List<BehaviorRecord> records) {
        List<BehaviorRecord> withContent = new ArrayList<>();
        for (BehaviorRecord record : records) {
            if (record.content() != null && !record.content().isBlank()) {
                withContent.add(record);
            }
        }
        withContent.sort(Comparator.comparing(BehaviorRecord::timestamp).reversed());

        List<String> samples = new ArrayList<>();
        for (BehaviorRecord record : withContent) {
            if (samples.size() >= maxSamples) {
                break;
            }
            samples.add(redact(truncate(record.content())));
        }
        return samples;
    }

    String redact(String input) {
        String out = EMAIL.matcher(input).replaceAll("[REDACTED_EMAIL]");
        out = PHONE.matcher(out).replaceAll("[REDACTED_PHONE]");
        return IPV4.matcher(out).replaceAll("[REDACTED_IP]");
    }

    private String truncate(String content) {
        return content.length() <= maxLength ? content : content.substring(0, maxLength);
    }
}
