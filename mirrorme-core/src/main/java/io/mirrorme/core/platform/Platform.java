package io.mirrorme.core.platform;

import com.fasterxml.jackson.annotation.JsonValue;
import io.mirrorme.core.model.BehaviorRecord;

/**
 * Activity platform a single record is attributed to.
 */
public enum Platform {
    TWITTER("twitter"),
    YOUTUBE("youtube"),
    INSTAGRAM("instagram"),
    SEARCH("search"),
    GENERAL_WEB("general_web"),
    OTHER("other");

    private final String id;

    Platform(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Title-cased id, e.g. {@code General_Web}.
     */
    public String displayLabel() {
        StringBuilder label = new StringBuilder(id.length());
        boolean upper = true;
        for (char c : id.toCharArray()) {
            label.append(upper ? Character.toUpperCase(c) : c);
            upper = !Character.isLetter(c);
        }
        return label.toString();
    }

    public static Platform of(BehaviorRecord record) {
        String type = record.behaviorType();
        if (type.startsWith("tweet_")) {
            return TWITTER;
        }
        if (type.startsWith("youtube_")) {
            return YOUTUBE;
        }
        if (type.startsWith("instagram_")) {
            return INSTAGRAM;
        }
        if ("search".equals(type)) {
            return SEARCH;
        }
        if ("engagement".equals(type)) {
            return GENERAL_WEB;
        }
        return OTHER;
    }
}
