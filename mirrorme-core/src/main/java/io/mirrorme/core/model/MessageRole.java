package io.mirrorme.core.model;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT
}
