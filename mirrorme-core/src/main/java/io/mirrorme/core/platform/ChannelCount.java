package io.mirrorme.core.platform;

public record ChannelCount(String channel, int count) {
}
