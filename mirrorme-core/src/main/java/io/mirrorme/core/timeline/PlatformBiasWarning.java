package io.mirrorme.core.timeline;

public record PlatformBiasWarning(String platform, String biasDirection, double strength, String warning) {
}
