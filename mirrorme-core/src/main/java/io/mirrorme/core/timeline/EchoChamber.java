package io.mirrorme.core.timeline;

public record EchoChamber(String topic, double concentration, String warning) {
}
