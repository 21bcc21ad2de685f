package io.mirrorme.core.network;

public record InterestNode(String id, String label, double weight, double size) {
}
