package io.mirrorme.core.perception;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a final score to an impression label. Thresholds are checked in the order they were added.
 */
final class ImpressionScale {
    private final List<Band> bands = new ArrayList<>();
    private final String floor;

    ImpressionScale(String floor) {
        this.floor = floor;
    }

    ImpressionScale atLeast(int minimum, String label) {
        bands.add(new Band(minimum, label));
        return this;
    }

    String label(int score) {
        for (Band band : bands) {
            if (score >= band.minimum()) {
                return band.label();
            }
        }
        return floor;
    }

    private record Band(int minimum, String label) {
    }
}
