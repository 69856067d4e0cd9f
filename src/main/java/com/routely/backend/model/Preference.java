package com.routely.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.routely.backend.routing.ObjectiveWeights;

import java.util.Locale;

/**
 * Stated optimisation preference of a traveller, each bound to a fixed weighting.
 */
public enum Preference {

    FASTEST("fastest", new ObjectiveWeights(1.0, 0.0, 0.1)),
    CHEAPEST("cheapest", new ObjectiveWeights(0.0, 1.0, 0.0)),
    // The penalty dominates any realistic time or cost, transfer count becomes the primary key
    FEWEST_TRANSFERS("fewest-transfers", new ObjectiveWeights(0.0, 0.0, 1000.0));

    private final String value;
    private final ObjectiveWeights weights;

    Preference(String value, ObjectiveWeights weights) {
        this.value = value;
        this.weights = weights;
    }

    public ObjectiveWeights weights() {
        return weights;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Accepts the API names plus the legacy "time", "cost" and "transfers" aliases.
     */
    @JsonCreator
    public static Preference fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return FASTEST;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        switch (normalized) {
            case "fastest":
            case "time":
                return FASTEST;
            case "cheapest":
            case "cost":
                return CHEAPEST;
            case "fewest-transfers":
            case "transfers":
                return FEWEST_TRANSFERS;
            default:
                throw new IllegalArgumentException("Unknown preference: " + raw);
        }
    }
}
