package com.routely.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Closures and delays laid over a snapshot for a single planning call.
 * The snapshot itself is never touched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NetworkOverlay {

    @Builder.Default
    private Set<String> closedEdgeIds = new HashSet<>();

    @Builder.Default
    private Set<String> closedLineIds = new HashSet<>();

    @Builder.Default
    private Set<String> closedStationIds = new HashSet<>();

    // Extra minutes per edge id
    @Builder.Default
    private Map<String, Integer> edgeDelayMinutes = new HashMap<>();

    // Extra minutes added to every ride hop of a line
    @Builder.Default
    private Map<String, Integer> lineDelayMinutes = new HashMap<>();

    public static NetworkOverlay empty() {
        return NetworkOverlay.builder().build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return isNullOrEmpty(closedEdgeIds) && isNullOrEmpty(closedLineIds) && isNullOrEmpty(closedStationIds)
                && isNullOrEmpty(edgeDelayMinutes) && isNullOrEmpty(lineDelayMinutes);
    }

    /**
     * Union of both overlays. When both carry a delay for the same key the larger one wins,
     * a disruption reported twice is not counted twice.
     */
    public NetworkOverlay merge(NetworkOverlay other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        NetworkOverlay merged = NetworkOverlay.builder().build();
        for (NetworkOverlay source : new NetworkOverlay[] { this, other }) {
            addAll(merged.closedEdgeIds, source.closedEdgeIds);
            addAll(merged.closedLineIds, source.closedLineIds);
            addAll(merged.closedStationIds, source.closedStationIds);
            mergeMax(merged.edgeDelayMinutes, source.edgeDelayMinutes);
            mergeMax(merged.lineDelayMinutes, source.lineDelayMinutes);
        }
        return merged;
    }

    private static void addAll(Set<String> target, Set<String> source) {
        if (source != null) {
            target.addAll(source);
        }
    }

    private static void mergeMax(Map<String, Integer> target, Map<String, Integer> source) {
        if (source == null) {
            return;
        }
        source.forEach((key, minutes) -> {
            if (minutes != null) {
                target.merge(key, minutes, Math::max);
            }
        });
    }

    private static boolean isNullOrEmpty(Set<?> set) {
        return set == null || set.isEmpty();
    }

    private static boolean isNullOrEmpty(Map<?, ?> map) {
        return map == null || map.isEmpty();
    }
}
