package com.routely.backend.network;

import com.routely.backend.model.Line;
import com.routely.backend.model.NetworkOverlay;
import com.routely.backend.model.Station;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Applies closures and delays of a {@link NetworkOverlay} on top of another view.
 * Closed stations stay resolvable but lose every edge touching them.
 * Delays without a value are ignored and each delay counts for at most {@link #MAX_DELAY_MINUTES}.
 */
public class OverlayNetworkView implements NetworkView {

    public static final int MAX_DELAY_MINUTES = 24 * 60;

    private final NetworkView delegate;
    private final Set<String> closedEdgeIds;
    private final Set<String> closedLineIds;
    private final Set<String> closedStationIds;
    private final Map<String, Integer> edgeDelayMinutes;
    private final Map<String, Integer> lineDelayMinutes;

    public OverlayNetworkView(NetworkView delegate, NetworkOverlay overlay) {
        this.delegate = delegate;
        this.closedEdgeIds = orEmpty(overlay.getClosedEdgeIds());
        this.closedLineIds = orEmpty(overlay.getClosedLineIds());
        this.closedStationIds = orEmpty(overlay.getClosedStationIds());
        this.edgeDelayMinutes = usableDelays(overlay.getEdgeDelayMinutes());
        this.lineDelayMinutes = usableDelays(overlay.getLineDelayMinutes());
    }

    /**
     * Wraps only when there is something to apply.
     */
    public static NetworkView of(NetworkView delegate, NetworkOverlay overlay) {
        if (overlay == null || overlay.isEmpty()) {
            return delegate;
        }
        return new OverlayNetworkView(delegate, overlay);
    }

    @Override
    public Optional<Station> findStation(String stationId) {
        return delegate.findStation(stationId);
    }

    @Override
    public Optional<Line> findLine(String lineId) {
        return delegate.findLine(lineId);
    }

    @Override
    public List<NetworkEdge> outgoing(String stationId) {
        if (closedStationIds.contains(stationId)) {
            return List.of();
        }
        List<NetworkEdge> edges = delegate.outgoing(stationId);
        List<NetworkEdge> visible = new ArrayList<>(edges.size());
        for (NetworkEdge edge : edges) {
            if (isClosed(edge)) {
                continue;
            }
            visible.add(edge.delayedBy(delayFor(edge)));
        }
        return visible;
    }

    public boolean isClosed(NetworkEdge edge) {
        if (closedEdgeIds.contains(edge.getId()) || closedStationIds.contains(edge.getToStationId())) {
            return true;
        }
        return edge.getLineId() != null && closedLineIds.contains(edge.getLineId());
    }

    private int delayFor(NetworkEdge edge) {
        int delay = edgeDelayMinutes.getOrDefault(edge.getId(), 0);
        if (edge.getLineId() != null) {
            delay += lineDelayMinutes.getOrDefault(edge.getLineId(), 0);
        }
        return delay;
    }

    private static <T> Set<T> orEmpty(Set<T> set) {
        return set == null ? Set.of() : set;
    }

    private static Map<String, Integer> usableDelays(Map<String, Integer> delays) {
        if (delays == null || delays.isEmpty()) {
            return Map.of();
        }
        Map<String, Integer> usable = new HashMap<>();
        delays.forEach((key, minutes) -> {
            if (key != null && minutes != null && minutes > 0) {
                usable.put(key, Math.min(minutes, MAX_DELAY_MINUTES));
            }
        });
        return usable;
    }
}
