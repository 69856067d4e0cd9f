package com.routely.backend.network;

import com.routely.backend.model.Line;
import com.routely.backend.model.Station;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hides a set of edges from another view. Used by the alternatives search.
 */
public class ExcludedEdgesNetworkView implements NetworkView {

    private final NetworkView delegate;
    private final Set<String> excludedEdgeIds;

    public ExcludedEdgesNetworkView(NetworkView delegate, Set<String> excludedEdgeIds) {
        this.delegate = delegate;
        this.excludedEdgeIds = Set.copyOf(excludedEdgeIds);
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
        List<NetworkEdge> edges = delegate.outgoing(stationId);
        if (excludedEdgeIds.isEmpty()) {
            return edges;
        }
        return edges.stream()
                .filter(edge -> !excludedEdgeIds.contains(edge.getId()))
                .collect(Collectors.toList());
    }
}
