package com.routely.backend.network;

import com.routely.backend.model.EdgeKind;
import com.routely.backend.model.Line;
import com.routely.backend.model.Station;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable routable network. Built once by {@link NetworkModelBuilder}, replaced wholesale on rebuild.
 */
public final class NetworkSnapshot implements NetworkView {

    private final Map<String, Station> stations;
    private final Map<String, Line> lines;
    private final Map<String, List<NetworkEdge>> adjacency;
    private final Map<String, NetworkEdge> edgesById;

    NetworkSnapshot(Map<String, Station> stations, Map<String, Line> lines,
            Map<String, List<NetworkEdge>> adjacency, Map<String, NetworkEdge> edgesById) {
        this.stations = Collections.unmodifiableMap(stations);
        this.lines = Collections.unmodifiableMap(lines);
        this.adjacency = Collections.unmodifiableMap(adjacency);
        this.edgesById = Collections.unmodifiableMap(edgesById);
    }

    @Override
    public Optional<Station> findStation(String stationId) {
        return stationId == null ? Optional.empty() : Optional.ofNullable(stations.get(stationId));
    }

    @Override
    public Optional<Line> findLine(String lineId) {
        return lineId == null ? Optional.empty() : Optional.ofNullable(lines.get(lineId));
    }

    @Override
    public List<NetworkEdge> outgoing(String stationId) {
        return adjacency.getOrDefault(stationId, List.of());
    }

    public Optional<NetworkEdge> findEdge(String edgeId) {
        return Optional.ofNullable(edgesById.get(edgeId));
    }

    /**
     * Direct edge between two stations, rides before transfers, then by id.
     */
    public Optional<NetworkEdge> edgeBetween(String fromStationId, String toStationId) {
        return outgoing(fromStationId).stream()
                .filter(edge -> edge.getToStationId().equals(toStationId))
                .min(Comparator.comparing((NetworkEdge edge) -> edge.getKind() == EdgeKind.RIDE ? 0 : 1)
                        .thenComparing(NetworkEdge::getId));
    }

    // Sorted by id
    public Collection<Station> stations() {
        return stations.values();
    }

    // Sorted by id
    public Collection<Line> lines() {
        return lines.values();
    }

    public int stationCount() {
        return stations.size();
    }

    public int lineCount() {
        return lines.size();
    }

    public int edgeCount() {
        return edgesById.size();
    }
}
