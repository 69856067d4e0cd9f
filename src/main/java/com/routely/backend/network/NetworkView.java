package com.routely.backend.network;

import com.routely.backend.model.Line;
import com.routely.backend.model.Station;

import java.util.List;
import java.util.Optional;

/**
 * Read-only graph as seen by a search. Implementations never modify the snapshot they wrap.
 */
public interface NetworkView {

    Optional<Station> findStation(String stationId);

    Optional<Line> findLine(String lineId);

    /**
     * Outgoing edges of a station in a stable order. Unknown stations have none.
     */
    List<NetworkEdge> outgoing(String stationId);

    default boolean containsStation(String stationId) {
        return stationId != null && findStation(stationId).isPresent();
    }
}
