package com.routely.backend.network;

import com.routely.backend.exception.IntegrityException;
import com.routely.backend.model.EdgeKind;
import com.routely.backend.model.Line;
import com.routely.backend.model.LineHop;
import com.routely.backend.model.Station;
import com.routely.backend.model.TransferLink;
import com.routely.backend.util.GeoUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Turns station, line and transfer data into a {@link NetworkSnapshot}.
 * Either the whole input is valid and a snapshot comes out, or an {@link IntegrityException} is thrown.
 */
@Component
@Slf4j
public class NetworkModelBuilder {

    public NetworkSnapshot build(List<Station> stations, List<Line> lines, List<TransferLink> transferLinks) {
        Objects.requireNonNull(stations, "stations");
        Objects.requireNonNull(lines, "lines");
        Objects.requireNonNull(transferLinks, "transferLinks");

        Map<String, Line> lineIndex = indexLines(lines);
        Map<String, Station> stationIndex = indexStations(stations, lineIndex);

        Map<String, List<NetworkEdge>> adjacency = new TreeMap<>();
        stationIndex.keySet().forEach(id -> adjacency.put(id, new ArrayList<>()));
        Map<String, NetworkEdge> edgesById = new TreeMap<>();

        for (Line line : lineIndex.values()) {
            addRideEdges(line, stationIndex, adjacency, edgesById);
        }

        List<TransferLink> sortedLinks = new ArrayList<>(transferLinks);
        sortedLinks.sort(Comparator.comparing(TransferLink::getId, Comparator.nullsFirst(Comparator.naturalOrder())));
        Map<String, TransferLink> seenLinks = new HashMap<>();
        for (TransferLink link : sortedLinks) {
            validateTransferLink(link, stationIndex, seenLinks);
            if (!link.isActive()) {
                log.debug("Skipping inactive transfer link {}", link.getId());
                continue;
            }
            addTransferEdges(link, adjacency, edgesById);
        }

        Map<String, List<NetworkEdge>> frozen = new TreeMap<>();
        adjacency.forEach((stationId, edges) -> {
            edges.sort(Comparator.comparing(NetworkEdge::getId));
            frozen.put(stationId, List.copyOf(edges));
        });

        log.info("🧱 Network built: {} stations, {} lines, {} edges",
                stationIndex.size(), lineIndex.size(), edgesById.size());
        return new NetworkSnapshot(stationIndex, lineIndex, frozen, edgesById);
    }

    private Map<String, Line> indexLines(List<Line> lines) {
        Map<String, Line> index = new TreeMap<>();
        for (Line line : lines) {
            if (line == null || isBlank(line.getId())) {
                throw new IntegrityException("Line without id");
            }
            if (index.containsKey(line.getId())) {
                throw new IntegrityException("Duplicate line id " + line.getId());
            }
            Line copy = line.toBuilder()
                    .stationIds(line.getStationIds() == null ? List.of() : List.copyOf(line.getStationIds()))
                    .hops(line.getHops() == null ? List.of() : List.copyOf(line.getHops()))
                    .build();
            index.put(copy.getId(), copy);
        }
        return index;
    }

    private Map<String, Station> indexStations(List<Station> stations, Map<String, Line> lineIndex) {
        Map<String, Station> index = new TreeMap<>();
        for (Station station : stations) {
            if (station == null || isBlank(station.getId())) {
                throw new IntegrityException("Station without id");
            }
            if (index.containsKey(station.getId())) {
                throw new IntegrityException("Duplicate station id " + station.getId());
            }
            if (station.getLineId() != null && !lineIndex.containsKey(station.getLineId())) {
                throw new IntegrityException("Station " + station.getId() + " references unknown line "
                        + station.getLineId());
            }
            index.put(station.getId(), station.toBuilder().build());
        }
        return index;
    }

    private void addRideEdges(Line line, Map<String, Station> stationIndex,
            Map<String, List<NetworkEdge>> adjacency, Map<String, NetworkEdge> edgesById) {
        List<String> stationIds = line.getStationIds();
        for (String stationId : stationIds) {
            if (!stationIndex.containsKey(stationId)) {
                throw new IntegrityException("Line " + line.getId() + " references unknown station " + stationId);
            }
        }
        if (!line.isActive()) {
            log.info("🚧 Line {} is {}, no ride edges", line.getId(), line.getStatus());
            return;
        }
        if (stationIds.size() < 2) {
            throw new IntegrityException("Active line " + line.getId() + " has fewer than two stations");
        }
        if (line.getTravelMinutesPerHop() < 0) {
            throw new IntegrityException("Line " + line.getId() + " has a negative travel time");
        }

        Map<String, LineHop> hops = new HashMap<>();
        for (LineHop hop : line.getHops()) {
            hops.put(pairKey(hop.getFromStationId(), hop.getToStationId()), hop);
        }

        for (int i = 0; i < stationIds.size() - 1; i++) {
            Station from = stationIndex.get(stationIds.get(i));
            Station to = stationIndex.get(stationIds.get(i + 1));
            if (from.getId().equals(to.getId())) {
                throw new IntegrityException("Line " + line.getId() + " repeats station " + from.getId());
            }
            LineHop hop = hops.get(pairKey(from.getId(), to.getId()));

            int minutes = hop != null && hop.getTravelMinutes() != null
                    ? hop.getTravelMinutes()
                    : line.getTravelMinutesPerHop();
            double distance = hop != null && hop.getDistanceKm() != null
                    ? hop.getDistanceKm()
                    : GeoUtils.distanceKm(from.getLat(), from.getLon(), to.getLat(), to.getLon());
            BigDecimal cost = hop != null && hop.getBaseCost() != null
                    ? hop.getBaseCost()
                    : (line.getCostPerHop() == null ? BigDecimal.ZERO : line.getCostPerHop());

            if (minutes < 0 || distance < 0 || cost.signum() < 0) {
                throw new IntegrityException("Line " + line.getId() + " has a negative weight between "
                        + from.getId() + " and " + to.getId());
            }

            addEdge(rideEdge(line, from.getId(), to.getId(), minutes, distance, cost), adjacency, edgesById);
            addEdge(rideEdge(line, to.getId(), from.getId(), minutes, distance, cost), adjacency, edgesById);
        }
    }

    private NetworkEdge rideEdge(Line line, String from, String to, int minutes, double distance, BigDecimal cost) {
        return NetworkEdge.builder()
                .id(line.getId() + ":" + from + ">" + to)
                .fromStationId(from)
                .toStationId(to)
                .kind(EdgeKind.RIDE)
                .lineId(line.getId())
                .travelMinutes(minutes)
                .distanceKm(distance)
                .baseCost(cost)
                .transferFee(BigDecimal.ZERO)
                .build();
    }

    private void validateTransferLink(TransferLink link, Map<String, Station> stationIndex,
            Map<String, TransferLink> seenLinks) {
        if (link == null || isBlank(link.getId())) {
            throw new IntegrityException("Transfer link without id");
        }
        if (seenLinks.put(link.getId(), link) != null) {
            throw new IntegrityException("Duplicate transfer link id " + link.getId());
        }
        for (String stationId : new String[] { link.getStationAId(), link.getStationBId() }) {
            if (stationId == null || !stationIndex.containsKey(stationId)) {
                throw new IntegrityException("Transfer link " + link.getId() + " references unknown station "
                        + stationId);
            }
        }
        if (link.getStationAId().equals(link.getStationBId())) {
            throw new IntegrityException("Transfer link " + link.getId() + " joins a station to itself");
        }
        BigDecimal fee = link.getTransferFee() == null ? BigDecimal.ZERO : link.getTransferFee();
        if (link.getWalkingMinutes() < 0 || link.getWalkingDistanceMeters() < 0 || fee.signum() < 0) {
            throw new IntegrityException("Transfer link " + link.getId() + " has a negative weight or fee");
        }
    }

    private void addTransferEdges(TransferLink link, Map<String, List<NetworkEdge>> adjacency,
            Map<String, NetworkEdge> edgesById) {
        addEdge(transferEdge(link, link.getStationAId(), link.getStationBId()), adjacency, edgesById);
        addEdge(transferEdge(link, link.getStationBId(), link.getStationAId()), adjacency, edgesById);
    }

    // Both directions share walking time and fee
    private NetworkEdge transferEdge(TransferLink link, String from, String to) {
        BigDecimal fee = link.getTransferFee() == null ? BigDecimal.ZERO : link.getTransferFee();
        return NetworkEdge.builder()
                .id("xfer:" + link.getId() + ":" + from + ">" + to)
                .fromStationId(from)
                .toStationId(to)
                .kind(EdgeKind.TRANSFER)
                .transferLinkId(link.getId())
                .travelMinutes(link.getWalkingMinutes())
                .distanceKm(link.getWalkingDistanceMeters() / 1000.0)
                .baseCost(fee)
                .transferFee(fee)
                .build();
    }

    private void addEdge(NetworkEdge edge, Map<String, List<NetworkEdge>> adjacency,
            Map<String, NetworkEdge> edgesById) {
        if (edgesById.put(edge.getId(), edge) != null) {
            throw new IntegrityException("Duplicate edge " + edge.getId());
        }
        adjacency.get(edge.getFromStationId()).add(edge);
    }

    private static String pairKey(String a, String b) {
        if (a == null || b == null) {
            return a + "|" + b;
        }
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
