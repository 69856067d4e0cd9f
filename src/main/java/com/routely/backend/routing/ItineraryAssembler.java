package com.routely.backend.routing;

import com.routely.backend.model.Itinerary;
import com.routely.backend.model.ItinerarySegment;
import com.routely.backend.model.Line;
import com.routely.backend.model.Preference;
import com.routely.backend.model.Station;
import com.routely.backend.network.NetworkEdge;
import com.routely.backend.network.NetworkView;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Turns an edge chain into an {@link Itinerary}, one segment per edge.
 */
public final class ItineraryAssembler {

    private ItineraryAssembler() {
    }

    public static Itinerary assemble(NetworkView view, String originId, String destinationId,
            List<NetworkEdge> edges, Preference preference, double score) {
        List<ItinerarySegment> segments = new ArrayList<>(edges.size());
        Set<String> linesUsed = new LinkedHashSet<>();
        int totalMinutes = 0;
        int walkingMinutes = 0;
        int transfers = 0;
        double distance = 0.0;
        BigDecimal baseCost = BigDecimal.ZERO;

        String expectedFrom = originId;
        for (int i = 0; i < edges.size(); i++) {
            NetworkEdge edge = edges.get(i);
            if (!edge.getFromStationId().equals(expectedFrom)) {
                throw new IllegalStateException("Edge " + edge.getId() + " does not continue from " + expectedFrom);
            }
            expectedFrom = edge.getToStationId();

            segments.add(segment(view, edge, i));
            totalMinutes += edge.getTravelMinutes();
            distance += edge.getDistanceKm();
            baseCost = baseCost.add(edge.getBaseCost());
            if (edge.isTransfer()) {
                transfers++;
                walkingMinutes += edge.getTravelMinutes();
            } else {
                linesUsed.add(edge.getLineId());
            }
        }
        if (!expectedFrom.equals(destinationId)) {
            throw new IllegalStateException("Path ends at " + expectedFrom + " instead of " + destinationId);
        }

        return Itinerary.builder()
                .id(idFor(originId, edges))
                .preference(preference)
                .originStationId(originId)
                .destinationStationId(destinationId)
                .segments(List.copyOf(segments))
                .totalMinutes(totalMinutes)
                .totalDistanceKm(distance)
                .transferCount(transfers)
                .walkingMinutes(walkingMinutes)
                .baseCost(baseCost.setScale(2, RoundingMode.HALF_UP))
                .score(score)
                .linesUsed(List.copyOf(linesUsed))
                .build();
    }

    /**
     * Same id for the same edge chain, whatever objective found it.
     */
    public static String idFor(String originId, List<NetworkEdge> edges) {
        StringBuilder key = new StringBuilder(originId);
        for (NetworkEdge edge : edges) {
            key.append('|').append(edge.getId());
        }
        return UUID.nameUUIDFromBytes(key.toString().getBytes(StandardCharsets.UTF_8)).toString();
    }

    /**
     * Copy with departure and arrival times on every segment, starting at {@code departure}.
     */
    public static Itinerary withSchedule(Itinerary itinerary, LocalDateTime departure) {
        if (departure == null) {
            return itinerary;
        }
        List<ItinerarySegment> timed = new ArrayList<>(itinerary.getSegments().size());
        LocalDateTime clock = departure;
        for (ItinerarySegment segment : itinerary.getSegments()) {
            LocalDateTime arrival = clock.plusMinutes(segment.getTravelMinutes());
            timed.add(segment.toBuilder().departureTime(clock).arrivalTime(arrival).build());
            clock = arrival;
        }
        return itinerary.toBuilder().segments(List.copyOf(timed)).build();
    }

    private static ItinerarySegment segment(NetworkView view, NetworkEdge edge, int order) {
        Station from = view.findStation(edge.getFromStationId())
                .orElseThrow(() -> new IllegalStateException("Unknown station " + edge.getFromStationId()));
        Station to = view.findStation(edge.getToStationId())
                .orElseThrow(() -> new IllegalStateException("Unknown station " + edge.getToStationId()));

        ItinerarySegment.ItinerarySegmentBuilder builder = ItinerarySegment.builder()
                .order(order)
                .kind(edge.getKind())
                .edgeId(edge.getId())
                .fromStationId(from.getId())
                .fromStationName(from.getName())
                .fromZone(from.getZoneNumber())
                .toStationId(to.getId())
                .toStationName(to.getName())
                .toZone(to.getZoneNumber())
                .travelMinutes(edge.getTravelMinutes())
                .distanceKm(edge.getDistanceKm())
                .baseCost(edge.getBaseCost())
                .transferFee(edge.getTransferFee());

        if (edge.isTransfer()) {
            builder.instructions("Walk " + edge.getTravelMinutes() + " min from " + from.getName()
                    + " to " + to.getName());
        } else {
            Line line = view.findLine(edge.getLineId()).orElse(null);
            String lineName = line == null ? edge.getLineId() : line.getName();
            builder.lineId(edge.getLineId())
                    .lineName(lineName)
                    .lineColor(line == null ? null : line.getColor())
                    .instructions("Take " + lineName + " from " + from.getName() + " to " + to.getName());
        }
        return builder.build();
    }
}
