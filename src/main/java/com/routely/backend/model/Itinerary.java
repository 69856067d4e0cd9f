package com.routely.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class Itinerary {
    // Derived from the edge sequence, identical routes get identical ids
    String id;
    Preference preference;
    String originStationId;
    String destinationStationId;
    List<ItinerarySegment> segments;

    int totalMinutes;
    double totalDistanceKm;
    int transferCount;
    int walkingMinutes;
    BigDecimal baseCost;
    double score;
    List<String> linesUsed;

    public List<String> edgeIds() {
        List<String> ids = new ArrayList<>(segments.size());
        for (ItinerarySegment segment : segments) {
            ids.add(segment.getEdgeId());
        }
        return ids;
    }

    public List<String> stationSequence() {
        List<String> stations = new ArrayList<>(segments.size() + 1);
        stations.add(originStationId);
        for (ItinerarySegment segment : segments) {
            stations.add(segment.getToStationId());
        }
        return stations;
    }
}
