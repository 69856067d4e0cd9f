package com.routely.backend.routing;

import com.routely.backend.model.Itinerary;

import java.util.Comparator;
import java.util.List;

public final class ItineraryComparators {

    /**
     * Score, then transfers, then distance, then station sequence, then edge ids.
     */
    public static final Comparator<Itinerary> RANKING = (a, b) -> {
        int byScore = RouteFinder.compareDoubles(a.getScore(), b.getScore());
        if (byScore != 0) {
            return byScore;
        }
        int byTransfers = Integer.compare(a.getTransferCount(), b.getTransferCount());
        if (byTransfers != 0) {
            return byTransfers;
        }
        int byDistance = RouteFinder.compareDoubles(a.getTotalDistanceKm(), b.getTotalDistanceKm());
        if (byDistance != 0) {
            return byDistance;
        }
        int byStations = compareLexicographically(a.stationSequence(), b.stationSequence());
        if (byStations != 0) {
            return byStations;
        }
        return compareLexicographically(a.edgeIds(), b.edgeIds());
    };

    private ItineraryComparators() {
    }

    static int compareLexicographically(List<String> a, List<String> b) {
        int shared = Math.min(a.size(), b.size());
        for (int i = 0; i < shared; i++) {
            int cmp = a.get(i).compareTo(b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }
}
