package com.routely.backend.routing;

import com.routely.backend.exception.InvalidPlanRequestException;
import com.routely.backend.exception.NoPathException;
import com.routely.backend.exception.SearchBudgetExceededException;
import com.routely.backend.exception.StationNotFoundException;
import com.routely.backend.model.Itinerary;
import com.routely.backend.model.Preference;
import com.routely.backend.network.NetworkEdge;
import com.routely.backend.network.NetworkView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Single-objective Dijkstra over a {@link NetworkView}.
 *
 * <p>Labels are ordered by accumulated score, then transfer count, then distance, then predecessor
 * station id and the edge used to arrive, so equal inputs always produce the same path.
 * The search stops as soon as the destination is settled.
 */
@Component
@Slf4j
public class RouteFinder {

    static final double EPSILON = 1e-9;

    private static final Comparator<Label> LABEL_ORDER = (a, b) -> {
        int byScore = compareDoubles(a.score, b.score);
        if (byScore != 0) {
            return byScore;
        }
        int byTransfers = Integer.compare(a.transfers, b.transfers);
        if (byTransfers != 0) {
            return byTransfers;
        }
        int byDistance = compareDoubles(a.distanceKm, b.distanceKm);
        if (byDistance != 0) {
            return byDistance;
        }
        int byPredecessor = compareNullable(a.predecessorStationId(), b.predecessorStationId());
        if (byPredecessor != 0) {
            return byPredecessor;
        }
        int byEdge = compareNullable(a.viaEdgeId(), b.viaEdgeId());
        if (byEdge != 0) {
            return byEdge;
        }
        return a.stationId.compareTo(b.stationId);
    };

    private final int maxFrontierPops;

    public RouteFinder(@Value("${routely.routing.max-frontier-pops:20000}") int maxFrontierPops) {
        if (maxFrontierPops < 1) {
            throw new IllegalArgumentException("routely.routing.max-frontier-pops must be positive");
        }
        this.maxFrontierPops = maxFrontierPops;
    }

    public Itinerary findBest(NetworkView view, String originId, String destinationId, Preference preference) {
        if (!view.containsStation(originId)) {
            throw new StationNotFoundException(originId);
        }
        if (!view.containsStation(destinationId)) {
            throw new StationNotFoundException(destinationId);
        }
        if (originId.equals(destinationId)) {
            throw new InvalidPlanRequestException("Origin and destination must differ");
        }
        Preference effective = preference == null ? Preference.FASTEST : preference;
        ObjectiveWeights weights = effective.weights();

        Map<String, Label> best = new HashMap<>();
        Set<String> settled = new HashSet<>();
        PriorityQueue<Label> frontier = new PriorityQueue<>(LABEL_ORDER);

        Label start = new Label(originId, 0.0, 0, 0.0, null, null);
        best.put(originId, start);
        frontier.add(start);

        int pops = 0;
        while (!frontier.isEmpty()) {
            Label current = frontier.poll();
            if (++pops > maxFrontierPops) {
                log.warn("PLAN: ⏱️ Search budget of {} pops exhausted between {} and {}",
                        maxFrontierPops, originId, destinationId);
                throw new SearchBudgetExceededException(maxFrontierPops);
            }
            if (!settled.add(current.stationId)) {
                continue;
            }
            if (current.stationId.equals(destinationId)) {
                log.debug("PLAN: settled {} after {} pops", destinationId, pops);
                return ItineraryAssembler.assemble(view, originId, destinationId, path(current),
                        effective, current.score);
            }
            for (NetworkEdge edge : view.outgoing(current.stationId)) {
                if (settled.contains(edge.getToStationId())) {
                    continue;
                }
                Label next = new Label(edge.getToStationId(),
                        current.score + weights.score(edge),
                        current.transfers + (edge.isTransfer() ? 1 : 0),
                        current.distanceKm + edge.getDistanceKm(),
                        edge,
                        current);
                Label known = best.get(next.stationId);
                if (known == null || LABEL_ORDER.compare(next, known) < 0) {
                    best.put(next.stationId, next);
                    frontier.add(next);
                }
            }
        }
        throw NoPathException.between(originId, destinationId);
    }

    private static List<NetworkEdge> path(Label destination) {
        Deque<NetworkEdge> edges = new ArrayDeque<>();
        for (Label label = destination; label.via != null; label = label.previous) {
            edges.addFirst(label.via);
        }
        return new ArrayList<>(edges);
    }

    static int compareDoubles(double a, double b) {
        if (Math.abs(a - b) <= EPSILON) {
            return 0;
        }
        return Double.compare(a, b);
    }

    private static int compareNullable(String a, String b) {
        if (a == null) {
            return b == null ? 0 : -1;
        }
        return b == null ? 1 : a.compareTo(b);
    }

    private static final class Label {
        final String stationId;
        final double score;
        final int transfers;
        final double distanceKm;
        final NetworkEdge via;
        final Label previous;

        Label(String stationId, double score, int transfers, double distanceKm, NetworkEdge via, Label previous) {
            this.stationId = stationId;
            this.score = score;
            this.transfers = transfers;
            this.distanceKm = distanceKm;
            this.via = via;
            this.previous = previous;
        }

        String predecessorStationId() {
            return via == null ? null : via.getFromStationId();
        }

        String viaEdgeId() {
            return via == null ? null : via.getId();
        }
    }
}
