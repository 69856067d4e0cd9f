package com.routely.backend.routing;

import com.routely.backend.exception.NoPathException;
import com.routely.backend.model.Itinerary;
import com.routely.backend.model.Preference;
import com.routely.backend.network.ExcludedEdgesNetworkView;
import com.routely.backend.network.NetworkView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Bounded set of structurally distinct itineraries.
 *
 * <p>Every accepted itinerary carries the edge exclusions it was found under. Its children re-run the
 * route finder with those exclusions plus one of its own edges, one child per edge. The best pending
 * candidate is accepted next when its edge set is new and it is diverse enough from everything accepted.
 */
@Component
@Slf4j
public class AlternativesGenerator {

    private final RouteFinder routeFinder;
    private final int minAlternatives;
    private final int maxAlternatives;
    private final double minEdgeDiversity;

    public AlternativesGenerator(RouteFinder routeFinder,
            @Value("${routely.routing.min-alternatives:3}") int minAlternatives,
            @Value("${routely.routing.max-alternatives:5}") int maxAlternatives,
            @Value("${routely.routing.min-edge-diversity:0.0}") double minEdgeDiversity) {
        if (minAlternatives < 1 || maxAlternatives < minAlternatives) {
            throw new IllegalArgumentException("Invalid alternatives range [" + minAlternatives + ", "
                    + maxAlternatives + "]");
        }
        if (minEdgeDiversity < 0.0 || minEdgeDiversity > 1.0) {
            throw new IllegalArgumentException("routely.routing.min-edge-diversity must be within [0, 1]");
        }
        this.routeFinder = routeFinder;
        this.minAlternatives = minAlternatives;
        this.maxAlternatives = maxAlternatives;
        this.minEdgeDiversity = minEdgeDiversity;
    }

    public List<Itinerary> findAlternatives(NetworkView view, String originId, String destinationId,
            Preference preference, int maxResults) {
        int limit = clamp(maxResults);
        Itinerary primary = routeFinder.findBest(view, originId, destinationId, preference);

        List<Candidate> accepted = new ArrayList<>();
        List<Candidate> pending = new ArrayList<>();
        Set<Set<String>> triedExclusions = new HashSet<>();
        Set<Set<String>> knownEdgeSets = new HashSet<>();
        Set<String> usedEdges = new HashSet<>();

        Candidate current = new Candidate(primary, Set.of());
        knownEdgeSets.add(edgeSet(primary));

        while (current != null) {
            accepted.add(current);
            usedEdges.addAll(current.itinerary.edgeIds());
            if (accepted.size() >= limit) {
                break;
            }
            expand(view, originId, destinationId, preference, current, pending, triedExclusions, knownEdgeSets);
            current = nextAcceptable(pending, usedEdges);
        }

        log.debug("PLAN: {} alternative(s) between {} and {} (limit {})",
                accepted.size(), originId, destinationId, limit);
        List<Itinerary> result = new ArrayList<>(accepted.size());
        accepted.forEach(candidate -> result.add(candidate.itinerary));
        return result;
    }

    int clamp(int requested) {
        return Math.max(minAlternatives, Math.min(maxAlternatives, requested));
    }

    private void expand(NetworkView view, String originId, String destinationId, Preference preference,
            Candidate parent, List<Candidate> pending, Set<Set<String>> triedExclusions,
            Set<Set<String>> knownEdgeSets) {
        for (String edgeId : new LinkedHashSet<>(parent.itinerary.edgeIds())) {
            Set<String> exclusions = new TreeSet<>(parent.exclusions);
            exclusions.add(edgeId);
            if (!triedExclusions.add(exclusions)) {
                continue;
            }
            Itinerary found;
            try {
                found = routeFinder.findBest(new ExcludedEdgesNetworkView(view, exclusions),
                        originId, destinationId, preference);
            } catch (NoPathException e) {
                log.trace("No path once {} is excluded", exclusions);
                continue;
            }
            if (knownEdgeSets.add(edgeSet(found))) {
                pending.add(new Candidate(found, Set.copyOf(exclusions)));
            }
        }
    }

    private Candidate nextAcceptable(List<Candidate> pending, Set<String> usedEdges) {
        while (!pending.isEmpty()) {
            Candidate best = pending.get(0);
            for (Candidate candidate : pending) {
                if (ItineraryComparators.RANKING.compare(candidate.itinerary, best.itinerary) < 0) {
                    best = candidate;
                }
            }
            pending.remove(best);
            if (diversity(best.itinerary, usedEdges) + RouteFinder.EPSILON >= minEdgeDiversity) {
                return best;
            }
            log.trace("Dropping {}: not diverse enough", best.itinerary.getId());
        }
        return null;
    }

    // Share of the itinerary's edges not used by any accepted itinerary
    static double diversity(Itinerary itinerary, Set<String> usedEdges) {
        List<String> edges = itinerary.edgeIds();
        if (edges.isEmpty()) {
            return 0.0;
        }
        long fresh = edges.stream().filter(edgeId -> !usedEdges.contains(edgeId)).count();
        return (double) fresh / edges.size();
    }

    private static Set<String> edgeSet(Itinerary itinerary) {
        return new TreeSet<>(itinerary.edgeIds());
    }

    private static final class Candidate {
        final Itinerary itinerary;
        final Set<String> exclusions;

        Candidate(Itinerary itinerary, Set<String> exclusions) {
            this.itinerary = itinerary;
            this.exclusions = exclusions;
        }
    }
}
