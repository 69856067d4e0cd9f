package com.routely.backend.service;

import com.routely.backend.fare.FareTable;
import com.routely.backend.model.Line;
import com.routely.backend.model.PassengerType;
import com.routely.backend.model.PlanRequest;
import com.routely.backend.model.RequestIssue;
import com.routely.backend.model.Station;
import com.routely.backend.network.NetworkEdge;
import com.routely.backend.network.NetworkSnapshot;
import com.routely.backend.network.NetworkView;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks plan requests against the current network without searching for routes.
 */
@Component
public class PlanRequestValidator {

    static final int MAX_PAST_HOURS = 1;
    static final int MAX_FUTURE_DAYS = 30;
    static final int SHORT_WALK_MINUTES = 5;

    private final Clock clock;

    public PlanRequestValidator() {
        this(Clock.systemDefaultZone());
    }

    PlanRequestValidator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Every problem with the request, in field order. An empty list means the request is valid.
     */
    public List<RequestIssue> issues(PlanRequest request, NetworkSnapshot network, FareTable fareTable) {
        List<RequestIssue> issues = new ArrayList<>();
        String origin = request.getOriginStationId();
        String destination = request.getDestinationStationId();

        if (origin != null && origin.equals(destination)) {
            issues.add(issue("SAME_STATION", "Origin and destination must differ", "destinationStationId"));
        }
        if (!network.containsStation(origin)) {
            issues.add(issue("INVALID_FROM_STATION", "Station not found: " + origin, "originStationId"));
        }
        if (!network.containsStation(destination)) {
            issues.add(issue("INVALID_TO_STATION", "Station not found: " + destination, "destinationStationId"));
        }

        if (request.getPassengerTypes() != null) {
            Set<String> known = fareTable.passengerTypes().stream()
                    .map(PassengerType::getId)
                    .collect(Collectors.toSet());
            for (String passengerType : request.getPassengerTypes()) {
                if (!known.contains(passengerType)) {
                    issues.add(issue("INVALID_PASSENGER_TYPE", "Unknown passenger type: " + passengerType,
                            "passengerTypes"));
                }
            }
        }

        LocalDateTime departure = request.getDepartureTime();
        if (departure != null) {
            LocalDateTime now = LocalDateTime.now(clock);
            if (departure.isBefore(now.minusHours(MAX_PAST_HOURS))) {
                issues.add(issue("PAST_DEPARTURE_TIME",
                        "Departure time is more than " + MAX_PAST_HOURS + " hour in the past", "departureTime"));
            } else if (departure.isAfter(now.plusDays(MAX_FUTURE_DAYS))) {
                issues.add(issue("FUTURE_DEPARTURE_TIME",
                        "Departure time is more than " + MAX_FUTURE_DAYS + " days ahead", "departureTime"));
            }
        }

        if (request.getMaxTransfers() != null && request.getMaxTransfers() < 0) {
            issues.add(issue("INVALID_TRANSFERS", "maxTransfers must not be negative", "maxTransfers"));
        }
        if (request.getMaxWalkingMinutes() != null && request.getMaxWalkingMinutes() < 0) {
            issues.add(issue("INVALID_WALKING_TIME", "maxWalkingMinutes must not be negative", "maxWalkingMinutes"));
        }
        if (request.getAlternatives() != null && request.getAlternatives() < 1) {
            issues.add(issue("INVALID_ALTERNATIVES", "At least one itinerary must be requested", "alternatives"));
        }

        issues.addAll(linePreferenceIssues(request, network));
        return issues;
    }

    /**
     * Problems with the avoided and preferred line lists: unknown or inactive lines, and lines named in both.
     */
    public List<RequestIssue> linePreferenceIssues(PlanRequest request, NetworkView network) {
        List<RequestIssue> issues = new ArrayList<>();
        List<String> avoid = orEmpty(request.getAvoidLineIds());
        List<String> prefer = orEmpty(request.getPreferLineIds());

        for (String lineId : avoid) {
            Optional<Line> line = network.findLine(lineId);
            if (line.isEmpty()) {
                issues.add(issue("INVALID_AVOID_LINE", "Line to avoid not found: " + lineId, "avoidLineIds"));
            } else if (!line.get().isActive()) {
                issues.add(issue("INACTIVE_AVOID_LINE", "Line to avoid is not active: " + lineId, "avoidLineIds"));
            }
        }
        for (String lineId : prefer) {
            Optional<Line> line = network.findLine(lineId);
            if (line.isEmpty()) {
                issues.add(issue("INVALID_PREFER_LINE", "Preferred line not found: " + lineId, "preferLineIds"));
            } else if (!line.get().isActive()) {
                issues.add(issue("INACTIVE_PREFER_LINE", "Preferred line is not active: " + lineId,
                        "preferLineIds"));
            }
        }

        Set<String> conflicting = new HashSet<>(avoid);
        conflicting.retainAll(prefer);
        if (!conflicting.isEmpty()) {
            issues.add(issue("CONFLICTING_LINE_PREFERENCES",
                    "Lines cannot be both avoided and preferred: " + conflicting.stream().sorted()
                            .collect(Collectors.joining(", ")), "preferLineIds"));
        }
        return issues;
    }

    /**
     * Reasons no route could satisfy an otherwise valid request. Empty when a route may exist.
     */
    public List<String> infeasibility(PlanRequest request, NetworkView view) {
        List<String> reasons = new ArrayList<>();
        String origin = request.getOriginStationId();
        String destination = request.getDestinationStationId();

        if (request.getMaxTransfers() != null && request.getMaxTransfers() == 0) {
            String originLine = view.findStation(origin).map(Station::getLineId).orElse(null);
            String destinationLine = view.findStation(destination).map(Station::getLineId).orElse(null);
            if (originLine != null && !originLine.equals(destinationLine)) {
                reasons.add("No transfers allowed but stations are on different lines");
            }
        }
        if (!reachable(view, origin, destination)) {
            reasons.add("No open connection between " + origin + " and " + destination);
        }
        return reasons;
    }

    public List<String> warnings(PlanRequest request) {
        List<String> warnings = new ArrayList<>();
        boolean transfersAllowed = request.getMaxTransfers() == null || request.getMaxTransfers() > 0;
        if (transfersAllowed && request.getMaxWalkingMinutes() != null
                && request.getMaxWalkingMinutes() >= 0
                && request.getMaxWalkingMinutes() < SHORT_WALK_MINUTES) {
            warnings.add("A walking limit under " + SHORT_WALK_MINUTES + " minutes may rule out most transfers");
        }
        return warnings;
    }

    private static boolean reachable(NetworkView view, String origin, String destination) {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        seen.add(origin);
        queue.add(origin);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(destination)) {
                return true;
            }
            for (NetworkEdge edge : view.outgoing(current)) {
                if (seen.add(edge.getToStationId())) {
                    queue.add(edge.getToStationId());
                }
            }
        }
        return false;
    }

    private static List<String> orEmpty(List<String> values) {
        return values == null ? List.of() : values;
    }

    private static RequestIssue issue(String code, String message, String field) {
        return RequestIssue.builder().code(code).message(message).field(field).build();
    }
}
