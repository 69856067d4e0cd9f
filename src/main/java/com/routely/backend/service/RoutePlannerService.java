package com.routely.backend.service;

import com.routely.backend.client.ServiceStatusApi;
import com.routely.backend.exception.InvalidPlanRequestException;
import com.routely.backend.exception.NoPathException;
import com.routely.backend.exception.RoutePlanningException;
import com.routely.backend.exception.StationNotFoundException;
import com.routely.backend.fare.FareCalculator;
import com.routely.backend.fare.FareTable;
import com.routely.backend.model.FareBreakdown;
import com.routely.backend.model.Itinerary;
import com.routely.backend.model.NetworkOverlay;
import com.routely.backend.model.PlanRequest;
import com.routely.backend.model.PlanResponse;
import com.routely.backend.model.PlanValidation;
import com.routely.backend.model.Preference;
import com.routely.backend.model.PricedItinerary;
import com.routely.backend.model.RequestIssue;
import com.routely.backend.network.NetworkSnapshot;
import com.routely.backend.network.NetworkView;
import com.routely.backend.network.OverlayNetworkView;
import com.routely.backend.routing.AlternativesGenerator;
import com.routely.backend.routing.ItineraryAssembler;
import com.routely.backend.routing.ItineraryComparators;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class RoutePlannerService {

    private final NetworkSnapshotService snapshotService;
    private final AlternativesGenerator alternativesGenerator;
    private final FareCalculator fareCalculator;
    private final ServiceStatusApi serviceStatusApi;
    private final MonitoringService monitoringService;
    private final PlanRequestValidator requestValidator;

    @Value("${routely.fare.default-passenger-type:adult}")
    private String defaultPassengerType;

    public PlanResponse plan(String originStationId, String destinationStationId, Preference preference,
            List<String> passengerTypes, int alternatives) {
        return plan(PlanRequest.builder()
                .originStationId(originStationId)
                .destinationStationId(destinationStationId)
                .preference(preference)
                .passengerTypes(passengerTypes == null ? new ArrayList<>() : new ArrayList<>(passengerTypes))
                .alternatives(alternatives)
                .build());
    }

    public PlanResponse plan(PlanRequest request) {
        checkRequest(request);
        Preference preference = request.getPreference() == null ? Preference.FASTEST : request.getPreference();
        long startTime = System.currentTimeMillis();
        String status = "SUCCESS";
        try {
            PlanResponse response = doPlan(request, preference);
            monitoringService.recordItineraryCount(preference.getValue(), response.getItineraries().size());
            return response;
        } catch (RuntimeException e) {
            status = e instanceof RoutePlanningException ? ((RoutePlanningException) e).getCode() : "FAILED";
            throw e;
        } finally {
            monitoringService.recordPlanningDuration(preference.getValue(),
                    System.currentTimeMillis() - startTime, status);
        }
    }

    private PlanResponse doPlan(PlanRequest request, Preference preference) {
        PlannerSnapshot snapshot = snapshotService.current();
        NetworkSnapshot network = snapshot.getNetwork();
        FareTable fareTable = snapshot.getFareTable();

        String origin = request.getOriginStationId();
        String destination = request.getDestinationStationId();
        if (!network.containsStation(origin)) {
            throw new StationNotFoundException(origin);
        }
        if (!network.containsStation(destination)) {
            throw new StationNotFoundException(destination);
        }

        List<RequestIssue> lineIssues = requestValidator.linePreferenceIssues(request, network);
        if (!lineIssues.isEmpty()) {
            RequestIssue first = lineIssues.get(0);
            throw new InvalidPlanRequestException(first.getCode(), first.getMessage());
        }

        List<String> passengerTypes = resolvePassengerTypes(request.getPassengerTypes());
        passengerTypes.forEach(fareTable::passengerType);

        int requested = request.getAlternatives() == null ? 1 : request.getAlternatives();
        log.info("PLAN: 🧭 {} → {} ({}, {} alternative(s), snapshot v{})",
                origin, destination, preference.getValue(), requested, snapshot.getVersion());

        NetworkView view = OverlayNetworkView.of(network, overlayFor(request));
        List<Itinerary> candidates = alternativesGenerator.findAlternatives(view, origin, destination,
                preference, requested);

        List<Itinerary> ranked = candidates.stream()
                .filter(itinerary -> withinConstraints(itinerary, request))
                .sorted(preferredLinesFirst(request.getPreferLineIds()).thenComparing(ItineraryComparators.RANKING))
                .limit(requested)
                .collect(Collectors.toList());
        if (ranked.isEmpty()) {
            throw new NoPathException("No route from " + origin + " to " + destination
                    + " satisfies the transfer and walking limits");
        }

        boolean group = request.isGroup();
        int groupSize = request.getGroupSize() == null ? 1 : request.getGroupSize();
        List<PricedItinerary> priced = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            Itinerary itinerary = ItineraryAssembler.withSchedule(ranked.get(i), request.getDepartureTime());
            List<FareBreakdown> fares = new ArrayList<>(passengerTypes.size());
            for (String passengerType : passengerTypes) {
                fares.add(fareCalculator.price(itinerary, fareTable, passengerType, group, groupSize));
            }
            priced.add(PricedItinerary.builder()
                    .rank(i + 1)
                    .itinerary(itinerary)
                    .fares(List.copyOf(fares))
                    .build());
        }

        log.info("PLAN: ✅ {} itinerary(ies) from {} to {}", priced.size(), origin, destination);
        return PlanResponse.builder()
                .snapshotVersion(snapshot.getVersion())
                .originStationId(origin)
                .destinationStationId(destination)
                .preference(preference)
                .itineraries(List.copyOf(priced))
                .build();
    }

    private void checkRequest(PlanRequest request) {
        if (request == null) {
            throw new InvalidPlanRequestException("Plan request is required");
        }
        if (isBlank(request.getOriginStationId()) || isBlank(request.getDestinationStationId())) {
            throw new InvalidPlanRequestException("Origin and destination are required");
        }
        if (request.getOriginStationId().equals(request.getDestinationStationId())) {
            throw new InvalidPlanRequestException("Origin and destination must differ");
        }
        if (request.getAlternatives() != null && request.getAlternatives() < 1) {
            throw new InvalidPlanRequestException("At least one itinerary must be requested");
        }
        if (request.isGroup() && (request.getGroupSize() == null || request.getGroupSize() < 1)) {
            throw new InvalidPlanRequestException("Group size must be at least 1");
        }
        if (request.getMaxTransfers() != null && request.getMaxTransfers() < 0) {
            throw new InvalidPlanRequestException("maxTransfers must not be negative");
        }
        if (request.getMaxWalkingMinutes() != null && request.getMaxWalkingMinutes() < 0) {
            throw new InvalidPlanRequestException("maxWalkingMinutes must not be negative");
        }
    }

    /**
     * Checks a request against the current network without planning it. Feasibility is only assessed
     * for valid requests; its reasons are reported as warnings.
     */
    public PlanValidation validate(PlanRequest request) {
        if (request == null) {
            throw new InvalidPlanRequestException("Plan request is required");
        }
        PlannerSnapshot snapshot = snapshotService.current();
        NetworkSnapshot network = snapshot.getNetwork();

        List<RequestIssue> issues = requestValidator.issues(request, network, snapshot.getFareTable());
        List<String> warnings = new ArrayList<>(requestValidator.warnings(request));
        boolean feasible = false;
        if (issues.isEmpty()) {
            List<String> reasons = requestValidator.infeasibility(request,
                    OverlayNetworkView.of(network, overlayFor(request)));
            feasible = reasons.isEmpty();
            warnings.addAll(reasons);
        }
        log.info("PLAN: 🔎 Checked {} → {}: {} issue(s), feasible={}",
                request.getOriginStationId(), request.getDestinationStationId(), issues.size(), feasible);
        return PlanValidation.builder()
                .snapshotVersion(snapshot.getVersion())
                .valid(issues.isEmpty())
                .feasible(feasible)
                .issues(List.copyOf(issues))
                .warnings(List.copyOf(warnings))
                .build();
    }

    List<String> resolvePassengerTypes(List<String> requested) {
        if (requested == null || requested.isEmpty()) {
            return List.of(defaultPassengerType);
        }
        return List.copyOf(requested);
    }

    private NetworkOverlay overlayFor(PlanRequest request) {
        NetworkOverlay overlay = request.getOverlay() == null ? NetworkOverlay.empty() : request.getOverlay();
        if (request.getAvoidLineIds() != null && !request.getAvoidLineIds().isEmpty()) {
            Set<String> avoided = new HashSet<>(request.getAvoidLineIds());
            overlay = overlay.merge(NetworkOverlay.builder().closedLineIds(avoided).build());
        }
        if (request.isUseLiveStatus() && serviceStatusApi.isEnabled()) {
            try {
                overlay = overlay.merge(serviceStatusApi.currentOverlay());
            } catch (RuntimeException e) {
                log.warn("PLAN: ⚠️ Live service status unavailable, planning without it: {}", e.getMessage());
            }
        }
        return overlay;
    }

    // Itineraries riding a preferred line sort ahead of the rest
    private static Comparator<Itinerary> preferredLinesFirst(List<String> preferLineIds) {
        if (preferLineIds == null || preferLineIds.isEmpty()) {
            return (a, b) -> 0;
        }
        Set<String> preferred = new HashSet<>(preferLineIds);
        return Comparator.comparingInt(itinerary -> itinerary.getLinesUsed().stream()
                .anyMatch(preferred::contains) ? 0 : 1);
    }

    private static boolean withinConstraints(Itinerary itinerary, PlanRequest request) {
        if (request.getMaxTransfers() != null && itinerary.getTransferCount() > request.getMaxTransfers()) {
            return false;
        }
        return request.getMaxWalkingMinutes() == null
                || itinerary.getWalkingMinutes() <= request.getMaxWalkingMinutes();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
