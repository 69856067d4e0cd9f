package com.routely.backend.service;

import com.routely.backend.exception.InvalidPlanRequestException;
import com.routely.backend.exception.NoPathException;
import com.routely.backend.exception.StationNotFoundException;
import com.routely.backend.fare.FareCalculator;
import com.routely.backend.fare.FareTable;
import com.routely.backend.model.FareBreakdown;
import com.routely.backend.model.FareComparison;
import com.routely.backend.model.FareQuote;
import com.routely.backend.model.FareQuoteRequest;
import com.routely.backend.model.Itinerary;
import com.routely.backend.model.PlanRequest;
import com.routely.backend.model.PlanResponse;
import com.routely.backend.model.Preference;
import com.routely.backend.model.PricedItinerary;
import com.routely.backend.network.NetworkEdge;
import com.routely.backend.network.NetworkSnapshot;
import com.routely.backend.routing.ItineraryAssembler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Prices journeys outside a planning call: a fixed station sequence, or the planner's alternatives
 * side by side for one passenger type.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FareQuoteService {

    private final NetworkSnapshotService snapshotService;
    private final RoutePlannerService routePlannerService;
    private final FareCalculator fareCalculator;

    @Value("${routely.fare.default-passenger-type:adult}")
    private String defaultPassengerType;

    @Value("${routely.fare.currency:THB}")
    private String currency;

    public FareQuote quote(FareQuoteRequest request) {
        if (request == null || request.getStationIds() == null || request.getStationIds().size() < 2) {
            throw new InvalidPlanRequestException("A fare quote needs at least two stations");
        }
        boolean group = request.isGroup();
        int groupSize = request.getGroupSize() == null ? 1 : request.getGroupSize();
        if (group && groupSize < 1) {
            throw new InvalidPlanRequestException("Group size must be at least 1");
        }

        PlannerSnapshot snapshot = snapshotService.current();
        Itinerary itinerary = itineraryThrough(snapshot.getNetwork(), request.getStationIds());
        FareTable fareTable = snapshot.getFareTable();

        List<String> passengerTypes = request.getPassengerTypes() == null || request.getPassengerTypes().isEmpty()
                ? List.of(defaultPassengerType)
                : request.getPassengerTypes();
        List<FareBreakdown> fares = new ArrayList<>(passengerTypes.size());
        for (String passengerType : passengerTypes) {
            fares.add(fareCalculator.price(itinerary, fareTable, passengerType, group, groupSize));
        }

        log.info("FARE: 🧾 Quoted {} stations for {}", request.getStationIds().size(), passengerTypes);
        return FareQuote.builder()
                .snapshotVersion(snapshot.getVersion())
                .itinerary(itinerary)
                .fares(List.copyOf(fares))
                .build();
    }

    public FareComparison compare(PlanRequest request) {
        if (request != null && request.getPassengerTypes() != null && request.getPassengerTypes().size() > 1) {
            throw new InvalidPlanRequestException("A fare comparison takes a single passenger type");
        }
        PlanResponse plan = routePlannerService.plan(request);
        String passengerTypeId = request.getPassengerTypes() == null || request.getPassengerTypes().isEmpty()
                ? defaultPassengerType
                : request.getPassengerTypes().get(0);

        List<PricedItinerary> byPrice = new ArrayList<>(plan.getItineraries());
        byPrice.sort(Comparator.comparing((PricedItinerary option) -> option.getFares().get(0).getTotal())
                .thenComparingInt(PricedItinerary::getRank));

        List<PricedItinerary> options = new ArrayList<>(byPrice.size());
        for (int i = 0; i < byPrice.size(); i++) {
            PricedItinerary option = byPrice.get(i);
            options.add(PricedItinerary.builder()
                    .rank(i + 1)
                    .itinerary(option.getItinerary())
                    .fares(option.getFares())
                    .farePerMinute(farePerMinute(option))
                    .build());
        }
        return FareComparison.builder()
                .snapshotVersion(plan.getSnapshotVersion())
                .passengerTypeId(passengerTypeId)
                .currency(currency)
                .options(List.copyOf(options))
                .build();
    }

    // Null for zero-minute itineraries
    static BigDecimal farePerMinute(PricedItinerary option) {
        int minutes = option.getItinerary().getTotalMinutes();
        if (minutes <= 0) {
            return null;
        }
        return option.getFares().get(0).getTotal()
                .divide(BigDecimal.valueOf(minutes), 2, RoundingMode.HALF_UP);
    }

    Itinerary itineraryThrough(NetworkSnapshot network, List<String> stationIds) {
        for (String stationId : stationIds) {
            if (!network.containsStation(stationId)) {
                throw new StationNotFoundException(stationId);
            }
        }
        Preference preference = Preference.FASTEST;
        List<NetworkEdge> edges = new ArrayList<>(stationIds.size() - 1);
        double score = 0.0;
        for (int i = 0; i < stationIds.size() - 1; i++) {
            String from = stationIds.get(i);
            String to = stationIds.get(i + 1);
            NetworkEdge edge = network.edgeBetween(from, to)
                    .orElseThrow(() -> new NoPathException("Stations " + from + " and " + to + " are not adjacent"));
            edges.add(edge);
            score += preference.weights().score(edge);
        }
        return ItineraryAssembler.assemble(network, stationIds.get(0), stationIds.get(stationIds.size() - 1),
                edges, preference, score);
    }
}
