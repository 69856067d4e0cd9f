package com.routely.backend.service;

import com.routely.backend.TestNetworks;
import com.routely.backend.exception.InvalidPlanRequestException;
import com.routely.backend.exception.NoPathException;
import com.routely.backend.exception.StationNotFoundException;
import com.routely.backend.fare.FareCalculator;
import com.routely.backend.model.FareBreakdown;
import com.routely.backend.model.FareComparison;
import com.routely.backend.model.FareQuote;
import com.routely.backend.model.FareQuoteRequest;
import com.routely.backend.model.Itinerary;
import com.routely.backend.model.NetworkData;
import com.routely.backend.model.PlanRequest;
import com.routely.backend.model.PlanResponse;
import com.routely.backend.model.Preference;
import com.routely.backend.model.PricedItinerary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FareQuoteServiceTest {

    @Mock
    private NetworkSnapshotService snapshotService;
    @Mock
    private RoutePlannerService routePlannerService;

    private FareQuoteService fareQuoteService;

    @BeforeEach
    void setUp() {
        fareQuoteService = new FareQuoteService(snapshotService, routePlannerService, new FareCalculator("THB"));
        ReflectionTestUtils.setField(fareQuoteService, "defaultPassengerType", "adult");
        ReflectionTestUtils.setField(fareQuoteService, "currency", "THB");
        lenient().when(snapshotService.current()).thenReturn(TestNetworks.snapshot(TestNetworks.twoLines()));
    }

    @Test
    void testQuote_StationSequenceAcrossTransfer() {
        // Given
        FareQuoteRequest request = FareQuoteRequest.builder()
                .stationIds(List.of("A", "B", "B2", "D"))
                .passengerTypes(List.of("child"))
                .build();

        // When
        FareQuote quote = fareQuoteService.quote(request);

        // Then
        assertEquals(3, quote.getItinerary().getSegments().size());
        assertEquals(1, quote.getItinerary().getTransferCount());
        assertEquals(new BigDecimal("15.00"), quote.getFares().get(0).getTotal());
    }

    @Test
    void testQuote_DefaultsToAdult() {
        // When
        FareQuote quote = fareQuoteService.quote(FareQuoteRequest.builder()
                .stationIds(List.of("A", "B", "C"))
                .build());

        // Then
        assertEquals("adult", quote.getFares().get(0).getPassengerTypeId());
        assertEquals(new BigDecimal("20.00"), quote.getFares().get(0).getTotal());
    }

    @Test
    void testQuote_NonAdjacentStations_NoPath() {
        assertThrows(NoPathException.class, () -> fareQuoteService.quote(FareQuoteRequest.builder()
                .stationIds(List.of("A", "C"))
                .build()));
    }

    @Test
    void testQuote_UnknownStation() {
        assertThrows(StationNotFoundException.class, () -> fareQuoteService.quote(FareQuoteRequest.builder()
                .stationIds(List.of("A", "Q"))
                .build()));
    }

    @Test
    void testQuote_SingleStation_Rejected() {
        assertThrows(InvalidPlanRequestException.class, () -> fareQuoteService.quote(FareQuoteRequest.builder()
                .stationIds(List.of("A"))
                .build()));
        verifyNoInteractions(routePlannerService);
    }

    @Test
    void testCompare_CheapestFirst() {
        // Given
        NetworkData data = TestNetworks.twoRoutes();
        data.getFareRules().set(1, TestNetworks.rule("L2", 1, 14, 0));
        PlannerSnapshot snapshot = TestNetworks.snapshot(data);
        FareCalculator calculator = new FareCalculator("THB");
        Itinerary direct = fareQuoteService.itineraryThrough(snapshot.getNetwork(), List.of("O", "X", "T"));
        Itinerary around = fareQuoteService.itineraryThrough(snapshot.getNetwork(), List.of("O", "O2", "Y", "T2", "T"));
        PlanRequest request = PlanRequest.builder()
                .originStationId("O")
                .destinationStationId("T")
                .preference(Preference.FASTEST)
                .passengerTypes(List.of("adult"))
                .build();
        PlanResponse plan = PlanResponse.builder()
                .snapshotVersion(7)
                .itineraries(List.of(
                        priced(2, around, calculator, snapshot),
                        priced(1, direct, calculator, snapshot)))
                .build();
        when(routePlannerService.plan(request)).thenReturn(plan);

        // When
        FareComparison comparison = fareQuoteService.compare(request);

        // Then
        assertEquals(7, comparison.getSnapshotVersion());
        assertEquals("adult", comparison.getPassengerTypeId());
        assertEquals(2, comparison.getOptions().size());
        assertSame(direct, comparison.getOptions().get(0).getItinerary());
        assertEquals(1, comparison.getOptions().get(0).getRank());
        assertTrue(comparison.getOptions().get(0).getFares().get(0).getTotal()
                .compareTo(comparison.getOptions().get(1).getFares().get(0).getTotal()) < 0);
        assertEquals(new BigDecimal("2.00"), comparison.getOptions().get(0).getFarePerMinute());
        assertEquals(new BigDecimal("2.80"), comparison.getOptions().get(1).getFarePerMinute());
    }

    @Test
    void testFarePerMinute_ZeroMinutes_Null() {
        // Given
        PricedItinerary option = PricedItinerary.builder()
                .rank(1)
                .itinerary(Itinerary.builder().totalMinutes(0).segments(List.of()).build())
                .fares(List.of(FareBreakdown.builder().total(new BigDecimal("10.00")).build()))
                .build();

        // When / Then
        assertNull(FareQuoteService.farePerMinute(option));
    }

    @Test
    void testCompare_SeveralPassengerTypes_Rejected() {
        PlanRequest request = PlanRequest.builder()
                .originStationId("A")
                .destinationStationId("D")
                .passengerTypes(List.of("adult", "child"))
                .build();
        assertThrows(InvalidPlanRequestException.class, () -> fareQuoteService.compare(request));
    }

    private static PricedItinerary priced(int rank, Itinerary itinerary, FareCalculator calculator,
            PlannerSnapshot snapshot) {
        return PricedItinerary.builder()
                .rank(rank)
                .itinerary(itinerary)
                .fares(List.of(calculator.price(itinerary, snapshot.getFareTable(), "adult", false, 1)))
                .build();
    }
}
