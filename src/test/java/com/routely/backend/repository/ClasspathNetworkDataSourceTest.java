package com.routely.backend.repository;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routely.backend.exception.IntegrityException;
import com.routely.backend.fare.FareCalculator;
import com.routely.backend.fare.FareTable;
import com.routely.backend.fare.FareTableBuilder;
import com.routely.backend.model.FareBreakdown;
import com.routely.backend.model.Itinerary;
import com.routely.backend.model.NetworkData;
import com.routely.backend.model.Preference;
import com.routely.backend.network.NetworkModelBuilder;
import com.routely.backend.network.NetworkSnapshot;
import com.routely.backend.routing.RouteFinder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loads the bundled Bangkok seed end to end: parse, build, route and price.
 */
class ClasspathNetworkDataSourceTest {

    private static final String SEED = "classpath:network/bangkok-network.json";

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Test
    void testLoad_BundledSeed_BuildsRoutableNetwork() {
        // Given
        ClasspathNetworkDataSource dataSource = new ClasspathNetworkDataSource(objectMapper,
                new DefaultResourceLoader(), SEED);

        // When
        NetworkData data = dataSource.load();
        NetworkSnapshot network = new NetworkModelBuilder()
                .build(data.getStations(), data.getLines(), data.getTransferLinks());
        FareTable fareTable = new FareTableBuilder("5:10,10:15,20:20")
                .build(network, data.getFareRules(), data.getPassengerTypes());

        // Then
        assertEquals(56, network.stationCount());
        assertEquals(5, network.lineCount());
        assertEquals(4, fareTable.passengerTypes().size());
        assertEquals(SEED, dataSource.describe());

        Itinerary itinerary = new RouteFinder(20000).findBest(network, "BTS_N8", "MRT_BL26", Preference.FASTEST);
        assertEquals("BTS_N8", itinerary.getOriginStationId());
        assertEquals("MRT_BL26", itinerary.getDestinationStationId());
        assertTrue(itinerary.getTransferCount() >= 1);
        assertTrue(itinerary.getTotalMinutes() > 0);

        FareBreakdown fare = new FareCalculator("THB").price(itinerary, fareTable, "adult", false, 1);
        assertTrue(fare.getTotal().signum() > 0);
        assertEquals("THB", fare.getCurrency());
    }

    @Test
    void testLoad_MissingSeed_ThrowsIntegrity() {
        ClasspathNetworkDataSource dataSource = new ClasspathNetworkDataSource(objectMapper,
                new DefaultResourceLoader(), "classpath:network/does-not-exist.json");

        IntegrityException ex = assertThrows(IntegrityException.class, dataSource::load);
        assertTrue(ex.getMessage().contains("does-not-exist.json"));
    }
}
