package com.routely.backend.network;

import com.routely.backend.TestNetworks;
import com.routely.backend.exception.IntegrityException;
import com.routely.backend.model.EdgeKind;
import com.routely.backend.model.FareType;
import com.routely.backend.model.Line;
import com.routely.backend.model.LineHop;
import com.routely.backend.model.LineStatus;
import com.routely.backend.model.NetworkData;
import com.routely.backend.model.Station;
import com.routely.backend.model.TransferLink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.routely.backend.TestNetworks.line;
import static com.routely.backend.TestNetworks.station;
import static com.routely.backend.TestNetworks.transfer;
import static org.junit.jupiter.api.Assertions.*;

class NetworkModelBuilderTest {

    private NetworkModelBuilder builder;
    private NetworkData data;

    @BeforeEach
    void setUp() {
        builder = new NetworkModelBuilder();
        data = TestNetworks.twoLines();
    }

    @Test
    void testBuild_CreatesRideEdgesInBothDirections() {
        // When
        NetworkSnapshot network = build();

        // Then
        assertEquals(5, network.stationCount());
        assertEquals(2, network.lineCount());
        // 3 ride hops and 1 transfer, two directions each
        assertEquals(8, network.edgeCount());
        assertTrue(network.findEdge("L1:A>B").isPresent());
        assertTrue(network.findEdge("L1:B>A").isPresent());

        NetworkEdge ride = network.findEdge("L1:B>C").orElseThrow();
        assertEquals(EdgeKind.RIDE, ride.getKind());
        assertEquals("L1", ride.getLineId());
        assertEquals(5, ride.getTravelMinutes());
        assertEquals(0, new BigDecimal("10").compareTo(ride.getBaseCost()));
        assertTrue(ride.getDistanceKm() > 1.0, "haversine distance of about 1.1 km expected");
    }

    @Test
    void testBuild_TransferLinkIsSymmetric() {
        // When
        NetworkSnapshot network = build();

        // Then
        NetworkEdge there = network.findEdge("xfer:X1:B>B2").orElseThrow();
        NetworkEdge back = network.findEdge("xfer:X1:B2>B").orElseThrow();
        assertTrue(there.isTransfer());
        assertEquals(there.getTravelMinutes(), back.getTravelMinutes());
        assertEquals(there.getTransferFee(), back.getTransferFee());
        assertEquals(0.1, there.getDistanceKm(), 1e-9);
    }

    @Test
    void testBuild_AdjacencyIsSortedById() {
        // When
        NetworkSnapshot network = build();

        // Then
        List<String> ids = network.outgoing("B").stream().map(NetworkEdge::getId).collect(Collectors.toList());
        assertEquals(List.of("L1:B>A", "L1:B>C", "xfer:X1:B>B2"), ids);
    }

    @Test
    void testBuild_InactiveLineContributesNoRides() {
        // Given
        data.getLines().set(1, data.getLines().get(1).toBuilder().status(LineStatus.MAINTENANCE).build());

        // When
        NetworkSnapshot network = build();

        // Then
        assertTrue(network.findEdge("L2:B2>D").isEmpty());
        assertTrue(network.findStation("D").isPresent());
        assertTrue(network.outgoing("D").isEmpty());
    }

    @Test
    void testBuild_InactiveTransferIsSkipped() {
        // Given
        TransferLink closed = data.getTransferLinks().get(0).toBuilder().active(false).build();
        data.setTransferLinks(new ArrayList<>(List.of(closed)));

        // When
        NetworkSnapshot network = build();

        // Then
        assertTrue(network.findEdge("xfer:X1:B>B2").isEmpty());
        assertEquals(6, network.edgeCount());
    }

    @Test
    void testBuild_HopOverrideWins() {
        // Given
        Line withHop = data.getLines().get(0).toBuilder()
                .hops(List.of(LineHop.builder()
                        .fromStationId("C")
                        .toStationId("B")
                        .travelMinutes(9)
                        .distanceKm(2.5)
                        .baseCost(new BigDecimal("4"))
                        .build()))
                .build();
        data.getLines().set(0, withHop);

        // When
        NetworkSnapshot network = build();

        // Then
        for (String edgeId : List.of("L1:B>C", "L1:C>B")) {
            NetworkEdge edge = network.findEdge(edgeId).orElseThrow();
            assertEquals(9, edge.getTravelMinutes());
            assertEquals(2.5, edge.getDistanceKm(), 1e-9);
            assertEquals(0, new BigDecimal("4").compareTo(edge.getBaseCost()));
        }
        assertEquals(5, network.findEdge("L1:A>B").orElseThrow().getTravelMinutes());
    }

    @Test
    void testBuild_EdgeBetweenPrefersRide() {
        // When
        NetworkSnapshot network = build();

        // Then
        assertEquals("L1:A>B", network.edgeBetween("A", "B").orElseThrow().getId());
        assertEquals("xfer:X1:B>B2", network.edgeBetween("B", "B2").orElseThrow().getId());
        assertTrue(network.edgeBetween("A", "C").isEmpty());
    }

    @Test
    void testBuild_LineWithUnknownStation_Throws() {
        // Given
        data.getLines().add(line("L3", FareType.ZONE, 2, 1, "C", "NOWHERE"));

        // When / Then
        IntegrityException ex = assertThrows(IntegrityException.class, this::build);
        assertTrue(ex.getMessage().contains("NOWHERE"));
    }

    @Test
    void testBuild_StationWithUnknownLine_Throws() {
        // Given
        data.getStations().add(station("E", "GHOST", 1, 13.0, 100.0));

        // When / Then
        assertThrows(IntegrityException.class, this::build);
    }

    @Test
    void testBuild_DuplicateStation_Throws() {
        // Given
        data.getStations().add(station("A", "L1", 1, 13.0, 100.0));

        // When / Then
        assertThrows(IntegrityException.class, this::build);
    }

    @Test
    void testBuild_TransferToUnknownStation_Throws() {
        // Given
        data.getTransferLinks().add(transfer("X2", "A", "ZZ", 2, 0));

        // When / Then
        assertThrows(IntegrityException.class, this::build);
    }

    @Test
    void testBuild_SelfTransfer_Throws() {
        // Given
        data.getTransferLinks().add(transfer("X2", "A", "A", 2, 0));

        // When / Then
        assertThrows(IntegrityException.class, this::build);
    }

    @Test
    void testBuild_NegativeWalkingTime_Throws() {
        // Given
        data.getTransferLinks().add(transfer("X2", "A", "B2", -1, 0));

        // When / Then
        assertThrows(IntegrityException.class, this::build);
    }

    @Test
    void testBuild_ActiveLineWithOneStation_Throws() {
        // Given
        data.getStations().add(station("E", "L3", 1, 13.0, 100.0));
        data.getLines().add(line("L3", FareType.ZONE, 2, 1, "E"));

        // When / Then
        assertThrows(IntegrityException.class, this::build);
    }

    @Test
    void testBuild_NegativeCostPerHop_Throws() {
        // Given
        data.getLines().set(0, data.getLines().get(0).toBuilder().costPerHop(new BigDecimal("-1")).build());

        // When / Then
        assertThrows(IntegrityException.class, this::build);
    }

    @Test
    void testBuild_DoesNotShareInputLists() {
        // Given
        NetworkSnapshot network = build();
        Station original = network.findStation("A").orElseThrow();

        // When
        data.getLines().get(0).getStationIds().add("D");

        // Then
        assertEquals(3, network.findLine("L1").orElseThrow().getStationIds().size());
        assertEquals("Station A", original.getName());
    }

    private NetworkSnapshot build() {
        return builder.build(data.getStations(), data.getLines(), data.getTransferLinks());
    }
}
