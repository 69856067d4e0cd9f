package com.routely.backend.controller;

import com.routely.backend.TestNetworks;
import com.routely.backend.exception.GlobalExceptionHandler;
import com.routely.backend.exception.SnapshotUnavailableException;
import com.routely.backend.fare.FareCalculator;
import com.routely.backend.service.FareQuoteService;
import com.routely.backend.service.NetworkSnapshotService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class NetworkControllerTest {

    @Mock
    private NetworkSnapshotService snapshotService;
    @Mock
    private FareQuoteService fareQuoteService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(
                        new NetworkController(snapshotService),
                        new FareController(fareQuoteService, snapshotService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testGetStations_FilteredByLine() throws Exception {
        when(snapshotService.current()).thenReturn(TestNetworks.snapshot(TestNetworks.twoLines()));

        mockMvc.perform(get("/api/v1/network/stations").param("lineId", "L2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].id").value("B2"))
                .andExpect(jsonPath("$[1].id").value("D"));
    }

    @Test
    void testGetLines() throws Exception {
        when(snapshotService.current()).thenReturn(TestNetworks.snapshot(TestNetworks.twoLines()));

        mockMvc.perform(get("/api/v1/network/lines"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("L1"))
                .andExpect(jsonPath("$[0].stationIds.length()").value(3));
    }

    @Test
    void testGetPassengerTypes() throws Exception {
        when(snapshotService.current()).thenReturn(TestNetworks.snapshot(TestNetworks.twoLines()));

        mockMvc.perform(get("/api/v1/fares/passenger-types"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[2].id").value("child"))
                .andExpect(jsonPath("$[2].category").value("CHILD"));
    }

    @Test
    void testGetStations_NotBuilt_503() throws Exception {
        when(snapshotService.current()).thenThrow(new SnapshotUnavailableException());

        mockMvc.perform(get("/api/v1/network/stations"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.retryable").value(true));
    }
}
