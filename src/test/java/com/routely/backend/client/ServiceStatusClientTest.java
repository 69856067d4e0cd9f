package com.routely.backend.client;

import com.routely.backend.model.NetworkOverlay;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ServiceStatusClientTest {

    private static final String OVERLAY_JSON = "{\"closedLineIds\":[\"MRT_PP\"],"
            + "\"lineDelayMinutes\":{\"BTS_SUK\":4}}";

    @Test
    void testCurrentOverlay_Enabled_ParsesBody() {
        // Given
        List<ClientRequest> requests = new ArrayList<>();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(OVERLAY_JSON)
                    .build());
        });
        ServiceStatusClient client = new ServiceStatusClient(builder, true, "http://status.local",
                "/api/v1/status/overlay", 2);

        // When
        NetworkOverlay overlay = client.currentOverlay();

        // Then
        assertTrue(client.isEnabled());
        assertEquals(Set.of("MRT_PP"), overlay.getClosedLineIds());
        assertEquals(Map.of("BTS_SUK", 4), overlay.getLineDelayMinutes());
        assertEquals(1, requests.size());
        assertEquals("/api/v1/status/overlay", requests.get(0).url().getPath());
    }

    @Test
    void testCurrentOverlay_Disabled_NeverCalls() {
        List<ClientRequest> requests = new ArrayList<>();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.error(new IllegalStateException("should not be called"));
        });
        ServiceStatusClient client = new ServiceStatusClient(builder, false, "http://status.local",
                "/api/v1/status/overlay", 2);

        NetworkOverlay overlay = client.currentOverlay();

        assertFalse(client.isEnabled());
        assertTrue(overlay.isEmpty());
        assertTrue(requests.isEmpty());
    }
}
