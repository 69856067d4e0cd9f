package com.routely.backend.client;

import com.routely.backend.model.NetworkOverlay;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Pulls the live closure and delay overlay from the operators' status service.
 */
@Component
@Slf4j
public class ServiceStatusClient implements ServiceStatusApi {

        private final WebClient webClient;
        private final boolean enabled;
        private final String overlayPath;
        private final int apiTimeout;

        public ServiceStatusClient(WebClient.Builder webClientBuilder,
                        @Value("${routely.status.enabled:false}") boolean enabled,
                        @Value("${routely.status.base-url:http://localhost:8081}") String baseUrl,
                        @Value("${routely.status.overlay-path:/api/v1/status/overlay}") String overlayPath,
                        @Value("${routely.status.timeout-seconds:2}") int apiTimeout) {
                this.enabled = enabled;
                this.overlayPath = overlayPath;
                this.apiTimeout = apiTimeout;
                this.webClient = webClientBuilder
                                .baseUrl(baseUrl)
                                .codecs(configurer -> configurer
                                                .defaultCodecs()
                                                .maxInMemorySize(512 * 1024))
                                .build();
                log.info("Service status client {} ({})", enabled ? "enabled" : "disabled", baseUrl);
        }

        @Override
        public boolean isEnabled() {
                return enabled;
        }

        @Override
        public NetworkOverlay currentOverlay() {
                if (!enabled) {
                        return NetworkOverlay.empty();
                }
                NetworkOverlay overlay = webClient.get()
                                .uri(uriBuilder -> uriBuilder.path(overlayPath).build())
                                .retrieve()
                                .bodyToMono(NetworkOverlay.class)
                                .timeout(Duration.ofSeconds(apiTimeout))
                                .block();
                return overlay == null ? NetworkOverlay.empty() : overlay;
        }
}
