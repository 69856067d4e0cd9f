package com.routely.backend.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routely.backend.exception.IntegrityException;
import com.routely.backend.model.NetworkData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the whole network from one JSON document, by default the seed bundled with the service.
 */
@Component
@ConditionalOnProperty(name = "routely.network.source", havingValue = "classpath", matchIfMissing = true)
@Slf4j
public class ClasspathNetworkDataSource implements NetworkDataSource {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final String location;

    public ClasspathNetworkDataSource(ObjectMapper objectMapper, ResourceLoader resourceLoader,
            @Value("${routely.network.seed:classpath:network/bangkok-network.json}") String location) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.location = location;
    }

    @Override
    public NetworkData load() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IntegrityException("Network seed not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            NetworkData data = objectMapper.readValue(in, NetworkData.class);
            log.info("DATA: 🟢 Read {} stations, {} lines, {} transfer links from {}",
                    data.getStations().size(), data.getLines().size(), data.getTransferLinks().size(), location);
            return data;
        } catch (IOException e) {
            throw new IntegrityException("Network seed " + location + " is unreadable: " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return location;
    }
}
