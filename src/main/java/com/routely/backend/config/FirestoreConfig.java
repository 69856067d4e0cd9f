package com.routely.backend.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.NoCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.ByteArrayInputStream;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Firestore client for the topology collections. Credentials come from a JSON string, a file
 * or the GCP environment. Setting {@code firestore.emulator-host} targets a local emulator
 * instead and skips credentials entirely.
 */
@Configuration
@ConditionalOnProperty(name = "routely.network.source", havingValue = "firestore")
@Slf4j
public class FirestoreConfig {

    @Value("${firestore.project-id:}")
    private String projectId;

    @Value("${firestore.credentials-path:}")
    private String credentialsPath;

    @Value("${firestore.credentials-json:}")
    private String credentialsJson;

    @Value("${firestore.emulator-host:}")
    private String emulatorHost;

    @Bean
    public Firestore firestore() throws IOException {
        if (emulatorHost != null && !emulatorHost.isEmpty()) {
            String project = projectId != null && !projectId.isEmpty() ? projectId : "routely-local";
            log.info("🧪 Using Firestore emulator at {} (project {})", emulatorHost, project);
            return FirestoreOptions.newBuilder()
                    .setEmulatorHost(emulatorHost)
                    .setCredentials(NoCredentials.getInstance())
                    .setProjectId(project)
                    .build()
                    .getService();
        }

        GoogleCredentials credentials = getCredentials();

        if (credentials == null) {
            log.warn("⚠️ Firestore credentials not configured. Network rebuilds will find no data.");
            return null;
        }

        FirestoreOptions.Builder builder = FirestoreOptions.newBuilder()
                .setCredentials(credentials);

        if (projectId != null && !projectId.isEmpty()) {
            builder.setProjectId(projectId);
        }

        Firestore firestore = builder.build().getService();
        log.info("✅ Firestore initialized successfully for project: {}",
                projectId != null && !projectId.isEmpty() ? projectId : "(default)");
        return firestore;
    }

    private GoogleCredentials getCredentials() throws IOException {
        if (credentialsJson != null && !credentialsJson.isEmpty()) {
            log.info("🔐 Loading Firestore credentials from JSON string");
            InputStream stream = new ByteArrayInputStream(credentialsJson.getBytes(StandardCharsets.UTF_8));
            return GoogleCredentials.fromStream(stream);
        }

        if (credentialsPath != null && !credentialsPath.isEmpty()) {
            log.info("🔐 Loading Firestore credentials from file: {}", credentialsPath);
            try (InputStream stream = new FileInputStream(credentialsPath)) {
                return GoogleCredentials.fromStream(stream);
            }
        }

        // Fall back to the GCP environment
        try {
            log.info("🔐 Attempting to load default Firestore credentials");
            return GoogleCredentials.getApplicationDefault();
        } catch (IOException e) {
            log.warn("⚠️ No Firestore credentials found: {}", e.getMessage());
            return null;
        }
    }
}
