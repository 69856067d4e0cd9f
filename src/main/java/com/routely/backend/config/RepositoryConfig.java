package com.routely.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.firestore.Firestore;
import com.routely.backend.model.Line;
import com.routely.backend.model.PassengerType;
import com.routely.backend.model.Station;
import com.routely.backend.model.TransferLink;
import com.routely.backend.model.ZoneFareRule;
import com.routely.backend.repository.DataRepository;
import com.routely.backend.repository.firestore.GenericFirestoreRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Firestore repositories, one per network collection. Only active with {@code routely.network.source=firestore}.
 */
@Configuration
@ConditionalOnProperty(name = "routely.network.source", havingValue = "firestore")
public class RepositoryConfig {

    @Value("${firestore.collection-prefix:}")
    private String collectionPrefix;

    @Bean
    public DataRepository<Station> stationRepository(Firestore firestore, ObjectMapper objectMapper) {
        return new GenericFirestoreRepository<>(firestore, collectionPrefix + "stations", Station.class, objectMapper);
    }

    @Bean
    public DataRepository<Line> lineRepository(Firestore firestore, ObjectMapper objectMapper) {
        return new GenericFirestoreRepository<>(firestore, collectionPrefix + "lines", Line.class, objectMapper);
    }

    @Bean
    public DataRepository<TransferLink> transferLinkRepository(Firestore firestore,
            ObjectMapper objectMapper) {
        return new GenericFirestoreRepository<>(firestore, collectionPrefix + "transferLinks", TransferLink.class,
                objectMapper);
    }

    @Bean
    public DataRepository<ZoneFareRule> fareRuleRepository(Firestore firestore, ObjectMapper objectMapper) {
        return new GenericFirestoreRepository<>(firestore, collectionPrefix + "fareRules", ZoneFareRule.class,
                objectMapper);
    }

    @Bean
    public DataRepository<PassengerType> passengerTypeRepository(Firestore firestore,
            ObjectMapper objectMapper) {
        return new GenericFirestoreRepository<>(firestore, collectionPrefix + "passengerTypes", PassengerType.class,
                objectMapper);
    }
}
