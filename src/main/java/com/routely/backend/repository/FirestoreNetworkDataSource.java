package com.routely.backend.repository;

import com.routely.backend.model.Line;
import com.routely.backend.model.NetworkData;
import com.routely.backend.model.PassengerType;
import com.routely.backend.model.Station;
import com.routely.backend.model.TransferLink;
import com.routely.backend.model.ZoneFareRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "routely.network.source", havingValue = "firestore")
@RequiredArgsConstructor
@Slf4j
public class FirestoreNetworkDataSource implements NetworkDataSource {

    private final DataRepository<Station> stationRepository;
    private final DataRepository<Line> lineRepository;
    private final DataRepository<TransferLink> transferLinkRepository;
    private final DataRepository<ZoneFareRule> fareRuleRepository;
    private final DataRepository<PassengerType> passengerTypeRepository;

    @Override
    public NetworkData load() {
        log.info("DATA: 📡 Loading network from Firestore...");
        return NetworkData.builder()
                .stations(stationRepository.findAll())
                .lines(lineRepository.findAll())
                .transferLinks(transferLinkRepository.findAll())
                .fareRules(fareRuleRepository.findAll())
                .passengerTypes(passengerTypeRepository.findAll())
                .build();
    }

    @Override
    public String describe() {
        return "firestore";
    }
}
