package com.routely.backend.service;

import com.routely.backend.fare.FareTable;
import com.routely.backend.model.SnapshotInfo;
import com.routely.backend.network.NetworkSnapshot;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Network and fare table built from the same source data. Swapped as one unit.
 */
@Value
public class PlannerSnapshot {
    long version;
    LocalDateTime builtAt;
    NetworkSnapshot network;
    FareTable fareTable;

    public SnapshotInfo info() {
        return SnapshotInfo.builder()
                .version(version)
                .builtAt(builtAt)
                .stationCount(network.stationCount())
                .lineCount(network.lineCount())
                .edgeCount(network.edgeCount())
                .fareRuleCount(fareTable.ruleCount())
                .passengerTypeCount(fareTable.passengerTypes().size())
                .build();
    }
}
