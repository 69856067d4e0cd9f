package com.routely.backend.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class SnapshotInfo {
    long version;
    LocalDateTime builtAt;
    int stationCount;
    int lineCount;
    int edgeCount;
    int fareRuleCount;
    int passengerTypeCount;
}
