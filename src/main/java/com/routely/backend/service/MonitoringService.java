package com.routely.backend.service;

public interface MonitoringService {
    /**
     * Records the duration and outcome of a planning call.
     *
     * @param preference The preference value (e.g., "fastest")
     * @param durationMs The duration of the call in milliseconds
     * @param status     The outcome (e.g., "SUCCESS", "NO_PATH")
     */
    void recordPlanningDuration(String preference, long durationMs, String status);

    /**
     * Records the duration and outcome of a network rebuild.
     */
    void recordRebuildDuration(long durationMs, String status);

    void recordItineraryCount(String preference, int count);
}
