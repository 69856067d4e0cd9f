package com.routely.backend.routing;

import com.routely.backend.network.NetworkEdge;
import lombok.Value;

/**
 * Linear weighting of minutes, cost and transfers. All weights are non-negative, so Dijkstra stays exact.
 */
@Value
public class ObjectiveWeights {
    double timeWeight;
    double costWeight;
    double transferPenalty;

    public ObjectiveWeights(double timeWeight, double costWeight, double transferPenalty) {
        if (timeWeight < 0 || costWeight < 0 || transferPenalty < 0) {
            throw new IllegalArgumentException("Objective weights must be non-negative");
        }
        this.timeWeight = timeWeight;
        this.costWeight = costWeight;
        this.transferPenalty = transferPenalty;
    }

    public double score(NetworkEdge edge) {
        double score = timeWeight * edge.timeWeight() + costWeight * edge.costWeight();
        if (edge.isTransfer()) {
            score += transferPenalty;
        }
        return score;
    }
}
