package com.routely.backend.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of checking a plan request without planning it. A request can be valid yet infeasible
 * when no route can satisfy it on the current network.
 */
@Value
@Builder
public class PlanValidation {
    long snapshotVersion;
    boolean valid;
    boolean feasible;
    List<RequestIssue> issues;
    List<String> warnings;
}
