package org.operaton.trainload.model;

import lombok.Builder;
import lombok.Value;

/**
 * Counts from one route enrichment pass over local workouts without a route.
 */
@Value
@Builder
public class RouteEnrichmentResult {
    int total;
    int matched;
    int enriched;
    int noRoute;
    int unmatched;
}
