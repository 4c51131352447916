package org.operaton.trainload.model;

/**
 * GPS coordinate of a route.
 */
public record RoutePoint(double latitude, double longitude) {
}
