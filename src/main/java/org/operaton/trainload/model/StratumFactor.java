package org.operaton.trainload.model;

import lombok.Value;

/**
 * Learned scaling factor restricted to one sport or one intensity band.
 */
@Value
public class StratumFactor {
    double factor;
    int sampleCount;
    double confidence;
}
