package dev.beacon.service;

import org.springframework.stereotype.Component;

/**
 * Coarse likelihood that a seeker accepts a connection, from the seeker-perspective score alone.
 */
@Component
public class AcceptanceEstimator {

    private static final double[][] STEPS = {
            {90.0, 0.95},
            {80.0, 0.85},
            {70.0, 0.70},
            {60.0, 0.50},
            {50.0, 0.30},
            {40.0, 0.20},
    };
    private static final double FLOOR = 0.10;

    public double estimate(double seekerScore) {
        for (double[] step : STEPS) {
            if (seekerScore >= step[0]) {
                return step[1];
            }
        }
        return FLOOR;
    }
}
