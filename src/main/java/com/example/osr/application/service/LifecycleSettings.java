package com.example.osr.application.service;

import java.time.Duration;
import java.util.Objects;

/**
 * Runtime settings for the order lifecycle engine.
 *
 * @param osrId       the OSR this engine submits to; records addressed to another OSR are read-only
 * @param callTimeout timeout applied to every OSR call
 * @param dryRun      rehearse every submission without contacting the OSR
 */
public record LifecycleSettings(String osrId, Duration callTimeout, boolean dryRun) {

    public LifecycleSettings {
        if (osrId == null || osrId.isBlank()) {
            throw new IllegalArgumentException("OSR id cannot be blank");
        }
        Objects.requireNonNull(callTimeout, "Call timeout cannot be null");
        if (callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("Call timeout must be positive: " + callTimeout);
        }
    }
}
