package org.dualportal.runtime.model;

import com.typesafe.config.Config;

/**
 * Thresholds and penalties that drive the stability and safety of a {@link ResonancePortal}.
 * <p>
 * Configuration structure ({@code dualportal.portal}):
 * <pre>
 * max-payload-mass = 1000.0      # kg, heavier payloads are unsafe
 * max-payload-volume = 10.0      # m^3, larger payloads are unsafe
 * cryogenic-threshold = -150.0   # degC, warmer floors degrade stability
 * contact-loss-penalty = 0.3
 * warm-floor-penalty = 0.15
 * load-penalty = 0.05            # scaled by mass / max-payload-mass
 * min-safe-stability = 0.5
 * </pre>
 */
public record PortalLimits(
        double maxPayloadMass,
        double maxPayloadVolume,
        double cryogenicThreshold,
        double contactLossPenalty,
        double warmFloorPenalty,
        double loadPenalty,
        double minSafeStability) {

    public PortalLimits {
        requirePositive("max-payload-mass", maxPayloadMass);
        requirePositive("max-payload-volume", maxPayloadVolume);
        if (!Double.isFinite(cryogenicThreshold)) {
            throw new IllegalArgumentException("cryogenic-threshold must be finite, got " + cryogenicThreshold);
        }
        requireFraction("contact-loss-penalty", contactLossPenalty);
        requireFraction("warm-floor-penalty", warmFloorPenalty);
        requireFraction("load-penalty", loadPenalty);
        requireFraction("min-safe-stability", minSafeStability);
    }

    public static PortalLimits defaults() {
        return new PortalLimits(1000.0, 10.0, -150.0, 0.3, 0.15, 0.05, 0.5);
    }

    /**
     * Reads limits from the {@code portal} block. Missing keys keep their default.
     *
     * @param config The {@code dualportal.portal} configuration block.
     * @return The validated limits.
     */
    public static PortalLimits fromConfig(Config config) {
        PortalLimits d = defaults();
        return new PortalLimits(
                read(config, "max-payload-mass", d.maxPayloadMass()),
                read(config, "max-payload-volume", d.maxPayloadVolume()),
                read(config, "cryogenic-threshold", d.cryogenicThreshold()),
                read(config, "contact-loss-penalty", d.contactLossPenalty()),
                read(config, "warm-floor-penalty", d.warmFloorPenalty()),
                read(config, "load-penalty", d.loadPenalty()),
                read(config, "min-safe-stability", d.minSafeStability()));
    }

    private static double read(Config config, String path, double fallback) {
        return config.hasPath(path) ? config.getDouble(path) : fallback;
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be positive and finite, got " + value);
        }
    }

    private static void requireFraction(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be within [0, 1], got " + value);
        }
    }
}
