package org.dualportal.runtime;

import com.typesafe.config.Config;

/**
 * Construction-time settings for a {@link BridgeController}.
 * <p>
 * Read once from the {@code dualportal} configuration block and never revisited.
 * <ul>
 *   <li><b>resonance-frequency:</b> The nominal resonance frequency (Hz) used as the
 *   reference in the detune penalty.</li>
 *   <li><b>base-frequency:</b> The nominal frequency of portal A. Defaults to the
 *   resonance frequency.</li>
 *   <li><b>detune:</b> The signed offset (Hz) of portal B relative to portal A.</li>
 *   <li><b>energy-rate:</b> The energy rate (J/s) passed to both portals.</li>
 * </ul>
 *
 * @param resonanceFrequency The reference resonance frequency in Hz, strictly positive.
 * @param baseFrequency      The nominal frequency of portal A in Hz.
 * @param detune             The frequency offset of portal B in Hz.
 * @param energyRate         The energy rate of both portals in J/s, non-negative.
 */
public record BridgeSettings(double resonanceFrequency, double baseFrequency, double detune, double energyRate) {

    public static final double DEFAULT_RESONANCE_FREQUENCY = 7.83;
    public static final double DEFAULT_DETUNE = 0.08;
    public static final double DEFAULT_ENERGY_RATE = 500.0;

    public BridgeSettings {
        if (!(resonanceFrequency > 0.0) || Double.isInfinite(resonanceFrequency)) {
            throw new IllegalArgumentException("resonance-frequency must be positive and finite, got " + resonanceFrequency);
        }
        if (!Double.isFinite(baseFrequency)) {
            throw new IllegalArgumentException("base-frequency must be finite, got " + baseFrequency);
        }
        if (!Double.isFinite(detune)) {
            throw new IllegalArgumentException("detune must be finite, got " + detune);
        }
        if (!(energyRate >= 0.0) || Double.isInfinite(energyRate)) {
            throw new IllegalArgumentException("energy-rate must be non-negative and finite, got " + energyRate);
        }
    }

    /**
     * Settings where portal A runs at the resonance frequency.
     */
    public BridgeSettings(double resonanceFrequency, double detune, double energyRate) {
        this(resonanceFrequency, resonanceFrequency, detune, energyRate);
    }

    public static BridgeSettings defaults() {
        return new BridgeSettings(DEFAULT_RESONANCE_FREQUENCY, DEFAULT_DETUNE, DEFAULT_ENERGY_RATE);
    }

    /**
     * Reads settings from the {@code dualportal} block. Missing keys fall back to the defaults.
     *
     * @param config The {@code dualportal} configuration block.
     * @return The validated settings.
     * @throws IllegalArgumentException if a value is out of range.
     * @throws com.typesafe.config.ConfigException if a value has the wrong type.
     */
    public static BridgeSettings fromConfig(Config config) {
        double resonance = config.hasPath("resonance-frequency")
                ? config.getDouble("resonance-frequency") : DEFAULT_RESONANCE_FREQUENCY;
        double base = config.hasPath("base-frequency") ? config.getDouble("base-frequency") : resonance;
        double detune = config.hasPath("detune") ? config.getDouble("detune") : DEFAULT_DETUNE;
        double rate = config.hasPath("energy-rate") ? config.getDouble("energy-rate") : DEFAULT_ENERGY_RATE;
        return new BridgeSettings(resonance, base, detune, rate);
    }

    /**
     * @return A copy of these settings with a different detune.
     */
    public BridgeSettings withDetune(double newDetune) {
        return new BridgeSettings(resonanceFrequency, baseFrequency, newDetune, energyRate);
    }

    /**
     * @return The nominal frequency of portal B.
     */
    public double detunedFrequency() {
        return baseFrequency + detune;
    }
}
