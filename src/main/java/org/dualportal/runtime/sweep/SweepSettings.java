package org.dualportal.runtime.sweep;

import com.typesafe.config.Config;

/**
 * Grid definition of a {@link ParameterSweep}, read from the {@code dualportal.sweep} block.
 * <ul>
 *   <li><b>energy-range:</b> The level both portals are charged to, and the highest energy
 *   offered to the bridge (J).</li>
 *   <li><b>detune-range:</b> Detune values are spread over {@code [-range, +range]} (Hz).</li>
 *   <li><b>steps:</b> Values per axis.</li>
 * </ul>
 *
 * @param energyRange The charge level and highest bridge input in joules, positive and finite.
 * @param detuneRange The detune span in Hz, non-negative and finite.
 * @param steps       The number of values per axis, at least 1.
 */
public record SweepSettings(double energyRange, double detuneRange, int steps) {

    public static final double DEFAULT_ENERGY_RANGE = 1000.0;
    public static final double DEFAULT_DETUNE_RANGE = 0.5;
    public static final int DEFAULT_STEPS = 5;

    public SweepSettings {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be at least 1, got " + steps);
        }
        if (!(energyRange > 0.0) || Double.isInfinite(energyRange)) {
            throw new IllegalArgumentException("energyRange must be positive and finite, got " + energyRange);
        }
        if (!(detuneRange >= 0.0) || Double.isInfinite(detuneRange)) {
            throw new IllegalArgumentException("detuneRange must be non-negative and finite, got " + detuneRange);
        }
    }

    public static SweepSettings defaults() {
        return new SweepSettings(DEFAULT_ENERGY_RANGE, DEFAULT_DETUNE_RANGE, DEFAULT_STEPS);
    }

    /**
     * Reads the grid from the {@code dualportal.sweep} block. Missing keys fall back to the defaults.
     *
     * @param config The {@code sweep} configuration block.
     * @return The validated settings.
     * @throws IllegalArgumentException if a value is out of range.
     * @throws com.typesafe.config.ConfigException if a value has the wrong type.
     */
    public static SweepSettings fromConfig(Config config) {
        double energy = config.hasPath("energy-range") ? config.getDouble("energy-range") : DEFAULT_ENERGY_RANGE;
        double detune = config.hasPath("detune-range") ? config.getDouble("detune-range") : DEFAULT_DETUNE_RANGE;
        int steps = config.hasPath("steps") ? config.getInt("steps") : DEFAULT_STEPS;
        return new SweepSettings(energy, detune, steps);
    }

    /**
     * Replaces the values that are given; {@code null} keeps the current one.
     */
    public SweepSettings override(Double newEnergyRange, Double newDetuneRange, Integer newSteps) {
        return new SweepSettings(
                newEnergyRange != null ? newEnergyRange : energyRange,
                newDetuneRange != null ? newDetuneRange : detuneRange,
                newSteps != null ? newSteps : steps);
    }
}
