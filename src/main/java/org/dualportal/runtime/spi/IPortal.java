package org.dualportal.runtime.spi;

import java.util.List;

/**
 * Service Provider Interface for a single resonance portal.
 * <p>
 * A portal owns its own physics: how energy accumulates over time and how stability
 * and safety are derived from payload and floor sensor readings. The
 * {@link org.dualportal.runtime.BridgeController} only reads the exposed attributes
 * and drives the lifecycle operations declared here.
 */
public interface IPortal {

    /**
     * Creates portals for a controller. The controller calls this once per portal at
     * construction time.
     */
    @FunctionalInterface
    interface Factory {

        /**
         * @param frequency The nominal resonance frequency of the portal in Hz.
         * @param power     The energy rate in joules per second.
         * @return A new portal in its baseline state.
         */
        IPortal create(double frequency, double power);
    }

    /**
     * Returns the portal to its baseline state: no energy, full stability, safe,
     * no payload and no floor readings.
     */
    void reset();

    /**
     * Records the payload currently sitting in the portal. Either value may be {@code null}.
     *
     * @param volume The payload volume in cubic metres.
     * @param mass   The payload mass in kilograms.
     */
    void sensePayload(Double volume, Double mass);

    /**
     * Records a floor sensor reading. Either value may be {@code null}.
     *
     * @param temperature The floor temperature in degrees Celsius.
     * @param contact     Whether the floor plate reports contact.
     */
    void floorSensor(Double temperature, Boolean contact);

    /**
     * Advances the portal's energy accumulation by the given time delta.
     *
     * @param dt The elapsed time in seconds.
     * @throws IllegalArgumentException if {@code dt} is negative or not a number.
     */
    void updateEnergy(double dt);

    /**
     * Removes energy from the portal. The stored energy never drops below zero.
     *
     * @param amount The energy to remove in joules.
     * @throws IllegalArgumentException if {@code amount} is negative or not a number.
     */
    void debitEnergy(double amount);

    /**
     * Drops the payload state of the portal.
     */
    void clearPayload();

    boolean hasPayload();

    double getFrequency();

    double getEnergy();

    /**
     * @return The stability of the portal in {@code [0, 1]}.
     */
    double getStability();

    boolean isSafe();

    /**
     * Produces a multi-line human-readable report of the portal state.
     *
     * @return The report lines in display order.
     */
    List<String> reportStatus();
}
