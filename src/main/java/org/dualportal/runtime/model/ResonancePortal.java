package org.dualportal.runtime.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.dualportal.runtime.spi.IPortal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link IPortal} implementation.
 * <p>
 * Energy accumulates linearly at a fixed rate. Stability starts at {@code 1.0} and is
 * reduced by the configured penalties:
 * <ul>
 *   <li>floor contact explicitly lost,</li>
 *   <li>floor temperature above the cryogenic threshold,</li>
 *   <li>payload mass, proportionally to {@code mass / maxPayloadMass}.</li>
 * </ul>
 * The portal is unsafe when the payload exceeds the mass or volume limit, when floor
 * contact is explicitly lost, or when stability falls below the safe minimum.
 * Absent readings ({@code null}) never trigger a penalty.
 */
public class ResonancePortal implements IPortal {

    private static final Logger LOG = LoggerFactory.getLogger(ResonancePortal.class);

    private final double frequency;
    private final double power;
    private final PortalLimits limits;

    private double energy;
    private double stability;
    private boolean safe;
    private Payload payload;
    private Double floorTemperature;
    private Boolean floorContact;

    public ResonancePortal(double frequency, double power) {
        this(frequency, power, PortalLimits.defaults());
    }

    /**
     * @param frequency The nominal frequency in Hz.
     * @param power     The energy rate in J/s, non-negative.
     * @param limits    The stability and safety limits.
     */
    public ResonancePortal(double frequency, double power, PortalLimits limits) {
        if (!(power >= 0.0) || Double.isInfinite(power)) {
            throw new IllegalArgumentException("power must be non-negative and finite, got " + power);
        }
        if (limits == null) {
            throw new IllegalArgumentException("limits must not be null");
        }
        this.frequency = frequency;
        this.power = power;
        this.limits = limits;
        clearState();
    }

    /**
     * @return A factory producing portals that share the given limits.
     */
    public static IPortal.Factory factory(PortalLimits limits) {
        return (frequency, power) -> new ResonancePortal(frequency, power, limits);
    }

    @Override
    public void reset() {
        clearState();
    }

    private void clearState() {
        energy = 0.0;
        payload = null;
        floorTemperature = null;
        floorContact = null;
        recompute();
    }

    @Override
    public void sensePayload(Double volume, Double mass) {
        payload = (volume == null && mass == null) ? null : new Payload(volume, mass);
        recompute();
    }

    @Override
    public void floorSensor(Double temperature, Boolean contact) {
        floorTemperature = temperature;
        floorContact = contact;
        recompute();
    }

    @Override
    public void updateEnergy(double dt) {
        if (!(dt >= 0.0)) {
            throw new IllegalArgumentException("dt must be non-negative, got " + dt);
        }
        energy += power * dt;
    }

    @Override
    public void debitEnergy(double amount) {
        if (!(amount >= 0.0)) {
            throw new IllegalArgumentException("amount must be non-negative, got " + amount);
        }
        energy = Math.max(0.0, energy - amount);
    }

    @Override
    public void clearPayload() {
        payload = null;
        recompute();
    }

    @Override
    public boolean hasPayload() {
        return payload != null;
    }

    public Payload getPayload() {
        return payload;
    }

    @Override
    public double getFrequency() { return frequency; }

    public double getPower() { return power; }

    @Override
    public double getEnergy() { return energy; }

    @Override
    public double getStability() { return stability; }

    @Override
    public boolean isSafe() { return safe; }

    @Override
    public List<String> reportStatus() {
        List<String> lines = new ArrayList<>();
        lines.add(String.format(Locale.ROOT, "Portal @ %.3f Hz", frequency));
        lines.add(String.format(Locale.ROOT, "  Energy: %.2f J (rate %.1f J/s)", energy, power));
        lines.add(String.format(Locale.ROOT, "  Stability: %.2f", stability));
        lines.add("  Safety: " + (safe ? "OK" : "FAULT"));
        lines.add("  Payload: " + describePayload());
        lines.add("  Floor: " + describeFloor());
        return lines;
    }

    private void recompute() {
        double s = 1.0;
        if (Boolean.FALSE.equals(floorContact)) {
            s -= limits.contactLossPenalty();
        }
        if (floorTemperature != null && floorTemperature > limits.cryogenicThreshold()) {
            s -= limits.warmFloorPenalty();
        }
        Double mass = payload != null ? payload.mass() : null;
        if (mass != null && mass > 0.0) {
            s -= limits.loadPenalty() * Math.min(1.0, mass / limits.maxPayloadMass());
        }
        stability = Math.max(0.0, Math.min(1.0, s));

        boolean overweight = mass != null && mass > limits.maxPayloadMass();
        Double volume = payload != null ? payload.volume() : null;
        boolean oversized = volume != null && volume > limits.maxPayloadVolume();
        safe = !overweight
                && !oversized
                && !Boolean.FALSE.equals(floorContact)
                && stability >= limits.minSafeStability();

        if (!safe) {
            LOG.debug("Portal at {} Hz unsafe (stability={}, overweight={}, oversized={}, contact={})",
                    frequency, stability, overweight, oversized, floorContact);
        }
    }

    private String describePayload() {
        if (payload == null) {
            return "none";
        }
        return String.format(Locale.ROOT, "volume=%s m^3, mass=%s kg",
                payload.volume() != null ? String.format(Locale.ROOT, "%.3f", payload.volume()) : "n/a",
                payload.mass() != null ? String.format(Locale.ROOT, "%.1f", payload.mass()) : "n/a");
    }

    private String describeFloor() {
        String temp = floorTemperature != null ? String.format(Locale.ROOT, "%.1f degC", floorTemperature) : "n/a";
        String contact = floorContact != null ? floorContact.toString() : "n/a";
        return "temperature=" + temp + ", contact=" + contact;
    }
}
