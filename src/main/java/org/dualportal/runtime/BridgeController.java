package org.dualportal.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.dualportal.runtime.model.PortalLimits;
import org.dualportal.runtime.model.ResonancePortal;
import org.dualportal.runtime.runid.RandomRunIdGenerator;
import org.dualportal.runtime.spi.IPortal;
import org.dualportal.runtime.spi.IRunIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manages two linked resonance portals: run initialization, bridge formation, one-shot
 * payload transfer and the audit trail of every run.
 * <p>
 * Every control operation appends at least one entry to the status log. Failures are
 * reported through {@link TransferResult} values or zeroed bridge state plus a log entry,
 * never through exceptions.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. All calls on one instance must be
 * externally serialized.
 */
public class BridgeController {

    private static final Logger LOG = LoggerFactory.getLogger(BridgeController.class);

    static final double STABILITY_THRESHOLD = 0.9;
    static final double STABILITY_PENALTY = 0.7;
    static final double MAX_STRENGTH_THRESHOLD = 0.95;
    static final double MIN_TRANSFER_STRENGTH = 0.5;
    static final double TRANSFER_EFFICIENCY = 0.8;
    static final double MIN_TRANSFER_ENERGY = 100.0;
    static final double TRANSFER_COST_FRACTION = 0.1;

    private final BridgeSettings settings;
    private final IPortal portalA;
    private final IPortal portalB;
    private final IRunIdGenerator runIdGenerator;
    private final double detune;

    private double bridgeStrength = 0.0;
    private double transferEnergy = 0.0;
    private final List<String> statusLog = new ArrayList<>();
    private String runId;

    /**
     * Creates a controller with {@link ResonancePortal}s using default limits and random run ids.
     */
    public BridgeController(BridgeSettings settings) {
        this(settings, ResonancePortal.factory(PortalLimits.defaults()), new RandomRunIdGenerator());
    }

    /**
     * @param settings       The bridge settings, read once.
     * @param portalFactory  Creates portal A at the base frequency and portal B at the detuned frequency.
     * @param runIdGenerator The source of run identifiers.
     */
    public BridgeController(BridgeSettings settings, IPortal.Factory portalFactory, IRunIdGenerator runIdGenerator) {
        if (settings == null || portalFactory == null || runIdGenerator == null) {
            throw new IllegalArgumentException("settings, portalFactory and runIdGenerator must not be null");
        }
        this.settings = settings;
        this.detune = settings.detune();
        this.portalA = portalFactory.create(settings.baseFrequency(), settings.energyRate());
        this.portalB = portalFactory.create(settings.detunedFrequency(), settings.energyRate());
        this.runIdGenerator = runIdGenerator;
    }

    /**
     * Starts a run without payload or floor readings.
     */
    public void initializeRun() {
        initializeRun(null, null, null, null, null, null);
    }

    /**
     * Starts a new run. Resets both portals, feeds them the payload and their own floor
     * readings, clears the log and draws a fresh run id. All arguments may be {@code null}
     * and are passed to the portals unchecked.
     */
    public void initializeRun(Double payloadVolume, Double payloadMass,
                              Double floorTempA, Boolean floorContactA,
                              Double floorTempB, Boolean floorContactB) {
        portalA.reset();
        portalB.reset();
        portalA.sensePayload(payloadVolume, payloadMass);
        portalB.sensePayload(payloadVolume, payloadMass);
        portalA.floorSensor(floorTempA, floorContactA);
        portalB.floorSensor(floorTempB, floorContactB);
        statusLog.clear();
        runId = runIdGenerator.nextRunId();
        audit("[INFO] Run " + runId + " initialized.");
        LOG.info("Run {} initialized", runId);
    }

    /**
     * Forms the bridge using the lesser of the two portals' energy as input.
     */
    public void formBridge() {
        formBridge(Math.min(portalA.getEnergy(), portalB.getEnergy()));
    }

    /**
     * Recomputes the bridge strength from the current portal state. No memory of earlier calls.
     * <p>
     * Only portal A's stability enters the denominator. The stability penalty stacks on top
     * of the clamped ratio; the safety veto overrides both.
     *
     * @param energyInput The energy offered to the bridge in joules.
     */
    public void formBridge(double energyInput) {
        transferEnergy = (energyInput >= 0.0) ? energyInput : 0.0;

        double minEnergy = portalA.getEnergy() * (1.0 + Math.abs(detune) / settings.resonanceFrequency());
        double denominator = minEnergy * portalA.getStability();
        double strength = 0.0;
        if (minEnergy > 0.0 && denominator > 0.0) {
            double ratio = energyInput / denominator;
            strength = Double.isNaN(ratio) ? 0.0 : clamp(ratio);
        }

        if (portalA.getStability() < STABILITY_THRESHOLD || portalB.getStability() < STABILITY_THRESHOLD) {
            strength *= STABILITY_PENALTY;
            audit("[WARN] Portal stability below threshold - bridge degraded.");
            LOG.warn("Run {}: portal stability below {} (A={}, B={}), bridge degraded",
                    runId, STABILITY_THRESHOLD, portalA.getStability(), portalB.getStability());
        }

        if (!(portalA.isSafe() && portalB.isSafe())) {
            strength = 0.0;
            audit("[ERROR] Safety failure - bridge formation blocked.");
            LOG.error("Run {}: safety failure (A safe={}, B safe={}), bridge blocked",
                    runId, portalA.isSafe(), portalB.isSafe());
        }

        bridgeStrength = strength;
        if (bridgeStrength >= MAX_STRENGTH_THRESHOLD) {
            audit("[INFO] Bridge formed at maximum strength.");
        } else {
            audit(String.format(Locale.ROOT, "[INFO] Bridge strength updated: %.2f", bridgeStrength));
        }
        LOG.debug("Run {}: bridge strength {} for input {} J", runId, bridgeStrength, energyInput);
    }

    /**
     * Sends the payload across the bridge.
     * <p>
     * Requires a bridge strength of at least 0.5 and more than 100 J of transfer energy.
     * On success both portals pay a 10% overhead, lose their payload and the bridge
     * collapses, so a second call fails on the strength check.
     *
     * @return The outcome of the attempt.
     */
    public TransferResult transferPayload() {
        if (bridgeStrength < MIN_TRANSFER_STRENGTH) {
            audit(String.format(Locale.ROOT, "[WARN] TRANSFER FAIL: Bridge strength %.3f < %.1f minimum",
                    bridgeStrength, MIN_TRANSFER_STRENGTH));
            LOG.warn("Run {}: transfer refused, bridge strength {} below {}", runId, bridgeStrength, MIN_TRANSFER_STRENGTH);
            return TransferResult.failed(TransferResult.INSUFFICIENT_BRIDGE_STRENGTH);
        }

        double availableEnergy = Math.min(portalA.getEnergy(), portalB.getEnergy());
        transferEnergy = availableEnergy * bridgeStrength * TRANSFER_EFFICIENCY;

        if (!(transferEnergy > MIN_TRANSFER_ENERGY)) {
            audit(String.format(Locale.ROOT, "[WARN] TRANSFER FAIL: Insufficient transfer energy %.1fJ (short by %.1fJ)",
                    transferEnergy, MIN_TRANSFER_ENERGY - transferEnergy));
            LOG.warn("Run {}: transfer refused, {} J does not exceed {} J", runId, transferEnergy, MIN_TRANSFER_ENERGY);
            return TransferResult.failed(TransferResult.INSUFFICIENT_TRANSFER_ENERGY);
        }

        double energyConsumed = transferEnergy * TRANSFER_COST_FRACTION;
        portalA.debitEnergy(energyConsumed);
        portalB.debitEnergy(energyConsumed);
        portalA.clearPayload();
        portalB.clearPayload();
        bridgeStrength = 0.0;

        audit(String.format(Locale.ROOT, "[INFO] TRANSFER SUCCESS: %.1fJ transferred - payloads cleared", transferEnergy));
        LOG.info("Run {}: transferred {} J, consumed {} J per portal", runId, transferEnergy, energyConsumed);
        return TransferResult.succeeded(transferEnergy, energyConsumed);
    }

    /**
     * Compiles the full report: bridge summary, each portal's own report, then the run log.
     * Does not mutate any state.
     *
     * @return An unmodifiable list of report lines.
     */
    public List<String> fullStatus() {
        List<String> report = new ArrayList<>();
        report.add("Run ID: " + (runId != null ? runId : "none"));
        report.add(describePortal("Portal A", portalA));
        report.add(describePortal("Portal B", portalB));
        report.add(String.format(Locale.ROOT, "Detune: %.3f Hz", detune));
        report.add(String.format(Locale.ROOT, "Bridge strength: %.2f, transfer energy: %.2f J", bridgeStrength, transferEnergy));
        report.addAll(portalA.reportStatus());
        report.addAll(portalB.reportStatus());
        report.add("Status log:");
        report.addAll(statusLog);
        return Collections.unmodifiableList(report);
    }

    /**
     * Ends the current run without starting a new one.
     */
    public void reset() {
        portalA.reset();
        portalB.reset();
        bridgeStrength = 0.0;
        transferEnergy = 0.0;
        statusLog.clear();
        LOG.info("Run {} reset", runId);
        runId = null;
    }

    public Optional<String> getRunId() {
        return Optional.ofNullable(runId);
    }

    public double getBridgeStrength() { return bridgeStrength; }

    public double getTransferEnergy() { return transferEnergy; }

    public double getDetune() { return detune; }

    public BridgeSettings getSettings() { return settings; }

    public IPortal getPortalA() { return portalA; }

    public IPortal getPortalB() { return portalB; }

    /**
     * @return An unmodifiable view of the run log.
     */
    public List<String> getStatusLog() {
        return Collections.unmodifiableList(statusLog);
    }

    private void audit(String entry) {
        statusLog.add(entry);
    }

    private static String describePortal(String name, IPortal portal) {
        return String.format(Locale.ROOT, "%s freq: %.3f Hz, stability: %.2f, safety: %s",
                name, portal.getFrequency(), portal.getStability(), portal.isSafe());
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
