package org.dualportal.runtime.sweep;

import java.util.ArrayList;
import java.util.List;

import org.dualportal.runtime.BridgeController;
import org.dualportal.runtime.BridgeSettings;
import org.dualportal.runtime.runid.SequentialRunIdGenerator;
import org.dualportal.runtime.spi.IPortal;
import org.dualportal.runtime.spi.IRunIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates bridge strength over a grid of energy inputs and detune offsets.
 * <p>
 * Every grid point gets its own controller: a run is initialized without payload, both
 * portals are charged to the top of the energy range through {@link IPortal#updateEnergy(double)},
 * the bridge is formed with the point's energy input and a transfer is attempted.
 */
public class ParameterSweep {

    private static final Logger LOG = LoggerFactory.getLogger(ParameterSweep.class);

    private final BridgeSettings settings;
    private final IPortal.Factory portalFactory;

    /**
     * @param settings      The base settings; the detune is replaced per grid point.
     * @param portalFactory Creates the portals of every evaluated controller.
     */
    public ParameterSweep(BridgeSettings settings, IPortal.Factory portalFactory) {
        if (settings == null || portalFactory == null) {
            throw new IllegalArgumentException("settings and portalFactory must not be null");
        }
        this.settings = settings;
        this.portalFactory = portalFactory;
    }

    /**
     * Runs the sweep.
     *
     * @param energyRange The charge level and highest energy input in joules; inputs are {@code energyRange * i / steps}.
     * @param detuneRange The detune span; values are evenly spaced in {@code [-detuneRange, detuneRange]}.
     * @param steps       The number of values per axis.
     * @return The report over {@code steps * steps} points.
     * @throws IllegalArgumentException if the ranges or steps are invalid, or the energy rate is zero.
     */
    public SweepReport sweep(double energyRange, double detuneRange, int steps) {
        return sweep(new SweepSettings(energyRange, detuneRange, steps));
    }

    /**
     * Runs the sweep over the given grid.
     *
     * @throws IllegalArgumentException if the energy rate is zero.
     */
    public SweepReport sweep(SweepSettings grid) {
        requireChargeable();
        double chargeLevel = grid.energyRange();
        List<SweepPoint> points = new ArrayList<>(grid.steps() * grid.steps());
        for (double detune : detuneValues(grid.detuneRange(), grid.steps())) {
            BridgeSettings pointSettings = settings.withDetune(detune);
            for (int i = 1; i <= grid.steps(); i++) {
                double energyInput = chargeLevel * i / grid.steps();
                points.add(evaluate(pointSettings, chargeLevel, energyInput));
            }
        }

        SweepReport report = new SweepReport(points);
        LOG.info(report.summary());
        return report;
    }

    /**
     * Prepares a controller at the optimal point of an approved sweep: the run is initialized,
     * the portals are charged and the bridge is formed, ready for {@link BridgeController#transferPayload()}.
     *
     * @param report The sweep to apply.
     * @param runIds The run id source of the returned controller.
     * @return The prepared controller.
     * @throws IllegalStateException if the sweep is not approved.
     */
    public BridgeController applyOptimal(SweepReport report, IRunIdGenerator runIds) {
        BridgeSettings optimalSettings = report.optimalSettings(settings);
        requireChargeable();
        SweepPoint optimal = report.optimal();
        BridgeController controller = charge(optimalSettings, optimal.chargedEnergy(), runIds);
        controller.formBridge(optimal.energyInput());
        LOG.info("Applied optimal parameters: detune={} Hz, charge={} J, input={} J, strength={}",
                optimal.detune(), optimal.chargedEnergy(), optimal.energyInput(), controller.getBridgeStrength());
        return controller;
    }

    private SweepPoint evaluate(BridgeSettings pointSettings, double chargeLevel, double energyInput) {
        BridgeController controller = charge(pointSettings, chargeLevel, new SequentialRunIdGenerator());
        controller.formBridge(energyInput);
        double strength = controller.getBridgeStrength();
        boolean transferable = controller.transferPayload().success();
        LOG.debug("detune={} input={} -> strength={} transferable={}",
                pointSettings.detune(), energyInput, strength, transferable);
        return new SweepPoint(
                pointSettings.detune(),
                controller.getPortalA().getFrequency(),
                controller.getPortalB().getFrequency(),
                chargeLevel,
                energyInput,
                strength,
                transferable);
    }

    private BridgeController charge(BridgeSettings pointSettings, double chargeLevel, IRunIdGenerator runIds) {
        BridgeController controller = new BridgeController(pointSettings, portalFactory, runIds);
        controller.initializeRun();
        double dt = chargeLevel / pointSettings.energyRate();
        controller.getPortalA().updateEnergy(dt);
        controller.getPortalB().updateEnergy(dt);
        return controller;
    }

    private void requireChargeable() {
        if (!(settings.energyRate() > 0.0)) {
            throw new IllegalArgumentException("A sweep needs a positive energy rate to charge the portals");
        }
    }

    static double[] detuneValues(double detuneRange, int steps) {
        if (steps == 1) {
            return new double[]{0.0};
        }
        double[] values = new double[steps];
        double increment = 2.0 * detuneRange / (steps - 1);
        for (int i = 0; i < steps; i++) {
            values[i] = -detuneRange + increment * i;
        }
        return values;
    }
}
