package org.dualportal.runtime.sweep;

/**
 * One evaluated configuration of a {@link ParameterSweep}.
 *
 * @param detune         The detune offset in Hz.
 * @param frequencyA     The nominal frequency of portal A in Hz.
 * @param frequencyB     The nominal frequency of portal B in Hz.
 * @param chargedEnergy  The energy both portals were charged to in joules.
 * @param energyInput    The energy offered to the bridge in joules.
 * @param bridgeStrength The resulting bridge strength.
 * @param transferable   Whether a transfer across this bridge succeeded.
 */
public record SweepPoint(
        double detune,
        double frequencyA,
        double frequencyB,
        double chargedEnergy,
        double energyInput,
        double bridgeStrength,
        boolean transferable) {
}
