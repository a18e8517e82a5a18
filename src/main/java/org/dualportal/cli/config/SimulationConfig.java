package org.dualportal.cli.config;

import org.dualportal.runtime.BridgeSettings;
import org.dualportal.runtime.model.PortalLimits;
import org.dualportal.runtime.sweep.SweepSettings;

/**
 * Typed view of the {@code dualportal} configuration block.
 *
 * @param bridge The controller settings from the block root.
 * @param portal The limits from {@code dualportal.portal}.
 * @param sweep  The sweep grid from {@code dualportal.sweep}.
 */
public record SimulationConfig(BridgeSettings bridge, PortalLimits portal, SweepSettings sweep) {

    public SimulationConfig {
        if (bridge == null || portal == null || sweep == null) {
            throw new IllegalArgumentException("bridge, portal and sweep settings must not be null");
        }
    }

    public static SimulationConfig defaults() {
        return new SimulationConfig(BridgeSettings.defaults(), PortalLimits.defaults(), SweepSettings.defaults());
    }
}
