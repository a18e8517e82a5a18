package org.dualportal.runtime;

import java.util.Locale;

/**
 * Outcome of {@link BridgeController#transferPayload()}.
 *
 * @param success           Whether the payload crossed the bridge.
 * @param reason            Why the transfer failed, {@code null} on success.
 * @param energyTransferred The energy carried across the bridge in joules (0 on failure).
 * @param energyConsumed    The energy debited from each portal in joules (0 on failure).
 * @param payloadsCleared   Whether both portals' payload state was cleared.
 * @param bridgeReset       Whether the bridge strength was reset to zero.
 */
public record TransferResult(
        boolean success,
        String reason,
        double energyTransferred,
        double energyConsumed,
        boolean payloadsCleared,
        boolean bridgeReset) {

    public static final String INSUFFICIENT_BRIDGE_STRENGTH = "Insufficient bridge strength";
    public static final String INSUFFICIENT_TRANSFER_ENERGY = "Insufficient transfer energy";

    /**
     * @return {@code Success (<transferred> J transferred, <consumed> J consumed)} or {@code Fail (<reason>)}.
     */
    public String describe() {
        return success
                ? String.format(Locale.ROOT, "Success (%.1f J transferred, %.1f J consumed)", energyTransferred, energyConsumed)
                : "Fail (" + reason + ")";
    }

    static TransferResult succeeded(double energyTransferred, double energyConsumed) {
        return new TransferResult(true, null, energyTransferred, energyConsumed, true, true);
    }

    static TransferResult failed(String reason) {
        return new TransferResult(false, reason, 0.0, 0.0, false, false);
    }
}
