package org.dualportal.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.dualportal.runtime.model.PortalLimits;
import org.dualportal.runtime.model.ResonancePortal;
import org.dualportal.runtime.runid.SequentialRunIdGenerator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * End-to-end bridge cycles with {@link ResonancePortal}s.
 */
@Tag("unit")
class BridgeLifecycleTest {

    private BridgeController controller(double detune) {
        return new BridgeController(
                new BridgeSettings(7.83, detune, 500.0),
                ResonancePortal.factory(PortalLimits.defaults()),
                new SequentialRunIdGenerator());
    }

    private static void charge(BridgeController controller, double dt) {
        controller.getPortalA().updateEnergy(dt);
        controller.getPortalB().updateEnergy(dt);
    }

    @Test
    void workedExampleTransfersEightHundredJoules() {
        BridgeController controller = controller(0.0);
        controller.initializeRun();
        charge(controller, 2.0);

        controller.formBridge();
        assertThat(controller.getBridgeStrength()).isEqualTo(1.0);

        TransferResult result = controller.transferPayload();

        assertThat(result.success()).isTrue();
        assertThat(result.energyTransferred()).isCloseTo(800.0, within(1e-9));
        assertThat(result.energyConsumed()).isCloseTo(80.0, within(1e-9));
        assertThat(controller.getPortalA().getEnergy()).isCloseTo(920.0, within(1e-9));
        assertThat(controller.getPortalB().getEnergy()).isCloseTo(920.0, within(1e-9));
    }

    @Test
    void transferIsOneShotAndClearsPayloads() {
        BridgeController controller = controller(0.08);
        controller.initializeRun(0.1, 75.0, -196.0, true, -196.0, true);
        charge(controller, 2.0);
        assertThat(controller.getPortalA().hasPayload()).isTrue();

        controller.formBridge();
        TransferResult first = controller.transferPayload();
        TransferResult second = controller.transferPayload();

        assertThat(first.success()).isTrue();
        assertThat(controller.getBridgeStrength()).isZero();
        assertThat(controller.getPortalA().hasPayload()).isFalse();
        assertThat(controller.getPortalB().hasPayload()).isFalse();
        assertThat(second.success()).isFalse();
        assertThat(second.reason()).isEqualTo(TransferResult.INSUFFICIENT_BRIDGE_STRENGTH);
    }

    @Test
    void lostFloorContactVetoesTheBridge() {
        BridgeController controller = controller(0.0);
        controller.initializeRun(0.1, 75.0, -196.0, true, -196.0, false);
        charge(controller, 2.0);

        controller.formBridge();

        assertThat(controller.getBridgeStrength()).isZero();
        assertThat(controller.getStatusLog()).contains(
                "[WARN] Portal stability below threshold - bridge degraded.",
                "[ERROR] Safety failure - bridge formation blocked.");
        assertThat(controller.transferPayload().success()).isFalse();
    }

    @Test
    void unchargedPortalsCannotTransfer() {
        BridgeController controller = controller(0.0);
        controller.initializeRun();

        controller.formBridge();

        assertThat(controller.getBridgeStrength()).isZero();
        assertThat(controller.transferPayload().reason()).isEqualTo(TransferResult.INSUFFICIENT_BRIDGE_STRENGTH);
    }

    @Test
    void resetReturnsPortalsToBaseline() {
        BridgeController controller = controller(0.08);
        controller.initializeRun(0.1, 75.0, 20.0, true, -196.0, true);
        charge(controller, 3.0);
        controller.formBridge();

        controller.reset();

        assertThat(controller.getBridgeStrength()).isZero();
        assertThat(controller.getTransferEnergy()).isZero();
        assertThat(controller.getStatusLog()).isEmpty();
        assertThat(controller.getRunId()).isEmpty();
        assertThat(controller.getPortalA().getEnergy()).isZero();
        assertThat(controller.getPortalA().getStability()).isEqualTo(1.0);
        assertThat(controller.getPortalA().isSafe()).isTrue();
        assertThat(controller.getPortalB().hasPayload()).isFalse();
        assertThat(controller.fullStatus().get(0)).isEqualTo("Run ID: none");

        controller.formBridge();
        assertThat(controller.transferPayload().success()).isFalse();
    }
}
