package org.dualportal.cli.commands;

import java.io.PrintWriter;
import java.util.Random;
import java.util.concurrent.Callable;

import org.dualportal.cli.CommandLineInterface;
import org.dualportal.cli.config.SimulationConfig;
import org.dualportal.runtime.BridgeController;
import org.dualportal.runtime.TransferResult;
import org.dualportal.runtime.model.ResonancePortal;
import org.dualportal.runtime.runid.RandomRunIdGenerator;
import org.dualportal.runtime.spi.IRunIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs one complete bridge cycle: initialize, charge both portals, form the bridge,
 * transfer the payload, print the full status, reset and print the status again.
 */
@Command(
    name = "run",
    mixinStandardHelpOptions = true,
    description = "Run one bridge formation and payload transfer cycle"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(names = {"--volume"}, description = "Payload volume in m^3")
    private Double payloadVolume;

    @Option(names = {"--mass"}, description = "Payload mass in kg")
    private Double payloadMass;

    @Option(names = {"--floor-temp-a"}, description = "Floor temperature of portal A in degC")
    private Double floorTempA;

    @Option(names = {"--floor-contact-a"}, arity = "1", description = "Floor contact of portal A (true/false)")
    private Boolean floorContactA;

    @Option(names = {"--floor-temp-b"}, description = "Floor temperature of portal B in degC")
    private Double floorTempB;

    @Option(names = {"--floor-contact-b"}, arity = "1", description = "Floor contact of portal B (true/false)")
    private Boolean floorContactB;

    @Option(names = {"--dt"}, defaultValue = "2.0", description = "Seconds of energy accumulation before forming the bridge (default: ${DEFAULT-VALUE})")
    private double dt;

    @Option(names = {"--seed"}, description = "Seed for the run id generator")
    private Long seed;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            SimulationConfig config = parent.getConfig();
            IRunIdGenerator runIds = seed != null
                    ? new RandomRunIdGenerator(new Random(seed))
                    : new RandomRunIdGenerator();

            BridgeController controller = new BridgeController(config.bridge(), ResonancePortal.factory(config.portal()), runIds);
            controller.initializeRun(payloadVolume, payloadMass, floorTempA, floorContactA, floorTempB, floorContactB);
            controller.getPortalA().updateEnergy(dt);
            controller.getPortalB().updateEnergy(dt);
            controller.formBridge();
            TransferResult result = controller.transferPayload();

            out.println("Bridge transfer result: " + result.describe());
            out.println("Full status report:");
            controller.fullStatus().forEach(out::println);

            controller.reset();
            out.println();
            out.println("After reset:");
            controller.fullStatus().forEach(out::println);
            out.flush();
            return result.success() ? 0 : 2;
        } catch (IllegalArgumentException | ConfigException e) {
            log.error("Run failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
