package org.dualportal.cli.commands;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.dualportal.cli.CommandLineInterface;
import org.dualportal.cli.config.SimulationConfig;
import org.dualportal.runtime.BridgeController;
import org.dualportal.runtime.TransferResult;
import org.dualportal.runtime.model.ResonancePortal;
import org.dualportal.runtime.runid.RandomRunIdGenerator;
import org.dualportal.runtime.sweep.ParameterSweep;
import org.dualportal.runtime.sweep.SweepPoint;
import org.dualportal.runtime.sweep.SweepReport;
import org.dualportal.runtime.sweep.SweepSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Sweeps energy input and detune and prints the best configurations with an approval verdict.
 * Options left unset fall back to the {@code dualportal.sweep} configuration block.
 * <p>
 * With {@code --apply}, an approved sweep's optimal point is used for a full bridge cycle;
 * a rejected sweep is never applied.
 */
@Command(
    name = "sweep",
    mixinStandardHelpOptions = true,
    description = "Evaluate bridge strength over a grid of energy inputs and detune offsets"
)
public class SweepCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SweepCommand.class);

    private static final int TOP_RESULTS = 5;

    @Option(names = {"--energy-range"}, description = "Charge level and highest energy input in J (default: dualportal.sweep.energy-range)")
    private Double energyRange;

    @Option(names = {"--detune-range"}, description = "Detune span in Hz, swept from -range to +range (default: dualportal.sweep.detune-range)")
    private Double detuneRange;

    @Option(names = {"--steps"}, description = "Values per axis (default: dualportal.sweep.steps)")
    private Integer steps;

    @Option(names = {"--apply"}, description = "Run a bridge cycle at the optimal point if the sweep is approved")
    private boolean apply;

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
            SweepSettings grid = config.sweep().override(energyRange, detuneRange, steps);
            ParameterSweep sweep = new ParameterSweep(config.bridge(), ResonancePortal.factory(config.portal()));
            SweepReport report = sweep.sweep(grid);

            out.println("=== Parameter Sweep ===");
            out.printf(Locale.ROOT, "Energy range: %.1f J, detune range: +/-%.3f Hz, steps: %d%n%n",
                    grid.energyRange(), grid.detuneRange(), grid.steps());
            out.println("Top configurations:");
            report.ranked().stream().limit(TOP_RESULTS).forEach(point -> out.println(format(point)));
            out.println();
            out.println(report.summary());

            if (!apply) {
                out.flush();
                return report.isApproved() ? 0 : 2;
            }
            if (!report.isApproved()) {
                log.warn("Refusing to apply a rejected sweep");
                err.printf(Locale.ROOT, "Cannot apply parameters - sweep results not approved. "
                        + "Bridge strength must be >= %.1f and the transfer must succeed.%n", SweepReport.MIN_ACCEPTABLE_STRENGTH);
                out.flush();
                err.flush();
                return 2;
            }
            return applyOptimal(sweep, report, out);
        } catch (IllegalArgumentException | ConfigException e) {
            log.error("Sweep failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private int applyOptimal(ParameterSweep sweep, SweepReport report, PrintWriter out) {
        SweepPoint optimal = report.optimal();
        out.println();
        out.printf(Locale.ROOT, "Applying optimal parameters: detune=%+.3f Hz, energy input=%.1f J%n",
                optimal.detune(), optimal.energyInput());

        BridgeController controller = sweep.applyOptimal(report, new RandomRunIdGenerator());
        TransferResult result = controller.transferPayload();
        out.println("Bridge transfer result: " + result.describe());
        out.println("Full status report:");
        controller.fullStatus().forEach(out::println);
        out.flush();
        return result.success() ? 0 : 2;
    }

    private static String format(SweepPoint point) {
        return String.format(Locale.ROOT,
                "  detune=%+.3f Hz (A=%.3f Hz, B=%.3f Hz) input=%.1f/%.1f J -> strength=%.3f%s",
                point.detune(), point.frequencyA(), point.frequencyB(), point.energyInput(), point.chargedEnergy(),
                point.bridgeStrength(), point.transferable() ? "" : " (not transferable)");
    }
}
