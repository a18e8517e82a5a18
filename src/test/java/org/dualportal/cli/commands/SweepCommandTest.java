package org.dualportal.cli.commands;

import org.dualportal.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the sweep command.
 */
@Tag("unit")
public class SweepCommandTest {

    @Test
    void testHelpOutput() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.execute("sweep", "--help");

        assertThat(out.toString()).contains("--energy-range", "--detune-range", "--steps", "--apply");
    }

    @Test
    void testSweepWithConfiguredDefaults() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        int exitCode = cmdLine.execute("sweep");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("=== Parameter Sweep ===")
                .contains("Sweep evaluated 25 configurations.")
                .contains("APPROVED");
    }

    @Test
    void testSweepWithExplicitOptions() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        int exitCode = cmdLine.execute("sweep", "--energy-range", "500", "--detune-range", "0.2", "--steps", "2");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Sweep evaluated 4 configurations.");
    }

    @Test
    void testInvalidStepsAreReported() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));
        int exitCode = cmdLine.execute("sweep", "--steps", "0");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("steps must be at least 1");
    }

    @Test
    void testLowEnergySweepIsRejected() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        int exitCode = cmdLine.execute("sweep", "--energy-range", "1");

        assertThat(exitCode).isEqualTo(2);
        assertThat(out.toString())
                .contains("(not transferable)")
                .contains("Transferable: 0.")
                .contains("REJECTED");
    }

    @Test
    void testApplyRunsBridgeCycleAtOptimum() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        int exitCode = cmdLine.execute("sweep", "--apply");

        String output = out.toString();
        assertThat(exitCode).isZero();
        assertThat(output).contains("Applying optimal parameters: detune=+0.000 Hz, energy input=1000.0 J");
        assertThat(output).contains("Bridge transfer result: Success (800.0 J transferred, 80.0 J consumed)");
        assertThat(output).contains("[INFO] TRANSFER SUCCESS: 800.0J transferred - payloads cleared");
    }

    @Test
    void testApplyRefusesRejectedSweep() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        int exitCode = cmdLine.execute("sweep", "--energy-range", "1", "--apply");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Cannot apply parameters - sweep results not approved");
        assertThat(out.toString()).doesNotContain("Applying optimal parameters");
    }
}
