package org.dualportal.cli.config;

import java.io.File;
import java.util.Optional;

import org.dualportal.runtime.BridgeSettings;
import org.dualportal.runtime.model.PortalLimits;
import org.dualportal.runtime.sweep.SweepSettings;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the simulation configuration.
 * <p>
 * HOCON layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Ddualportal.detune=0.1})</li>
 *   <li>Environment variables</li>
 *   <li>The located configuration file, if any</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved after composition, so overriding {@code resonance-frequency}
 * also moves {@code base-frequency} unless that is set explicitly.
 * <p>
 * The resolved {@code dualportal} block is then bound to a {@link SimulationConfig}.
 */
public final class ConfigLoader {

    public static final String ROOT_PATH = "dualportal";

    static final String PORTAL_PATH = "portal";
    static final String SWEEP_PATH = "sweep";

    private static final File DEFAULT_CONFIG_FILE = new File("config", "dualportal.conf");

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Locates, composes and binds the configuration.
     *
     * @param explicitConfigFile The file given via {@code --config}, or {@code null}.
     * @param handler            Receives progress messages.
     * @return The typed configuration.
     * @throws IllegalArgumentException            if a named file is missing or a value is out of range.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed, resolved or bound.
     */
    public static SimulationConfig load(final File explicitConfigFile, final ConfigMessageHandler handler) {
        return bind(compose(locate(explicitConfigFile, handler).orElse(null)));
    }

    /**
     * Binds the {@code dualportal} block of a resolved configuration. Missing sub-blocks fall
     * back to their defaults.
     *
     * @param root A resolved configuration containing the {@code dualportal} block.
     * @return The typed configuration.
     * @throws IllegalArgumentException            if a value is out of range.
     * @throws com.typesafe.config.ConfigException if the block is missing or a value has the wrong type.
     */
    public static SimulationConfig bind(final Config root) {
        final Config block = root.getConfig(ROOT_PATH);
        final PortalLimits limits = block.hasPath(PORTAL_PATH)
                ? PortalLimits.fromConfig(block.getConfig(PORTAL_PATH))
                : PortalLimits.defaults();
        final SweepSettings sweep = block.hasPath(SWEEP_PATH)
                ? SweepSettings.fromConfig(block.getConfig(SWEEP_PATH))
                : SweepSettings.defaults();
        return new SimulationConfig(BridgeSettings.fromConfig(block), limits, sweep);
    }

    /**
     * Picks the configuration file: {@code --config}, then {@code -Dconfig.file}, then
     * {@code config/dualportal.conf} in the working directory.
     *
     * @return The file to layer over the defaults, or empty to use {@code reference.conf} only.
     * @throws IllegalArgumentException if an explicitly named file does not exist.
     */
    static Optional<File> locate(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            requireExisting(explicitConfigFile, "Configuration file not found: ");
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return Optional.of(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            requireExisting(systemConfigFile, "Configuration file specified via -Dconfig.file not found: ");
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via -Dconfig.file: " + systemConfigFile.getAbsolutePath());
            return Optional.of(systemConfigFile);
        }

        if (DEFAULT_CONFIG_FILE.exists()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file found in current directory: " + DEFAULT_CONFIG_FILE.getAbsolutePath());
            return Optional.of(DEFAULT_CONFIG_FILE);
        }

        handler.log(MessageLevel.WARN,
                "No '" + DEFAULT_CONFIG_FILE.getPath() + "' found. Using simulation defaults from classpath.");
        return Optional.empty();
    }

    /**
     * Composes the configuration layers and resolves substitutions.
     *
     * @param configFile The file layer, or {@code null} for none.
     */
    static Config compose(final File configFile) {
        Config layers = ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
        if (configFile != null) {
            layers = layers.withFallback(ConfigFactory.parseFile(configFile));
        }
        return layers.withFallback(ConfigFactory.defaultReferenceUnresolved()).resolve();
    }

    private static void requireExisting(final File file, final String messagePrefix) {
        if (!file.exists()) {
            throw new IllegalArgumentException(messagePrefix + file.getAbsolutePath());
        }
    }
}
