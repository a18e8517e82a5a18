package org.dualportal.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.dualportal.runtime.BridgeSettings;
import org.dualportal.runtime.model.PortalLimits;
import org.dualportal.runtime.sweep.SweepSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader}: layer priority (system properties over the
 * configuration file over {@code reference.conf}) and binding to {@link SimulationConfig}.
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("dualportal.detune");
        System.clearProperty("dualportal.energy-rate");
        System.clearProperty("dualportal.resonance-frequency");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Reference configuration should bind to the simulation defaults")
    void compose_referenceOnlyShouldBindToDefaults() {
        SimulationConfig config = ConfigLoader.bind(ConfigLoader.compose(null));

        assertEquals(SimulationConfig.defaults(), config);
    }

    @Test
    @DisplayName("File values should override reference values and keep the rest")
    void compose_fileShouldOverrideReferenceValues() {
        SimulationConfig config = ConfigLoader.bind(ConfigLoader.compose(testResource("test-config.conf")));

        assertEquals(0.25, config.bridge().detune());
        assertEquals(250.0, config.bridge().energyRate());
        assertEquals(BridgeSettings.DEFAULT_RESONANCE_FREQUENCY, config.bridge().baseFrequency());
        assertEquals(400.0, config.portal().maxPayloadMass());
        assertEquals(PortalLimits.defaults().maxPayloadVolume(), config.portal().maxPayloadVolume());
        assertEquals(new SweepSettings(SweepSettings.DEFAULT_ENERGY_RANGE, SweepSettings.DEFAULT_DETUNE_RANGE, 3),
                config.sweep());
    }

    @Test
    @DisplayName("System property should override file configuration")
    void compose_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("dualportal.detune", "0.4");
        ConfigFactory.invalidateCaches();

        SimulationConfig config = ConfigLoader.bind(ConfigLoader.compose(testResource("test-config.conf")));

        assertEquals(0.4, config.bridge().detune());
        assertEquals(250.0, config.bridge().energyRate());
    }

    @Test
    @DisplayName("Overriding a referenced value should propagate into substitutions")
    void compose_overrideShouldPropagateIntoSubstitutions() {
        System.setProperty("dualportal.resonance-frequency", "9.0");
        ConfigFactory.invalidateCaches();

        SimulationConfig config = ConfigLoader.bind(ConfigLoader.compose(null));

        assertEquals(9.0, config.bridge().resonanceFrequency());
        assertEquals(9.0, config.bridge().baseFrequency());
    }

    @Test
    @DisplayName("bind should fall back to defaults for missing sub-blocks")
    void bind_missingSubBlocksShouldUseDefaults() {
        Config root = ConfigFactory.parseString("dualportal { detune = -0.1 }");

        SimulationConfig config = ConfigLoader.bind(root);

        assertEquals(-0.1, config.bridge().detune());
        assertEquals(PortalLimits.defaults(), config.portal());
        assertEquals(SweepSettings.defaults(), config.sweep());
    }

    @Test
    @DisplayName("bind should reject out-of-range values")
    void bind_shouldRejectInvalidValues() {
        Config badSweep = ConfigFactory.parseString("dualportal.sweep.steps = 0");
        Config badRate = ConfigFactory.parseString("dualportal.energy-rate = -5");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ConfigLoader.bind(badSweep));
        assertTrue(e.getMessage().contains("steps must be at least 1"));
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.bind(badRate));
        assertThrows(ConfigException.Missing.class, () -> ConfigLoader.bind(ConfigFactory.empty()));
    }

    @Test
    @DisplayName("load should use an explicit file and report it")
    void load_shouldUseExplicitFile() {
        List<String> messages = new ArrayList<>();

        SimulationConfig config = ConfigLoader.load(testResource("test-config.conf"),
                (level, message) -> messages.add(level + ": " + message));

        assertEquals(0.25, config.bridge().detune());
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO: Using configuration file specified via --config"));
    }

    @Test
    @DisplayName("load should reject a missing explicit file")
    void load_shouldRejectMissingExplicitFile() {
        File missing = new File("does-not-exist/dualportal.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.load(missing, (level, message) -> { }));
        assertTrue(e.getMessage().contains("Configuration file not found"));
    }

    private File testResource(String name) {
        URL url = getClass().getClassLoader().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
