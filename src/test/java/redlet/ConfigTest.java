package redlet;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

    private static String resource(String name) throws URISyntaxException {
        return new File(ConfigTest.class.getResource("/" + name).toURI()).getAbsolutePath();
    }

    @Test
    public void testDefaults() {
        Config config = new Config();
        assertEquals(6379, config.port);
        assertEquals("0.0.0.0", config.bindAddress);
        assertEquals(0, config.workerThreads);
        assertEquals("INFO", config.logLevel);
    }

    @Test
    public void testMissingFileUsesDefaults() {
        Config config = Config.load("does-not-exist.yaml");
        assertEquals(Config.DEFAULT_PORT, config.port);
    }

    @Test
    public void testLoadYaml() throws Exception {
        Config config = Config.load(resource("redlet-test.yaml"));
        assertEquals(7000, config.port);
        assertEquals("127.0.0.1", config.bindAddress);
        assertEquals(2, config.workerThreads);
        assertEquals("DEBUG", config.logLevel);
    }

    @Test
    public void testLoadLegacy() throws Exception {
        Config config = Config.load(resource("redlet-legacy.conf"));
        assertEquals(7001, config.port);
        assertEquals("127.0.0.1", config.bindAddress);
        assertEquals(0, config.workerThreads);
    }

    @Test
    public void testYamlNameFallsBackToConf(@TempDir Path dir) throws Exception {
        Files.write(dir.resolve("server.conf"), "port 7002\nio-threads 3\n".getBytes(StandardCharsets.UTF_8));
        Config config = Config.load(dir.resolve("server.yaml").toString());
        assertEquals(7002, config.port);
        assertEquals(3, config.workerThreads);
    }

    @Test
    public void testBrokenLegacyFileUsesDefaults(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("bad.conf");
        Files.write(file, "port not-a-number\n".getBytes(StandardCharsets.UTF_8));
        Config config = Config.load(file.toString());
        assertEquals(Config.DEFAULT_PORT, config.port);
    }

    @Test
    public void testEnvironmentOverridesPort() {
        Config config = new Config();
        config.applyEnvironment(Map.of("REDLET_PORT", "7100"));
        assertEquals(7100, config.port);

        config.applyEnvironment(Collections.emptyMap());
        assertEquals(7100, config.port);

        assertThrows(IllegalArgumentException.class, () -> config.applyEnvironment(Map.of("REDLET_PORT", "x")));
    }

    @Test
    public void testCommandLinePortForms() {
        Config config = new Config();
        config.applyArgs(new String[] {"--port", "7200"});
        assertEquals(7200, config.port);

        config.applyArgs(new String[] {"-p", "7201"});
        assertEquals(7201, config.port);

        config.applyArgs(new String[] {"--port=7202", "--config", "other.yaml"});
        assertEquals(7202, config.port);
    }

    @Test
    public void testCommandLineErrors() {
        Config config = new Config();
        assertThrows(IllegalArgumentException.class, () -> config.applyArgs(new String[] {"--port"}));
        assertThrows(IllegalArgumentException.class, () -> config.applyArgs(new String[] {"--port", "abc"}));
        assertThrows(IllegalArgumentException.class, () -> config.applyArgs(new String[] {"-p", "70000"}));
        assertThrows(IllegalArgumentException.class, () -> config.applyArgs(new String[] {"--verbose"}));
    }

    @Test
    public void testConfigFileFromArgs() {
        assertEquals(Config.DEFAULT_FILE, Config.configFileFromArgs(new String[0]));
        assertEquals("a.yaml", Config.configFileFromArgs(new String[] {"--config", "a.yaml"}));
        assertEquals("b.yaml", Config.configFileFromArgs(new String[] {"-p", "1", "-c", "b.yaml"}));
        assertEquals("c.conf", Config.configFileFromArgs(new String[] {"--config=c.conf"}));
    }

    @Test
    public void testValidate() {
        Config config = new Config();
        config.validate();

        config.port = 70000;
        assertThrows(IllegalArgumentException.class, config::validate);

        config.port = 6379;
        config.workerThreads = -1;
        assertThrows(IllegalArgumentException.class, config::validate);
    }
}
