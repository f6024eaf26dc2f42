package redlet;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import redlet.utils.Log;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.Map;

public class Config {
    public static final String DEFAULT_FILE = "redlet.yaml";
    public static final int DEFAULT_PORT = 6379;

    public int port = DEFAULT_PORT;
    public String bindAddress = "0.0.0.0";
    public int workerThreads = 0; // 0 = Netty default
    public String logLevel = "INFO";

    public Config() {
        // Default constructor for Jackson
    }

    public static Config load(String filename) {
        File f = new File(filename);
        if (!f.exists() && filename.endsWith(".yaml")) {
            File legacyFile = new File(filename.substring(0, filename.length() - ".yaml".length()) + ".conf");
            if (legacyFile.exists()) f = legacyFile;
        }

        Config config = new Config();

        if (!f.exists()) {
            Log.warn("Config file not found: " + filename + ". Using defaults.");
            return config;
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            Config loaded = mapper.readValue(f, Config.class);
            if (loaded != null) config = loaded;
        } catch (Exception e) {
            Log.warn("Failed to load config as YAML (" + e.getMessage() + "). Attempting legacy parse...");
            config = loadLegacy(f, new Config());
        }
        return config;
    }

    private static Config loadLegacy(File f, Config config) {
        try (BufferedReader br = new BufferedReader(new FileReader(f))) {
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] parts = line.split("\\s+", 2);
                if (parts.length < 2) continue;

                String key = parts[0];
                String val = parts[1].trim();

                switch (key) {
                    case "port": config.port = parsePort(val); break;
                    case "bind": config.bindAddress = val; break;
                    case "io-threads": config.workerThreads = Integer.parseInt(val); break;
                    case "loglevel": config.logLevel = val; break;
                    default: Log.warn("Ignoring unknown config directive: " + key);
                }
            }
            Log.info("Loaded legacy config.");
        } catch (IOException | IllegalArgumentException e) {
            Log.error("Error loading legacy config: " + e.getMessage() + ". Using defaults.");
            return new Config();
        }
        return config;
    }

    /** REDLET_PORT overrides the file. */
    public void applyEnvironment(Map<String, String> env) {
        String envPort = env.get("REDLET_PORT");
        if (envPort != null && !envPort.isEmpty()) {
            port = parsePort(envPort);
        }
    }

    /**
     * Applies command line overrides: {@code --port <n>}, {@code -p <n>},
     * {@code --port=<n>}. Config file flags are accepted and skipped here.
     */
    public void applyArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--port":
                case "-p":
                    port = parsePort(requireValue(args, ++i, arg));
                    break;
                case "--config":
                case "-c":
                    requireValue(args, ++i, arg);
                    break;
                default:
                    if (arg.startsWith("--port=")) {
                        port = parsePort(arg.substring("--port=".length()));
                    } else if (!arg.startsWith("--config=")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
            }
        }
    }

    public static String configFileFromArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ((args[i].equals("--config") || args[i].equals("-c")) && i + 1 < args.length) {
                return args[i + 1];
            }
            if (args[i].startsWith("--config=")) {
                return args[i].substring("--config=".length());
            }
        }
        return DEFAULT_FILE;
    }

    public void validate() {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        if (workerThreads < 0) {
            throw new IllegalArgumentException("workerThreads must not be negative: " + workerThreads);
        }
    }

    static int parsePort(String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0 || parsed > 65535) {
                throw new IllegalArgumentException("Port out of range: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + value);
        }
    }

    private static String requireValue(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[index];
    }
}
