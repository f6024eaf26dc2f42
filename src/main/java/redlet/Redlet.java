package redlet;

import redlet.commands.CommandRegistry;
import redlet.db.Database;
import redlet.utils.Log;

import java.util.TreeSet;

/**
 * Project: Redlet
 * Version: 0.1.0
 */
public class Redlet {
    public static final String VERSION = "0.1.0";

    public static void printBanner(Config config) {
        Log.info("\n" +
                " :: Redlet ::       (v" + VERSION + ") \n" +
                " :: Engine ::       Java " + System.getProperty("java.version") + " / Netty \n" +
                " :: Port   ::       " + config.port + " \n" +
                " :: Commands ::     " + String.join(" ", new TreeSet<>(CommandRegistry.names())) + " \n");
    }

    public static void main(String[] args) throws Exception {
        Config config;
        try {
            config = Config.load(Config.configFileFromArgs(args));
            config.applyEnvironment(System.getenv());
            config.applyArgs(args);
            config.validate();
        } catch (IllegalArgumentException e) {
            Log.error(e.getMessage());
            Log.error("Usage: redlet [--port|-p <port>] [--config|-c <file>]");
            System.exit(1);
            return;
        }
        Log.setLevel(config.logLevel);

        printBanner(config);

        // Owned here and shared by every connection
        Database db = new Database();
        RedletServer server = new RedletServer(config, db);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            Log.info("Shutting down...");
            server.stop();
        }, "redlet-shutdown"));

        try {
            server.start();
        } catch (Exception e) {
            Log.error("Failed to bind " + config.bindAddress + ":" + config.port + ": " + e.getMessage());
            System.exit(1);
            return;
        }
        server.awaitTermination();
    }
}
