package redlet.commands;

import redlet.commands.connection.EchoCommand;
import redlet.commands.connection.PingCommand;
import redlet.commands.server.InfoCommand;
import redlet.commands.string.GetCommand;
import redlet.commands.string.SetCommand;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class CommandRegistry {
    private static final Map<String, CommandContainer> commands = new HashMap<>();

    static {
        // Connection
        register("PING", 0, PingCommand::parse);
        register("ECHO", 1, EchoCommand::parse);

        // String
        register("GET", 1, GetCommand::parse);
        register("SET", 2, SetCommand::parse);

        // Server
        register("INFO", 1, InfoCommand::parse);
    }

    private static void register(String name, int minArgs, CommandParser parser) {
        commands.put(name, new CommandContainer(parser, new CommandMetadata(name, minArgs)));
    }

    /** Case-insensitive lookup; null for unknown names. */
    public static CommandContainer get(String name) {
        return commands.get(name.toUpperCase(Locale.ROOT));
    }

    public static Set<String> names() {
        return Collections.unmodifiableSet(commands.keySet());
    }
}
