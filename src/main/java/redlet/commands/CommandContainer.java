package redlet.commands;

public class CommandContainer {
    private final CommandParser parser;
    private final CommandMetadata metadata;

    public CommandContainer(CommandParser parser, CommandMetadata metadata) {
        this.parser = parser;
        this.metadata = metadata;
    }

    public CommandParser getParser() {
        return parser;
    }

    public CommandMetadata getMetadata() {
        return metadata;
    }
}
