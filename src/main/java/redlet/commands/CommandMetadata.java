package redlet.commands;

public class CommandMetadata {
    private final String name;
    private final int minArgs;

    public CommandMetadata(String name, int minArgs) {
        this.name = name;
        this.minArgs = minArgs;
    }

    public String getName() {
        return name;
    }

    /** Arguments required after the command name. */
    public int getMinArgs() {
        return minArgs;
    }
}
