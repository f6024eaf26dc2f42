package redlet.commands;

import redlet.protocol.RespValue;

import java.util.List;

/**
 * Command name and arguments pulled out of a request array.
 */
public class CommandRequest {
    private final String name;
    private final List<RespValue> args;

    public CommandRequest(String name, List<RespValue> args) {
        this.name = name;
        this.args = args;
    }

    public String getName() {
        return name;
    }

    public List<RespValue> getArgs() {
        return args;
    }
}
