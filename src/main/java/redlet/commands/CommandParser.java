package redlet.commands;

import redlet.protocol.RespValue;

import java.util.List;

@FunctionalInterface
public interface CommandParser {
    // args excludes the command name
    Command parse(List<RespValue> args) throws CommandException;
}
