package redlet.commands;

import redlet.protocol.RespValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a decoded request into a {@link Command}. Pure: nothing here reads or
 * writes the keyspace.
 */
public class CommandTranslator {

    private CommandTranslator() { }

    public static Command translate(RespValue request) throws CommandException {
        CommandRequest extracted = extractCommand(request);
        return toCommand(extracted.getName(), extracted.getArgs());
    }

    /**
     * Requires an array whose first element is a non-null bulk string (the
     * command name). The remaining elements are passed on untouched.
     */
    public static CommandRequest extractCommand(RespValue request) throws CommandException {
        if (!(request instanceof RespValue.Array)) {
            throw CommandException.unexpectedFormat();
        }
        RespValue.Array array = (RespValue.Array) request;
        if (array.size() == 0) {
            throw CommandException.unexpectedFormat();
        }
        RespValue first = array.get(0);
        if (!(first instanceof RespValue.BulkString) || ((RespValue.BulkString) first).isNull()) {
            throw CommandException.unexpectedFormat();
        }

        List<RespValue> args = new ArrayList<>(array.getValues().subList(1, array.size()));
        return new CommandRequest(first.asText(), args);
    }

    public static Command toCommand(String name, List<RespValue> args) throws CommandException {
        CommandContainer container = CommandRegistry.get(name);
        if (container == null) {
            throw CommandException.unknownCommand(name);
        }
        if (args.size() < container.getMetadata().getMinArgs()) {
            throw CommandException.arity(container.getMetadata().getName());
        }
        return container.getParser().parse(args);
    }
}
