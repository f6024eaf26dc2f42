package redlet.commands;

import redlet.protocol.RespValue;

import java.util.Locale;

/**
 * A request that was understood at the protocol level but cannot be run.
 * The client gets an error reply and the connection stays open.
 */
public class CommandException extends Exception {

    public enum Kind {
        ARITY,
        UNSUPPORTED_OPTION,
        UNKNOWN_COMMAND,
        INVALID_INTEGER,
        UNEXPECTED_FORMAT
    }

    private final Kind kind;

    private CommandException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static CommandException arity(String command) {
        return new CommandException(Kind.ARITY,
                "ERR wrong number of arguments for '" + command.toLowerCase(Locale.ROOT) + "' command");
    }

    public static CommandException syntaxError() {
        return new CommandException(Kind.UNSUPPORTED_OPTION, "ERR syntax error");
    }

    public static CommandException unknownCommand(String command) {
        return new CommandException(Kind.UNKNOWN_COMMAND, "ERR unknown command '" + command + "'");
    }

    public static CommandException notAnInteger() {
        return new CommandException(Kind.INVALID_INTEGER, "ERR value is not an integer or out of range");
    }

    public static CommandException unexpectedFormat() {
        return new CommandException(Kind.UNEXPECTED_FORMAT,
                "ERR Protocol error: expected a non-empty array of bulk strings");
    }

    public Kind getKind() {
        return kind;
    }

    public RespValue toReply() {
        return RespValue.error(getMessage());
    }
}
