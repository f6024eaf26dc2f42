package redlet.commands.connection;

import redlet.commands.Command;
import redlet.db.Database;
import redlet.protocol.RespValue;

import java.util.List;

public class PingCommand implements Command {
    private final RespValue message;

    public PingCommand(RespValue message) {
        this.message = message;
    }

    public static PingCommand parse(List<RespValue> args) {
        return new PingCommand(args.isEmpty() ? null : args.get(0));
    }

    public RespValue getMessage() {
        return message;
    }

    @Override
    public RespValue execute(Database db) {
        return message == null ? RespValue.pong() : message;
    }
}
