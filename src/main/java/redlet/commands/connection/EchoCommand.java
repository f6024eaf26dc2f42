package redlet.commands.connection;

import redlet.commands.Command;
import redlet.db.Database;
import redlet.protocol.RespValue;

import java.util.List;

public class EchoCommand implements Command {
    private final RespValue message;

    public EchoCommand(RespValue message) {
        this.message = message;
    }

    public static EchoCommand parse(List<RespValue> args) {
        return new EchoCommand(args.get(0));
    }

    public RespValue getMessage() {
        return message;
    }

    @Override
    public RespValue execute(Database db) {
        return message;
    }
}
