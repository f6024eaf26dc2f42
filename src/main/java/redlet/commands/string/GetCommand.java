package redlet.commands.string;

import redlet.commands.Command;
import redlet.db.Database;
import redlet.db.StoreException;
import redlet.protocol.RespValue;

import java.util.List;

public class GetCommand implements Command {
    private final RespValue key;

    public GetCommand(RespValue key) {
        this.key = key;
    }

    public static GetCommand parse(List<RespValue> args) {
        return new GetCommand(args.get(0));
    }

    public RespValue getKey() {
        return key;
    }

    /** Missing and expired keys both answer with the null bulk string. */
    @Override
    public RespValue execute(Database db) throws StoreException {
        RespValue value = db.get(key);
        return value == null ? RespValue.nullBulkString() : value;
    }
}
