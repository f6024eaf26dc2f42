package redlet.commands.string;

import redlet.commands.Command;
import redlet.commands.CommandException;
import redlet.db.Database;
import redlet.db.StoreException;
import redlet.protocol.InvalidIntegerException;
import redlet.protocol.RespCodec;
import redlet.protocol.RespValue;

import java.util.List;

/**
 * {@code SET key value}. The {@code SET key value PX ms} form is parsed here
 * too and produces a {@link SetWithExpiryCommand}.
 */
public class SetCommand implements Command {
    protected final RespValue key;
    protected final RespValue value;

    public SetCommand(RespValue key, RespValue value) {
        this.key = key;
        this.value = value;
    }

    public static Command parse(List<RespValue> args) throws CommandException {
        RespValue key = args.get(0);
        RespValue value = args.get(1);

        if (args.size() == 2) {
            return new SetCommand(key, value);
        }
        if (args.size() != 4 || !isPx(args.get(2))) {
            throw CommandException.syntaxError();
        }
        return new SetWithExpiryCommand(key, value, parseTtl(args.get(3)));
    }

    private static boolean isPx(RespValue option) {
        return option instanceof RespValue.BulkString && "px".equalsIgnoreCase(option.asText());
    }

    private static long parseTtl(RespValue ttl) throws CommandException {
        if (ttl instanceof RespValue.IntegerValue) {
            return ((RespValue.IntegerValue) ttl).getValue();
        }
        if (ttl instanceof RespValue.BulkString && !((RespValue.BulkString) ttl).isNull()) {
            try {
                return RespCodec.parseIntWithSign(((RespValue.BulkString) ttl).getBytes());
            } catch (InvalidIntegerException e) {
                throw CommandException.notAnInteger();
            }
        }
        throw CommandException.notAnInteger();
    }

    public RespValue getKey() {
        return key;
    }

    public RespValue getValue() {
        return value;
    }

    @Override
    public RespValue execute(Database db) throws StoreException {
        db.set(key, value);
        return RespValue.ok();
    }
}
