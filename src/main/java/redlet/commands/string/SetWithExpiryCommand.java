package redlet.commands.string;

import redlet.db.Database;
import redlet.db.StoreException;
import redlet.protocol.RespValue;

public class SetWithExpiryCommand extends SetCommand {
    private final long ttlMillis;

    public SetWithExpiryCommand(RespValue key, RespValue value, long ttlMillis) {
        super(key, value);
        this.ttlMillis = ttlMillis;
    }

    public long getTtlMillis() {
        return ttlMillis;
    }

    @Override
    public RespValue execute(Database db) throws StoreException {
        db.setWithExpiry(key, value, ttlMillis);
        return RespValue.ok();
    }
}
