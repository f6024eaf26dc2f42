package redlet.commands;

import redlet.db.Database;
import redlet.db.StoreException;
import redlet.protocol.RespValue;

/**
 * A validated request. Argument checking already happened in the
 * {@link CommandParser}, so executing can only fail on the store.
 */
public interface Command {
    RespValue execute(Database db) throws StoreException;
}
