package redlet.commands.server;

import redlet.commands.Command;
import redlet.db.Database;
import redlet.protocol.RespValue;

import java.util.List;
import java.util.Locale;

/**
 * Only the replication section has content; this server is always a master.
 * Other sections reply with an empty bulk string.
 */
public class InfoCommand implements Command {
    public static final String REPLICATION = "replication";

    private final String section;

    public InfoCommand(String section) {
        this.section = section;
    }

    public static InfoCommand parse(List<RespValue> args) {
        String text = args.get(0).asText();
        return new InfoCommand(text == null ? "" : text.toLowerCase(Locale.ROOT));
    }

    public String getSection() {
        return section;
    }

    @Override
    public RespValue execute(Database db) {
        StringBuilder info = new StringBuilder();
        if (section.equals(REPLICATION)) appendReplication(info);
        return RespValue.bulkString(info.toString());
    }

    private void appendReplication(StringBuilder info) {
        info.append("role:master");
    }
}
