package redlet.commands.server;

import org.junit.jupiter.api.Test;
import redlet.db.Database;
import redlet.protocol.RespCodec;
import redlet.protocol.RespValue;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InfoCommandTest {

    private final Database db = new Database();

    private String info(String section) {
        RespValue reply = InfoCommand.parse(List.of(RespValue.bulkString(section))).execute(db);
        return new String(RespCodec.serialize(reply), StandardCharsets.UTF_8);
    }

    @Test
    void testReplicationSection() {
        assertEquals("$11\r\nrole:master\r\n", info("replication"));
        assertEquals("$11\r\nrole:master\r\n", info("Replication"));
    }

    @Test
    void testOtherSectionsAreEmpty() {
        assertEquals("$0\r\n\r\n", info("memory"));
        assertEquals("$0\r\n\r\n", info(""));
    }

    @Test
    void testNullSectionIsEmpty() {
        RespValue reply = InfoCommand.parse(List.of(RespValue.nullBulkString())).execute(db);
        assertEquals(RespValue.bulkString(""), reply);
    }
}
