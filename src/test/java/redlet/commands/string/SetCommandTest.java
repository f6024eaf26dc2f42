package redlet.commands.string;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import redlet.commands.CommandTranslator;
import redlet.db.Database;
import redlet.protocol.RespCodec;
import redlet.protocol.RespValue;
import redlet.utils.MockClock;
import redlet.utils.Time;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class SetCommandTest {

    private Database db;
    private MockClock clock;

    @BeforeEach
    public void setup() {
        clock = new MockClock();
        Time.setClock(clock);
        db = new Database();
    }

    @AfterEach
    public void tearDown() {
        Time.useSystemClock();
    }

    private RespValue run(String... parts) throws Exception {
        return CommandTranslator.translate(RespValue.command(parts)).execute(db);
    }

    @Test
    public void testSetRepliesOk() throws Exception {
        RespValue reply = run("SET", "k", "v");
        assertEquals("+OK\r\n", new String(RespCodec.serialize(reply), StandardCharsets.UTF_8));
        assertEquals(RespValue.bulkString("v"), run("GET", "k"));
    }

    @Test
    public void testSetWithPxExpires() throws Exception {
        assertEquals(RespValue.ok(), run("SET", "k", "v", "PX", "100"));
        assertEquals(RespValue.bulkString("v"), run("GET", "k"));

        clock.advance(150);
        assertEquals(RespValue.nullBulkString(), run("GET", "k"));
    }

    @Test
    public void testPlainSetClearsEarlierTtl() throws Exception {
        run("SET", "k", "v1", "PX", "100");
        run("SET", "k", "v2");

        clock.advance(10_000);
        assertEquals(RespValue.bulkString("v2"), run("GET", "k"));
    }

    @Test
    public void testLargeBinaryValue() throws Exception {
        byte[] big = new byte[1 << 20];
        for (int i = 0; i < big.length; i++) big[i] = (byte) i;

        new SetCommand(RespValue.bulkString("blob"), RespValue.bulkString(big)).execute(db);
        RespValue.BulkString stored = (RespValue.BulkString) run("GET", "blob");
        assertTrue(Arrays.equals(big, stored.getBytes()));
    }

    @Test
    public void testOverwriteKeepsSingleEntry() throws Exception {
        run("SET", "k", "v1");
        run("SET", "k", "v2");
        assertEquals(1, db.size());
        assertEquals(RespValue.bulkString("v2"), run("GET", "k"));
    }
}
