package redlet.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP parsing and serialization.
 *
 * <p>Parsing works on absolute indices of a {@link ByteBuf} and never moves its
 * reader index; callers skip {@link Parsed#consumed} bytes once they accept a value.
 * Two flavours exist:
 * <ul>
 *   <li>{@link #parse(ByteBuf)} is for streams. It returns {@code null} while the
 *       buffer only holds a prefix of a frame.</li>
 *   <li>{@link #parse(byte[])} is for a buffer that must contain a whole frame.
 *       Running out of bytes is a {@link MalformedFrameException}.</li>
 * </ul>
 * A frame is first walked without copying bulk payloads or building values.
 * Only once that walk finds it complete is it parsed for real, so a large
 * frame arriving over many reads is checked cheaply on each of them.
 */
public final class RespCodec {

    public static final byte SIMPLE_STRING = '+';
    public static final byte SIMPLE_ERROR = '-';
    public static final byte INTEGER = ':';
    public static final byte BULK_STRING = '$';
    public static final byte ARRAY = '*';

    public static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    /** Longest header or simple line we wait for before giving up on a CRLF. */
    public static final int MAX_LINE_LENGTH = 64 * 1024;
    public static final int MAX_NESTING_DEPTH = 32;

    private static final int MAX_PREALLOCATED_ELEMENTS = 1024;
    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NULL_BULK_STRING = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private RespCodec() { }

    public static final class Parsed {
        public final RespValue value;
        public final int consumed;

        public Parsed(RespValue value, int consumed) {
            this.value = value;
            this.consumed = consumed;
        }
    }

    public static final class Line {
        /** Line content without the terminator. */
        public final byte[] bytes;
        /** Bytes from the start of the line up to and including CRLF. */
        public final int consumed;

        public Line(byte[] bytes, int consumed) {
            this.bytes = bytes;
            this.consumed = consumed;
        }
    }

    // --- PARSING ---

    public static Parsed parse(byte[] buffer) throws MalformedFrameException {
        if (buffer == null || buffer.length == 0) {
            throw new MalformedFrameException("Empty buffer");
        }
        ByteBuf buf = Unpooled.wrappedBuffer(buffer);
        try {
            Parsed parsed = parse(buf);
            if (parsed == null) {
                throw new MalformedFrameException("Buffer ended before the frame was complete");
            }
            return parsed;
        } finally {
            buf.release();
        }
    }

    public static Parsed parse(ByteBuf buffer) throws MalformedFrameException {
        if (frameLength(buffer) < 0) return null;
        return parseAt(buffer, buffer.readerIndex(), 0, true);
    }

    /**
     * Size of the complete frame at the reader index, or -1 while only a
     * prefix is buffered. Validates like {@link #parse(ByteBuf)} but copies
     * no payload and builds no values.
     */
    public static int frameLength(ByteBuf buffer) throws MalformedFrameException {
        Parsed walked = parseAt(buffer, buffer.readerIndex(), 0, false);
        return walked == null ? -1 : walked.consumed;
    }

    /** With {@code build} false the returned {@link Parsed} only carries its size. */
    private static Parsed parseAt(ByteBuf buf, int start, int depth, boolean build) throws MalformedFrameException {
        if (start >= buf.writerIndex()) return null;

        byte type = buf.getByte(start);
        switch (type) {
            case SIMPLE_STRING:
                return parseSimpleString(buf, start);
            case INTEGER:
                return parseInteger(buf, start);
            case BULK_STRING:
                return parseBulkString(buf, start, build);
            case ARRAY:
                return parseArray(buf, start, depth, build);
            default:
                throw new MalformedFrameException("Unknown value type byte 0x" + Integer.toHexString(type & 0xFF));
        }
    }

    private static Parsed parseSimpleString(ByteBuf buf, int start) throws MalformedFrameException {
        Line line = requireLine(buf, start + 1);
        if (line == null) return null;

        for (byte b : line.bytes) {
            if (b == '\r' || b == '\n') {
                throw new MalformedFrameException("Simple string contains a bare CR or LF");
            }
        }
        String text = new String(line.bytes, StandardCharsets.UTF_8);
        return new Parsed(new RespValue.SimpleString(text), line.consumed + 1);
    }

    private static Parsed parseInteger(ByteBuf buf, int start) throws MalformedFrameException {
        Line line = requireLine(buf, start + 1);
        if (line == null) return null;

        try {
            return new Parsed(new RespValue.IntegerValue(parseIntWithSign(line.bytes)), line.consumed + 1);
        } catch (InvalidIntegerException e) {
            throw new MalformedFrameException("Invalid integer: " + e.getMessage(), e);
        }
    }

    private static Parsed parseBulkString(ByteBuf buf, int start, boolean build) throws MalformedFrameException {
        Line header = requireLine(buf, start + 1);
        if (header == null) return null;

        long length = parseLength(header.bytes, "bulk string");
        int headerSize = header.consumed + 1;
        if (length == -1) {
            return new Parsed(RespValue.BulkString.NULL, headerSize);
        }
        if (length < -1 || length > MAX_BULK_LENGTH) {
            throw new MalformedFrameException("Invalid bulk string length " + length);
        }

        int payloadStart = start + headerSize;
        int payloadEnd = payloadStart + (int) length;
        long available = buf.writerIndex() - (long) payloadStart;
        if (available > length && buf.getByte(payloadEnd) != '\r') {
            throw new MalformedFrameException("Bulk string longer than its declared length " + length);
        }
        if (available < length + 2) return null;
        if (buf.getByte(payloadEnd + 1) != '\n') {
            throw new MalformedFrameException("Bulk string is not terminated by CRLF");
        }

        int consumed = headerSize + (int) length + 2;
        if (!build) return new Parsed(null, consumed);

        byte[] payload = new byte[(int) length];
        buf.getBytes(payloadStart, payload);
        return new Parsed(new RespValue.BulkString(payload), consumed);
    }

    private static Parsed parseArray(ByteBuf buf, int start, int depth, boolean build) throws MalformedFrameException {
        if (depth >= MAX_NESTING_DEPTH) {
            throw new MalformedFrameException("Arrays nested deeper than " + MAX_NESTING_DEPTH);
        }
        Line header = requireLine(buf, start + 1);
        if (header == null) return null;

        long count = parseLength(header.bytes, "array");
        if (count < 0) {
            throw new MalformedFrameException("Invalid array length " + count);
        }

        int consumed = header.consumed + 1;
        List<RespValue> items = build ? new ArrayList<>((int) Math.min(count, MAX_PREALLOCATED_ELEMENTS)) : null;
        for (long i = 0; i < count; i++) {
            Parsed item = parseAt(buf, start + consumed, depth + 1, build);
            if (item == null) return null;
            if (build) items.add(item.value);
            consumed += item.consumed;
        }
        return new Parsed(build ? new RespValue.Array(items) : null, consumed);
    }

    private static Line requireLine(ByteBuf buf, int from) throws MalformedFrameException {
        Line line = readUntilCrlf(buf, from);
        if (line == null && buf.writerIndex() - from > MAX_LINE_LENGTH) {
            throw new MalformedFrameException("No CRLF within " + MAX_LINE_LENGTH + " bytes");
        }
        return line;
    }

    private static long parseLength(byte[] line, String what) throws MalformedFrameException {
        try {
            return parseIntWithSign(line);
        } catch (InvalidIntegerException e) {
            throw new MalformedFrameException("Invalid " + what + " length: " + e.getMessage(), e);
        }
    }

    /**
     * Finds the first CRLF at or after {@code from}. Returns null when the
     * readable window has no terminator yet.
     */
    public static Line readUntilCrlf(ByteBuf buf, int from) {
        int end = buf.writerIndex();
        int searchFrom = from;
        while (searchFrom < end) {
            int lf = buf.indexOf(searchFrom, end, (byte) '\n');
            if (lf < 0) return null;
            if (lf > from && buf.getByte(lf - 1) == '\r') {
                byte[] line = new byte[lf - 1 - from];
                buf.getBytes(from, line);
                return new Line(line, lf + 1 - from);
            }
            searchFrom = lf + 1;
        }
        return null;
    }

    public static Line readUntilCrlf(byte[] bytes) {
        ByteBuf buf = Unpooled.wrappedBuffer(bytes);
        try {
            return readUntilCrlf(buf, 0);
        } finally {
            buf.release();
        }
    }

    /**
     * Parses an optional {@code +}/{@code -} sign followed by decimal digits.
     * Values outside the signed 64-bit range are rejected rather than wrapped.
     */
    public static long parseIntWithSign(byte[] line) throws InvalidIntegerException {
        if (line == null || line.length == 0) {
            throw new InvalidIntegerException("empty integer value");
        }
        int digitsStart = (line[0] == '+' || line[0] == '-') ? 1 : 0;
        if (digitsStart == line.length) {
            throw new InvalidIntegerException("sign without digits");
        }
        for (int i = digitsStart; i < line.length; i++) {
            if (line[i] < '0' || line[i] > '9') {
                throw new InvalidIntegerException("not a decimal integer");
            }
        }
        String text = new String(line, StandardCharsets.US_ASCII);
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new InvalidIntegerException("out of range: " + text);
        }
    }

    // --- SERIALIZATION ---

    public static byte[] serialize(RespValue value) {
        ByteBuf buf = Unpooled.buffer();
        try {
            encode(value, buf);
            byte[] out = new byte[buf.readableBytes()];
            buf.readBytes(out);
            return out;
        } finally {
            buf.release();
        }
    }

    public static void encode(RespValue value, ByteBuf out) {
        switch (value.getType()) {
            case SIMPLE_STRING:
                writeLine(out, SIMPLE_STRING, ((RespValue.SimpleString) value).getText());
                break;
            case SIMPLE_ERROR:
                writeLine(out, SIMPLE_ERROR, ((RespValue.SimpleError) value).getMessage());
                break;
            case INTEGER:
                writeLine(out, INTEGER, Long.toString(((RespValue.IntegerValue) value).getValue()));
                break;
            case BULK_STRING:
                RespValue.BulkString bulk = (RespValue.BulkString) value;
                if (bulk.isNull()) {
                    out.writeBytes(NULL_BULK_STRING);
                } else {
                    writeLine(out, BULK_STRING, Integer.toString(bulk.length()));
                    out.writeBytes(bulk.rawBytes());
                    out.writeBytes(CRLF);
                }
                break;
            case ARRAY:
                RespValue.Array array = (RespValue.Array) value;
                writeLine(out, ARRAY, Integer.toString(array.size()));
                for (RespValue item : array.getValues()) {
                    encode(item, out);
                }
                break;
            default:
                throw new IllegalArgumentException("Cannot serialize " + value.getType());
        }
    }

    private static void writeLine(ByteBuf out, byte type, String text) {
        out.writeByte(type);
        out.writeCharSequence(text, StandardCharsets.UTF_8);
        out.writeBytes(CRLF);
    }
}
