package redlet.protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single RESP datum. Instances are immutable and compare by value, so they
 * can be used directly as keys of the keyspace.
 */
public abstract class RespValue {

    public enum Type {
        SIMPLE_STRING,
        SIMPLE_ERROR,
        INTEGER,
        BULK_STRING,
        ARRAY
    }

    private static final SimpleString OK = new SimpleString("OK");
    private static final SimpleString PONG = new SimpleString("PONG");

    RespValue() { }

    public abstract Type getType();

    /**
     * Textual view used by commands that read an argument as a word
     * (option names, INFO sections). Null for arrays and the null bulk string.
     */
    public abstract String asText();

    // --- FACTORIES ---
    public static SimpleString ok() {
        return OK;
    }

    public static SimpleString pong() {
        return PONG;
    }

    public static SimpleString simpleString(String text) {
        return new SimpleString(text);
    }

    public static SimpleError error(String text) {
        return new SimpleError(text);
    }

    public static IntegerValue integer(long value) {
        return new IntegerValue(value);
    }

    public static BulkString bulkString(String text) {
        if (text == null) return BulkString.NULL;
        return new BulkString(text.getBytes(StandardCharsets.UTF_8));
    }

    /** Copies {@code bytes}; later changes to the array do not reach the value. */
    public static BulkString bulkString(byte[] bytes) {
        if (bytes == null) return BulkString.NULL;
        return new BulkString(bytes.clone());
    }

    public static BulkString nullBulkString() {
        return BulkString.NULL;
    }

    public static Array array(List<RespValue> values) {
        return new Array(values);
    }

    public static Array array(RespValue... values) {
        return new Array(Arrays.asList(values));
    }

    /** Builds a request the way clients send it: an array of bulk strings. */
    public static Array command(String... parts) {
        List<RespValue> values = new ArrayList<>(parts.length);
        for (String part : parts) {
            values.add(bulkString(part));
        }
        return new Array(values);
    }

    // --- VARIANTS ---

    public static final class SimpleString extends RespValue {
        private final String text;

        SimpleString(String text) {
            Objects.requireNonNull(text, "text");
            if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
                throw new IllegalArgumentException("Simple strings cannot contain CR or LF");
            }
            this.text = text;
        }

        public String getText() {
            return text;
        }

        @Override
        public Type getType() {
            return Type.SIMPLE_STRING;
        }

        @Override
        public String asText() {
            return text;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SimpleString && ((SimpleString) o).text.equals(text);
        }

        @Override
        public int hashCode() {
            return 31 * Type.SIMPLE_STRING.hashCode() + text.hashCode();
        }

        @Override
        public String toString() {
            return "+" + text;
        }
    }

    public static final class SimpleError extends RespValue {
        private final String message;

        SimpleError(String message) {
            Objects.requireNonNull(message, "message");
            // Error lines share the simple string framing.
            this.message = message.replace('\r', ' ').replace('\n', ' ');
        }

        public String getMessage() {
            return message;
        }

        @Override
        public Type getType() {
            return Type.SIMPLE_ERROR;
        }

        @Override
        public String asText() {
            return message;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SimpleError && ((SimpleError) o).message.equals(message);
        }

        @Override
        public int hashCode() {
            return 31 * Type.SIMPLE_ERROR.hashCode() + message.hashCode();
        }

        @Override
        public String toString() {
            return "-" + message;
        }
    }

    public static final class IntegerValue extends RespValue {
        private final long value;

        IntegerValue(long value) {
            this.value = value;
        }

        public long getValue() {
            return value;
        }

        @Override
        public Type getType() {
            return Type.INTEGER;
        }

        @Override
        public String asText() {
            return String.valueOf(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof IntegerValue && ((IntegerValue) o).value == value;
        }

        @Override
        public int hashCode() {
            return 31 * Type.INTEGER.hashCode() + Long.hashCode(value);
        }

        @Override
        public String toString() {
            return ":" + value;
        }
    }

    public static final class BulkString extends RespValue {
        /** The null bulk string ({@code $-1}); also the reply for a missing or expired key. */
        public static final BulkString NULL = new BulkString(null);

        private final byte[] bytes;

        /** Takes ownership of {@code bytes}; callers hand over a fresh array. */
        BulkString(byte[] bytes) {
            this.bytes = bytes;
        }

        public boolean isNull() {
            return bytes == null;
        }

        /** A copy of the payload, null for {@link #NULL}. */
        public byte[] getBytes() {
            return bytes == null ? null : bytes.clone();
        }

        /** The payload without copying, for the encoder. */
        byte[] rawBytes() {
            return bytes;
        }

        public int length() {
            return bytes == null ? -1 : bytes.length;
        }

        @Override
        public Type getType() {
            return Type.BULK_STRING;
        }

        @Override
        public String asText() {
            return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BulkString && Arrays.equals(((BulkString) o).bytes, bytes);
        }

        @Override
        public int hashCode() {
            return 31 * Type.BULK_STRING.hashCode() + Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return bytes == null ? "$(nil)" : "$\"" + asText() + "\"";
        }
    }

    public static final class Array extends RespValue {
        private final List<RespValue> values;

        Array(List<RespValue> values) {
            Objects.requireNonNull(values, "values");
            this.values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        public List<RespValue> getValues() {
            return values;
        }

        public int size() {
            return values.size();
        }

        public RespValue get(int index) {
            return values.get(index);
        }

        @Override
        public Type getType() {
            return Type.ARRAY;
        }

        @Override
        public String asText() {
            return null;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Array && ((Array) o).values.equals(values);
        }

        @Override
        public int hashCode() {
            return 31 * Type.ARRAY.hashCode() + values.hashCode();
        }

        @Override
        public String toString() {
            return "*" + values;
        }
    }
}
