package redlet.db;

import redlet.protocol.RespValue;

/**
 * A stored value plus its optional time-to-live. Entries are never mutated;
 * SET replaces the whole entry.
 */
public class ValueEntry {
    public final RespValue value;
    public final boolean hasExpiry;
    public final long ttlMillis;
    public final long insertedAt;

    private ValueEntry(RespValue value, boolean hasExpiry, long ttlMillis, long insertedAt) {
        this.value = value;
        this.hasExpiry = hasExpiry;
        this.ttlMillis = ttlMillis;
        this.insertedAt = insertedAt;
    }

    public static ValueEntry persistent(RespValue value, long now) {
        return new ValueEntry(value, false, 0, now);
    }

    public static ValueEntry expiring(RespValue value, long ttlMillis, long now) {
        return new ValueEntry(value, true, ttlMillis, now);
    }

    /** Expired only once strictly more than {@code ttlMillis} have elapsed. */
    public boolean isExpired(long now) {
        return hasExpiry && now - insertedAt > ttlMillis;
    }
}
