package redlet.db;

import redlet.protocol.RespValue;
import redlet.utils.Time;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The keyspace. One lock covers the whole map and is held only while the map
 * is touched. Expiry is lazy: an expired entry is reported as a miss on read
 * but stays in the map until the key is written again.
 */
public class Database {
    private final Map<RespValue, ValueEntry> store = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public void set(RespValue key, RespValue value) throws StoreException {
        put(key, ValueEntry.persistent(value, Time.now()));
    }

    public void setWithExpiry(RespValue key, RespValue value, long ttlMillis) throws StoreException {
        put(key, ValueEntry.expiring(value, ttlMillis, Time.now()));
    }

    /**
     * Returns the stored value, or null when the key was never set or has expired.
     */
    public RespValue get(RespValue key) throws StoreException {
        ValueEntry entry;
        acquire();
        try {
            entry = store.get(key);
        } finally {
            lock.unlock();
        }
        if (entry == null || entry.isExpired(Time.now())) {
            return null;
        }
        return entry.value;
    }

    /** Number of physically stored entries, expired ones included. */
    public int size() throws StoreException {
        acquire();
        try {
            return store.size();
        } finally {
            lock.unlock();
        }
    }

    private void put(RespValue key, ValueEntry entry) throws StoreException {
        acquire();
        try {
            store.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    private void acquire() throws StoreException {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("interrupted while waiting for the keyspace lock", e);
        }
    }
}
