package redlet.db;

/**
 * The keyspace could not be accessed. Fails the current request only.
 */
public class StoreException extends Exception {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
