package redlet.protocol;

/**
 * The byte stream cannot be decoded into a RESP value. The connection that
 * produced it is no longer in sync and gets closed.
 */
public class MalformedFrameException extends Exception {

    public MalformedFrameException(String message) {
        super(message);
    }

    public MalformedFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
