package redlet.protocol;

public class InvalidIntegerException extends Exception {

    public InvalidIntegerException(String message) {
        super(message);
    }
}
