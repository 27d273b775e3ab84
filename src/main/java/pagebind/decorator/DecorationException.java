package pagebind.decorator;

/**
 * Unchecked exception thrown when a page-object member cannot be decorated:
 * unsupported declared type, wrapper that cannot be created, member that
 * cannot be written.
 */
public class DecorationException extends RuntimeException {

    public DecorationException(String msg) {
        super(msg);
    }

    public DecorationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
