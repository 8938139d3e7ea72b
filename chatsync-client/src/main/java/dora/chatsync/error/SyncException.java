package dora.chatsync.error;

/**
 * Base type of every failure raised by the synchronization layer.
 */
public class SyncException extends RuntimeException {

    public SyncException(String message) {
        super(message);
    }

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
