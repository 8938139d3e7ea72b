package dora.chatsync.error;

/**
 * A command was issued while the connection was not in the CONNECTED state.
 */
public class NotConnectedException extends SyncException {

    public NotConnectedException(String message) {
        super(message);
    }
}
