package dora.chatsync.error;

/**
 * A send could not even be recorded locally, e.g. because the envelope could not be prepared.
 * Once a message is in the store its failures are reported on the record instead.
 */
public class SendFailedException extends SyncException {

    public SendFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
