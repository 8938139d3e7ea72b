package dora.chatsync.error;

import java.time.Duration;

/**
 * The server did not confirm authentication within the connect ceiling.
 */
public class ConnectTimeoutException extends SyncException {

    public ConnectTimeoutException(Duration timeout) {
        super("Connection timeout after " + timeout.toMillis() + " ms");
    }
}
