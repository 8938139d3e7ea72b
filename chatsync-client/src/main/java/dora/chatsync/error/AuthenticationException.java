package dora.chatsync.error;

/**
 * The server rejected the session credential. Never retried with the same credential.
 */
public class AuthenticationException extends SyncException {

    public AuthenticationException(String message) {
        super(message);
    }
}
