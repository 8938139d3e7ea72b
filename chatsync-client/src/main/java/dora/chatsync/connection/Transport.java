package dora.chatsync.connection;

/**
 * Opens authenticated-capable sessions to the sync server.
 * One transport may open many sessions over its lifetime, one at a time.
 */
public interface Transport {

    /**
     * Starts opening a session. The call returns immediately; progress is reported to {@code listener}
     * from arbitrary threads: {@link TransportListener#onOpen()} once the socket is usable, or
     * {@link TransportListener#onClosed(Throwable)} if it never becomes usable.
     */
    TransportSession open(TransportListener listener);

    /**
     * Releases resources shared by all sessions.
     */
    default void close() {
    }
}
