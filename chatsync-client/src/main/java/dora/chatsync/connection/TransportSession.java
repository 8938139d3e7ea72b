package dora.chatsync.connection;

public interface TransportSession {

    /**
     * Sends one frame to {@code destination}.
     *
     * @throws dora.chatsync.error.TransportException if the session can no longer send
     */
    void send(String destination, Object payload);

    /**
     * Closes the session. No listener callback follows a local close.
     */
    void close();
}
