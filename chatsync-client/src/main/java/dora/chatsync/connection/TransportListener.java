package dora.chatsync.connection;

import dora.chatsync.shared.dto.AuthErrorEvent;
import dora.chatsync.shared.dto.AuthenticatedEvent;
import dora.chatsync.shared.dto.MessageAck;
import dora.chatsync.shared.dto.MessageError;
import dora.chatsync.shared.dto.PresenceEvent;
import dora.chatsync.shared.dto.ServerMessage;
import dora.chatsync.shared.dto.TypingEvent;

/**
 * Callbacks of one transport session. Implementations must not assume any particular calling thread.
 */
public interface TransportListener {

    void onOpen();

    void onAuthenticated(AuthenticatedEvent event);

    void onAuthRejected(AuthErrorEvent event);

    void onMessage(ServerMessage message);

    void onAck(MessageAck ack);

    void onMessageError(MessageError error);

    void onTypingStart(TypingEvent event);

    void onTypingStop(TypingEvent event);

    void onPresence(PresenceEvent event);

    /**
     * The session ended without a local close. {@code cause} is null for a clean server-side close.
     */
    void onClosed(Throwable cause);
}
