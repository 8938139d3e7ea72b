package dora.chatsync.connection;

import dora.chatsync.event.EventChannel;
import dora.chatsync.shared.dto.MessageAck;
import dora.chatsync.shared.dto.MessageError;
import dora.chatsync.shared.dto.PresenceEvent;
import dora.chatsync.shared.dto.ServerMessage;
import dora.chatsync.shared.dto.TypingEvent;
import lombok.Getter;

/**
 * Server events fanned out by the {@link ConnectionManager}. Everything is published on the event loop.
 */
@Getter
public class ConnectionEvents {
    private final EventChannel<ServerMessage> envelopeReceived = new EventChannel<>("envelope-received");
    private final EventChannel<MessageAck> sendAcknowledged = new EventChannel<>("send-acknowledged");
    private final EventChannel<MessageError> sendFailed = new EventChannel<>("send-failed");
    private final EventChannel<TypingEvent> typingStarted = new EventChannel<>("typing-started");
    private final EventChannel<TypingEvent> typingStopped = new EventChannel<>("typing-stopped");
    private final EventChannel<PresenceEvent> presenceChanged = new EventChannel<>("presence-changed");
    private final EventChannel<Boolean> connectivityChanged = new EventChannel<>("connectivity-changed");
}
