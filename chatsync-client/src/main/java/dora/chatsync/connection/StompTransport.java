package dora.chatsync.connection;

import com.fasterxml.jackson.databind.ObjectMapper;
import dora.chatsync.error.TransportException;
import dora.chatsync.shared.SyncDestinations;
import dora.chatsync.shared.dto.AuthErrorEvent;
import dora.chatsync.shared.dto.AuthenticatedEvent;
import dora.chatsync.shared.dto.MessageAck;
import dora.chatsync.shared.dto.MessageError;
import dora.chatsync.shared.dto.PresenceEvent;
import dora.chatsync.shared.dto.ServerMessage;
import dora.chatsync.shared.dto.TypingEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.converter.MappingJackson2MessageConverter;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompFrameHandler;
import org.springframework.messaging.simp.stomp.StompHeaders;
import org.springframework.messaging.simp.stomp.StompSession;
import org.springframework.messaging.simp.stomp.StompSessionHandlerAdapter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.messaging.WebSocketStompClient;

import java.lang.reflect.Type;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * {@link Transport} over STOMP on a WebSocket, using Spring's STOMP client.
 */
@Slf4j
public class StompTransport implements Transport {

    private static final long HEARTBEAT_MS = 10_000;

    private final String url;
    private final WebSocketStompClient stompClient;
    private final ThreadPoolTaskScheduler heartbeatScheduler;

    public StompTransport(String url, ObjectMapper objectMapper) {
        this.url = url;

        MappingJackson2MessageConverter converter = new MappingJackson2MessageConverter();
        converter.setObjectMapper(objectMapper);

        this.heartbeatScheduler = new ThreadPoolTaskScheduler();
        heartbeatScheduler.setPoolSize(1);
        heartbeatScheduler.setThreadNamePrefix("chatsync-heartbeat-");
        heartbeatScheduler.setDaemon(true);
        heartbeatScheduler.initialize();

        this.stompClient = new WebSocketStompClient(new StandardWebSocketClient());
        stompClient.setMessageConverter(converter);
        stompClient.setTaskScheduler(heartbeatScheduler);
        stompClient.setDefaultHeartbeat(new long[]{HEARTBEAT_MS, HEARTBEAT_MS});
    }

    @Override
    public TransportSession open(TransportListener listener) {
        SyncSessionHandler handler = new SyncSessionHandler(listener);
        log.debug("Connecting to {}", url);
        stompClient.connectAsync(url, new WebSocketHttpHeaders(), new StompHeaders(), handler)
                .whenComplete((session, ex) -> {
                    if (ex != null) {
                        handler.closed(ex);
                    } else if (handler.closedLocally.get()) {
                        // closed before the handshake finished
                        session.disconnect();
                    }
                });
        return handler;
    }

    @Override
    public void close() {
        stompClient.stop();
        heartbeatScheduler.shutdown();
    }

    static class SyncSessionHandler extends StompSessionHandlerAdapter implements TransportSession {

        private final TransportListener listener;
        private final AtomicBoolean closedLocally = new AtomicBoolean();
        private final AtomicBoolean closeReported = new AtomicBoolean();
        private volatile StompSession session;

        SyncSessionHandler(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public void afterConnected(StompSession session, StompHeaders connectedHeaders) {
            this.session = session;
            if (closedLocally.get()) {
                return;
            }
            subscribe(SyncDestinations.QUEUE_AUTHENTICATED, AuthenticatedEvent.class, listener::onAuthenticated);
            subscribe(SyncDestinations.QUEUE_AUTH_ERROR, AuthErrorEvent.class, listener::onAuthRejected);
            subscribe(SyncDestinations.QUEUE_MESSAGE_RECEIVED, ServerMessage.class, listener::onMessage);
            subscribe(SyncDestinations.QUEUE_MESSAGE_ACK, MessageAck.class, listener::onAck);
            subscribe(SyncDestinations.QUEUE_MESSAGE_ERROR, MessageError.class, listener::onMessageError);
            subscribe(SyncDestinations.QUEUE_TYPING_START, TypingEvent.class, listener::onTypingStart);
            subscribe(SyncDestinations.QUEUE_TYPING_STOP, TypingEvent.class, listener::onTypingStop);
            subscribe(SyncDestinations.QUEUE_PRESENCE, PresenceEvent.class, listener::onPresence);
            log.debug("STOMP session {} established", session.getSessionId());
            listener.onOpen();
        }

        private <T> void subscribe(String destination, Class<T> payloadType, Consumer<T> consumer) {
            session.subscribe(destination, new TypedFrameHandler<>(payloadType, consumer));
        }

        @Override
        public void handleException(StompSession session, StompCommand command, StompHeaders headers,
                                    byte[] payload, Throwable exception) {
            log.warn("Failed to handle {} frame on {}", command, headers.getDestination(), exception);
        }

        @Override
        public void handleTransportError(StompSession session, Throwable exception) {
            closed(exception);
        }

        void closed(Throwable cause) {
            if (closedLocally.get() || !closeReported.compareAndSet(false, true)) {
                return;
            }
            listener.onClosed(cause);
        }

        @Override
        public void send(String destination, Object payload) {
            StompSession current = session;
            if (current == null || !current.isConnected()) {
                throw new TransportException("STOMP session is not connected");
            }
            try {
                current.send(destination, payload);
            } catch (RuntimeException e) {
                throw new TransportException("Failed to send to " + destination, e);
            }
        }

        @Override
        public void close() {
            if (!closedLocally.compareAndSet(false, true)) {
                return;
            }
            StompSession current = session;
            if (current != null && current.isConnected()) {
                try {
                    current.disconnect();
                } catch (RuntimeException e) {
                    log.debug("Error while disconnecting STOMP session", e);
                }
            }
        }
    }

    static class TypedFrameHandler<T> implements StompFrameHandler {

        private final Class<T> payloadType;
        private final Consumer<T> consumer;

        TypedFrameHandler(Class<T> payloadType, Consumer<T> consumer) {
            this.payloadType = payloadType;
            this.consumer = consumer;
        }

        @Override
        public Type getPayloadType(StompHeaders headers) {
            return payloadType;
        }

        @Override
        public void handleFrame(StompHeaders headers, Object payload) {
            if (payload == null) {
                log.warn("Dropping empty frame from {}", headers.getDestination());
                return;
            }
            consumer.accept(payloadType.cast(payload));
        }
    }
}
