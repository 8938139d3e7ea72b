package dora.chatsync.connection;

import dora.chatsync.error.AuthenticationException;
import dora.chatsync.error.ConnectTimeoutException;
import dora.chatsync.error.Failures;
import dora.chatsync.error.NotConnectedException;
import dora.chatsync.error.TransportException;
import dora.chatsync.loop.Cancellable;
import dora.chatsync.loop.EventLoop;
import dora.chatsync.model.ConversationKey;
import dora.chatsync.session.CredentialStore;
import dora.chatsync.shared.SyncDestinations;
import dora.chatsync.shared.dto.AuthErrorEvent;
import dora.chatsync.shared.dto.AuthenticateRequest;
import dora.chatsync.shared.dto.AuthenticatedEvent;
import dora.chatsync.shared.dto.DeliveryReceipt;
import dora.chatsync.shared.dto.MessageAck;
import dora.chatsync.shared.dto.MessageError;
import dora.chatsync.shared.dto.OutboundEnvelope;
import dora.chatsync.shared.dto.PresenceEvent;
import dora.chatsync.shared.dto.ServerMessage;
import dora.chatsync.shared.dto.TypingEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Owns the one logical session with the sync server.
 * <p>
 * {@code connect} resolves only once the server has confirmed the credential. A session that drops
 * after that is re-established in the background with the same credential until {@link #disconnect()}
 * is called or the server rejects the credential. Commands never queue: outside CONNECTED they fail
 * with {@link NotConnectedException}.
 * <p>
 * State lives on the event loop. Every transport session is tagged with a generation number and
 * callbacks from a session that is no longer current are dropped.
 */
@Slf4j
public class ConnectionManager {

    private final EventLoop loop;
    private final Transport transport;
    private final CredentialStore credentialStore;
    private final ReconnectBackoff backoff;
    private final Duration connectTimeout;
    private final ConnectionEvents events = new ConnectionEvents();
    private final Set<ConversationKey> rooms = new CopyOnWriteArraySet<>();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile TransportSession activeSession;
    private volatile AuthenticatedEvent identity;

    // loop-confined
    private long generation;
    private Attempt current;
    private String replayCredential;
    private int reconnectAttempt;
    private Cancellable reconnectTimer = Cancellable.NONE;

    public ConnectionManager(EventLoop loop, Transport transport, CredentialStore credentialStore,
                             ReconnectBackoff backoff, Duration connectTimeout) {
        this.loop = loop;
        this.transport = transport;
        this.credentialStore = credentialStore;
        this.backoff = backoff;
        this.connectTimeout = connectTimeout;
    }

    public ConnectionEvents events() {
        return events;
    }

    public ConnectionState state() {
        return state;
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    /**
     * User id confirmed by the server for the current or most recent session, null before the first one.
     */
    public String localUserId() {
        AuthenticatedEvent current = identity;
        return current != null ? current.getUserId() : null;
    }

    public String localUsername() {
        AuthenticatedEvent current = identity;
        return current != null ? current.getUsername() : null;
    }

    // ---------------------------------------------------------------- lifecycle

    /**
     * Connects and authenticates with {@code credential}. A call made while another attempt is in flight
     * waits for that attempt instead of opening a second session, under its own timeout.
     *
     * @return completes once authenticated, or exceptionally with {@link AuthenticationException},
     * {@link ConnectTimeoutException} or {@link TransportException}
     */
    public CompletableFuture<Void> connect(String credential) {
        Objects.requireNonNull(credential, "credential");
        CompletableFuture<Void> result = withTimeout(new CompletableFuture<>());
        loop.execute(() -> {
            if (state == ConnectionState.CONNECTED) {
                result.complete(null);
                return;
            }
            Attempt attempt = current;
            if (attempt == null) {
                // while reconnecting, a failed attempt must keep the background retries going
                boolean automatic = state == ConnectionState.RECONNECTING;
                reconnectTimer.cancel();
                attempt = startAttempt(credential, automatic);
            }
            follow(attempt, result);
        });
        return result;
    }

    /**
     * Makes one attempt to get back to CONNECTED using the last credential, or the credential store's
     * current one when there is none. Used before a send, never retried by itself.
     */
    public CompletableFuture<Void> ensureConnected() {
        CompletableFuture<Void> result = withTimeout(new CompletableFuture<>());
        loop.execute(() -> {
            if (state == ConnectionState.CONNECTED) {
                result.complete(null);
                return;
            }
            Attempt attempt = current;
            if (attempt == null) {
                String credential = replayCredential != null ? replayCredential : credentialStore.currentCredential();
                if (credential == null) {
                    result.completeExceptionally(new NotConnectedException("Not connected and no credential available"));
                    return;
                }
                boolean automatic = state == ConnectionState.RECONNECTING;
                reconnectTimer.cancel();
                attempt = startAttempt(credential, automatic);
            }
            follow(attempt, result);
        });
        return result;
    }

    /**
     * Closes the session, cancels any pending reconnect and forgets the credential and joined rooms.
     */
    public void disconnect() {
        loop.execute(this::closeEverything);
    }

    public void shutdown() {
        loop.execute(() -> {
            closeEverything();
            transport.close();
        });
    }

    private void closeEverything() {
        generation++;
        reconnectTimer.cancel();
        reconnectTimer = Cancellable.NONE;
        if (current != null) {
            Attempt attempt = current;
            current = null;
            attempt.timeout.cancel();
            closeQuietly(attempt.session);
            attempt.outcome.completeExceptionally(new NotConnectedException("Disconnected by request"));
        }
        closeQuietly(activeSession);
        activeSession = null;
        replayCredential = null;
        reconnectAttempt = 0;
        rooms.clear();
        boolean wasConnected = state == ConnectionState.CONNECTED;
        transition(ConnectionState.DISCONNECTED);
        if (wasConnected) {
            events.getConnectivityChanged().publish(false);
        }
    }

    // ---------------------------------------------------------------- commands

    public void sendEnvelope(OutboundEnvelope envelope) {
        send(SyncDestinations.MESSAGE_SEND, envelope);
    }

    public void sendReceipt(DeliveryReceipt receipt) {
        send(SyncDestinations.MESSAGE_ACK, receipt);
    }

    /**
     * Joins the room of a conversation. Joined rooms are joined again after every reconnect.
     */
    public void joinRoom(ConversationKey key) {
        send(SyncDestinations.ROOM_JOIN, key.toRoomRequest());
        rooms.add(key);
    }

    public void leaveRoom(ConversationKey key) {
        rooms.remove(key);
        send(SyncDestinations.ROOM_LEAVE, key.toRoomRequest());
    }

    public Set<ConversationKey> joinedRooms() {
        return Set.copyOf(rooms);
    }

    public void startTyping(ConversationKey key) {
        send(SyncDestinations.TYPING_START, key.toTypingRequest());
    }

    public void stopTyping(ConversationKey key) {
        send(SyncDestinations.TYPING_STOP, key.toTypingRequest());
    }

    private void send(String destination, Object payload) {
        TransportSession session = activeSession;
        if (state != ConnectionState.CONNECTED || session == null) {
            throw new NotConnectedException("Cannot send to " + destination + " while " + state);
        }
        session.send(destination, payload);
    }

    // ---------------------------------------------------------------- attempts

    private Attempt startAttempt(String credential, boolean automatic) {
        long gen = ++generation;
        Attempt attempt = new Attempt(gen, credential, automatic);
        current = attempt;
        replayCredential = credential;
        transition(ConnectionState.CONNECTING);
        attempt.timeout = loop.schedule(() -> {
            if (current == attempt) {
                failAttempt(attempt, new ConnectTimeoutException(connectTimeout));
            }
        }, connectTimeout);
        try {
            attempt.session = transport.open(new SessionListener(gen));
        } catch (RuntimeException e) {
            failAttempt(attempt, new TransportException("Failed to open transport", e));
        }
        return attempt;
    }

    private void failAttempt(Attempt attempt, Throwable error) {
        current = null;
        attempt.timeout.cancel();
        closeQuietly(attempt.session);
        if (attempt.automatic) {
            log.info("Reconnect attempt failed: {}", Failures.describe(error));
            transition(ConnectionState.RECONNECTING);
            attempt.outcome.completeExceptionally(error);
            scheduleReconnect();
        } else {
            log.warn("Connection attempt failed: {}", Failures.describe(error));
            transition(ConnectionState.DISCONNECTED);
            attempt.outcome.completeExceptionally(error);
        }
    }

    private void scheduleReconnect() {
        if (replayCredential == null) {
            transition(ConnectionState.DISCONNECTED);
            return;
        }
        Duration delay = backoff.delay(reconnectAttempt++);
        log.info("Reconnecting in {} ms (attempt {})", delay.toMillis(), reconnectAttempt);
        reconnectTimer = loop.schedule(() -> {
            reconnectTimer = Cancellable.NONE;
            if (state == ConnectionState.RECONNECTING && current == null && replayCredential != null) {
                startAttempt(replayCredential, true);
            }
        }, delay);
    }

    private void follow(Attempt attempt, CompletableFuture<Void> result) {
        attempt.outcome.whenComplete((ignored, error) -> {
            if (error != null) {
                result.completeExceptionally(error);
            } else {
                result.complete(null);
            }
        });
    }

    // Each caller gets its own ceiling, independent of the attempt it joins.
    private CompletableFuture<Void> withTimeout(CompletableFuture<Void> result) {
        loop.execute(() -> {
            if (result.isDone()) {
                return;
            }
            Cancellable timer = loop.schedule(
                    () -> result.completeExceptionally(new ConnectTimeoutException(connectTimeout)), connectTimeout);
            result.whenComplete((ignored, error) -> timer.cancel());
        });
        return result;
    }

    private void transition(ConnectionState next) {
        if (state != next) {
            log.info("Connection state {} -> {}", state, next);
            state = next;
        }
    }

    private static void closeQuietly(TransportSession session) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (RuntimeException e) {
            log.debug("Error while closing transport session", e);
        }
    }

    // ---------------------------------------------------------------- transport callbacks, on the loop

    private void opened(long gen) {
        Attempt attempt = current;
        if (attempt == null || attempt.generation != gen || state != ConnectionState.CONNECTING) {
            return;
        }
        transition(ConnectionState.AUTHENTICATING);
        try {
            attempt.session.send(SyncDestinations.AUTHENTICATE, new AuthenticateRequest(attempt.credential));
        } catch (RuntimeException e) {
            failAttempt(attempt, new TransportException("Failed to send credential", e));
        }
    }

    private void authenticated(long gen, AuthenticatedEvent event) {
        Attempt attempt = current;
        if (attempt == null || attempt.generation != gen) {
            return;
        }
        current = null;
        attempt.timeout.cancel();
        identity = event;
        activeSession = attempt.session;
        reconnectAttempt = 0;
        transition(ConnectionState.CONNECTED);
        log.info("Authenticated as {} ({})", event.getUsername(), event.getUserId());
        rejoinRooms();
        events.getConnectivityChanged().publish(true);
        attempt.outcome.complete(null);
    }

    private void rejoinRooms() {
        for (ConversationKey key : rooms) {
            try {
                activeSession.send(SyncDestinations.ROOM_JOIN, key.toRoomRequest());
            } catch (RuntimeException e) {
                // the session dropped again; the next reconnect retries the whole set
                log.warn("Failed to rejoin {}: {}", key, Failures.describe(e));
                return;
            }
        }
    }

    private void rejected(long gen, AuthErrorEvent event) {
        if (gen != generation) {
            return;
        }
        String reason = event.getMessage() != null ? event.getMessage() : "Authentication failed";
        log.warn("Server rejected credential: {}", reason);
        boolean wasConnected = state == ConnectionState.CONNECTED;
        Attempt attempt = current;
        current = null;
        generation++;
        reconnectTimer.cancel();
        replayCredential = null;
        closeQuietly(activeSession);
        activeSession = null;
        transition(ConnectionState.DISCONNECTED);
        if (attempt != null) {
            attempt.timeout.cancel();
            closeQuietly(attempt.session);
            attempt.outcome.completeExceptionally(new AuthenticationException(reason));
        }
        if (wasConnected) {
            events.getConnectivityChanged().publish(false);
        }
        credentialStore.onAuthenticationFailed(reason);
    }

    private void closed(long gen, Throwable cause) {
        if (gen != generation) {
            return;
        }
        Attempt attempt = current;
        if (attempt != null) {
            failAttempt(attempt, new TransportException(
                    cause != null ? Failures.describe(cause) : "Connection closed by server", cause));
            return;
        }
        if (state == ConnectionState.CONNECTED) {
            log.warn("Connection lost: {}", cause != null ? Failures.describe(cause) : "closed by server");
            activeSession = null;
            transition(ConnectionState.RECONNECTING);
            events.getConnectivityChanged().publish(false);
            scheduleReconnect();
        }
    }

    private static final class Attempt {
        private final long generation;
        private final String credential;
        private final boolean automatic;
        private final CompletableFuture<Void> outcome = new CompletableFuture<>();
        private TransportSession session;
        private Cancellable timeout = Cancellable.NONE;

        Attempt(long generation, String credential, boolean automatic) {
            this.generation = generation;
            this.credential = credential;
            this.automatic = automatic;
        }
    }

    /**
     * Hops every callback onto the loop and drops it there if the session is stale.
     */
    private final class SessionListener implements TransportListener {

        private final long gen;

        SessionListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onOpen() {
            loop.execute(() -> opened(gen));
        }

        @Override
        public void onAuthenticated(AuthenticatedEvent event) {
            loop.execute(() -> authenticated(gen, event));
        }

        @Override
        public void onAuthRejected(AuthErrorEvent event) {
            loop.execute(() -> rejected(gen, event));
        }

        @Override
        public void onMessage(ServerMessage message) {
            dispatch(() -> events.getEnvelopeReceived().publish(message));
        }

        @Override
        public void onAck(MessageAck ack) {
            dispatch(() -> events.getSendAcknowledged().publish(ack));
        }

        @Override
        public void onMessageError(MessageError error) {
            dispatch(() -> events.getSendFailed().publish(error));
        }

        @Override
        public void onTypingStart(TypingEvent event) {
            dispatch(() -> events.getTypingStarted().publish(event));
        }

        @Override
        public void onTypingStop(TypingEvent event) {
            dispatch(() -> events.getTypingStopped().publish(event));
        }

        @Override
        public void onPresence(PresenceEvent event) {
            dispatch(() -> events.getPresenceChanged().publish(event));
        }

        @Override
        public void onClosed(Throwable cause) {
            loop.execute(() -> closed(gen, cause));
        }

        private void dispatch(Runnable publish) {
            loop.execute(() -> {
                if (gen == generation) {
                    publish.run();
                }
            });
        }
    }
}
