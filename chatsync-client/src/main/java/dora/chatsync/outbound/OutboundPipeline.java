package dora.chatsync.outbound;

import dora.chatsync.connection.ConnectionManager;
import dora.chatsync.crypto.CryptoModule;
import dora.chatsync.crypto.PreparedEnvelope;
import dora.chatsync.error.Failures;
import dora.chatsync.error.SendFailedException;
import dora.chatsync.event.Subscription;
import dora.chatsync.loop.Cancellable;
import dora.chatsync.loop.EventLoop;
import dora.chatsync.model.ConversationKey;
import dora.chatsync.model.ConversationTarget;
import dora.chatsync.model.Message;
import dora.chatsync.shared.dto.MessageAck;
import dora.chatsync.shared.dto.MessageError;
import dora.chatsync.shared.dto.MessageStatus;
import dora.chatsync.shared.dto.OutboundEnvelope;
import dora.chatsync.store.ConversationStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Turns compose actions into tracked messages.
 * <p>
 * A send first shows up in the store as PENDING, then goes to the server. Its outcome arrives later as
 * an ack or an error event and rewrites that same record. Failed sends are never retried here.
 */
@Slf4j
public class OutboundPipeline {

    public static final int MAX_MESSAGE_LENGTH = 4000;
    static final String NO_ACK_REASON = "No acknowledgment from server";

    private final EventLoop loop;
    private final ConversationStore store;
    private final ConnectionManager connection;
    private final CryptoModule crypto;
    private final Duration pendingTimeout;
    private final int protocolVersion;

    private final List<Subscription> subscriptions = new ArrayList<>();
    // loop-confined
    private final Map<String, Cancellable> watchdogs = new HashMap<>();

    public OutboundPipeline(EventLoop loop, ConversationStore store, ConnectionManager connection,
                            CryptoModule crypto, Duration pendingTimeout, int protocolVersion) {
        this.loop = loop;
        this.store = store;
        this.connection = connection;
        this.crypto = crypto;
        this.pendingTimeout = pendingTimeout;
        this.protocolVersion = protocolVersion;
    }

    public void init() {
        subscriptions.add(connection.events().getSendAcknowledged().subscribe(this::onAck));
        subscriptions.add(connection.events().getSendFailed().subscribe(this::onError));
    }

    public void close() {
        subscriptions.forEach(Subscription::cancel);
        subscriptions.clear();
        loop.execute(() -> {
            watchdogs.values().forEach(Cancellable::cancel);
            watchdogs.clear();
        });
    }

    /**
     * Sends a message. The returned future completes with the correlation token as soon as the PENDING
     * record is in the store, without waiting for the server.
     *
     * @throws IllegalArgumentException if the text is blank or longer than {@value #MAX_MESSAGE_LENGTH}
     */
    public CompletableFuture<String> send(ConversationTarget target, String plaintext, String replyToId) {
        if (plaintext == null || plaintext.isBlank()) {
            throw new IllegalArgumentException("Message cannot be empty");
        }
        if (plaintext.length() > MAX_MESSAGE_LENGTH) {
            throw new IllegalArgumentException("Message exceeds " + MAX_MESSAGE_LENGTH + " characters");
        }
        if (target.isChannel() || connection.localUserId() != null) {
            return prepareAndSend(target.toKey(connection.localUserId()), target, plaintext, replyToId);
        }
        // a direct conversation id needs our own user id, known only once authenticated
        log.debug("Local user unknown, connecting before addressing {}", target.getRecipientId());
        CompletableFuture<String> result = new CompletableFuture<>();
        connection.ensureConnected().whenCompleteAsync((ignored, error) -> {
            String me = connection.localUserId();
            if (error != null || me == null) {
                String reason = error != null ? Failures.describe(error) : "local user is unknown";
                result.completeExceptionally(new SendFailedException("Cannot address direct message: " + reason,
                        error != null ? Failures.unwrap(error) : null));
                return;
            }
            prepareAndSend(target.toKey(me), target, plaintext, replyToId).whenComplete((token, failure) -> {
                if (failure != null) {
                    result.completeExceptionally(Failures.unwrap(failure));
                } else {
                    result.complete(token);
                }
            });
        }, loop);
        return result;
    }

    private CompletableFuture<String> prepareAndSend(ConversationKey key, ConversationTarget target,
                                                     String plaintext, String replyToId) {
        CompletableFuture<PreparedEnvelope> prepared;
        try {
            prepared = crypto.prepareEnvelope(plaintext, target);
        } catch (RuntimeException e) {
            prepared = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<String> result = new CompletableFuture<>();
        prepared.whenCompleteAsync((envelope, error) -> {
            if (error != null) {
                log.warn("Failed to prepare envelope for {}: {}", key, Failures.describe(error));
                result.completeExceptionally(
                        new SendFailedException("Failed to prepare envelope", Failures.unwrap(error)));
                return;
            }
            String token = envelope.getCorrelationToken();
            boolean inserted = store.insertPending(Message.builder()
                    .correlationToken(token)
                    .senderId(connection.localUserId())
                    .senderUsername(connection.localUsername())
                    .conversationKey(key)
                    .content(plaintext)
                    .timestamp(loop.now())
                    .status(MessageStatus.PENDING)
                    .replyToId(replyToId)
                    .build());
            if (!inserted) {
                result.completeExceptionally(new SendFailedException("Correlation token " + token + " already used", null));
                return;
            }
            armWatchdog(token);
            result.complete(token);
            transmit(target.envelopeBuilder()
                    .encryptedEnvelope(envelope.getEncryptedEnvelope())
                    .clientNonce(token)
                    .protocolVersion(protocolVersion)
                    .replyToId(replyToId)
                    .build());
        }, loop);
        return result;
    }

    private void transmit(OutboundEnvelope envelope) {
        if (connection.isConnected()) {
            transmitNow(envelope);
            return;
        }
        log.debug("Not connected, trying one reconnect before sending {}", envelope.getClientNonce());
        connection.ensureConnected().whenCompleteAsync((ignored, error) -> {
            if (error != null) {
                fail(envelope.getClientNonce(), "Not connected: " + Failures.describe(error));
            } else {
                transmitNow(envelope);
            }
        }, loop);
    }

    private void transmitNow(OutboundEnvelope envelope) {
        try {
            connection.sendEnvelope(envelope);
            log.debug("Sent {}", envelope.getClientNonce());
        } catch (RuntimeException e) {
            fail(envelope.getClientNonce(), Failures.describe(e));
        }
    }

    private void armWatchdog(String token) {
        if (pendingTimeout.isZero() || pendingTimeout.isNegative()) {
            return;
        }
        watchdogs.put(token, loop.schedule(() -> {
            watchdogs.remove(token);
            if (store.expirePending(token, NO_ACK_REASON)) {
                log.warn("Message {} timed out waiting for acknowledgment", token);
            }
        }, pendingTimeout));
    }

    private void disarm(String token) {
        Cancellable watchdog = watchdogs.remove(token);
        if (watchdog != null) {
            watchdog.cancel();
        }
    }

    private void fail(String token, String reason) {
        disarm(token);
        store.reconcileFailure(token, reason);
    }

    private void onAck(MessageAck ack) {
        if (ack.getClientNonce() == null || ack.getMessageId() == null) {
            log.warn("Ignoring incomplete ack {}", ack);
            return;
        }
        disarm(ack.getClientNonce());
        store.reconcileAck(ack.getClientNonce(), ack.getMessageId(), ack.getStatus());
    }

    private void onError(MessageError error) {
        if (error.getClientNonce() == null) {
            log.warn("Server reported an error for an unknown message: {}", error.getError());
            return;
        }
        String reason = error.getError() != null ? error.getError() : "Rejected by server";
        log.info("Server rejected {}: {}", error.getClientNonce(), reason);
        fail(error.getClientNonce(), reason);
    }
}
