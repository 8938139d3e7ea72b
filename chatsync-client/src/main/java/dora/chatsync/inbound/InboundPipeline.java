package dora.chatsync.inbound;

import dora.chatsync.connection.ConnectionManager;
import dora.chatsync.crypto.CryptoModule;
import dora.chatsync.error.Failures;
import dora.chatsync.event.Subscription;
import dora.chatsync.loop.EventLoop;
import dora.chatsync.model.ConversationKey;
import dora.chatsync.model.Message;
import dora.chatsync.shared.dto.DeliveryReceipt;
import dora.chatsync.shared.dto.MessageStatus;
import dora.chatsync.shared.dto.ServerMessage;
import dora.chatsync.store.ConversationStore;
import dora.chatsync.store.IngestOutcome;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Decrypts pushed messages and ingests them into the store.
 * A message that cannot be decrypted or placed is logged and dropped; the next one is unaffected.
 */
@Slf4j
public class InboundPipeline {

    private final EventLoop loop;
    private final ConversationStore store;
    private final ConnectionManager connection;
    private final CryptoModule crypto;
    private final boolean deliveryReceipts;
    private Subscription subscription;

    public InboundPipeline(EventLoop loop, ConversationStore store, ConnectionManager connection,
                           CryptoModule crypto, boolean deliveryReceipts) {
        this.loop = loop;
        this.store = store;
        this.connection = connection;
        this.crypto = crypto;
        this.deliveryReceipts = deliveryReceipts;
    }

    public void init() {
        subscription = connection.events().getEnvelopeReceived().subscribe(this::onEnvelope);
    }

    public void close() {
        if (subscription != null) {
            subscription.cancel();
            subscription = null;
        }
    }

    void onEnvelope(ServerMessage envelope) {
        if (envelope.getId() == null) {
            log.warn("Dropping pushed message without id from {}", envelope.getSenderId());
            return;
        }
        Optional<ConversationKey> key = ConversationKey.of(envelope, connection.localUserId());
        if (key.isEmpty()) {
            log.warn("Dropping message {}: no channel or conversation", envelope.getId());
            return;
        }

        CompletableFuture<String> decrypted;
        try {
            decrypted = crypto.decrypt(envelope);
        } catch (RuntimeException e) {
            decrypted = CompletableFuture.failedFuture(e);
        }
        decrypted.whenCompleteAsync((plaintext, error) -> {
            if (error != null) {
                log.warn("Dropping undecryptable message {} in {}: {}",
                        envelope.getId(), key.get(), Failures.describe(error));
                return;
            }
            Message message = ServerMessages.toMessage(envelope, key.get(), plaintext, loop.now());
            IngestOutcome outcome = store.ingest(message, envelope.getClientNonce());
            log.debug("Message {} in {}: {}", envelope.getId(), key.get(), outcome);
            if (outcome == IngestOutcome.APPENDED && isFromOtherUser(envelope)) {
                relayDelivered(envelope.getId());
            }
        }, loop);
    }

    private boolean isFromOtherUser(ServerMessage envelope) {
        return envelope.getSenderId() != null && !Objects.equals(envelope.getSenderId(), connection.localUserId());
    }

    private void relayDelivered(String messageId) {
        if (!deliveryReceipts || !connection.isConnected()) {
            return;
        }
        try {
            connection.sendReceipt(new DeliveryReceipt(messageId, MessageStatus.DELIVERED));
        } catch (RuntimeException e) {
            // receipts are advisory
            log.debug("Could not relay delivery of {}: {}", messageId, Failures.describe(e));
        }
    }
}
