package dora.chatsync;

import com.fasterxml.jackson.databind.ObjectMapper;
import dora.chatsync.config.ObjectMapperFactory;
import dora.chatsync.config.SyncClientConfig;
import dora.chatsync.connection.ConnectionManager;
import dora.chatsync.connection.ConnectionState;
import dora.chatsync.connection.ReconnectBackoff;
import dora.chatsync.connection.StompTransport;
import dora.chatsync.connection.Transport;
import dora.chatsync.crypto.CryptoModule;
import dora.chatsync.error.Failures;
import dora.chatsync.event.Subscription;
import dora.chatsync.history.HistoryApi;
import dora.chatsync.history.HistoryMerge;
import dora.chatsync.history.HttpHistoryApi;
import dora.chatsync.inbound.InboundPipeline;
import dora.chatsync.loop.EventLoop;
import dora.chatsync.loop.ExecutorEventLoop;
import dora.chatsync.model.ConversationKey;
import dora.chatsync.model.ConversationTarget;
import dora.chatsync.model.ConversationView;
import dora.chatsync.outbound.OutboundPipeline;
import dora.chatsync.presence.PresenceDirectory;
import dora.chatsync.presence.TypingTracker;
import dora.chatsync.session.CredentialStore;
import dora.chatsync.shared.dto.DeliveryReceipt;
import dora.chatsync.shared.dto.MessageStatus;
import dora.chatsync.shared.dto.PresenceEvent;
import dora.chatsync.shared.dto.PresenceStatus;
import dora.chatsync.store.ConversationStore;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Entry point of the sync layer for a UI.
 * <p>
 * Reads come from immutable {@link ConversationView}s; everything else is asynchronous. Call
 * {@link #init()} once before use and {@link #shutdown()} when done.
 */
@Slf4j
public class SyncClient {

    private final SyncClientConfig config;
    private final EventLoop loop;
    private final ConversationStore store;
    private final ConnectionManager connection;
    private final OutboundPipeline outbound;
    private final InboundPipeline inbound;
    private final HistoryMerge history;
    private final TypingTracker typing;
    private final PresenceDirectory presence;
    private boolean initialized;

    public SyncClient(SyncClientConfig config, EventLoop loop, Transport transport, CredentialStore credentialStore,
                      CryptoModule crypto, HistoryApi historyApi) {
        this.config = config;
        this.loop = loop;
        this.store = new ConversationStore();
        this.connection = new ConnectionManager(loop, transport, credentialStore,
                new ReconnectBackoff(config.getReconnectDelay(), config.getReconnectDelayMax(),
                        config.getReconnectRandomization(), () -> ThreadLocalRandom.current().nextDouble()),
                config.getConnectTimeout());
        this.outbound = new OutboundPipeline(loop, store, connection, crypto,
                config.getPendingTimeout(), config.getProtocolVersion());
        this.inbound = new InboundPipeline(loop, store, connection, crypto, config.isDeliveryReceipts());
        this.history = new HistoryMerge(loop, store, historyApi, crypto);
        this.typing = new TypingTracker(loop, store, connection, config.getTypingTtl());
        this.presence = new PresenceDirectory(connection);
    }

    /**
     * Wires the production STOMP transport and HTTP history client.
     */
    public static SyncClient create(SyncClientConfig config, CredentialStore credentialStore, CryptoModule crypto) {
        ObjectMapper objectMapper = ObjectMapperFactory.create();
        EventLoop loop = new ExecutorEventLoop();
        Transport transport = new StompTransport(config.getServerUrl(), objectMapper);
        // direct history paths need the local user id, known only once the client is connected
        AtomicReference<SyncClient> client = new AtomicReference<>();
        HistoryApi historyApi = new HttpHistoryApi(config.getApiUrl(), objectMapper, credentialStore,
                () -> client.get().localUserId());
        client.set(new SyncClient(config, loop, transport, credentialStore, crypto, historyApi));
        return client.get();
    }

    public synchronized void init() {
        if (initialized) {
            return;
        }
        outbound.init();
        inbound.init();
        typing.init();
        presence.init();
        initialized = true;
        log.info("Sync client initialized");
    }

    public synchronized void shutdown() {
        if (!initialized) {
            return;
        }
        initialized = false;
        outbound.close();
        inbound.close();
        typing.close();
        presence.close();
        connection.shutdown();
        loop.shutdown();
        log.info("Sync client shut down");
    }

    // ---------------------------------------------------------------- connection

    public CompletableFuture<Void> connect(String credential) {
        return connection.connect(credential);
    }

    public void disconnect() {
        connection.disconnect();
    }

    public ConnectionState connectionState() {
        return connection.state();
    }

    public String localUserId() {
        return connection.localUserId();
    }

    public Subscription onConnectivityChanged(Consumer<Boolean> listener) {
        return connection.events().getConnectivityChanged().subscribe(listener);
    }

    // ---------------------------------------------------------------- messages

    /**
     * @return the correlation token of the new PENDING message
     */
    public CompletableFuture<String> send(ConversationTarget target, String plaintext) {
        return outbound.send(target, plaintext, null);
    }

    public CompletableFuture<String> send(ConversationTarget target, String plaintext, String replyToId) {
        return outbound.send(target, plaintext, replyToId);
    }

    public CompletableFuture<Integer> loadOlder(ConversationKey key) {
        return history.loadOlder(key, config.getHistoryPageSize(), null);
    }

    public CompletableFuture<Integer> loadOlder(ConversationKey key, int pageSize, String beforeId) {
        return history.loadOlder(key, pageSize, beforeId);
    }

    /**
     * Tells the sender that {@code messageId} was read. Skipped when offline.
     */
    public void markRead(ConversationKey key, String messageId) {
        loop.execute(() -> {
            if (!connection.isConnected()) {
                log.debug("Not connected, read receipt for {} in {} skipped", messageId, key);
                return;
            }
            try {
                connection.sendReceipt(new DeliveryReceipt(messageId, MessageStatus.READ));
            } catch (RuntimeException e) {
                log.debug("Could not relay read receipt for {}: {}", messageId, Failures.describe(e));
            }
        });
    }

    // ---------------------------------------------------------------- rooms and typing

    public CompletableFuture<Void> joinConversation(ConversationKey key) {
        return onLoop(() -> connection.joinRoom(key));
    }

    public CompletableFuture<Void> leaveConversation(ConversationKey key) {
        return onLoop(() -> connection.leaveRoom(key));
    }

    public CompletableFuture<Void> startTyping(ConversationKey key) {
        return onLoop(() -> connection.startTyping(key));
    }

    public CompletableFuture<Void> stopTyping(ConversationKey key) {
        return onLoop(() -> connection.stopTyping(key));
    }

    private CompletableFuture<Void> onLoop(Runnable command) {
        return CompletableFuture.runAsync(command, loop);
    }

    // ---------------------------------------------------------------- reads

    public ConversationView view(ConversationKey key) {
        return store.view(key);
    }

    /**
     * Listener is called on the event loop after every change to the conversation.
     */
    public Subscription subscribe(ConversationKey key, Consumer<ConversationView> listener) {
        return store.subscribe(key, listener);
    }

    public Subscription onPresenceChanged(Consumer<PresenceEvent> listener) {
        return presence.subscribe(listener);
    }

    public PresenceStatus presenceOf(String userId) {
        return presence.statusOf(userId);
    }

    ConversationStore store() {
        return store;
    }

    ConnectionManager connection() {
        return connection;
    }
}
