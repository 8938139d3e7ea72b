package dora.chatsync.inbound;

import dora.chatsync.connection.ConnectionManager;
import dora.chatsync.connection.ReconnectBackoff;
import dora.chatsync.crypto.CryptoModule;
import dora.chatsync.error.DecryptException;
import dora.chatsync.model.ConversationKey;
import dora.chatsync.model.Message;
import dora.chatsync.session.InMemoryCredentialStore;
import dora.chatsync.shared.SyncDestinations;
import dora.chatsync.shared.dto.DeliveryReceipt;
import dora.chatsync.shared.dto.MessageStatus;
import dora.chatsync.shared.dto.ServerMessage;
import dora.chatsync.store.ConversationStore;
import dora.chatsync.testing.FakeTransport;
import dora.chatsync.testing.ManualEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InboundPipelineTest {

    private static final ConversationKey GENERAL = ConversationKey.channel("general");

    @Mock
    private CryptoModule crypto;

    private final ManualEventLoop loop = new ManualEventLoop();
    private final FakeTransport transport = new FakeTransport().acceptAs("u1", "alice");
    private final ConversationStore store = new ConversationStore();
    private ConnectionManager connection;
    private InboundPipeline pipeline;

    @BeforeEach
    void setUp() {
        connection = new ConnectionManager(loop, transport, new InMemoryCredentialStore(),
                new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(5), 0, () -> 0.5),
                Duration.ofSeconds(10));
        pipeline = new InboundPipeline(loop, store, connection, crypto, true);
        pipeline.init();
        connection.connect("cred");
        loop.runPending();
    }

    @Test
    void pushedMessageIsDecryptedAndStored() {
        decryptAsBody();

        transport.lastSession().push(fromBob("m1", 10, "hello"));
        loop.runPending();

        assertThat(store.view(GENERAL).getMessages()).singleElement().satisfies(message -> {
            assertThat(message.getId()).isEqualTo("m1");
            assertThat(message.getContent()).isEqualTo("hello");
            assertThat(message.getStatus()).isEqualTo(MessageStatus.SENT);
            assertThat(message.getSenderUsername()).isEqualTo("bob");
        });
    }

    @Test
    void undecryptableMessageDoesNotStopTheNextOne() {
        when(crypto.decrypt(any())).thenAnswer(invocation -> {
            ServerMessage message = invocation.getArgument(0);
            if (message.getId().equals("m1")) {
                return CompletableFuture.failedFuture(new DecryptException("Bad MAC"));
            }
            return CompletableFuture.completedFuture(message.getEncryptedEnvelope());
        });

        transport.lastSession().push(fromBob("m1", 10, "corrupt"));
        transport.lastSession().push(fromBob("m2", 11, "fine"));
        loop.runPending();

        assertThat(store.view(GENERAL).getMessages()).extracting(Message::getId).containsExactly("m2");
    }

    @Test
    void sameMessagePushedTwiceIsStoredOnce() {
        decryptAsBody();

        transport.lastSession().push(fromBob("m1", 10, "hello"));
        transport.lastSession().push(fromBob("m1", 10, "hello"));
        loop.runPending();

        assertThat(store.view(GENERAL).getMessages()).hasSize(1);
        assertThat(transport.lastSession().sentTo(SyncDestinations.MESSAGE_ACK)).hasSize(1);
    }

    @Test
    void echoOfOwnMessageReconcilesPendingRecord() {
        decryptAsBody();
        store.insertPending(Message.builder()
                .correlationToken("t1")
                .senderId("u1")
                .conversationKey(GENERAL)
                .content("mine")
                .timestamp(Instant.ofEpochSecond(9))
                .status(MessageStatus.PENDING)
                .build());

        ServerMessage echo = fromBob("m7", 10, "mine");
        echo.setSenderId("u1");
        echo.setClientNonce("t1");
        transport.lastSession().push(echo);
        loop.runPending();

        assertThat(store.view(GENERAL).getMessages()).singleElement().satisfies(message -> {
            assertThat(message.getId()).isEqualTo("m7");
            assertThat(message.getStatus()).isEqualTo(MessageStatus.SENT);
        });
        assertThat(transport.lastSession().sentTo(SyncDestinations.MESSAGE_ACK)).isEmpty();
    }

    @Test
    void deliveryIsRelayedForMessagesFromOthers() {
        decryptAsBody();

        transport.lastSession().push(fromBob("m1", 10, "hello"));
        loop.runPending();

        assertThat(transport.lastSession().sentTo(SyncDestinations.MESSAGE_ACK, DeliveryReceipt.class))
                .containsExactly(new DeliveryReceipt("m1", MessageStatus.DELIVERED));
    }

    @Test
    void directMessageWithoutConversationIdLandsWithItsSender() {
        decryptAsBody();
        ServerMessage direct = fromBob("m1", 10, "psst");
        direct.setChannelId(null);

        transport.lastSession().push(direct);
        loop.runPending();

        assertThat(store.view(ConversationKey.direct("u1:u2")).getMessages()).hasSize(1);
    }

    @Test
    void messageWithoutServerIdIsDropped() {
        transport.lastSession().push(fromBob(null, 10, "ghost"));
        loop.runPending();

        assertThat(store.conversations()).isEmpty();
    }

    @Test
    void missingTimestampFallsBackToArrivalTime() {
        decryptAsBody();
        ServerMessage message = fromBob("m1", 10, "hello");
        message.setCreatedAt(null);

        transport.lastSession().push(message);
        loop.runPending();

        assertThat(store.view(GENERAL).getMessages().get(0).getTimestamp()).isEqualTo(loop.now());
    }

    private void decryptAsBody() {
        when(crypto.decrypt(any())).thenAnswer(invocation ->
                CompletableFuture.completedFuture(invocation.<ServerMessage>getArgument(0).getEncryptedEnvelope()));
    }

    private static ServerMessage fromBob(String id, long second, String body) {
        return ServerMessage.builder()
                .id(id)
                .senderId("u2")
                .senderUsername("bob")
                .channelId("general")
                .encryptedEnvelope(body)
                .protocolVersion(1)
                .createdAt(Instant.ofEpochSecond(second))
                .build();
    }
}
