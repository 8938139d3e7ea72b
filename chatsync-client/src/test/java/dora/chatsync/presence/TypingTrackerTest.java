package dora.chatsync.presence;

import dora.chatsync.connection.ConnectionManager;
import dora.chatsync.connection.ReconnectBackoff;
import dora.chatsync.model.ConversationKey;
import dora.chatsync.model.TypingUser;
import dora.chatsync.session.InMemoryCredentialStore;
import dora.chatsync.shared.dto.TypingEvent;
import dora.chatsync.store.ConversationStore;
import dora.chatsync.testing.FakeTransport;
import dora.chatsync.testing.ManualEventLoop;
import net.jqwik.api.Example;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TypingTrackerTest {

    private static final ConversationKey GENERAL = ConversationKey.channel("general");
    private static final Duration TTL = Duration.ofSeconds(6);

    private final ManualEventLoop loop = new ManualEventLoop();
    private final FakeTransport transport = new FakeTransport().acceptAs("u1", "alice");
    private final ConversationStore store = new ConversationStore();
    private final ConnectionManager connection = new ConnectionManager(loop, transport, new InMemoryCredentialStore(),
            new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(5), 0, () -> 0.5),
            Duration.ofSeconds(10));
    private final TypingTracker tracker = new TypingTracker(loop, store, connection, TTL);

    TypingTrackerTest() {
        tracker.init();
        connection.connect("cred");
        loop.runPending();
    }

    @Example
    void otherUserStartsAndStopsTyping() {
        transport.lastSession().typingStart(inGeneral("u2", "bob"));
        loop.runPending();

        assertThat(store.view(GENERAL).getTypingUsers()).extracting(TypingUser::getUsername).containsExactly("bob");

        transport.lastSession().typingStop(inGeneral("u2", "bob"));
        loop.runPending();

        assertThat(store.view(GENERAL).getTypingUsers()).isEmpty();
    }

    @Example
    void ownTypingEchoIsIgnored() {
        transport.lastSession().typingStart(inGeneral("u1", "alice"));
        loop.runPending();

        assertThat(store.view(GENERAL).getTypingUsers()).isEmpty();
    }

    @Example
    void directTypingWithoutConversationIdUsesTheSender() {
        transport.lastSession().typingStart(TypingEvent.builder().userId("u2").username("bob").build());
        loop.runPending();

        assertThat(store.view(ConversationKey.direct("u1:u2")).getTypingUsers()).hasSize(1);
    }

    @Example
    void typingExpiresWithoutFreshSignal() {
        transport.lastSession().typingStart(inGeneral("u2", "bob"));
        loop.runPending();

        loop.advance(Duration.ofSeconds(3));
        transport.lastSession().typingStart(inGeneral("u3", "carol"));
        loop.runPending();
        loop.advance(Duration.ofSeconds(6));

        assertThat(store.view(GENERAL).getTypingUsers()).extracting(TypingUser::getUsername).containsExactly("carol");

        loop.advance(Duration.ofSeconds(3));

        assertThat(store.view(GENERAL).getTypingUsers()).isEmpty();
    }

    @Example
    void repeatedStartKeepsTypingAlive() {
        for (int i = 0; i < 5; i++) {
            transport.lastSession().typingStart(inGeneral("u2", "bob"));
            loop.runPending();
            loop.advance(Duration.ofSeconds(3));
        }

        assertThat(store.view(GENERAL).getTypingUsers()).hasSize(1);
    }

    @Example
    void connectionLossClearsTyping() {
        transport.lastSession().typingStart(inGeneral("u2", "bob"));
        loop.runPending();

        transport.lastSession().drop();
        loop.runPending();

        assertThat(store.view(GENERAL).getTypingUsers()).isEmpty();
    }

    @Example
    void closedTrackerStopsSweeping() {
        tracker.close();
        loop.runPending();

        assertThat(loop.scheduledCount()).isZero();
    }

    private static TypingEvent inGeneral(String userId, String username) {
        return TypingEvent.builder().userId(userId).username(username).channelId("general").build();
    }
}
