package dora.chatsync.presence;

import dora.chatsync.connection.ConnectionManager;
import dora.chatsync.event.Subscription;
import dora.chatsync.loop.Cancellable;
import dora.chatsync.loop.EventLoop;
import dora.chatsync.model.ConversationKey;
import dora.chatsync.shared.dto.TypingEvent;
import dora.chatsync.store.ConversationStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the typing sets of the store in line with typing events.
 * <p>
 * Entries expire after the TTL without a fresh start signal and are all dropped when the
 * connection goes down, since stop events sent meanwhile are lost.
 */
@Slf4j
public class TypingTracker {

    private final EventLoop loop;
    private final ConversationStore store;
    private final ConnectionManager connection;
    private final Duration ttl;
    private final List<Subscription> subscriptions = new ArrayList<>();
    private Cancellable sweep = Cancellable.NONE;

    public TypingTracker(EventLoop loop, ConversationStore store, ConnectionManager connection, Duration ttl) {
        this.loop = loop;
        this.store = store;
        this.connection = connection;
        this.ttl = ttl;
    }

    public void init() {
        subscriptions.add(connection.events().getTypingStarted().subscribe(this::onStart));
        subscriptions.add(connection.events().getTypingStopped().subscribe(this::onStop));
        subscriptions.add(connection.events().getConnectivityChanged().subscribe(connected -> {
            if (!connected) {
                store.clearTyping();
            }
        }));
        if (!ttl.isZero() && !ttl.isNegative()) {
            loop.execute(this::scheduleSweep);
        }
    }

    public void close() {
        subscriptions.forEach(Subscription::cancel);
        subscriptions.clear();
        loop.execute(() -> {
            sweep.cancel();
            sweep = Cancellable.NONE;
        });
    }

    private void onStart(TypingEvent event) {
        resolve(event).ifPresent(key ->
                store.startTyping(key, event.getUserId(), event.getUsername(), loop.now()));
    }

    private void onStop(TypingEvent event) {
        resolve(event).ifPresent(key -> store.stopTyping(key, event.getUserId()));
    }

    private Optional<ConversationKey> resolve(TypingEvent event) {
        String me = connection.localUserId();
        if (event.getUserId() == null || Objects.equals(event.getUserId(), me)) {
            return Optional.empty();
        }
        Optional<ConversationKey> key = ConversationKey.of(event, me);
        if (key.isEmpty()) {
            log.debug("Ignoring typing event without conversation from {}", event.getUserId());
        }
        return key;
    }

    private void scheduleSweep() {
        // half the TTL keeps an entry's lifetime between ttl and 1.5 * ttl
        sweep = loop.schedule(() -> {
            store.expireTyping(loop.now().minus(ttl));
            scheduleSweep();
        }, ttl.dividedBy(2));
    }
}
