package dora.chatsync.presence;

import dora.chatsync.connection.ConnectionManager;
import dora.chatsync.event.EventChannel;
import dora.chatsync.event.Subscription;
import dora.chatsync.shared.dto.PresenceEvent;
import dora.chatsync.shared.dto.PresenceStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Last known presence of other users, as pushed by the server. Forgotten when the connection drops.
 */
public class PresenceDirectory {

    private final ConnectionManager connection;
    private final Map<String, PresenceStatus> statuses = new ConcurrentHashMap<>();
    private final EventChannel<PresenceEvent> changes = new EventChannel<>("presence");
    private final List<Subscription> subscriptions = new ArrayList<>();

    public PresenceDirectory(ConnectionManager connection) {
        this.connection = connection;
    }

    public void init() {
        subscriptions.add(connection.events().getPresenceChanged().subscribe(this::onPresence));
        subscriptions.add(connection.events().getConnectivityChanged().subscribe(connected -> {
            if (!connected) {
                statuses.clear();
            }
        }));
    }

    public void close() {
        subscriptions.forEach(Subscription::cancel);
        subscriptions.clear();
    }

    public PresenceStatus statusOf(String userId) {
        return statuses.getOrDefault(userId, PresenceStatus.OFFLINE);
    }

    public Subscription subscribe(Consumer<PresenceEvent> listener) {
        return changes.subscribe(listener);
    }

    private void onPresence(PresenceEvent event) {
        if (event.getUserId() == null || event.getStatus() == null) {
            return;
        }
        PresenceStatus previous = statuses.put(event.getUserId(), event.getStatus());
        if (previous != event.getStatus()) {
            changes.publish(event);
        }
    }
}
