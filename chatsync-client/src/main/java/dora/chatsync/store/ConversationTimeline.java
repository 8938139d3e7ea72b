package dora.chatsync.store;

import dora.chatsync.model.ConversationKey;
import dora.chatsync.model.ConversationView;
import dora.chatsync.model.Message;
import dora.chatsync.model.TypingUser;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Mutable state of one conversation. Only touched on the event loop; readers get {@link #view()}.
 */
class ConversationTimeline {

    private static final Comparator<Message> BY_TIMESTAMP = Comparator.comparing(Message::getTimestamp);

    private final ConversationKey key;
    private final List<Message> messages = new ArrayList<>();
    private final Map<String, TypingUser> typing = new LinkedHashMap<>();
    private boolean hasMore = true;
    private volatile ConversationView view;

    ConversationTimeline(ConversationKey key) {
        this.key = key;
        this.view = ConversationView.empty(key);
    }

    ConversationKey key() {
        return key;
    }

    int size() {
        return messages.size();
    }

    Message get(int index) {
        return messages.get(index);
    }

    void set(int index, Message message) {
        messages.set(index, message);
    }

    void add(Message message) {
        messages.add(message);
    }

    void remove(int index) {
        messages.remove(index);
    }

    int indexOfId(String id) {
        if (id == null) {
            return -1;
        }
        for (int i = 0; i < messages.size(); i++) {
            if (id.equals(messages.get(i).getId())) {
                return i;
            }
        }
        return -1;
    }

    /**
     * First record carrying {@code token} that also satisfies {@code filter}.
     */
    int indexOfToken(String token, Predicate<Message> filter) {
        if (token == null) {
            return -1;
        }
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            if (token.equals(message.getCorrelationToken()) && filter.test(message)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Oldest record the server knows about, used as the cursor for the next history page.
     */
    String oldestServerId() {
        for (Message message : messages) {
            if (message.hasServerId()) {
                return message.getId();
            }
        }
        return null;
    }

    boolean hasMore() {
        return hasMore;
    }

    void setHasMore(boolean hasMore) {
        this.hasMore = hasMore;
    }

    // List.sort is stable, so equal timestamps keep their arrival order.
    void sort() {
        messages.sort(BY_TIMESTAMP);
    }

    boolean putTyping(TypingUser user) {
        TypingUser previous = typing.put(user.getUserId(), user);
        return !Objects.equals(previous, user);
    }

    boolean removeTyping(String userId) {
        return typing.remove(userId) != null;
    }

    boolean expireTyping(Instant cutoff) {
        return typing.values().removeIf(user -> user.getLastSignalTime().isBefore(cutoff));
    }

    boolean clearTyping() {
        if (typing.isEmpty()) {
            return false;
        }
        typing.clear();
        return true;
    }

    ConversationView refreshView() {
        view = new ConversationView(key, List.copyOf(messages), hasMore, List.copyOf(typing.values()));
        return view;
    }

    ConversationView view() {
        return view;
    }
}
