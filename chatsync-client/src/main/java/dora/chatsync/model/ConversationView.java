package dora.chatsync.model;

import lombok.Value;

import java.util.List;

/**
 * Immutable snapshot of one conversation, published after every mutation.
 */
@Value
public class ConversationView {
    ConversationKey key;
    List<Message> messages;
    boolean hasMore;
    List<TypingUser> typingUsers;

    public static ConversationView empty(ConversationKey key) {
        return new ConversationView(key, List.of(), true, List.of());
    }
}
