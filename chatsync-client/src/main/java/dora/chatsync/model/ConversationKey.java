package dora.chatsync.model;

import dora.chatsync.shared.dto.ConversationType;
import dora.chatsync.shared.dto.RoomRequest;
import dora.chatsync.shared.dto.ServerMessage;
import dora.chatsync.shared.dto.TypingEvent;
import dora.chatsync.shared.dto.TypingRequest;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * Identifies one conversation timeline: either a channel or a direct conversation, never both.
 */
@Value
public class ConversationKey {
    @NonNull ConversationType type;
    @NonNull String id;

    public static ConversationKey channel(String channelId) {
        return new ConversationKey(ConversationType.CHANNEL, channelId);
    }

    public static ConversationKey direct(String conversationId) {
        return new ConversationKey(ConversationType.DM, conversationId);
    }

    public boolean isChannel() {
        return type == ConversationType.CHANNEL;
    }

    /**
     * Resolves the timeline a server message belongs to.
     * A direct message without a conversation id is placed in the conversation with its sender.
     */
    public static Optional<ConversationKey> of(ServerMessage message, String localUserId) {
        if (message.getChannelId() != null) {
            return Optional.of(channel(message.getChannelId()));
        }
        return directOf(message.getConversationId(), message.getSenderId(), localUserId);
    }

    public static Optional<ConversationKey> of(TypingEvent event, String localUserId) {
        if (event.getChannelId() != null) {
            return Optional.of(channel(event.getChannelId()));
        }
        return directOf(event.getConversationId(), event.getUserId(), localUserId);
    }

    private static Optional<ConversationKey> directOf(String conversationId, String otherUserId, String localUserId) {
        if (conversationId != null) {
            return Optional.of(direct(conversationId));
        }
        if (otherUserId != null && localUserId != null) {
            return Optional.of(direct(DirectConversations.idFor(localUserId, otherUserId)));
        }
        return Optional.empty();
    }

    public RoomRequest toRoomRequest() {
        return isChannel() ? RoomRequest.forChannel(id) : RoomRequest.forConversation(id);
    }

    public TypingRequest toTypingRequest() {
        return isChannel() ? TypingRequest.forChannel(id) : TypingRequest.forConversation(id);
    }

    @Override
    public String toString() {
        return type + "/" + id;
    }
}
