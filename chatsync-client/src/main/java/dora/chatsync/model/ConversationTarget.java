package dora.chatsync.model;

import dora.chatsync.shared.dto.OutboundEnvelope;
import lombok.NonNull;
import lombok.Value;

/**
 * Addressee of a compose action: a channel, or a single recipient for a direct message.
 */
@Value
public class ConversationTarget {
    String channelId;
    String recipientId;

    private ConversationTarget(String channelId, String recipientId) {
        this.channelId = channelId;
        this.recipientId = recipientId;
    }

    public static ConversationTarget channel(@NonNull String channelId) {
        return new ConversationTarget(channelId, null);
    }

    public static ConversationTarget direct(@NonNull String recipientId) {
        return new ConversationTarget(null, recipientId);
    }

    public boolean isChannel() {
        return channelId != null;
    }

    /**
     * The timeline a message to this target is stored in. Direct targets need the local user id.
     */
    public ConversationKey toKey(String localUserId) {
        if (isChannel()) {
            return ConversationKey.channel(channelId);
        }
        if (localUserId == null) {
            throw new IllegalStateException("Local user is unknown, cannot address a direct conversation");
        }
        return ConversationKey.direct(DirectConversations.idFor(localUserId, recipientId));
    }

    public OutboundEnvelope.OutboundEnvelopeBuilder envelopeBuilder() {
        return OutboundEnvelope.builder()
                .channelId(channelId)
                .recipientId(recipientId);
    }
}
