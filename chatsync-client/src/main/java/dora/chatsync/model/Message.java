package dora.chatsync.model;

import dora.chatsync.shared.dto.MessageStatus;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * A decrypted chat message held in a conversation timeline.
 * Locally composed messages carry a correlation token until the server assigns an id;
 * received messages carry only the server id.
 */
@Value
@Builder(toBuilder = true)
public class Message {
    String id;
    String correlationToken;
    String senderId;
    String senderUsername;
    @NonNull ConversationKey conversationKey;
    String content;
    @NonNull Instant timestamp;
    @NonNull MessageStatus status;
    String replyToId;
    String failureReason;

    public boolean hasServerId() {
        return id != null;
    }

    public boolean isPending() {
        return status == MessageStatus.PENDING;
    }
}
