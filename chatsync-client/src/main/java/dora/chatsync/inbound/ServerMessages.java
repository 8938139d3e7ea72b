package dora.chatsync.inbound;

import dora.chatsync.model.ConversationKey;
import dora.chatsync.model.Message;
import dora.chatsync.shared.dto.MessageStatus;
import dora.chatsync.shared.dto.ServerMessage;

import java.time.Instant;

/**
 * Maps decrypted server messages onto store records.
 */
public final class ServerMessages {

    private ServerMessages() {
    }

    /**
     * @param receivedAt used as the timestamp when the server did not send one
     */
    public static Message toMessage(ServerMessage source, ConversationKey key, String plaintext, Instant receivedAt) {
        return Message.builder()
                .id(source.getId())
                .senderId(source.getSenderId())
                .senderUsername(source.getSenderUsername())
                .conversationKey(key)
                .content(plaintext)
                .timestamp(source.getCreatedAt() != null ? source.getCreatedAt() : receivedAt)
                .status(statusOf(source))
                .replyToId(source.getReplyToId())
                .build();
    }

    // a received message is at least SENT
    static MessageStatus statusOf(ServerMessage source) {
        MessageStatus status = source.getStatus();
        if (status == null || status == MessageStatus.PENDING || status == MessageStatus.FAILED) {
            return MessageStatus.SENT;
        }
        return status;
    }
}
