package dora.chatsync.shared.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A message as stored and relayed by the server. The body is still encrypted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Encrypted message relayed by the server")
public class ServerMessage {
    @Schema(description = "Server-assigned message ID")
    @JsonProperty("id")
    private String id;

    @JsonProperty("senderId")
    private String senderId;

    @JsonProperty("senderUsername")
    private String senderUsername;

    @JsonProperty("channelId")
    private String channelId;

    @Schema(description = "Direct conversation ID, the two user IDs sorted and joined by ':'")
    @JsonProperty("conversationId")
    private String conversationId;

    @JsonProperty("conversationType")
    private ConversationType conversationType;

    @JsonProperty("encryptedEnvelope")
    private String encryptedEnvelope;

    @JsonProperty("protocolVersion")
    private int protocolVersion;

    @JsonProperty("createdAt")
    private Instant createdAt;

    @JsonProperty("replyToId")
    private String replyToId;

    @Schema(description = "Sender's correlation token; present when this is the echo of the recipient's own message")
    @JsonProperty("clientNonce")
    private String clientNonce;

    @Schema(description = "Delivery status, absent means SENT")
    @JsonProperty("status")
    private MessageStatus status;
}
