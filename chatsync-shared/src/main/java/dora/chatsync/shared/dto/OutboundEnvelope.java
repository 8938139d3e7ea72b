package dora.chatsync.shared.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Encrypted message submitted by a client. Exactly one of channelId and recipientId is set.")
public class OutboundEnvelope {
    @Schema(description = "Target channel ID")
    @JsonProperty("channelId")
    private String channelId;

    @Schema(description = "Target user ID for a direct message")
    @JsonProperty("recipientId")
    private String recipientId;

    @Schema(description = "Opaque encrypted envelope")
    @NotBlank(message = "Envelope cannot be blank")
    @JsonProperty("encryptedEnvelope")
    private String encryptedEnvelope;

    @Schema(description = "Client-generated correlation token, echoed back in the ack")
    @NotBlank(message = "Client nonce cannot be blank")
    @JsonProperty("clientNonce")
    private String clientNonce;

    @Schema(description = "Envelope protocol version", example = "1")
    @JsonProperty("protocolVersion")
    private int protocolVersion;

    @Schema(description = "ID of the message being replied to")
    @JsonProperty("replyToId")
    private String replyToId;
}
