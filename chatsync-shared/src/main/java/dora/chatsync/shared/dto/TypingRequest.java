package dora.chatsync.shared.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Typing indicator for a conversation")
public class TypingRequest {
    @JsonProperty("channelId")
    private String channelId;

    @JsonProperty("conversationId")
    private String conversationId;

    public static TypingRequest forChannel(String channelId) {
        return new TypingRequest(channelId, null);
    }

    public static TypingRequest forConversation(String conversationId) {
        return new TypingRequest(null, conversationId);
    }
}
