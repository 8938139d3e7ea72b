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
@Schema(description = "Join or leave the room of a conversation")
public class RoomRequest {
    @JsonProperty("channelId")
    private String channelId;

    @JsonProperty("conversationId")
    private String conversationId;

    public static RoomRequest forChannel(String channelId) {
        return new RoomRequest(channelId, null);
    }

    public static RoomRequest forConversation(String conversationId) {
        return new RoomRequest(null, conversationId);
    }
}
