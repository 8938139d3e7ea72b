package dora.chatsync.shared.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthenticatedEvent {
    @JsonProperty("userId")
    private String userId;

    @JsonProperty("username")
    private String username;
}
