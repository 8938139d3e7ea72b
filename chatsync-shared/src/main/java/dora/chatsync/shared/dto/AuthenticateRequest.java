package dora.chatsync.shared.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "Session authentication sent right after the STOMP handshake")
public class AuthenticateRequest {
    @Schema(description = "Session token issued at sign-in")
    @NotBlank(message = "Token cannot be blank")
    @JsonProperty("token")
    private String token;

    @JsonCreator
    public AuthenticateRequest(@JsonProperty("token") String token) {
        this.token = token;
    }

    public AuthenticateRequest() {
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    @Override
    public String toString() {
        // never log the token
        return "AuthenticateRequest{token=***}";
    }
}
