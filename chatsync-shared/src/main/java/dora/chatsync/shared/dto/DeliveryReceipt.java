package dora.chatsync.shared.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Recipient-side delivery or read receipt relayed back to the sender")
public class DeliveryReceipt {
    @NotBlank(message = "Message ID cannot be blank")
    @JsonProperty("messageId")
    private String messageId;

    @Schema(description = "Receipt status", allowableValues = {"DELIVERED", "READ"})
    @NotNull(message = "Status cannot be null")
    @JsonProperty("status")
    private MessageStatus status;
}
