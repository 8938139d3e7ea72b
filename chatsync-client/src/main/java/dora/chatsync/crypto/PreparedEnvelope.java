package dora.chatsync.crypto;

import lombok.NonNull;
import lombok.Value;

@Value
public class PreparedEnvelope {
    @NonNull String encryptedEnvelope;
    @NonNull String correlationToken;
}
