package dora.chatsync.store;

import dora.chatsync.model.Message;
import lombok.NonNull;
import lombok.Value;

/**
 * A decrypted server message plus the sender's correlation token when the server echoed it back.
 */
@Value
public class InboundMessage {
    @NonNull Message message;
    String echoToken;

    public static InboundMessage of(Message message) {
        return new InboundMessage(message, null);
    }
}
