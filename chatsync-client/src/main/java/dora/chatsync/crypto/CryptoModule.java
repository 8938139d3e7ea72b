package dora.chatsync.crypto;

import dora.chatsync.model.ConversationTarget;
import dora.chatsync.shared.dto.ServerMessage;

import java.util.concurrent.CompletableFuture;

/**
 * Encryption boundary. Key management and the envelope format belong to the implementation.
 * Futures may complete on any thread.
 */
public interface CryptoModule {

    /**
     * Encrypts {@code plaintext} for {@code target} and mints the correlation token of the new message.
     */
    CompletableFuture<PreparedEnvelope> prepareEnvelope(String plaintext, ConversationTarget target);

    /**
     * Decrypts the envelope of a server message. Fails with {@link dora.chatsync.error.DecryptException}
     * when the body cannot be read.
     */
    CompletableFuture<String> decrypt(ServerMessage message);
}
