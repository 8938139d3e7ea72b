package dora.chatsync.history;

import dora.chatsync.model.ConversationKey;
import dora.chatsync.shared.dto.ServerMessage;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Server-side message history, still encrypted.
 */
public interface HistoryApi {

    /**
     * Fetches up to {@code pageSize} messages older than {@code beforeId}, or the newest ones when it is null.
     */
    CompletableFuture<List<ServerMessage>> fetchPage(ConversationKey key, int pageSize, String beforeId);
}
