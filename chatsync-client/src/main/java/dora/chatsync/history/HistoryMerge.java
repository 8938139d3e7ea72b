package dora.chatsync.history;

import dora.chatsync.crypto.CryptoModule;
import dora.chatsync.error.Failures;
import dora.chatsync.inbound.ServerMessages;
import dora.chatsync.loop.EventLoop;
import dora.chatsync.model.ConversationKey;
import dora.chatsync.shared.dto.ServerMessage;
import dora.chatsync.store.ConversationStore;
import dora.chatsync.store.InboundMessage;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Loads older pages of a conversation and merges them into the store.
 * <p>
 * Real-time messages may land while a page is in flight; the merge skips ids already present, so
 * the order of the two never matters. Identical requests in flight at the same time share one fetch.
 */
@Slf4j
public class HistoryMerge {

    private final EventLoop loop;
    private final ConversationStore store;
    private final HistoryApi historyApi;
    private final CryptoModule crypto;

    // loop-confined
    private final Map<PageRequest, CompletableFuture<Integer>> inFlight = new HashMap<>();

    public HistoryMerge(EventLoop loop, ConversationStore store, HistoryApi historyApi, CryptoModule crypto) {
        this.loop = loop;
        this.store = store;
        this.historyApi = historyApi;
        this.crypto = crypto;
    }

    /**
     * Fetches the page before {@code beforeId}, or before the oldest known message when it is null.
     *
     * @return number of messages the server returned
     */
    public CompletableFuture<Integer> loadOlder(ConversationKey key, int pageSize, String beforeId) {
        Objects.requireNonNull(key, "key");
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive");
        }
        CompletableFuture<Integer> result = new CompletableFuture<>();
        loop.execute(() -> {
            String cursor = beforeId != null ? beforeId : store.oldestServerId(key).orElse(null);
            PageRequest request = new PageRequest(key, pageSize, cursor);
            CompletableFuture<Integer> shared = inFlight.get(request);
            if (shared == null) {
                shared = new CompletableFuture<>();
                inFlight.put(request, shared);
                fetch(request, shared);
            } else {
                log.debug("Joining in-flight history request {}", request);
            }
            shared.whenComplete((count, error) -> {
                if (error != null) {
                    result.completeExceptionally(error);
                } else {
                    result.complete(count);
                }
            });
        });
        return result;
    }

    private void fetch(PageRequest request, CompletableFuture<Integer> outcome) {
        CompletableFuture<List<ServerMessage>> page;
        try {
            page = historyApi.fetchPage(request.key, request.pageSize, request.beforeId);
        } catch (RuntimeException e) {
            page = CompletableFuture.failedFuture(e);
        }
        page.thenCompose(messages -> decryptAll(request.key, messages)
                        .thenApply(decrypted -> new DecryptedPage(messages.size(), decrypted)))
                .whenCompleteAsync((decrypted, error) -> {
                    inFlight.remove(request);
                    if (error != null) {
                        Throwable cause = Failures.unwrap(error);
                        log.warn("History request {} failed: {}", request, Failures.describe(cause));
                        outcome.completeExceptionally(cause);
                        return;
                    }
                    int added = store.mergePage(request.key, decrypted.messages, decrypted.fetched >= request.pageSize);
                    log.debug("History {} returned {} messages, {} new", request, decrypted.fetched, added);
                    outcome.complete(decrypted.fetched);
                }, loop);
    }

    // Undecryptable records are dropped here, so the page may shrink.
    private CompletableFuture<List<InboundMessage>> decryptAll(ConversationKey key, List<ServerMessage> messages) {
        List<CompletableFuture<InboundMessage>> pending = new ArrayList<>(messages.size());
        for (ServerMessage message : messages) {
            if (message.getId() == null) {
                log.warn("Dropping history record without id in {}", key);
                continue;
            }
            CompletableFuture<String> decrypted;
            try {
                decrypted = crypto.decrypt(message);
            } catch (RuntimeException e) {
                decrypted = CompletableFuture.failedFuture(e);
            }
            pending.add(decrypted.handle((plaintext, error) -> {
                if (error != null) {
                    log.warn("Dropping undecryptable history record {} in {}: {}",
                            message.getId(), key, Failures.describe(error));
                    return null;
                }
                return new InboundMessage(
                        ServerMessages.toMessage(message, key, plaintext, loop.now()), message.getClientNonce());
            }));
        }
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<InboundMessage> result = new ArrayList<>(pending.size());
                    for (CompletableFuture<InboundMessage> future : pending) {
                        InboundMessage inbound = future.join();
                        if (inbound != null) {
                            result.add(inbound);
                        }
                    }
                    return result;
                });
    }

    @EqualsAndHashCode
    @RequiredArgsConstructor
    private static final class PageRequest {
        private final ConversationKey key;
        private final int pageSize;
        private final String beforeId;

        @Override
        public String toString() {
            return key + " limit=" + pageSize + " before=" + beforeId;
        }
    }

    @RequiredArgsConstructor
    private static final class DecryptedPage {
        private final int fetched;
        private final List<InboundMessage> messages;
    }
}
