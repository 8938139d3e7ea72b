package dora.chatsync.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dora.chatsync.error.AuthenticationException;
import dora.chatsync.error.TransportException;
import dora.chatsync.model.ConversationKey;
import dora.chatsync.model.DirectConversations;
import dora.chatsync.session.CredentialStore;
import dora.chatsync.shared.dto.HistoryPage;
import dora.chatsync.shared.dto.ServerMessage;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * {@link HistoryApi} over the server's REST endpoints.
 */
@Slf4j
public class HttpHistoryApi implements HistoryApi {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CredentialStore credentialStore;
    private final Supplier<String> localUserId;

    public HttpHistoryApi(String baseUrl, HttpClient httpClient, ObjectMapper objectMapper,
                          CredentialStore credentialStore, Supplier<String> localUserId) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.credentialStore = credentialStore;
        this.localUserId = localUserId;
    }

    public HttpHistoryApi(String baseUrl, ObjectMapper objectMapper, CredentialStore credentialStore,
                          Supplier<String> localUserId) {
        this(baseUrl, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                objectMapper, credentialStore, localUserId);
    }

    @Override
    public CompletableFuture<List<ServerMessage>> fetchPage(ConversationKey key, int pageSize, String beforeId) {
        HttpRequest request;
        try {
            request = createRequestBuilder(endpointFor(key, pageSize, beforeId)).GET().build();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    int status = response.statusCode();
                    if (status == 200) {
                        return parsePage(response.body());
                    }
                    String errorMessage = extractErrorMessage(response.body());
                    if (status == 401 || status == 403) {
                        String reason = errorMessage != null ? errorMessage
                                : (status == 401 ? "Unauthorized - please sign in again" : "Forbidden - please sign in again");
                        credentialStore.onAuthenticationFailed(reason);
                        throw new AuthenticationException(reason);
                    }
                    throw new TransportException("History request failed with HTTP " + status
                            + (errorMessage != null ? ": " + errorMessage : ""));
                });
    }

    String endpointFor(ConversationKey key, int pageSize, String beforeId) {
        StringBuilder endpoint = new StringBuilder("/messages/");
        if (key.isChannel()) {
            endpoint.append("channel/").append(encode(key.getId()));
        } else {
            String me = localUserId.get();
            if (me == null) {
                throw new IllegalStateException("Local user is unknown, cannot load direct history");
            }
            endpoint.append("dm/").append(encode(DirectConversations.peerOf(key.getId(), me)));
        }
        endpoint.append("?limit=").append(pageSize);
        if (beforeId != null) {
            endpoint.append("&before=").append(encode(beforeId));
        }
        return endpoint.toString();
    }

    private HttpRequest.Builder createRequestBuilder(String endpoint) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + endpoint))
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json");
        String token = credentialStore.currentCredential();
        if (token != null && !token.isEmpty()) {
            builder.header("Authorization", "Bearer " + token);
        } else {
            log.warn("No credential available for request to {}", endpoint);
        }
        return builder;
    }

    private List<ServerMessage> parsePage(String body) {
        try {
            HistoryPage page = objectMapper.readValue(body, HistoryPage.class);
            return page.getMessages() != null ? page.getMessages() : List.of();
        } catch (JsonProcessingException e) {
            throw new TransportException("Failed to parse history page", e);
        }
    }

    /**
     * Pulls a readable message out of an error body, JSON or plain text.
     */
    private String extractErrorMessage(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return null;
        }
        try {
            JsonNode json = objectMapper.readTree(responseBody);
            if (json.has("message")) {
                return json.get("message").asText();
            }
            if (json.has("error")) {
                return json.get("error").asText();
            }
            return responseBody;
        } catch (JsonProcessingException e) {
            return responseBody;
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
