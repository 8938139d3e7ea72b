package dora.chatsync.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import dora.chatsync.config.ObjectMapperFactory;
import dora.chatsync.error.AuthenticationException;
import dora.chatsync.error.TransportException;
import dora.chatsync.model.ConversationKey;
import dora.chatsync.session.InMemoryCredentialStore;
import dora.chatsync.shared.dto.ServerMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HttpHistoryApiTest {

    @Mock
    private HttpClient httpClient;
    @Mock
    private HttpResponse<String> response;

    private final ObjectMapper objectMapper = ObjectMapperFactory.create();
    private final InMemoryCredentialStore credentials = new InMemoryCredentialStore();
    private final AtomicReference<String> localUserId = new AtomicReference<>("u1");
    private final List<String> invalidations = new ArrayList<>();
    private HttpHistoryApi api;

    @BeforeEach
    void setUp() {
        credentials.setToken("jwt-1");
        credentials.setOnTokenInvalid(invalidations::add);
        api = new HttpHistoryApi("https://chat.example.test/api/", httpClient, objectMapper, credentials,
                localUserId::get);
    }

    @Test
    void channelEndpointCarriesLimitAndCursor() {
        assertThat(api.endpointFor(ConversationKey.channel("general"), 50, null))
                .isEqualTo("/messages/channel/general?limit=50");
        assertThat(api.endpointFor(ConversationKey.channel("dev ops"), 20, "m 9"))
                .isEqualTo("/messages/channel/dev+ops?limit=20&before=m+9");
    }

    @Test
    void directEndpointNamesThePeer() {
        assertThat(api.endpointFor(ConversationKey.direct("u1:u2"), 10, null))
                .isEqualTo("/messages/dm/u2?limit=10");
        assertThat(api.endpointFor(ConversationKey.direct("u0:u1"), 10, null))
                .isEqualTo("/messages/dm/u0?limit=10");
    }

    @Test
    void directEndpointNeedsTheLocalUser() {
        localUserId.set(null);

        assertThatThrownBy(() -> api.endpointFor(ConversationKey.direct("u1:u2"), 10, null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void successfulPageIsParsed() throws Exception {
        respond(200, "{\"messages\":[{\"id\":\"m1\",\"senderId\":\"u2\",\"channelId\":\"general\","
                + "\"encryptedEnvelope\":\"e1\",\"createdAt\":\"2024-03-01T10:00:00Z\",\"extra\":true}]}");

        List<ServerMessage> page = api.fetchPage(ConversationKey.channel("general"), 50, "m9").get();

        assertThat(page).singleElement().satisfies(message -> {
            assertThat(message.getId()).isEqualTo("m1");
            assertThat(message.getEncryptedEnvelope()).isEqualTo("e1");
            assertThat(message.getCreatedAt()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
        });
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).sendAsync(request.capture(), any());
        assertThat(request.getValue().uri().toString())
                .isEqualTo("https://chat.example.test/api/messages/channel/general?limit=50&before=m9");
        assertThat(request.getValue().headers().firstValue("Authorization")).hasValue("Bearer jwt-1");
    }

    @Test
    void unauthorizedInvalidatesTheCredential() {
        respond(401, "{\"message\":\"Token expired\"}");

        CompletableFuture<List<ServerMessage>> page = api.fetchPage(ConversationKey.channel("general"), 50, null);

        assertThatThrownBy(page::join)
                .hasCauseInstanceOf(AuthenticationException.class)
                .hasMessageContaining("Token expired");
        assertThat(credentials.currentCredential()).isNull();
        assertThat(invalidations).containsExactly("Token expired");
    }

    @Test
    void serverErrorIsATransportFailure() {
        respond(500, "boom");

        CompletableFuture<List<ServerMessage>> page = api.fetchPage(ConversationKey.channel("general"), 50, null);

        assertThatThrownBy(page::join)
                .hasCauseInstanceOf(TransportException.class)
                .hasMessageContaining("HTTP 500: boom");
        assertThat(credentials.currentCredential()).isEqualTo("jwt-1");
    }

    private void respond(int status, String body) {
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        doReturn(CompletableFuture.completedFuture(response)).when(httpClient).sendAsync(any(), any());
    }
}
