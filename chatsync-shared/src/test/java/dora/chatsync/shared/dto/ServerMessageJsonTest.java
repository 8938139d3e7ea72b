package dora.chatsync.shared.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ServerMessageJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void serverMessageIgnoresUnknownFields() throws Exception {
        ServerMessage message = objectMapper.readValue("{"
                + "\"id\":\"m1\",\"senderId\":\"u2\",\"senderUsername\":\"bob\","
                + "\"conversationId\":\"u1:u2\",\"conversationType\":\"DM\","
                + "\"encryptedEnvelope\":\"e1\",\"protocolVersion\":1,"
                + "\"createdAt\":\"2024-03-01T10:00:00Z\",\"clientNonce\":\"t1\","
                + "\"status\":\"DELIVERED\",\"attachments\":[]}", ServerMessage.class);

        assertThat(message.getId()).isEqualTo("m1");
        assertThat(message.getConversationType()).isEqualTo(ConversationType.DM);
        assertThat(message.getCreatedAt()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
        assertThat(message.getClientNonce()).isEqualTo("t1");
        assertThat(message.getStatus()).isEqualTo(MessageStatus.DELIVERED);
    }

    @Test
    void doNotDisturbTravelsAsDnd() throws Exception {
        PresenceEvent event = objectMapper.readValue("{\"userId\":\"u2\",\"status\":\"DND\"}", PresenceEvent.class);

        assertThat(event.getStatus()).isEqualTo(PresenceStatus.DO_NOT_DISTURB);
        assertThat(objectMapper.writeValueAsString(event)).contains("\"DND\"");
    }

    @Test
    void envelopeOmitsUnsetDestination() throws Exception {
        String json = objectMapper.writeValueAsString(OutboundEnvelope.builder()
                .recipientId("u2")
                .encryptedEnvelope("e1")
                .clientNonce("t1")
                .protocolVersion(1)
                .build());

        assertThat(json).doesNotContain("channelId").contains("\"recipientId\":\"u2\"");
    }

    @Test
    void historyPageWithoutMessagesIsEmpty() throws Exception {
        HistoryPage page = objectMapper.readValue("{}", HistoryPage.class);

        assertThat(page.getMessages()).isEmpty();
    }
}
