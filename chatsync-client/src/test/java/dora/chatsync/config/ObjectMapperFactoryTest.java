package dora.chatsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dora.chatsync.shared.dto.MessageAck;
import dora.chatsync.shared.dto.MessageStatus;
import dora.chatsync.shared.dto.OutboundEnvelope;
import net.jqwik.api.Example;

import static org.assertj.core.api.Assertions.assertThat;

class ObjectMapperFactoryTest {

    private final ObjectMapper objectMapper = ObjectMapperFactory.create();

    @Example
    void unknownFieldsAreIgnored() throws Exception {
        MessageAck ack = objectMapper.readValue(
                "{\"clientNonce\":\"t1\",\"messageId\":\"m1\",\"status\":\"DELIVERED\",\"serverTime\":123}",
                MessageAck.class);

        assertThat(ack.getClientNonce()).isEqualTo("t1");
        assertThat(ack.getStatus()).isEqualTo(MessageStatus.DELIVERED);
    }

    @Example
    void envelopeCarriesCorrelationToken() throws Exception {
        String json = objectMapper.writeValueAsString(OutboundEnvelope.builder()
                .channelId("general")
                .encryptedEnvelope("e1")
                .clientNonce("t1")
                .protocolVersion(1)
                .build());

        assertThat(objectMapper.readTree(json).get("clientNonce").asText()).isEqualTo("t1");
        assertThat(objectMapper.readTree(json).get("encryptedEnvelope").asText()).isEqualTo("e1");
    }
}
