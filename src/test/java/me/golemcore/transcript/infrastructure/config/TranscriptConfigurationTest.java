package me.golemcore.transcript.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import me.golemcore.transcript.domain.model.Message;
import me.golemcore.transcript.port.outbound.AgentExecutionPort;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TranscriptConfigurationTest {

    @Test
    void shouldConfigureObjectMapperForIsoTimestamps() throws Exception {
        ObjectMapper mapper = TranscriptConfiguration.objectMapper();

        assertFalse(mapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
        assertFalse(mapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));

        Message message = Message.builder()
                .role(Message.ROLE_USER)
                .content("hi")
                .timestamp(Instant.parse("2026-02-14T00:00:00Z"))
                .build();
        String json = mapper.writeValueAsString(message);
        assertTrue(json.contains("\"timestamp\":\"2026-02-14T00:00:00Z\""));
        assertFalse(json.contains("userMessage"));

        Message restored = mapper.readValue("{\"role\":\"tool\",\"extra\":1,\"toolCallId\":\"tc-1\"}",
                Message.class);
        assertEquals("tc-1", restored.getToolCallId());
    }

    @Test
    void shouldProvideSystemClock() {
        assertNotNull(TranscriptConfiguration.clock());
    }

    @Test
    void shouldLogActiveConfigurationOnInit() {
        AgentExecutionPort executionPort = mock(AgentExecutionPort.class);
        when(executionPort.isAvailable()).thenReturn(false);
        TranscriptConfiguration configuration = new TranscriptConfiguration(new TranscriptProperties(),
                executionPort);

        assertDoesNotThrow(configuration::init);
        verify(executionPort).isAvailable();
    }
}
