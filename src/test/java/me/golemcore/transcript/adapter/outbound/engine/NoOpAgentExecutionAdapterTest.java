package me.golemcore.transcript.adapter.outbound.engine;

import me.golemcore.transcript.domain.model.StreamEventKind;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertFalse;

class NoOpAgentExecutionAdapterTest {

    private final NoOpAgentExecutionAdapter adapter = new NoOpAgentExecutionAdapter();

    @Test
    void shouldEndRunWithPlaceholderAnswer() {
        StepVerifier.create(adapter.streamEvents("anything"))
                .expectNextMatches(event -> event.getKind() == StreamEventKind.RUN_END
                        && NoOpAgentExecutionAdapter.NO_ENGINE_ANSWER.equals(event.getPayload()))
                .verifyComplete();
    }

    @Test
    void shouldReportUnavailable() {
        assertFalse(adapter.isAvailable());
    }
}
