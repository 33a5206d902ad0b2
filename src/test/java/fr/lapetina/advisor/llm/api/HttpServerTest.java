package fr.lapetina.advisor.llm.api;

import fr.lapetina.advisor.llm.engine.StreamOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HttpServerTest {

    @Test
    @DisplayName("should mark a completed stream as done")
    void shouldMarkCompletedStreamDone() {
        Map<String, Object> line = HttpServer.streamEndLine("The stock looks stable.", StreamOutcome.COMPLETED);

        assertThat(line).containsEntry("done", true)
                .containsEntry("outcome", "completed")
                .doesNotContainKey("abandoned");
    }

    @Test
    @DisplayName("should not mark an abandoned stream as done")
    void shouldFlagAbandonedStream() {
        Map<String, Object> line = HttpServer.streamEndLine("The stock", StreamOutcome.ABANDONED);

        assertThat(line).containsEntry("text", "The stock")
                .containsEntry("done", false)
                .containsEntry("outcome", "abandoned")
                .containsEntry("abandoned", true);
    }

    @Test
    @DisplayName("should not mark a failed stream as done")
    void shouldReportFailedStream() {
        Map<String, Object> line = HttpServer.streamEndLine("", StreamOutcome.FAILED);

        assertThat(line).containsEntry("done", false)
                .containsEntry("outcome", "failed");
    }
}
