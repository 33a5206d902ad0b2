package fr.lapetina.advisor.llm.engine;

import fr.lapetina.advisor.llm.domain.model.ErrorType;
import fr.lapetina.advisor.llm.domain.model.GenerationRequest;
import fr.lapetina.advisor.llm.engine.bigram.BigramFixtures;
import fr.lapetina.advisor.llm.engine.bigram.BigramModelHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenStreamTest {

    private GenerationEngine engine;
    private BigramModelHandle handle;

    @BeforeEach
    void setUp() {
        engine = new GenerationEngine(16, Duration.ofSeconds(5), 4);
        handle = BigramFixtures.handle();
    }

    private static GenerationRequest greedy() {
        return GenerationRequest.ofPrompt(null, "How is ACME doing?", 0.0);
    }

    private static List<String> collect(TokenStream stream) {
        List<String> snapshots = new ArrayList<>();
        while (stream.hasNext()) {
            snapshots.add(stream.next());
        }
        return snapshots;
    }

    @Test
    @DisplayName("should yield cumulative snapshots ending with the blocking result")
    void shouldYieldCumulativeSnapshots() throws InterruptedException {
        RecordingStreamSession session = new RecordingStreamSession(handle);

        List<String> snapshots = collect(engine.stream(greedy(), session));

        assertThat(snapshots).containsExactlyElementsOf(BigramFixtures.GREEDY_SNAPSHOTS);
        assertThat(snapshots.get(snapshots.size() - 1))
                .isEqualTo(engine.complete(handle, greedy()).text());
        assertThat(session.outcome()).isEqualTo(StreamOutcome.COMPLETED);
        assertThat(session.finalText()).isEqualTo(BigramFixtures.GREEDY_ANSWER);
        assertThat(session.awaitReleased()).isTrue();
    }

    @Test
    @DisplayName("should yield snapshots of non-decreasing length when sampling")
    void shouldYieldGrowingSnapshotsWhenSampling() {
        GenerationRequest request = GenerationRequest.builder()
                .user("Any view on the market?")
                .temperature(1.0)
                .seed(7L)
                .build();

        List<String> snapshots = collect(engine.stream(request, new RecordingStreamSession(handle)));

        assertThat(snapshots).isNotEmpty();
        assertThat(snapshots).isSortedAccordingTo(Comparator.comparingInt(String::length));
        assertThat(snapshots).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("should not touch the session before the first pull")
    void shouldStartLazily() {
        RecordingStreamSession session = new RecordingStreamSession(handle);
        TokenStream stream = engine.stream(greedy(), session);

        assertThat(session.acquired()).isZero();

        assertThat(stream.hasNext()).isTrue();
        assertThat(session.acquired()).isEqualTo(1);
        stream.close();
    }

    @Test
    @DisplayName("should end immediately when no handle is available")
    void shouldEndWhenUnavailable() {
        RecordingStreamSession session = new RecordingStreamSession(null);
        TokenStream stream = engine.stream(greedy(), session);

        assertThat(stream.hasNext()).isFalse();
        assertThat(session.outcome()).isEqualTo(StreamOutcome.UNAVAILABLE);
        assertThat(stream.isFinished()).isTrue();
    }

    @Test
    @DisplayName("should not acquire when closed before the first pull")
    void shouldNotAcquireWhenClosedEarly() {
        RecordingStreamSession session = new RecordingStreamSession(handle);
        TokenStream stream = engine.stream(greedy(), session);

        stream.close();

        assertThat(stream.hasNext()).isFalse();
        assertThat(session.acquired()).isZero();
        assertThat(session.isFinished()).isFalse();
    }

    @Test
    @DisplayName("should report CLOSED when the consumer stops early")
    void shouldReportClosedWhenStoppedEarly() throws InterruptedException {
        RecordingStreamSession session = new RecordingStreamSession(handle);
        TokenStream stream = engine.stream(greedy(), session);

        assertThat(stream.next()).isEqualTo("The");
        stream.close();

        assertThat(session.outcome()).isEqualTo(StreamOutcome.CLOSED);
        assertThat(session.finalText()).isEqualTo("The");
        assertThat(stream.hasNext()).isFalse();
        assertThat(session.awaitReleased()).isTrue();
    }

    @Test
    @DisplayName("should abandon a stalled producer after the timeout")
    void shouldAbandonStalledProducer() throws InterruptedException {
        GenerationEngine impatient = new GenerationEngine(16, Duration.ofMillis(200), 4);
        GatedModelHandle gated = new GatedModelHandle(handle);
        RecordingStreamSession session = new RecordingStreamSession(gated);
        TokenStream stream = impatient.stream(greedy(), session);

        long start = System.nanoTime();
        assertThat(stream.hasNext()).isFalse();
        long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(waitedMillis).isGreaterThanOrEqualTo(150);
        assertThat(session.outcome()).isEqualTo(StreamOutcome.ABANDONED);
        assertThat(stream.outcome()).contains(StreamOutcome.ABANDONED);
        assertThat(session.finalText()).isEmpty();

        // the detached producer stops at its first token and gives the handle back
        gated.open();
        assertThat(session.awaitReleased()).isTrue();
    }

    @Test
    @DisplayName("should not abandon a slow producer that keeps making progress")
    void shouldKeepSteadyProducerPastTheTimeout() {
        GenerationEngine impatient = new GenerationEngine(16, Duration.ofMillis(250), 4);
        PacedModelHandle paced = new PacedModelHandle(handle, Duration.ofMillis(60));
        RecordingStreamSession session = new RecordingStreamSession(paced);
        TokenStream stream = impatient.stream(greedy(), session);

        long start = System.nanoTime();
        List<String> snapshots = collect(stream);
        long tookMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(tookMillis).isGreaterThan(250);
        assertThat(snapshots).containsExactlyElementsOf(BigramFixtures.GREEDY_SNAPSHOTS);
        assertThat(snapshots.get(snapshots.size() - 1))
                .isEqualTo(impatient.complete(handle, greedy()).text());
        assertThat(session.outcome()).isEqualTo(StreamOutcome.COMPLETED);
        assertThat(stream.outcome()).contains(StreamOutcome.COMPLETED);
    }

    @Test
    @DisplayName("should report no outcome while running and UNAVAILABLE when empty")
    void shouldExposeOutcome() {
        TokenStream stream = engine.stream(greedy(), new RecordingStreamSession(handle));

        assertThat(stream.next()).isEqualTo("The");
        assertThat(stream.outcome()).isEmpty();
        stream.close();

        assertThat(stream.outcome()).contains(StreamOutcome.CLOSED);
        assertThat(TokenStream.empty().outcome()).contains(StreamOutcome.UNAVAILABLE);
    }

    @Test
    @DisplayName("should report FAILED when the engine faults")
    void shouldReportEngineFailure() throws InterruptedException {
        handle.close();
        RecordingStreamSession session = new RecordingStreamSession(handle);

        TokenStream stream = engine.stream(greedy(), session);

        assertThat(stream.hasNext()).isFalse();
        assertThat(session.outcome()).isEqualTo(StreamOutcome.FAILED);
        assertThat(session.error()).isEqualTo(ErrorType.ENGINE_ERROR);
        assertThat(session.awaitReleased()).isTrue();
    }

    @Test
    @DisplayName("should drain to a consumer and return the final text")
    void shouldDrainToConsumer() {
        List<String> seen = new ArrayList<>();
        TokenStream stream = engine.stream(greedy(), new RecordingStreamSession(handle));

        String result = stream.drainTo(seen::add);

        assertThat(result).isEqualTo(BigramFixtures.GREEDY_ANSWER);
        assertThat(seen).containsExactlyElementsOf(BigramFixtures.GREEDY_SNAPSHOTS);
        assertThat(stream.isFinished()).isTrue();
        assertThat(stream.lastSnapshot()).isEqualTo(result);
    }

    @Test
    @DisplayName("should keep working with a channel smaller than the answer")
    void shouldApplyBackpressure() {
        GenerationEngine narrow = new GenerationEngine(16, Duration.ofSeconds(5), 1);

        List<String> snapshots = collect(narrow.stream(greedy(), new RecordingStreamSession(handle)));

        assertThat(snapshots).containsExactlyElementsOf(BigramFixtures.GREEDY_SNAPSHOTS);
    }

    @Test
    @DisplayName("should have no elements when empty")
    void shouldBeEmpty() {
        TokenStream stream = TokenStream.empty();

        assertThat(stream.hasNext()).isFalse();
        assertThat(stream.drainTo(s -> { })).isEmpty();
        assertThatThrownBy(stream::next).isInstanceOf(NoSuchElementException.class);
    }
}
