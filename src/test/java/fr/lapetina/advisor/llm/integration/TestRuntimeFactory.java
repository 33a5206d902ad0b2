package fr.lapetina.advisor.llm.integration;

import fr.lapetina.advisor.llm.RuntimeFactory;
import fr.lapetina.advisor.llm.domain.model.ModelId;
import fr.lapetina.advisor.llm.engine.bigram.BigramFixtures;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Test extension of RuntimeFactory rooted in a temporary directory, with the
 * tiny bigram model already in the weight cache.
 */
public final class TestRuntimeFactory extends RuntimeFactory {

    public static final ModelId TINY = ModelId.of("test/tiny-bigram");

    private TestRuntimeFactory(String configPath, Path baseDir) {
        super(configPath, baseDir, null);
    }

    /**
     * Creates and starts a factory from the default test configuration.
     */
    public static TestRuntimeFactory create(Path baseDir) {
        return create("test-config.yaml", baseDir);
    }

    public static TestRuntimeFactory create(String configPath, Path baseDir) {
        BigramFixtures.writeModel(baseDir.resolve("models"), TINY);
        TestRuntimeFactory factory = new TestRuntimeFactory(configPath, baseDir);
        factory.start();
        return factory;
    }

    /**
     * Polls until a model is ready or the timeout expires.
     */
    public boolean awaitReady(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!getManager().isReady()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }
}
