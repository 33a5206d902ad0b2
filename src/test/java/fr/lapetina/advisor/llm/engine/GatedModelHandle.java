package fr.lapetina.advisor.llm.engine;

import fr.lapetina.advisor.llm.domain.model.ModelId;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delegating handle whose generations wait for {@link #open()} before
 * producing their first token.
 */
public final class GatedModelHandle implements ModelHandle {

    private final ModelHandle delegate;
    private final CountDownLatch gate = new CountDownLatch(1);
    private final CountDownLatch entered = new CountDownLatch(1);
    private final AtomicInteger generations = new AtomicInteger();

    public GatedModelHandle(ModelHandle delegate) {
        this.delegate = delegate;
    }

    public void open() {
        gate.countDown();
    }

    /**
     * Waits until a generation is blocked at the gate.
     */
    public boolean awaitEntered(long timeout, TimeUnit unit) throws InterruptedException {
        return entered.await(timeout, unit);
    }

    public int generations() {
        return generations.get();
    }

    @Override
    public ModelId modelId() {
        return delegate.modelId();
    }

    @Override
    public ChatTemplate chatTemplate() {
        return delegate.chatTemplate();
    }

    @Override
    public int[] encode(String text) {
        return delegate.encode(text);
    }

    @Override
    public String decode(int[] tokens, int length) {
        return delegate.decode(tokens, length);
    }

    @Override
    public void generate(int[] promptTokens, SamplingParams params, TokenSink sink) {
        generations.incrementAndGet();
        entered.countDown();
        try {
            if (!gate.await(10, TimeUnit.SECONDS)) {
                throw new InferenceException("Gate was never opened");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InferenceException("Interrupted at the gate");
        }
        delegate.generate(promptTokens, params, sink);
    }

    @Override
    public long memoryFootprintBytes() {
        return delegate.memoryFootprintBytes();
    }

    @Override
    public void close() {
        delegate.close();
    }
}
