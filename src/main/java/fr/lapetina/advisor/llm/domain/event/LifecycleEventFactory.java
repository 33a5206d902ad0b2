package fr.lapetina.advisor.llm.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for pre-allocating LifecycleEvent slots in the Disruptor ring buffer.
 */
public final class LifecycleEventFactory implements EventFactory<LifecycleEvent> {

    @Override
    public LifecycleEvent newInstance() {
        return new LifecycleEvent();
    }
}
