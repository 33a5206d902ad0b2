package fr.lapetina.advisor.llm.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.advisor.llm.domain.event.LifecycleEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the most recent lifecycle events for the {@code /events} endpoint.
 * Oldest events are evicted once the capacity is reached.
 */
public final class JournalHandler implements EventHandler<LifecycleEvent> {

    private final int capacity;
    private final Deque<LifecycleEvent.Record> events;

    public JournalHandler(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Journal capacity must be > 0");
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<>(capacity);
    }

    @Override
    public void onEvent(LifecycleEvent event, long sequence, boolean endOfBatch) {
        if (event.getType() == null) {
            return;
        }
        LifecycleEvent.Record record = event.toRecord();
        synchronized (events) {
            if (events.size() == capacity) {
                events.removeFirst();
            }
            events.addLast(record);
        }
    }

    /**
     * Recorded events, oldest first.
     */
    public List<LifecycleEvent.Record> recent() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    /**
     * At most {@code limit} of the newest events, oldest first.
     */
    public List<LifecycleEvent.Record> recent(int limit) {
        List<LifecycleEvent.Record> all = recent();
        if (limit >= all.size()) {
            return all;
        }
        return new ArrayList<>(all.subList(all.size() - Math.max(limit, 0), all.size()));
    }

    public int getCapacity() {
        return capacity;
    }
}
