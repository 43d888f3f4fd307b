package tech.charforge.generationworker.event;

import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous, typed publish/subscribe for {@link WorkerEvent}s.
 *
 * <p>Listeners run on the publishing thread. A listener that throws is logged
 * and skipped; the publisher and the remaining listeners are unaffected.
 */
public class WorkerEventBus {

    private static final Logger LOG = Logger.getLogger(WorkerEventBus.class);

    private final List<Listener<?>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Handle to an active subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void cancel();
    }

    private record Listener<E extends WorkerEvent>(Class<E> type, Consumer<? super E> consumer) {

        void deliver(WorkerEvent event) {
            if (type.isInstance(event)) {
                consumer.accept(type.cast(event));
            }
        }
    }

    /**
     * Subscribe to one event type. Use {@code WorkerEvent.class} to receive everything.
     */
    public <E extends WorkerEvent> Subscription subscribe(Class<E> type, Consumer<? super E> consumer) {
        Listener<E> listener = new Listener<>(type, consumer);
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(WorkerEvent event) {
        for (Listener<?> listener : listeners) {
            try {
                listener.deliver(event);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Listener for %s failed on %s", listener.type().getSimpleName(),
                    event.getClass().getSimpleName());
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }
}
