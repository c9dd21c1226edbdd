package trader.aggregator.service.event;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Typed publish/subscribe channel. Listeners are called synchronously on the publishing thread,
 * each one isolated from the failures of the others. The same events are mirrored to a hot {@link Flux}.
 */
@Slf4j
public class EventChannel<T> {

    private final String name;
    private final List<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();
    private final Sinks.Many<T> sink = Sinks.many().multicast().directBestEffort();

    public EventChannel(String name) {
        this.name = name;
    }

    public ListenerRegistration subscribe(Consumer<? super T> listener) {
        listeners.add(listener);
        log.debug("Listener registered on {} channel ({} total)", name, listeners.size());
        return () -> listeners.remove(listener);
    }

    public void publish(T event) {
        Objects.requireNonNull(event, "event");
        for (Consumer<? super T> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("Listener on {} channel failed: {}", name, e.getMessage(), e);
            }
        }
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Dropped {} event for stream subscribers: {}", name, result);
        }
    }

    public Flux<T> asFlux() {
        return sink.asFlux();
    }

    public int listenerCount() {
        return listeners.size();
    }
}
