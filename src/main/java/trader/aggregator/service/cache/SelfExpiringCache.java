package trader.aggregator.service.cache;

import lombok.extern.slf4j.Slf4j;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.BiPredicate;

/**
 * Write-through map in which every write schedules its own removal after the TTL.
 */
@Slf4j
public class SelfExpiringCache<K, V> {

    private final String name;
    private final Duration ttl;
    private final Scheduler scheduler;
    private final Map<K, Slot<V>> entries = new ConcurrentHashMap<>();

    public SelfExpiringCache(String name, Duration ttl, Scheduler scheduler) {
        this.name = name;
        this.ttl = ttl;
        this.scheduler = scheduler;
    }

    public Optional<V> get(K key) {
        return Optional.ofNullable(entries.get(key)).map(Slot::value);
    }

    public void put(K key, V value) {
        Slot<V> slot = new Slot<>(value);
        entries.put(key, slot);
        scheduler.schedule(() -> expire(key, slot), ttl.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int removeIf(BiPredicate<K, V> predicate) {
        int before = entries.size();
        entries.entrySet().removeIf(entry -> predicate.test(entry.getKey(), entry.getValue().value()));
        return before - entries.size();
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private void expire(K key, Slot<V> slot) {
        if (entries.remove(key, slot)) {
            log.debug("{} cache entry {} expired", name, key);
        }
    }

    // identity holder, so an older timer never removes a newer write of an equal value
    private static final class Slot<V> {
        private final V value;

        private Slot(V value) {
            this.value = value;
        }

        private V value() {
            return value;
        }
    }
}
