package trader.aggregator.service.aggregation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;
import trader.aggregator.config.AggregatorProperties;
import trader.aggregator.model.AggregatedPrice;
import trader.aggregator.service.cache.SelfExpiringCache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Aggregates keyed by pair. Served while younger than {@code maxStaleTime}, removed {@code cacheTtl} after each write.
 */
@Slf4j
@Component
public class PriceCache {

    private final SelfExpiringCache<String, AggregatedPrice> entries;
    private final AggregatorProperties properties;
    private final Clock clock;

    public PriceCache(AggregatorProperties properties, Clock clock, @Qualifier("engineScheduler") Scheduler engineScheduler) {
        this.properties = properties;
        this.clock = clock;
        this.entries = new SelfExpiringCache<>("price", Duration.ofMillis(properties.getCacheTtl()), engineScheduler);
    }

    public Optional<AggregatedPrice> getFresh(String pairKey) {
        return entries.get(pairKey).filter(price -> !isStale(price.getLastUpdated()));
    }

    /**
     * Any cached aggregate regardless of age, used to patch in push-feed updates.
     */
    public Optional<AggregatedPrice> getAny(String pairKey) {
        return entries.get(pairKey);
    }

    public void put(AggregatedPrice price) {
        entries.put(price.getPairKey(), price);
    }

    public boolean isStale(Instant lastUpdated) {
        return clock.millis() - lastUpdated.toEpochMilli() >= properties.getMaxStaleTime();
    }

    public int cleanup() {
        long now = clock.millis();
        int removed = entries.removeIf((key, price) -> now - price.getLastUpdated().toEpochMilli() > properties.getCacheTtl());
        if (removed > 0) {
            log.debug("Removed {} expired price cache entries", removed);
        }
        return removed;
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
