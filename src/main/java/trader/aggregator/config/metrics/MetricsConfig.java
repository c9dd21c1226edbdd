package trader.aggregator.config.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import trader.aggregator.service.feed.FeedManager;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter arbitrageOpportunityCounter(MeterRegistry registry) {
        return Counter.builder("arbitrage.opportunities.detected")
                .description("Number of arbitrage opportunities detected")
                .register(registry);
    }

    @Bean
    public Counter apiCallsCounter(MeterRegistry registry) {
        return Counter.builder("api.calls.total")
                .description("Number of price source API calls made")
                .register(registry);
    }

    @Bean
    public Counter priceCacheHitsCounter(MeterRegistry registry) {
        return Counter.builder("price.cache.hits")
                .description("Aggregated prices served from cache")
                .register(registry);
    }

    @Bean
    public Counter sourceFailuresCounter(MeterRegistry registry) {
        return Counter.builder("price.source.failures")
                .description("Price source fetches that produced no usable quote")
                .register(registry);
    }

    @Bean
    public Counter feedUpdatesCounter(MeterRegistry registry) {
        return Counter.builder("feed.updates.applied")
                .description("Push feed price updates applied to cached aggregates")
                .register(registry);
    }

    @Bean
    public Gauge activeFeedsGauge(MeterRegistry registry, FeedManager feedManager) {
        return Gauge.builder("feed.connections.active", feedManager::activeConnectionCount)
                .description("Currently open push feed connections")
                .register(registry);
    }
}
