package trader.aggregator.service.aggregation;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import trader.aggregator.config.AggregatorProperties;
import trader.aggregator.config.metrics.TimerUtils;
import trader.aggregator.model.AggregatedPrice;
import trader.aggregator.model.PriceData;
import trader.aggregator.model.PriceSource;
import trader.aggregator.model.Token;
import trader.aggregator.service.event.EngineEvents;
import trader.aggregator.service.source.SourceRegistry;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fetch, filter and aggregate pipeline for one pair. Sources are queried concurrently and awaited together,
 * so nothing is published before every admitted source has settled.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceAggregator {

    static final String AGGREGATION_TIMER = "price.aggregation.time";

    private final SourceRegistry sourceRegistry;
    private final QuoteFetcher quoteFetcher;
    private final OutlierFilter outlierFilter;
    private final AggregatedPriceAssembler assembler;
    private final PriceCache priceCache;
    private final EngineEvents events;
    private final AggregatorProperties properties;
    private final MeterRegistry meterRegistry;
    private final Counter priceCacheHitsCounter;
    private final Counter arbitrageOpportunityCounter;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong arbitrageOpportunities = new AtomicLong();

    public Mono<AggregatedPrice> getAggregatedPrice(Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        return Mono.defer(() -> {
            String pairKey = AggregatedPrice.pairKey(tokenIn, tokenOut);
            totalRequests.incrementAndGet();

            if (properties.isCacheEnabled()) {
                Optional<AggregatedPrice> cached = priceCache.getFresh(pairKey);
                if (cached.isPresent()) {
                    cacheHits.incrementAndGet();
                    priceCacheHitsCounter.increment();
                    log.debug("Serving {} from price cache", pairKey);
                    return Mono.just(cached.get());
                }
            }

            List<PriceSource> sources = sourceRegistry.eligibleSources(properties.getEnabledSources(), tokenIn.getChainId());
            log.info("Aggregating {} {} -> {} across {} sources",
                    amountIn, tokenIn.getSymbol(), tokenOut.getSymbol(), sources.size());

            return TimerUtils.timedMono(() -> Flux.fromIterable(sources)
                                    .flatMap(source -> quoteFetcher.fetch(source, tokenIn, tokenOut, amountIn),
                                            Math.max(1, properties.getMaxConcurrentRequests()))
                                    .collectList()
                                    .map(quotes -> aggregate(pairKey, quotes)),
                            meterRegistry, AGGREGATION_TIMER)
                    .doOnNext(this::publish)
                    .doOnError(error -> {
                        failedRequests.incrementAndGet();
                        log.error("Aggregation failed for {}: {}", pairKey, error.getMessage());
                    });
        });
    }

    AggregatedPrice aggregate(String pairKey, List<PriceData> quotes) {
        List<PriceData> valid = properties.isOutlierDetection() ? outlierFilter.filter(quotes) : quotes;
        return assembler.assemble(pairKey, quotes, valid);
    }

    private void publish(AggregatedPrice price) {
        successfulRequests.incrementAndGet();
        if (properties.isCacheEnabled()) {
            priceCache.put(price);
        }
        log.info("Best price for {}: {} from {} ({} valid of {} quotes)",
                price.getPairKey(), price.getBestPrice().getPrice(), price.getBestPrice().getSource(),
                price.getValidPrices().size(), price.getAllPrices().size());

        events.publishPriceUpdate(price);
        price.getArbitrageOpportunities().forEach(opportunity -> {
            arbitrageOpportunities.incrementAndGet();
            arbitrageOpportunityCounter.increment();
            events.publishArbitrage(opportunity);
        });
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getSuccessfulRequests() {
        return successfulRequests.get();
    }

    public long getFailedRequests() {
        return failedRequests.get();
    }

    public long getCacheHits() {
        return cacheHits.get();
    }

    public long getArbitrageOpportunities() {
        return arbitrageOpportunities.get();
    }

    public double getAverageResponseTimeMillis() {
        return TimerUtils.meanMillis(meterRegistry, AGGREGATION_TIMER);
    }
}
