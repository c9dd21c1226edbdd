package trader.aggregator.service;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import trader.aggregator.config.AggregatorProperties;
import trader.aggregator.exception.NoValidPricesException;
import trader.aggregator.model.AggregatedPrice;
import trader.aggregator.model.ArbitrageOpportunity;
import trader.aggregator.model.EngineStats;
import trader.aggregator.model.OptimizedRoute;
import trader.aggregator.model.PriceData;
import trader.aggregator.model.RevenueStats;
import trader.aggregator.model.RouteComparison;
import trader.aggregator.model.ServiceFee;
import trader.aggregator.model.SourceErrorEvent;
import trader.aggregator.model.Token;
import trader.aggregator.service.aggregation.PriceAggregator;
import trader.aggregator.service.aggregation.PriceCache;
import trader.aggregator.service.event.EngineEvents;
import trader.aggregator.service.event.ListenerRegistration;
import trader.aggregator.service.feed.FeedManager;
import trader.aggregator.service.routing.RouteOptimizer;
import trader.aggregator.service.routing.ServiceFeeCalculator;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Consumer;

/**
 * Entry point of the engine: price aggregation, route optimization, push feeds and event streams.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DexAggregationEngine {

    private final PriceAggregator priceAggregator;
    private final PriceCache priceCache;
    private final RouteOptimizer routeOptimizer;
    private final ServiceFeeCalculator serviceFeeCalculator;
    private final FeedManager feedManager;
    private final EngineEvents events;
    private final AggregatorProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        feedManager.start();
    }

    public Mono<AggregatedPrice> getAggregatedPrice(Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        return priceAggregator.getAggregatedPrice(tokenIn, tokenOut, amountIn)
                .doOnNext(this::followOnFeeds);
    }

    private void followOnFeeds(AggregatedPrice price) {
        if (!properties.isWebsocketEnabled()) {
            return;
        }
        price.getAllPrices().stream()
                .map(PriceData::getDex)
                .distinct()
                .forEach(dex -> feedManager.subscribe(dex, price.getPairKey()));
    }

    public Mono<List<OptimizedRoute>> findOptimalRoutes(Token tokenIn, Token tokenOut, BigDecimal amountIn,
                                                        List<PriceData> quotes) {
        return Mono.fromCallable(() -> routeOptimizer.findOptimalRoutes(tokenIn, tokenOut, amountIn, quotes));
    }

    /**
     * Aggregates quotes first and routes over the valid ones. A pair no source can price is still routed through the graph.
     */
    public Mono<List<OptimizedRoute>> findOptimalRoutes(Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        return quotesFor(tokenIn, tokenOut, amountIn)
                .flatMap(quotes -> findOptimalRoutes(tokenIn, tokenOut, amountIn, quotes));
    }

    public Mono<List<OptimizedRoute>> findOptimalRouteForLargeVolume(Token tokenIn, Token tokenOut, BigDecimal amountIn,
                                                                     List<PriceData> quotes) {
        return Mono.fromCallable(() -> routeOptimizer.findOptimalRouteForLargeVolume(tokenIn, tokenOut, amountIn, quotes));
    }

    public Mono<List<OptimizedRoute>> findOptimalRouteForLargeVolume(Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        return quotesFor(tokenIn, tokenOut, amountIn)
                .flatMap(quotes -> findOptimalRouteForLargeVolume(tokenIn, tokenOut, amountIn, quotes));
    }

    private Mono<List<PriceData>> quotesFor(Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        if (tokenIn.sameAs(tokenOut)) {
            return Mono.just(List.of());
        }
        return getAggregatedPrice(tokenIn, tokenOut, amountIn)
                .map(AggregatedPrice::getValidPrices)
                .onErrorResume(NoValidPricesException.class, e -> {
                    log.info("No quotes for {}, routing through liquidity graph only", e.getPairKey());
                    return Mono.just(List.of());
                });
    }

    public List<RouteComparison> compareRoutes(List<OptimizedRoute> routes) {
        return routeOptimizer.compareRoutes(routes);
    }

    public void recordRouteOutcome(OptimizedRoute route, boolean success) {
        routeOptimizer.recordOutcome(route, success);
    }

    public void recordRouteOutcome(String signature, boolean success) {
        routeOptimizer.recordOutcome(signature, success);
    }

    public ServiceFee calculateServiceFee(BigDecimal amountIn, String userAddress) {
        return serviceFeeCalculator.calculate(amountIn, userAddress);
    }

    public RevenueStats getRevenueStats() {
        return serviceFeeCalculator.revenueStats();
    }

    public ListenerRegistration onPriceUpdate(Consumer<? super AggregatedPrice> listener) {
        return events.onPriceUpdate(listener);
    }

    public ListenerRegistration onArbitrageOpportunity(Consumer<? super ArbitrageOpportunity> listener) {
        return events.onArbitrageOpportunity(listener);
    }

    public ListenerRegistration onError(Consumer<? super SourceErrorEvent> listener) {
        return events.onError(listener);
    }

    public Flux<AggregatedPrice> priceUpdates() {
        return events.priceUpdates().asFlux();
    }

    public Flux<ArbitrageOpportunity> arbitrageOpportunities() {
        return events.arbitrageOpportunities().asFlux();
    }

    public Flux<SourceErrorEvent> errors() {
        return events.errors().asFlux();
    }

    public EngineStats getStats() {
        return EngineStats.builder()
                .totalRequests(priceAggregator.getTotalRequests())
                .successfulRequests(priceAggregator.getSuccessfulRequests())
                .failedRequests(priceAggregator.getFailedRequests())
                .cacheHits(priceAggregator.getCacheHits())
                .feedUpdates(feedManager.getAppliedUpdates())
                .arbitrageOpportunities(priceAggregator.getArbitrageOpportunities())
                .averageResponseTimeMillis(priceAggregator.getAverageResponseTimeMillis())
                .cacheSize(priceCache.size())
                .activeFeeds(feedManager.activeConnectionCount())
                .build();
    }

    public void clearCache() {
        priceCache.clear();
        routeOptimizer.clearCache();
        log.info("Price and route caches cleared");
    }

    @Scheduled(fixedRateString = "${aggregator.update-interval:5000}")
    public void maintain() {
        int evicted = priceCache.cleanup();
        if (evicted > 0) {
            log.debug("Evicted {} expired price entries", evicted);
        }
        feedManager.heartbeat();
    }

    @PreDestroy
    public void disconnect() {
        feedManager.disconnectAll();
        log.info("Engine disconnected");
    }
}
