package trader.aggregator.service.routing;

import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import trader.aggregator.config.RoutingProperties;
import trader.aggregator.model.OptimizedRoute;
import trader.aggregator.model.PriceData;
import trader.aggregator.model.RouteComparison;
import trader.aggregator.model.Token;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class RouteOptimizer {

    static final String BEST_ROUTE = "Best route";
    static final String ACCEPTABLE = "Acceptable alternative";
    static final String SIGNIFICANTLY_WORSE = "Significantly worse output";
    static final String NOT_RECOMMENDED = "Not recommended - over 10% worse";
    static final String HIGH_RISK = "High risk - low confidence";
    static final String TOO_SLOW = "Too slow";

    private final LiquidityGraph graph;
    private final PathFinder pathFinder;
    private final ArbitrageRouteBuilder arbitrageRouteBuilder;
    private final RouteFactory routeFactory;
    private final RouteScorer scorer;
    private final PerformanceLearner learner;
    private final VolumeSplitter splitter;
    private final RouteCache routeCache;
    private final RoutingProperties properties;

    /**
     * Ranked candidate routes for the trade: one per direct quote, graph paths for distinct tokens
     * and triangular cycles when both sides are the same token. Empty when nothing routes.
     */
    @Observed(name = "route.optimization", contextualName = "find-optimal-routes")
    public List<OptimizedRoute> findOptimalRoutes(Token tokenIn, Token tokenOut, BigDecimal amountIn, List<PriceData> quotes) {
        if (amountIn == null || amountIn.signum() <= 0) {
            throw new IllegalArgumentException("amountIn must be positive");
        }
        Optional<List<OptimizedRoute>> cached = routeCache.get(tokenIn, tokenOut, amountIn);
        if (cached.isPresent()) {
            log.debug("Route cache hit for {} -> {} ({})", tokenIn.getSymbol(), tokenOut.getSymbol(), amountIn);
            return cached.get();
        }

        List<OptimizedRoute> candidates = new ArrayList<>();
        for (PriceData quote : quotes) {
            candidates.add(routeFactory.fromQuote(quote, amountIn));
        }
        if (tokenIn.sameAs(tokenOut)) {
            candidates.addAll(arbitrageRouteBuilder.findTriangularRoutes(graph, tokenIn, amountIn));
        } else {
            candidates.addAll(pathFinder.findRoutes(graph, tokenIn, tokenOut, amountIn));
        }

        List<OptimizedRoute> ranked = scorer.rank(learner.adjust(candidates), properties.getObjective());
        List<OptimizedRoute> result = ranked.size() > properties.getMaxRoutes()
                ? List.copyOf(ranked.subList(0, properties.getMaxRoutes()))
                : List.copyOf(ranked);

        log.info("Optimized {} -> {} ({}): {} candidates, {} returned",
                tokenIn.getSymbol(), tokenOut.getSymbol(), amountIn, candidates.size(), result.size());
        routeCache.put(tokenIn, tokenOut, amountIn, result);
        return result;
    }

    /**
     * Large orders are sliced and each slice routed on its own; the slice routes are concatenated in slice order.
     */
    public List<OptimizedRoute> findOptimalRouteForLargeVolume(Token tokenIn, Token tokenOut, BigDecimal amountIn,
                                                               List<PriceData> quotes) {
        if (!splitter.isLargeOrder(amountIn)) {
            return findOptimalRoutes(tokenIn, tokenOut, amountIn, quotes);
        }
        List<BigDecimal> slices = splitter.split(amountIn);
        log.info("Large order of {} split into {} slices", amountIn, slices.size());

        List<OptimizedRoute> routes = new ArrayList<>();
        for (BigDecimal slice : slices) {
            findOptimalRoutes(tokenIn, tokenOut, slice, quotes).stream()
                    .map(splitter::markSplit)
                    .forEach(routes::add);
        }
        return routes;
    }

    public List<RouteComparison> compareRoutes(List<OptimizedRoute> routes) {
        if (routes.isEmpty()) {
            return List.of();
        }
        List<OptimizedRoute> ranked = scorer.rank(routes, properties.getObjective());
        BigDecimal bestOutput = ranked.get(0).getEstimatedOutput();

        List<RouteComparison> comparisons = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            OptimizedRoute route = ranked.get(i);
            double difference = i == 0 || bestOutput.signum() == 0
                    ? 0
                    : bestOutput.subtract(route.getEstimatedOutput())
                        .divide(bestOutput, MathContext.DECIMAL64)
                        .doubleValue() * 100;
            comparisons.add(RouteComparison.builder()
                    .route(route)
                    .rank(i + 1)
                    .differenceFromBestPercent(difference)
                    .recommendation(i == 0 ? BEST_ROUTE : recommendationFor(route, difference))
                    .build());
        }
        return comparisons;
    }

    static String recommendationFor(OptimizedRoute route, double difference) {
        String recommendation = ACCEPTABLE;
        if (difference > 5) {
            recommendation = SIGNIFICANTLY_WORSE;
        }
        if (difference > 10) {
            recommendation = NOT_RECOMMENDED;
        }
        if (route.getConfidence() < 70) {
            recommendation = HIGH_RISK;
        }
        if (route.getEstimatedTimeSeconds() > 120) {
            recommendation = TOO_SLOW;
        }
        return recommendation;
    }

    public void recordOutcome(OptimizedRoute route, boolean success) {
        learner.recordOutcome(route, success);
    }

    public void recordOutcome(String signature, boolean success) {
        learner.recordOutcome(signature, success);
    }

    public void clearCache() {
        routeCache.clear();
    }

    public int cacheSize() {
        return routeCache.size();
    }
}
