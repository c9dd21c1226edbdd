package trader.aggregator.service.routing;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;
import trader.aggregator.config.RoutingProperties;
import trader.aggregator.model.DexType;
import trader.aggregator.model.OptimizedRoute;
import trader.aggregator.model.RouteComparison;
import trader.aggregator.model.RouteType;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static trader.aggregator.Fixtures.USDC;
import static trader.aggregator.Fixtures.WETH;
import static trader.aggregator.Fixtures.quote;

class RouteOptimizerTest {

    private final RoutingProperties properties = new RoutingProperties();
    private final VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
    private final LiquidityGraph graph = new LiquidityGraph();
    private final PerformanceLearner learner = new PerformanceLearner(properties);
    private RouteOptimizer optimizer;

    @BeforeEach
    void setUp() {
        AmmQuoteCalculator calculator = new AmmQuoteCalculator();
        RouteScorer scorer = new RouteScorer(properties);
        RouteFactory factory = new RouteFactory(scorer);
        optimizer = new RouteOptimizer(graph,
                new PathFinder(calculator, factory, properties),
                new ArbitrageRouteBuilder(calculator, factory, properties),
                factory, scorer, learner,
                new VolumeSplitter(properties),
                new RouteCache(properties, scheduler),
                properties);
        graph.replaceAll(List.of(PathFinderTest.USDC_WETH, PathFinderTest.USDC_USDT, PathFinderTest.WETH_USDT));
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    @Nested
    @DisplayName("findOptimalRoutes")
    class FindOptimalRoutes {

        @Test
        @DisplayName("combines quote routes with graph paths and ranks them")
        void combinesSources() {
            List<OptimizedRoute> routes = optimizer.findOptimalRoutes(USDC, WETH, new BigDecimal("1000"),
                    List.of(quote(DexType.JUPITER, "0.334")));

            assertThat(routes).hasSize(3);
            assertThat(routes).extracting(OptimizedRoute::signature)
                    .containsExactlyInAnyOrder("JUPITER", "UNISWAP_V3", "CURVE-SUSHISWAP");
            assertThat(routes).filteredOn(route -> route.getSteps().size() == 2)
                    .extracting(OptimizedRoute::getType)
                    .containsExactly(RouteType.MULTI_HOP);
        }

        @Test
        @DisplayName("identical requests are served from the route cache until it expires")
        void cachesResults() {
            List<OptimizedRoute> first = optimizer.findOptimalRoutes(USDC, WETH, new BigDecimal("1000"), List.of());
            graph.replaceAll(List.of());

            assertThat(optimizer.findOptimalRoutes(USDC, WETH, new BigDecimal("1000.00"), List.of())).isEqualTo(first);
            assertThat(optimizer.cacheSize()).isEqualTo(1);

            scheduler.advanceTimeBy(Duration.ofMillis(properties.getRouteCacheTtl()));

            assertThat(optimizer.findOptimalRoutes(USDC, WETH, new BigDecimal("1000"), List.of())).isEmpty();
        }

        @Test
        void clearCacheForcesRecomputation() {
            optimizer.findOptimalRoutes(USDC, WETH, new BigDecimal("1000"), List.of());
            optimizer.clearCache();
            graph.replaceAll(List.of());

            assertThat(optimizer.findOptimalRoutes(USDC, WETH, new BigDecimal("1000"), List.of())).isEmpty();
        }

        @Test
        void resultIsLimitedToMaxRoutes() {
            properties.setMaxRoutes(2);

            assertThat(optimizer.findOptimalRoutes(USDC, WETH, new BigDecimal("1000"),
                    List.of(quote(DexType.JUPITER, "0.334"), quote(DexType.BALANCER, "0.333"))))
                    .hasSize(2);
        }

        @Test
        @DisplayName("same token in and out looks for triangular cycles instead of paths")
        void sameTokenUsesCycles() {
            assertThat(optimizer.findOptimalRoutes(USDC, USDC, new BigDecimal("1000"), List.of()))
                    .allMatch(route -> route.getType() == RouteType.ARBITRAGE);
        }

        @Test
        void learnedFailuresLowerConfidence() {
            learner.recordOutcome("UNISWAP_V3", false);
            learner.recordOutcome("UNISWAP_V3", true);

            OptimizedRoute direct = optimizer.findOptimalRoutes(USDC, WETH, new BigDecimal("1000"), List.of()).stream()
                    .filter(route -> route.signature().equals("UNISWAP_V3"))
                    .findFirst()
                    .orElseThrow();

            assertThat(direct.getConfidence()).isCloseTo(47.5, within(1e-9));
        }

        @Test
        void rejectsNonPositiveAmounts() {
            assertThatThrownBy(() -> optimizer.findOptimalRoutes(USDC, WETH, BigDecimal.ZERO, List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("large orders are routed per slice and marked as split")
    void largeVolumeSplits() {
        List<OptimizedRoute> routes = optimizer.findOptimalRouteForLargeVolume(USDC, WETH, new BigDecimal("120000"), List.of());

        assertThat(routes).hasSize(6).allMatch(OptimizedRoute::isSplit);
        assertThat(routes.get(0).getSteps().get(0).getAmountIn()).isEqualByComparingTo("40000");
    }

    @Test
    void smallOrdersAreNotSplit() {
        assertThat(optimizer.findOptimalRouteForLargeVolume(USDC, WETH, new BigDecimal("1000"), List.of()))
                .noneMatch(OptimizedRoute::isSplit);
    }

    @Nested
    @DisplayName("compareRoutes")
    class CompareRoutes {

        @Test
        void labelsEveryAlternative() {
            OptimizedRoute best = RouteScorerTest.route("best", "100", 50_000, 20, 95, 10);
            List<OptimizedRoute> routes = List.of(
                    RouteScorerTest.route("worse", "94", 200_000, 35, 85, 30),
                    RouteScorerTest.route("much-worse", "89", 200_000, 35, 85, 30),
                    RouteScorerTest.route("risky", "99", 200_000, 35, 60, 30),
                    RouteScorerTest.route("slow", "99", 200_000, 130, 85, 30),
                    RouteScorerTest.route("fine", "98", 200_000, 35, 85, 30),
                    best);

            Map<String, RouteComparison> byId = optimizer.compareRoutes(routes).stream()
                    .collect(Collectors.toMap(comparison -> comparison.getRoute().getId(), Function.identity()));

            assertThat(byId.get("best").getRank()).isEqualTo(1);
            assertThat(byId.get("best").getRecommendation()).isEqualTo("Best route");
            assertThat(byId.get("best").getDifferenceFromBestPercent()).isZero();
            assertThat(byId.get("worse").getRecommendation()).isEqualTo("Significantly worse output");
            assertThat(byId.get("worse").getDifferenceFromBestPercent()).isCloseTo(6.0, within(1e-9));
            assertThat(byId.get("much-worse").getRecommendation()).isEqualTo("Not recommended - over 10% worse");
            assertThat(byId.get("risky").getRecommendation()).isEqualTo("High risk - low confidence");
            assertThat(byId.get("slow").getRecommendation()).isEqualTo("Too slow");
            assertThat(byId.get("fine").getRecommendation()).isEqualTo("Acceptable alternative");
        }

        @Test
        void emptyInputGivesNoComparisons() {
            assertThat(optimizer.compareRoutes(List.of())).isEmpty();
        }
    }
}
