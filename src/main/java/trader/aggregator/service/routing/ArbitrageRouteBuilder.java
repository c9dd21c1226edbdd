package trader.aggregator.service.routing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import trader.aggregator.config.RoutingProperties;
import trader.aggregator.model.LiquidityPool;
import trader.aggregator.model.OptimizedRoute;
import trader.aggregator.model.RouteStep;
import trader.aggregator.model.RouteType;
import trader.aggregator.model.Token;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Triangular cycles {@code base -> intermediate -> final -> base} that return more than they take.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArbitrageRouteBuilder {

    static final long TRIANGULAR_GAS = 300_000;
    static final double TRIANGULAR_CONFIDENCE = 70;
    private static final BigDecimal THREE = BigDecimal.valueOf(3);

    private final AmmQuoteCalculator calculator;
    private final RouteFactory routeFactory;
    private final RoutingProperties properties;

    public List<OptimizedRoute> findTriangularRoutes(LiquidityGraph graph, Token base, BigDecimal amountIn) {
        List<OptimizedRoute> routes = new ArrayList<>();

        for (LiquidityPool first : graph.poolsFor(base)) {
            Token intermediate = first.otherToken(base);
            for (LiquidityPool second : graph.poolsFor(intermediate)) {
                if (second.equals(first)) {
                    continue;
                }
                Token last = second.otherToken(intermediate);
                if (last.sameAs(base)) {
                    continue;
                }
                findReturnPool(graph, last, base, first, second)
                        .flatMap(third -> evaluate(base, amountIn, first, second, third))
                        .ifPresent(routes::add);
            }
        }

        routes.sort(Comparator.comparingDouble(OptimizedRoute::getProfitMargin).reversed());
        if (!routes.isEmpty()) {
            log.info("Found {} profitable triangular cycles for {}, best margin {}",
                    routes.size(), base.getSymbol(), routes.get(0).getProfitMargin());
        }
        return routes;
    }

    private Optional<LiquidityPool> findReturnPool(LiquidityGraph graph, Token from, Token base,
                                                   LiquidityPool first, LiquidityPool second) {
        return graph.poolsFor(from).stream()
                .filter(pool -> pool.touches(base) && !pool.equals(first) && !pool.equals(second))
                .findFirst();
    }

    private Optional<OptimizedRoute> evaluate(Token base, BigDecimal amountIn,
                                              LiquidityPool first, LiquidityPool second, LiquidityPool third) {
        List<RouteStep> steps = new ArrayList<>(3);
        Token token = base;
        BigDecimal amount = amountIn;
        try {
            for (LiquidityPool pool : List.of(first, second, third)) {
                SwapQuote hop = calculator.quote(pool, token, amount);
                Token out = pool.otherToken(token);
                steps.add(RouteStep.builder()
                        .dex(pool.getDex())
                        .tokenIn(token)
                        .tokenOut(out)
                        .amountIn(amount)
                        .amountOut(hop.getAmountOut())
                        .poolAddress(pool.getAddress())
                        .fee(pool.getFee())
                        .priceImpact(hop.getPriceImpact())
                        .build());
                token = out;
                amount = hop.getAmountOut();
                if (amount.signum() <= 0) {
                    return Optional.empty();
                }
            }
        } catch (IllegalArgumentException e) {
            log.debug("Skipping cycle through unusable pool: {}", e.getMessage());
            return Optional.empty();
        }

        double profitMargin = amount.subtract(amountIn).divide(amountIn, MathContext.DECIMAL64).doubleValue();
        if (profitMargin <= properties.getMinArbitrageProfit()) {
            return Optional.empty();
        }

        BigDecimal averageTvl = first.getTvl().add(second.getTvl()).add(third.getTvl())
                .divide(THREE, MathContext.DECIMAL64);

        return Optional.of(routeFactory.fromSteps(RouteType.ARBITRAGE, steps, TRIANGULAR_GAS).toBuilder()
                .confidence(TRIANGULAR_CONFIDENCE)
                .riskScore(riskFor(averageTvl))
                .profitMargin(profitMargin)
                .build());
    }

    double riskFor(BigDecimal averageTvl) {
        RoutingProperties.RiskTiers tiers = properties.getRiskTiers();
        if (averageTvl.compareTo(tiers.getLowRiskTvl()) > 0) {
            return tiers.getLowRisk();
        }
        if (averageTvl.compareTo(tiers.getMediumRiskTvl()) > 0) {
            return tiers.getMediumRisk();
        }
        return tiers.getHighRisk();
    }
}
