package trader.aggregator.service.routing;

import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import trader.aggregator.config.RoutingProperties;
import trader.aggregator.model.LiquidityPool;
import trader.aggregator.model.OptimizedRoute;
import trader.aggregator.model.RouteStep;
import trader.aggregator.model.RouteType;
import trader.aggregator.model.Token;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Breadth-first search for swap paths between two tokens, bounded by {@code maxHops} and {@code maxRoutes}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PathFinder {

    static final long GAS_PER_HOP = 50_000;

    private final AmmQuoteCalculator calculator;
    private final RouteFactory routeFactory;
    private final RoutingProperties properties;

    public List<OptimizedRoute> findRoutes(LiquidityGraph graph, Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        if (tokenIn.sameAs(tokenOut) || properties.getMaxHops() < 1) {
            return List.of();
        }

        Set<String> stablecoins = properties.getStablecoins().stream()
                .map(value -> value.toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<OptimizedRoute> routes = new ArrayList<>();
        Deque<PathNode> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();

        queue.add(new PathNode(tokenIn, List.of(), amountIn, 0, 0, 0, 0));
        visited.add(tokenIn.key());

        while (!queue.isEmpty() && routes.size() < properties.getMaxRoutes()) {
            PathNode current = queue.poll();
            if (current.getDepth() >= properties.getMaxHops()) {
                continue;
            }

            for (LiquidityPool pool : graph.poolsFor(current.getToken())) {
                if (routes.size() >= properties.getMaxRoutes()) {
                    break;
                }
                if (pool.getTvl().compareTo(properties.getMinLiquidityUsd()) < 0 || current.getPools().contains(pool)) {
                    continue;
                }

                Token next = pool.otherToken(current.getToken());
                List<LiquidityPool> path = append(current.getPools(), pool);

                if (next.sameAs(tokenOut)) {
                    log.debug("Path of {} hops reached {} (fee {}, impact {}%)", path.size(), tokenOut.getSymbol(),
                            current.getCumulativeFee() + pool.getFee(), current.getCumulativeImpact());
                    replay(tokenIn, amountIn, path, current.getCumulativeGas() + GAS_PER_HOP).ifPresent(routes::add);
                } else if (current.getDepth() + 1 < properties.getMaxHops()
                        && !visited.contains(next.key())
                        && (!properties.isStablecoinRouting() || isStablecoin(next, stablecoins))) {
                    extend(current, pool, next, path).ifPresent(node -> {
                        visited.add(next.key());
                        queue.add(node);
                    });
                }
            }
        }

        log.debug("Path search {} -> {} found {} routes", tokenIn.getSymbol(), tokenOut.getSymbol(), routes.size());
        return routes;
    }

    private Optional<PathNode> extend(PathNode current, LiquidityPool pool, Token next, List<LiquidityPool> path) {
        try {
            SwapQuote hop = calculator.quote(pool, current.getToken(), current.getAmount());
            if (hop.getAmountOut().signum() <= 0) {
                return Optional.empty();
            }
            return Optional.of(new PathNode(next, path, hop.getAmountOut(), current.getDepth() + 1,
                    current.getCumulativeGas() + GAS_PER_HOP,
                    current.getCumulativeFee() + pool.getFee(),
                    current.getCumulativeImpact() + hop.getPriceImpact()));
        } catch (IllegalArgumentException e) {
            log.debug("Skipping pool {}: {}", pool.getAddress(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Rebuilds the accepted path hop by hop from the original input amount.
     */
    private Optional<OptimizedRoute> replay(Token tokenIn, BigDecimal amountIn, List<LiquidityPool> path, long totalGas) {
        List<RouteStep> steps = new ArrayList<>(path.size());
        Token token = tokenIn;
        BigDecimal amount = amountIn;
        try {
            for (LiquidityPool pool : path) {
                SwapQuote hop = calculator.quote(pool, token, amount);
                if (hop.getAmountOut().signum() <= 0) {
                    return Optional.empty();
                }
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
            }
        } catch (IllegalArgumentException e) {
            log.debug("Discarding path through unusable pool: {}", e.getMessage());
            return Optional.empty();
        }

        RouteType type = steps.size() == 1 ? RouteType.DIRECT : RouteType.MULTI_HOP;
        return Optional.of(routeFactory.fromSteps(type, steps, totalGas));
    }

    static boolean isStablecoin(Token token, Set<String> stablecoins) {
        return (token.getSymbol() != null && stablecoins.contains(token.getSymbol().toUpperCase(Locale.ROOT)))
                || stablecoins.contains(token.getAddress().toUpperCase(Locale.ROOT));
    }

    private static List<LiquidityPool> append(List<LiquidityPool> pools, LiquidityPool pool) {
        List<LiquidityPool> path = new ArrayList<>(pools.size() + 1);
        path.addAll(pools);
        path.add(pool);
        return path;
    }

    /**
     * Partial path ending at {@code token}, with the amount of that token it would deliver.
     */
    @Value
    private static class PathNode {
        Token token;
        List<LiquidityPool> pools;
        BigDecimal amount;
        int depth;
        long cumulativeGas;
        double cumulativeFee;
        double cumulativeImpact;
    }
}
