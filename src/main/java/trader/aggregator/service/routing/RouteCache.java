package trader.aggregator.service.routing;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;
import trader.aggregator.config.RoutingProperties;
import trader.aggregator.model.OptimizedRoute;
import trader.aggregator.model.Token;
import trader.aggregator.service.cache.SelfExpiringCache;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Short-lived memo of ranked routes per {@code (chain, tokenIn, tokenOut, amount)}.
 */
@Component
public class RouteCache {

    private final SelfExpiringCache<String, List<OptimizedRoute>> entries;

    public RouteCache(RoutingProperties properties, @Qualifier("engineScheduler") Scheduler engineScheduler) {
        this.entries = new SelfExpiringCache<>("route", Duration.ofMillis(properties.getRouteCacheTtl()), engineScheduler);
    }

    public Optional<List<OptimizedRoute>> get(Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        return entries.get(key(tokenIn, tokenOut, amountIn));
    }

    public void put(Token tokenIn, Token tokenOut, BigDecimal amountIn, List<OptimizedRoute> routes) {
        entries.put(key(tokenIn, tokenOut, amountIn), List.copyOf(routes));
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    static String key(Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        return tokenIn.getChainId() + "-"
                + tokenIn.getAddress().toLowerCase(Locale.ROOT) + "-"
                + tokenOut.getAddress().toLowerCase(Locale.ROOT) + "-"
                + amountIn.stripTrailingZeros().toPlainString();
    }
}
